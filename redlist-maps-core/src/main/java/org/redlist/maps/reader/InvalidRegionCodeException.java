package org.redlist.maps.reader;

/**
 * Thrown when a region code is text but not a 2-letter ISO 3166-1 alpha-2 code.
 */
public class InvalidRegionCodeException extends IllegalArgumentException {

  private final String input;

  public InvalidRegionCodeException(String input, String message) {
    super(message);
    this.input = input;
  }

  public static InvalidRegionCodeException empty(String input) {
    return new InvalidRegionCodeException(input, "Region code cannot be empty");
  }

  public static InvalidRegionCodeException badPattern(String input) {
    return new InvalidRegionCodeException(input,
      "Invalid region code '" + input + "': must be a 2-letter ISO 3166-1 alpha-2 code (e.g. 'SG', 'FR', 'BR')");
  }

  /** Returns the rejected input. */
  public String input() {
    return input;
  }
}
