package org.redlist.maps.reader;

/**
 * Thrown when a well-formed region code has no boundary in the {@link BoundaryStore}.
 */
public class RegionNotFoundException extends RuntimeException {

  private final String code;

  public RegionNotFoundException(String code, Throwable cause) {
    super("Country code '" + code + "' not found in database. Lookup is case-insensitive and expects an " +
      "ISO 3166-1 alpha-2 code (2 letters, e.g. 'SG' for Singapore).", cause);
    this.code = code;
  }

  /** Returns the upper-case code that was not found. */
  public String code() {
    return code;
  }
}
