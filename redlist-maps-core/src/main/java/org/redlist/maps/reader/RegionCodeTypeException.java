package org.redlist.maps.reader;

/**
 * Thrown when a region code is not text at all.
 */
public class RegionCodeTypeException extends IllegalArgumentException {

  private final String receivedType;

  public RegionCodeTypeException(Object received) {
    super("Region code must be a string, got " + typeName(received));
    this.receivedType = typeName(received);
  }

  private static String typeName(Object received) {
    return received == null ? "null" : received.getClass().getSimpleName();
  }

  /** Returns the simple class name of the rejected value, or {@code "null"}. */
  public String receivedType() {
    return receivedType;
  }
}
