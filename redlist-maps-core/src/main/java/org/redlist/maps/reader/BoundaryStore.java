package org.redlist.maps.reader;

import java.io.Closeable;
import java.util.Set;

/**
 * A source of country and region boundaries keyed by lower-case ISO 3166-1 alpha-2 code.
 */
public interface BoundaryStore extends Closeable {

  /**
   * Returns the WKB encoded lon/lat boundary of {@code lowerCaseCode}.
   *
   * @throws NotFoundException if the store has no boundary for the code
   */
  byte[] wkb(String lowerCaseCode) throws NotFoundException;

  /** Returns every lower-case code this store has a boundary for. */
  Set<String> codes();

  @Override
  default void close() {}

  /** Thrown when a store has no boundary for a requested code. */
  class NotFoundException extends Exception {
    public NotFoundException(String code) {
      super("No result found for: " + code);
    }
  }
}
