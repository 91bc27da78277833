package org.redlist.maps.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by unexpected input geometry, for example a boundary that cannot be reprojected or parsed.
 */
public class GeometryException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryException.class);

  private final String stat;

  /**
   * Constructs a new exception with a detailed error message caused by {@code cause}.
   *
   * @param stat    string that uniquely identifies this error condition
   * @param message description of the error to log that should be detailed enough that you can find the offending
   *                geometry from it
   * @param cause   the original exception that was thrown
   */
  public GeometryException(String stat, String message, Throwable cause) {
    super(message, cause);
    this.stat = stat;
  }

  public GeometryException(String stat, String message) {
    super(message);
    this.stat = stat;
  }

  /** Returns the unique code for this error condition. */
  public String stat() {
    return stat;
  }

  /** Prints the error with a prefix describing where it happened. */
  public void log(String logContext) {
    LOGGER.warn("{}: {}", logContext, getMessage());
  }
}
