package org.redlist.maps.geo;

import org.locationtech.jts.geom.Envelope;

/**
 * A rectangular map frame in projected meters.
 */
public record Extent(double minX, double maxX, double minY, double maxY) {

  /** Fraction of each axis range added as margin on both sides of a region's bounds. */
  public static final double PADDING_FRACTION = 0.15;

  public Extent {
    if (!(maxX >= minX) || !(maxY >= minY)) {
      throw new IllegalArgumentException("Extent must have maxX >= minX and maxY >= minY, was [" + minX + ", " +
        maxX + ", " + minY + ", " + maxY + "]");
    }
  }

  /**
   * Returns {@code bounds} expanded by {@link #PADDING_FRACTION} of its width on the left and right, and of its height
   * on the top and bottom.
   */
  public static Extent padded(Envelope bounds) {
    return padded(bounds, PADDING_FRACTION);
  }

  public static Extent padded(Envelope bounds, double fraction) {
    double paddingX = bounds.getWidth() * fraction;
    double paddingY = bounds.getHeight() * fraction;
    return new Extent(
      bounds.getMinX() - paddingX,
      bounds.getMaxX() + paddingX,
      bounds.getMinY() - paddingY,
      bounds.getMaxY() + paddingY
    );
  }

  public double width() {
    return maxX - minX;
  }

  public double height() {
    return maxY - minY;
  }

  public Envelope toEnvelope() {
    return new Envelope(minX, maxX, minY, maxY);
  }
}
