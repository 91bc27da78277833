package org.redlist.maps.raster;

/**
 * Edges of a north-up raster in projected meters.
 */
public record RasterBounds(double left, double right, double bottom, double top) {

  public RasterBounds {
    if (!(right > left) || !(top > bottom)) {
      throw new IllegalArgumentException(
        "Raster bounds must have positive size, got left=%s right=%s bottom=%s top=%s".formatted(left, right, bottom,
          top));
    }
  }

  public double width() {
    return right - left;
  }

  public double height() {
    return top - bottom;
  }
}
