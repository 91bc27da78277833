package org.redlist.maps.compute;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.redlist.maps.geo.Extent;

/**
 * A north-up grid of pixels in a projected coordinate system: the size and affine transform requested from the compute
 * service.
 * <p>
 * Two requests sharing a grid return pixel-aligned rasters.
 *
 * @param crsCode    coordinate system code, for example {@code EPSG:32648}
 * @param width      number of columns
 * @param height     number of rows
 * @param scale      pixel size in meters
 * @param translateX x coordinate of the left edge
 * @param translateY y coordinate of the top edge
 */
public record PixelGrid(String crsCode, int width, int height, double scale, double translateX, double translateY) {

  public PixelGrid {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("Grid must have at least 1 pixel, got " + width + "x" + height);
    }
    if (!(scale > 0)) {
      throw new IllegalArgumentException("Pixel size must be positive, got " + scale);
    }
  }

  /** Returns the grid covering {@code extent} with pixels of {@code scale} meters, rounding the size up. */
  public static PixelGrid covering(Extent extent, String crsCode, double scale) {
    return new PixelGrid(
      crsCode,
      (int) Math.ceil(extent.width() / scale),
      (int) Math.ceil(extent.height() / scale),
      scale,
      extent.minX(),
      extent.maxY()
    );
  }

  /**
   * Returns the pixel size that fits the longest side of {@code extent} into {@code dpi * multiplier} pixels.
   */
  public static double scaleFor(Extent extent, int dpi, int multiplier) {
    return Math.max(extent.width(), extent.height()) / (dpi * (double) multiplier);
  }

  public double left() {
    return translateX;
  }

  public double right() {
    return translateX + width * scale;
  }

  public double top() {
    return translateY;
  }

  public double bottom() {
    return translateY - height * scale;
  }

  /** Returns this grid in the REST {@code PixelGrid} format. */
  public ObjectNode toJson() {
    ObjectNode grid = Expression.MAPPER.createObjectNode();
    ObjectNode dimensions = grid.putObject("dimensions");
    dimensions.put("width", width);
    dimensions.put("height", height);
    ObjectNode affine = grid.putObject("affineTransform");
    affine.put("scaleX", scale);
    affine.put("shearX", 0d);
    affine.put("translateX", translateX);
    affine.put("shearY", 0d);
    affine.put("scaleY", -scale);
    affine.put("translateY", translateY);
    grid.put("crsCode", crsCode);
    return grid;
  }
}
