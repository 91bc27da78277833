package org.redlist.maps.raster;

/**
 * A georeferenced raster with a validity mask, ready to draw.
 * <p>
 * Pixels where {@link #isVisible(int, int)} is false are never drawn.
 */
public class RasterLayer {

  private final double[][][] values;
  private final boolean[][] mask;
  private final RasterBounds bounds;
  private final int width;
  private final int height;
  private final int bands;

  /**
   * @param values samples indexed {@code [row][column][band]}, row 0 at the top
   * @param mask   visibility indexed {@code [row][column]}, same size as {@code values}
   * @param bounds edges of the raster in projected meters
   * @throws IllegalArgumentException if {@code mask} and {@code values} differ in size
   */
  public RasterLayer(double[][][] values, boolean[][] mask, RasterBounds bounds) {
    this.height = values.length;
    this.width = height == 0 ? 0 : values[0].length;
    this.bands = width == 0 ? 0 : values[0][0].length;
    if (height == 0 || width == 0 || bands == 0) {
      throw new IllegalArgumentException("Raster must have at least one pixel and band");
    }
    if (mask.length != height || mask[0].length != width) {
      throw new IllegalArgumentException("Mask is %dx%d but values are %dx%d".formatted(
        mask.length == 0 ? 0 : mask[0].length, mask.length, width, height));
    }
    this.values = values;
    this.mask = mask;
    this.bounds = bounds;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int bands() {
    return bands;
  }

  public RasterBounds bounds() {
    return bounds;
  }

  public boolean isVisible(int row, int col) {
    return mask[row][col];
  }

  public double value(int row, int col, int band) {
    return values[row][col][band];
  }

  /** Returns the number of visible pixels. */
  public long visibleCount() {
    long count = 0;
    for (boolean[] row : mask) {
      for (boolean visible : row) {
        if (visible) {
          count++;
        }
      }
    }
    return count;
  }

  /** Returns {@code [min, max]} of {@code band} over visible pixels, or {@code [NaN, NaN]} if none are visible. */
  public double[] range(int band) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (int row = 0; row < height; row++) {
      for (int col = 0; col < width; col++) {
        double value = values[row][col][band];
        if (mask[row][col] && Double.isFinite(value)) {
          min = Math.min(min, value);
          max = Math.max(max, value);
        }
      }
    }
    return min > max ? new double[]{Double.NaN, Double.NaN} : new double[]{min, max};
  }

  /** Returns true if every visible value of the first band is 0 or 1. */
  public boolean isBinary() {
    boolean any = false;
    for (int row = 0; row < height; row++) {
      for (int col = 0; col < width; col++) {
        if (mask[row][col]) {
          double value = values[row][col][0];
          if (value != 0 && value != 1) {
            return false;
          }
          any = true;
        }
      }
    }
    return any;
  }

  /**
   * Combines a value raster and a mask raster of the same grid: a pixel is visible where every mask band is greater
   * than zero.
   *
   * @throws IllegalArgumentException if the two rasters differ in size
   */
  public static RasterLayer composite(DecodedRaster values, DecodedRaster mask, RasterBounds bounds) {
    if (values.width() != mask.width() || values.height() != mask.height()) {
      throw new IllegalArgumentException("Mask is %dx%d but values are %dx%d".formatted(
        mask.width(), mask.height(), values.width(), values.height()));
    }
    boolean[][] visible = new boolean[values.height()][values.width()];
    double[][][] maskValues = mask.values();
    for (int row = 0; row < visible.length; row++) {
      for (int col = 0; col < visible[row].length; col++) {
        boolean pixelVisible = true;
        for (double m : maskValues[row][col]) {
          pixelVisible &= m > 0;
        }
        visible[row][col] = pixelVisible;
      }
    }
    return new RasterLayer(values.values(), visible, bounds);
  }
}
