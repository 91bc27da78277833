package org.redlist.maps.raster;

import java.util.Optional;

/**
 * Pixel values read from a GeoTIFF.
 *
 * @param values pixel samples indexed {@code [row][column][band]}
 * @param bounds georeferenced edges when the file carries scale and tiepoint tags
 */
public record DecodedRaster(double[][][] values, Optional<RasterBounds> bounds) {

  public int height() {
    return values.length;
  }

  public int width() {
    return values.length == 0 ? 0 : values[0].length;
  }

  public int bands() {
    return values.length == 0 || values[0].length == 0 ? 0 : values[0][0].length;
  }
}
