package org.redlist.maps.raster;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;

/**
 * Decodes an in-memory GeoTIFF into {@code [row][column][band]} samples with tiff-java.
 * <p>
 * Only north-up rasters georeferenced with {@code ModelPixelScale} and {@code ModelTiepoint} tags are understood;
 * anything else decodes with empty bounds and the caller falls back to the grid it requested.
 */
public class GeoTiffDecoder {

  private GeoTiffDecoder() {}

  /**
   * Decodes the first image of {@code bytes}.
   *
   * @throws IOException if the bytes are not a readable TIFF
   */
  public static DecodedRaster decode(byte[] bytes) throws IOException {
    Rasters rasters;
    FileDirectory directory;
    try {
      TIFFImage tiff = TiffReader.readTiff(bytes);
      directory = tiff.getFileDirectory();
      rasters = directory.readRasters();
    } catch (RuntimeException e) {
      throw new IOException("Unable to decode " + bytes.length + " byte GeoTIFF: " + e.getMessage(), e);
    }
    int width = rasters.getWidth();
    int height = rasters.getHeight();
    int bands = rasters.getSamplesPerPixel();
    double[][][] values = new double[height][width][bands];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        for (int b = 0; b < bands; b++) {
          values[y][x][b] = rasters.getPixelSample(b, x, y).doubleValue();
        }
      }
    }
    return new DecodedRaster(values, bounds(directory, width, height));
  }

  private static Optional<RasterBounds> bounds(FileDirectory directory, int width, int height) {
    double[] scale = null;
    double[] tiepoint = null;
    for (FileDirectoryEntry entry : directory.getEntries()) {
      if (entry.getFieldTag() == FieldTagType.ModelPixelScale) {
        scale = doubles(entry.getValues());
      } else if (entry.getFieldTag() == FieldTagType.ModelTiepoint) {
        tiepoint = doubles(entry.getValues());
      }
    }
    if (scale == null || scale.length < 2 || tiepoint == null || tiepoint.length < 6) {
      return Optional.empty();
    }
    double sx = scale[0];
    double sy = scale[1];
    // tiepoint is [i, j, k, x, y, z]: raster point (i, j) sits at model point (x, y)
    double left = tiepoint[3] - tiepoint[0] * sx;
    double top = tiepoint[4] + tiepoint[1] * sy;
    if (!(sx > 0) || !(sy > 0)) {
      return Optional.empty();
    }
    return Optional.of(new RasterBounds(left, left + width * sx, top - height * sy, top));
  }

  private static double[] doubles(Object values) {
    if (values instanceof List<?> list) {
      double[] result = new double[list.size()];
      for (int i = 0; i < result.length; i++) {
        result[i] = ((Number) list.get(i)).doubleValue();
      }
      return result;
    } else if (values instanceof Number number) {
      return new double[]{number.doubleValue()};
    }
    return null;
  }
}
