package org.redlist.maps.render;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.List;
import org.redlist.maps.compute.Visualization;
import org.redlist.maps.raster.FetchMode;
import org.redlist.maps.raster.RasterLayer;

/**
 * Turns a {@link RasterLayer} into an ARGB image, leaving masked pixels fully transparent.
 * <ul>
 * <li>3 or more bands are drawn as RGB, stretched from the visualization's min/max when set</li>
 * <li>single band rasters whose visible values are all 0 or 1 get two discrete colors unless a visualization is
 * set</li>
 * <li>other single band rasters are stretched linearly across the palette, a gray ramp from the data minimum to
 * maximum by default</li>
 * </ul>
 */
public class Colormap {

  static final Color ABSENT = new Color(0xd3d3d3);
  static final Color PRESENT = new Color(0x006400);
  private static final List<Color> GRAY_RAMP = List.of(Color.BLACK, Color.WHITE);

  private Colormap() {}

  public static BufferedImage toImage(RasterLayer layer, Visualization visualization, FetchMode mode) {
    BufferedImage image = new BufferedImage(layer.width(), layer.height(), BufferedImage.TYPE_INT_ARGB);
    if (layer.bands() >= 3) {
      drawRgb(layer, image, mode == FetchMode.VISUALIZED ? Visualization.DEFAULT : visualization);
    } else if (visualization.isDefault() && layer.isBinary()) {
      drawDiscrete(layer, image);
    } else {
      drawRamp(layer, image, visualization);
    }
    return image;
  }

  private static void drawRgb(RasterLayer layer, BufferedImage image, Visualization visualization) {
    double min = visualization.min() != null ? visualization.min() : 0;
    double max = visualization.max() != null ? visualization.max() : 255;
    for (int row = 0; row < layer.height(); row++) {
      for (int col = 0; col < layer.width(); col++) {
        if (layer.isVisible(row, col)) {
          int r = stretch(layer.value(row, col, 0), min, max);
          int g = stretch(layer.value(row, col, 1), min, max);
          int b = stretch(layer.value(row, col, 2), min, max);
          int a = layer.bands() >= 4 ? stretch(layer.value(row, col, 3), min, max) : 255;
          image.setRGB(col, row, (a << 24) | (r << 16) | (g << 8) | b);
        }
      }
    }
  }

  private static int stretch(double value, double min, double max) {
    if (!Double.isFinite(value)) {
      return 0;
    }
    double fraction = max > min ? (value - min) / (max - min) : 0;
    return (int) Math.round(Math.max(0, Math.min(1, fraction)) * 255);
  }

  private static void drawDiscrete(RasterLayer layer, BufferedImage image) {
    for (int row = 0; row < layer.height(); row++) {
      for (int col = 0; col < layer.width(); col++) {
        if (layer.isVisible(row, col)) {
          image.setRGB(col, row, (layer.value(row, col, 0) == 1 ? PRESENT : ABSENT).getRGB());
        }
      }
    }
  }

  private static void drawRamp(RasterLayer layer, BufferedImage image, Visualization visualization) {
    double[] range = layer.range(0);
    double min = visualization.min() != null ? visualization.min() : range[0];
    double max = visualization.max() != null ? visualization.max() : range[1];
    List<Color> palette = visualization.palette().isEmpty() ? GRAY_RAMP :
      visualization.palette().stream().map(Colors::parse).toList();
    for (int row = 0; row < layer.height(); row++) {
      for (int col = 0; col < layer.width(); col++) {
        double value = layer.value(row, col, 0);
        if (layer.isVisible(row, col) && Double.isFinite(value)) {
          double fraction = max > min ? (value - min) / (max - min) : 0;
          image.setRGB(col, row, colorAt(palette, fraction).getRGB());
        }
      }
    }
  }

  /** Returns the color {@code fraction} (clamped to [0, 1]) of the way along {@code palette}. */
  static Color colorAt(List<Color> palette, double fraction) {
    if (palette.size() == 1) {
      return palette.get(0);
    }
    double position = Math.max(0, Math.min(1, fraction)) * (palette.size() - 1);
    int index = Math.min((int) Math.floor(position), palette.size() - 2);
    return Colors.interpolate(palette.get(index), palette.get(index + 1), position - index);
  }
}
