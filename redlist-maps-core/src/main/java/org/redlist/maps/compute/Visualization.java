package org.redlist.maps.compute;

import java.util.List;

/**
 * How to turn single band values into colors: values are stretched linearly from {@code min} to {@code max} across
 * {@code palette}.
 *
 * @param min     value drawn with the first palette color, or {@code null} to use the data minimum
 * @param max     value drawn with the last palette color, or {@code null} to use the data maximum
 * @param palette color names or hex strings, empty for a gray ramp
 */
public record Visualization(Double min, Double max, List<String> palette) {

  public static final Visualization DEFAULT = new Visualization(null, null, List.of());

  public Visualization {
    palette = palette == null ? List.of() : List.copyOf(palette);
    if (min != null && max != null && max < min) {
      throw new IllegalArgumentException("max must be >= min, got min=" + min + " max=" + max);
    }
  }

  public static Visualization of(double min, double max, String... palette) {
    return new Visualization(min, max, List.of(palette));
  }

  public boolean isDefault() {
    return min == null && max == null && palette.isEmpty();
  }
}
