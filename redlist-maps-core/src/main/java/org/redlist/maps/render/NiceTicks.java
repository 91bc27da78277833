package org.redlist.maps.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks evenly spaced, round tick positions for an axis: at most {@code bins + 1} ticks on multiples of 1, 2, 2.5 or 5
 * times a power of ten.
 */
public class NiceTicks {

  public static final int DEFAULT_BINS = 6;
  private static final double[] STEPS = {1, 2, 2.5, 5, 10};

  private NiceTicks() {}

  /** Returns the spacing between ticks that splits {@code [min, max]} into at most {@code bins} intervals. */
  public static double step(double min, double max, int bins) {
    double raw = (max - min) / bins;
    if (!(raw > 0)) {
      return 1;
    }
    double magnitude = Math.pow(10, Math.floor(Math.log10(raw)));
    for (double step : STEPS) {
      double candidate = step * magnitude;
      long first = (long) Math.ceil(min / candidate - 1e-9);
      long last = (long) Math.floor(max / candidate + 1e-9);
      if (last - first <= bins) {
        return candidate;
      }
    }
    return 10 * magnitude;
  }

  /** Returns tick positions within {@code [min, max]}. */
  public static List<Double> ticks(double min, double max, int bins) {
    double step = step(min, max, bins);
    List<Double> result = new ArrayList<>();
    long first = (long) Math.ceil(min / step - 1e-9);
    long last = (long) Math.floor(max / step + 1e-9);
    for (long i = first; i <= last; i++) {
      result.add(i * step);
    }
    return result;
  }

  public static List<Double> ticks(double min, double max) {
    return ticks(min, max, DEFAULT_BINS);
  }
}
