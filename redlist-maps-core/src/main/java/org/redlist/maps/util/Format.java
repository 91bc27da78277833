package org.redlist.maps.util;

import java.text.NumberFormat;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Utilities for formatting values as strings.
 */
public class Format {

  public static final Locale DEFAULT_LOCALE = Locale.getDefault(Locale.Category.FORMAT);

  private static final ConcurrentMap<Locale, Format> instances = new ConcurrentHashMap<>();
  private static final NavigableMap<Long, String> STORAGE_SUFFIXES = new TreeMap<>(Map.ofEntries(
    Map.entry(1_000L, "k"),
    Map.entry(1_000_000L, "M"),
    Map.entry(1_000_000_000L, "G"),
    Map.entry(1_000_000_000_000L, "T")
  ));

  // `NumberFormat` instances are not thread safe, so we need to wrap them inside a `ThreadLocal`.
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> nf;

  private Format(Locale locale) {
    nf = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setMaximumFractionDigits(1);
      return f;
    });
  }

  public static Format forLocale(Locale locale) {
    return instances.computeIfAbsent(locale, Format::new);
  }

  public static Format defaultInstance() {
    return forLocale(DEFAULT_LOCALE);
  }

  /** Returns a number of bytes formatted like "123" "1.2k" "240M", etc. */
  public String storage(Number num) {
    long value = num.longValue();
    if (value < 0) {
      return "-";
    } else if (value < 1000) {
      return Long.toString(value);
    }

    Map.Entry<Long, String> e = STORAGE_SUFFIXES.floorEntry(value);
    Long divideBy = e.getKey();
    String suffix = e.getValue();

    long truncated = value / (divideBy / 10);
    boolean hasDecimal = truncated < 100 && (truncated % 10 != 0);
    return hasDecimal ? decimal(truncated / 10d) + suffix : (truncated / 10) + suffix;
  }

  /** Returns a number formatted with 1 decimal point. */
  public String decimal(double value) {
    return nf.get().format(value);
  }
}
