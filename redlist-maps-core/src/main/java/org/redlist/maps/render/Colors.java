package org.redlist.maps.render;

import java.awt.Color;
import java.util.Locale;
import java.util.Map;

/**
 * Parses color strings in the forms map styling options are usually written in: a named color such as
 * {@code "lightblue"}, {@code #rgb}, {@code #rrggbb}, {@code #rrggbbaa} or {@code "none"}.
 */
public class Colors {

  /** Fully transparent, what {@code "none"} parses to. */
  public static final Color NONE = new Color(0, 0, 0, 0);

  private static final Map<String, Integer> NAMED = Map.ofEntries(
    Map.entry("black", 0x000000),
    Map.entry("white", 0xffffff),
    Map.entry("gray", 0x808080),
    Map.entry("grey", 0x808080),
    Map.entry("darkgray", 0xa9a9a9),
    Map.entry("darkgrey", 0xa9a9a9),
    Map.entry("lightgray", 0xd3d3d3),
    Map.entry("lightgrey", 0xd3d3d3),
    Map.entry("silver", 0xc0c0c0),
    Map.entry("red", 0xff0000),
    Map.entry("darkred", 0x8b0000),
    Map.entry("green", 0x008000),
    Map.entry("darkgreen", 0x006400),
    Map.entry("lightgreen", 0x90ee90),
    Map.entry("lime", 0x00ff00),
    Map.entry("blue", 0x0000ff),
    Map.entry("darkblue", 0x00008b),
    Map.entry("navy", 0x000080),
    Map.entry("lightblue", 0xadd8e6),
    Map.entry("skyblue", 0x87ceeb),
    Map.entry("cyan", 0x00ffff),
    Map.entry("magenta", 0xff00ff),
    Map.entry("yellow", 0xffff00),
    Map.entry("orange", 0xffa500),
    Map.entry("purple", 0x800080),
    Map.entry("brown", 0xa52a2a),
    Map.entry("beige", 0xf5f5dc),
    Map.entry("tan", 0xd2b48c),
    Map.entry("olive", 0x808000),
    Map.entry("teal", 0x008080),
    Map.entry("pink", 0xffc0cb),
    Map.entry("gold", 0xffd700)
  );

  private Colors() {}

  /**
   * Returns the color {@code value} describes.
   *
   * @throws IllegalArgumentException if {@code value} is not a known name or hex color
   */
  public static Color parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Color must not be null");
    }
    String normalized = value.strip().toLowerCase(Locale.ROOT);
    if ("none".equals(normalized)) {
      return NONE;
    }
    Integer named = NAMED.get(normalized);
    if (named != null) {
      return new Color(named);
    }
    String hex = normalized.startsWith("#") ? normalized.substring(1) : null;
    try {
      if (hex != null && hex.length() == 3) {
        int r = Integer.parseInt(hex.substring(0, 1), 16);
        int g = Integer.parseInt(hex.substring(1, 2), 16);
        int b = Integer.parseInt(hex.substring(2, 3), 16);
        return new Color(r * 17, g * 17, b * 17);
      } else if (hex != null && hex.length() == 6) {
        return new Color(Integer.parseInt(hex, 16));
      } else if (hex != null && hex.length() == 8) {
        long rgba = Long.parseLong(hex, 16);
        return new Color((int) (rgba >> 24) & 0xff, (int) (rgba >> 16) & 0xff, (int) (rgba >> 8) & 0xff,
          (int) rgba & 0xff);
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid hex color: " + value, e);
    }
    throw new IllegalArgumentException("Unknown color: " + value);
  }

  /** Returns {@code color} with its alpha multiplied by {@code alpha}. */
  public static Color withAlpha(Color color, double alpha) {
    return new Color(color.getRed(), color.getGreen(), color.getBlue(),
      (int) Math.round(color.getAlpha() * Math.max(0, Math.min(1, alpha))));
  }

  /** Returns the color {@code fraction} of the way from {@code from} to {@code to}. */
  public static Color interpolate(Color from, Color to, double fraction) {
    double f = Math.max(0, Math.min(1, fraction));
    return new Color(
      (int) Math.round(from.getRed() + (to.getRed() - from.getRed()) * f),
      (int) Math.round(from.getGreen() + (to.getGreen() - from.getGreen()) * f),
      (int) Math.round(from.getBlue() + (to.getBlue() - from.getBlue()) * f),
      (int) Math.round(from.getAlpha() + (to.getAlpha() - from.getAlpha()) * f)
    );
  }
}
