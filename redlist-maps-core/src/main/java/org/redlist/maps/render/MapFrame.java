package org.redlist.maps.render;

import java.awt.Rectangle;

/**
 * Where the map sits in the output image, and which of its four edges (spines) were drawn.
 */
public record MapFrame(
  int x,
  int y,
  int width,
  int height,
  boolean leftSpineVisible,
  boolean rightSpineVisible,
  boolean topSpineVisible,
  boolean bottomSpineVisible
) {

  public static MapFrame of(Rectangle bounds, boolean spinesVisible) {
    return new MapFrame(bounds.x, bounds.y, bounds.width, bounds.height, spinesVisible, spinesVisible, spinesVisible,
      spinesVisible);
  }

  /** Returns true if any spine is visible. */
  public boolean anySpineVisible() {
    return leftSpineVisible || rightSpineVisible || topSpineVisible || bottomSpineVisible;
  }

  public Rectangle bounds() {
    return new Rectangle(x, y, width, height);
  }
}
