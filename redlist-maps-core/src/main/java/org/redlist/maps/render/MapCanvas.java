package org.redlist.maps.render;

import java.awt.Rectangle;
import java.awt.Shape;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import org.locationtech.jts.awt.ShapeWriter;
import org.locationtech.jts.geom.Geometry;
import org.redlist.maps.geo.Extent;
import org.redlist.maps.raster.RasterBounds;

/**
 * Maps projected meters to output pixels for a map frame with equal x and y scale, y pointing up in meters and down in
 * pixels.
 */
public class MapCanvas {

  private final Extent extent;
  private final Rectangle frame;
  private final double pixelsPerMeter;
  private final ShapeWriter shapeWriter;

  private MapCanvas(Extent extent, Rectangle frame, double pixelsPerMeter) {
    this.extent = extent;
    this.frame = frame;
    this.pixelsPerMeter = pixelsPerMeter;
    this.shapeWriter = new ShapeWriter((src, dest) -> dest.setLocation(toPixelX(src.x), toPixelY(src.y)));
    shapeWriter.setRemoveDuplicatePoints(true);
  }

  /**
   * Returns a canvas that fits {@code extent} inside {@code available}, keeping the aspect ratio and centering it.
   */
  public static MapCanvas fit(Extent extent, Rectangle2D available) {
    double scale = Math.min(available.getWidth() / extent.width(), available.getHeight() / extent.height());
    double width = extent.width() * scale;
    double height = extent.height() * scale;
    Rectangle frame = new Rectangle(
      (int) Math.round(available.getX() + (available.getWidth() - width) / 2),
      (int) Math.round(available.getY() + (available.getHeight() - height) / 2),
      Math.max(1, (int) Math.round(width)),
      Math.max(1, (int) Math.round(height))
    );
    return new MapCanvas(extent, frame, scale);
  }

  public Rectangle frame() {
    return new Rectangle(frame);
  }

  public Extent extent() {
    return extent;
  }

  public double toPixelX(double x) {
    return frame.x + (x - extent.minX()) * pixelsPerMeter;
  }

  public double toPixelY(double y) {
    return frame.y + (extent.maxY() - y) * pixelsPerMeter;
  }

  /** Returns the projected coordinate under a pixel position. */
  public Point2D toWorld(double px, double py) {
    return new Point2D.Double(extent.minX() + (px - frame.x) / pixelsPerMeter,
      extent.maxY() - (py - frame.y) / pixelsPerMeter);
  }

  /** Returns a projected geometry as a shape in pixel coordinates. */
  public Shape toShape(Geometry projected) {
    return shapeWriter.toShape(projected);
  }

  /** Returns the pixel rectangle covered by raster {@code bounds}. */
  public Rectangle2D toPixels(RasterBounds bounds) {
    double left = toPixelX(bounds.left());
    double top = toPixelY(bounds.top());
    return new Rectangle2D.Double(left, top, toPixelX(bounds.right()) - left, toPixelY(bounds.bottom()) - top);
  }
}
