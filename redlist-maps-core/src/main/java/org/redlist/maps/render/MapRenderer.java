package org.redlist.maps.render;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.geom.AffineTransform;
import java.awt.geom.Line2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.redlist.maps.RenderRequest;
import org.redlist.maps.geo.Extent;
import org.redlist.maps.geo.GeometryException;
import org.redlist.maps.geo.MapProjection;
import org.redlist.maps.raster.RasterLayer;
import org.redlist.maps.reader.ContextLayers;
import org.redlist.maps.reader.ContextSource;
import org.redlist.maps.reader.ResolvedBoundary;
import org.redlist.maps.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws a resolved region, with optional raster basemap and context layers, into a PNG.
 * <p>
 * Layers from back to front:
 * <ol>
 * <li>the world reference image, when one is configured</li>
 * <li>land and ocean fills, or flat white when surrounding countries are hidden</li>
 * <li>the raster basemap</li>
 * <li>coastlines and country borders</li>
 * <li>the region polygon</li>
 * <li>km gridlines, tick labels and axis labels, or nothing at all around the frame when the grid is off</li>
 * <li>the title</li>
 * </ol>
 * Fills go under the raster so it stays visible; lines go above it.
 */
public class MapRenderer {

  private static final Logger LOGGER = LoggerFactory.getLogger(MapRenderer.class);

  static final Color OCEAN = Colors.parse("lightblue");
  static final Color LAND = Color.WHITE;
  static final Color TICK_LABEL = Colors.parse("#333333");
  static final double POLYGON_ALPHA = 0.7;
  static final double CONTEXT_LINE_WIDTH_PT = 0.5;
  static final double BORDER_ALPHA = 0.5;
  static final double GRID_ALPHA = 0.3;
  static final double GRID_LINE_WIDTH_PT = 0.5;
  static final double SPINE_WIDTH_PT = 0.8;
  static final double TICK_LENGTH_PT = 3.5;
  static final float TICK_LABEL_SIZE_PT = 9;
  static final float AXIS_LABEL_SIZE_PT = 10;
  static final float TITLE_SIZE_PT = 16;
  // share of the figure left around the map for labels and title
  static final double MARGIN_LEFT = 0.125;
  static final double MARGIN_RIGHT = 0.1;
  static final double MARGIN_BOTTOM = 0.11;
  static final double MARGIN_TOP = 0.12;

  private final ContextSource context;
  private final WorldBackground worldBackground;

  /**
   * @param context         land, ocean, coastline and border layers
   * @param worldBackground world reference image, or {@code null} for none
   */
  public MapRenderer(ContextSource context, WorldBackground worldBackground) {
    this.context = context;
    this.worldBackground = worldBackground;
  }

  /**
   * Draws {@code boundary} styled by {@code request} with an optional raster basemap and writes it to
   * {@link RenderRequest#outputPath()}.
   *
   * @throws IOException if the image cannot be written
   */
  public RenderedMap render(RenderRequest request, ResolvedBoundary boundary, Optional<RasterLayer> raster)
    throws IOException {
    BufferedImage image = new BufferedImage(request.widthPixels(), request.heightPixels(),
      BufferedImage.TYPE_INT_ARGB);
    MapFrame frame;
    Graphics2D graphics = image.createGraphics();
    try {
      frame = draw(graphics, request, boundary, raster);
    } finally {
      graphics.dispose();
    }
    Path output = request.outputPath();
    FileUtils.createParentDirectories(output);
    PngWriter.write(image, output, request.dpi());
    LOGGER.info("Map saved to: {}", output);
    return new RenderedMap(output, frame);
  }

  private MapFrame draw(Graphics2D g, RenderRequest request, ResolvedBoundary boundary,
    Optional<RasterLayer> raster) {
    g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
    g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
    g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
    g.setColor(Color.WHITE);
    g.fillRect(0, 0, request.widthPixels(), request.heightPixels());

    int dpi = request.dpi();
    MapCanvas canvas = MapCanvas.fit(boundary.extent(), new Rectangle2D.Double(
      request.widthPixels() * MARGIN_LEFT,
      request.heightPixels() * MARGIN_TOP,
      request.widthPixels() * (1 - MARGIN_LEFT - MARGIN_RIGHT),
      request.heightPixels() * (1 - MARGIN_TOP - MARGIN_BOTTOM)
    ));
    Rectangle frameBounds = canvas.frame();
    MapProjection projection = boundary.projection();

    Shape previousClip = g.getClip();
    g.clip(frameBounds);
    if (request.showWorldBackground() && worldBackground != null) {
      worldBackground.draw(g, canvas, projection);
    }

    ContextLayers layers = ContextLayers.EMPTY;
    if (request.showSurroundingCountries()) {
      Envelope lonLat = projection.lonLatEnvelope(boundary.extent().toEnvelope());
      layers = context.layers(lonLat);
      fill(g, canvas, projection, layers.ocean(), OCEAN);
      fill(g, canvas, projection, layers.land(), LAND);
    } else {
      g.setColor(Color.WHITE);
      g.fill(frameBounds);
    }

    raster.ifPresent(layer -> drawRaster(g, canvas, layer, request));

    stroke(g, canvas, projection, layers.coastline(), Color.BLACK, points(CONTEXT_LINE_WIDTH_PT, dpi));
    stroke(g, canvas, projection, layers.borders(), Colors.withAlpha(Color.BLACK, BORDER_ALPHA),
      points(CONTEXT_LINE_WIDTH_PT, dpi));

    drawRegion(g, canvas, boundary.projectedGeometry(), request);
    g.setClip(previousClip);

    if (request.showGrid()) {
      drawGrid(g, canvas, boundary, dpi);
    }
    request.title().ifPresent(title -> drawTitle(g, frameBounds, title, dpi));
    return MapFrame.of(frameBounds, request.showGrid());
  }

  /** Returns {@code pt} points in pixels at {@code dpi}. */
  static float points(double pt, int dpi) {
    return (float) (pt * dpi / 72d);
  }

  private static void fill(Graphics2D g, MapCanvas canvas, MapProjection projection, List<Geometry> lonLat,
    Color color) {
    g.setColor(color);
    for (Geometry geometry : lonLat) {
      project(projection, geometry).ifPresent(projected -> g.fill(canvas.toShape(projected)));
    }
  }

  private static void stroke(Graphics2D g, MapCanvas canvas, MapProjection projection, List<Geometry> lonLat,
    Color color, float width) {
    g.setColor(color);
    g.setStroke(new BasicStroke(width, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
    for (Geometry geometry : lonLat) {
      project(projection, geometry).ifPresent(projected -> g.draw(canvas.toShape(projected)));
    }
  }

  private static Optional<Geometry> project(MapProjection projection, Geometry lonLat) {
    try {
      return Optional.of(projection.project(lonLat));
    } catch (GeometryException e) {
      e.log("Skipping context geometry");
      return Optional.empty();
    }
  }

  private static void drawRaster(Graphics2D g, MapCanvas canvas, RasterLayer layer, RenderRequest request) {
    BufferedImage colored = Colormap.toImage(layer, request.visualization(), request.fetchMode());
    Rectangle2D target = canvas.toPixels(layer.bounds());
    Object previous = g.getRenderingHint(RenderingHints.KEY_INTERPOLATION);
    g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
    AffineTransform transform = new AffineTransform(
      target.getWidth() / colored.getWidth(), 0,
      0, target.getHeight() / colored.getHeight(),
      target.getX(), target.getY());
    g.drawImage(colored, transform, null);
    if (previous != null) {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, previous);
    }
  }

  private static void drawRegion(Graphics2D g, MapCanvas canvas, Geometry projected, RenderRequest request) {
    Shape shape = canvas.toShape(projected);
    if (request.hasFill()) {
      g.setColor(Colors.withAlpha(Colors.parse(request.fillColor()), POLYGON_ALPHA));
      g.fill(shape);
    }
    if (request.showBorder() && request.edgeWidth() > 0) {
      g.setColor(Colors.withAlpha(Colors.parse(request.edgeColor()), POLYGON_ALPHA));
      g.setStroke(new BasicStroke(points(request.edgeWidth(), request.dpi()), BasicStroke.CAP_ROUND,
        BasicStroke.JOIN_ROUND));
      g.draw(shape);
    }
  }

  private static void drawGrid(Graphics2D g, MapCanvas canvas, ResolvedBoundary boundary, int dpi) {
    Extent extent = canvas.extent();
    Rectangle frame = canvas.frame();
    List<Double> xTicks = NiceTicks.ticks(extent.minX(), extent.maxX());
    List<Double> yTicks = NiceTicks.ticks(extent.minY(), extent.maxY());

    float gridWidth = points(GRID_LINE_WIDTH_PT, dpi);
    g.setColor(Colors.withAlpha(Colors.parse("gray"), GRID_ALPHA));
    g.setStroke(new BasicStroke(gridWidth, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10,
      new float[]{3.7f * gridWidth, 1.6f * gridWidth}, 0));
    for (double x : xTicks) {
      double px = canvas.toPixelX(x);
      g.draw(new Line2D.Double(px, frame.y, px, frame.getMaxY()));
    }
    for (double y : yTicks) {
      double py = canvas.toPixelY(y);
      g.draw(new Line2D.Double(frame.x, py, frame.getMaxX(), py));
    }

    g.setColor(Color.BLACK);
    g.setStroke(new BasicStroke(points(SPINE_WIDTH_PT, dpi)));
    g.draw(frame);

    float tickLength = points(TICK_LENGTH_PT, dpi);
    float gap = points(3.5, dpi);
    Font tickFont = new Font(Font.SANS_SERIF, Font.PLAIN, 1).deriveFont(points(TICK_LABEL_SIZE_PT, dpi));
    g.setFont(tickFont);
    FontMetrics tickMetrics = g.getFontMetrics();
    double maxYLabelWidth = 0;
    for (double x : xTicks) {
      double px = canvas.toPixelX(x);
      g.setColor(TICK_LABEL);
      g.draw(new Line2D.Double(px, frame.getMaxY(), px, frame.getMaxY() + tickLength));
      String label = kilometers(x);
      g.drawString(label, (float) (px - tickMetrics.stringWidth(label) / 2d),
        (float) (frame.getMaxY() + tickLength + gap + tickMetrics.getAscent()));
    }
    for (double y : yTicks) {
      double py = canvas.toPixelY(y);
      g.setColor(TICK_LABEL);
      g.draw(new Line2D.Double(frame.x - tickLength, py, frame.x, py));
      String label = kilometers(y);
      int labelWidth = tickMetrics.stringWidth(label);
      maxYLabelWidth = Math.max(maxYLabelWidth, labelWidth);
      g.drawString(label, (float) (frame.x - tickLength - gap - labelWidth),
        (float) (py + tickMetrics.getAscent() / 2d - tickMetrics.getDescent() / 2d));
    }

    g.setColor(Color.BLACK);
    g.setFont(tickFont.deriveFont(points(AXIS_LABEL_SIZE_PT, dpi)));
    FontMetrics axisMetrics = g.getFontMetrics();
    String xLabel = xAxisLabel(boundary);
    g.drawString(xLabel, (float) (frame.getCenterX() - axisMetrics.stringWidth(xLabel) / 2d),
      (float) (frame.getMaxY() + tickLength + gap + tickMetrics.getHeight() + gap + axisMetrics.getAscent()));

    String yLabel = Y_AXIS_LABEL;
    AffineTransform previous = g.getTransform();
    double yLabelX = frame.x - tickLength - gap - maxYLabelWidth - gap - axisMetrics.getDescent();
    g.translate(yLabelX, frame.getCenterY() + axisMetrics.stringWidth(yLabel) / 2d);
    g.rotate(-Math.PI / 2);
    g.drawString(yLabel, 0, 0);
    g.setTransform(previous);
  }

  static final String Y_AXIS_LABEL = "Northing (km)";

  /** Returns the x axis label, for example {@code Easting (km) - UTM Zone 13N}. */
  static String xAxisLabel(ResolvedBoundary boundary) {
    return "Easting (km) - UTM Zone " + boundary.zone();
  }

  /** Formats a tick position in meters as whole kilometers. */
  static String kilometers(double meters) {
    String result = String.format(Locale.ROOT, "%.0f", meters / 1000);
    return "-0".equals(result) ? "0" : result;
  }

  private static void drawTitle(Graphics2D g, Rectangle frame, String title, int dpi) {
    g.setColor(Color.BLACK);
    g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 1).deriveFont(points(TITLE_SIZE_PT, dpi)));
    FontMetrics metrics = g.getFontMetrics();
    g.drawString(title, (float) (frame.getCenterX() - metrics.stringWidth(title) / 2d),
      (float) (frame.y - points(6, dpi) - metrics.getDescent()));
  }
}
