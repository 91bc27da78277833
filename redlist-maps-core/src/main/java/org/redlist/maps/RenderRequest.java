package org.redlist.maps;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.redlist.maps.compute.Image;
import org.redlist.maps.compute.Visualization;
import org.redlist.maps.config.Arguments;
import org.redlist.maps.raster.FetchMode;

/**
 * Everything that controls how one region map is drawn.
 * <p>
 * Build with {@link #builder(String)}; every field not set keeps its default.
 *
 * @param regionCode               2-letter region code as supplied by the caller
 * @param outputPath               PNG to write, {@code <lower-case code>.png} by default
 * @param showBorder               stroke the region outline
 * @param showGrid                 draw km gridlines and axis labels, otherwise hide the frame
 * @param showSurroundingCountries draw land, ocean, coastline and borders around the region
 * @param showWorldBackground      draw the configured world image under everything else
 * @param fillColor                region fill, {@code "none"} for no fill
 * @param edgeColor                region outline color
 * @param edgeWidth                region outline width in points
 * @param title                    title above the map, none when empty
 * @param dpi                      output resolution
 * @param widthInches              figure width
 * @param heightInches             figure height
 * @param image                    remote raster drawn under the region
 * @param clipImage                clip {@code image} to the region boundary on the service
 * @param visualization            color scale for {@code image}
 * @param fetchMode                how {@code image} is colored
 */
public record RenderRequest(
  Object regionCode,
  Path outputPath,
  boolean showBorder,
  boolean showGrid,
  boolean showSurroundingCountries,
  boolean showWorldBackground,
  String fillColor,
  String edgeColor,
  double edgeWidth,
  Optional<String> title,
  int dpi,
  double widthInches,
  double heightInches,
  Optional<Image> image,
  boolean clipImage,
  Visualization visualization,
  FetchMode fetchMode
) {

  public static final String DEFAULT_FILL_COLOR = "white";
  public static final String DEFAULT_EDGE_COLOR = "black";
  public static final double DEFAULT_EDGE_WIDTH = 1.5;
  public static final int DEFAULT_DPI = 300;
  public static final double DEFAULT_WIDTH_INCHES = 12;
  public static final double DEFAULT_HEIGHT_INCHES = 8;

  public RenderRequest {
    if (dpi <= 0) {
      throw new IllegalArgumentException("dpi must be > 0, was " + dpi);
    }
    if (!(widthInches > 0) || !(heightInches > 0)) {
      throw new IllegalArgumentException("figure size must be positive, was " + widthInches + "x" + heightInches);
    }
    if (edgeWidth < 0) {
      throw new IllegalArgumentException("edge width must be >= 0, was " + edgeWidth);
    }
    title = title.filter(t -> !t.isEmpty());
  }

  public static Builder builder(Object regionCode) {
    return new Builder(regionCode);
  }

  /**
   * Returns a request for {@code regionCode} with options from {@code arguments}: {@code output}, {@code border},
   * {@code grid}, {@code surrounding}, {@code world_background}, {@code fill_color}, {@code edge_color},
   * {@code edge_width}, {@code title}, {@code dpi}, {@code width}, {@code height}, {@code image}
   * (or {@code image_collection}), {@code bands}, {@code clip_image}, {@code vis_min}, {@code vis_max},
   * {@code palette} and {@code fetch_mode}.
   */
  public static RenderRequest fromArguments(String regionCode, Arguments arguments) {
    Builder builder = builder(regionCode);
    String output = arguments.getString("output", "PNG file to write, defaults to <code>.png", null);
    if (output != null) {
      builder.outputPath(Path.of(output));
    }
    builder
      .showBorder(arguments.getBoolean("border", "stroke the region outline", true))
      .showGrid(arguments.getBoolean("grid", "draw km gridlines and axis labels", true))
      .showSurroundingCountries(arguments.getBoolean("surrounding", "draw neighboring land, ocean and borders", true))
      .showWorldBackground(arguments.getBoolean("world_background", "draw the world_image under the map", true))
      .fillColor(arguments.getString("fill_color", "region fill color or none", DEFAULT_FILL_COLOR))
      .edgeColor(arguments.getString("edge_color", "region outline color", DEFAULT_EDGE_COLOR))
      .edgeWidth(arguments.getDouble("edge_width", "region outline width in points", DEFAULT_EDGE_WIDTH))
      .title(arguments.getString("title", "map title", ""))
      .dpi(arguments.getInteger("dpi", "output resolution", DEFAULT_DPI))
      .widthInches(arguments.getDouble("width", "figure width in inches", DEFAULT_WIDTH_INCHES))
      .heightInches(arguments.getDouble("height", "figure height in inches", DEFAULT_HEIGHT_INCHES))
      .clipImage(arguments.getBoolean("clip_image", "clip the raster to the region boundary", false))
      .fetchMode(FetchMode.valueOf(arguments.getString("fetch_mode", "raw_values or visualized", "raw_values")
        .toUpperCase(Locale.ROOT)));

    String imageId = arguments.getString("image", "raster asset id drawn under the region", null);
    String collectionId = arguments.getString("image_collection", "image collection id mosaicked under the region",
      null);
    Image image = imageId != null ? Image.load(imageId) : collectionId != null ? Image.mosaic(collectionId) : null;
    if (image != null) {
      List<String> bands = arguments.getList("bands", "bands to select from the raster", List.of());
      builder.image(bands.isEmpty() ? image : image.select(bands.toArray(String[]::new)));
    }

    Double min = arguments.has("vis_min") ? arguments.getDouble("vis_min", "value drawn with the first color", 0) :
      null;
    Double max = arguments.has("vis_max") ? arguments.getDouble("vis_max", "value drawn with the last color", 1) :
      null;
    List<String> palette = arguments.getList("palette", "colors the raster values are stretched across", List.of());
    builder.visualization(new Visualization(min, max, palette));
    return builder.build();
  }

  /** Returns the lower-case region code as a PNG file name. */
  static Path defaultOutputPath(Object regionCode) {
    return Path.of(String.valueOf(regionCode).toLowerCase(Locale.ROOT) + ".png");
  }

  /** Returns true if the region should be filled. */
  public boolean hasFill() {
    return fillColor != null && !"none".equalsIgnoreCase(fillColor);
  }

  public int widthPixels() {
    return (int) Math.round(widthInches * dpi);
  }

  public int heightPixels() {
    return (int) Math.round(heightInches * dpi);
  }

  /** Mutable builder for {@link RenderRequest}. */
  public static final class Builder {

    private final Object regionCode;
    private Path outputPath;
    private boolean showBorder = true;
    private boolean showGrid = true;
    private boolean showSurroundingCountries = true;
    private boolean showWorldBackground = true;
    private String fillColor = DEFAULT_FILL_COLOR;
    private String edgeColor = DEFAULT_EDGE_COLOR;
    private double edgeWidth = DEFAULT_EDGE_WIDTH;
    private String title;
    private int dpi = DEFAULT_DPI;
    private double widthInches = DEFAULT_WIDTH_INCHES;
    private double heightInches = DEFAULT_HEIGHT_INCHES;
    private Image image;
    private boolean clipImage = false;
    private Visualization visualization = Visualization.DEFAULT;
    private FetchMode fetchMode = FetchMode.RAW_VALUES;

    private Builder(Object regionCode) {
      this.regionCode = regionCode;
    }

    public Builder outputPath(Path outputPath) {
      this.outputPath = outputPath;
      return this;
    }

    public Builder showBorder(boolean showBorder) {
      this.showBorder = showBorder;
      return this;
    }

    public Builder showGrid(boolean showGrid) {
      this.showGrid = showGrid;
      return this;
    }

    public Builder showSurroundingCountries(boolean showSurroundingCountries) {
      this.showSurroundingCountries = showSurroundingCountries;
      return this;
    }

    public Builder showWorldBackground(boolean showWorldBackground) {
      this.showWorldBackground = showWorldBackground;
      return this;
    }

    /** Sets the region fill, {@code null} restores the default and {@code "none"} disables it. */
    public Builder fillColor(String fillColor) {
      this.fillColor = fillColor == null ? DEFAULT_FILL_COLOR : fillColor;
      return this;
    }

    public Builder edgeColor(String edgeColor) {
      this.edgeColor = edgeColor == null ? DEFAULT_EDGE_COLOR : edgeColor;
      return this;
    }

    public Builder edgeWidth(double edgeWidth) {
      this.edgeWidth = edgeWidth;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder dpi(int dpi) {
      this.dpi = dpi;
      return this;
    }

    public Builder widthInches(double widthInches) {
      this.widthInches = widthInches;
      return this;
    }

    public Builder heightInches(double heightInches) {
      this.heightInches = heightInches;
      return this;
    }

    public Builder image(Image image) {
      this.image = image;
      return this;
    }

    public Builder clipImage(boolean clipImage) {
      this.clipImage = clipImage;
      return this;
    }

    public Builder visualization(Visualization visualization) {
      this.visualization = visualization == null ? Visualization.DEFAULT : visualization;
      return this;
    }

    public Builder fetchMode(FetchMode fetchMode) {
      this.fetchMode = fetchMode == null ? FetchMode.RAW_VALUES : fetchMode;
      return this;
    }

    public RenderRequest build() {
      return new RenderRequest(
        regionCode,
        outputPath == null ? defaultOutputPath(regionCode) : outputPath,
        showBorder,
        showGrid,
        showSurroundingCountries,
        showWorldBackground,
        fillColor,
        edgeColor,
        edgeWidth,
        Optional.ofNullable(title),
        dpi,
        widthInches,
        heightInches,
        Optional.ofNullable(image),
        clipImage,
        visualization,
        fetchMode
      );
    }
  }
}
