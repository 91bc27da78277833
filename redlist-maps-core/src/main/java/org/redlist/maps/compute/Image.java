package org.redlist.maps.compute;

import java.util.List;
import java.util.Objects;
import org.locationtech.jts.geom.Geometry;

/**
 * A handle to a remote raster: an {@link Expression} that evaluates to an image on the compute service.
 * <p>
 * Methods return new handles and never contact the service; pixels are only computed when the handle is passed to
 * {@link ComputeService#computePixels(Image, PixelGrid)} or an export.
 */
public final class Image {

  private final Expression expression;

  private Image(Expression expression) {
    this.expression = expression;
  }

  /** Returns a handle to the image asset {@code assetId}, for example {@code USGS/SRTMGL1_003}. */
  public static Image load(String assetId) {
    return new Image(Expression.invoke("Image.load", "id", assetId));
  }

  /** Returns a handle to the mosaic of every image in the collection {@code collectionId}. */
  public static Image mosaic(String collectionId) {
    return new Image(Expression.invoke("ImageCollection.mosaic",
      "collection", Expression.invoke("ImageCollection.load", "id", collectionId)));
  }

  /** Returns an image with the same value in every pixel. */
  public static Image constant(double value) {
    return new Image(Expression.invoke("Image.constant", "value", value));
  }

  public Expression expression() {
    return expression;
  }

  public Image select(String... bands) {
    return new Image(Expression.invoke("Image.select", "input", expression, "bandSelectors", List.of(bands)));
  }

  /** Returns the validity mask of this image: 0 where a pixel has no data, up to 1 where it is fully valid. */
  public Image mask() {
    return new Image(Expression.invoke("Image.mask", "image", expression));
  }

  /** Returns this image with pixels hidden wherever {@code mask} is zero. */
  public Image updateMask(Image mask) {
    return new Image(Expression.invoke("Image.updateMask", "image", expression, "mask", mask.expression));
  }

  /** Returns this image clipped to a lon/lat polygon or multipolygon. */
  public Image clip(Geometry lonLat) {
    return new Image(Expression.invoke("Image.clip", "input", expression, "geometry",
      Geometries.toExpression(lonLat)));
  }

  /** Returns an 8-bit RGB rendering of this image. */
  public Image visualize(Visualization visualization) {
    return new Image(Expression.invoke("Image.visualize",
      "image", expression,
      "min", visualization.min(),
      "max", visualization.max(),
      "palette", visualization.palette().isEmpty() ? null : visualization.palette()));
  }

  /** Returns 1 where this image is greater than {@code value}, 0 elsewhere. */
  public Image gt(double value) {
    return new Image(Expression.invoke("Image.gt", "image1", expression, "image2", constant(value).expression));
  }

  /** Returns this image with masked pixels replaced by {@code value}. */
  public Image unmask(double value) {
    return new Image(Expression.invoke("Image.unmask", "input", expression, "value", value));
  }

  /** Returns this image aggregated into coarser pixels with {@code reducer} when it is next reprojected. */
  public Image reduceResolution(Expression reducer, boolean bestEffort, int maxPixels) {
    return new Image(Expression.invoke("Image.reduceResolution",
      "image", expression,
      "reducer", reducer,
      "bestEffort", bestEffort,
      "maxPixels", maxPixels));
  }

  /** Returns this image resampled into {@code projection}, an expression evaluating to a projection. */
  public Image reproject(Expression projection) {
    return new Image(Expression.invoke("Image.reproject", "image", expression, "crs", projection));
  }

  /** Returns an expression evaluating to the footprint of this image. */
  public Expression geometry() {
    return Expression.invoke("Image.geometry", "feature", expression);
  }

  /**
   * Returns an expression evaluating to a collection of polygons around connected pixels with the same value within
   * {@code region}.
   */
  public Expression reduceToVectors(Expression region, double scale, boolean bestEffort) {
    return Expression.invoke("Image.reduceToVectors",
      "image", expression,
      "geometry", region,
      "scale", scale,
      "geometryType", "polygon",
      "eightConnected", false,
      "bestEffort", bestEffort);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Image other && expression.equals(other.expression));
  }

  @Override
  public int hashCode() {
    return Objects.hash(expression);
  }

  @Override
  public String toString() {
    return "Image" + expression;
  }
}
