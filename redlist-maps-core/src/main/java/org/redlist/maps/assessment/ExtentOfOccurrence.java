package org.redlist.maps.assessment;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import org.locationtech.jts.geom.Geometry;
import org.redlist.maps.compute.ComputeService;
import org.redlist.maps.compute.Expression;
import org.redlist.maps.compute.Geometries;
import org.redlist.maps.compute.Image;
import org.redlist.maps.geo.GeometryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extent of occurrence (EOO) of an ecosystem: the area of the minimum convex polygon that encloses every known
 * occurrence, as defined by the IUCN Red List of Ecosystems guidelines (criteria B1 and B2).
 * <p>
 * The hull must not exclude any area, discontinuity or disjunction, so it is computed from all presence pixels of a
 * binary classification image (1 = present, 0 or masked = absent).
 */
public class ExtentOfOccurrence {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtentOfOccurrence.class);

  public static final double DEFAULT_MAX_ERROR = 1;
  public static final double VECTOR_SCALE = 1;
  private static final double SQUARE_METERS_PER_KM2 = 1e6;

  private ExtentOfOccurrence() {}

  /**
   * Returns an expression evaluating to the EOO polygon of {@code classImage}.
   *
   * @param classImage binary presence image
   * @param region     area to vectorize, or {@code null} to use the footprint of {@code classImage}
   * @param maxError   tolerated error in meters for the hull
   * @param bestEffort let the service coarsen the vectorization scale for large regions
   */
  public static Expression hull(Image classImage, Expression region, double maxError, boolean bestEffort) {
    Expression geometry = region == null ? classImage.geometry() : region;
    Expression polygons = classImage
      .updateMask(Image.constant(1))
      .reduceToVectors(geometry, VECTOR_SCALE, bestEffort);
    Expression merged = Expression.invoke("Collection.geometry", "collection", polygons);
    return applyHullTwice(merged, maxError);
  }

  /** Returns {@link #hull(Image, Expression, double, boolean)} for a lon/lat region. */
  public static Expression hull(Image classImage, Geometry lonLatRegion, double maxError, boolean bestEffort) {
    return hull(classImage, lonLatRegion == null ? null : Geometries.toExpression(lonLatRegion), maxError,
      bestEffort);
  }

  /**
   * Returns the convex hull of the convex hull of {@code geometry}.
   * <p>
   * A single hull of a vectorized image sometimes comes back non-convex from the service, the second pass makes it
   * convex (https://issuetracker.google.com/issues/465490917).
   */
  public static Expression applyHullTwice(Expression geometry, double maxError) {
    return convexHull(convexHull(geometry, maxError), maxError);
  }

  private static Expression convexHull(Expression geometry, double maxError) {
    return Expression.invoke("Geometry.convexHull",
      "geometry", geometry,
      "maxError", Expression.invoke("ErrorMargin", "value", maxError));
  }

  /** Returns an expression evaluating to the area of {@code hull} in square kilometers. */
  public static Expression areaKm2(Expression hull) {
    return Expression.invoke("Number.divide",
      "left", Expression.invoke("Geometry.area", "geometry", hull),
      "right", SQUARE_METERS_PER_KM2);
  }

  /**
   * Computes the EOO polygon and its area on {@code service}.
   *
   * @throws IOException       if the service returns an error
   * @throws GeometryException if the returned polygon cannot be parsed
   */
  public static EooResult evaluate(ComputeService service, Image classImage, Geometry lonLatRegion, double maxError,
    boolean bestEffort) throws IOException, InterruptedException, GeometryException {
    Expression hull = hull(classImage, lonLatRegion, maxError, bestEffort);
    JsonNode geoJson = service.computeValue(hull);
    Geometry polygon = Geometries.fromGeoJson(geoJson);
    JsonNode area = service.computeValue(areaKm2(hull));
    if (!area.isNumber()) {
      throw new IOException("Expected a number for EOO area but got " + area);
    }
    LOGGER.info("EOO is {} km2", Math.round(area.asDouble()));
    return new EooResult(polygon, area.asDouble());
  }
}
