package org.redlist.maps.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A transverse Mercator projection between WGS84 lon/lat and planar meters, with the rectangle of projected
 * coordinates it considers valid.
 * <p>
 * Geometries projected through {@link #project(Geometry)} are clipped to {@link #limits()}. The
 * {@link #standard(ProjectionSpec) standard} limits match the usual extent of a UTM zone, which truncates countries
 * that reach into neighboring zones, so maps are drawn with the {@link #unclipped(ProjectionSpec) widened} limits.
 * <p>
 * Instances are not thread-safe since the underlying proj4j transforms reuse internal buffers.
 */
public class MapProjection {

  private static final Logger LOGGER = LoggerFactory.getLogger(MapProjection.class);

  /** Half-width of the widened validity rectangle around the false origin, in meters. */
  public static final double WIDENED_HALF_RANGE = 20_000_000;
  public static final double STANDARD_MIN_X = -250_000;
  public static final double STANDARD_MAX_X = 1_250_000;
  public static final double STANDARD_MIN_Y = -10_000_000;
  public static final double STANDARD_MAX_Y = 25_000_000;

  private static final CRSFactory CRS_FACTORY = new CRSFactory();
  private static final CoordinateTransformFactory TRANSFORM_FACTORY = new CoordinateTransformFactory();
  private static final String WGS84_PARAMS = "+proj=longlat +datum=WGS84 +no_defs";
  private static final int ENVELOPE_SAMPLES = 32;

  private final ProjectionSpec spec;
  private final Envelope limits;
  private final CoordinateTransform forward;
  private final CoordinateTransform inverse;

  private MapProjection(ProjectionSpec spec, Envelope limits) {
    this.spec = spec;
    this.limits = limits;
    CoordinateReferenceSystem wgs84 = CRS_FACTORY.createFromParameters("WGS84", WGS84_PARAMS);
    CoordinateReferenceSystem tm = CRS_FACTORY.createFromParameters("UTM " + spec.zone(), spec.toProj4());
    this.forward = TRANSFORM_FACTORY.createTransform(wgs84, tm);
    this.inverse = TRANSFORM_FACTORY.createTransform(tm, wgs84);
  }

  /** Returns a projection with the usual UTM zone limits. */
  public static MapProjection standard(ProjectionSpec spec) {
    return new MapProjection(spec, new Envelope(STANDARD_MIN_X, STANDARD_MAX_X, STANDARD_MIN_Y, STANDARD_MAX_Y));
  }

  /**
   * Returns a projection whose limits extend {@link #WIDENED_HALF_RANGE} in every direction from the false origin so
   * geometries that straddle zone boundaries are never truncated.
   */
  public static MapProjection unclipped(ProjectionSpec spec) {
    return new MapProjection(spec, new Envelope(
      spec.falseEasting() - WIDENED_HALF_RANGE,
      spec.falseEasting() + WIDENED_HALF_RANGE,
      spec.falseNorthing() - WIDENED_HALF_RANGE,
      spec.falseNorthing() + WIDENED_HALF_RANGE
    ));
  }

  public ProjectionSpec spec() {
    return spec;
  }

  public UtmZone zone() {
    return spec.zone();
  }

  /** Returns the rectangle of projected coordinates this projection considers valid. */
  public Envelope limits() {
    return new Envelope(limits);
  }

  /** Returns the width of {@link #limits()} in meters. */
  public double xRange() {
    return limits.getWidth();
  }

  /** Returns the height of {@link #limits()} in meters. */
  public double yRange() {
    return limits.getHeight();
  }

  /** Projects a single lon/lat point into planar meters. */
  public Coordinate project(double lon, double lat) {
    ProjCoordinate result = forward.transform(new ProjCoordinate(lon, lat), new ProjCoordinate());
    return new CoordinateXY(result.x, result.y);
  }

  /** Converts a single planar point back into lon/lat. */
  public Coordinate unproject(double x, double y) {
    ProjCoordinate result = inverse.transform(new ProjCoordinate(x, y), new ProjCoordinate());
    return new CoordinateXY(result.x, result.y);
  }

  /**
   * Projects every vertex of a lon/lat geometry and clips the result to {@link #limits()}.
   *
   * @throws GeometryException if a vertex cannot be projected or the clip fails
   */
  public Geometry project(Geometry lonLatGeometry) throws GeometryException {
    Geometry projected;
    try {
      projected = GeoUtils.transformCoordinates(lonLatGeometry, c -> project(c.x, c.y));
    } catch (Proj4jException e) {
      throw new GeometryException("projection_error", "unable to project geometry into UTM zone " + zone(), e);
    }
    return clipToLimits(projected);
  }

  /** Converts every vertex of a projected geometry back to lon/lat. */
  public Geometry unproject(Geometry projectedGeometry) throws GeometryException {
    try {
      return GeoUtils.transformCoordinates(projectedGeometry, c -> unproject(c.x, c.y));
    } catch (Proj4jException e) {
      throw new GeometryException("unprojection_error", "unable to unproject geometry from UTM zone " + zone(), e);
    }
  }

  /** Returns {@code projected} intersected with {@link #limits()}, or unchanged if it already fits. */
  public Geometry clipToLimits(Geometry projected) throws GeometryException {
    if (limits.contains(projected.getEnvelopeInternal())) {
      return projected;
    }
    Polygon limitsPolygon = GeoUtils.toPolygon(limits);
    try {
      return projected.intersection(limitsPolygon);
    } catch (RuntimeException e) {
      return GeoUtils.fixPolygon(projected).intersection(limitsPolygon);
    }
  }

  /**
   * Returns the lon/lat envelope covering a projected rectangle, found by unprojecting points along its edges.
   * <p>
   * Points outside of the inverse projection's domain are skipped and the result is limited to the world bounds.
   */
  public Envelope lonLatEnvelope(Envelope projected) {
    Envelope result = new Envelope();
    for (int i = 0; i <= ENVELOPE_SAMPLES; i++) {
      double fx = projected.getMinX() + projected.getWidth() * i / ENVELOPE_SAMPLES;
      double fy = projected.getMinY() + projected.getHeight() * i / ENVELOPE_SAMPLES;
      expandWithUnprojected(result, fx, projected.getMinY());
      expandWithUnprojected(result, fx, projected.getMaxY());
      expandWithUnprojected(result, projected.getMinX(), fy);
      expandWithUnprojected(result, projected.getMaxX(), fy);
    }
    return result.intersection(GeoUtils.WORLD_LAT_LON_BOUNDS);
  }

  private void expandWithUnprojected(Envelope envelope, double x, double y) {
    try {
      Coordinate c = unproject(x, y);
      if (Double.isFinite(c.x) && Double.isFinite(c.y)) {
        envelope.expandToInclude(c);
      }
    } catch (Proj4jException e) {
      LOGGER.trace("unable to unproject {},{}", x, y);
    }
  }

  @Override
  public String toString() {
    return "MapProjection{zone=" + zone() + ", limits=" + limits + "}";
  }
}
