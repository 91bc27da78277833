package org.redlist.maps.reader;

import java.util.Locale;
import java.util.regex.Pattern;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.redlist.maps.geo.Extent;
import org.redlist.maps.geo.GeoUtils;
import org.redlist.maps.geo.GeometryException;
import org.redlist.maps.geo.MapProjection;
import org.redlist.maps.geo.ProjectionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a region code into a {@link ResolvedBoundary}: validates the code, loads its boundary from a
 * {@link BoundaryStore}, picks a UTM zone from the boundary's centroid, projects the boundary and pads its bounds
 * into a map frame.
 * <p>
 * Boundaries crossing the antimeridian are made contiguous before the zone is picked. The returned
 * {@link ResolvedBoundary#lonLatGeometry()} keeps the stored coordinates.
 * <p>
 * Nothing is cached between calls.
 */
public class BoundaryResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(BoundaryResolver.class);
  private static final Pattern REGION_CODE = Pattern.compile("^[A-Za-z]{2}$");

  private final BoundaryStore store;

  public BoundaryResolver(BoundaryStore store) {
    this.store = store;
  }

  /**
   * Checks that {@code regionCode} is a 2-letter code and returns it upper-cased.
   * <p>
   * Checks run in order: the value must be a {@link CharSequence}, must not be blank, then must match
   * {@code ^[A-Za-z]{2}$}. Surrounding whitespace is not trimmed.
   *
   * @throws RegionCodeTypeException    if {@code regionCode} is not text
   * @throws InvalidRegionCodeException if {@code regionCode} is blank or not 2 letters
   */
  public static String validate(Object regionCode) {
    if (!(regionCode instanceof CharSequence chars)) {
      throw new RegionCodeTypeException(regionCode);
    }
    String code = chars.toString();
    if (code.isBlank()) {
      throw InvalidRegionCodeException.empty(code);
    }
    if (!REGION_CODE.matcher(code).matches()) {
      throw InvalidRegionCodeException.badPattern(code);
    }
    return code.toUpperCase(Locale.ROOT);
  }

  /**
   * Resolves the boundary and map frame for {@code regionCode}.
   *
   * @throws RegionCodeTypeException    if {@code regionCode} is not text
   * @throws InvalidRegionCodeException if {@code regionCode} is blank or not 2 letters
   * @throws RegionNotFoundException    if the store has no boundary for the code
   * @throws GeometryException          if the stored boundary cannot be parsed or projected
   */
  public ResolvedBoundary resolve(Object regionCode) throws GeometryException {
    String code = validate(regionCode);
    byte[] wkb;
    try {
      wkb = store.wkb(code.toLowerCase(Locale.ROOT));
    } catch (BoundaryStore.NotFoundException e) {
      throw new RegionNotFoundException(code, e);
    }
    Geometry lonLat = GeoUtils.fromWkb(wkb);
    if (lonLat.isEmpty()) {
      throw new GeometryException("empty_boundary", "Boundary for " + code + " is empty");
    }

    Geometry contiguous = GeoUtils.shiftAcrossAntimeridian(lonLat);
    if (contiguous != lonLat) {
      LOGGER.debug("{} crosses the antimeridian, shifting western longitudes by 360 degrees", code);
    }
    Point centroid = contiguous.getCentroid();
    MapProjection projection = MapProjection.unclipped(ProjectionSpec.forLonLat(centroid.getX(), centroid.getY()));
    Geometry projected = checkProjected(code, projection.project(contiguous));
    Extent extent = Extent.padded(projected.getEnvelopeInternal());
    LOGGER.debug("{} projected bounds {} in UTM zone {}", code, projected.getEnvelopeInternal(), projection.zone());
    LOGGER.info("Resolved {} in UTM zone {} with frame [{}, {}, {}, {}]", code, projection.zone(),
      Math.round(extent.minX()), Math.round(extent.maxX()), Math.round(extent.minY()), Math.round(extent.maxY()));
    return new ResolvedBoundary(code, lonLat, projected, extent, projection);
  }

  /**
   * Returns {@code projected} if it can frame a map.
   *
   * @throws GeometryException if it is empty or its bounds are not finite
   */
  static Geometry checkProjected(String code, Geometry projected) throws GeometryException {
    if (projected.isEmpty()) {
      throw new GeometryException("empty_projection", "Boundary for " + code + " is empty after projection");
    }
    Envelope bounds = projected.getEnvelopeInternal();
    if (!Double.isFinite(bounds.getMinX()) || !Double.isFinite(bounds.getMaxX()) ||
      !Double.isFinite(bounds.getMinY()) || !Double.isFinite(bounds.getMaxY())) {
      throw new GeometryException("non_finite_projection", "Boundary for " + code + " has non-finite bounds " +
        bounds + " after projection");
    }
    return projected;
  }
}
