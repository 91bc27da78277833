package org.redlist.maps.geo;

import java.util.Locale;

/**
 * Parameters of a UTM-style transverse Mercator projection.
 *
 * @param zone            the zone these parameters were derived from
 * @param centralMeridian longitude of the projection's origin
 * @param scaleFactor     scale factor along the central meridian
 * @param falseEasting    value added to every x coordinate, in meters
 * @param falseNorthing   value added to every y coordinate, in meters
 */
public record ProjectionSpec(
  UtmZone zone,
  double centralMeridian,
  double scaleFactor,
  double falseEasting,
  double falseNorthing
) {

  public static final double UTM_SCALE_FACTOR = 0.9996;
  public static final double UTM_FALSE_EASTING = 500_000;
  public static final double UTM_SOUTH_FALSE_NORTHING = 10_000_000;

  /** Returns the standard UTM parameters for {@code zone}. */
  public static ProjectionSpec forZone(UtmZone zone) {
    return new ProjectionSpec(
      zone,
      zone.centralMeridian(),
      UTM_SCALE_FACTOR,
      UTM_FALSE_EASTING,
      zone.south() ? UTM_SOUTH_FALSE_NORTHING : 0
    );
  }

  /** Returns the standard UTM parameters for the zone containing {@code lon, lat}. */
  public static ProjectionSpec forLonLat(double lon, double lat) {
    return forZone(UtmZone.of(lon, lat));
  }

  public boolean south() {
    return zone.south();
  }

  /** Returns the EPSG code of the equivalent WGS84 / UTM coordinate reference system. */
  public int epsgCode() {
    return zone.epsgCode();
  }

  /** Returns the proj.4 parameter string describing this projection on the WGS84 ellipsoid. */
  public String toProj4() {
    return String.format(Locale.ROOT,
      "+proj=tmerc +lat_0=0 +lon_0=%s +k=%s +x_0=%s +y_0=%s +ellps=WGS84 +datum=WGS84 +units=m +no_defs",
      centralMeridian, scaleFactor, falseEasting, falseNorthing);
  }
}
