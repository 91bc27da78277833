package org.redlist.maps.geo;

/**
 * A UTM zone number and hemisphere.
 *
 * @param zone  zone number in {@code [1, 60]}
 * @param south true for the southern hemisphere variant of the zone
 */
public record UtmZone(int zone, boolean south) {

  public static final int MIN_ZONE = 1;
  public static final int MAX_ZONE = 60;
  private static final int NORTH_EPSG_BASE = 32600;
  private static final int SOUTH_EPSG_BASE = 32700;

  public UtmZone {
    if (zone < MIN_ZONE || zone > MAX_ZONE) {
      throw new IllegalArgumentException("UTM zone must be in [1, 60], was " + zone);
    }
  }

  /**
   * Returns the zone that contains {@code lon, lat}.
   * <p>
   * Zone 1 starts at -180 degrees and each zone is 6 degrees wide. Longitudes outside of {@code [-180, 180]} are
   * clamped to the first or last zone, and latitudes below the equator select the southern variant. Special zones for
   * Norway and Svalbard are not handled.
   */
  public static UtmZone of(double lon, double lat) {
    // clamp before narrowing, a huge longitude would otherwise saturate the int cast
    int zone = (int) Math.max(MIN_ZONE, Math.min(MAX_ZONE, Math.floor((lon + 180) / 6) + 1));
    return new UtmZone(zone, lat < 0);
  }

  /** Returns the WGS84 / UTM EPSG code for this zone: 326zz in the north, 327zz in the south. */
  public int epsgCode() {
    return (south ? SOUTH_EPSG_BASE : NORTH_EPSG_BASE) + zone;
  }

  /** Returns the {@code EPSG:326zz} form of {@link #epsgCode()}. */
  public String crsCode() {
    return "EPSG:" + epsgCode();
  }

  /** Returns the longitude in the middle of this zone. */
  public double centralMeridian() {
    return (zone - 1) * 6d - 180 + 3;
  }

  /** Returns the hemisphere letter used in labels, {@code N} or {@code S}. */
  public char hemisphere() {
    return south ? 'S' : 'N';
  }

  @Override
  public String toString() {
    return zone + String.valueOf(hemisphere());
  }
}
