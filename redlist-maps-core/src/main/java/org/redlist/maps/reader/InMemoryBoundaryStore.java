package org.redlist.maps.reader;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.locationtech.jts.geom.Geometry;
import org.redlist.maps.geo.GeoUtils;

/**
 * A {@link BoundaryStore} backed by a map, for embedding callers that already hold their boundaries.
 */
public class InMemoryBoundaryStore implements BoundaryStore {

  private final Map<String, byte[]> boundaries = new TreeMap<>();

  /** Adds or replaces the boundary for {@code code}. Codes are stored lower-case. */
  public InMemoryBoundaryStore put(String code, byte[] wkb) {
    boundaries.put(code.toLowerCase(Locale.ROOT), wkb.clone());
    return this;
  }

  /** Adds or replaces the lon/lat boundary for {@code code}. */
  public InMemoryBoundaryStore put(String code, Geometry lonLatGeometry) {
    return put(code, GeoUtils.toWkb(lonLatGeometry));
  }

  @Override
  public byte[] wkb(String lowerCaseCode) throws NotFoundException {
    byte[] result = boundaries.get(lowerCaseCode);
    if (result == null) {
      throw new NotFoundException(lowerCaseCode);
    }
    return result.clone();
  }

  @Override
  public Set<String> codes() {
    return Set.copyOf(boundaries.keySet());
  }
}
