package org.redlist.maps.reader;

import org.locationtech.jts.geom.Geometry;
import org.redlist.maps.geo.Extent;
import org.redlist.maps.geo.MapProjection;
import org.redlist.maps.geo.UtmZone;

/**
 * A region boundary ready to be drawn.
 *
 * @param code              the upper-case region code
 * @param lonLatGeometry    the boundary in WGS84 lon/lat
 * @param projectedGeometry the boundary in {@code projection}'s planar meters
 * @param extent            the padded map frame around {@code projectedGeometry}
 * @param projection        the projection selected from the boundary's centroid
 */
public record ResolvedBoundary(
  String code,
  Geometry lonLatGeometry,
  Geometry projectedGeometry,
  Extent extent,
  MapProjection projection
) {

  public UtmZone zone() {
    return projection.zone();
  }
}
