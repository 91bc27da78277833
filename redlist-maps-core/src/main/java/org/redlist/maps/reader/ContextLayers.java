package org.redlist.maps.reader;

import java.util.List;
import org.locationtech.jts.geom.Geometry;

/**
 * Lon/lat geometries drawn around the target region to give it geographic context.
 *
 * @param land      land polygons
 * @param ocean     ocean polygons
 * @param coastline coastline lines
 * @param borders   country border lines
 */
public record ContextLayers(
  List<Geometry> land,
  List<Geometry> ocean,
  List<Geometry> coastline,
  List<Geometry> borders
) {

  public static final ContextLayers EMPTY = new ContextLayers(List.of(), List.of(), List.of(), List.of());

  public ContextLayers {
    land = List.copyOf(land);
    ocean = List.copyOf(ocean);
    coastline = List.copyOf(coastline);
    borders = List.copyOf(borders);
  }

  public boolean isEmpty() {
    return land.isEmpty() && ocean.isEmpty() && coastline.isEmpty() && borders.isEmpty();
  }
}
