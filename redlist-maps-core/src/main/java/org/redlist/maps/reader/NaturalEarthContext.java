package org.redlist.maps.reader;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.redlist.maps.geo.GeoUtils;
import org.redlist.maps.geo.GeometryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ContextSource} that reads land, ocean, coastline and country border layers from a Natural Earth sqlite
 * distribution.
 * <p>
 * Each layer is read from the most detailed table available the first time it is needed and kept in memory.
 */
public class NaturalEarthContext implements ContextSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(NaturalEarthContext.class);

  static final String LAND = "land";
  static final String OCEAN = "ocean";
  static final String COASTLINE = "coastline";
  static final String BORDERS = "admin_0_boundary_lines_land";

  private final NaturalEarthDatabase database;
  private final Map<String, List<Geometry>> themes = new ConcurrentHashMap<>();

  public NaturalEarthContext(NaturalEarthDatabase database) {
    this.database = database;
  }

  @Override
  public ContextLayers layers(Envelope lonLatEnvelope) {
    return new ContextLayers(
      clip(LAND, lonLatEnvelope),
      clip(OCEAN, lonLatEnvelope),
      clip(COASTLINE, lonLatEnvelope),
      clip(BORDERS, lonLatEnvelope)
    );
  }

  private List<Geometry> clip(String theme, Envelope lonLatEnvelope) {
    Polygon window = GeoUtils.toPolygon(lonLatEnvelope);
    List<Geometry> result = new ArrayList<>();
    for (Geometry geometry : themes.computeIfAbsent(theme, this::read)) {
      if (!geometry.getEnvelopeInternal().intersects(lonLatEnvelope)) {
        continue;
      }
      try {
        Geometry clipped = lonLatEnvelope.contains(geometry.getEnvelopeInternal()) ? geometry :
          intersect(geometry, window);
        if (!clipped.isEmpty()) {
          result.add(clipped);
        }
      } catch (GeometryException e) {
        e.log("Skipping " + theme + " geometry");
      }
    }
    return result;
  }

  private static Geometry intersect(Geometry geometry, Polygon window) throws GeometryException {
    try {
      return geometry.intersection(window);
    } catch (RuntimeException e) {
      return GeoUtils.fixPolygon(geometry).intersection(window);
    }
  }

  private List<Geometry> read(String theme) {
    try {
      Optional<String> table = database.mostDetailedTable(theme);
      if (table.isEmpty()) {
        LOGGER.warn("No ne_*_{} table found, context layer will be empty", theme);
        return List.of();
      }
      List<Geometry> result = new ArrayList<>();
      try (
        Statement statement = database.connection().createStatement();
        @SuppressWarnings("java:S2077") // table name checked against a regex
        ResultSet rs = statement.executeQuery("SELECT GEOMETRY FROM %s WHERE GEOMETRY IS NOT NULL;"
          .formatted(table.get()))
      ) {
        while (rs.next()) {
          try {
            result.add(GeoUtils.fromWkb(rs.getBytes(1)));
          } catch (GeometryException e) {
            e.log("Skipping " + table.get() + " row");
          }
        }
      }
      LOGGER.debug("Read {} geometries from {}", result.size(), table.get());
      return List.copyOf(result);
    } catch (SQLException e) {
      throw new IllegalStateException("Unable to read " + theme + " from Natural Earth", e);
    }
  }
}
