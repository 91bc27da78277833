package org.redlist.maps.compute;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.redlist.maps.geo.GeoUtils;
import org.redlist.maps.geo.GeometryException;

/**
 * Conversions between JTS geometries and remote compute geometries.
 * <p>
 * Geometries sent to the compute service are always lon/lat: it does not accept multipolygons in a projected
 * coordinate system.
 */
public class Geometries {

  private Geometries() {}

  /** Returns an expression that constructs the lon/lat polygon or multipolygon {@code lonLat} remotely. */
  public static Expression toExpression(Geometry lonLat) {
    List<List<List<double[]>>> polygons = new ArrayList<>();
    for (int i = 0; i < lonLat.getNumGeometries(); i++) {
      if (lonLat.getGeometryN(i) instanceof Polygon polygon && !polygon.isEmpty()) {
        polygons.add(rings(polygon));
      }
    }
    if (polygons.isEmpty()) {
      throw new IllegalArgumentException("Expected a polygon or multipolygon, got " + lonLat.getGeometryType());
    }
    return Expression.invoke("GeometryConstructors.MultiPolygon", "coordinates", polygons);
  }

  private static List<List<double[]>> rings(Polygon polygon) {
    List<List<double[]>> rings = new ArrayList<>();
    rings.add(coordinates(polygon.getExteriorRing()));
    for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
      rings.add(coordinates(polygon.getInteriorRingN(i)));
    }
    return rings;
  }

  private static List<double[]> coordinates(LineString line) {
    List<double[]> result = new ArrayList<>(line.getNumPoints());
    for (Coordinate c : line.getCoordinates()) {
      result.add(new double[]{c.x, c.y});
    }
    return result;
  }

  /**
   * Parses a GeoJSON geometry returned by the compute service.
   *
   * @throws GeometryException if the type is not supported or the coordinates are malformed
   */
  public static Geometry fromGeoJson(JsonNode node) throws GeometryException {
    String type = node.path("type").asText();
    JsonNode coords = node.path("coordinates");
    try {
      return switch (type) {
        case "Point" -> GeoUtils.JTS_FACTORY.createPoint(coordinate(coords));
        case "LineString" -> GeoUtils.JTS_FACTORY.createLineString(coordinateArray(coords));
        case "Polygon" -> polygon(coords);
        case "MultiPolygon" -> {
          List<Polygon> polygons = new ArrayList<>();
          for (JsonNode polygon : coords) {
            polygons.add(polygon(polygon));
          }
          yield GeoUtils.createMultiPolygon(polygons);
        }
        case "GeometryCollection" -> {
          List<Geometry> parts = new ArrayList<>();
          for (JsonNode part : node.path("geometries")) {
            parts.add(fromGeoJson(part));
          }
          yield GeoUtils.JTS_FACTORY.buildGeometry(parts);
        }
        default -> throw new GeometryException("geojson_unsupported_type", "Unsupported GeoJSON type: " + type);
      };
    } catch (IllegalArgumentException e) {
      throw new GeometryException("geojson_malformed", "Malformed GeoJSON " + type, e);
    }
  }

  private static Polygon polygon(JsonNode rings) {
    if (rings.isEmpty()) {
      return GeoUtils.EMPTY_POLYGON;
    }
    LinearRing shell = GeoUtils.JTS_FACTORY.createLinearRing(coordinateArray(rings.get(0)));
    LinearRing[] holes = new LinearRing[rings.size() - 1];
    for (int i = 1; i < rings.size(); i++) {
      holes[i - 1] = GeoUtils.JTS_FACTORY.createLinearRing(coordinateArray(rings.get(i)));
    }
    return GeoUtils.JTS_FACTORY.createPolygon(shell, holes);
  }

  private static Coordinate[] coordinateArray(JsonNode points) {
    Coordinate[] result = new Coordinate[points.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = coordinate(points.get(i));
    }
    return result;
  }

  private static Coordinate coordinate(JsonNode point) {
    if (point.size() < 2) {
      throw new IllegalArgumentException("Expected [x, y] but got " + point);
    }
    return new CoordinateXY(point.get(0).asDouble(), point.get(1).asDouble());
  }
}
