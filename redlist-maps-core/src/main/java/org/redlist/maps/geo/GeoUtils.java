package org.redlist.maps.geo;

import java.util.List;
import java.util.function.UnaryOperator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.impl.PackedCoordinateSequence;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;
import org.locationtech.jts.geom.util.GeometryTransformer;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKBWriter;

/**
 * A collection of utilities for working with JTS data structures and geographic data.
 * <p>
 * "lat/lon" geometries use x=longitude, y=latitude ordering throughout.
 */
public class GeoUtils {

  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);

  public static final Geometry EMPTY_GEOMETRY = JTS_FACTORY.createGeometryCollection();
  public static final Polygon EMPTY_POLYGON = JTS_FACTORY.createPolygon();
  private static final Polygon[] EMPTY_POLYGON_ARRAY = new Polygon[0];

  /** Bounds of the planet in lat/lon coordinates. */
  public static final Envelope WORLD_LAT_LON_BOUNDS = new Envelope(-180, 180, -90, 90);

  // should not instantiate
  private GeoUtils() {}

  /** Parses WKB bytes into a geometry using {@link #JTS_FACTORY}. */
  public static Geometry fromWkb(byte[] wkb) throws GeometryException {
    try {
      // WKBReader is not thread-safe
      return new WKBReader(JTS_FACTORY).read(wkb);
    } catch (ParseException | RuntimeException e) {
      throw new GeometryException("wkb_parse_error", "unable to parse " + wkb.length + " WKB bytes", e);
    }
  }

  /** Encodes {@code geometry} as 2D WKB. */
  public static byte[] toWkb(Geometry geometry) {
    return new WKBWriter(2).write(geometry);
  }

  public static Point point(double x, double y) {
    return JTS_FACTORY.createPoint(new CoordinateXY(x, y));
  }

  public static MultiPolygon createMultiPolygon(List<Polygon> polygon) {
    return JTS_FACTORY.createMultiPolygon(polygon.toArray(EMPTY_POLYGON_ARRAY));
  }

  /** Returns a rectangle polygon covering {@code envelope}. */
  public static Polygon toPolygon(Envelope envelope) {
    return (Polygon) JTS_FACTORY.toGeometry(envelope);
  }

  /**
   * Attempt to fix any self-intersections or overlaps in {@code geom}.
   *
   * @throws GeometryException if a robustness error occurred
   */
  public static Geometry fixPolygon(Geometry geom) throws GeometryException {
    try {
      return geom.buffer(0);
    } catch (TopologyException e) {
      throw new GeometryException("fix_polygon_topology_error", "robustness error fixing polygon: " + e);
    }
  }

  /**
   * Returns a copy of {@code geometry} with every vertex passed through {@code transform}.
   * <p>
   * Only x and y are kept; {@code transform} receives and returns a 2D coordinate.
   */
  public static Geometry transformCoordinates(Geometry geometry, UnaryOperator<Coordinate> transform) {
    return new GeometryTransformer() {
      @Override
      protected CoordinateSequence transformCoordinates(CoordinateSequence coords, Geometry parent) {
        CoordinateSequence copy = new PackedCoordinateSequence.Double(coords.size(), 2, 0);
        for (int i = 0; i < coords.size(); i++) {
          Coordinate result = transform.apply(new CoordinateXY(coords.getX(i), coords.getY(i)));
          copy.setOrdinate(i, 0, result.x);
          copy.setOrdinate(i, 1, result.y);
        }
        return copy;
      }
    }.transform(geometry);
  }

  /**
   * Returns {@code lonLat} with negative longitudes shifted east by 360 degrees when its envelope is more than 180
   * degrees wide, so a region split by the antimeridian becomes one contiguous shape. Other geometries are returned
   * unchanged.
   */
  public static Geometry shiftAcrossAntimeridian(Geometry lonLat) {
    if (lonLat.getEnvelopeInternal().getWidth() <= 180) {
      return lonLat;
    }
    return transformCoordinates(lonLat, c -> c.x < 0 ? new CoordinateXY(c.x + 360, c.y) : c);
  }
}
