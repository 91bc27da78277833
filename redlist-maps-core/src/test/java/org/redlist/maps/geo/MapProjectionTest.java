package org.redlist.maps.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.redlist.maps.TestUtils.rectangle;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

class MapProjectionTest {

  @Test
  void testProjectionSpecForZone() {
    ProjectionSpec spec = ProjectionSpec.forLonLat(-105, 40);
    assertEquals(13, spec.zone().zone());
    assertEquals(-105, spec.centralMeridian());
    assertEquals(0.9996, spec.scaleFactor());
    assertEquals(500_000, spec.falseEasting());
    assertEquals(0, spec.falseNorthing());
    assertEquals(10_000_000, ProjectionSpec.forLonLat(-45, -10).falseNorthing());
  }

  @Test
  void testCentralMeridianProjectsToFalseEasting() {
    MapProjection projection = MapProjection.unclipped(ProjectionSpec.forLonLat(-105, 40));
    for (double lat : new double[]{-60, -10, 0, 10, 40, 70}) {
      assertEquals(500_000, projection.project(-105, lat).x, 1, "lat=" + lat);
    }
  }

  @Test
  void testSouthernHemisphereUsesFalseNorthing() {
    MapProjection projection = MapProjection.unclipped(ProjectionSpec.forLonLat(-45, -10));
    assertTrue(projection.spec().south());
    // the equator sits at the false northing, everything south of it below
    assertEquals(10_000_000, projection.project(-45, 0).y, 1e-3);
    Coordinate projected = projection.project(-45, -10);
    assertTrue(projected.y > 8_850_000, "northing " + projected.y);
    assertTrue(projected.y < 8_950_000, "northing " + projected.y);
  }

  @Test
  void testRoundTrip() {
    MapProjection projection = MapProjection.unclipped(ProjectionSpec.forLonLat(103.8, 1.3));
    Coordinate projected = projection.project(103.8, 1.3);
    Coordinate back = projection.unproject(projected.x, projected.y);
    assertEquals(103.8, back.x, 1e-6);
    assertEquals(1.3, back.y, 1e-6);
  }

  @Test
  void testWidenedLimitsAreAnOrderOfMagnitudeLarger() {
    ProjectionSpec spec = ProjectionSpec.forLonLat(-105, 40);
    MapProjection standard = MapProjection.standard(spec);
    MapProjection unclipped = MapProjection.unclipped(spec);
    assertTrue(unclipped.xRange() >= 10 * standard.xRange(),
      unclipped.xRange() + " vs " + standard.xRange());
    assertTrue(unclipped.limits().contains(standard.limits().getMinX(), 0));
    assertTrue(unclipped.limits().contains(standard.limits().getMaxX(), 0));
  }

  @Test
  void testStandardLimitsTruncateGeometryThatWidenedLimitsKeep() throws GeometryException {
    // 30 degrees wide, reaching 2.5 zones either side of zone 13
    Geometry wide = rectangle(-120, 35, -90, 45);
    ProjectionSpec spec = ProjectionSpec.forLonLat(-105, 40);

    Envelope clipped = MapProjection.standard(spec).project(wide).getEnvelopeInternal();
    Envelope full = MapProjection.unclipped(spec).project(wide).getEnvelopeInternal();

    assertTrue(clipped.getMaxX() <= MapProjection.STANDARD_MAX_X + 1e-6);
    assertTrue(full.getMaxX() > 1_500_000, "maxX " + full.getMaxX());
    assertTrue(full.getMinX() < -500_000, "minX " + full.getMinX());
    assertEquals(wide.getCoordinates().length, MapProjection.unclipped(spec).project(wide).getCoordinates().length);
  }

  @Test
  void testLonLatEnvelopeCoversProjectedRectangle() throws GeometryException {
    MapProjection projection = MapProjection.unclipped(ProjectionSpec.forLonLat(103.8, 1.3));
    Geometry singapore = rectangle(103.6, 1.2, 104.0, 1.5);
    Envelope projected = projection.project(singapore).getEnvelopeInternal();
    Envelope lonLat = projection.lonLatEnvelope(projected);
    assertTrue(lonLat.covers(new Envelope(103.6001, 103.9999, 1.2001, 1.4999)), lonLat.toString());
    assertTrue(lonLat.getWidth() < 1, lonLat.toString());
  }
}
