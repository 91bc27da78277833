package org.redlist.maps.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

class ExtentTest {

  @Test
  void testPadsFifteenPercentOfEachAxis() {
    Extent extent = Extent.padded(new Envelope(0, 1000, 0, 200));
    assertEquals(-150, extent.minX(), 1e-9);
    assertEquals(1150, extent.maxX(), 1e-9);
    assertEquals(-30, extent.minY(), 1e-9);
    assertEquals(230, extent.maxY(), 1e-9);
    assertEquals(1300, extent.width(), 1e-9);
    assertEquals(260, extent.height(), 1e-9);
  }

  @Test
  void testPaddedExtentContainsBounds() {
    Envelope bounds = new Envelope(350_000, 420_000, 130_000, 170_000);
    Extent extent = Extent.padded(bounds);
    assertTrue(extent.maxX() > extent.minX());
    assertTrue(extent.maxY() > extent.minY());
    assertTrue(extent.toEnvelope().contains(bounds));
    assertTrue(extent.minX() < bounds.getMinX());
    assertTrue(extent.maxY() > bounds.getMaxY());
  }

  @Test
  void testCustomFraction() {
    Extent extent = Extent.padded(new Envelope(0, 10, 0, 10), 0.5);
    assertEquals(new Extent(-5, 15, -5, 15), extent);
  }

  @Test
  void testRejectsInvertedOrNaNBounds() {
    assertThrows(IllegalArgumentException.class, () -> new Extent(10, 0, 0, 10));
    assertThrows(IllegalArgumentException.class, () -> new Extent(0, 10, 10, 0));
    assertThrows(IllegalArgumentException.class, () -> new Extent(Double.NaN, 10, 0, 10));
    assertThrows(IllegalArgumentException.class, () -> Extent.padded(new Envelope()));
  }
}
