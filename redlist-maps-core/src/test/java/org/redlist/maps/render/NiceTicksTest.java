package org.redlist.maps.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class NiceTicksTest {

  @Test
  void testRoundSteps() {
    assertEquals(List.of(0d, 2d, 4d, 6d, 8d, 10d), NiceTicks.ticks(0, 10));
    assertEquals(List.of(0d, 20d, 40d, 60d, 80d, 100d), NiceTicks.ticks(-3, 103));
    assertEquals(10_000, NiceTicks.step(337_000, 389_000, 6), 1e-9);
  }

  @Test
  void testAtMostBinsPlusOneTicks() {
    double[][] ranges = {{0, 1}, {337_123, 388_456}, {8_150_000, 8_420_000}, {-1e6, 1e6}, {0.001, 0.0013}};
    for (double[] range : ranges) {
      List<Double> ticks = NiceTicks.ticks(range[0], range[1]);
      assertTrue(ticks.size() <= NiceTicks.DEFAULT_BINS + 1, ticks.toString());
      assertTrue(ticks.size() >= 2, ticks.toString());
      for (double tick : ticks) {
        assertTrue(tick >= range[0] - 1e-9 && tick <= range[1] + 1e-9, tick + " outside " + range[0] + "-" +
          range[1]);
      }
    }
  }

  @Test
  void testEmptyRange() {
    assertEquals(List.of(5d), NiceTicks.ticks(5, 5));
  }
}
