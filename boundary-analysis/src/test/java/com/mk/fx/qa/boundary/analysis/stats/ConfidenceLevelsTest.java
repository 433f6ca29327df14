package com.mk.fx.qa.boundary.analysis.stats;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ConfidenceLevelsTest {

  @Test
  void anchors_returnTabulatedValues() {
    assertEquals(0.674, ConfidenceLevels.zFor(0.50));
    assertEquals(1.28, ConfidenceLevels.zFor(0.80));
    assertEquals(1.645, ConfidenceLevels.zFor(0.90));
    assertEquals(1.96, ConfidenceLevels.zFor(0.95));
    assertEquals(2.58, ConfidenceLevels.zFor(0.99));
    assertEquals(3.29, ConfidenceLevels.zFor(0.999));
  }

  @Test
  void betweenAnchors_interpolatesLinearly() {
    assertEquals(1.4625, ConfidenceLevels.zFor(0.85), 1e-9);
  }

  @Test
  void mapping_isStrictlyIncreasing() {
    double previous = ConfidenceLevels.zFor(0.50);
    for (double c = 0.51; c <= 0.999; c += 0.01) {
      double z = ConfidenceLevels.zFor(c);
      assertTrue(z > previous, "z not increasing at " + c);
      previous = z;
    }
  }

  @Test
  void unsupportedLevels_areRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfidenceLevels.zFor(0.49));
    assertThrows(IllegalArgumentException.class, () -> ConfidenceLevels.zFor(1.0));
    assertThrows(IllegalArgumentException.class, () -> ConfidenceLevels.zFor(Double.NaN));
  }
}
