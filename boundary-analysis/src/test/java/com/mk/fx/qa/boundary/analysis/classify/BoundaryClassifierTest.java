package com.mk.fx.qa.boundary.analysis.classify;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.stats.Aggregate;
import org.junit.jupiter.api.Test;

class BoundaryClassifierTest {

  private static final double EPS = 1e-9;

  private final BoundaryClassifier classifier = new BoundaryClassifier();

  private static Aggregate agg(double mean) {
    return new Aggregate(mean, 1.0, 5, 5);
  }

  @Test
  void notSignificant_withinThreshold_isClosePerformance() {
    Classification c = classifier.classify(agg(105), agg(100), false, 10, Side.B);

    assertEquals(BoundaryType.CLOSE_PERFORMANCE, c.boundaryType());
    assertEquals(Side.A, c.superior());
    assertEquals(5.0, c.relativeDiffPct(), EPS);
  }

  @Test
  void notSignificant_beyondThreshold_isNotSignificant_withoutSuperior() {
    Classification c = classifier.classify(agg(150), agg(100), false, 10, Side.B);

    assertEquals(BoundaryType.NOT_SIGNIFICANT, c.boundaryType());
    assertTrue(c.superiorSide().isEmpty());
    assertEquals(50.0, c.relativeDiffPct(), EPS);
  }

  @Test
  void significant_withinThreshold_isClosePerformance() {
    Classification c = classifier.classify(agg(108), agg(100), true, 10, Side.B);

    assertEquals(BoundaryType.CLOSE_PERFORMANCE, c.boundaryType());
    assertEquals(Side.A, c.superior());
  }

  @Test
  void thresholdComparison_isInclusive() {
    Classification c = classifier.classify(agg(110), agg(100), true, 10, Side.B);

    assertEquals(BoundaryType.CLOSE_PERFORMANCE, c.boundaryType());
  }

  @Test
  void significant_beyondThreshold_expectedWinner_isStableSuperior() {
    Classification c = classifier.classify(agg(130), agg(100), true, 10, Side.B);

    assertEquals(BoundaryType.STABLE_SUPERIOR, c.boundaryType());
    assertEquals(Side.A, c.superior());
  }

  @Test
  void significant_beyondThreshold_normallyInferiorWinner_isCrossover() {
    Classification c = classifier.classify(agg(80), agg(100), true, 10, Side.B);

    assertEquals(BoundaryType.PERFORMANCE_CROSSOVER, c.boundaryType());
    assertEquals(Side.B, c.superior());
    assertEquals(-20.0, c.relativeDiffPct(), EPS);
  }

  @Test
  void crossover_alwaysNamesTheNormallyInferiorSide() {
    double[][] pairs = {{80, 100}, {130, 100}, {10, 1000}, {1000, 10}};
    for (Side inferior : Side.values()) {
      for (double[] p : pairs) {
        Classification c = classifier.classify(agg(p[0]), agg(p[1]), true, 10, inferior);
        if (c.boundaryType() == BoundaryType.PERFORMANCE_CROSSOVER) {
          assertEquals(inferior, c.superior());
        } else {
          assertEquals(BoundaryType.STABLE_SUPERIOR, c.boundaryType());
          assertEquals(inferior.opposite(), c.superior());
        }
      }
    }
  }

  @Test
  void exactTie_hasNoSuperior() {
    Classification c = classifier.classify(agg(100), agg(100), false, 10, Side.B);

    assertEquals(BoundaryType.CLOSE_PERFORMANCE, c.boundaryType());
    assertNull(c.superior());
    assertEquals(0.0, c.relativeDiffPct());
  }

  @Test
  void swappingSides_keepsTypeAndFlipsSuperiorAndSign() {
    double[][] pairs = {{80, 100}, {100, 104}, {150, 100}, {100, 100.5}};
    for (boolean significant : new boolean[] {true, false}) {
      for (double[] p : pairs) {
        Classification ab = classifier.classify(agg(p[0]), agg(p[1]), significant, 10, Side.B);
        Classification ba = classifier.classify(agg(p[1]), agg(p[0]), significant, 10, Side.A);

        assertEquals(ab.boundaryType(), ba.boundaryType());
        assertEquals(Math.signum(ab.relativeDiffPct()), -Math.signum(ba.relativeDiffPct()));
        if (ab.superior() != null) {
          assertEquals(ab.superior().opposite(), ba.superior());
        } else {
          assertNull(ba.superior());
        }
      }
    }
  }

  @Test
  void swappingSides_nearThreshold_keepsTypeAndNegatesDiffExactly() {
    double[][] pairs = {{111, 100}, {100, 111}, {109.5, 100}, {100, 90.5}, {5, 0}};
    for (boolean significant : new boolean[] {true, false}) {
      for (double[] p : pairs) {
        Classification ab = classifier.classify(agg(p[0]), agg(p[1]), significant, 10, Side.B);
        Classification ba = classifier.classify(agg(p[1]), agg(p[0]), significant, 10, Side.A);

        assertEquals(ab.boundaryType(), ba.boundaryType());
        assertEquals(ab.relativeDiffPct(), -ba.relativeDiffPct(), EPS);
      }
    }
  }

  @Test
  void baseline_isTheNormallyInferiorSide() {
    Classification c = classifier.classify(agg(111), agg(100), true, 10, Side.B);
    Classification swapped = classifier.classify(agg(100), agg(111), true, 10, Side.A);

    assertEquals(BoundaryType.STABLE_SUPERIOR, c.boundaryType());
    assertEquals(11.0, c.relativeDiffPct(), EPS);
    assertEquals(BoundaryType.STABLE_SUPERIOR, swapped.boundaryType());
    assertEquals(Side.B, swapped.superior());
    assertEquals(-11.0, swapped.relativeDiffPct(), EPS);
  }

  @Test
  void negatedLatency_lowerRawValueWins() {
    // 100 ms against 50 ms, oriented by negation
    Classification c =
        classifier.classify(agg(100).negated(), agg(50).negated(), true, 10, Side.B);

    assertEquals(-100.0, c.relativeDiffPct(), EPS);
    assertEquals(Side.B, c.superior());
    assertEquals(BoundaryType.PERFORMANCE_CROSSOVER, c.boundaryType());
  }

  @Test
  void relativeDiff_withZeroBaseline_isSignedInfinity() {
    assertEquals(Double.POSITIVE_INFINITY, BoundaryClassifier.relativeDiffPct(5, 0));
    assertEquals(Double.NEGATIVE_INFINITY, BoundaryClassifier.relativeDiffPct(-5, 0));
    assertEquals(0.0, BoundaryClassifier.relativeDiffPct(0, 0));
  }

  @Test
  void zeroBaseline_classifiesBeyondAnyThreshold() {
    Classification c = classifier.classify(agg(5), agg(0), true, 10, Side.B);

    assertEquals(BoundaryType.STABLE_SUPERIOR, c.boundaryType());
  }

  @Test
  void invalidThreshold_isRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> classifier.classify(agg(1), agg(1), true, -1, Side.B));
    assertThrows(
        IllegalArgumentException.class,
        () -> classifier.classify(agg(1), agg(1), true, Double.NaN, Side.B));
  }
}
