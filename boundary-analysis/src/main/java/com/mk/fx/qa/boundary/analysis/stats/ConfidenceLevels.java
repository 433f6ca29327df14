package com.mk.fx.qa.boundary.analysis.stats;

/**
 * Maps a two-sided confidence level to the normal z-multiplier used for confidence margins.
 *
 * <p>Exact anchors: 0.50 → 0.674, 0.80 → 1.28, 0.90 → 1.645, 0.95 → 1.96, 0.99 → 2.58, 0.999 →
 * 3.29. Values between anchors are linearly interpolated, so the mapping is strictly increasing.
 */
public final class ConfidenceLevels {

  public static final double MIN_CONFIDENCE = 0.50;
  public static final double MAX_CONFIDENCE = 0.999;

  private static final double[] LEVELS = {0.50, 0.80, 0.90, 0.95, 0.99, 0.999};
  private static final double[] Z_VALUES = {0.674, 1.28, 1.645, 1.96, 2.58, 3.29};

  private ConfidenceLevels() {
    // Utility class, no instantiation
  }

  /**
   * Returns the z-multiplier for {@code confidence}.
   *
   * @throws IllegalArgumentException if confidence lies outside [0.50, 0.999]
   */
  public static double zFor(double confidence) {
    requireSupported(confidence);
    for (int i = 0; i < LEVELS.length; i++) {
      if (confidence == LEVELS[i]) {
        return Z_VALUES[i];
      }
      if (confidence < LEVELS[i]) {
        double fraction = (confidence - LEVELS[i - 1]) / (LEVELS[i] - LEVELS[i - 1]);
        return Z_VALUES[i - 1] + fraction * (Z_VALUES[i] - Z_VALUES[i - 1]);
      }
    }
    return Z_VALUES[Z_VALUES.length - 1];
  }

  public static void requireSupported(double confidence) {
    if (!(confidence >= MIN_CONFIDENCE && confidence <= MAX_CONFIDENCE)) {
      throw new IllegalArgumentException(
          "Confidence must be within ["
              + MIN_CONFIDENCE
              + ", "
              + MAX_CONFIDENCE
              + "] but was "
              + confidence);
    }
  }
}
