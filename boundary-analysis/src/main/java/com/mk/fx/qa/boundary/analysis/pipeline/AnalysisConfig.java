package com.mk.fx.qa.boundary.analysis.pipeline;

import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.stats.ConfidenceLevels;
import com.mk.fx.qa.boundary.analysis.stats.OutlierMode;
import com.mk.fx.qa.boundary.analysis.stats.SignificancePolicy;
import java.util.Objects;
import lombok.Builder;

/**
 * Immutable parameters of one analysis run.
 *
 * @param outlierK standard-deviation multiplier for outlier removal
 * @param outlierMode how the outlier filter derives its reference statistics
 * @param confidence two-sided confidence level used for significance margins
 * @param significancePolicy gap rule applied to the combined margins
 * @param crossoverThresholdPct relative difference (percent, inclusive) still counted as close
 * @param minValidSamples fewest samples the outlier filter may leave before it falls back
 * @param expectedSuperior variant that normally wins; the other one winning is a crossover
 */
@Builder(toBuilder = true)
public record AnalysisConfig(
    double outlierK,
    OutlierMode outlierMode,
    double confidence,
    SignificancePolicy significancePolicy,
    double crossoverThresholdPct,
    int minValidSamples,
    ProtocolVariant expectedSuperior) {

  public AnalysisConfig {
    if (!Double.isFinite(outlierK) || outlierK <= 0) {
      throw new IllegalArgumentException("outlierK must be > 0 but was " + outlierK);
    }
    Objects.requireNonNull(outlierMode, "outlierMode");
    ConfidenceLevels.requireSupported(confidence);
    Objects.requireNonNull(significancePolicy, "significancePolicy");
    if (!Double.isFinite(crossoverThresholdPct) || crossoverThresholdPct < 0) {
      throw new IllegalArgumentException(
          "crossoverThresholdPct must be >= 0 but was " + crossoverThresholdPct);
    }
    if (minValidSamples < 1) {
      throw new IllegalArgumentException("minValidSamples must be >= 1 but was " + minValidSamples);
    }
    Objects.requireNonNull(expectedSuperior, "expectedSuperior");
  }

  /** Non-overlap at 95 % confidence with k = 2 and a 10 % crossover threshold. */
  public static AnalysisConfig defaults() {
    return new AnalysisConfig(
        2.0,
        OutlierMode.FULL_SAMPLE,
        0.95,
        SignificancePolicy.nonOverlap(),
        10.0,
        1,
        ProtocolVariant.HTTP2);
  }
}
