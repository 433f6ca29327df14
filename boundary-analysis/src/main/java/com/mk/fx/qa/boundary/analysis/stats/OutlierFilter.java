package com.mk.fx.qa.boundary.analysis.stats;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Drops samples lying more than {@code k} standard deviations away from the mean.
 *
 * <p>The reference mean and population deviation are computed once over the unfiltered input (no
 * iterative re-filtering). When fewer than {@code minValidSamples} samples survive, the original
 * input is returned unchanged and the result is flagged as a fallback, so a non-empty input never
 * yields an empty output.
 */
@Slf4j
@Getter
public final class OutlierFilter {

  public static final int DEFAULT_MIN_VALID_SAMPLES = 1;

  private final OutlierMode mode;
  private final int minValidSamples;

  public OutlierFilter() {
    this(OutlierMode.FULL_SAMPLE, DEFAULT_MIN_VALID_SAMPLES);
  }

  public OutlierFilter(OutlierMode mode, int minValidSamples) {
    this.mode = Objects.requireNonNull(mode, "mode");
    if (minValidSamples < 1) {
      throw new IllegalArgumentException("minValidSamples must be >= 1 but was " + minValidSamples);
    }
    this.minValidSamples = minValidSamples;
  }

  /**
   * Filters {@code samples} with multiplier {@code k}.
   *
   * @throws IllegalArgumentException if {@code samples} is empty or {@code k} is not a positive
   *     finite number
   */
  public FilteredSamples filter(SampleSet samples, double k) {
    Objects.requireNonNull(samples, "samples");
    if (samples.isEmpty()) {
      throw new IllegalArgumentException("Cannot filter an empty sample set");
    }
    if (!Double.isFinite(k) || k <= 0) {
      throw new IllegalArgumentException("Outlier multiplier k must be > 0 but was " + k);
    }

    double[] values = samples.toArray();
    double mean = Moments.mean(values);
    double std = Moments.populationStdDev(values, mean);
    SampleSet.Builder kept = SampleSet.builder();
    List<Double> rejected = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      boolean keep =
          mode == OutlierMode.FULL_SAMPLE
              ? Math.abs(values[i] - mean) <= k * std
              : withinLeaveOneOutBounds(values, i, k);
      if (keep) {
        kept.add(values[i]);
      } else {
        rejected.add(values[i]);
      }
    }

    if (kept.size() < minValidSamples) {
      log.warn(
          "Insufficient valid samples after outlier removal ({}/{}), keeping all samples",
          kept.size(),
          values.length);
      return new FilteredSamples(samples, values.length, List.of(), true);
    }
    if (!rejected.isEmpty()) {
      log.info(
          "Outliers removed: {} (mode={}, k={}, kept {}/{})",
          rejected,
          mode,
          k,
          kept.size(),
          values.length);
    }
    return new FilteredSamples(kept.build(), values.length, rejected, false);
  }

  @VisibleForTesting
  static boolean withinLeaveOneOutBounds(double[] values, int index, double k) {
    if (values.length == 1) {
      return true;
    }
    double[] others = new double[values.length - 1];
    for (int i = 0, j = 0; i < values.length; i++) {
      if (i != index) {
        others[j++] = values[i];
      }
    }
    double mean = Moments.mean(others);
    double std = Moments.populationStdDev(others, mean);
    return Math.abs(values[index] - mean) <= k * std;
  }
}
