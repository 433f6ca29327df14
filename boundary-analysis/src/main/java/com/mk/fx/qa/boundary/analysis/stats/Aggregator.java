package com.mk.fx.qa.boundary.analysis.stats;

import java.util.Objects;

/** Reduces filtered samples to an {@link Aggregate}. Stateless and deterministic. */
public final class Aggregator {

  public Aggregate aggregate(FilteredSamples filtered) {
    Objects.requireNonNull(filtered, "filtered");
    SampleSet retained = filtered.retained();
    if (retained.isEmpty()) {
      throw new IllegalArgumentException("Cannot aggregate an empty sample set");
    }
    double[] values = retained.toArray();
    double mean = Moments.mean(values);
    double std = Moments.populationStdDev(values, mean);
    return new Aggregate(mean, std, values.length, filtered.totalCount());
  }
}
