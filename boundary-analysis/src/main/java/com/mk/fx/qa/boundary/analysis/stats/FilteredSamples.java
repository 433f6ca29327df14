package com.mk.fx.qa.boundary.analysis.stats;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link OutlierFilter}: the retained samples together with the size of the unfiltered
 * input, so the aggregator can report both counts.
 *
 * @param retained samples kept (the whole input when {@code fallbackApplied})
 * @param totalCount number of samples before filtering
 * @param rejected samples that were dropped, in recording order
 * @param fallbackApplied true when too few samples survived and the input was kept as is
 */
public record FilteredSamples(
    SampleSet retained, int totalCount, List<Double> rejected, boolean fallbackApplied) {

  public FilteredSamples {
    Objects.requireNonNull(retained, "retained");
    rejected = List.copyOf(rejected);
    if (retained.size() > totalCount) {
      throw new IllegalArgumentException(
          "Retained " + retained.size() + " samples out of only " + totalCount);
    }
  }

  /** Wraps an input that was not filtered at all. */
  public static FilteredSamples unfiltered(SampleSet samples) {
    return new FilteredSamples(samples, samples.size(), List.of(), false);
  }

  public int validCount() {
    return retained.size();
  }
}
