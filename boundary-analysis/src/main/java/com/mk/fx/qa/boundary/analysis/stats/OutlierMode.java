package com.mk.fx.qa.boundary.analysis.stats;

import java.util.Arrays;

/** How {@link OutlierFilter} derives the reference mean and deviation for each sample. */
public enum OutlierMode {
  /** Every sample is judged against the mean and deviation of the whole input. */
  FULL_SAMPLE,
  /**
   * Every sample is judged against the mean and deviation of the other samples. Tighter than
   * {@link #FULL_SAMPLE}: a sample kept here is always within bounds of the whole input too.
   */
  LEAVE_ONE_OUT;

  public static OutlierMode fromValue(String value) {
    return Arrays.stream(values())
        .filter(mode -> mode.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported outlier mode: " + value));
  }
}
