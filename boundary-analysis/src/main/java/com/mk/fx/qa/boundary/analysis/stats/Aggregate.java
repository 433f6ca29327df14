package com.mk.fx.qa.boundary.analysis.stats;

/**
 * Point estimate for one variant under one condition.
 *
 * @param mean arithmetic mean of the retained samples
 * @param stdDev population standard deviation of the retained samples
 * @param validCount number of retained samples, never zero
 * @param totalCount number of samples before outlier removal
 */
public record Aggregate(double mean, double stdDev, int validCount, int totalCount) {

  public Aggregate {
    if (validCount < 1) {
      throw new IllegalArgumentException("validCount must be >= 1 but was " + validCount);
    }
    if (validCount > totalCount) {
      throw new IllegalArgumentException(
          "validCount " + validCount + " exceeds totalCount " + totalCount);
    }
    if (stdDev < 0) {
      throw new IllegalArgumentException("stdDev must be >= 0 but was " + stdDev);
    }
  }

  /** Same estimate with the sign of the mean flipped, for lower-is-better metrics. */
  public Aggregate negated() {
    return new Aggregate(-mean, stdDev, validCount, totalCount);
  }

  public int rejectedCount() {
    return totalCount - validCount;
  }
}
