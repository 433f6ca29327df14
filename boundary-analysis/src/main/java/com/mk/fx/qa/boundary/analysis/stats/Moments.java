package com.mk.fx.qa.boundary.analysis.stats;

/** Mean and population standard deviation shared by the filter and the aggregator. */
final class Moments {

  private Moments() {
    // Utility class, no instantiation
  }

  static double mean(double[] values) {
    double sum = 0.0;
    for (double v : values) {
      sum += v;
    }
    return sum / values.length;
  }

  /** Square root of the mean squared deviation (divides by n, not n - 1). */
  static double populationStdDev(double[] values, double mean) {
    double acc = 0.0;
    for (double v : values) {
      double d = v - mean;
      acc += d * d;
    }
    return Math.sqrt(acc / values.length);
  }
}
