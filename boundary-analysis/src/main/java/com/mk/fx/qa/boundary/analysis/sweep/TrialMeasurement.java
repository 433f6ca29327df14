package com.mk.fx.qa.boundary.analysis.sweep;

import com.mk.fx.qa.boundary.analysis.model.Metric;

/** Headline numbers of one benchmark trial. */
public record TrialMeasurement(double throughputRps, double latencyMs) {

  /** True when both numbers are finite and non-negative. */
  public boolean isUsable() {
    return Double.isFinite(throughputRps)
        && Double.isFinite(latencyMs)
        && throughputRps >= 0
        && latencyMs >= 0;
  }

  public double valueOf(Metric metric) {
    return switch (metric) {
      case THROUGHPUT -> throughputRps;
      case LATENCY -> latencyMs;
    };
  }
}
