package com.mk.fx.qa.boundary.analysis.report;

import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import java.util.Map;

/**
 * Run-level overview of a registry, consumed by report and chart generators.
 *
 * @param totalConditions compared plus skipped conditions
 * @param boundaryCount close-performance plus crossover conditions
 * @param diffStats relative difference statistics over boundary conditions with a finite
 *     difference, null when there are none
 * @param delayRange delay statistics over boundary conditions, null when there are none
 * @param meanStdDevByVariant average measurement standard deviation per variant
 */
public record BoundarySummary(
    int totalConditions,
    int comparedConditions,
    int skippedConditions,
    Map<BoundaryType, Long> countsByType,
    int boundaryCount,
    DiffStats diffStats,
    DelayRange delayRange,
    Map<ProtocolVariant, Double> meanStdDevByVariant) {

  public BoundarySummary {
    countsByType = Map.copyOf(countsByType);
    meanStdDevByVariant = Map.copyOf(meanStdDevByVariant);
  }

  public long count(BoundaryType type) {
    return countsByType.getOrDefault(type, 0L);
  }

  /** {@code finiteCount} is the number of boundary conditions the statistics cover. */
  public record DiffStats(
      double avgPct, double minPct, double maxPct, double stdDevPct, int finiteCount) {}

  public record DelayRange(double minMs, double maxMs, double avgMs) {}
}
