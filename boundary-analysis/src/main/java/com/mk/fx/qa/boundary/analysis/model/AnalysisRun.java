package com.mk.fx.qa.boundary.analysis.model;

import com.mk.fx.qa.boundary.analysis.pipeline.AnalysisConfig;
import com.mk.fx.qa.boundary.analysis.report.BoundarySummary;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Frozen outcome of one analysis run.
 *
 * @param preset name of the preset the settings started from, null for the defaults
 */
public record AnalysisRun(
    UUID id,
    Instant createdAt,
    Metric metric,
    String preset,
    AnalysisConfig config,
    List<ComparisonResult> results,
    List<SkippedCondition> skipped,
    BoundarySummary summary) {

  public AnalysisRun {
    results = List.copyOf(results);
    skipped = List.copyOf(skipped);
  }
}
