package com.mk.fx.qa.boundary.analysis.dto;

import com.mk.fx.qa.boundary.analysis.cfg.AnalysisProperties;
import com.mk.fx.qa.boundary.analysis.model.Metric;
import com.mk.fx.qa.boundary.analysis.report.BoundarySummary;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Data;

/** Full analysis run: the settings applied, every comparison, skips and the summary. */
@Data
public class AnalysisRunResponse {

  private UUID id;
  private Instant createdAt;
  private Metric metric;
  private String preset;
  private AnalysisProperties.Settings settings;
  private List<ComparisonResultResponse> results;
  private List<SkippedConditionResponse> skipped;
  private BoundarySummary summary;
}
