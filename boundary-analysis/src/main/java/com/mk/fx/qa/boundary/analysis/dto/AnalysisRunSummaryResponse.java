package com.mk.fx.qa.boundary.analysis.dto;

import com.mk.fx.qa.boundary.analysis.model.Metric;
import java.time.Instant;
import java.util.UUID;
import lombok.Data;

/** History entry for an analysis run. */
@Data
public class AnalysisRunSummaryResponse {

  private UUID id;
  private Instant createdAt;
  private Metric metric;
  private String preset;
  private int comparedConditions;
  private int skippedConditions;
  private int boundaryCount;
}
