package com.mk.fx.qa.boundary.analysis.dto;

import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.model.Metric;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import lombok.Data;

/** Flattened comparison of both variants under one condition. */
@Data
public class ComparisonResultResponse {

  private double delayMs;
  private double lossPct;
  private double bandwidthMbps;
  private Metric metric;

  private double http2Mean;
  private double http2StdDev;
  private int http2ValidCount;
  private int http2TotalCount;

  private double http3Mean;
  private double http3StdDev;
  private int http3ValidCount;
  private int http3TotalCount;

  private double relativeDiffPct;
  private boolean significant;
  private BoundaryType boundaryType;
  private ProtocolVariant superiorVariant;
}
