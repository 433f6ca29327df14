package com.mk.fx.qa.boundary.analysis.dto;

import com.mk.fx.qa.boundary.analysis.model.Metric;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.model.SkipReason;
import lombok.Data;

@Data
public class SkippedConditionResponse {

  private double delayMs;
  private double lossPct;
  private double bandwidthMbps;
  private Metric metric;
  private ProtocolVariant variant;
  private SkipReason reason;
  private String message;
}
