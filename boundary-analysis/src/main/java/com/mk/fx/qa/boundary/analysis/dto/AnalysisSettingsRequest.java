package com.mk.fx.qa.boundary.analysis.dto;

import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.stats.OutlierMode;
import com.mk.fx.qa.boundary.analysis.stats.SignificancePolicy;
import lombok.Data;

/** Optional per-request overrides; null fields keep the preset value. */
@Data
public class AnalysisSettingsRequest {

  private Double outlierK;
  private OutlierMode outlierMode;
  private Double confidence;
  private SignificancePolicy.Type significancePolicy;
  private Double relaxedRatioFactor;
  private Double crossoverThresholdPct;
  private Integer minValidSamples;
  private ProtocolVariant expectedSuperior;
}
