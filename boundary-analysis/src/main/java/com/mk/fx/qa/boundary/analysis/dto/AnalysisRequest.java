package com.mk.fx.qa.boundary.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.boundary.analysis.model.Metric;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Data;

/**
 * Request to analyse one metric across a set of conditions. Settings start from the named preset
 * (or the defaults) and any non-null field in {@code settings} overrides them.
 */
@Data
public class AnalysisRequest {

  @NotNull
  @JsonProperty("metric")
  private Metric metric;

  @JsonProperty("preset")
  private String preset;

  @Valid
  @JsonProperty("settings")
  private AnalysisSettingsRequest settings;

  @NotEmpty
  @Valid
  @JsonProperty("conditions")
  private List<ConditionSamplesRequest> conditions;
}
