package com.mk.fx.qa.boundary.analysis.dto;

import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Raw samples of both variants under one condition. Leaving a variant out marks it as never
 * measured; an empty list marks a measurement round without usable trials.
 */
@Data
public class ConditionSamplesRequest {

  @NotNull @PositiveOrZero private Double delayMs;

  @NotNull @PositiveOrZero private Double lossPct;

  @NotNull @PositiveOrZero private Double bandwidthMbps;

  @NotNull private Map<ProtocolVariant, List<Double>> samples;
}
