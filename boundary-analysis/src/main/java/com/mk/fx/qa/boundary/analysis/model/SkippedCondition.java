package com.mk.fx.qa.boundary.analysis.model;

import java.util.Objects;

/**
 * A condition left out of the registry for lack of data.
 *
 * @param variant the variant at fault, or null when it does not apply to one variant
 */
public record SkippedCondition(
    ConditionKey condition,
    Metric metric,
    ProtocolVariant variant,
    SkipReason reason,
    String message) {

  public SkippedCondition {
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(reason, "reason");
  }
}
