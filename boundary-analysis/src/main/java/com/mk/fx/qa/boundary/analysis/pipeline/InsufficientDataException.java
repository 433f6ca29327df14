package com.mk.fx.qa.boundary.analysis.pipeline;

import com.mk.fx.qa.boundary.analysis.model.ConditionKey;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.model.SkipReason;
import lombok.Getter;

/** Raised when a condition lacks the samples needed to compare both variants. */
@Getter
public class InsufficientDataException extends RuntimeException {

  private final ConditionKey condition;
  private final ProtocolVariant variant;
  private final SkipReason reason;

  public InsufficientDataException(
      ConditionKey condition, ProtocolVariant variant, SkipReason reason, String message) {
    super(message);
    this.condition = condition;
    this.variant = variant;
    this.reason = reason;
  }
}
