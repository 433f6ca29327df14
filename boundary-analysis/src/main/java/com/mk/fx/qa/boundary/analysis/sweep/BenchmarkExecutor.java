package com.mk.fx.qa.boundary.analysis.sweep;

import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;

/** Runs one benchmark trial for a variant under the condition currently applied. */
public interface BenchmarkExecutor {

  /**
   * @param condition handle proving the network shaping the trial runs under is in force
   * @throws TrialFailedException if the trial produced no usable measurement
   */
  TrialMeasurement execute(ProtocolVariant variant, AppliedCondition condition);
}
