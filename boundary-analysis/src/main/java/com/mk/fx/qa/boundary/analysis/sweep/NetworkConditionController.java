package com.mk.fx.qa.boundary.analysis.sweep;

import com.mk.fx.qa.boundary.analysis.model.ConditionKey;

/**
 * Applies delay, loss and bandwidth shaping to the shared test network. Only one condition can be
 * in force at a time.
 */
public interface NetworkConditionController {

  /**
   * @throws NetworkShapingException if the shaping could not be applied
   */
  AppliedCondition apply(ConditionKey condition);
}
