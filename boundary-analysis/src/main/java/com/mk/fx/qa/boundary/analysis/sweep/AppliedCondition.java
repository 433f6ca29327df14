package com.mk.fx.qa.boundary.analysis.sweep;

import com.mk.fx.qa.boundary.analysis.model.ConditionKey;

/**
 * Handle to network shaping that is currently in force. Holding it is what allows benchmark trials
 * to run under {@link #condition()}; closing it clears the shaping.
 */
public interface AppliedCondition extends AutoCloseable {

  ConditionKey condition();

  @Override
  void close();
}
