package com.mk.fx.qa.boundary.analysis.sweep;

import com.mk.fx.qa.boundary.analysis.model.ConditionKey;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/** Ordered, de-duplicated list of conditions to sweep. */
public final class ConditionPlan {

  private final List<ConditionKey> conditions;

  private ConditionPlan(Collection<ConditionKey> conditions) {
    this.conditions = List.copyOf(new TreeSet<>(conditions));
  }

  /** Every combination of the given delays, losses and bandwidths. */
  public static ConditionPlan grid(
      Collection<Double> delaysMs,
      Collection<Double> lossesPct,
      Collection<Double> bandwidthsMbps) {
    if (delaysMs.isEmpty() || lossesPct.isEmpty() || bandwidthsMbps.isEmpty()) {
      throw new IllegalArgumentException("Each grid axis needs at least one value");
    }
    TreeSet<ConditionKey> keys = new TreeSet<>();
    for (double delay : delaysMs) {
      for (double loss : lossesPct) {
        for (double bandwidth : bandwidthsMbps) {
          keys.add(new ConditionKey(delay, loss, bandwidth));
        }
      }
    }
    return new ConditionPlan(keys);
  }

  /** Delays from {@code fromMs} to {@code toMs} inclusive in {@code stepMs} increments. */
  public static ConditionPlan delaySweep(
      double fromMs, double toMs, double stepMs, double lossPct, double bandwidthMbps) {
    if (!(stepMs > 0) || toMs < fromMs) {
      throw new IllegalArgumentException(
          "Invalid delay sweep from " + fromMs + " to " + toMs + " step " + stepMs);
    }
    TreeSet<ConditionKey> keys = new TreeSet<>();
    long steps = (long) Math.floor((toMs - fromMs) / stepMs + 1e-9);
    for (long i = 0; i <= steps; i++) {
      keys.add(new ConditionKey(fromMs + i * stepMs, lossPct, bandwidthMbps));
    }
    return new ConditionPlan(keys);
  }

  public static ConditionPlan of(Collection<ConditionKey> conditions) {
    return new ConditionPlan(conditions);
  }

  public List<ConditionKey> conditions() {
    return conditions;
  }

  public int size() {
    return conditions.size();
  }
}
