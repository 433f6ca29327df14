package com.mk.fx.qa.boundary.analysis.model;

import java.util.Comparator;

/**
 * One emulated network scenario. Equality is exact numeric match; ordering is ascending by delay,
 * then loss, then bandwidth. A bandwidth of zero means the link is not rate limited.
 *
 * @param delayMs added one-way delay in milliseconds
 * @param lossPct packet loss in percent
 * @param bandwidthMbps bandwidth cap in Mbit/s, 0 for unlimited
 */
public record ConditionKey(double delayMs, double lossPct, double bandwidthMbps)
    implements Comparable<ConditionKey> {

  private static final Comparator<ConditionKey> ORDER =
      Comparator.comparingDouble(ConditionKey::delayMs)
          .thenComparingDouble(ConditionKey::lossPct)
          .thenComparingDouble(ConditionKey::bandwidthMbps);

  public ConditionKey {
    delayMs = requireNonNegative(delayMs, "delayMs");
    lossPct = requireNonNegative(lossPct, "lossPct");
    bandwidthMbps = requireNonNegative(bandwidthMbps, "bandwidthMbps");
  }

  public static ConditionKey of(double delayMs, double lossPct, double bandwidthMbps) {
    return new ConditionKey(delayMs, lossPct, bandwidthMbps);
  }

  public boolean bandwidthLimited() {
    return bandwidthMbps > 0;
  }

  @Override
  public int compareTo(ConditionKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "(" + delayMs + "ms, " + lossPct + "%, " + bandwidthMbps + "Mbps)";
  }

  private static double requireNonNegative(double value, String name) {
    if (!Double.isFinite(value) || value < 0) {
      throw new IllegalArgumentException(name + " must be a finite value >= 0 but was " + value);
    }
    // -0.0 and 0.0 must be the same condition
    return value == 0.0 ? 0.0 : value;
  }
}
