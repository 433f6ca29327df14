package com.mk.fx.qa.boundary.analysis.model;

import java.util.Arrays;

/** Measured quantity and the direction in which it improves. */
public enum Metric {
  THROUGHPUT("req/s", true),
  LATENCY("ms", false);

  private final String unit;
  private final boolean higherIsBetter;

  Metric(String unit, boolean higherIsBetter) {
    this.unit = unit;
    this.higherIsBetter = higherIsBetter;
  }

  public String unit() {
    return unit;
  }

  public boolean higherIsBetter() {
    return higherIsBetter;
  }

  public static Metric fromValue(String value) {
    return Arrays.stream(values())
        .filter(m -> m.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported metric: " + value));
  }
}
