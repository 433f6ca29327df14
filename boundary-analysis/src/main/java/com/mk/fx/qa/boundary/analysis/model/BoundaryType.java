package com.mk.fx.qa.boundary.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Category assigned to a condition after comparing both variants. */
public enum BoundaryType {
  /** The gap is too noisy to call and too wide to be a tie; no boundary. */
  NOT_SIGNIFICANT("not_significant"),
  /** Both variants perform within the crossover threshold of each other. */
  CLOSE_PERFORMANCE("close_performance"),
  /** The normally inferior variant is reliably ahead. */
  PERFORMANCE_CROSSOVER("performance_crossover"),
  /** The normally superior variant is reliably ahead. */
  STABLE_SUPERIOR("stable_superior");

  private final String value;

  BoundaryType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** True for the categories that mark a performance boundary. */
  public boolean isBoundary() {
    return this == CLOSE_PERFORMANCE || this == PERFORMANCE_CROSSOVER;
  }

  @JsonCreator
  public static BoundaryType fromValue(String value) {
    return Arrays.stream(values())
        .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported boundary type: " + value));
  }
}
