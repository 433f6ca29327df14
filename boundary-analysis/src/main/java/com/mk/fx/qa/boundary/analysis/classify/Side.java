package com.mk.fx.qa.boundary.analysis.classify;

/** Position of an aggregate in a pairwise comparison; {@code B} is the baseline. */
public enum Side {
  A,
  B;

  public Side opposite() {
    return this == A ? B : A;
  }
}
