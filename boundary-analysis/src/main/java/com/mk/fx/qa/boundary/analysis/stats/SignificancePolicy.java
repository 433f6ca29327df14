package com.mk.fx.qa.boundary.analysis.stats;

import java.util.Arrays;

/**
 * Rule deciding how large the gap between two means must be, relative to their combined
 * confidence margin, before the difference counts as significant.
 */
public interface SignificancePolicy {

  enum Type {
    NON_OVERLAP,
    RELAXED_RATIO;

    public static Type fromValue(String value) {
      return Arrays.stream(values())
          .filter(type -> type.name().equalsIgnoreCase(value))
          .findFirst()
          .orElseThrow(
              () -> new IllegalArgumentException("Unsupported significance policy: " + value));
    }
  }

  Type type();

  /** Minimum gap (exclusive) between the two means for the given combined margin. */
  double requiredGap(double combinedMargin);

  static SignificancePolicy nonOverlap() {
    return new NonOverlap();
  }

  static SignificancePolicy relaxedRatio(double ratio) {
    return new RelaxedRatio(ratio);
  }

  static SignificancePolicy of(Type type, double relaxedRatioFactor) {
    return switch (type) {
      case NON_OVERLAP -> nonOverlap();
      case RELAXED_RATIO -> relaxedRatio(relaxedRatioFactor);
    };
  }

  /** Significant only when the two confidence intervals do not overlap at all. */
  record NonOverlap() implements SignificancePolicy {
    @Override
    public Type type() {
      return Type.NON_OVERLAP;
    }

    @Override
    public double requiredGap(double combinedMargin) {
      return combinedMargin;
    }
  }

  /** Significant when the gap exceeds {@code ratio} of the combined margin, overlap allowed. */
  record RelaxedRatio(double ratio) implements SignificancePolicy {
    public RelaxedRatio {
      if (!(ratio > 0 && ratio < 1)) {
        throw new IllegalArgumentException("Relaxed ratio must be in (0, 1) but was " + ratio);
      }
    }

    @Override
    public Type type() {
      return Type.RELAXED_RATIO;
    }

    @Override
    public double requiredGap(double combinedMargin) {
      return ratio * combinedMargin;
    }
  }
}
