package com.mk.fx.qa.boundary.analysis.stats;

import java.util.Objects;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether two aggregates of the same condition differ by more than noise.
 *
 * <p>Each aggregate contributes a margin of {@code z * stdDev}; the active {@link
 * SignificancePolicy} turns the combined margin into the gap the means must exceed. Only absolute
 * quantities are compared, so a zero mean is harmless. If the arithmetic produces a non-finite
 * value the comparison is reported as significant.
 */
@Slf4j
@Getter
public final class SignificanceTester {

  private final SignificancePolicy policy;

  public SignificanceTester(SignificancePolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public boolean isSignificant(Aggregate a, Aggregate b, double confidence) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    double z = ConfidenceLevels.zFor(confidence);
    double marginA = z * a.stdDev();
    double marginB = z * b.stdDev();
    double gap = Math.abs(a.mean() - b.mean());
    double required = policy.requiredGap(marginA + marginB);
    if (!Double.isFinite(gap) || !Double.isFinite(required)) {
      log.debug(
          "Non-finite significance inputs (gap={}, required={}), treating as significant",
          gap,
          required);
      return true;
    }
    return gap > required;
  }
}
