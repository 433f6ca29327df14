package com.mk.fx.qa.boundary.analysis.classify;

import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.stats.Aggregate;
import java.util.Objects;

/**
 * Turns a significance decision and the signed relative difference into a {@link BoundaryType}.
 *
 * <p>The classifier only reasons about sign: a larger mean is better. Callers comparing a
 * lower-is-better metric pass negated aggregates (see {@link Aggregate#negated()}); the absolute
 * denominator in {@link #relativeDiffPct(double, double)} keeps the sign meaningful in that case.
 *
 * <p>The baseline of the relative difference is the normally inferior side, whichever argument
 * carries it. The difference is always signed as {@code a} over {@code b}, so swapping the
 * arguments together with {@code normallyInferior} negates it exactly.
 *
 * <table>
 *   <caption>Decision table (threshold comparison is inclusive)</caption>
 *   <tr><th>significant</th><th>|diff| &lt;= threshold</th><th>result</th></tr>
 *   <tr><td>no</td><td>no</td><td>NOT_SIGNIFICANT</td></tr>
 *   <tr><td>no</td><td>yes</td><td>CLOSE_PERFORMANCE</td></tr>
 *   <tr><td>yes</td><td>yes</td><td>CLOSE_PERFORMANCE</td></tr>
 *   <tr><td>yes</td><td>no</td><td>PERFORMANCE_CROSSOVER if the normally inferior side wins,
 *       else STABLE_SUPERIOR</td></tr>
 * </table>
 */
public final class BoundaryClassifier {

  public Classification classify(
      Aggregate a,
      Aggregate b,
      boolean significant,
      double crossoverThresholdPct,
      Side normallyInferior) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    Objects.requireNonNull(normallyInferior, "normallyInferior");
    if (!(crossoverThresholdPct >= 0) || Double.isInfinite(crossoverThresholdPct)) {
      throw new IllegalArgumentException(
          "Crossover threshold must be a finite value >= 0 but was " + crossoverThresholdPct);
    }

    double diff = signedDiffPct(a.mean(), b.mean(), normallyInferior);
    boolean withinThreshold = Math.abs(diff) <= crossoverThresholdPct;
    Side better = better(a.mean(), b.mean());

    if (!significant) {
      return withinThreshold
          ? new Classification(BoundaryType.CLOSE_PERFORMANCE, better, diff)
          : new Classification(BoundaryType.NOT_SIGNIFICANT, null, diff);
    }
    if (withinThreshold) {
      return new Classification(BoundaryType.CLOSE_PERFORMANCE, better, diff);
    }
    if (better == normallyInferior) {
      return new Classification(BoundaryType.PERFORMANCE_CROSSOVER, better, diff);
    }
    return new Classification(BoundaryType.STABLE_SUPERIOR, better, diff);
  }

  /**
   * Signed difference of {@code a} relative to baseline {@code b}, in percent. A zero baseline
   * yields an infinity carrying the sign of {@code a}, or zero when both are zero.
   */
  public static double relativeDiffPct(double a, double b) {
    if (b == 0.0) {
      return a == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, a);
    }
    return (a - b) / Math.abs(b) * 100.0;
  }

  private static double signedDiffPct(double a, double b, Side baseline) {
    return baseline == Side.B ? relativeDiffPct(a, b) : 0.0 - relativeDiffPct(b, a);
  }

  private static Side better(double a, double b) {
    if (a > b) return Side.A;
    if (b > a) return Side.B;
    return null;
  }
}
