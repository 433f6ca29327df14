package com.mk.fx.qa.boundary.analysis.report;

import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.model.ComparisonResult;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.registry.BoundaryRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Builds a {@link BoundarySummary} from the contents of a registry. */
public final class BoundaryReportBuilder {

  public BoundarySummary build(BoundaryRegistry registry) {
    List<ComparisonResult> results = registry.all();
    int skipped = registry.skipped().size();

    Map<BoundaryType, Long> counts = new EnumMap<>(BoundaryType.class);
    for (BoundaryType type : BoundaryType.values()) {
      counts.put(type, 0L);
    }
    for (ComparisonResult r : results) {
      counts.merge(r.boundaryType(), 1L, Long::sum);
    }

    List<ComparisonResult> boundaries =
        results.stream().filter(ComparisonResult::isBoundary).toList();

    return new BoundarySummary(
        results.size() + skipped,
        results.size(),
        skipped,
        counts,
        boundaries.size(),
        computeDiffStats(boundaries),
        computeDelayRange(boundaries),
        computeMeanStdDev(results));
  }

  private BoundarySummary.DiffStats computeDiffStats(List<ComparisonResult> boundaries) {
    // a zero baseline yields an infinite difference; those stay out of the statistics
    double[] diffs =
        boundaries.stream()
            .mapToDouble(ComparisonResult::relativeDiffPct)
            .filter(Double::isFinite)
            .toArray();
    if (diffs.length == 0) return null;
    double sum = 0.0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double d : diffs) {
      sum += d;
      min = Math.min(min, d);
      max = Math.max(max, d);
    }
    double avg = sum / diffs.length;
    double varianceSum = 0.0;
    for (double d : diffs) {
      varianceSum += (d - avg) * (d - avg);
    }
    double std = Math.sqrt(varianceSum / diffs.length);
    return new BoundarySummary.DiffStats(avg, min, max, std, diffs.length);
  }

  private BoundarySummary.DelayRange computeDelayRange(List<ComparisonResult> boundaries) {
    if (boundaries.isEmpty()) return null;
    double sum = 0.0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (ComparisonResult r : boundaries) {
      double delay = r.condition().delayMs();
      sum += delay;
      min = Math.min(min, delay);
      max = Math.max(max, delay);
    }
    return new BoundarySummary.DelayRange(min, max, sum / boundaries.size());
  }

  private Map<ProtocolVariant, Double> computeMeanStdDev(List<ComparisonResult> results) {
    Map<ProtocolVariant, Double> map = new EnumMap<>(ProtocolVariant.class);
    if (results.isEmpty()) return map;
    for (ProtocolVariant variant : ProtocolVariant.values()) {
      double sum = 0.0;
      for (ComparisonResult r : results) {
        sum += r.aggregateFor(variant).stdDev();
      }
      map.put(variant, sum / results.size());
    }
    return map;
  }
}
