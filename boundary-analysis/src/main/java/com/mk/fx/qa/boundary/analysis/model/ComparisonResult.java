package com.mk.fx.qa.boundary.analysis.model;

import com.mk.fx.qa.boundary.analysis.stats.Aggregate;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of comparing both variants under one condition.
 *
 * <p>{@code relativeDiffPct} is the HTTP/2 minus HTTP/3 difference on the metric's orientation,
 * relative to the variant not expected to win ({@code (http2 - http3) / |http3| * 100} by
 * default), so a positive value always means HTTP/2 did better. A zero baseline makes it
 * infinite. The aggregates are kept in the metric's raw units.
 *
 * @param superiorVariant better variant, or null when not significant or exactly tied
 */
public record ComparisonResult(
    ConditionKey condition,
    Metric metric,
    Aggregate http2,
    Aggregate http3,
    double relativeDiffPct,
    boolean significant,
    BoundaryType boundaryType,
    ProtocolVariant superiorVariant) {

  public ComparisonResult {
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(http2, "http2");
    Objects.requireNonNull(http3, "http3");
    Objects.requireNonNull(boundaryType, "boundaryType");
  }

  public Aggregate aggregateFor(ProtocolVariant variant) {
    return variant == ProtocolVariant.HTTP2 ? http2 : http3;
  }

  public Optional<ProtocolVariant> superior() {
    return Optional.ofNullable(superiorVariant);
  }

  public boolean isBoundary() {
    return boundaryType.isBoundary();
  }
}
