package com.mk.fx.qa.boundary.analysis.registry;

import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.model.ComparisonResult;
import com.mk.fx.qa.boundary.analysis.model.ConditionKey;
import com.mk.fx.qa.boundary.analysis.model.SkippedCondition;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Results of one analysis run, keyed by condition.
 *
 * <p>Recording a condition again replaces whatever the previous round left for it, whether a
 * result or a skip. Reads return snapshots ordered by {@link ConditionKey} ascending.
 */
public class BoundaryRegistry {

  private final Map<ConditionKey, ComparisonResult> results = new TreeMap<>();
  private final Map<ConditionKey, SkippedCondition> skipped = new TreeMap<>();

  /** Inserts or overwrites the result for {@code condition}. */
  public synchronized void record(ConditionKey condition, ComparisonResult result) {
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(result, "result");
    if (!condition.equals(result.condition())) {
      throw new IllegalArgumentException(
          "Result for " + result.condition() + " cannot be recorded under " + condition);
    }
    results.put(condition, result);
    skipped.remove(condition);
  }

  /** Marks a condition as skipped for this run, dropping any earlier result for it. */
  public synchronized void recordSkipped(SkippedCondition skip) {
    Objects.requireNonNull(skip, "skip");
    skipped.put(skip.condition(), skip);
    results.remove(skip.condition());
  }

  public synchronized List<ComparisonResult> all() {
    return List.copyOf(results.values());
  }

  public synchronized List<SkippedCondition> skipped() {
    return List.copyOf(skipped.values());
  }

  public synchronized Optional<ComparisonResult> find(ConditionKey condition) {
    return Optional.ofNullable(results.get(condition));
  }

  public synchronized List<ComparisonResult> byType(BoundaryType type) {
    return results.values().stream().filter(r -> r.boundaryType() == type).toList();
  }

  public synchronized int size() {
    return results.size();
  }

  public synchronized boolean isEmpty() {
    return results.isEmpty();
  }
}
