package com.mk.fx.qa.boundary.analysis.sweep;

import com.mk.fx.qa.boundary.analysis.model.Metric;
import com.mk.fx.qa.boundary.analysis.registry.BoundaryRegistry;
import java.util.Map;

/** One registry per metric produced by a sweep. */
public record SweepResult(Map<Metric, BoundaryRegistry> registries) {

  public SweepResult {
    registries = Map.copyOf(registries);
  }

  public BoundaryRegistry forMetric(Metric metric) {
    BoundaryRegistry registry = registries.get(metric);
    if (registry == null) {
      throw new IllegalArgumentException("Metric " + metric + " was not analysed");
    }
    return registry;
  }
}
