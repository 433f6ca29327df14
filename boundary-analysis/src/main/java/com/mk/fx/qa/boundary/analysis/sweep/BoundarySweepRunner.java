package com.mk.fx.qa.boundary.analysis.sweep;

import com.mk.fx.qa.boundary.analysis.model.ConditionKey;
import com.mk.fx.qa.boundary.analysis.model.Metric;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.model.SkipReason;
import com.mk.fx.qa.boundary.analysis.model.SkippedCondition;
import com.mk.fx.qa.boundary.analysis.pipeline.BoundaryAnalysisPipeline;
import com.mk.fx.qa.boundary.analysis.pipeline.ConditionMeasurements;
import com.mk.fx.qa.boundary.analysis.registry.BoundaryRegistry;
import com.mk.fx.qa.boundary.analysis.stats.SampleSet;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Drives a sequential sweep over a {@link ConditionPlan}.
 *
 * <p>For each condition the shaping is applied, every trial of both variants runs to completion,
 * the shaping is released, and only then are the complete sample sets handed to the pipeline. A
 * failed trial is dropped; a condition whose shaping cannot be applied is skipped. If shaping
 * cannot be released, the batch already measured is still analysed and the sweep stops, recording
 * the remaining conditions as {@link SkipReason#SWEEP_STOPPED}.
 */
@Slf4j
public class BoundarySweepRunner {

  private static final List<Metric> METRICS = List.of(Metric.THROUGHPUT, Metric.LATENCY);

  private final NetworkConditionController networkController;
  private final BenchmarkExecutor benchmarkExecutor;
  private final BoundaryAnalysisPipeline pipeline;

  public BoundarySweepRunner(
      NetworkConditionController networkController,
      BenchmarkExecutor benchmarkExecutor,
      BoundaryAnalysisPipeline pipeline) {
    this.networkController = Objects.requireNonNull(networkController, "networkController");
    this.benchmarkExecutor = Objects.requireNonNull(benchmarkExecutor, "benchmarkExecutor");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
  }

  public SweepResult run(ConditionPlan plan, int trialsPerVariant) {
    if (trialsPerVariant < 1) {
      throw new IllegalArgumentException(
          "trialsPerVariant must be >= 1 but was " + trialsPerVariant);
    }
    Map<Metric, BoundaryRegistry> registries = new EnumMap<>(Metric.class);
    for (Metric metric : METRICS) {
      registries.put(metric, new BoundaryRegistry());
    }

    List<ConditionKey> conditions = plan.conditions();
    for (int i = 0; i < conditions.size(); i++) {
      ConditionKey condition = conditions.get(i);
      boolean released;
      MDC.put("condition", condition.toString());
      try {
        log.info("Sweep condition {}/{}: {}", i + 1, conditions.size(), condition);
        released = runCondition(condition, trialsPerVariant, registries);
      } finally {
        MDC.remove("condition");
      }
      if (!released) {
        List<ConditionKey> remaining = conditions.subList(i + 1, conditions.size());
        log.error("Stopping sweep; {} condition(s) left unmeasured", remaining.size());
        for (ConditionKey skipped : remaining) {
          recordSkipped(
              registries,
              skipped,
              SkipReason.SWEEP_STOPPED,
              "Shaping for " + condition + " could not be released");
        }
        break;
      }
    }
    return new SweepResult(registries);
  }

  /** Returns false when the shaping could not be released afterwards. */
  private boolean runCondition(
      ConditionKey condition, int trialsPerVariant, Map<Metric, BoundaryRegistry> registries) {
    AppliedCondition applied;
    try {
      applied = networkController.apply(condition);
    } catch (RuntimeException e) {
      log.warn("Could not apply network condition {}: {}", condition, e.getMessage());
      recordSkipped(registries, condition, SkipReason.SHAPING_FAILED, e.getMessage());
      return true;
    }

    Map<ProtocolVariant, Map<Metric, SampleSet>> collected;
    boolean released;
    try {
      collected = collect(applied, trialsPerVariant);
    } finally {
      released = release(applied);
    }

    for (Metric metric : METRICS) {
      ConditionMeasurements measurements =
          ConditionMeasurements.of(
              condition,
              collected.get(ProtocolVariant.HTTP2).get(metric),
              collected.get(ProtocolVariant.HTTP3).get(metric));
      pipeline.analyseInto(registries.get(metric), metric, measurements);
    }
    return released;
  }

  private boolean release(AppliedCondition applied) {
    try {
      applied.close();
      return true;
    } catch (RuntimeException e) {
      log.error(
          "Could not release network condition {}; network state is unknown",
          applied.condition(),
          e);
      return false;
    }
  }

  private static void recordSkipped(
      Map<Metric, BoundaryRegistry> registries,
      ConditionKey condition,
      SkipReason reason,
      String message) {
    for (Metric metric : METRICS) {
      registries
          .get(metric)
          .recordSkipped(new SkippedCondition(condition, metric, null, reason, message));
    }
  }

  private Map<ProtocolVariant, Map<Metric, SampleSet>> collect(
      AppliedCondition applied, int trialsPerVariant) {
    Map<ProtocolVariant, Map<Metric, SampleSet>> collected = new EnumMap<>(ProtocolVariant.class);
    for (ProtocolVariant variant : ProtocolVariant.values()) {
      Map<Metric, SampleSet.Builder> builders = new EnumMap<>(Metric.class);
      for (Metric metric : METRICS) {
        builders.put(metric, SampleSet.builder());
      }
      for (int trial = 1; trial <= trialsPerVariant; trial++) {
        try {
          TrialMeasurement m = benchmarkExecutor.execute(variant, applied);
          if (m == null || !m.isUsable()) {
            throw new TrialFailedException("unusable measurement " + m);
          }
          for (Metric metric : METRICS) {
            builders.get(metric).add(m.valueOf(metric));
          }
          if (log.isInfoEnabled()) {
            log.info(
                "  {} trial {}/{}: {} req/s, {} ms",
                variant.label(),
                trial,
                trialsPerVariant,
                String.format(Locale.ROOT, "%.1f", m.throughputRps()),
                String.format(Locale.ROOT, "%.1f", m.latencyMs()));
          }
        } catch (TrialFailedException e) {
          log.warn(
              "  {} trial {}/{} failed: {}",
              variant.label(),
              trial,
              trialsPerVariant,
              e.getMessage());
        } catch (RuntimeException e) {
          log.warn(
              "  {} trial {}/{} failed unexpectedly", variant.label(), trial, trialsPerVariant, e);
        }
      }
      if (builders.get(Metric.THROUGHPUT).size() == 0) {
        log.warn("  All {} trials failed under {}", variant.label(), applied.condition());
      }
      Map<Metric, SampleSet> sets = new EnumMap<>(Metric.class);
      builders.forEach((metric, builder) -> sets.put(metric, builder.build()));
      collected.put(variant, sets);
    }
    return collected;
  }
}
