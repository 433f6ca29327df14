package com.mk.fx.qa.boundary.analysis.sweep;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.model.ComparisonResult;
import com.mk.fx.qa.boundary.analysis.model.ConditionKey;
import com.mk.fx.qa.boundary.analysis.model.Metric;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.model.SkipReason;
import com.mk.fx.qa.boundary.analysis.model.SkippedCondition;
import com.mk.fx.qa.boundary.analysis.pipeline.AnalysisConfig;
import com.mk.fx.qa.boundary.analysis.pipeline.BoundaryAnalysisPipeline;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import org.junit.jupiter.api.Test;

class BoundarySweepRunnerTest {

  private static final ConditionKey LOW = ConditionKey.of(10, 0, 0);
  private static final ConditionKey HIGH = ConditionKey.of(200, 0, 0);

  /** Records every apply/close and fails shaping for the configured conditions. */
  private static final class RecordingController implements NetworkConditionController {
    final List<String> events = new ArrayList<>();
    final Set<ConditionKey> failing;
    final Set<ConditionKey> stuck;
    ConditionKey active;

    RecordingController(Set<ConditionKey> failing) {
      this(failing, Set.of());
    }

    RecordingController(Set<ConditionKey> failing, Set<ConditionKey> stuck) {
      this.failing = failing;
      this.stuck = stuck;
    }

    @Override
    public AppliedCondition apply(ConditionKey condition) {
      if (failing.contains(condition)) {
        throw new NetworkShapingException("tc refused " + condition);
      }
      active = condition;
      events.add("apply " + condition);
      return new AppliedCondition() {
        @Override
        public ConditionKey condition() {
          return condition;
        }

        @Override
        public void close() {
          if (stuck.contains(condition)) {
            events.add("close failed " + condition);
            throw new NetworkShapingException("tc del failed");
          }
          active = null;
          events.add("close " + condition);
        }
      };
    }
  }

  /** Answers trials from a function and checks they only run while shaping is in force. */
  private static final class ScriptedExecutor implements BenchmarkExecutor {
    final RecordingController controller;
    final BiFunction<ProtocolVariant, ConditionKey, TrialMeasurement> script;
    final List<String> trials = new ArrayList<>();

    ScriptedExecutor(
        RecordingController controller,
        BiFunction<ProtocolVariant, ConditionKey, TrialMeasurement> script) {
      this.controller = controller;
      this.script = script;
    }

    @Override
    public TrialMeasurement execute(ProtocolVariant variant, AppliedCondition condition) {
      assertEquals(controller.active, condition.condition(), "trial ran without shaping");
      trials.add(variant + " " + condition.condition());
      return script.apply(variant, condition.condition());
    }
  }

  private static BoundaryAnalysisPipeline pipeline() {
    return new BoundaryAnalysisPipeline(AnalysisConfig.defaults());
  }

  /** HTTP/2 wins at low delay; HTTP/3 wins at high delay. */
  private static TrialMeasurement crossoverScript(ProtocolVariant variant, ConditionKey key) {
    boolean http2Ahead = key.delayMs() < 100;
    boolean winner = (variant == ProtocolVariant.HTTP2) == http2Ahead;
    return winner ? new TrialMeasurement(1000, 20) : new TrialMeasurement(500, 40);
  }

  @Test
  void sweep_detectsCrossoverForBothMetrics() {
    RecordingController controller = new RecordingController(Set.of());
    ScriptedExecutor executor =
        new ScriptedExecutor(controller, BoundarySweepRunnerTest::crossoverScript);

    SweepResult result =
        new BoundarySweepRunner(controller, executor, pipeline())
            .run(ConditionPlan.of(List.of(HIGH, LOW)), 3);

    for (Metric metric : Metric.values()) {
      ComparisonResult low = result.forMetric(metric).find(LOW).orElseThrow();
      ComparisonResult high = result.forMetric(metric).find(HIGH).orElseThrow();
      assertEquals(BoundaryType.STABLE_SUPERIOR, low.boundaryType(), metric.name());
      assertEquals(ProtocolVariant.HTTP2, low.superiorVariant());
      assertEquals(BoundaryType.PERFORMANCE_CROSSOVER, high.boundaryType(), metric.name());
      assertEquals(ProtocolVariant.HTTP3, high.superiorVariant());
    }
    assertEquals(3, result.forMetric(Metric.LATENCY).find(LOW).orElseThrow().http2().totalCount());
  }

  @Test
  void sweep_runsConditionsInOrder_andReleasesShapingBeforeTheNext() {
    RecordingController controller = new RecordingController(Set.of());
    ScriptedExecutor executor =
        new ScriptedExecutor(controller, BoundarySweepRunnerTest::crossoverScript);

    new BoundarySweepRunner(controller, executor, pipeline())
        .run(ConditionPlan.of(List.of(HIGH, LOW)), 2);

    assertEquals(
        List.of("apply " + LOW, "close " + LOW, "apply " + HIGH, "close " + HIGH),
        controller.events);
    assertEquals(
        List.of(
            "HTTP2 " + LOW, "HTTP2 " + LOW, "HTTP3 " + LOW, "HTTP3 " + LOW,
            "HTTP2 " + HIGH, "HTTP2 " + HIGH, "HTTP3 " + HIGH, "HTTP3 " + HIGH),
        executor.trials);
  }

  @Test
  void failedTrials_areDropped() {
    RecordingController controller = new RecordingController(Set.of());
    int[] calls = {0};
    ScriptedExecutor executor =
        new ScriptedExecutor(
            controller,
            (variant, key) -> {
              calls[0]++;
              if (variant == ProtocolVariant.HTTP3 && calls[0] % 2 == 0) {
                throw new TrialFailedException("client crashed");
              }
              return crossoverScript(variant, key);
            });

    SweepResult result =
        new BoundarySweepRunner(controller, executor, pipeline())
            .run(ConditionPlan.of(List.of(LOW)), 4);

    ComparisonResult low = result.forMetric(Metric.THROUGHPUT).find(LOW).orElseThrow();
    assertEquals(4, low.http2().totalCount());
    assertEquals(2, low.http3().totalCount());
  }

  @Test
  void unusableMeasurements_countAsFailedTrials() {
    RecordingController controller = new RecordingController(Set.of());
    ScriptedExecutor executor =
        new ScriptedExecutor(
            controller,
            (variant, key) ->
                variant == ProtocolVariant.HTTP3
                    ? new TrialMeasurement(Double.NaN, 10)
                    : crossoverScript(variant, key));

    SweepResult result =
        new BoundarySweepRunner(controller, executor, pipeline())
            .run(ConditionPlan.of(List.of(LOW)), 2);

    for (Metric metric : Metric.values()) {
      assertTrue(result.forMetric(metric).isEmpty());
      SkippedCondition skipped = result.forMetric(metric).skipped().get(0);
      assertEquals(SkipReason.EMPTY_SAMPLE_SET, skipped.reason());
      assertEquals(ProtocolVariant.HTTP3, skipped.variant());
    }
  }

  @Test
  void shapingFailure_skipsConditionWithoutRunningTrials() {
    RecordingController controller = new RecordingController(Set.of(LOW));
    ScriptedExecutor executor =
        new ScriptedExecutor(controller, BoundarySweepRunnerTest::crossoverScript);

    SweepResult result =
        new BoundarySweepRunner(controller, executor, pipeline())
            .run(ConditionPlan.of(List.of(LOW, HIGH)), 2);

    assertTrue(executor.trials.stream().noneMatch(t -> t.endsWith(LOW.toString())));
    for (Metric metric : Metric.values()) {
      assertTrue(result.forMetric(metric).find(LOW).isEmpty());
      assertTrue(result.forMetric(metric).find(HIGH).isPresent());
      assertEquals(SkipReason.SHAPING_FAILED, result.forMetric(metric).skipped().get(0).reason());
    }
  }

  @Test
  void releaseFailure_keepsMeasuredBatch_andStopsTheSweep() {
    RecordingController controller = new RecordingController(Set.of(), Set.of(LOW));
    ScriptedExecutor executor =
        new ScriptedExecutor(controller, BoundarySweepRunnerTest::crossoverScript);

    SweepResult result =
        new BoundarySweepRunner(controller, executor, pipeline())
            .run(ConditionPlan.of(List.of(LOW, HIGH)), 3);

    assertEquals(List.of("apply " + LOW, "close failed " + LOW), controller.events);
    assertTrue(executor.trials.stream().noneMatch(t -> t.endsWith(HIGH.toString())));
    for (Metric metric : Metric.values()) {
      ComparisonResult low = result.forMetric(metric).find(LOW).orElseThrow();
      assertEquals(BoundaryType.STABLE_SUPERIOR, low.boundaryType(), metric.name());
      assertEquals(3, low.http2().totalCount());
      assertTrue(result.forMetric(metric).find(HIGH).isEmpty());
      SkippedCondition skipped = result.forMetric(metric).skipped().get(0);
      assertEquals(HIGH, skipped.condition());
      assertEquals(SkipReason.SWEEP_STOPPED, skipped.reason());
    }
  }

  @Test
  void unexpectedTrialError_isDroppedLikeAFailedTrial() {
    RecordingController controller = new RecordingController(Set.of());
    int[] calls = {0};
    ScriptedExecutor executor =
        new ScriptedExecutor(
            controller,
            (variant, key) -> {
              calls[0]++;
              if (calls[0] == 1) {
                throw new IllegalStateException("h2load crashed");
              }
              return crossoverScript(variant, key);
            });

    SweepResult result =
        new BoundarySweepRunner(controller, executor, pipeline())
            .run(ConditionPlan.of(List.of(LOW, HIGH)), 3);

    assertEquals(
        List.of("apply " + LOW, "close " + LOW, "apply " + HIGH, "close " + HIGH),
        controller.events);
    ComparisonResult low = result.forMetric(Metric.THROUGHPUT).find(LOW).orElseThrow();
    assertEquals(2, low.http2().totalCount());
    assertEquals(3, low.http3().totalCount());
    assertTrue(result.forMetric(Metric.THROUGHPUT).find(HIGH).isPresent());
  }

  @Test
  void trialsPerVariant_mustBePositive() {
    RecordingController controller = new RecordingController(Set.of());
    BoundarySweepRunner runner =
        new BoundarySweepRunner(
            controller,
            new ScriptedExecutor(controller, BoundarySweepRunnerTest::crossoverScript),
            pipeline());

    assertThrows(
        IllegalArgumentException.class, () -> runner.run(ConditionPlan.of(List.of(LOW)), 0));
  }
}
