package com.mk.fx.qa.boundary.analysis.pipeline;

import com.mk.fx.qa.boundary.analysis.classify.BoundaryClassifier;
import com.mk.fx.qa.boundary.analysis.classify.Classification;
import com.mk.fx.qa.boundary.analysis.classify.Side;
import com.mk.fx.qa.boundary.analysis.model.ComparisonResult;
import com.mk.fx.qa.boundary.analysis.model.ConditionKey;
import com.mk.fx.qa.boundary.analysis.model.Metric;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.model.SkipReason;
import com.mk.fx.qa.boundary.analysis.model.SkippedCondition;
import com.mk.fx.qa.boundary.analysis.registry.BoundaryRegistry;
import com.mk.fx.qa.boundary.analysis.stats.Aggregate;
import com.mk.fx.qa.boundary.analysis.stats.Aggregator;
import com.mk.fx.qa.boundary.analysis.stats.OutlierFilter;
import com.mk.fx.qa.boundary.analysis.stats.SampleSet;
import com.mk.fx.qa.boundary.analysis.stats.SignificanceTester;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Filter → aggregate → significance → classification for each condition, parameterised by one
 * {@link AnalysisConfig}.
 *
 * <p>HTTP/2 is always side {@code a} and HTTP/3 the baseline {@code b}. Lower-is-better metrics are
 * oriented by negating both means before classification; results keep the raw aggregates. The
 * pipeline holds no mutable state and may be shared between threads.
 */
@Slf4j
public class BoundaryAnalysisPipeline {

  @Getter private final AnalysisConfig config;
  private final OutlierFilter outlierFilter;
  private final Aggregator aggregator;
  private final SignificanceTester significanceTester;
  private final BoundaryClassifier classifier;

  public BoundaryAnalysisPipeline(AnalysisConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.outlierFilter = new OutlierFilter(config.outlierMode(), config.minValidSamples());
    this.aggregator = new Aggregator();
    this.significanceTester = new SignificanceTester(config.significancePolicy());
    this.classifier = new BoundaryClassifier();
  }

  /**
   * Compares the two variants under one condition.
   *
   * @throws InsufficientDataException if either sample set is missing or empty
   */
  public ComparisonResult compare(
      ConditionKey condition, Metric metric, SampleSet http2Samples, SampleSet http3Samples) {
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(metric, "metric");
    requireSamples(condition, ProtocolVariant.HTTP2, http2Samples);
    requireSamples(condition, ProtocolVariant.HTTP3, http3Samples);

    Aggregate http2 = aggregate(http2Samples);
    Aggregate http3 = aggregate(http3Samples);

    Aggregate a = metric.higherIsBetter() ? http2 : http2.negated();
    Aggregate b = metric.higherIsBetter() ? http3 : http3.negated();
    boolean significant = significanceTester.isSignificant(a, b, config.confidence());
    Side normallyInferior = sideOf(config.expectedSuperior().other());
    Classification classification =
        classifier.classify(
            a, b, significant, config.crossoverThresholdPct(), normallyInferior);

    ProtocolVariant superior = classification.superiorSide().map(this::variantOf).orElse(null);
    if (log.isInfoEnabled()) {
      log.info(
          "Condition {} {}: HTTP/2 {} ± {} {}, HTTP/3 {} ± {} {}, diff {}% significant={} -> {}{}",
          condition,
          metric,
          format(http2.mean()),
          format(http2.stdDev()),
          metric.unit(),
          format(http3.mean()),
          format(http3.stdDev()),
          metric.unit(),
          format(classification.relativeDiffPct()),
          significant,
          classification.boundaryType().value(),
          superior != null ? " (" + superior.label() + " ahead)" : "");
    }

    return new ComparisonResult(
        condition,
        metric,
        http2,
        http3,
        classification.relativeDiffPct(),
        significant,
        classification.boundaryType(),
        superior);
  }

  /**
   * Analyses every condition into a fresh registry. Conditions without enough data are recorded as
   * skipped and never abort the run.
   */
  public BoundaryRegistry analyse(Metric metric, Collection<ConditionMeasurements> measurements) {
    BoundaryRegistry registry = new BoundaryRegistry();
    for (ConditionMeasurements m : measurements) {
      analyseInto(registry, metric, m);
    }
    log.info(
        "Analysis of {} finished: {} conditions compared, {} skipped",
        metric,
        registry.size(),
        registry.skipped().size());
    return registry;
  }

  /** Analyses one condition and records its result or skip in {@code registry}. */
  public void analyseInto(BoundaryRegistry registry, Metric metric, ConditionMeasurements m) {
    ConditionKey condition = m.condition();
    try {
      ComparisonResult result =
          compare(
              condition,
              metric,
              m.samplesFor(ProtocolVariant.HTTP2).orElse(null),
              m.samplesFor(ProtocolVariant.HTTP3).orElse(null));
      registry.record(condition, result);
    } catch (InsufficientDataException e) {
      log.warn("Condition {} skipped: {}", condition, e.getMessage());
      registry.recordSkipped(
          new SkippedCondition(condition, metric, e.getVariant(), e.getReason(), e.getMessage()));
    }
  }

  private Aggregate aggregate(SampleSet samples) {
    return aggregator.aggregate(outlierFilter.filter(samples, config.outlierK()));
  }

  private static void requireSamples(
      ConditionKey condition, ProtocolVariant variant, SampleSet samples) {
    if (samples == null) {
      throw new InsufficientDataException(
          condition,
          variant,
          SkipReason.MISSING_COUNTERPART,
          "No " + variant.label() + " measurements for condition " + condition);
    }
    if (samples.isEmpty()) {
      throw new InsufficientDataException(
          condition,
          variant,
          SkipReason.EMPTY_SAMPLE_SET,
          "Zero usable " + variant.label() + " samples for condition " + condition);
    }
  }

  private static Side sideOf(ProtocolVariant variant) {
    return variant == ProtocolVariant.HTTP2 ? Side.A : Side.B;
  }

  private ProtocolVariant variantOf(Side side) {
    return side == Side.A ? ProtocolVariant.HTTP2 : ProtocolVariant.HTTP3;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.1f", value);
  }
}
