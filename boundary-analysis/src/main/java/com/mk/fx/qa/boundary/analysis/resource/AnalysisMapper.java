package com.mk.fx.qa.boundary.analysis.resource;

import com.mk.fx.qa.boundary.analysis.cfg.AnalysisProperties;
import com.mk.fx.qa.boundary.analysis.dto.AnalysisRunResponse;
import com.mk.fx.qa.boundary.analysis.dto.AnalysisRunSummaryResponse;
import com.mk.fx.qa.boundary.analysis.dto.ComparisonResultResponse;
import com.mk.fx.qa.boundary.analysis.dto.ConditionSamplesRequest;
import com.mk.fx.qa.boundary.analysis.dto.SkippedConditionResponse;
import com.mk.fx.qa.boundary.analysis.model.AnalysisRun;
import com.mk.fx.qa.boundary.analysis.model.ComparisonResult;
import com.mk.fx.qa.boundary.analysis.model.ConditionKey;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.model.SkippedCondition;
import com.mk.fx.qa.boundary.analysis.pipeline.AnalysisConfig;
import com.mk.fx.qa.boundary.analysis.pipeline.ConditionMeasurements;
import com.mk.fx.qa.boundary.analysis.stats.SampleSet;
import com.mk.fx.qa.boundary.analysis.stats.SignificancePolicy;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface AnalysisMapper {

  @Mapping(target = "delayMs", source = "condition.delayMs")
  @Mapping(target = "lossPct", source = "condition.lossPct")
  @Mapping(target = "bandwidthMbps", source = "condition.bandwidthMbps")
  @Mapping(target = "http2Mean", source = "http2.mean")
  @Mapping(target = "http2StdDev", source = "http2.stdDev")
  @Mapping(target = "http2ValidCount", source = "http2.validCount")
  @Mapping(target = "http2TotalCount", source = "http2.totalCount")
  @Mapping(target = "http3Mean", source = "http3.mean")
  @Mapping(target = "http3StdDev", source = "http3.stdDev")
  @Mapping(target = "http3ValidCount", source = "http3.validCount")
  @Mapping(target = "http3TotalCount", source = "http3.totalCount")
  ComparisonResultResponse toResponse(ComparisonResult result);

  List<ComparisonResultResponse> toResponses(List<ComparisonResult> results);

  @Mapping(target = "delayMs", source = "condition.delayMs")
  @Mapping(target = "lossPct", source = "condition.lossPct")
  @Mapping(target = "bandwidthMbps", source = "condition.bandwidthMbps")
  SkippedConditionResponse toResponse(SkippedCondition skipped);

  @Mapping(target = "settings", source = "config")
  AnalysisRunResponse toResponse(AnalysisRun run);

  @Mapping(target = "comparedConditions", source = "summary.comparedConditions")
  @Mapping(target = "skippedConditions", source = "summary.skippedConditions")
  @Mapping(target = "boundaryCount", source = "summary.boundaryCount")
  AnalysisRunSummaryResponse toSummary(AnalysisRun run);

  List<AnalysisRunSummaryResponse> toSummaries(List<AnalysisRun> runs);

  default AnalysisProperties.Settings toSettings(AnalysisConfig config) {
    if (config == null) {
      return null;
    }
    AnalysisProperties.Settings settings = new AnalysisProperties.Settings();
    settings.setOutlierK(config.outlierK());
    settings.setOutlierMode(config.outlierMode());
    settings.setConfidence(config.confidence());
    settings.setSignificancePolicy(config.significancePolicy().type());
    if (config.significancePolicy() instanceof SignificancePolicy.RelaxedRatio relaxed) {
      settings.setRelaxedRatioFactor(relaxed.ratio());
    }
    settings.setCrossoverThresholdPct(config.crossoverThresholdPct());
    settings.setMinValidSamples(config.minValidSamples());
    settings.setExpectedSuperior(config.expectedSuperior());
    return settings;
  }

  /**
   * @throws IllegalArgumentException if a condition appears twice or a sample is null
   */
  default List<ConditionMeasurements> toMeasurements(List<ConditionSamplesRequest> requests) {
    List<ConditionMeasurements> measurements = new ArrayList<>(requests.size());
    Set<ConditionKey> seen = new HashSet<>();
    for (ConditionSamplesRequest request : requests) {
      ConditionMeasurements m = toMeasurements(request);
      if (!seen.add(m.condition())) {
        throw new IllegalArgumentException("Duplicate condition: " + m.condition());
      }
      measurements.add(m);
    }
    return measurements;
  }

  default ConditionMeasurements toMeasurements(ConditionSamplesRequest request) {
    ConditionKey key =
        ConditionKey.of(request.getDelayMs(), request.getLossPct(), request.getBandwidthMbps());
    Map<ProtocolVariant, SampleSet> samples = new EnumMap<>(ProtocolVariant.class);
    request
        .getSamples()
        .forEach(
            (variant, values) -> {
              if (variant == null || values == null) {
                throw new IllegalArgumentException(
                    "Samples under " + key + " need a variant and a list of values");
              }
              samples.put(variant, SampleSet.of(values));
            });
    return new ConditionMeasurements(key, samples);
  }
}
