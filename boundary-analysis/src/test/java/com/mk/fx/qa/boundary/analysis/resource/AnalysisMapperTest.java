package com.mk.fx.qa.boundary.analysis.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mk.fx.qa.boundary.analysis.cfg.AnalysisProperties;
import com.mk.fx.qa.boundary.analysis.dto.ComparisonResultResponse;
import com.mk.fx.qa.boundary.analysis.dto.ConditionSamplesRequest;
import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.model.ComparisonResult;
import com.mk.fx.qa.boundary.analysis.model.ConditionKey;
import com.mk.fx.qa.boundary.analysis.model.Metric;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.pipeline.AnalysisConfig;
import com.mk.fx.qa.boundary.analysis.pipeline.ConditionMeasurements;
import com.mk.fx.qa.boundary.analysis.stats.Aggregate;
import com.mk.fx.qa.boundary.analysis.stats.SampleSet;
import com.mk.fx.qa.boundary.analysis.stats.SignificancePolicy;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class AnalysisMapperTest {

  private final AnalysisMapper mapper = Mappers.getMapper(AnalysisMapper.class);

  private static ConditionSamplesRequest request(
      double delay, Map<ProtocolVariant, List<Double>> s) {
    ConditionSamplesRequest req = new ConditionSamplesRequest();
    req.setDelayMs(delay);
    req.setLossPct(0.5);
    req.setBandwidthMbps(0.0);
    req.setSamples(s);
    return req;
  }

  @Test
  void toMeasurements_keepsOnlyTheVariantsSent() {
    ConditionMeasurements m =
        mapper.toMeasurements(request(50, Map.of(ProtocolVariant.HTTP2, List.of(1.0, 2.0))));

    assertThat(m.condition()).isEqualTo(ConditionKey.of(50, 0.5, 0));
    assertThat(m.samplesFor(ProtocolVariant.HTTP2)).contains(SampleSet.of(1, 2));
    assertThat(m.samplesFor(ProtocolVariant.HTTP3)).isEmpty();
  }

  @Test
  void toMeasurements_rejectsDuplicatesAndNullLists() {
    var samples = Map.of(ProtocolVariant.HTTP2, List.of(1.0));
    Map<ProtocolVariant, List<Double>> withNull = new HashMap<>();
    withNull.put(ProtocolVariant.HTTP3, null);

    assertThatThrownBy(
            () -> mapper.toMeasurements(List.of(request(50, samples), request(50, samples))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate condition");
    assertThatThrownBy(() -> mapper.toMeasurements(request(50, withNull)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toResponse_flattensConditionAndAggregates() {
    ConditionKey key = ConditionKey.of(150, 1, 20);
    ComparisonResult result =
        new ComparisonResult(
            key,
            Metric.LATENCY,
            new Aggregate(40, 2, 3, 4),
            new Aggregate(80, 3, 5, 5),
            50.0,
            true,
            BoundaryType.STABLE_SUPERIOR,
            ProtocolVariant.HTTP2);

    ComparisonResultResponse response = mapper.toResponse(result);

    assertThat(response.getDelayMs()).isEqualTo(150.0);
    assertThat(response.getBandwidthMbps()).isEqualTo(20.0);
    assertThat(response.getHttp2Mean()).isEqualTo(40.0);
    assertThat(response.getHttp2ValidCount()).isEqualTo(3);
    assertThat(response.getHttp2TotalCount()).isEqualTo(4);
    assertThat(response.getHttp3StdDev()).isEqualTo(3.0);
    assertThat(response.isSignificant()).isTrue();
    assertThat(response.getBoundaryType()).isEqualTo(BoundaryType.STABLE_SUPERIOR);
    assertThat(response.getSuperiorVariant()).isEqualTo(ProtocolVariant.HTTP2);
  }

  @Test
  void toSettings_roundTripsThroughConfig() {
    AnalysisConfig config =
        AnalysisConfig.defaults().toBuilder()
            .significancePolicy(SignificancePolicy.relaxedRatio(0.3))
            .confidence(0.8)
            .build();

    AnalysisProperties.Settings settings = mapper.toSettings(config);

    assertThat(settings.getSignificancePolicy()).isEqualTo(SignificancePolicy.Type.RELAXED_RATIO);
    assertThat(settings.getRelaxedRatioFactor()).isEqualTo(0.3);
    assertThat(settings.toConfig()).isEqualTo(config);
  }
}
