package com.mk.fx.qa.boundary.analysis.pipeline;

import com.mk.fx.qa.boundary.analysis.model.ConditionKey;
import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.stats.SampleSet;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete batch of samples collected under one condition. A variant that was never measured has
 * no entry; a variant that was measured without a usable trial maps to an empty set.
 */
public record ConditionMeasurements(
    ConditionKey condition, Map<ProtocolVariant, SampleSet> samples) {

  public ConditionMeasurements {
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(samples, "samples");
    samples = Map.copyOf(samples);
  }

  public static ConditionMeasurements of(ConditionKey condition, SampleSet http2, SampleSet http3) {
    Map<ProtocolVariant, SampleSet> map = new EnumMap<>(ProtocolVariant.class);
    if (http2 != null) {
      map.put(ProtocolVariant.HTTP2, http2);
    }
    if (http3 != null) {
      map.put(ProtocolVariant.HTTP3, http3);
    }
    return new ConditionMeasurements(condition, map);
  }

  public Optional<SampleSet> samplesFor(ProtocolVariant variant) {
    return Optional.ofNullable(samples.get(variant));
  }
}
