package com.mk.fx.qa.boundary.analysis.cfg;

import com.mk.fx.qa.boundary.analysis.model.ProtocolVariant;
import com.mk.fx.qa.boundary.analysis.pipeline.AnalysisConfig;
import com.mk.fx.qa.boundary.analysis.stats.OutlierMode;
import com.mk.fx.qa.boundary.analysis.stats.SignificancePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Default analysis settings plus named presets, bound from {@code boundary.analysis.*}.
 *
 * <p>Presets capture the strictness levels used for different studies (e.g. a strict non-overlap
 * test versus relaxed-ratio tests at lower confidence) so they are selected by name instead of
 * being copied around.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "boundary.analysis")
public class AnalysisProperties {

  @Positive private int historySize = 50;

  @Valid @NotNull private Settings defaults = new Settings();

  @Valid @NotNull private Map<String, Settings> presets = new LinkedHashMap<>();

  @Data
  public static class Settings {

    @Positive private double outlierK = 2.0;

    @NotNull private OutlierMode outlierMode = OutlierMode.FULL_SAMPLE;

    @DecimalMin("0.50")
    @DecimalMax("0.999")
    private double confidence = 0.95;

    @NotNull
    private SignificancePolicy.Type significancePolicy = SignificancePolicy.Type.NON_OVERLAP;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double relaxedRatioFactor = 0.5;

    @PositiveOrZero private double crossoverThresholdPct = 10.0;

    @Min(1)
    private int minValidSamples = 1;

    @NotNull private ProtocolVariant expectedSuperior = ProtocolVariant.HTTP2;

    /**
     * @throws IllegalArgumentException if the combination of values is invalid
     */
    public AnalysisConfig toConfig() {
      return AnalysisConfig.builder()
          .outlierK(outlierK)
          .outlierMode(outlierMode)
          .confidence(confidence)
          .significancePolicy(SignificancePolicy.of(significancePolicy, relaxedRatioFactor))
          .crossoverThresholdPct(crossoverThresholdPct)
          .minValidSamples(minValidSamples)
          .expectedSuperior(expectedSuperior)
          .build();
    }
  }
}
