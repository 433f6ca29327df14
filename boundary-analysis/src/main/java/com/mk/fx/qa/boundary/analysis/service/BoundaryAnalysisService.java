package com.mk.fx.qa.boundary.analysis.service;

import com.mk.fx.qa.boundary.analysis.cfg.AnalysisProperties;
import com.mk.fx.qa.boundary.analysis.dto.AnalysisSettingsRequest;
import com.mk.fx.qa.boundary.analysis.model.AnalysisRun;
import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.model.ComparisonResult;
import com.mk.fx.qa.boundary.analysis.model.Metric;
import com.mk.fx.qa.boundary.analysis.pipeline.AnalysisConfig;
import com.mk.fx.qa.boundary.analysis.pipeline.BoundaryAnalysisPipeline;
import com.mk.fx.qa.boundary.analysis.pipeline.ConditionMeasurements;
import com.mk.fx.qa.boundary.analysis.registry.BoundaryRegistry;
import com.mk.fx.qa.boundary.analysis.report.BoundaryReportBuilder;
import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs boundary analyses on submitted samples and keeps a bounded history of the results.
 *
 * <p>Each submission resolves its settings (preset or defaults, then request overrides), builds a
 * {@link BoundaryAnalysisPipeline} for them and analyses all conditions synchronously. Runs are
 * immutable once stored; the oldest runs are evicted past {@code historySize}.
 */
@Slf4j
@Service
public class BoundaryAnalysisService {

  private final AnalysisProperties properties;
  private final SettingsMapper settingsMapper;
  private final BoundaryReportBuilder reportBuilder;
  private final Map<UUID, AnalysisRun> runs;
  private final Deque<UUID> history;

  public BoundaryAnalysisService(AnalysisProperties properties, SettingsMapper settingsMapper) {
    this.properties = properties;
    this.settingsMapper = settingsMapper;
    this.reportBuilder = new BoundaryReportBuilder();
    this.runs = new ConcurrentHashMap<>();
    this.history = new ConcurrentLinkedDeque<>();
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "BoundaryAnalysisService initialised with historySize={} defaults={} presets={}",
        properties.getHistorySize(),
        properties.getDefaults(),
        properties.getPresets().keySet());
  }

  /**
   * Analyses the given measurements and stores the run.
   *
   * @throws IllegalArgumentException if the preset is unknown or the resolved settings are invalid
   */
  public AnalysisRun submit(
      Metric metric,
      String preset,
      AnalysisSettingsRequest overrides,
      List<ConditionMeasurements> measurements) {
    Objects.requireNonNull(metric, "metric");
    AnalysisConfig config = resolveSettings(preset, overrides).toConfig();
    log.info(
        "Starting {} analysis of {} conditions (preset={}, config={})",
        metric,
        measurements.size(),
        preset == null ? "defaults" : preset,
        config);

    BoundaryRegistry registry = new BoundaryAnalysisPipeline(config).analyse(metric, measurements);
    AnalysisRun run =
        new AnalysisRun(
            UUID.randomUUID(),
            Instant.now(),
            metric,
            preset,
            config,
            registry.all(),
            registry.skipped(),
            reportBuilder.build(registry));
    store(run);
    log.info(
        "Analysis {} stored: {} compared, {} skipped, {} boundaries",
        run.id(),
        run.summary().comparedConditions(),
        run.summary().skippedConditions(),
        run.summary().boundaryCount());
    return run;
  }

  /** Returns a copy of the preset (or the defaults) with non-null overrides applied. */
  public AnalysisProperties.Settings resolveSettings(
      String preset, AnalysisSettingsRequest overrides) {
    AnalysisProperties.Settings base;
    if (preset == null || preset.isBlank()) {
      base = properties.getDefaults();
    } else {
      base = properties.getPresets().get(preset);
      if (base == null) {
        throw new IllegalArgumentException(
            "Unknown preset: " + preset + ". Available: " + properties.getPresets().keySet());
      }
    }
    AnalysisProperties.Settings settings = settingsMapper.copy(base);
    if (overrides != null) {
      settingsMapper.applyOverrides(overrides, settings);
    }
    return settings;
  }

  public Optional<AnalysisRun> getRun(UUID id) {
    return Optional.ofNullable(runs.get(id));
  }

  /** Stored runs, newest first. */
  public List<AnalysisRun> getRuns() {
    List<AnalysisRun> list = new ArrayList<>();
    Iterator<UUID> it = history.descendingIterator();
    while (it.hasNext()) {
      AnalysisRun run = runs.get(it.next());
      if (run != null) {
        list.add(run);
      }
    }
    return list;
  }

  /** Results of a run, optionally restricted to one boundary type; empty if the run is unknown. */
  public Optional<List<ComparisonResult>> getResults(UUID id, BoundaryType type) {
    return getRun(id)
        .map(
            run ->
                type == null
                    ? run.results()
                    : run.results().stream().filter(r -> r.boundaryType() == type).toList());
  }

  /** Copies of the configured presets, in declaration order. */
  public Map<String, AnalysisProperties.Settings> getPresets() {
    Map<String, AnalysisProperties.Settings> presets = new LinkedHashMap<>();
    properties
        .getPresets()
        .forEach((name, settings) -> presets.put(name, settingsMapper.copy(settings)));
    return presets;
  }

  public boolean isHealthy() {
    return properties.getDefaults() != null;
  }

  private void store(AnalysisRun run) {
    runs.put(run.id(), run);
    history.addLast(run.id());
    while (history.size() > properties.getHistorySize()) {
      UUID evicted = history.pollFirst();
      if (evicted == null) {
        break;
      }
      runs.remove(evicted);
      log.debug("Analysis {} evicted from history", evicted);
    }
  }
}
