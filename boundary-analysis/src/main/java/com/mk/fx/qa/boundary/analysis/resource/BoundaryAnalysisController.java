package com.mk.fx.qa.boundary.analysis.resource;

import com.mk.fx.qa.boundary.analysis.cfg.AnalysisProperties;
import com.mk.fx.qa.boundary.analysis.dto.AnalysisRequest;
import com.mk.fx.qa.boundary.analysis.dto.AnalysisRunResponse;
import com.mk.fx.qa.boundary.analysis.dto.AnalysisRunSummaryResponse;
import com.mk.fx.qa.boundary.analysis.dto.HealthResponse;
import com.mk.fx.qa.boundary.analysis.model.AnalysisRun;
import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import com.mk.fx.qa.boundary.analysis.pipeline.ConditionMeasurements;
import com.mk.fx.qa.boundary.analysis.service.BoundaryAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(
    name = "Boundary Analyses",
    description = "Endpoints for analysing HTTP/2 vs HTTP/3 samples and browsing boundary results")
@RestController
@RequestMapping("/api/analyses")
@Validated
@RequiredArgsConstructor
public class BoundaryAnalysisController {

  private final BoundaryAnalysisService analysisService;
  private final AnalysisMapper analysisMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Submission
  // -----------------------------------------------------
  @Operation(
      summary = "Analyse samples",
      description =
          "Filters, aggregates, tests and classifies every submitted condition and stores the run.")
  @PostMapping
  public ResponseEntity<AnalysisRunResponse> submitAnalysis(
      @Valid @RequestBody AnalysisRequest request) {
    log.info(
        "Received {} analysis with {} conditions (preset={})",
        request.getMetric(),
        request.getConditions().size(),
        request.getPreset());
    List<ConditionMeasurements> measurements =
        analysisMapper.toMeasurements(request.getConditions());
    AnalysisRun run =
        analysisService.submit(
            request.getMetric(), request.getPreset(), request.getSettings(), measurements);
    return responseFactory.created(analysisMapper.toResponse(run));
  }

  // -----------------------------------------------------
  // Runs and boundaries
  // -----------------------------------------------------
  @Operation(summary = "List analyses", description = "Returns stored analysis runs, newest first.")
  @GetMapping
  public ResponseEntity<List<AnalysisRunSummaryResponse>> getAnalyses() {
    return responseFactory.ok(analysisMapper.toSummaries(analysisService.getRuns()));
  }

  @Operation(summary = "Get analysis", description = "Returns a stored analysis run in full.")
  @GetMapping("/{analysisId}")
  public ResponseEntity<?> getAnalysis(@PathVariable UUID analysisId) {
    return analysisService
        .getRun(analysisId)
        .<ResponseEntity<?>>map(run -> responseFactory.ok(analysisMapper.toResponse(run)))
        .orElseGet(
            () -> {
              log.warn("Analysis {} not found", analysisId);
              return responseFactory.analysisNotFound(analysisId);
            });
  }

  @Operation(
      summary = "Analysis boundaries",
      description = "Returns the comparisons of a run, optionally filtered by boundary type.")
  @GetMapping("/{analysisId}/boundaries")
  public ResponseEntity<?> getBoundaries(
      @PathVariable UUID analysisId, @RequestParam(required = false) String type) {
    BoundaryType boundaryType = null;
    if (type != null) {
      try {
        boundaryType = BoundaryType.fromValue(type);
      } catch (IllegalArgumentException ex) {
        log.warn("Invalid boundary type filter: {}", type);
        String allowed =
            Arrays.stream(BoundaryType.values())
                .map(BoundaryType::value)
                .collect(Collectors.joining(", ", "[", "]"));
        return responseFactory.error(
            HttpStatus.BAD_REQUEST,
            "Invalid Boundary Type",
            "Unrecognized boundary type: " + type + ". Allowed: " + allowed,
            analysisId);
      }
    }
    return analysisService
        .getResults(analysisId, boundaryType)
        .<ResponseEntity<?>>map(results -> responseFactory.ok(analysisMapper.toResponses(results)))
        .orElseGet(
            () -> {
              log.warn("Analysis {} not found", analysisId);
              return responseFactory.analysisNotFound(analysisId);
            });
  }

  // -----------------------------------------------------
  // Misc endpoints
  // -----------------------------------------------------
  @Operation(summary = "Presets", description = "Lists the named analysis presets.")
  @GetMapping("/presets")
  public ResponseEntity<Map<String, AnalysisProperties.Settings>> getPresets() {
    return responseFactory.ok(analysisService.getPresets());
  }

  @Operation(summary = "Health check", description = "Verifies service health.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = analysisService.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return responseFactory.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }
}
