package com.mk.fx.qa.boundary.analysis.resource;

import com.mk.fx.qa.boundary.analysis.cfg.ErrorResponse;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Component
public class ApiResponseFactory {

  public ResponseEntity<ErrorResponse> error(
      HttpStatus status, String title, String message, UUID analysisId) {
    return ResponseEntity.status(status).body(new ErrorResponse(title, message, analysisId));
  }

  public ResponseEntity<ErrorResponse> analysisNotFound(UUID analysisId) {
    return error(
        HttpStatus.NOT_FOUND, "Not Found", "Analysis not found: " + analysisId, analysisId);
  }

  public <T> ResponseEntity<T> ok(T body) {
    return ResponseEntity.ok(body);
  }

  public <T> ResponseEntity<T> created(T body) {
    return ResponseEntity.status(HttpStatus.CREATED).body(body);
  }
}
