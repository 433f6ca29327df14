package com.mk.fx.qa.boundary.analysis.cfg;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.UUID;

/**
 * Body returned when an analysis request is rejected or refers to an unknown run.
 *
 * @param error short category, e.g. "Invalid Argument" or "Invalid Boundary Type"
 * @param details what was rejected, such as the duplicate condition or the allowed values
 * @param analysisId the run the request addressed, omitted when there is none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Rejected analysis request")
public record ErrorResponse(String error, String details, UUID analysisId) {

  public static ErrorResponse of(String error, String details) {
    return new ErrorResponse(error, details, null);
  }
}
