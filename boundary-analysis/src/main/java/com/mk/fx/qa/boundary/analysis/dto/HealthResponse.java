package com.mk.fx.qa.boundary.analysis.dto;

/**
 * Represents the health status of the service.
 *
 * @param status the health status, e.g. "UP" or "DOWN"
 */
public record HealthResponse(String status) {}
