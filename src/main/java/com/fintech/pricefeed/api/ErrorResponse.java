package com.fintech.pricefeed.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every endpoint.
 * Follows RFC 7807 Problem Details for HTTP APIs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "400")
    int status,

    @Schema(description = "Error type/category", example = "SERVICE_VALIDATION_ERROR")
    String error,

    @Schema(description = "Human-readable error message", example = "Unsupported interval '2m'. Allowed: 1m, 5m, 15m, 1h, 4h, 1d")
    String message,

    @Schema(description = "Request path that caused the error", example = "/api/v1/prices/0xabc/candles")
    String path,

    @Schema(description = "Timestamp of the error", example = "2026-01-15T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Field-level errors, when the request body or parameters failed validation")
    List<ValidationError> validationErrors
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path, List<ValidationError> validationErrors) {
        this(status, error, message, path, Instant.now(), validationErrors);
    }

    @Schema(description = "Field-level validation error")
    public record ValidationError(
        @Schema(description = "Field name that failed validation", example = "count")
        String field,

        @Schema(description = "Rejected value", example = "0")
        String rejectedValue,

        @Schema(description = "Validation error message", example = "must be greater than or equal to 1")
        String message
    ) {}
}
