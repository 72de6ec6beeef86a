package com.scholary.tts.handler.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Standardized error response for API clients.
 *
 * <p>{@code jobId}, {@code queueSize} and {@code detail} are only present where they apply;
 * {@code detail} carries diagnostics for 500 responses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
    String errorCode,
    String message,
    String jobId,
    Integer queueSize,
    String detail,
    Instant timestamp) {

  static ApiError of(String errorCode, String message) {
    return new ApiError(errorCode, message, null, null, null, Instant.now());
  }

  static ApiError forJob(String errorCode, String message, String jobId) {
    return new ApiError(errorCode, message, jobId, null, null, Instant.now());
  }
}
