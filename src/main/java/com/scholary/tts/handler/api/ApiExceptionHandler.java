package com.scholary.tts.handler.api;

import com.scholary.tts.handler.job.CapacityExceededException;
import com.scholary.tts.handler.job.JobNotFoundException;
import com.scholary.tts.handler.service.ArtifactNotFoundException;
import com.scholary.tts.handler.service.IncompleteArtifactException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Converts domain exceptions to HTTP responses.
 *
 * <p>Client errors are logged at warn without a stack trace. Anything unexpected is logged in full
 * and answered with a generic 500 that carries the exception message as detail.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException ex) {
    FieldError fieldError = ex.getBindingResult().getFieldError();
    String message =
        fieldError == null
            ? "Invalid request"
            : "text".equals(fieldError.getField())
                ? fieldError.getDefaultMessage()
                : fieldError.getField() + ": " + fieldError.getDefaultMessage();
    LOGGER.warn("Rejected invalid request: {}", message);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("InvalidRequest", message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
    LOGGER.warn("Rejected unreadable request body: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("InvalidRequest", "Request body is missing or malformed"));
  }

  /** Transient: the client should retry once the queue drains. */
  @ExceptionHandler(CapacityExceededException.class)
  public ResponseEntity<ApiError> handleCapacityExceeded(CapacityExceededException ex) {
    LOGGER.warn("Rejected submission: queueSize={}, limit={}", ex.getQueueSize(), ex.getLimit());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiError(
                "CapacityExceeded",
                "Server is at capacity, please try again later",
                null,
                ex.getQueueSize(),
                null,
                Instant.now()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ApiError.forJob("JobNotFound", ex.getMessage(), ex.getJobId()));
  }

  @ExceptionHandler(ArtifactNotFoundException.class)
  public ResponseEntity<ApiError> handleArtifactNotFound(ArtifactNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ApiError.forJob("AudioNotFound", ex.getMessage(), ex.getJobId()));
  }

  @ExceptionHandler(IncompleteArtifactException.class)
  public ResponseEntity<ApiError> handleIncompleteArtifact(IncompleteArtifactException ex) {
    LOGGER.error("Incomplete artifact served for job {}: {}", ex.getJobId(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(ApiError.forJob("AudioIncomplete", ex.getMessage(), ex.getJobId()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    // Framework errors such as unknown routes keep their own status
    if (ex instanceof ErrorResponse errorResponse) {
      HttpStatusCode status = errorResponse.getStatusCode();
      LOGGER.warn("Request failed with status {}: {}", status.value(), ex.getMessage());
      return ResponseEntity.status(status)
          .body(ApiError.of(ex.getClass().getSimpleName(), ex.getMessage()));
    }

    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                null,
                null,
                ex.getClass().getSimpleName() + ": " + ex.getMessage(),
                Instant.now()));
  }
}
