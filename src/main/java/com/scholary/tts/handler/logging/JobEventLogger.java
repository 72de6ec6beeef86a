package com.scholary.tts.handler.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured job lifecycle logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets {@code event_type} plus its own fields for the duration of one log call, so
 * they can be queried in a log aggregator. Events raised on a worker thread rely on the job context
 * set by {@link #setJobContext}; the others carry {@code jobId} themselves.
 */
public class JobEventLogger {

  private final Logger logger;

  public JobEventLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job accepted into the queue. */
  public void logSubmitted(String jobId, int textLength, String voice, int queueSize) {
    try (MDC.MDCCloseable context = MDC.putCloseable("jobId", jobId)) {
      MDC.put("event_type", "job_submitted");
      MDC.put("textLength", String.valueOf(textLength));
      MDC.put("voice", voice);
      MDC.put("queueSize", String.valueOf(queueSize));

      logger.info(
          "Job submitted: jobId={}, voice={}, chars={}, queueSize={}",
          jobId,
          voice,
          textLength,
          queueSize);
    } finally {
      clearEventFields();
    }
  }

  /** Log a submission refused by admission control. */
  public void logRejected(int queueSize, int limit) {
    try {
      MDC.put("event_type", "job_rejected");
      MDC.put("queueSize", String.valueOf(queueSize));
      MDC.put("limit", String.valueOf(limit));

      logger.warn("Job rejected: queueSize={} exceeds limit={}", queueSize, limit);
    } finally {
      clearEventFields();
    }
  }

  /** Log a worker claiming a job. */
  public void logStarted(String jobId, long waitMs) {
    try {
      MDC.put("event_type", "job_started");
      MDC.put("waitMs", String.valueOf(waitMs));

      logger.info("Job started: jobId={}, queuedFor={}ms", jobId, waitMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job whose artifact was written. */
  public void logCompleted(String jobId, int audioBytes, long synthesisMs) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("audioBytes", String.valueOf(audioBytes));
      MDC.put("synthesisMs", String.valueOf(synthesisMs));

      logger.info(
          "Job completed: jobId={}, bytes={}, synthesis={}ms", jobId, audioBytes, synthesisMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job that ended in FAILED. */
  public void logFailed(String jobId, String errorType, String message, long synthesisMs) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", errorType);
      MDC.put("synthesisMs", String.valueOf(synthesisMs));

      logger.error(
          "Job failed: jobId={}, error={}, message={}, after={}ms",
          jobId,
          errorType,
          message,
          synthesisMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log removal of an in-memory record. */
  public void logCleaned(String jobId, String previousStatus) {
    try (MDC.MDCCloseable context = MDC.putCloseable("jobId", jobId)) {
      MDC.put("event_type", "job_cleaned");
      MDC.put("previousStatus", previousStatus);

      logger.info("Job cleaned up: jobId={}, status={}", jobId, previousStatus);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("textLength");
    MDC.remove("voice");
    MDC.remove("queueSize");
    MDC.remove("limit");
    MDC.remove("waitMs");
    MDC.remove("audioBytes");
    MDC.remove("synthesisMs");
    MDC.remove("errorType");
    MDC.remove("previousStatus");
  }
}
