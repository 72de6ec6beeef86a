package com.scholary.tts.handler.job;

import com.scholary.tts.handler.synthesis.SpeechRequest;
import java.time.Instant;

/**
 * Represents one synthesis job.
 *
 * <p>Tracks the job's state and timestamps. Instances are owned by {@link JobManager}; the mutable
 * fields are only touched while holding its lock, and once a worker has claimed the job only that
 * worker changes its status. Readers outside the manager get a {@link JobSnapshot}.
 */
class TtsJob {

  private final String jobId;
  private final SpeechRequest request;
  private final Instant createdAt;

  private JobStatus status;
  private Instant startedAt;
  private Instant finishedAt;
  private String error;

  TtsJob(String jobId, SpeechRequest request, Instant createdAt) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = createdAt;
    this.status = JobStatus.QUEUED;
  }

  String getJobId() {
    return jobId;
  }

  SpeechRequest getRequest() {
    return request;
  }

  Instant getCreatedAt() {
    return createdAt;
  }

  JobStatus getStatus() {
    return status;
  }

  Instant getStartedAt() {
    return startedAt;
  }

  Instant getFinishedAt() {
    return finishedAt;
  }

  String getError() {
    return error;
  }

  void markProcessing(Instant now) {
    requireStatus(JobStatus.QUEUED);
    this.status = JobStatus.PROCESSING;
    this.startedAt = now;
  }

  void markCompleted(Instant now) {
    requireStatus(JobStatus.PROCESSING);
    this.status = JobStatus.COMPLETED;
    this.finishedAt = now;
  }

  void markFailed(Instant now, String reason) {
    requireStatus(JobStatus.PROCESSING);
    this.status = JobStatus.FAILED;
    this.finishedAt = now;
    this.error = reason;
  }

  JobSnapshot snapshot() {
    return new JobSnapshot(jobId, request, status, createdAt, startedAt, finishedAt, error);
  }

  private void requireStatus(JobStatus expected) {
    if (status != expected) {
      throw new IllegalStateException(
          String.format("Job %s is %s, expected %s", jobId, status, expected));
    }
  }
}
