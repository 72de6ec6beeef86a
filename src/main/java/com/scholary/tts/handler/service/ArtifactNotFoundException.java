package com.scholary.tts.handler.service;

/** Thrown when no artifact exists for a job, either because it is not ready or was deleted. */
public class ArtifactNotFoundException extends RuntimeException {

  private final String jobId;

  public ArtifactNotFoundException(String jobId, String message) {
    super(message);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
