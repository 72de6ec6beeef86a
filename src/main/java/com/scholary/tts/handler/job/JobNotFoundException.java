package com.scholary.tts.handler.job;

/** Thrown when a job id is unknown to both memory and the artifact store. */
public class JobNotFoundException extends RuntimeException {

  private final String jobId;

  public JobNotFoundException(String jobId) {
    super("Job " + jobId + " not found");
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
