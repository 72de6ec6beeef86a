package com.scholary.tts.handler.service;

/**
 * Thrown when an artifact exists but is smaller than the minimum plausible size.
 *
 * <p>Distinct from {@link ArtifactNotFoundException}: it points at a defect on the write path
 * (truncated or corrupt output), not at a job that is still running.
 */
public class IncompleteArtifactException extends RuntimeException {

  private final String jobId;
  private final int sizeBytes;

  public IncompleteArtifactException(String jobId, int sizeBytes, int minBytes) {
    super(
        String.format(
            "Audio file appears to be incomplete for job %s (%d bytes, expected at least %d)",
            jobId, sizeBytes, minBytes));
    this.jobId = jobId;
    this.sizeBytes = sizeBytes;
  }

  public String getJobId() {
    return jobId;
  }

  public int getSizeBytes() {
    return sizeBytes;
  }
}
