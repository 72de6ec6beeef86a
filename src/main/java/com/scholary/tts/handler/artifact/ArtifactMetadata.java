package com.scholary.tts.handler.artifact;

import java.time.Instant;

/**
 * Completion index entry for one stored artifact.
 *
 * <p>{@code text} and {@code voice} are null for artifacts discovered without a sidecar record.
 */
public record ArtifactMetadata(
    String jobId,
    Instant createdAt,
    Instant completedAt,
    String text,
    String voice,
    long sizeBytes) {

  /** Copy of this entry with the stored size filled in. */
  public ArtifactMetadata withSize(long size) {
    return new ArtifactMetadata(jobId, createdAt, completedAt, text, voice, size);
  }
}
