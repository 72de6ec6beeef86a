package com.scholary.tts.handler.artifact;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for finished audio, keyed by job id.
 *
 * <p>The existence of an artifact is the authoritative signal that a job completed, so
 * implementations must never expose a partially written artifact. Each store also keeps a small
 * completion index ({@link ArtifactMetadata} per job) so that listings and counters do not need a
 * full scan of the backing storage.
 *
 * <p>Implementations are thread-safe.
 */
public interface ArtifactStore {

  /**
   * Persist an artifact and its index entry.
   *
   * <p>The write is atomic from a reader's point of view: {@link #exists} turns true only once the
   * complete audio is in place.
   *
   * @param metadata completion metadata for the index
   * @param audio the encoded audio
   * @throws ArtifactStoreException if the write fails
   */
  void save(ArtifactMetadata metadata, byte[] audio);

  /**
   * Check whether a finished artifact exists.
   *
   * @param jobId the job id
   * @return true if the artifact exists
   */
  boolean exists(String jobId);

  /**
   * Read an artifact's bytes.
   *
   * @param jobId the job id
   * @return the audio, or empty if no artifact exists
   * @throws ArtifactStoreException if the artifact exists but cannot be read
   */
  Optional<byte[]> read(String jobId);

  /**
   * Delete an artifact and its index entry.
   *
   * @param jobId the job id
   * @return true if an artifact was removed, false if there was none
   * @throws ArtifactStoreException if the delete fails
   */
  boolean delete(String jobId);

  /**
   * List the completion index.
   *
   * @return metadata for every stored artifact, in no particular order
   */
  List<ArtifactMetadata> list();

  /**
   * Count stored artifacts.
   *
   * @return the number of artifacts in the index
   */
  int count();
}
