package com.scholary.tts.handler.service;

import com.scholary.tts.handler.artifact.ArtifactStore;
import com.scholary.tts.handler.artifact.ArtifactStoreProperties;
import com.scholary.tts.handler.job.JobManager;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

/**
 * Read and delete path for finished audio.
 *
 * <p>Fetch applies a minimum-size sanity check so a truncated artifact is reported as incomplete
 * rather than served. Delete removes the artifact synchronously and schedules cleanup of the
 * job's in-memory record on the maintenance executor; that cleanup is best-effort and not part of
 * the delete's success.
 */
@Service
public class ArtifactAccessService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactAccessService.class);

  private final ArtifactStore artifactStore;
  private final JobManager jobManager;
  private final Executor maintenanceExecutor;
  private final int minBytes;
  private final String cacheControl;

  public ArtifactAccessService(
      ArtifactStore artifactStore,
      JobManager jobManager,
      @Qualifier("maintenanceExecutor") Executor maintenanceExecutor,
      ArtifactStoreProperties properties) {
    this.artifactStore = artifactStore;
    this.jobManager = jobManager;
    this.maintenanceExecutor = maintenanceExecutor;
    this.minBytes = properties.minBytes();
    this.cacheControl = "public, max-age=" + properties.cacheMaxAgeSeconds();
  }

  /**
   * Fetch a finished artifact.
   *
   * @param jobId the job id
   * @return the audio with cache metadata
   * @throws ArtifactNotFoundException if there is no artifact
   * @throws IncompleteArtifactException if the artifact is below the minimum size
   */
  public AudioArtifact fetch(String jobId) {
    byte[] audio =
        artifactStore
            .read(jobId)
            .orElseThrow(
                () ->
                    new ArtifactNotFoundException(
                        jobId, "Audio for job " + jobId + " not found or not ready yet"));

    if (audio.length < minBytes) {
      LOGGER.warn("Artifact too small: jobId={}, bytes={}, min={}", jobId, audio.length, minBytes);
      throw new IncompleteArtifactException(jobId, audio.length, minBytes);
    }

    return new AudioArtifact(jobId, audio, etag(jobId), cacheControl);
  }

  /**
   * Delete an artifact and schedule cleanup of its in-memory record.
   *
   * @param jobId the job id
   * @throws ArtifactNotFoundException if there is no artifact
   */
  public void delete(String jobId) {
    if (!artifactStore.delete(jobId)) {
      throw new ArtifactNotFoundException(jobId, "Audio for job " + jobId + " not found");
    }

    if (jobManager.contains(jobId)) {
      scheduleCleanup(jobId);
    }
  }

  /** Entity tag derived from the job id only, so repeated fetches get the same tag. */
  static String etag(String jobId) {
    return "\"" + DigestUtils.md5DigestAsHex(jobId.getBytes(StandardCharsets.UTF_8)) + "\"";
  }

  private void scheduleCleanup(String jobId) {
    try {
      maintenanceExecutor.execute(
          () -> {
            try {
              jobManager.cleanup(jobId);
            } catch (RuntimeException e) {
              LOGGER.warn("Background cleanup failed for job {}", jobId, e);
            }
          });
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Could not schedule cleanup for job {}, record stays in memory", jobId, e);
    }
  }
}
