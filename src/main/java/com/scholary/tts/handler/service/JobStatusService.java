package com.scholary.tts.handler.service;

import com.scholary.tts.handler.api.JobStatusResponse;
import com.scholary.tts.handler.artifact.ArtifactStore;
import com.scholary.tts.handler.job.JobManager;
import com.scholary.tts.handler.job.JobNotFoundException;
import com.scholary.tts.handler.job.JobSnapshot;
import com.scholary.tts.handler.job.JobStatus;
import org.springframework.stereotype.Service;

/**
 * Resolves a job's status for clients.
 *
 * <p>The artifact store is checked first: a stored artifact means COMPLETED, whatever the
 * in-memory record still says. Only when there is no artifact does the job manager's record
 * decide.
 */
@Service
public class JobStatusService {

  private final ArtifactStore artifactStore;
  private final JobManager jobManager;

  public JobStatusService(ArtifactStore artifactStore, JobManager jobManager) {
    this.artifactStore = artifactStore;
    this.jobManager = jobManager;
  }

  /**
   * Look up a job.
   *
   * @param jobId the job id
   * @return the current status
   * @throws JobNotFoundException if neither the store nor memory knows the job
   */
  public JobStatusResponse status(String jobId) {
    if (artifactStore.exists(jobId)) {
      return new JobStatusResponse(jobId, JobStatus.COMPLETED, "Audio is ready");
    }

    JobSnapshot job = jobManager.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    return new JobStatusResponse(jobId, job.status(), describe(job));
  }

  private static String describe(JobSnapshot job) {
    return switch (job.status()) {
      case QUEUED -> "Audio is queued for processing";
      case PROCESSING -> "Audio is being processed";
      case COMPLETED -> "Audio is ready";
      case FAILED -> "Audio generation failed: " + job.error();
    };
  }
}
