package com.scholary.tts.handler.service;

import com.scholary.tts.handler.api.HealthResponse;
import com.scholary.tts.handler.artifact.ArtifactStore;
import com.scholary.tts.handler.job.JobManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Reports liveness with queue and artifact counters. Never throws. */
@Service
public class HealthService {

  private static final Logger LOGGER = LoggerFactory.getLogger(HealthService.class);

  private final ArtifactStore artifactStore;
  private final JobManager jobManager;

  public HealthService(ArtifactStore artifactStore, JobManager jobManager) {
    this.artifactStore = artifactStore;
    this.jobManager = jobManager;
  }

  public HealthResponse report() {
    try {
      return HealthResponse.healthy(
          artifactStore.count(), jobManager.queueSize(), jobManager.jobCount());
    } catch (RuntimeException e) {
      LOGGER.error("Health check error", e);
      return HealthResponse.unhealthy(e.getMessage());
    }
  }
}
