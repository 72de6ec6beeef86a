package com.scholary.tts.handler.service;

import com.scholary.tts.handler.artifact.ArtifactMetadata;
import com.scholary.tts.handler.artifact.ArtifactStore;
import com.scholary.tts.handler.config.TtsProperties;
import com.scholary.tts.handler.job.JobManager;
import com.scholary.tts.handler.job.JobSnapshot;
import com.scholary.tts.handler.job.JobStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Builds the merged job listing.
 *
 * <p>Completed jobs come from the artifact store's index; active jobs come from the job manager.
 * A job that has an artifact is listed once, from the store. The result is newest first and
 * capped at {@code tts.list-limit}.
 */
@Service
public class JobLister {

  private static final String ELLIPSIS = "...";

  private final ArtifactStore artifactStore;
  private final JobManager jobManager;
  private final int maxLimit;
  private final int previewLength;

  public JobLister(ArtifactStore artifactStore, JobManager jobManager, TtsProperties properties) {
    this.artifactStore = artifactStore;
    this.jobManager = jobManager;
    this.maxLimit = properties.listLimit();
    this.previewLength = properties.previewLength();
  }

  /** List with the configured default limit. */
  public List<JobSummary> list() {
    return list(maxLimit);
  }

  /**
   * List recent jobs.
   *
   * @param limit maximum number of entries; values outside 1..{@code tts.list-limit} fall back to
   *     the configured limit
   * @return summaries ordered by creation time, newest first
   */
  public List<JobSummary> list(int limit) {
    int effectiveLimit = limit <= 0 || limit > maxLimit ? maxLimit : limit;

    // Memory before the store, so a job finishing in between appears in both and is deduplicated
    List<JobSnapshot> inMemory = jobManager.activeJobs();
    List<ArtifactMetadata> stored = artifactStore.list();

    List<JobSummary> all = new ArrayList<>(stored.size() + inMemory.size());
    Set<String> withArtifact = new HashSet<>();
    for (ArtifactMetadata artifact : stored) {
      withArtifact.add(artifact.jobId());
      all.add(
          new JobSummary(
              artifact.jobId(),
              JobStatus.COMPLETED,
              artifact.createdAt(),
              true,
              preview(artifact.text())));
    }
    for (JobSnapshot job : inMemory) {
      if (withArtifact.contains(job.jobId())) {
        continue;
      }
      // The audio lands before the store's index entry is written
      if (mayHaveAudio(job.status()) && artifactStore.exists(job.jobId())) {
        all.add(
            new JobSummary(
                job.jobId(),
                JobStatus.COMPLETED,
                job.createdAt(),
                true,
                preview(job.request().text())));
      } else {
        all.add(
            new JobSummary(
                job.jobId(), job.status(), job.createdAt(), false, preview(job.request().text())));
      }
    }

    all.sort(
        Comparator.comparing(
                JobSummary::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(JobSummary::jobId));
    return all.size() > effectiveLimit ? List.copyOf(all.subList(0, effectiveLimit)) : all;
  }

  private static boolean mayHaveAudio(JobStatus status) {
    return status == JobStatus.PROCESSING || status == JobStatus.COMPLETED;
  }

  String preview(String text) {
    if (text == null || text.length() <= previewLength) {
      return text;
    }
    return text.substring(0, previewLength) + ELLIPSIS;
  }
}
