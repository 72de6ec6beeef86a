package com.scholary.tts.handler.job;

import com.scholary.tts.handler.artifact.ArtifactMetadata;
import com.scholary.tts.handler.artifact.ArtifactStore;
import com.scholary.tts.handler.config.TtsProperties;
import com.scholary.tts.handler.logging.JobEventLogger;
import com.scholary.tts.handler.synthesis.SpeechRequest;
import com.scholary.tts.handler.synthesis.SpeechSynthesizer;
import com.scholary.tts.handler.synthesis.SynthesisException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Schedules synthesis jobs onto a fixed pool of workers.
 *
 * <p>Owns the in-memory job table, the count of unfinished jobs and the hand-off to the worker
 * pool. All three are guarded by a single lock; nothing outside this class touches a {@link
 * TtsJob}.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>{@link #submit} applies admission control, records the job as QUEUED and hands it to the
 *       {@code synthesisExecutor}. It never waits for a worker.
 *   <li>The executor runs {@code maxConcurrent} threads over an unbounded FIFO queue, so jobs are
 *       claimed in submission order. Claiming moves the job to PROCESSING.
 *   <li>The worker calls the engine and writes the artifact without holding the lock, then takes
 *       the lock again to record COMPLETED or FAILED.
 * </ol>
 *
 * <p>Failures are terminal: the reason is kept on the record and the job is never retried. Records
 * stay in memory until {@link #cleanup} is called or the optional retention expires them.
 */
@Service
public class JobManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobManager.class);
  private final JobEventLogger events = new JobEventLogger(LOGGER);

  private final JobRepository repository;
  private final ArtifactStore artifactStore;
  private final SpeechSynthesizer synthesizer;
  private final Executor workers;
  private final Clock clock;
  private final int maxConcurrent;
  private final int capacityLimit;

  private final ReentrantLock lock = new ReentrantLock();

  // QUEUED + PROCESSING, guarded by lock
  private int activeCount;

  JobManager(
      JobRepository repository,
      ArtifactStore artifactStore,
      SpeechSynthesizer synthesizer,
      @Qualifier("synthesisExecutor") Executor workers,
      Clock clock,
      TtsProperties properties) {
    this.repository = repository;
    this.artifactStore = artifactStore;
    this.synthesizer = synthesizer;
    this.workers = workers;
    this.clock = clock;
    this.maxConcurrent = properties.maxConcurrent();
    this.capacityLimit = properties.capacityLimit();

    LOGGER.info(
        "Job manager ready: maxConcurrent={}, capacityLimit={}", maxConcurrent, capacityLimit);
  }

  /**
   * Queue a synthesis request.
   *
   * @param request the validated request
   * @return the new job id
   * @throws CapacityExceededException if more than {@code maxConcurrent * backlogFactor} jobs are
   *     unfinished; nothing is enqueued in that case
   */
  public String submit(SpeechRequest request) {
    Objects.requireNonNull(request, "request");

    String jobId;
    int queueSize;
    lock.lock();
    try {
      if (activeCount > capacityLimit) {
        events.logRejected(activeCount, capacityLimit);
        throw new CapacityExceededException(activeCount, capacityLimit);
      }

      jobId = UUID.randomUUID().toString();
      repository.save(new TtsJob(jobId, request, clock.instant()));
      activeCount++;

      try {
        workers.execute(() -> process(jobId));
      } catch (RejectedExecutionException e) {
        repository.delete(jobId);
        activeCount--;
        LOGGER.error("Worker pool refused job {}", jobId, e);
        throw new CapacityExceededException(activeCount, capacityLimit, e);
      }
      queueSize = activeCount;
    } finally {
      lock.unlock();
    }

    events.logSubmitted(jobId, request.text().length(), request.voice(), queueSize);
    return jobId;
  }

  /**
   * Count unfinished jobs.
   *
   * @return the number of QUEUED and PROCESSING jobs
   */
  public int queueSize() {
    lock.lock();
    try {
      return activeCount;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Look up a job's in-memory status.
   *
   * <p>Empty means the id is unknown to memory; the artifact store may still hold its output.
   */
  public Optional<JobStatus> jobStatus(String jobId) {
    return findJob(jobId).map(JobSnapshot::status);
  }

  public Optional<JobSnapshot> findJob(String jobId) {
    lock.lock();
    try {
      return repository.findById(jobId).map(TtsJob::snapshot);
    } finally {
      lock.unlock();
    }
  }

  /** Snapshot of every job still held in memory, in any status. */
  public List<JobSnapshot> activeJobs() {
    lock.lock();
    try {
      return repository.findAll().stream().map(TtsJob::snapshot).toList();
    } finally {
      lock.unlock();
    }
  }

  public boolean contains(String jobId) {
    lock.lock();
    try {
      return repository.findById(jobId).isPresent();
    } finally {
      lock.unlock();
    }
  }

  /** Number of records in memory, finished ones included. */
  public int jobCount() {
    lock.lock();
    try {
      return (int) repository.size();
    } finally {
      lock.unlock();
    }
  }

  public int getMaxConcurrent() {
    return maxConcurrent;
  }

  public int getCapacityLimit() {
    return capacityLimit;
  }

  /**
   * Remove a job's in-memory record. Idempotent.
   *
   * <p>A QUEUED job is dropped before any worker sees it. A PROCESSING job keeps running; its
   * result is still written to the artifact store, only the final status update is discarded.
   *
   * @return true if a record was removed
   */
  public boolean cleanup(String jobId) {
    JobStatus previous;
    lock.lock();
    try {
      Optional<TtsJob> job = repository.findById(jobId);
      if (job.isEmpty()) {
        return false;
      }
      previous = job.get().getStatus();
      if (previous == JobStatus.QUEUED) {
        activeCount--;
      }
      repository.delete(jobId);
    } finally {
      lock.unlock();
    }

    events.logCleaned(jobId, previous.value());
    return true;
  }

  /** Worker entry point. Runs on a {@code synthesisExecutor} thread. */
  void process(String jobId) {
    TtsJob job = claim(jobId);
    if (job == null) {
      LOGGER.info("Skipping job {}: removed before a worker claimed it", jobId);
      return;
    }

    JobEventLogger.setJobContext(jobId);
    long started = System.nanoTime();
    String failure = "Unexpected error";
    String errorType = "Error";
    boolean completed = false;
    int audioBytes = 0;
    try {
      events.logStarted(jobId, Duration.between(job.getCreatedAt(), job.getStartedAt()).toMillis());

      SpeechRequest request = job.getRequest();
      byte[] audio = synthesizer.synthesize(request);
      if (audio == null || audio.length == 0) {
        throw new SynthesisException("Synthesis engine returned no audio");
      }
      artifactStore.save(
          new ArtifactMetadata(
              jobId, job.getCreatedAt(), clock.instant(), request.text(), request.voice(), 0),
          audio);

      audioBytes = audio.length;
      completed = true;
    } catch (Exception e) {
      failure = describe(e);
      errorType = e.getClass().getSimpleName();
      LOGGER.error("Synthesis failed for job {}", jobId, e);
    } finally {
      long elapsedMs = (System.nanoTime() - started) / 1_000_000;
      finish(job, completed, failure);
      if (completed) {
        events.logCompleted(jobId, audioBytes, elapsedMs);
      } else {
        events.logFailed(jobId, errorType, failure, elapsedMs);
      }
      JobEventLogger.clearJobContext();
    }
  }

  private TtsJob claim(String jobId) {
    lock.lock();
    try {
      TtsJob job = repository.findById(jobId).orElse(null);
      if (job == null || job.getStatus() != JobStatus.QUEUED) {
        return null;
      }
      job.markProcessing(clock.instant());
      repository.save(job);
      return job;
    } finally {
      lock.unlock();
    }
  }

  private void finish(TtsJob job, boolean completed, String failure) {
    lock.lock();
    try {
      activeCount--;
      // The record may have been cleaned up while the worker was busy
      if (repository.findById(job.getJobId()).orElse(null) != job) {
        LOGGER.info(
            "Job {} was cleaned up while processing, dropping final status", job.getJobId());
        return;
      }
      if (completed) {
        job.markCompleted(clock.instant());
      } else {
        job.markFailed(clock.instant(), failure);
      }
      repository.save(job);
    } finally {
      lock.unlock();
    }
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }
}
