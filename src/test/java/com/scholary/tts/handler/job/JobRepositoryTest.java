package com.scholary.tts.handler.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.tts.handler.synthesis.SpeechRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final AtomicLong nanos = new AtomicLong();

  @Test
  void terminalJobs_shouldExpireAfterRetention() {
    JobRepository repository = new JobRepository(Duration.ofMinutes(10), nanos::get);
    TtsJob job = newJob("done");
    job.markProcessing(Instant.now());
    job.markCompleted(Instant.now());
    repository.save(job);

    advance(Duration.ofMinutes(9));
    assertThat(repository.findById("done")).isPresent();

    advance(Duration.ofMinutes(2));
    assertThat(repository.findById("done")).isEmpty();
    assertThat(repository.size()).isZero();
  }

  @Test
  void activeJobs_shouldNeverExpire() {
    JobRepository repository = new JobRepository(Duration.ofMinutes(10), nanos::get);
    TtsJob queued = newJob("queued");
    TtsJob processing = newJob("processing");
    processing.markProcessing(Instant.now());
    repository.save(queued);
    repository.save(processing);

    advance(Duration.ofDays(30));

    assertThat(repository.findAll())
        .extracting(TtsJob::getJobId)
        .containsExactlyInAnyOrder("queued", "processing");
  }

  @Test
  void retentionClock_shouldStartWhenJobFinishes() {
    JobRepository repository = new JobRepository(Duration.ofMinutes(10), nanos::get);
    TtsJob job = newJob("slow");
    repository.save(job);
    job.markProcessing(Instant.now());
    repository.save(job);

    advance(Duration.ofMinutes(30));
    job.markFailed(Instant.now(), "engine down");
    repository.save(job);

    advance(Duration.ofMinutes(5));
    assertThat(repository.findById("slow")).isPresent();
  }

  @Test
  void zeroRetention_shouldKeepTerminalJobsUntilDeleted() {
    JobRepository repository = new JobRepository(Duration.ZERO, nanos::get);
    TtsJob job = newJob("kept");
    job.markProcessing(Instant.now());
    job.markCompleted(Instant.now());
    repository.save(job);

    advance(Duration.ofDays(365));
    assertThat(repository.findById("kept")).isPresent();

    repository.delete("kept");
    assertThat(repository.findById("kept")).isEmpty();
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }

  private static TtsJob newJob(String jobId) {
    return new TtsJob(
        jobId, new SpeechRequest("Hello", "en-US-AriaNeural", 0, 0, 0), Instant.now());
  }
}
