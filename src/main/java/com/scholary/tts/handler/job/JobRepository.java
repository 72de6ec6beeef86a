package com.scholary.tts.handler.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.tts.handler.config.TtsProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory table of synthesis jobs.
 *
 * <p>Backed by a Caffeine cache with a per-entry {@link Expiry}: QUEUED and PROCESSING jobs never
 * expire, and terminal jobs expire {@code tts.completed-retention-minutes} after they finished. The
 * default retention of 0 keeps terminal jobs until someone calls {@link JobManager#cleanup}, so
 * memory grows with the number of finished jobs that nobody cleans up.
 *
 * <p>Expiry is evaluated on write, so callers must {@link #save} a job again after changing its
 * status.
 */
@Repository
class JobRepository {

  private final Cache<String, TtsJob> cache;

  @Autowired
  JobRepository(TtsProperties properties) {
    this(Duration.ofMinutes(properties.completedRetentionMinutes()), Ticker.systemTicker());
  }

  JobRepository(Duration completedRetention, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .expireAfter(new TerminalJobExpiry(completedRetention))
            .ticker(ticker)
            .executor(Runnable::run)
            .build();
  }

  void save(TtsJob job) {
    cache.put(job.getJobId(), job);
  }

  Optional<TtsJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  List<TtsJob> findAll() {
    return new ArrayList<>(cache.asMap().values());
  }

  void delete(String jobId) {
    cache.invalidate(jobId);
  }

  long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private static final class TerminalJobExpiry implements Expiry<String, TtsJob> {

    private final long retentionNanos;

    TerminalJobExpiry(Duration retention) {
      this.retentionNanos = retention.isZero() ? Long.MAX_VALUE : retention.toNanos();
    }

    @Override
    public long expireAfterCreate(String jobId, TtsJob job, long currentTime) {
      return job.getStatus().isTerminal() ? retentionNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterUpdate(
        String jobId, TtsJob job, long currentTime, long currentDuration) {
      return job.getStatus().isTerminal() ? retentionNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterRead(
        String jobId, TtsJob job, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
