package com.scholary.tts.handler.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.tts.handler.artifact.ArtifactStore;
import com.scholary.tts.handler.artifact.FileSystemArtifactStore;
import com.scholary.tts.handler.config.TtsProperties;
import com.scholary.tts.handler.synthesis.SpeechRequest;
import com.scholary.tts.handler.synthesis.SpeechSynthesizer;
import com.scholary.tts.handler.synthesis.SynthesisException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Tests for JobManager.
 *
 * <p>Most tests hand tasks to a queue instead of a thread pool and run them by hand, so every state
 * in between can be observed.
 */
class JobManagerTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
  private static final byte[] AUDIO = new byte[256];

  @TempDir Path tempDir;

  private final Deque<Runnable> pending = new ArrayDeque<>();
  private SpeechSynthesizer synthesizer;
  private ArtifactStore artifactStore;
  private JobManager manager;

  @BeforeEach
  void setUp() {
    synthesizer = mock(SpeechSynthesizer.class);
    artifactStore = new FileSystemArtifactStore(tempDir);
    // maxConcurrent=1, backlogFactor=2: a submit is refused once 3 jobs are unfinished
    manager = newManager(1, pending::add);
  }

  @Test
  void submit_shouldReturnUniqueIdsAndQueueJobs() {
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < 3; i++) {
      ids.add(manager.submit(request("job " + i)));
    }

    assertThat(ids).hasSize(3);
    assertThat(manager.queueSize()).isEqualTo(3);
    assertThat(ids).allSatisfy(id -> assertThat(manager.jobStatus(id)).contains(JobStatus.QUEUED));
    verifyNoInteractions(synthesizer);
  }

  @Test
  void process_shouldMoveJobThroughProcessingToCompleted() {
    String jobId = manager.submit(request("Hello world"));
    List<JobStatus> seenBySynthesizer = new ArrayList<>();
    when(synthesizer.synthesize(any()))
        .thenAnswer(
            invocation -> {
              seenBySynthesizer.add(manager.jobStatus(jobId).orElseThrow());
              return AUDIO;
            });

    runNext();

    assertThat(seenBySynthesizer).containsExactly(JobStatus.PROCESSING);
    assertThat(manager.jobStatus(jobId)).contains(JobStatus.COMPLETED);
    assertThat(manager.queueSize()).isZero();
    assertThat(artifactStore.read(jobId)).hasValueSatisfying(b -> assertThat(b).hasSize(256));
    assertThat(artifactStore.list())
        .singleElement()
        .satisfies(
            metadata -> {
              assertThat(metadata.text()).isEqualTo("Hello world");
              assertThat(metadata.createdAt()).isEqualTo(CLOCK.instant());
            });

    JobSnapshot snapshot = manager.findJob(jobId).orElseThrow();
    assertThat(snapshot.startedAt()).isNotNull();
    assertThat(snapshot.finishedAt()).isNotNull();
    assertThat(snapshot.error()).isNull();
  }

  @Test
  void submit_shouldRejectWhenOverCapacityWithoutChangingState() {
    for (int i = 0; i < 3; i++) {
      manager.submit(request("job " + i));
    }
    int jobsBefore = manager.jobCount();

    assertThatThrownBy(() -> manager.submit(request("one too many")))
        .isInstanceOfSatisfying(
            CapacityExceededException.class,
            ex -> {
              assertThat(ex.getQueueSize()).isEqualTo(3);
              assertThat(ex.getLimit()).isEqualTo(2);
            });

    assertThat(manager.queueSize()).isEqualTo(3);
    assertThat(manager.jobCount()).isEqualTo(jobsBefore);
    assertThat(pending).hasSize(3);
  }

  @Test
  void submit_shouldAcceptAgainOnceAJobFinishes() {
    when(synthesizer.synthesize(any())).thenReturn(AUDIO);
    for (int i = 0; i < 3; i++) {
      manager.submit(request("job " + i));
    }
    assertThatThrownBy(() -> manager.submit(request("rejected")))
        .isInstanceOf(CapacityExceededException.class);

    runNext();

    assertThat(manager.queueSize()).isEqualTo(2);
    String accepted = manager.submit(request("accepted"));
    assertThat(manager.jobStatus(accepted)).contains(JobStatus.QUEUED);
  }

  @Test
  void submit_shouldAdmitExactlyCapacityUnderConcurrentCallers() throws Exception {
    Queue<Runnable> handedOff = new ConcurrentLinkedQueue<>();
    // maxConcurrent=5, backlogFactor=2: 11 jobs fit before the first refusal
    manager = newManager(5, handedOff::add);
    int callers = 32;
    int submissions = 500;
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger remaining = new AtomicInteger(submissions);
    AtomicInteger accepted = new AtomicInteger();
    AtomicInteger rejected = new AtomicInteger();
    Set<String> ids = ConcurrentHashMap.newKeySet();
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  while (remaining.getAndDecrement() > 0) {
                    try {
                      ids.add(manager.submit(request("concurrent")));
                      accepted.incrementAndGet();
                    } catch (CapacityExceededException ex) {
                      rejected.incrementAndGet();
                    }
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(accepted.get()).isEqualTo(11);
    assertThat(rejected.get()).isEqualTo(submissions - 11);
    assertThat(ids).hasSize(11);
    assertThat(manager.queueSize()).isEqualTo(handedOff.size()).isEqualTo(11);
    assertThat(manager.jobCount()).isEqualTo(11);
    assertThat(ids).allSatisfy(id -> assertThat(manager.jobStatus(id)).contains(JobStatus.QUEUED));
  }

  @Test
  void submit_shouldRollBackWhenWorkerPoolRefusesTask() {
    manager =
        newManager(
            1,
            task -> {
              throw new RejectedExecutionException("shutting down");
            });

    assertThatThrownBy(() -> manager.submit(request("Hello")))
        .isInstanceOf(CapacityExceededException.class);
    assertThat(manager.queueSize()).isZero();
    assertThat(manager.jobCount()).isZero();
  }

  @Test
  void process_shouldMarkFailedWithoutRetry() {
    String failing = manager.submit(request("fails"));
    String next = manager.submit(request("works"));
    when(synthesizer.synthesize(any()))
        .thenThrow(new SynthesisException("engine down"))
        .thenReturn(AUDIO);

    runNext();

    JobSnapshot failed = manager.findJob(failing).orElseThrow();
    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.error()).isEqualTo("engine down");
    assertThat(artifactStore.exists(failing)).isFalse();
    assertThat(manager.queueSize()).isEqualTo(1);

    runNext();

    assertThat(manager.jobStatus(next)).contains(JobStatus.COMPLETED);
    assertThat(manager.jobStatus(failing)).contains(JobStatus.FAILED);
    assertThat(pending).isEmpty();
    verify(synthesizer, times(2)).synthesize(any());
  }

  @Test
  void process_shouldFailJobWhenEngineReturnsNoAudio() {
    String jobId = manager.submit(request("silence"));
    when(synthesizer.synthesize(any())).thenReturn(new byte[0]);

    runNext();

    JobSnapshot job = manager.findJob(jobId).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.error()).contains("no audio");
    assertThat(artifactStore.exists(jobId)).isFalse();
  }

  @Test
  void process_shouldFailJobWhenArtifactWriteFails() {
    ArtifactStore failingStore = mock(ArtifactStore.class);
    doThrow(new IllegalStateException("disk full"))
        .when(failingStore)
        .save(any(), any());
    artifactStore = failingStore;
    manager = newManager(1, pending::add);
    String jobId = manager.submit(request("Hello"));
    when(synthesizer.synthesize(any())).thenReturn(AUDIO);

    runNext();

    assertThat(manager.findJob(jobId).orElseThrow().error()).isEqualTo("disk full");
    assertThat(manager.queueSize()).isZero();
  }

  @Test
  void cleanup_shouldBeIdempotent() {
    when(synthesizer.synthesize(any())).thenReturn(AUDIO);
    String jobId = manager.submit(request("Hello"));
    runNext();

    assertThat(manager.cleanup(jobId)).isTrue();
    assertThat(manager.cleanup(jobId)).isFalse();
    assertThat(manager.contains(jobId)).isFalse();
    assertThat(manager.queueSize()).isZero();
    assertThat(artifactStore.exists(jobId)).isTrue();
  }

  @Test
  void cleanup_ofQueuedJob_shouldSkipSynthesisAndFreeCapacity() {
    String jobId = manager.submit(request("never spoken"));

    assertThat(manager.cleanup(jobId)).isTrue();
    assertThat(manager.queueSize()).isZero();

    runNext();

    verifyNoInteractions(synthesizer);
    assertThat(manager.contains(jobId)).isFalse();
    assertThat(artifactStore.exists(jobId)).isFalse();
  }

  @Test
  void cleanup_whileProcessing_shouldKeepArtifactAndDropFinalStatus() {
    String jobId = manager.submit(request("Hello"));
    when(synthesizer.synthesize(any()))
        .thenAnswer(
            invocation -> {
              assertThat(manager.cleanup(jobId)).isTrue();
              return AUDIO;
            });

    runNext();

    assertThat(manager.contains(jobId)).isFalse();
    assertThat(manager.queueSize()).isZero();
    assertThat(artifactStore.exists(jobId)).isTrue();
  }

  @Test
  void workers_shouldClaimJobsInSubmissionOrder() throws Exception {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setThreadNamePrefix("test-synthesis-");
    executor.initialize();
    try {
      manager = newManager(1, executor);
      CountDownLatch firstStarted = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      List<String> order = Collections.synchronizedList(new ArrayList<>());
      when(synthesizer.synthesize(any()))
          .thenAnswer(
              invocation -> {
                SpeechRequest request = invocation.getArgument(0);
                order.add(request.text());
                if (request.text().equals("first")) {
                  firstStarted.countDown();
                  release.await(5, TimeUnit.SECONDS);
                }
                return AUDIO;
              });

      String first = manager.submit(request("first"));
      assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();
      String second = manager.submit(request("second"));
      String third = manager.submit(request("third"));

      assertThat(manager.jobStatus(first)).contains(JobStatus.PROCESSING);
      assertThat(manager.jobStatus(second)).contains(JobStatus.QUEUED);
      assertThat(manager.jobStatus(third)).contains(JobStatus.QUEUED);

      release.countDown();
      await()
          .atMost(Duration.ofSeconds(5))
          .untilAsserted(() -> assertThat(manager.queueSize()).isZero());

      assertThat(order).containsExactly("first", "second", "third");
      assertThat(List.of(first, second, third))
          .allSatisfy(id -> assertThat(manager.jobStatus(id)).contains(JobStatus.COMPLETED));
    } finally {
      executor.shutdown();
    }
  }

  private JobManager newManager(int maxConcurrent, Executor executor) {
    TtsProperties properties = new TtsProperties(maxConcurrent, 2, 50, 100, 0);
    return new JobManager(
        new JobRepository(Duration.ZERO, System::nanoTime),
        artifactStore,
        synthesizer,
        executor,
        CLOCK,
        properties);
  }

  private void runNext() {
    Runnable task = pending.poll();
    assertThat(task).as("pending task").isNotNull();
    task.run();
  }

  private static SpeechRequest request(String text) {
    return new SpeechRequest(text, "en-US-AriaNeural", 0, 0, 0);
  }
}
