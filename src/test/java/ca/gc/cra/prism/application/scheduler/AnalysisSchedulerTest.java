package ca.gc.cra.prism.application.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.ModelLocatorPort;
import ca.gc.cra.prism.domain.analysis.AnalysisValidationException;
import ca.gc.cra.prism.domain.analysis.FileKind;
import ca.gc.cra.prism.domain.analysis.JobOutcome;
import ca.gc.cra.prism.domain.analysis.JobOutcome.FailureKind;
import ca.gc.cra.prism.domain.analysis.JobRecord;
import ca.gc.cra.prism.domain.analysis.JobStatus;
import ca.gc.cra.prism.domain.analysis.Priority;
import ca.gc.cra.prism.domain.analysis.Verdict;
import ca.gc.cra.prism.infrastructure.store.InMemoryResultStore;
import ca.gc.cra.prism.testutil.ManualClock;
import ca.gc.cra.prism.testutil.RecordingMetricsPort;
import ca.gc.cra.prism.testutil.ScriptedDetector;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class AnalysisSchedulerTest {
  private static final Duration WAIT = Duration.ofSeconds(10);
  private static final ModelLocatorPort MODELS = name -> Path.of("/models", name);

  private final ScriptedDetector detector = new ScriptedDetector();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ExecutorService callers = Executors.newCachedThreadPool();
  private AnalysisScheduler scheduler;

  @AfterEach
  void tearDown() {
    detector.release();
    if (scheduler != null) {
      scheduler.shutdown();
    }
    callers.shutdownNow();
  }

  @Test
  void imageJobCompletesWithVerdict() throws Exception {
    scheduler = started(settings(2, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));

    String id = scheduler.submit("/media/portrait.jpg", "image", "alice", 1);
    JobRecord record = scheduler.waitForCompletion(id, WAIT);

    assertEquals(JobStatus.COMPLETED, record.status());
    assertEquals(Verdict.AUTHENTIC, record.result().orElseThrow().verdict());
    assertEquals(FileKind.IMAGE, record.fileKind());
    assertEquals(Priority.NORMAL, record.priority());
    assertTrue(record.startedAtMillis() >= record.createdAtMillis());
    assertEquals(Path.of("/models", "deepfake_detector"), detector.modelPath());
    assertEquals(1L, metrics.count("scheduler.job.completed"));
    assertEquals(JobStatus.COMPLETED, scheduler.getStatus(id).orElseThrow());
  }

  @Test
  void submissionBlocksWhileTierIsFullUntilAWorkerFreesASlot() throws Exception {
    scheduler = started(settings(1, 3, BackpressureMode.BLOCK, Duration.ofSeconds(5)));
    detector.hold();

    String first = scheduler.submit("/media/a.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);
    awaitCondition(() -> detector.calls() == 1);
    for (int i = 0; i < 3; i++) {
      scheduler.submit("/media/q" + i + ".mp4", FileKind.VIDEO, "alice", Priority.NORMAL);
    }
    assertEquals(3, scheduler.getQueueDepths().get(Priority.NORMAL));

    Future<String> blocked = callers.submit(
        () -> scheduler.submit("/media/late.mp4", FileKind.VIDEO, "alice", Priority.NORMAL));
    TimeUnit.MILLISECONDS.sleep(300);
    assertFalse(blocked.isDone(), "submission should wait for room on the normal tier");

    detector.release();
    String late = blocked.get(WAIT.toSeconds(), TimeUnit.SECONDS);
    assertEquals(JobStatus.COMPLETED, scheduler.waitForCompletion(late, WAIT).status());
    assertEquals(JobStatus.COMPLETED, scheduler.waitForCompletion(first, WAIT).status());
  }

  @Test
  void tiersAreIsolatedFromEachOther() throws Exception {
    scheduler = started(settings(1, 2, BackpressureMode.REJECT, Duration.ofSeconds(5)));
    detector.hold();

    scheduler.submit("/media/n0.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);
    awaitCondition(() -> detector.calls() == 1);
    scheduler.submit("/media/n1.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);
    scheduler.submit("/media/n2.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);

    String critical = scheduler.submit("/media/urgent.mp4", FileKind.VIDEO, "bob", Priority.CRITICAL);
    awaitCondition(() -> scheduler.getStatus(critical).orElseThrow() == JobStatus.PROCESSING);
    assertEquals(2, scheduler.getQueueDepths().get(Priority.NORMAL));
    assertEquals(0, scheduler.getQueueDepths().get(Priority.CRITICAL));
  }

  @Test
  void rejectModeThrowsQueueFullAndLeavesNoRecord() throws Exception {
    scheduler = started(settings(1, 1, BackpressureMode.REJECT, Duration.ofSeconds(5)));
    detector.hold();

    scheduler.submit("/media/a.wav", FileKind.AUDIO, "alice", Priority.HIGH);
    awaitCondition(() -> detector.calls() == 1);
    scheduler.submit("/media/b.wav", FileKind.AUDIO, "alice", Priority.HIGH);

    QueueFullException full = assertThrows(QueueFullException.class,
        () -> scheduler.submit("/media/c.wav", FileKind.AUDIO, "alice", Priority.HIGH));
    assertEquals(Priority.HIGH, full.priority());
    assertEquals(2, scheduler.getMetrics().total());
    assertEquals(1L, metrics.count("scheduler.submit.rejected"));
  }

  @Test
  void batchSubmitReturnsDistinctIdsEvenWhenAJobFails() throws Exception {
    scheduler = started(settings(2, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));
    List<SubmissionRequest> batch = List.of(
        new SubmissionRequest("/media/1.jpg", "image", "alice", 1),
        new SubmissionRequest("/media/2.mp4", "video", "alice", 2),
        new SubmissionRequest("/media/fail.wav", "audio", "alice", 3),
        new SubmissionRequest("/media/4.png", "image", "alice", 1),
        new SubmissionRequest("/media/5.mkv", "video", "alice", 1));

    List<String> ids = scheduler.batchSubmit(batch);

    assertEquals(5, ids.size());
    assertEquals(5, new HashSet<>(ids).size());
    int failed = 0;
    for (String id : ids) {
      JobRecord record = scheduler.waitForCompletion(id, WAIT);
      if (record.status() == JobStatus.FAILED) {
        failed++;
        assertEquals(FailureKind.DETECTOR_ERROR, record.failure().orElseThrow().kind());
        assertTrue(record.failure().orElseThrow().detail().contains("corrupt stream"));
      }
    }
    assertEquals(1, failed);
  }

  @Test
  void batchSubmitStopsAtFirstInvalidEntry() throws Exception {
    scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));
    List<SubmissionRequest> batch = List.of(
        new SubmissionRequest("/media/1.jpg", "image", "alice", 1),
        new SubmissionRequest("/media/2.doc", "document", "alice", 1),
        new SubmissionRequest("/media/3.jpg", "image", "alice", 1));

    assertThrows(AnalysisValidationException.class, () -> scheduler.batchSubmit(batch));
    assertEquals(1, scheduler.getMetrics().total());
  }

  @Test
  void invalidSubmissionsAreRejectedWithoutCreatingRecords() throws Exception {
    scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));

    assertThrows(AnalysisValidationException.class,
        () -> scheduler.submit("/media/a.txt", "document", "alice", 1));
    assertThrows(AnalysisValidationException.class,
        () -> scheduler.submit("/media/a.jpg", "image", "alice", 7));
    assertThrows(AnalysisValidationException.class,
        () -> scheduler.submit(" ", "image", "alice", 1));
    assertThrows(AnalysisValidationException.class,
        () -> scheduler.submit("/media/a.jpg", "image", "", 1));
    assertEquals(0, scheduler.getMetrics().total());
  }

  @Test
  void waitTimeoutDoesNotCancelTheJob() throws Exception {
    scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));
    detector.hold();
    String id = scheduler.submit("/media/slow.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);

    AnalysisTimeoutException timeout = assertThrows(AnalysisTimeoutException.class,
        () -> scheduler.waitForCompletion(id, Duration.ofMillis(200)));
    assertEquals(id, timeout.analysisId());
    assertFalse(scheduler.getStatus(id).orElseThrow().isTerminal());

    detector.release();
    assertEquals(JobStatus.COMPLETED, scheduler.waitForCompletion(id, WAIT).status());
    assertEquals(1L, metrics.count("scheduler.wait.timeout"));
  }

  @Test
  void hugeWaitTimeoutsDoNotExpireImmediately() throws Exception {
    scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));
    detector.hold();
    String id = scheduler.submit("/media/long.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);

    Future<JobRecord> nanosCap = callers.submit(
        () -> scheduler.waitForCompletion(id, Duration.ofNanos(Long.MAX_VALUE)));
    Future<JobRecord> beyondNanos = callers.submit(
        () -> scheduler.waitForCompletion(id, Duration.ofSeconds(Long.MAX_VALUE)));
    TimeUnit.MILLISECONDS.sleep(200);
    assertFalse(nanosCap.isDone());
    assertFalse(beyondNanos.isDone());

    detector.release();
    assertEquals(JobStatus.COMPLETED, nanosCap.get(WAIT.toSeconds(), TimeUnit.SECONDS).status());
    assertEquals(JobStatus.COMPLETED, beyondNanos.get(WAIT.toSeconds(), TimeUnit.SECONDS).status());
    assertEquals(0L, metrics.count("scheduler.wait.timeout"));
  }

  @Test
  void unknownIdIsDistinctFromFailure() throws Exception {
    scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));

    assertTrue(scheduler.getStatus("0123456789abcdef").isEmpty());
    assertTrue(scheduler.getResult("0123456789abcdef").isEmpty());
    assertThrows(AnalysisNotFoundException.class,
        () -> scheduler.waitForCompletion("0123456789abcdef", Duration.ofMillis(50)));
  }

  @Test
  void workerSurvivesDetectorCrash() throws Exception {
    Logger processorLog = (Logger) LoggerFactory.getLogger(JobProcessor.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    processorLog.addAppender(appender);
    try {
      scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));

      String crashed = scheduler.submit("/media/crash.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);
      String healthy = scheduler.submit("/media/fine.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);

      JobRecord crashRecord = scheduler.waitForCompletion(crashed, WAIT);
      assertEquals(JobStatus.FAILED, crashRecord.status());
      JobOutcome.Failure failure = crashRecord.failure().orElseThrow();
      assertEquals(FailureKind.DETECTOR_CRASH, failure.kind());
      assertTrue(failure.detail().startsWith("IllegalStateException"));
      assertEquals(JobStatus.COMPLETED, scheduler.waitForCompletion(healthy, WAIT).status());
      assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
          && e.getFormattedMessage().contains("Detector crashed")));
      assertEquals(1L, metrics.count("scheduler.job.failed.detector_crash"));
    } finally {
      processorLog.detachAppender(appender);
    }
  }

  @Test
  void capabilityCheckFailureFailsTheJobInsteadOfStrandingIt() throws Exception {
    scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));
    detector.failNextSupports(new IllegalStateException("capability table unavailable"));

    String broken = scheduler.submit("/media/first.jpg", FileKind.IMAGE, "alice", Priority.NORMAL);
    String next = scheduler.submit("/media/second.jpg", FileKind.IMAGE, "alice", Priority.NORMAL);

    JobRecord record = scheduler.waitForCompletion(broken, WAIT);
    assertEquals(JobStatus.FAILED, record.status());
    assertEquals(FailureKind.DETECTOR_CRASH, record.failure().orElseThrow().kind());
    assertTrue(record.failure().orElseThrow().detail().contains("capability table unavailable"));
    assertEquals(JobStatus.COMPLETED, scheduler.waitForCompletion(next, WAIT).status());
  }

  @Test
  void errorEscapingProcessingFailsTheJobAndKeepsTheWorker() throws Exception {
    scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));
    detector.failNextSupports(new AssertionError("codec table corrupted"));

    String broken = scheduler.submit("/media/first.wav", FileKind.AUDIO, "alice", Priority.HIGH);
    JobRecord record = scheduler.waitForCompletion(broken, WAIT);
    assertEquals(JobStatus.FAILED, record.status());
    assertEquals(FailureKind.DETECTOR_CRASH, record.failure().orElseThrow().kind());
    assertEquals(1L, metrics.count("scheduler.worker.uncaught"));

    String[] later = new String[3];
    for (int i = 0; i < later.length; i++) {
      later[i] = scheduler.submit("/media/later" + i + ".wav", FileKind.AUDIO, "alice", Priority.HIGH);
    }
    for (String id : later) {
      assertEquals(JobStatus.COMPLETED, scheduler.waitForCompletion(id, WAIT).status());
    }
  }

  @Test
  void unsupportedKindFailsWithoutCallingDetector() throws Exception {
    ScriptedDetector imagesOnly = new ScriptedDetector(EnumSet.of(FileKind.IMAGE));
    scheduler = new AnalysisScheduler(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)),
        imagesOnly.factory(), MODELS, new InMemoryResultStore(), System::currentTimeMillis, metrics);
    scheduler.start();

    String id = scheduler.submit("/media/voice.wav", FileKind.AUDIO, "alice", Priority.NORMAL);
    JobRecord record = scheduler.waitForCompletion(id, WAIT);

    assertEquals(FailureKind.UNSUPPORTED_FILE_KIND, record.failure().orElseThrow().kind());
    assertEquals(0, imagesOnly.calls());
  }

  @Test
  void metricsSummarizeTerminalOutcomes() throws Exception {
    scheduler = started(settings(2, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)));
    List<String> ids = new ArrayList<>();
    ids.add(scheduler.submit("/media/a.jpg", "image", "alice", 1));
    ids.add(scheduler.submit("/media/b.jpg", "image", "alice", 2));
    ids.add(scheduler.submit("/media/fail.jpg", "image", "alice", 3));
    for (String id : ids) {
      scheduler.waitForCompletion(id, WAIT);
    }

    SchedulerMetrics snapshot = scheduler.getMetrics();

    assertEquals(3, snapshot.total());
    assertEquals(2, snapshot.completed());
    assertEquals(1, snapshot.failed());
    assertEquals(0, snapshot.queued());
    assertEquals(2d / 3d, snapshot.successRate(), 1e-9);
    assertTrue(snapshot.avgProcessingMillis() >= 0d);
  }

  @Test
  void concurrentSubmissionsReceiveDistinctIds() throws Exception {
    scheduler = started(settings(2, 1_000, BackpressureMode.BLOCK, Duration.ofSeconds(5)));
    int threads = 8;
    int perThread = 25;
    Set<String> ids = ConcurrentHashMap.newKeySet();
    CountDownLatch go = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      futures.add(callers.submit(() -> {
        go.await();
        for (int i = 0; i < perThread; i++) {
          ids.add(scheduler.submit("/media/same.jpg", FileKind.IMAGE, "alice", Priority.NORMAL));
        }
        return null;
      }));
    }
    go.countDown();
    for (Future<?> future : futures) {
      future.get(WAIT.toSeconds(), TimeUnit.SECONDS);
    }

    assertEquals(threads * perThread, ids.size());
  }

  @Test
  void cleanupRemovesOnlyRecordsOlderThanRetention() throws Exception {
    ManualClock clock = new ManualClock(1_000_000L);
    scheduler = new AnalysisScheduler(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)),
        detector.factory(), MODELS, new InMemoryResultStore(), clock, metrics);
    scheduler.start();
    String old = scheduler.submit("/media/old.jpg", FileKind.IMAGE, "alice", Priority.NORMAL);
    scheduler.waitForCompletion(old, WAIT);

    clock.advance(Duration.ofHours(23));
    String recent = scheduler.submit("/media/recent.jpg", FileKind.IMAGE, "alice", Priority.NORMAL);
    scheduler.waitForCompletion(recent, WAIT);
    assertEquals(0, scheduler.cleanup());

    clock.advance(Duration.ofHours(2));
    assertEquals(1, scheduler.cleanup());
    assertTrue(scheduler.getStatus(old).isEmpty());
    assertEquals(JobStatus.COMPLETED, scheduler.getStatus(recent).orElseThrow());

    assertEquals(1, scheduler.cleanup(Duration.ofMinutes(30)));
    assertEquals(0, scheduler.getMetrics().total());
  }

  @Test
  void gracefulShutdownDrainsQueuedJobs() throws Exception {
    scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(10)));
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      ids.add(scheduler.submit("/media/" + i + ".png", FileKind.IMAGE, "alice", Priority.NORMAL));
    }

    scheduler.shutdown();

    assertEquals(AnalysisScheduler.State.TERMINATED, scheduler.state());
    for (String id : ids) {
      assertEquals(JobStatus.COMPLETED, scheduler.getStatus(id).orElseThrow());
    }
    assertTrue(detector.closed());
    assertThrows(SchedulerStateException.class,
        () -> scheduler.submit("/media/late.png", FileKind.IMAGE, "alice", Priority.NORMAL));
  }

  @Test
  void forcedShutdownFailsUnfinishedJobsAsInterrupted() throws Exception {
    scheduler = started(settings(1, 10, BackpressureMode.BLOCK, Duration.ofMillis(300)));
    detector.hold();
    String running = scheduler.submit("/media/run.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);
    awaitCondition(() -> detector.calls() == 1);
    String waiting = scheduler.submit("/media/wait.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);

    scheduler.shutdown();

    for (String id : List.of(running, waiting)) {
      JobRecord record = scheduler.getResult(id).orElseThrow();
      assertEquals(JobStatus.FAILED, record.status());
      assertEquals(FailureKind.INTERRUPTED, record.failure().orElseThrow().kind());
    }
    assertEquals(0, scheduler.getMetrics().queued() + scheduler.getMetrics().processing());
    assertEquals(1L, metrics.count("scheduler.shutdown.forced"));
  }

  @Test
  void shutdownRefusesSubmittersStillBlockedAfterTheDrainBudget() throws Exception {
    scheduler = started(settings(1, 1, BackpressureMode.BLOCK, Duration.ofMillis(300)));
    detector.hold();
    String running = scheduler.submit("/media/run.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);
    awaitCondition(() -> detector.calls() == 1);
    String queued = scheduler.submit("/media/queued.mp4", FileKind.VIDEO, "alice", Priority.NORMAL);
    Future<String> blocked = callers.submit(
        () -> scheduler.submit("/media/late.mp4", FileKind.VIDEO, "alice", Priority.NORMAL));
    TimeUnit.MILLISECONDS.sleep(100);
    assertFalse(blocked.isDone());

    scheduler.shutdown();

    ExecutionException refused = assertThrows(ExecutionException.class,
        () -> blocked.get(WAIT.toSeconds(), TimeUnit.SECONDS));
    assertTrue(refused.getCause() instanceof SchedulerStateException, String.valueOf(refused.getCause()));
    assertEquals(2, scheduler.getMetrics().total());
    for (String id : List.of(running, queued)) {
      assertEquals(JobStatus.FAILED, scheduler.getStatus(id).orElseThrow());
    }
    assertEquals(1L, metrics.count("scheduler.shutdown.submittersRefused"));
  }

  @Test
  void shutdownIsIdempotentAndLifecycleIsEnforced() throws Exception {
    scheduler = new AnalysisScheduler(settings(1, 10, BackpressureMode.BLOCK, Duration.ofSeconds(5)),
        detector.factory(), MODELS, new InMemoryResultStore(), System::currentTimeMillis, metrics);
    assertThrows(SchedulerStateException.class,
        () -> scheduler.submit("/media/a.jpg", FileKind.IMAGE, "alice", Priority.NORMAL));

    scheduler.start();
    assertThrows(SchedulerStateException.class, scheduler::start);
    scheduler.shutdown();
    scheduler.shutdown();

    assertEquals(AnalysisScheduler.State.TERMINATED, scheduler.state());
    assertTrue(metrics.count("scheduler.submit.refused") >= 1L);
  }

  private AnalysisScheduler started(SchedulerSettings settings) throws Exception {
    AnalysisScheduler created = new AnalysisScheduler(
        settings, detector.factory(), MODELS, new InMemoryResultStore(), System::currentTimeMillis, metrics);
    created.start();
    return created;
  }

  private static SchedulerSettings settings(
      int workers, int capacity, BackpressureMode backpressure, Duration shutdownTimeout) {
    Map<Priority, SchedulerSettings.TierSettings> tiers = new EnumMap<>(Priority.class);
    for (Priority priority : Priority.values()) {
      tiers.put(priority, new SchedulerSettings.TierSettings(workers, capacity));
    }
    return new SchedulerSettings(
        tiers,
        4,
        backpressure,
        Duration.ZERO,
        Duration.ofMillis(20),
        Duration.ofHours(24),
        Duration.ZERO,
        shutdownTimeout,
        "deepfake_detector",
        512);
  }

  private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + WAIT.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within " + WAIT);
      }
      TimeUnit.MILLISECONDS.sleep(10);
    }
  }
}
