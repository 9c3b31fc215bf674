package ca.gc.cra.prism.application.scheduler;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.DetectorPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.ModelLocatorPort;
import ca.gc.cra.prism.application.port.ResultStore;
import ca.gc.cra.prism.domain.analysis.AnalysisException;
import ca.gc.cra.prism.domain.analysis.AnalysisIds;
import ca.gc.cra.prism.domain.analysis.AnalysisRequest;
import ca.gc.cra.prism.domain.analysis.AnalysisValidationException;
import ca.gc.cra.prism.domain.analysis.FileKind;
import ca.gc.cra.prism.domain.analysis.JobOutcome;
import ca.gc.cra.prism.domain.analysis.JobOutcome.FailureKind;
import ca.gc.cra.prism.domain.analysis.JobRecord;
import ca.gc.cra.prism.domain.analysis.JobStatus;
import ca.gc.cra.prism.domain.analysis.Priority;
import ca.gc.cra.prism.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Priority-tiered analysis scheduler: accepts submissions, dispatches them to
 * per-tier workers, tracks each job's lifecycle, and drains gracefully on shutdown.
 * <p><strong>Why:</strong> Callers (CLI, HTTP layers) need asynchronous submission with bounded memory,
 * per-tier throughput guarantees, and a queryable record for every accepted job.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate submissions, assign ids, and apply backpressure per {@link BackpressureMode}.</li>
 *   <li>Run {@link TierWorkerPool}s that settle every job on a {@link JobOutcome}.</li>
 *   <li>Serve status, result, wait, queue-depth, and aggregate-metrics queries.</li>
 *   <li>Remove aged records manually or periodically.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All public methods are safe for concurrent use. A read/write lock
 * gates submissions so shutdown observes every enqueue that started before draining began.</p>
 * <p><strong>Observability:</strong> Emits {@code scheduler.*} metrics via {@link MetricsPort} and
 * lifecycle logs at INFO.</p>
 *
 * @since 0.1.0
 */
public final class AnalysisScheduler implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AnalysisScheduler.class);
  private static final Duration FORCED_STOP_GRACE = Duration.ofSeconds(1);
  private static final int MAX_ID_ATTEMPTS = 8;

  /** Scheduler lifecycle states. */
  public enum State {
    /** Constructed; not yet accepting work. */
    NEW,
    /** Accepting submissions and dispatching jobs. */
    RUNNING,
    /** Refusing submissions while queued and in-flight jobs finish. */
    DRAINING,
    /** Stopped; every record is terminal. */
    TERMINATED
  }

  private final SchedulerSettings settings;
  private final DetectorPort.Factory detectorFactory;
  private final ModelLocatorPort modelLocator;
  private final ResultStore store;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final PriorityQueueSet queues;

  private final Object lifecycleLock = new Object();
  private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
  private final ReentrantReadWriteLock submissionGate = new ReentrantReadWriteLock();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private volatile boolean refuseBlockedSubmitters;

  private final Map<Priority, TierWorkerPool> pools = new EnumMap<>(Priority.class);
  private DetectorPort detector;
  private ExecutorService detectorPool;
  private ScheduledExecutorService housekeeping;

  /**
   * Creates a scheduler; no threads run until {@link #start()}.
   *
   * @param settings tuning parameters
   * @param detectorFactory opens the detector once the model is resolved
   * @param modelLocator resolves the detector model at start
   * @param store record store
   * @param clock time source for record timestamps and cleanup
   * @param metrics operational metrics sink; {@code null} disables metrics
   */
  public AnalysisScheduler(
      SchedulerSettings settings,
      DetectorPort.Factory detectorFactory,
      ModelLocatorPort modelLocator,
      ResultStore store,
      ClockPort clock,
      MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.detectorFactory = Objects.requireNonNull(detectorFactory, "detectorFactory");
    this.modelLocator = Objects.requireNonNull(modelLocator, "modelLocator");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.queues = PriorityQueueSet.from(settings);
  }

  /**
   * Resolves the model, opens the detector, and launches the tier workers.
   *
   * @throws IOException if the model cannot be located
   * @throws AnalysisException if the detector cannot be opened
   * @throws SchedulerStateException if the scheduler was already started or shut down
   */
  public void start() throws IOException, AnalysisException {
    synchronized (lifecycleLock) {
      if (state.get() != State.NEW) {
        throw new SchedulerStateException("Scheduler already " + state.get().name().toLowerCase(Locale.ROOT));
      }
      Path modelPath = modelLocator.resolve(settings.modelName());
      DetectorPort opened = detectorFactory.open(modelPath);
      if (opened == null) {
        throw new AnalysisException("Detector factory returned no detector for " + modelPath);
      }
      detector = opened;
      detectorPool = ExecutorFactories.newDetectorPool(
          settings.detectorThreads(), settings.totalWorkers(), "prism-detect");
      JobProcessor processor = new JobProcessor(
          detector, detectorPool, store, clock, metrics, settings.errorDetailMaxBytes());
      for (Priority priority : Priority.values()) {
        TierWorkerPool pool = new TierWorkerPool(
            priority, queues.queue(priority), settings.tier(priority).workers(), processor, metrics);
        pools.put(priority, pool);
        pool.start();
      }
      scheduleCleanup();
      state.set(State.RUNNING);
      log.info("Analysis scheduler started (model={}, workers={}, detectorThreads={}, backpressure={})",
          modelPath, settings.totalWorkers(), settings.detectorThreads(), settings.backpressure());
    }
  }

  /**
   * Submits a job described by untyped boundary values.
   *
   * @param fileRef media reference
   * @param fileKind kind name ({@code video}, {@code image}, {@code audio})
   * @param submitter submitting identity
   * @param priority numeric tier: 1 normal, 2 high, 3 critical
   * @return assigned analysis id
   * @throws AnalysisValidationException if any value is invalid; nothing is enqueued
   * @throws SchedulerStateException if the scheduler is not running
   * @throws QueueFullException in {@link BackpressureMode#REJECT} when the tier stays full
   * @throws InterruptedException if interrupted while blocked on a full tier
   */
  public String submit(String fileRef, String fileKind, String submitter, int priority)
      throws InterruptedException {
    return submit(fileRef, FileKind.fromString(fileKind), submitter, Priority.fromLevel(priority));
  }

  /**
   * Submits a typed job.
   *
   * @param fileRef media reference
   * @param fileKind media kind
   * @param submitter submitting identity
   * @param priority tier
   * @return assigned analysis id
   * @throws AnalysisValidationException if a value is missing or blank
   * @throws SchedulerStateException if the scheduler is not running
   * @throws QueueFullException in {@link BackpressureMode#REJECT} when the tier stays full
   * @throws InterruptedException if interrupted while blocked on a full tier
   */
  public String submit(String fileRef, FileKind fileKind, String submitter, Priority priority)
      throws InterruptedException {
    if (fileRef == null || fileRef.isBlank()) {
      throw new AnalysisValidationException("fileRef must not be blank");
    }
    if (submitter == null || submitter.isBlank()) {
      throw new AnalysisValidationException("submitter must not be blank");
    }
    if (fileKind == null) {
      throw new AnalysisValidationException("fileKind must be provided");
    }
    if (priority == null) {
      throw new AnalysisValidationException("priority must be provided");
    }
    requireRunning();

    submissionGate.readLock().lockInterruptibly();
    try {
      requireRunning();
      AnalysisRequest request = reserve(fileRef.trim(), fileKind, submitter.trim(), priority);
      enqueue(request);
      metrics.increment("scheduler.submit.accepted");
      metrics.observe("scheduler.queue.depth." + priority.wireName(), queues.depth(priority));
      log.debug("Accepted {} on {} tier", request.analysisId(), priority.wireName());
      return request.analysisId();
    } finally {
      submissionGate.readLock().unlock();
    }
  }

  /**
   * Submits jobs one by one through {@link #submit(String, String, String, int)}.
   *
   * <p>Not atomic: when an element fails, the jobs accepted before it stay queued and the failure
   * propagates.</p>
   *
   * @param requests submissions in order
   * @return assigned ids in submission order
   * @throws InterruptedException if interrupted while blocked on a full tier
   */
  public List<String> batchSubmit(List<SubmissionRequest> requests) throws InterruptedException {
    Objects.requireNonNull(requests, "requests");
    List<String> ids = new ArrayList<>(requests.size());
    for (SubmissionRequest request : requests) {
      try {
        ids.add(submit(request.fileRef(), request.fileKind(), request.submitter(), request.priority()));
      } catch (RuntimeException | InterruptedException ex) {
        log.warn("Batch submission stopped after {} of {} job(s): {}",
            ids.size(), requests.size(), ex.getMessage());
        throw ex;
      }
    }
    return ids;
  }

  /**
   * Returns a job's status.
   *
   * @param analysisId job id
   * @return status, or empty when the id is unknown or cleaned up
   */
  public Optional<JobStatus> getStatus(String analysisId) {
    return store.get(analysisId).map(JobRecord::status);
  }

  /**
   * Returns a job's full record.
   *
   * @param analysisId job id
   * @return record, or empty when the id is unknown or cleaned up
   */
  public Optional<JobRecord> getResult(String analysisId) {
    return store.get(analysisId);
  }

  /**
   * Polls until the job reaches a terminal state.
   *
   * <p>No lock is held between samples. A timeout abandons the wait only; the job keeps running.</p>
   *
   * @param analysisId job id
   * @param timeout maximum wait
   * @return terminal record
   * @throws AnalysisTimeoutException if the job is still pending at the deadline
   * @throws AnalysisNotFoundException if the id is unknown or the record was removed while waiting
   * @throws InterruptedException if interrupted while sleeping
   */
  public JobRecord waitForCompletion(String analysisId, Duration timeout)
      throws AnalysisTimeoutException, InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    long pollNanos = settings.pollInterval().toNanos();
    long deadline = saturatedAdd(System.nanoTime(), timeout);
    while (true) {
      JobRecord record = store.get(analysisId).orElseThrow(() -> new AnalysisNotFoundException(analysisId));
      if (record.status().isTerminal()) {
        return record;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        metrics.increment("scheduler.wait.timeout");
        throw new AnalysisTimeoutException(analysisId, timeout);
      }
      TimeUnit.NANOSECONDS.sleep(Math.min(pollNanos, remaining));
    }
  }

  /**
   * Current depth of every tier.
   *
   * @return depths keyed by tier; all tiers present
   */
  public Map<Priority, Integer> getQueueDepths() {
    return queues.depths();
  }

  /**
   * Computes aggregate statistics over the result store.
   *
   * @return metrics snapshot
   */
  public SchedulerMetrics getMetrics() {
    return MetricsAggregator.aggregate(store.snapshot(), queues.depths());
  }

  /**
   * Removes records older than the configured retention.
   *
   * @return number of removed records
   */
  public int cleanup() {
    return cleanup(settings.retention());
  }

  /**
   * Removes every record whose last update is older than {@code retention}, regardless of status.
   *
   * @param retention retention window
   * @return number of removed records
   */
  public int cleanup(Duration retention) {
    Objects.requireNonNull(retention, "retention");
    long now = clock.nowMillis();
    long windowMillis = retention.toMillis();
    int removed = store.removeIf(record -> record.ageMillis(now) > windowMillis);
    metrics.observe("scheduler.cleanup.removed", removed);
    if (removed > 0) {
      log.info("Cleanup removed {} record(s) older than {}", removed, retention);
    }
    return removed;
  }

  /**
   * Stops accepting submissions, drains queued and in-flight jobs, and releases threads.
   *
   * <p>Submitters blocked on a full tier may still be accepted while the drain runs. Any still blocked
   * after {@link SchedulerSettings#shutdownTimeout()} are refused with {@link SchedulerStateException}
   * and leave no record. Jobs still pending when the drain budget elapses are failed with
   * {@link FailureKind#INTERRUPTED}. Idempotent; concurrent callers wait for the first to finish.</p>
   */
  public void shutdown() {
    boolean owner;
    synchronized (lifecycleLock) {
      State current = state.get();
      if (current == State.NEW) {
        state.set(State.TERMINATED);
        terminated.countDown();
        return;
      }
      owner = current == State.RUNNING;
      if (owner) {
        state.set(State.DRAINING);
      }
    }
    if (!owner) {
      awaitTerminated();
      return;
    }
    log.info("Analysis scheduler draining (queued={})", queues.depths());

    boolean interrupted = false;
    boolean drained;
    try {
      waitForSubmitters();
      housekeeping.shutdownNow();
      pools.values().forEach(TierWorkerPool::requestStop);
      drained = awaitPools(settings.shutdownTimeout());
    } catch (InterruptedException ex) {
      interrupted = true;
      drained = false;
    }

    if (!drained) {
      log.warn("Drain did not finish within {}; interrupting remaining jobs", settings.shutdownTimeout());
      metrics.increment("scheduler.shutdown.forced");
      pools.values().forEach(TierWorkerPool::shutdownNow);
      for (AnalysisRequest leftover : queues.drainAll()) {
        abandon(leftover.analysisId());
      }
      try {
        awaitPools(FORCED_STOP_GRACE);
      } catch (InterruptedException ex) {
        interrupted = true;
      }
      detectorPool.shutdownNow();
    } else {
      detectorPool.shutdown();
    }

    closeDetector();
    int swept = 0;
    for (JobRecord record : store.snapshot()) {
      if (!record.status().isTerminal() && abandon(record.analysisId())) {
        swept++;
      }
    }
    if (swept > 0) {
      log.warn("Failed {} unfinished job(s) at shutdown", swept);
    }
    state.set(State.TERMINATED);
    terminated.countDown();
    log.info("Analysis scheduler stopped");
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  /** Equivalent to {@link #shutdown()}. */
  @Override
  public void close() {
    shutdown();
  }

  /**
   * Current lifecycle state.
   *
   * @return state
   */
  public State state() {
    return state.get();
  }

  /**
   * Effective settings.
   *
   * @return settings
   */
  public SchedulerSettings settings() {
    return settings;
  }

  private void requireRunning() {
    State current = state.get();
    if (current != State.RUNNING) {
      metrics.increment("scheduler.submit.refused");
      throw new SchedulerStateException("Scheduler is not accepting submissions (state=" + current + ")");
    }
  }

  private AnalysisRequest reserve(String fileRef, FileKind fileKind, String submitter, Priority priority) {
    for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
      long now = clock.nowMillis();
      String id = AnalysisIds.newId(fileRef, submitter, now);
      AnalysisRequest request = new AnalysisRequest(fileRef, fileKind, id, submitter, priority);
      if (store.create(JobRecord.queued(request, now))) {
        return request;
      }
      metrics.increment("scheduler.submit.idCollision");
    }
    throw new IllegalStateException("Could not allocate a unique analysis id after " + MAX_ID_ATTEMPTS + " attempts");
  }

  private void enqueue(AnalysisRequest request) throws InterruptedException {
    boolean accepted = false;
    try {
      if (settings.backpressure() == BackpressureMode.BLOCK) {
        // Wait in slices so a shutdown that gave up on blocked submitters can turn them away.
        while (!accepted && !refuseBlockedSubmitters) {
          accepted = queues.offer(request, settings.pollInterval());
        }
      } else {
        accepted = queues.offer(request, settings.offerTimeout());
      }
    } finally {
      if (!accepted) {
        store.remove(request.analysisId());
        metrics.increment("scheduler.submit.rejected");
      }
    }
    if (accepted) {
      return;
    }
    if (settings.backpressure() == BackpressureMode.BLOCK) {
      log.debug("Refused blocked submission on {} tier during shutdown", request.priority().wireName());
      throw new SchedulerStateException("Scheduler shut down while the submission waited for room");
    }
    log.debug("Rejected submission on full {} tier", request.priority().wireName());
    throw new QueueFullException(request.priority(), queues.capacity(request.priority()));
  }

  private void waitForSubmitters() throws InterruptedException {
    // Submitters hold the read lock from the state check until their record is enqueued.
    if (submissionGate.writeLock().tryLock(settings.shutdownTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
      submissionGate.writeLock().unlock();
      return;
    }
    log.warn("Submitters still blocked after {}; refusing them", settings.shutdownTimeout());
    metrics.increment("scheduler.shutdown.submittersRefused");
    refuseBlockedSubmitters = true;
    long grace = settings.pollInterval().plus(FORCED_STOP_GRACE).toNanos();
    if (submissionGate.writeLock().tryLock(grace, TimeUnit.NANOSECONDS)) {
      submissionGate.writeLock().unlock();
    } else {
      log.warn("Submitters did not leave within {} ms", TimeUnit.NANOSECONDS.toMillis(grace));
    }
  }

  private static long saturatedAdd(long nowNanos, Duration timeout) {
    long nanos;
    try {
      nanos = Math.max(0L, timeout.toNanos());
    } catch (ArithmeticException ex) {
      nanos = timeout.isNegative() ? 0L : Long.MAX_VALUE;
    }
    // Keeps deadline - now positive under nanoTime's wrap-around arithmetic.
    return nowNanos + Math.min(nanos, Long.MAX_VALUE / 2);
  }

  private boolean awaitPools(Duration budget) throws InterruptedException {
    long deadline = saturatedAdd(System.nanoTime(), budget);
    boolean all = true;
    for (TierWorkerPool pool : pools.values()) {
      Duration remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
      if (!pool.awaitTermination(remaining)) {
        log.warn("Workers for {} tier still busy after drain budget", pool.priority().wireName());
        all = false;
      }
    }
    return all;
  }

  private boolean abandon(String analysisId) {
    JobOutcome.Failure failure = new JobOutcome.Failure(FailureKind.INTERRUPTED, null);
    try {
      return store.update(analysisId, record -> record.status().isTerminal()
              ? record
              : record.abandon(failure, clock.nowMillis()))
          .map(record -> record.status() == JobStatus.FAILED)
          .orElse(false);
    } catch (IllegalStateException ex) {
      log.debug("Job {} settled before it could be abandoned", analysisId);
      return false;
    }
  }

  private void closeDetector() {
    try {
      detector.close();
    } catch (RuntimeException ex) {
      log.warn("Detector close failed", ex);
    }
  }

  private void scheduleCleanup() {
    housekeeping = ExecutorFactories.newHousekeepingScheduler("prism-housekeeping");
    Duration interval = settings.cleanupInterval();
    if (interval.isZero()) {
      return;
    }
    long millis = interval.toMillis();
    housekeeping.scheduleAtFixedRate(this::runScheduledCleanup, millis, millis, TimeUnit.MILLISECONDS);
  }

  private void runScheduledCleanup() {
    try {
      cleanup();
    } catch (RuntimeException ex) {
      metrics.increment("scheduler.cleanup.error");
      log.warn("Scheduled cleanup failed", ex);
    }
  }

  private void awaitTerminated() {
    try {
      terminated.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
