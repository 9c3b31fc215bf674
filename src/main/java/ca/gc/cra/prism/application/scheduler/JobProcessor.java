package ca.gc.cra.prism.application.scheduler;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.DetectorPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.ResultStore;
import ca.gc.cra.prism.domain.analysis.AnalysisException;
import ca.gc.cra.prism.domain.analysis.AnalysisRequest;
import ca.gc.cra.prism.domain.analysis.DetectionResult;
import ca.gc.cra.prism.domain.analysis.JobOutcome;
import ca.gc.cra.prism.domain.analysis.JobOutcome.FailureKind;
import ca.gc.cra.prism.domain.analysis.JobRecord;
import ca.gc.cra.prism.logging.Logs;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one dequeued job: marks it processing, invokes the detector on the detector pool, and settles
 * the record on a {@link JobOutcome}.
 *
 * <p>Every detector failure is converted into a {@link JobOutcome.Failure}; nothing thrown by the
 * detector reaches the dispatcher loop.</p>
 *
 * @since 0.1.0
 */
final class JobProcessor {
  private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

  static final String MDC_ANALYSIS_ID = "analysisId";
  static final String MDC_PRIORITY = "priority";
  static final String MDC_FILE_KIND = "fileKind";

  private final DetectorPort detector;
  private final ExecutorService detectorPool;
  private final ResultStore store;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final int errorDetailMaxBytes;

  JobProcessor(
      DetectorPort detector,
      ExecutorService detectorPool,
      ResultStore store,
      ClockPort clock,
      MetricsPort metrics,
      int errorDetailMaxBytes) {
    this.detector = Objects.requireNonNull(detector, "detector");
    this.detectorPool = Objects.requireNonNull(detectorPool, "detectorPool");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.errorDetailMaxBytes = errorDetailMaxBytes;
  }

  /**
   * Processes a job to a terminal record.
   *
   * @param request dequeued descriptor
   */
  void process(AnalysisRequest request) {
    String id = request.analysisId();
    MDC.put(MDC_ANALYSIS_ID, id);
    MDC.put(MDC_PRIORITY, request.priority().wireName());
    MDC.put(MDC_FILE_KIND, request.fileKind().wireName());
    try {
      Optional<JobRecord> started = transition(id, r -> r.startProcessing(clock.nowMillis()));
      if (started.isEmpty()) {
        metrics.increment("scheduler.job.skipped");
        log.warn("Skipping job {}: no queued record found", id);
        return;
      }
      log.debug("Processing {} ({})", Logs.truncate(request.fileRef(), 256), request.fileKind().wireName());

      JobOutcome outcome = analyze(request);
      Optional<JobRecord> finished = transition(id, r -> r.finish(outcome, clock.nowMillis()));
      finished.ifPresent(this::recordCompletion);
    } finally {
      MDC.remove(MDC_ANALYSIS_ID);
      MDC.remove(MDC_PRIORITY);
      MDC.remove(MDC_FILE_KIND);
    }
  }

  /**
   * Fails a job whose processing escaped {@link #process}, unless it already settled.
   *
   * @param request job being processed when the error escaped
   * @param cause escaped error
   * @return {@code true} if the record was failed by this call
   */
  boolean failEscaped(AnalysisRequest request, Throwable cause) {
    String id = request.analysisId();
    JobOutcome.Failure failure = new JobOutcome.Failure(
        FailureKind.DETECTOR_CRASH, Logs.describe(cause, errorDetailMaxBytes));
    Optional<JobRecord> settled;
    try {
      settled = store.update(id, r -> r.status().isTerminal() ? r : r.abandon(failure, clock.nowMillis()));
    } catch (RuntimeException ex) {
      log.warn("Unable to settle job {} after dispatcher error: {}", id, ex.getMessage());
      return false;
    }
    // Identity match: only a record failed by this call is counted.
    if (settled.isPresent() && settled.get().outcome() == failure) {
      recordCompletion(settled.get());
      return true;
    }
    return false;
  }

  private JobOutcome analyze(AnalysisRequest request) {
    boolean supported;
    try {
      supported = detector.supports(request.fileKind());
    } catch (RuntimeException ex) {
      log.error("Detector capability check failed on {}", request.analysisId(), ex);
      return JobOutcome.failure(FailureKind.DETECTOR_CRASH, Logs.describe(ex, errorDetailMaxBytes));
    }
    if (!supported) {
      return JobOutcome.failure(
          FailureKind.UNSUPPORTED_FILE_KIND,
          "detector does not support " + request.fileKind().wireName() + " files");
    }
    Future<DetectionResult> call;
    try {
      call = detectorPool.submit(() -> detector.analyze(request.fileRef(), request.fileKind()));
    } catch (RejectedExecutionException ex) {
      return JobOutcome.failure(FailureKind.DETECTOR_CRASH, "detector pool unavailable");
    }
    try {
      DetectionResult result = call.get();
      if (result == null) {
        return JobOutcome.failure(FailureKind.DETECTOR_CRASH, "detector returned no result");
      }
      return JobOutcome.success(result);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof AnalysisException) {
        return JobOutcome.failure(FailureKind.DETECTOR_ERROR, Logs.describe(cause, errorDetailMaxBytes));
      }
      log.error("Detector crashed on {}", request.analysisId(), cause);
      return JobOutcome.failure(FailureKind.DETECTOR_CRASH, Logs.describe(cause, errorDetailMaxBytes));
    } catch (InterruptedException ex) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      return JobOutcome.failure(FailureKind.INTERRUPTED, null);
    }
  }

  private Optional<JobRecord> transition(String id, UnaryOperator<JobRecord> step) {
    try {
      return store.update(id, step);
    } catch (IllegalStateException ex) {
      // Record was settled elsewhere, e.g. abandoned by a forced shutdown.
      metrics.increment("scheduler.job.transitionRejected");
      log.warn("Job {} transition rejected: {}", id, ex.getMessage());
      return Optional.empty();
    }
  }

  private void recordCompletion(JobRecord record) {
    metrics.observe("scheduler.job.latencyMillis", record.processingMillis());
    if (record.outcome() instanceof JobOutcome.Failure failure) {
      metrics.increment("scheduler.job.failed");
      metrics.increment("scheduler.job.failed." + failure.kind().name().toLowerCase(Locale.ROOT));
      log.warn("Job {} failed after {} ms: {} {}",
          record.analysisId(), record.processingMillis(), failure.kind(), failure.detail());
      return;
    }
    metrics.increment("scheduler.job.completed");
    record.result().ifPresent(result -> log.debug("Job {} completed in {} ms: {} ({})",
        record.analysisId(), record.processingMillis(), result.verdict(), result.confidence()));
  }
}
