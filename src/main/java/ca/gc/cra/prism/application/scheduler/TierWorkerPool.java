package ca.gc.cra.prism.application.scheduler;

import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.domain.analysis.AnalysisRequest;
import ca.gc.cra.prism.domain.analysis.Priority;
import ca.gc.cra.prism.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fixed set of dispatcher threads dedicated to one priority tier's queue.
 * <p><strong>Why:</strong> Each tier keeps guaranteed throughput regardless of backlog in the other
 * tiers; critical jobs never wait behind a normal-priority queue.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} launches the loops; {@link #requestStop()} lets each
 * loop finish once its queue is empty; {@link #shutdownNow()} interrupts loops that overran the drain
 * budget.</p>
 * <p><strong>Thread-safety:</strong> Lifecycle methods are called by the owning scheduler only.</p>
 *
 * @since 0.1.0
 */
final class TierWorkerPool {
  private static final Logger log = LoggerFactory.getLogger(TierWorkerPool.class);
  private static final long WORKER_IDLE_POLL_MILLIS = 100L;

  private final Priority priority;
  private final BlockingQueue<AnalysisRequest> queue;
  private final int workers;
  private final JobProcessor processor;
  private final MetricsPort metrics;
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final ExecutorService executor;

  TierWorkerPool(
      Priority priority,
      BlockingQueue<AnalysisRequest> queue,
      int workers,
      JobProcessor processor,
      MetricsPort metrics) {
    this.priority = Objects.requireNonNull(priority, "priority");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.workers = workers;
    this.processor = Objects.requireNonNull(processor, "processor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.executor = ExecutorFactories.newDispatcherPool(
        workers, "prism-" + priority.wireName(), this::onUncaught);
  }

  /** Launches one dispatcher loop per configured worker. */
  void start() {
    for (int i = 0; i < workers; i++) {
      executor.execute(new Dispatcher());
    }
    log.debug("Started {} dispatcher(s) for {} tier", workers, priority.wireName());
  }

  /** Asks every loop to exit once the tier queue is empty. */
  void requestStop() {
    stopRequested.set(true);
    executor.shutdown();
  }

  /**
   * Waits for the loops to exit.
   *
   * @param timeout maximum wait
   * @return {@code true} if every loop exited in time
   * @throws InterruptedException if the caller is interrupted while waiting
   */
  boolean awaitTermination(Duration timeout) throws InterruptedException {
    return executor.awaitTermination(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
  }

  /** Interrupts every loop; in-flight jobs settle as {@code INTERRUPTED}. */
  void shutdownNow() {
    stopRequested.set(true);
    executor.shutdownNow();
  }

  Priority priority() {
    return priority;
  }

  private void onUncaught(Thread thread, Throwable error) {
    metrics.increment("scheduler.worker.crashed");
    log.error("Dispatcher {} for {} tier terminated unexpectedly", thread.getName(), priority.wireName(), error);
  }

  private final class Dispatcher implements Runnable {
    @Override
    public void run() {
      try {
        while (true) {
          if (stopRequested.get() && queue.isEmpty()) {
            break;
          }
          AnalysisRequest request = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (request == null) {
            continue;
          }
          try {
            processor.process(request);
          } catch (RuntimeException | Error ex) {
            metrics.increment("scheduler.worker.uncaught");
            log.error("Dispatcher failed while handling {}", request.analysisId(), ex);
            processor.failEscaped(request, ex);
            if (ex instanceof VirtualMachineError fatal) {
              throw fatal;
            }
          }
          if (Thread.currentThread().isInterrupted()) {
            break;
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!stopRequested.get()) {
          metrics.increment("scheduler.worker.interrupted");
        }
      }
    }
  }
}
