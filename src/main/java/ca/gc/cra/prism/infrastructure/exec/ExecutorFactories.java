package ca.gc.cra.prism.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for creating tuned executor services aligned with PRISM concurrency requirements.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for tier dispatcher loops.
   *
   * <p>Each submitted runnable is expected to be a long-lived loop, so the pool has no queue: submitting
   * more loops than {@code size} is rejected.</p>
   *
   * @param size number of dispatcher threads to allocate
   * @param prefix thread-name prefix used to tag dispatcher threads
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newDispatcherPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = threadFactory(prefix, "prism-dispatch", handler, false);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the bounded pool that runs detector calls off the dispatcher threads.
   *
   * @param size number of detector threads
   * @param queueCapacity maximum detector calls waiting for a free thread
   * @param prefix thread-name prefix
   * @return configured executor service
   */
  public static ExecutorService newDetectorPool(int size, int queueCapacity, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    ThreadFactory factory = threadFactory(prefix, "prism-detect", null, false);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(queueCapacity),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-threaded daemon scheduler for housekeeping such as record cleanup.
   *
   * @param prefix thread-name prefix
   * @return scheduled executor whose tasks are dropped on shutdown
   */
  public static ScheduledExecutorService newHousekeepingScheduler(String prefix) {
    ThreadFactory factory = threadFactory(prefix, "prism-housekeeping", null, true);
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  private static ThreadFactory threadFactory(
      String prefix, String fallbackPrefix, UncaughtExceptionHandler handler, boolean daemon) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallbackPrefix : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(Objects.requireNonNull(runnable, "runnable"));
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    };
  }
}
