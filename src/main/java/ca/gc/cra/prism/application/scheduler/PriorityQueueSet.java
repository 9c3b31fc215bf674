package ca.gc.cra.prism.application.scheduler;

import ca.gc.cra.prism.domain.analysis.AnalysisRequest;
import ca.gc.cra.prism.domain.analysis.Priority;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Three independent bounded FIFO queues, one per priority tier.
 *
 * <p>Queue length never exceeds the tier capacity: {@link #offer} waits at most its timeout for room
 * on a full tier. Ordering is FIFO within a tier only.</p>
 *
 * <p>Thread-safe; backed by {@link ArrayBlockingQueue}.</p>
 *
 * @since 0.1.0
 */
public final class PriorityQueueSet {
  private final Map<Priority, BlockingQueue<AnalysisRequest>> queues;
  private final Map<Priority, Integer> capacities;

  /**
   * Creates queues with the given capacities.
   *
   * @param capacities capacity per tier; every tier must be present with a positive value
   * @throws IllegalArgumentException if a tier is missing or its capacity is not positive
   */
  public PriorityQueueSet(Map<Priority, Integer> capacities) {
    Objects.requireNonNull(capacities, "capacities");
    Map<Priority, BlockingQueue<AnalysisRequest>> created = new EnumMap<>(Priority.class);
    Map<Priority, Integer> caps = new EnumMap<>(Priority.class);
    for (Priority priority : Priority.values()) {
      Integer capacity = capacities.get(priority);
      if (capacity == null || capacity <= 0) {
        throw new IllegalArgumentException(
            "capacity for " + priority.wireName() + " must be positive (was " + capacity + ")");
      }
      created.put(priority, new ArrayBlockingQueue<>(capacity));
      caps.put(priority, capacity);
    }
    this.queues = Collections.unmodifiableMap(created);
    this.capacities = Collections.unmodifiableMap(caps);
  }

  /**
   * Builds the queue set described by scheduler settings.
   *
   * @param settings scheduler settings
   * @return queue set sized per tier
   */
  public static PriorityQueueSet from(SchedulerSettings settings) {
    Map<Priority, Integer> capacities = new EnumMap<>(Priority.class);
    for (Priority priority : Priority.values()) {
      capacities.put(priority, settings.tier(priority).queueCapacity());
    }
    return new PriorityQueueSet(capacities);
  }

  /**
   * Enqueues a request on its tier, waiting at most {@code timeout} for room.
   *
   * @param request request to enqueue
   * @param timeout maximum wait; zero means a single non-blocking attempt
   * @return {@code true} if enqueued
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean offer(AnalysisRequest request, Duration timeout) throws InterruptedException {
    BlockingQueue<AnalysisRequest> queue = queue(request.priority());
    if (timeout == null || timeout.isZero()) {
      return queue.offer(request);
    }
    return queue.offer(request, timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Returns the queue backing a tier, for use by that tier's workers.
   *
   * @param priority tier
   * @return blocking queue of the tier
   */
  BlockingQueue<AnalysisRequest> queue(Priority priority) {
    return queues.get(Objects.requireNonNull(priority, "priority"));
  }

  /**
   * Current number of queued requests on a tier.
   *
   * @param priority tier
   * @return queue depth
   */
  public int depth(Priority priority) {
    return queue(priority).size();
  }

  /**
   * Current depth of every tier.
   *
   * @return depth per tier, always containing all three tiers
   */
  public Map<Priority, Integer> depths() {
    Map<Priority, Integer> depths = new EnumMap<>(Priority.class);
    for (Map.Entry<Priority, BlockingQueue<AnalysisRequest>> entry : queues.entrySet()) {
      depths.put(entry.getKey(), entry.getValue().size());
    }
    return depths;
  }

  /**
   * Configured capacity of a tier.
   *
   * @param priority tier
   * @return capacity
   */
  public int capacity(Priority priority) {
    return capacities.get(priority);
  }

  /**
   * Indicates whether every tier is empty.
   *
   * @return {@code true} when nothing is queued
   */
  public boolean isEmpty() {
    for (BlockingQueue<AnalysisRequest> queue : queues.values()) {
      if (!queue.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Removes and returns everything still queued, across all tiers.
   *
   * @return drained requests in tier order, FIFO within a tier
   */
  List<AnalysisRequest> drainAll() {
    List<AnalysisRequest> drained = new ArrayList<>();
    for (BlockingQueue<AnalysisRequest> queue : queues.values()) {
      queue.drainTo(drained);
    }
    return drained;
  }
}
