package ca.gc.cra.prism.application.scheduler;

import ca.gc.cra.prism.domain.analysis.Priority;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scheduler tuning parameters.
 *
 * @param tiers worker count and queue capacity for every priority tier
 * @param detectorThreads size of the bounded detector pool
 * @param backpressure behaviour when a tier queue is full
 * @param offerTimeout how long {@link BackpressureMode#REJECT} waits for room before failing
 * @param pollInterval sampling interval used by {@code waitForCompletion}
 * @param retention age after which records are removed by cleanup
 * @param cleanupInterval period of automatic cleanup; {@link Duration#ZERO} disables it
 * @param shutdownTimeout drain budget before remaining jobs are forcibly failed
 * @param modelName logical model resolved once at start
 * @param errorDetailMaxBytes maximum stored length of failure detail
 * @since 0.1.0
 */
public record SchedulerSettings(
    Map<Priority, TierSettings> tiers,
    int detectorThreads,
    BackpressureMode backpressure,
    Duration offerTimeout,
    Duration pollInterval,
    Duration retention,
    Duration cleanupInterval,
    Duration shutdownTimeout,
    String modelName,
    int errorDetailMaxBytes) {

  static final int DEFAULT_WORKERS_PER_TIER = 2;
  static final int DEFAULT_DETECTOR_THREADS = 4;
  static final String DEFAULT_MODEL_NAME = "deepfake_detector";

  /**
   * Normalizes settings, clamping counts and defaulting missing values.
   *
   * @throws IllegalArgumentException if a tier is missing or a duration is negative
   */
  public SchedulerSettings {
    Objects.requireNonNull(tiers, "tiers");
    EnumMap<Priority, TierSettings> copy = new EnumMap<>(Priority.class);
    for (Priority priority : Priority.values()) {
      TierSettings tier = tiers.get(priority);
      if (tier == null) {
        throw new IllegalArgumentException("missing tier settings for " + priority.wireName());
      }
      copy.put(priority, tier);
    }
    tiers = Collections.unmodifiableMap(copy);
    detectorThreads = Math.max(1, detectorThreads);
    backpressure = Objects.requireNonNullElse(backpressure, BackpressureMode.BLOCK);
    offerTimeout = requireNonNegative("offerTimeout", offerTimeout, Duration.ZERO);
    pollInterval = requireNonNegative("pollInterval", pollInterval, Duration.ofMillis(250));
    if (pollInterval.isZero()) {
      pollInterval = Duration.ofMillis(1);
    }
    retention = requireNonNegative("retention", retention, Duration.ofHours(24));
    cleanupInterval = requireNonNegative("cleanupInterval", cleanupInterval, Duration.ofHours(1));
    shutdownTimeout = requireNonNegative("shutdownTimeout", shutdownTimeout, Duration.ofMinutes(5));
    modelName = (modelName == null || modelName.isBlank()) ? DEFAULT_MODEL_NAME : modelName.trim();
    errorDetailMaxBytes = Math.max(64, errorDetailMaxBytes);
  }

  /**
   * Derives settings using the scheduler defaults: two workers per tier and queue capacities of 100,
   * 50, and 20 for normal, high, and critical.
   *
   * @return default settings
   */
  public static SchedulerSettings defaults() {
    return new SchedulerSettings(
        defaultTiers(),
        DEFAULT_DETECTOR_THREADS,
        BackpressureMode.BLOCK,
        Duration.ZERO,
        Duration.ofMillis(250),
        Duration.ofHours(24),
        Duration.ofHours(1),
        Duration.ofMinutes(5),
        DEFAULT_MODEL_NAME,
        512);
  }

  /**
   * Default tier table.
   *
   * @return mutable map of default tier settings
   */
  public static Map<Priority, TierSettings> defaultTiers() {
    Map<Priority, TierSettings> tiers = new EnumMap<>(Priority.class);
    tiers.put(Priority.NORMAL, new TierSettings(DEFAULT_WORKERS_PER_TIER, 100));
    tiers.put(Priority.HIGH, new TierSettings(DEFAULT_WORKERS_PER_TIER, 50));
    tiers.put(Priority.CRITICAL, new TierSettings(DEFAULT_WORKERS_PER_TIER, 20));
    return tiers;
  }

  /**
   * Returns settings for one tier.
   *
   * @param priority tier
   * @return tier settings
   */
  public TierSettings tier(Priority priority) {
    return tiers.get(priority);
  }

  /**
   * Total dispatcher threads across all tiers.
   *
   * @return sum of tier worker counts
   */
  public int totalWorkers() {
    int total = 0;
    for (TierSettings tier : tiers.values()) {
      total += tier.workers();
    }
    return total;
  }

  private static Duration requireNonNegative(String name, Duration value, Duration fallback) {
    Duration effective = Objects.requireNonNullElse(value, fallback);
    if (effective.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative");
    }
    return effective;
  }

  /**
   * Per-tier worker and queue sizing.
   *
   * @param workers dedicated dispatcher threads; clamped to at least one
   * @param queueCapacity bounded queue capacity; clamped to at least one
   */
  public record TierSettings(int workers, int queueCapacity) {
    /** Clamps values to usable minimums. */
    public TierSettings {
      workers = Math.max(1, workers);
      queueCapacity = Math.max(1, queueCapacity);
    }
  }
}
