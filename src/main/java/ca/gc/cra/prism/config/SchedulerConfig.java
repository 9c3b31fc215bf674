package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.scheduler.BackpressureMode;
import ca.gc.cra.prism.application.scheduler.SchedulerSettings;
import ca.gc.cra.prism.application.scheduler.SchedulerSettings.TierSettings;
import ca.gc.cra.prism.domain.analysis.Priority;
import ca.gc.cra.prism.validation.Numbers;
import ca.gc.cra.prism.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Scheduler configuration assembled from flat {@code key=value} maps.
 *
 * <p>Keys (defaults in parentheses): {@code workers.normal|high|critical} (2), {@code queue.normal}
 * (100), {@code queue.high} (50), {@code queue.critical} (20), {@code detectorThreads} (4),
 * {@code backpressure} (BLOCK), {@code offerTimeoutMs} (0), {@code pollIntervalMs} (250),
 * {@code retentionHours} (24), {@code cleanupIntervalMinutes} (60, 0 disables),
 * {@code shutdownTimeoutSeconds} (300), {@code modelBase} (~/.prism/models), {@code modelName}
 * (deepfake_detector), {@code errorDetailMaxBytes} (512).</p>
 *
 * @param settings scheduler tuning
 * @param modelBase directory the model locator searches
 * @since 0.1.0
 */
public record SchedulerConfig(SchedulerSettings settings, Path modelBase) {
  static final int MAX_WORKERS_PER_TIER = 64;
  static final int MAX_QUEUE_CAPACITY = 100_000;

  /** Validates fields. */
  public SchedulerConfig {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(modelBase, "modelBase");
  }

  /**
   * Default configuration.
   *
   * @return defaults
   */
  public static SchedulerConfig defaults() {
    return new SchedulerConfig(SchedulerSettings.defaults(), defaultModelBase());
  }

  /**
   * Builds configuration from a flat map; missing keys take defaults.
   *
   * @param args merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static SchedulerConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    SchedulerSettings defaults = SchedulerSettings.defaults();

    Map<Priority, TierSettings> tiers = new EnumMap<>(Priority.class);
    for (Priority priority : Priority.values()) {
      TierSettings fallback = defaults.tier(priority);
      String tier = priority.wireName();
      int workers = (int) longValue(args, "workers." + tier, fallback.workers(), 1, MAX_WORKERS_PER_TIER);
      int capacity = (int) longValue(args, "queue." + tier, fallback.queueCapacity(), 1, MAX_QUEUE_CAPACITY);
      tiers.put(priority, new TierSettings(workers, capacity));
    }

    int detectorThreads = (int) longValue(args, "detectorThreads", defaults.detectorThreads(), 1, 256);
    BackpressureMode backpressure = BackpressureMode.fromString(args.get("backpressure"));
    Duration offerTimeout = Duration.ofMillis(
        longValue(args, "offerTimeoutMs", defaults.offerTimeout().toMillis(), 0, 3_600_000));
    Duration pollInterval = Duration.ofMillis(
        longValue(args, "pollIntervalMs", defaults.pollInterval().toMillis(), 1, 60_000));
    Duration retention = Duration.ofHours(
        longValue(args, "retentionHours", defaults.retention().toHours(), 0, 24L * 365));
    Duration cleanupInterval = Duration.ofMinutes(
        longValue(args, "cleanupIntervalMinutes", defaults.cleanupInterval().toMinutes(), 0, 24L * 60));
    Duration shutdownTimeout = Duration.ofSeconds(
        longValue(args, "shutdownTimeoutSeconds", defaults.shutdownTimeout().toSeconds(), 0, 86_400));
    String modelName = stringValue(args, "modelName")
        .map(v -> Strings.requireIdentifier("modelName", v))
        .orElse(defaults.modelName());
    int errorDetailMaxBytes = (int) longValue(
        args, "errorDetailMaxBytes", defaults.errorDetailMaxBytes(), 64, 65_536);
    Path modelBase = stringValue(args, "modelBase").map(SchedulerConfig::expandHome).orElse(defaultModelBase());

    SchedulerSettings settings = new SchedulerSettings(
        tiers,
        detectorThreads,
        backpressure,
        offerTimeout,
        pollInterval,
        retention,
        cleanupInterval,
        shutdownTimeout,
        modelName,
        errorDetailMaxBytes);
    return new SchedulerConfig(settings, modelBase);
  }

  /**
   * Renders this configuration back to the flat key space.
   *
   * @return ordered map of keys to values
   */
  public Map<String, String> asFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    for (Priority priority : Priority.values()) {
      map.put("workers." + priority.wireName(), Integer.toString(settings.tier(priority).workers()));
    }
    for (Priority priority : Priority.values()) {
      map.put("queue." + priority.wireName(), Integer.toString(settings.tier(priority).queueCapacity()));
    }
    map.put("detectorThreads", Integer.toString(settings.detectorThreads()));
    map.put("backpressure", settings.backpressure().name());
    map.put("offerTimeoutMs", Long.toString(settings.offerTimeout().toMillis()));
    map.put("pollIntervalMs", Long.toString(settings.pollInterval().toMillis()));
    map.put("retentionHours", Long.toString(settings.retention().toHours()));
    map.put("cleanupIntervalMinutes", Long.toString(settings.cleanupInterval().toMinutes()));
    map.put("shutdownTimeoutSeconds", Long.toString(settings.shutdownTimeout().toSeconds()));
    map.put("modelBase", modelBase.toString());
    map.put("modelName", settings.modelName());
    map.put("errorDetailMaxBytes", Integer.toString(settings.errorDetailMaxBytes()));
    return map;
  }

  private static long longValue(Map<String, String> args, String key, long fallback, long min, long max) {
    String raw = args.get(key);
    if (raw == null || raw.isBlank()) {
      return Numbers.requireRange(key, fallback, min, max);
    }
    return Numbers.parseRange(key, raw, min, max);
  }

  private static Optional<String> stringValue(Map<String, String> args, String key) {
    String raw = args.get(key);
    return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(raw.trim());
  }

  private static Path defaultModelBase() {
    return Path.of(System.getProperty("user.home", "."), ".prism", "models");
  }

  static Path expandHome(String raw) {
    if (raw.equals("~")) {
      return Path.of(System.getProperty("user.home", "."));
    }
    if (raw.startsWith("~/")) {
      return Path.of(System.getProperty("user.home", "."), raw.substring(2));
    }
    return Path.of(raw);
  }
}
