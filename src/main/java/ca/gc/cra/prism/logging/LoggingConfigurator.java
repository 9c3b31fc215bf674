package ca.gc.cra.prism.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts PRISM logging verbosity at runtime for the CLI {@code --verbose} flag.
 *
 * @implNote Logback only; other SLF4J bindings keep their configured level and a warning is logged.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String PRISM_LOGGER = "ca.gc.cra.prism";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the PRISM package logger to DEBUG and the root logger to INFO, so per-job detail becomes
   * visible without enabling third-party debug output.
   *
   * @return {@code true} if the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      Level rootLevel = root.getLevel();
      if (rootLevel == null || rootLevel.isGreaterOrEqual(Level.WARN)) {
        root.setLevel(Level.INFO);
      }
      context.getLogger(PRISM_LOGGER).setLevel(Level.DEBUG);
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
