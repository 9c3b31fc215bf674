package ca.gc.cra.prism.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void truncateAppendsOriginalLength() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertEquals("abcd... (truncated, 4 of 10 bytes)", truncated);
  }

  @Test
  void truncateDoesNotSplitMultibyteCharacters() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é..."), truncated);
  }

  @Test
  void describeNamesTheExceptionType() {
    assertEquals("IOException: disk gone", Logs.describe(new IOException("disk gone"), 64));
    assertEquals("IllegalStateException", Logs.describe(new IllegalStateException(), 64));
  }

  @Test
  void verboseLoggingLowersPrismLogger() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    Logger prism = context.getLogger("ca.gc.cra.prism");
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    Level original = prism.getLevel();
    Level originalRoot = root.getLevel();
    try {
      prism.setLevel(Level.WARN);

      assertTrue(LoggingConfigurator.enableVerboseLogging());
      assertEquals(Level.DEBUG, prism.getLevel());
    } finally {
      prism.setLevel(original);
      root.setLevel(originalRoot);
    }
  }
}
