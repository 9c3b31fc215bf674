package ca.gc.cra.prism.api;

import ca.gc.cra.prism.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PRISM CLI dispatcher that routes to subcommands.
 *
 * <p>Flags placed before the command apply to the dispatcher; everything after the command is handed
 * to the subcommand untouched.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: prism <analyze> [options]";
  private static final String HELP_TEXT = """
      PRISM media analysis scheduler

      Usage:
        prism <command> [options]

      Commands:
        analyze     Queue media files for deepfake analysis and print results (analyze --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the subcommand
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = 0;
    while (commandIndex < raw.length && isFlag(raw[commandIndex])) {
      commandIndex++;
    }
    CliInput global = CliInput.parse(Arrays.copyOfRange(raw, 0, commandIndex));
    if (global.help() || (commandIndex < raw.length && isHelpWord(raw[commandIndex]))) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex >= raw.length) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);
    return switch (command) {
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static boolean isFlag(String arg) {
    if (arg == null) {
      return true;
    }
    String trimmed = arg.trim();
    return trimmed.isEmpty() || trimmed.startsWith("-");
  }

  private static boolean isHelpWord(String arg) {
    return arg != null && arg.trim().equalsIgnoreCase("help");
  }
}
