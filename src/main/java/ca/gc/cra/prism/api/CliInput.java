package ca.gc.cra.prism.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw arguments into {@code key=value} pairs, positional words, and {@code --flags}.
 *
 * <p>Aliases are normalized: {@code -h} and {@code help} become {@code --help}; {@code -v} and
 * {@code --debug} become {@code --verbose}.</p>
 *
 * @param keyValueArgs non-flag arguments in their original order
 * @param flags normalized lower-case flags
 * @since 0.1.0
 */
public record CliInput(List<String> keyValueArgs, Set<String> flags) {
  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");

  /** Copies the collections. */
  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments; {@code null} and blank entries are skipped.
   *
   * @param args raw arguments
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_ALIASES.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_ALIASES.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags);
  }

  /**
   * Whether help was requested.
   *
   * @return {@code true} for {@code --help} or an alias
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Whether verbose logging was requested.
   *
   * @return {@code true} for {@code --verbose} or an alias
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag, case-insensitively.
   *
   * @param flag flag including leading dashes
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Non-flag arguments as an array, for handing to a subcommand.
   *
   * @return copy of the non-flag arguments
   */
  public String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }
}
