package ca.gc.cra.fluxbatch.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into normalized flags and {@code key=value} tokens.
 */
final class CliInput {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";
  static final String DRY_RUN = "--dry-run";

  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Partitions raw arguments. Blank and {@code null} entries are ignored; any dash-prefixed token without
   * {@code '='} is treated as a flag.
   *
   * @param args raw arguments (may be {@code null})
   * @return parsed input
   */
  static CliInput parse(String[] args) {
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
          flags.add(HELP);
        } else if (VERBOSE_ALIASES.contains(lower)) {
          flags.add(VERBOSE);
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags);
  }

  String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  boolean help() {
    return flags.contains(HELP);
  }

  boolean verbose() {
    return flags.contains(VERBOSE);
  }

  boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return "CliInput" + Arrays.toString(keyValueArgs.toArray()) + flags;
  }
}
