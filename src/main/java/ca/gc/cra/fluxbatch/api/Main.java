package ca.gc.cra.fluxbatch.api;

import ca.gc.cra.fluxbatch.domain.batch.RunMode;
import ca.gc.cra.fluxbatch.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * fluxbatch CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: fluxbatch <levels|sites|list-levels> [options]";
  private static final String HELP_TEXT = """
      fluxbatch command dispatcher

      Usage:
        fluxbatch <command> [options]

      Commands:
        levels       Run each declared level over its control files (levels --help for details)
        sites        Run per-site control file lists in parallel (sites --help for details)
        list-levels  Print the known processing levels

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
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
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the command)
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);

    return switch (command) {
      case "levels" -> BatchCli.run(delegateArgs, RunMode.LEVELS);
      case "sites" -> BatchCli.run(delegateArgs, RunMode.SITES);
      case "list-levels" -> ListLevelsCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        yield run(Arrays.copyOfRange(args, 1, args.length));
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
