package ca.gc.cra.sift.api;

import ca.gc.cra.sift.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SIFT CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sift <analyze> [options]";
  private static final String HELP_TEXT = """
      SIFT command dispatcher

      Usage:
        sift <command> [options]

      Commands:
        analyze     Tally suspicious source IPs in a log, CSV, JSON, or Excel file (analyze --help for details)

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
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    CliInput input = CliInput.parse(safeArgs);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = withoutFirst(safeArgs, remainder[0]);

    return switch (command) {
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String command) {
    for (int i = 0; i < args.length; i++) {
      if (args[i] != null && args[i].trim().equals(command)) {
        String[] rest = new String[args.length - 1];
        System.arraycopy(args, 0, rest, 0, i);
        System.arraycopy(args, i + 1, rest, i, args.length - i - 1);
        return rest;
      }
    }
    return Arrays.copyOf(args, args.length);
  }
}
