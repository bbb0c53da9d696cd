package ca.gc.cra.logmerge.api;

import ca.gc.cra.logmerge.logging.LoggingConfigurator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point dispatching to subcommands.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: logmerge merge [options]";
  private static final String HELP_TEXT = """
      logmerge command dispatcher

      Usage:
        logmerge <command> [options]

      Commands:
        merge       Merge log files by timestamp or concurrently (merge --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.keyValueArgs().isEmpty()) {
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

    String command = input.keyValueArgs().get(0).toLowerCase(Locale.ROOT);
    return switch (command) {
      case "merge" -> MergeCli.run(subcommandArgs(args));
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  /** Drops the command word but keeps every flag, so {@code merge --help} reaches the subcommand. */
  private static String[] subcommandArgs(String[] args) {
    String[] rest = new String[args.length - 1];
    boolean dropped = false;
    int i = 0;
    for (String arg : args) {
      if (!dropped && arg != null && !arg.isBlank() && !arg.trim().startsWith("-")) {
        dropped = true;
        continue;
      }
      if (i < rest.length) {
        rest[i++] = arg;
      }
    }
    return rest;
  }
}
