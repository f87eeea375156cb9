package ca.gc.cra.qsolog.api;

import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code qsolog} dispatcher that routes to the import, export, and awards commands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: qsolog <import|export|awards> [key=value ...] [--flags]";
  private static final String HELP_TEXT = """
      QSO log tools

      Usage:
        qsolog <command> [options]

      Commands:
        import    Import an ADIF file into the log store
        export    Export the log store to an ADIF file
        awards    Summarize award progress

      Run qsolog <command> --help for command options.
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a subcommand without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] safe = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safe.length; i++) {
      if (safe[i] != null && !safe[i].isBlank() && !safe[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      if (CliInput.parse(safe).help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safe[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[safe.length - 1];
    System.arraycopy(safe, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safe, commandIndex + 1, delegateArgs, commandIndex, safe.length - commandIndex - 1);

    return switch (command) {
      case "import" -> ImportCli.run(delegateArgs);
      case "export" -> ExportCli.run(delegateArgs);
      case "awards" -> AwardsCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {} (args {})", command, Arrays.toString(delegateArgs));
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
