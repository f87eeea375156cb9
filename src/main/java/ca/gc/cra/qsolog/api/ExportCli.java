package ca.gc.cra.qsolog.api;

import ca.gc.cra.qsolog.config.CompositionRoot;
import ca.gc.cra.qsolog.config.EngineConfig;
import ca.gc.cra.qsolog.config.ExportConfig;
import ca.gc.cra.qsolog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.qsolog.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code qsolog export}: writes the filtered contacts of the log store to an ADIF file.
 *
 * @since 0.1.0
 */
public final class ExportCli {
  private static final Logger log = LoggerFactory.getLogger(ExportCli.class);
  private static final String MODE = "export";
  private static final String SUMMARY_USAGE =
      "usage: export out=FILE [store=FILE] [band=BAND] [mode=MODE] [call=TEXT] [limit=N] [programId=NAME]";
  private static final String HELP_TEXT = """
      QSO log export

      Usage:
        export out=backup.adi [options]

      Required:
        out=FILE          ADIF file to write (replaced if it exists)

      Optional:
        store=FILE        Log store to read (default ~/.qsolog/qsolog.adi)
        band=BAND         Only contacts on this band, e.g. 20M
        mode=MODE         Only contacts in this mode, e.g. CW
        call=TEXT         Only calls containing TEXT (case-insensitive)
        limit=N           At most N contacts (0 = all)
        programId=NAME    PROGRAMID header value (default QSOLOG)
        config=FILE       YAML file with common/export sections
        --verbose         Enable DEBUG logging
        --help            Show this message
      """;

  private ExportCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CommandSupport.Resolution resolution =
        CommandSupport.resolve(MODE, CliInput.parse(args), SUMMARY_USAGE, HELP_TEXT, log);
    if (resolution.finished()) {
      return resolution.exitCode();
    }

    ExportConfig config;
    try {
      config = ExportConfig.fromMap(resolution.settings());
      Paths.validateWritableFile(config.output(), true);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid export arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(EngineConfig.defaults(), metrics);
      long written = root.exportUseCase(config).run();
      CliPrinter.println("Exported " + written + " QSOs to " + config.output());
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CommandSupport.failure(MODE, ex, log);
    }
  }
}
