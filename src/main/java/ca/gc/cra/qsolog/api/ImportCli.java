package ca.gc.cra.qsolog.api;

import ca.gc.cra.qsolog.application.pipeline.ImportUseCase.ImportSummary;
import ca.gc.cra.qsolog.config.CompositionRoot;
import ca.gc.cra.qsolog.config.ImportConfig;
import ca.gc.cra.qsolog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.qsolog.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code qsolog import}: decodes an ADIF file and appends accepted contacts to the log store.
 *
 * @since 0.1.0
 */
public final class ImportCli {
  private static final Logger log = LoggerFactory.getLogger(ImportCli.class);
  private static final String MODE = "import";
  private static final String SUMMARY_USAGE =
      "usage: import in=FILE [store=FILE] [engine=SERIAL|PARALLEL] [workers=N] [config=YAML] [--dry-run]";
  private static final String HELP_TEXT = """
      QSO log import

      Usage:
        import in=contest.adi [options]

      Required:
        in=FILE                  ADIF file to import

      Optional:
        store=FILE               Log store to append to (default ~/.qsolog/qsolog.adi)
        engine=SERIAL|PARALLEL   Decode engine (default PARALLEL)
        workers=N                Worker threads for PARALLEL (default: available processors)
        parallelThreshold=N      Records below which PARALLEL decodes serially (default 100)
        config=FILE              YAML file with common/import sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL         OTLP metrics endpoint when exporter=otlp
        --dry-run                Decode and count without writing to the store
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ImportCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CommandSupport.Resolution resolution =
        CommandSupport.resolve(MODE, CliInput.parse(args), SUMMARY_USAGE, HELP_TEXT, log);
    if (resolution.finished()) {
      return resolution.exitCode();
    }

    ImportConfig config;
    try {
      config = ImportConfig.fromMap(resolution.settings());
      Paths.validateReadableFile(config.input());
      if (!config.dryRun()) {
        Paths.validateWritableFile(config.store(), true);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid import arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config.engine(), metrics);
      log.info("Importing {} into {} (engine={}, workers={}, dryRun={})",
          config.input(), config.dryRun() ? "<memory>" : config.store(),
          config.engine().engine(), config.engine().workers(), config.dryRun());
      ImportSummary summary = root.importUseCase(config).run();
      CliPrinter.printLines(
          (config.dryRun() ? "Dry run: decoded " : "Imported ") + summary.accepted() + " QSOs",
          "Rejected records: " + summary.rejected());
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CommandSupport.failure(MODE, ex, log);
    }
  }
}
