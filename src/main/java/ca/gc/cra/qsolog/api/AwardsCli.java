package ca.gc.cra.qsolog.api;

import ca.gc.cra.qsolog.application.pipeline.AwardsUseCase.AwardsReport;
import ca.gc.cra.qsolog.config.AwardsConfig;
import ca.gc.cra.qsolog.config.CompositionRoot;
import ca.gc.cra.qsolog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.qsolog.infrastructure.report.AwardsReportWriter;
import ca.gc.cra.qsolog.validation.Paths;
import java.io.StringWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code qsolog awards}: prints award statistics and suggestions as text or JSON.
 *
 * @since 0.1.0
 */
public final class AwardsCli {
  private static final Logger log = LoggerFactory.getLogger(AwardsCli.class);
  private static final String MODE = "awards";
  private static final String SUMMARY_USAGE =
      "usage: awards [store=FILE | in=FILE] [band=BAND] [mode=MODE] [format=text|json] "
          + "[awards.dxcc=N] [awards.vucc=N]";
  private static final String HELP_TEXT = """
      QSO log awards

      Usage:
        awards [options]

      Optional:
        store=FILE              Log store to summarize (default ~/.qsolog/qsolog.adi)
        in=FILE                 Summarize this ADIF file instead of the store
        band=BAND               Only contacts on this band
        mode=MODE               Only contacts in this mode
        format=text|json        Report format (default text)
        awards.dxcc=N           Countries needed for DXCC (default 100)
        awards.vucc=N           Grids needed for VUCC (default 100)
        engine=SERIAL|PARALLEL  Summary engine (default PARALLEL)
        summaryChunkSize=N      Contacts per parallel slice (default 5000)
        config=FILE             YAML file with common/awards sections
        --verbose               Enable DEBUG logging
        --help                  Show this message
      """;

  private AwardsCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CommandSupport.Resolution resolution =
        CommandSupport.resolve(MODE, CliInput.parse(args), SUMMARY_USAGE, HELP_TEXT, log);
    if (resolution.finished()) {
      return resolution.exitCode();
    }

    AwardsConfig config;
    try {
      config = AwardsConfig.fromMap(resolution.settings());
      config.input().ifPresent(Paths::validateReadableFile);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid awards arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config.engine(), metrics);
      AwardsReport report = root.awardsUseCase(config).run();
      StringWriter out = new StringWriter();
      new AwardsReportWriter().write(report.summary(), report.suggestions(), config.format(), out);
      CliPrinter.print(out.toString());
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CommandSupport.failure(MODE, ex, log);
    }
  }
}
