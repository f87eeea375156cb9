package ca.gc.cra.qsolog.api;

import ca.gc.cra.qsolog.config.ConfigMerger;
import ca.gc.cra.qsolog.config.DefaultsForMode;
import ca.gc.cra.qsolog.config.YamlConfigLoader;
import ca.gc.cra.qsolog.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Argument handling shared by the subcommands: help, verbosity, {@code key=value} parsing, the
 * optional YAML file, and the merge with embedded defaults.
 */
final class CommandSupport {

  private CommandSupport() {}

  /**
   * Resolves the effective configuration for {@code mode}, or the exit code to stop with.
   *
   * @param mode subcommand name
   * @param input parsed arguments
   * @param usage one-line usage printed on argument errors
   * @param help full help printed for {@code --help}
   * @param log logger of the calling command
   * @return merged settings or a terminal exit code
   */
  static Resolution resolve(String mode, CliInput input, String usage, String help, Logger log) {
    if (input.help()) {
      CliPrinter.println(help.stripTrailing());
      return Resolution.exit(ExitCode.SUCCESS);
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", mode);
    }

    Map<String, String> cli;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.exit(ExitCode.INVALID_ARGS);
    }
    if (input.hasFlag("--dry-run")) {
      cli.put("dryRun", "true");
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(cli);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.exit(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Resolution.exit(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.exit(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn));
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.exit(ExitCode.CONFIG_ERROR);
    }
    return new Resolution(effective, null);
  }

  /**
   * Maps a use-case failure to an exit code after logging it.
   *
   * @param mode subcommand name
   * @param failure exception thrown by the run
   * @param log logger of the calling command
   * @return exit code for the failure
   */
  static ExitCode failure(String mode, Exception failure, Logger log) {
    if (failure instanceof InterruptedIOException || failure instanceof ClosedByInterruptException) {
      log.warn("{} interrupted", mode);
      Thread.currentThread().interrupt();
      return ExitCode.INTERRUPTED;
    }
    if (failure instanceof IOException) {
      log.error("{} failed with an I/O error", mode, failure);
      return ExitCode.IO_ERROR;
    }
    if (failure instanceof IllegalArgumentException) {
      log.error("{} configuration error: {}", mode, failure.getMessage(), failure);
      return ExitCode.CONFIG_ERROR;
    }
    log.error("Unexpected failure in {}", mode, failure);
    return ExitCode.RUNTIME_FAILURE;
  }

  /** Effective settings, or the exit code when argument handling already finished the run. */
  record Resolution(Map<String, String> settings, ExitCode exitCode) {
    static Resolution exit(ExitCode code) {
      return new Resolution(Map.of(), code);
    }

    boolean finished() {
      return exitCode != null;
    }
  }
}
