package ca.gc.cra.qsolog.config;

import ca.gc.cra.qsolog.domain.awards.AwardThresholds;
import ca.gc.cra.qsolog.domain.qso.QsoFilter;
import ca.gc.cra.qsolog.infrastructure.report.ReportFormat;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for the {@code awards} command.
 * <p>When {@link #input()} is present the summary is computed from that ADIF file instead of the
 * store.</p>
 *
 * @param input optional ADIF file summarized in place of the store
 * @param store log file summarized when no input is given
 * @param filter contact selection
 * @param format report rendering
 * @param thresholds award targets
 * @param engine engine settings
 * @since 0.1.0
 */
public record AwardsConfig(
    Optional<Path> input,
    Path store,
    QsoFilter filter,
    ReportFormat format,
    AwardThresholds thresholds,
    EngineConfig engine) {

  public AwardsConfig {
    input = Objects.requireNonNullElse(input, Optional.<Path>empty()).map(p -> p.toAbsolutePath().normalize());
    store = Objects.requireNonNullElseGet(store, ConfigValues::defaultStore).toAbsolutePath().normalize();
    filter = Objects.requireNonNullElse(filter, QsoFilter.all());
    format = Objects.requireNonNullElse(format, ReportFormat.TEXT);
    thresholds = Objects.requireNonNullElseGet(thresholds, AwardThresholds::defaults);
    engine = Objects.requireNonNullElseGet(engine, EngineConfig::defaults);
  }

  /** Path actually summarized: the input file when given, otherwise the store. */
  public Path source() {
    return input.orElse(store);
  }

  public static AwardsConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    AwardThresholds defaults = AwardThresholds.defaults();
    AwardThresholds thresholds = new AwardThresholds(
        ConfigValues.parseInt(options, "awards.dxcc", defaults.dxcc(), 1, Integer.MAX_VALUE),
        ConfigValues.parseInt(options, "awards.vucc", defaults.vucc(), 1, Integer.MAX_VALUE));
    return new AwardsConfig(
        ConfigValues.optionalPath("in", ConfigValues.firstNonBlank(options, "in", "input")),
        ConfigValues.optionalPath("store", options.get("store")).orElseGet(ConfigValues::defaultStore),
        ConfigValues.filter(options),
        ReportFormat.fromString(options.get("format")),
        thresholds,
        EngineConfig.fromMap(options));
  }
}
