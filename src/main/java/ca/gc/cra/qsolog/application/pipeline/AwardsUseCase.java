package ca.gc.cra.qsolog.application.pipeline;

import ca.gc.cra.qsolog.application.port.QsoStorePort;
import ca.gc.cra.qsolog.application.port.SummaryEngine;
import ca.gc.cra.qsolog.domain.awards.AwardSuggestions;
import ca.gc.cra.qsolog.domain.awards.AwardThresholds;
import ca.gc.cra.qsolog.domain.awards.AwardsSummary;
import ca.gc.cra.qsolog.domain.qso.Qso;
import ca.gc.cra.qsolog.domain.qso.QsoFilter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the awards summary and suggestions for the contacts selected by a filter.
 *
 * @since 0.1.0
 */
public final class AwardsUseCase {
  private static final Logger log = LoggerFactory.getLogger(AwardsUseCase.class);

  private final QsoStorePort store;
  private final QsoFilter filter;
  private final SummaryEngine engine;
  private final AwardThresholds thresholds;

  public AwardsUseCase(QsoStorePort store, QsoFilter filter, SummaryEngine engine, AwardThresholds thresholds) {
    this.store = Objects.requireNonNull(store, "store");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
  }

  /**
   * Reads the selected contacts and summarizes them.
   *
   * @return summary with suggestions
   * @throws IOException if the store cannot be read
   */
  public AwardsReport run() throws IOException {
    List<Qso> selected = new ArrayList<>();
    store.iterate(filter).forEach(selected::add);
    AwardsSummary summary = engine.summarize(selected);
    List<String> suggestions = AwardSuggestions.suggest(summary, thresholds);
    log.info("Summarized {} contacts: {} countries, {} grids",
        summary.totalQsos(), summary.uniqueCountries(), summary.uniqueGrids());
    return new AwardsReport(summary, suggestions);
  }

  /**
   * Result of an awards run.
   *
   * @param summary aggregate statistics
   * @param suggestions award progress notes
   */
  public record AwardsReport(AwardsSummary summary, List<String> suggestions) {
    public AwardsReport {
      Objects.requireNonNull(summary, "summary");
      suggestions = List.copyOf(suggestions);
    }
  }
}
