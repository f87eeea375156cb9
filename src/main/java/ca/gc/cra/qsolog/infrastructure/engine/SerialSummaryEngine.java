package ca.gc.cra.qsolog.infrastructure.engine;

import ca.gc.cra.qsolog.application.port.SummaryEngine;
import ca.gc.cra.qsolog.domain.awards.AwardsAggregator;
import ca.gc.cra.qsolog.domain.awards.AwardsSummary;
import ca.gc.cra.qsolog.domain.qso.Qso;
import java.util.List;
import java.util.Objects;

/**
 * {@link SummaryEngine} that aggregates on the calling thread.
 *
 * @since 0.1.0
 */
public final class SerialSummaryEngine implements SummaryEngine {
  @Override
  public AwardsSummary summarize(List<Qso> qsos) {
    Objects.requireNonNull(qsos, "qsos");
    return AwardsAggregator.summarize(qsos);
  }
}
