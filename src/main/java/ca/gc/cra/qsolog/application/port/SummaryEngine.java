package ca.gc.cra.qsolog.application.port;

import ca.gc.cra.qsolog.domain.awards.AwardsSummary;
import ca.gc.cra.qsolog.domain.qso.Qso;
import java.util.List;

/**
 * Computes an {@link AwardsSummary} over a materialized contact collection.
 *
 * <p>Implemented by {@code SerialSummaryEngine} and {@code ExecutorSummaryEngine}; both return a summary
 * equal to the serial computation regardless of chunking or completion order.</p>
 *
 * @since 0.1.0
 */
public interface SummaryEngine {
  /**
   * Summarizes the given contacts.
   *
   * @param qsos contacts to summarize; must not be {@code null}
   * @return immutable summary
   */
  AwardsSummary summarize(List<Qso> qsos);
}
