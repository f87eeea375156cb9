/**
 * Awards statistics over contact collections.
 * <p><strong>Role:</strong> Domain aggregation used by the awards use case and summary engines.</p>
 * <p><strong>Concurrency:</strong> Summaries are immutable; chunk summaries combine only through
 * {@link ca.gc.cra.qsolog.domain.awards.AwardsSummary#merge(ca.gc.cra.qsolog.domain.awards.AwardsSummary)}.</p>
 */
package ca.gc.cra.qsolog.domain.awards;
