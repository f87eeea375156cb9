/**
 * Contact value objects and the filter applied when reading them back from a store.
 * <p><strong>Concurrency:</strong> Types are immutable; safe across threads.</p>
 */
package ca.gc.cra.qsolog.domain.qso;
