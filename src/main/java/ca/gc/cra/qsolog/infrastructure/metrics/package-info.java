/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.qsolog.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe from worker threads.</p>
 * <p><strong>Metrics:</strong> Names follow the dotted {@code import.*}, {@code export.*}, {@code awards.*} and
 * {@code store.*} contract.</p>
 */
package ca.gc.cra.qsolog.infrastructure.metrics;
