/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and shorten record previews before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from import workers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.qsolog.logging;
