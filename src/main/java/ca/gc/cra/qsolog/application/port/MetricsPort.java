package ca.gc.cra.qsolog.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for import, export, and awards runs.
 * <p><strong>Why:</strong> Lets engines and use cases record counters and latencies without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and dry runs.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from worker threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code import.records.rejected}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code import.fallback.serial}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, record counts)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
