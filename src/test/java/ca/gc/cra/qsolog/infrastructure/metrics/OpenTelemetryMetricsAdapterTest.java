package ca.gc.cra.qsolog.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  private MetricData metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream()
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("import.fallback.serial");
    adapter.increment("import.fallback.serial");

    MetricData counter = metric("import.fallback.serial");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("import.fallback.serial",
        point.getAttributes().get(AttributeKey.stringKey("qsolog.metric.key")));
    assertEquals("qsolog", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("import.records.accepted", 10);
    adapter.observe("import.records.accepted", 30);

    MetricData histogram = metric("import.records.accepted");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2, point.getCount());
    assertEquals(40.0, point.getSum());
  }

  @Test
  void sanitizesInstrumentNames() {
    assertEquals("import.latency_ms", OpenTelemetryMetricsAdapter.sanitizeName(" Import.Latency ms "));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("qsolog.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void noneExporterIsNoop() {
    String previous = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");
    try {
      assertDoesNotThrow(() -> {
        try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter()) {
          noop.increment("anything");
          noop.observe("anything.else", 1);
          noop.forceFlush();
        }
      });
    } finally {
      if (previous == null) {
        System.clearProperty("otel.metrics.exporter");
      } else {
        System.setProperty("otel.metrics.exporter", previous);
      }
    }
  }
}
