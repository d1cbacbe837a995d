package ca.gc.cra.premis.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
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
    if (adapter != null) {
      adapter.close();
    }
  }

  private Optional<MetricData> metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("import.records");
    adapter.increment("import.records");
    adapter.increment("import.records");
    adapter.forceFlush();

    MetricData counter = metric("import.records").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("import.records", point.getAttributes().get(AttributeKey.stringKey("premis.metric.key")));
    assertEquals("premis-records", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("export.latencyNanos", 1_000L);
    adapter.observe("export.latencyNanos", 3_000L);
    adapter.forceFlush();

    MetricData histogram = metric("export.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
  }

  @Test
  void sanitizeNameReplacesIllegalCharacters() {
    assertEquals("import.records", OpenTelemetryMetricsAdapter.sanitizeName("import.records"));
    assertEquals("m1st_metric", OpenTelemetryMetricsAdapter.sanitizeName("1st metric"));
    assertEquals("premis.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void noneExporterRunsInNoopMode() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("none", "");

    assertTrue(result.isNoop());
    new OpenTelemetryMetricsAdapter(result).increment("import.documents");
  }
}
