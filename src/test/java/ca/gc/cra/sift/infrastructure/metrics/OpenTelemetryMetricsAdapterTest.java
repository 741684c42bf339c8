package ca.gc.cra.sift.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

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
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("analyze.partition.tabular");
    adapter.increment("analyze.partition.tabular");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "analyze.partition.tabular");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("analyze.partition.tabular",
        point.getAttributes().get(AttributeKey.stringKey("sift.metric.key")));
    assertEquals("sift", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("analyze.records.loaded", 10);
    adapter.observe("analyze.records.loaded", 30);

    MetricData histogram = find(reader.collectAllMetrics(), "analyze.records.loaded");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(40.0, point.getSum());
  }

  @Test
  void testingBootstrapIsActive() {
    assertFalse(adapter.isNoop());
  }

  @Test
  void namesAreSanitized() {
    assertEquals("analyze.scan.latencynanos",
        OpenTelemetryMetricsAdapter.sanitizeName("analyze.scan.latencyNanos"));
    assertEquals("m9_lives", OpenTelemetryMetricsAdapter.sanitizeName("9 lives"));
    assertEquals("sift.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    MetricData match = metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElse(null);
    assertTrue(match != null, "Expected metric " + name + " to be exported");
    return match;
  }
}
