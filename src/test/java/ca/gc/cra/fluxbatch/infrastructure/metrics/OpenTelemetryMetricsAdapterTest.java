package ca.gc.cra.fluxbatch.infrastructure.metrics;

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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("fluxbatch.metric.key");

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

  @Test
  void incrementRecordsUnitCounter() {
    adapter.increment("batch.unit.failed");
    adapter.increment("batch.unit.failed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "batch.unit.failed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("batch.unit.failed", point.getAttributes().get(METRIC_KEY));
    assertEquals("fluxbatch", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsLatencyHistogramUnderSanitizedName() {
    adapter.observe("batch.unit.latencyMillis", 40L);
    adapter.observe("batch.unit.latencyMillis", 60L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "batch.unit.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum());
    assertEquals("batch.unit.latencyMillis", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeReplacesIllegalCharacters() {
    assertEquals("m1st.site", OpenTelemetryMetricsAdapter.sanitize("1st.site"));
    assertEquals("batch.site_skipped", OpenTelemetryMetricsAdapter.sanitize("batch.site skipped"));
    assertEquals("fluxbatch.metric", OpenTelemetryMetricsAdapter.sanitize(" "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " in " + metrics);
    return match;
  }
}
