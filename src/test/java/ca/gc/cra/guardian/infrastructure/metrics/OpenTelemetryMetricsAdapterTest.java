package ca.gc.cra.guardian.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("guardian.metric.key");

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
  void blockedCounterCarriesKeyAndServiceResource() {
    adapter.increment("safety.blocked.dangerous");
    adapter.increment("safety.blocked.dangerous");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "safety.blocked.dangerous");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("safety.blocked.dangerous", point.getAttributes().get(METRIC_KEY));
    assertEquals("guardian", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void scoreObservationsBecomeHistogram() {
    adapter.observe("safety.score.pct", 100);
    adapter.observe("safety.score.pct", 60);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "safety.score.pct");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(160.0, point.getSum(), 1e-9);
  }

  @Test
  void instrumentNamesAreNormalized() {
    assertEquals("pipeline.stage.content_filter.latencymillis",
        OpenTelemetryMetricsAdapter.instrumentName("pipeline.stage.content_filter.latencyMillis"));
    assertEquals("m1st_key", OpenTelemetryMetricsAdapter.instrumentName("1st key"));
    assertEquals("guardian.metric", OpenTelemetryMetricsAdapter.instrumentName(" "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }
}
