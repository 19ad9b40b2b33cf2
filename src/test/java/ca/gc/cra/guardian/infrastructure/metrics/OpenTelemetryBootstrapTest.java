package ca.gc.cra.guardian.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @BeforeEach
  void rememberProperties() {
    previousExporter = System.getProperty("otel.metrics.exporter");
  }

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneGivesNoopAdapter() {
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      adapter.increment("safety.evaluations");
      adapter.observe("adapt.words", 12);
    }
  }

  @Test
  void unknownExporterDisablesMetrics() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=test, broken, =x, region=ca-central");

    assertEquals(2, attributes.size());
    assertEquals("test", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("ca-central", attributes.get(AttributeKey.stringKey("region")));
  }

  @Test
  void settingsPreferPropertiesOverEnvironmentAndAddDeviceId() {
    Map<String, String> properties = Map.of("otel.metrics.exporter", "otlp");
    Map<String, String> environment = Map.of(
        "OTEL_METRICS_EXPORTER", "none",
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4317",
        "GUARDIAN_METRICS_INTERVAL_SECONDS", "15",
        "GUARDIAN_DEVICE_ID", "kiosk-7");

    OpenTelemetryBootstrap.Settings settings =
        OpenTelemetryBootstrap.Settings.resolve(properties::get, environment::get);

    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, settings.mode());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals(Duration.ofSeconds(15), settings.interval());
    assertEquals("kiosk-7", settings.resourceAttributes().get(OpenTelemetryBootstrap.DEVICE_ID));
  }

  @Test
  void settingsFallBackToOfflineDefaults() {
    Map<String, String> environment = Map.of("GUARDIAN_METRICS_INTERVAL_SECONDS", "-3");

    OpenTelemetryBootstrap.Settings settings =
        OpenTelemetryBootstrap.Settings.resolve(key -> null, environment::get);

    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, settings.mode());
    assertEquals("http://localhost:4317", settings.endpoint());
    assertEquals(Duration.ofSeconds(60), settings.interval());
    assertTrue(settings.resourceAttributes().isEmpty());
  }
}
