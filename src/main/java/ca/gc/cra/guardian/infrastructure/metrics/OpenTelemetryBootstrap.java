package ca.gc.cra.guardian.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for GUARDIAN.
 *
 * <p>Tutors usually run offline, so metrics stay disabled unless {@code otlp} is chosen. Each setting is read
 * from a system property first, then the environment:</p>
 * <ul>
 *   <li>{@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER}: {@code none} (default) or {@code otlp}</li>
 *   <li>{@code otel.exporter.otlp.endpoint} / {@code OTEL_EXPORTER_OTLP_ENDPOINT}</li>
 *   <li>{@code otel.resource.attributes} / {@code OTEL_RESOURCE_ATTRIBUTES}</li>
 *   <li>{@code guardian.metrics.interval.seconds} / {@code GUARDIAN_METRICS_INTERVAL_SECONDS} (default 60)</li>
 *   <li>{@code guardian.device.id} / {@code GUARDIAN_DEVICE_ID}, exported as {@code guardian.device.id}</li>
 * </ul>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.guardian";
  static final AttributeKey<String> DEVICE_ID = AttributeKey.stringKey("guardian.device.id");
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final long DEFAULT_INTERVAL_SECONDS = 60;
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    try {
      Settings settings = Settings.resolve(System::getProperty, System::getenv);
      if (settings.mode() == ExporterMode.NONE) {
        log.debug("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(settings.interval()).build();
      BootstrapResult result = build(reader, settings.resourceAttributes());
      log.info("OpenTelemetry metrics exporting via OTLP to {} every {}s",
          settings.endpoint(), settings.interval().toSeconds());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extras) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.of(SERVICE_NAME, "guardian", SERVICE_VERSION, version)))
        .merge(Resource.create(extras));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return BootstrapResult.active(provider, meter);
  }

  /**
   * Parses {@code key=value,key=value}; malformed entries are logged and skipped.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null || raw.isBlank()) {
      return builder.build();
    }
    for (String token : raw.split(",")) {
      String entry = token.trim();
      int idx = entry.indexOf('=');
      if (idx > 0 && idx < entry.length() - 1) {
        builder.put(AttributeKey.stringKey(entry.substring(0, idx).trim()), entry.substring(idx + 1).trim());
      } else if (!entry.isEmpty()) {
        log.warn("Ignoring malformed OTEL_RESOURCE_ATTRIBUTES entry: {}", entry);
      }
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  /**
   * Exporter settings after property and environment lookup.
   *
   * @param mode exporter mode
   * @param endpoint OTLP endpoint
   * @param interval export interval
   * @param resourceAttributes extra resource attributes, including the device id when set
   */
  record Settings(ExporterMode mode, String endpoint, Duration interval, Attributes resourceAttributes) {

    static Settings resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
      Lookup lookup = new Lookup(properties, environment);
      ExporterMode mode = ExporterMode.from(lookup.get("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none"));
      String endpoint = lookup.get("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      Duration interval = Duration.ofSeconds(intervalSeconds(
          lookup.get("guardian.metrics.interval.seconds", "GUARDIAN_METRICS_INTERVAL_SECONDS", "")));
      AttributesBuilder attributes = parseResourceAttributes(
          lookup.get("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", "")).toBuilder();
      String device = lookup.get("guardian.device.id", "GUARDIAN_DEVICE_ID", "");
      if (!device.isEmpty()) {
        attributes.put(DEVICE_ID, device);
      }
      return new Settings(mode, endpoint, interval, attributes.build());
    }

    private static long intervalSeconds(String raw) {
      if (raw.isEmpty()) {
        return DEFAULT_INTERVAL_SECONDS;
      }
      try {
        long seconds = Long.parseLong(raw);
        if (seconds > 0) {
          return seconds;
        }
      } catch (NumberFormatException ex) {
        log.debug("Unparseable metrics interval", ex);
      }
      log.warn("Ignoring metrics interval '{}'; using {}s", raw, DEFAULT_INTERVAL_SECONDS);
      return DEFAULT_INTERVAL_SECONDS;
    }
  }

  private record Lookup(UnaryOperator<String> properties, UnaryOperator<String> environment) {
    String get(String property, String env, String defaultValue) {
      String value = properties.apply(property);
      if (value == null || value.isBlank()) {
        value = environment.apply(env);
      }
      return value == null || value.isBlank() ? defaultValue : value.trim();
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none", "" -> NONE;
        default -> {
          log.warn("Unknown OTEL_METRICS_EXPORTER value '{}'; metrics disabled", raw);
          yield NONE;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, Objects.requireNonNull(provider, "provider"));
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null && !provider.forceFlush().join(5, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
