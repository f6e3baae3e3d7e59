package ca.gc.cra.meshradar.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for MESHRADAR from {@code otel.*} system properties, falling back to the
 * standard {@code OTEL_*} environment variables.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.meshradar";
  static final String SERVICE_NAME_VALUE = "meshradar";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {}

  /**
   * Initializes metrics from the environment. Any failure degrades to a noop result so metrics can never stop the
   * pipeline from starting.
   */
  static BootstrapResult initialize() {
    Settings settings;
    try {
      settings = Settings.fromEnvironment();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid OpenTelemetry settings; metrics disabled: {}", ex.getMessage());
      return BootstrapResult.noop();
    }
    if (settings.exporter() == Exporter.NONE) {
      log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(settings.interval()).build();
      BootstrapResult result = build(reader, settings.resourceAttributes());
      log.info("OpenTelemetry metrics exporting to {} every {}s", settings.endpoint(), settings.interval().toSeconds());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extraResource) {
    String version = detectServiceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(version, extraResource))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new BootstrapResult(meter, provider);
  }

  private static Resource buildResource(String version, Attributes extra) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, SERVICE_NAME_VALUE)
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .put(SERVICE_INSTANCE_ID, detectInstanceId());
    Resource resource = Resource.getDefault().merge(Resource.create(builder.build()));
    return extra.isEmpty() ? resource : resource.merge(Resource.create(extra));
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        if (!trimmed.isEmpty()) {
          log.warn("Ignoring malformed resource attribute '{}'", trimmed);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String detectInstanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable; using runtime name for service.instance.id", ex);
      return ManagementFactory.getRuntimeMXBean().getName();
    }
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/meshradar/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        return props.getProperty("version", "0.0.0-dev");
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  enum Exporter {
    OTLP,
    NONE;

    static Exporter parse(String raw) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      switch (normalized) {
        case "otlp":
          return OTLP;
        case "none":
          return NONE;
        default:
          throw new IllegalArgumentException("metricsExporter must be otlp or none, got '" + raw + "'");
      }
    }
  }

  /** Resolved exporter settings. */
  record Settings(Exporter exporter, String endpoint, Attributes resourceAttributes, Duration interval) {

    static Settings fromEnvironment() {
      Exporter exporter = Exporter.parse(lookup("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp"));
      String endpoint = lookup("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      Attributes attributes = parseResourceAttributes(lookup("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
      String intervalRaw = lookup("otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL", "");
      Duration interval = intervalRaw.isEmpty() ? DEFAULT_INTERVAL : Duration.ofMillis(parseMillis(intervalRaw));
      return new Settings(exporter, endpoint, attributes, interval);
    }

    private static long parseMillis(String raw) {
      try {
        long millis = Long.parseLong(raw);
        if (millis <= 0) {
          throw new IllegalArgumentException("otel.metric.export.interval must be positive");
        }
        return millis;
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("otel.metric.export.interval must be milliseconds", ex);
      }
    }

    private static String lookup(String property, String env, String fallback) {
      String value = System.getProperty(property);
      if (value == null || value.isBlank()) {
        value = System.getenv(env);
      }
      return value == null || value.isBlank() ? fallback : value.trim();
    }
  }

  /** Meter plus the provider that owns it; the noop result has no provider. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(null, null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        awaitResult(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        awaitResult(provider.shutdown(), "shutdown");
      }
    }

    private static void awaitResult(CompletableResultCode result, String what) {
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within 5s", what);
      }
    }
  }
}
