package dev.podflow.infrastructure.metrics;

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
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the OpenTelemetry meter provider for one podflow command.
 *
 * <p>Every exported series carries {@code service.name=podflow} and {@code podflow.command} ({@code run} or
 * {@code publish}) so dashboards can separate full pipeline runs from re-publishes, plus any operator-supplied
 * {@code otelResourceAttributes}. When the exporter is {@code none}, or the OTLP exporter cannot be built, a
 * no-op meter is used and nothing is exported.</p>
 */
final class OpenTelemetryBootstrap implements AutoCloseable {
  static final AttributeKey<String> COMMAND = AttributeKey.stringKey("podflow.command");

  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "dev.podflow";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final Duration FLUSH_WAIT = Duration.ofSeconds(5);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

  private final Meter meter;
  private final SdkMeterProvider provider;

  private OpenTelemetryBootstrap(Meter meter, SdkMeterProvider provider) {
    this.meter = meter;
    this.provider = provider;
  }

  /**
   * Starts metrics export as configured.
   *
   * @param exporter {@code otlp} or {@code none}, already validated by the config layer
   * @param otlpEndpoint OTLP gRPC endpoint; {@code null} or blank for the local collector default
   * @param resourceAttributes operator attributes as {@code k=v,k2=v2}; may be {@code null}
   * @param command podflow command being run
   * @return bootstrap; never {@code null}
   */
  static OpenTelemetryBootstrap start(String exporter, String otlpEndpoint, String resourceAttributes, String command) {
    if (exporter == null || !"otlp".equalsIgnoreCase(exporter.trim())) {
      log.info("Metrics export disabled (metricsExporter={})", exporter);
      return disabled();
    }
    String endpoint = otlpEndpoint == null || otlpEndpoint.isBlank() ? DEFAULT_ENDPOINT : otlpEndpoint.trim();
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      OpenTelemetryBootstrap bootstrap = withReader(reader, command, resourceAttributes);
      log.info("Exporting {} metrics over OTLP to {}", command, endpoint);
      return bootstrap;
    } catch (RuntimeException ex) {
      log.error("Could not start OTLP metrics export to {}; metrics are disabled for this {}", endpoint, command, ex);
      return disabled();
    }
  }

  static OpenTelemetryBootstrap withReader(MetricReader reader, String command, String resourceAttributes) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(command, resourceAttributes))
        .registerMetricReader(Objects.requireNonNull(reader, "reader"))
        .build();
    return new OpenTelemetryBootstrap(provider.get(SCOPE), provider);
  }

  static OpenTelemetryBootstrap disabled() {
    return new OpenTelemetryBootstrap(MeterProvider.noop().get(SCOPE), null);
  }

  /**
   * Builds the resource: SDK defaults, then podflow's service and command, then operator attributes, each layer
   * overriding the previous one.
   */
  static Resource resource(String command, String resourceAttributes) {
    Attributes podflow = Attributes.of(
        SERVICE_NAME, "podflow",
        COMMAND, Objects.requireNonNull(command, "command"));
    return Resource.getDefault()
        .merge(Resource.create(podflow))
        .merge(Resource.create(parseResourceAttributes(resourceAttributes)));
  }

  // Same k=v,k2=v2 shape as OTEL_RESOURCE_ATTRIBUTES; malformed entries are skipped with a warning.
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      String[] pair = entry.split("=", 2);
      String key = pair[0].trim();
      String value = pair.length == 2 ? pair[1].trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isBlank()) {
          log.warn("Ignoring malformed otelResourceAttributes entry '{}'", entry.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  Meter meter() {
    return meter;
  }

  boolean exporting() {
    return provider != null;
  }

  void flush() {
    if (provider == null) {
      return;
    }
    CompletableResultCode flushed = provider.forceFlush().join(FLUSH_WAIT.toMillis(), TimeUnit.MILLISECONDS);
    if (!flushed.isSuccess()) {
      log.warn("Metrics flush did not complete within {}", FLUSH_WAIT);
    }
  }

  @Override
  public void close() {
    if (provider == null) {
      return;
    }
    try {
      CompletableResultCode shutdown = provider.shutdown().join(FLUSH_WAIT.toMillis(), TimeUnit.MILLISECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Meter provider did not shut down within {}", FLUSH_WAIT);
      }
    } catch (RuntimeException ex) {
      log.warn("Failed to shut down the meter provider cleanly", ex);
    }
  }
}
