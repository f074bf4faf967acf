package dev.podflow.infrastructure.metrics;

import dev.podflow.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards podflow counters and histograms to OpenTelemetry. Instruments are created lazily
 * per metric name and cached.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("podflow.metric.key");
  private static final String FALLBACK_METRIC_NAME = "podflow.metric";

  private final OpenTelemetryBootstrap telemetry;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for one podflow command.
   *
   * @param exporter {@code otlp} or {@code none}
   * @param otlpEndpoint OTLP gRPC endpoint; default local collector when {@code null} or blank
   * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}; may be {@code null}
   * @param command {@code run} or {@code publish}; exported as the {@code podflow.command} resource attribute
   * @return adapter; measurements are dropped when the exporter is {@code none} or could not be started
   */
  public static OpenTelemetryMetricsAdapter create(
      String exporter, String otlpEndpoint, String resourceAttributes, String command) {
    return new OpenTelemetryMetricsAdapter(
        OpenTelemetryBootstrap.start(exporter, otlpEndpoint, resourceAttributes, command));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap telemetry) {
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.meter = telemetry.meter();
    if (!telemetry.exporting()) {
      log.debug("Metrics are recorded against a no-op meter");
    }
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(effectiveKey, this::createCounter).add(1, attributes(effectiveKey));
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(effectiveKey, this::createHistogram).record(value, attributes(effectiveKey));
  }

  /**
   * Exports pending measurements.
   */
  public void forceFlush() {
    telemetry.flush();
  }

  @Override
  public void close() {
    telemetry.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("podflow counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("podflow observation for " + key)
        .build();
  }

  private static Attributes attributes(String key) {
    return Attributes.of(METRIC_KEY_ATTRIBUTE, key);
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }
}
