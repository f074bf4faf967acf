package dev.podflow.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission.
 * <p><strong>Why:</strong> Lets the coordinators count runs, stage failures and platform outcomes without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from fan-out workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g. {@code publish.platform.art19.success}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, e.g. milliseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
