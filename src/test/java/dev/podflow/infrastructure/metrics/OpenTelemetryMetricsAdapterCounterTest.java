package dev.podflow.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.withReader(reader, "run", null));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("publish.platform.art19.success");
    adapter.increment("publish.platform.art19.success");
    adapter.increment("publish.platform.twitter.failure");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    Optional<MetricData> maybeCounter = metrics.stream()
        .filter(metric -> metric.getName().equals("publish.platform.art19.success"))
        .findFirst();
    assertTrue(maybeCounter.isPresent(), "Expected counter metric to be exported");

    MetricData counter = maybeCounter.orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("publish.platform.art19.success",
        point.getAttributes().get(AttributeKey.stringKey("podflow.metric.key")));
    assertEquals("podflow", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("run", counter.getResource().getAttribute(OpenTelemetryBootstrap.COMMAND));
    assertEquals("dev.podflow", counter.getInstrumentationScopeInfo().getName());
    assertTrue(metrics.stream().anyMatch(m -> m.getName().equals("publish.platform.twitter.failure")));
  }

  @Test
  void noOpAdapterAcceptsMeasurements() {
    try (OpenTelemetryMetricsAdapter noop = OpenTelemetryMetricsAdapter.create("none", null, null, "run")) {
      noop.increment("workflow.run.started");
      noop.observe("workflow.run.latencyMillis", 5L);
      noop.forceFlush();
    }
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("workflow.stage.audio_processing.failed",
        OpenTelemetryMetricsAdapter.sanitizeName("workflow.stage.audio_processing.failed"));
    assertEquals("publish.fanout.latencymillis",
        OpenTelemetryMetricsAdapter.sanitizeName("publish.fanout.latencyMillis"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b_c", OpenTelemetryMetricsAdapter.sanitizeName("a b/c"));
    assertEquals("podflow.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }
}
