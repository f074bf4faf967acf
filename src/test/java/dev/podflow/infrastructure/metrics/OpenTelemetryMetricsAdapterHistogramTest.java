package dev.podflow.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterHistogramTest {

  @Test
  void eachStageLatencyIsItsOwnHistogram() {
    InMemoryMetricReader reader = InMemoryMetricReader.create();
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(
        OpenTelemetryBootstrap.withReader(reader, "run", "deployment.environment=ci"))) {
      adapter.observe("workflow.stage.audio_processing.latencyMillis", 1_200L);
      adapter.observe("workflow.stage.transcription.latencyMillis", 8_000L);
      adapter.observe("workflow.stage.transcription.latencyMillis", 4_000L);

      Map<String, MetricData> byName = reader.collectAllMetrics().stream()
          .collect(Collectors.toMap(MetricData::getName, Function.identity()));

      assertEquals(2, byName.size());
      MetricData transcription = byName.get("workflow.stage.transcription.latencymillis");
      assertEquals(MetricDataType.HISTOGRAM, transcription.getType());
      HistogramPointData point = transcription.getHistogramData().getPoints().iterator().next();
      assertEquals(2L, point.getCount());
      assertEquals(12_000.0, point.getSum());
      assertEquals(4_000.0, point.getMin());
      assertEquals(8_000.0, point.getMax());
      assertEquals("workflow.stage.transcription.latencyMillis",
          point.getAttributes().get(AttributeKey.stringKey("podflow.metric.key")));

      MetricData audio = byName.get("workflow.stage.audio_processing.latencymillis");
      assertEquals(1L, audio.getHistogramData().getPoints().iterator().next().getCount());
    }
  }

  @Test
  void publishLatencyCarriesCommandAndOperatorResource() {
    InMemoryMetricReader reader = InMemoryMetricReader.create();
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(
        OpenTelemetryBootstrap.withReader(reader, "publish", "deployment.environment=ci"))) {
      adapter.observe("publish.fanout.latencyMillis", 250L);

      MetricData fanOut = reader.collectAllMetrics().iterator().next();

      assertEquals("publish.fanout.latencymillis", fanOut.getName());
      assertEquals("publish", fanOut.getResource().getAttribute(OpenTelemetryBootstrap.COMMAND));
      assertEquals("ci", fanOut.getResource().getAttribute(AttributeKey.stringKey("deployment.environment")));
    }
  }
}
