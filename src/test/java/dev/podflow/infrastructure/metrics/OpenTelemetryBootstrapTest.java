package dev.podflow.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void exporterNoneDoesNotExport() {
    try (OpenTelemetryBootstrap telemetry = OpenTelemetryBootstrap.start("none", null, null, "run")) {
      assertFalse(telemetry.exporting());
      assertDoesNotThrow(telemetry::flush);
    }
  }

  @Test
  void inMemoryReaderExports() {
    try (OpenTelemetryBootstrap telemetry =
        OpenTelemetryBootstrap.withReader(InMemoryMetricReader.create(), "publish", null)) {
      assertTrue(telemetry.exporting());
    }
  }

  @Test
  void resourceNamesServiceAndCommand() {
    Resource resource = OpenTelemetryBootstrap.resource("publish", null);

    assertEquals("podflow", resource.getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("publish", resource.getAttribute(OpenTelemetryBootstrap.COMMAND));
  }

  @Test
  void operatorAttributesOverridePodflowDefaults() {
    Resource resource = OpenTelemetryBootstrap.resource("run", "service.name=podflow-staging,region=eu");

    assertEquals("podflow-staging", resource.getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("eu", resource.getAttribute(AttributeKey.stringKey("region")));
    assertEquals("run", resource.getAttribute(OpenTelemetryBootstrap.COMMAND));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes(
        "deployment.environment=prod, broken, team = audio,=x,empty=");

    assertEquals(2, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("audio", attributes.get(AttributeKey.stringKey("team")));
  }

  @Test
  void missingResourceAttributesAreEmpty() {
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(null).isEmpty());
  }
}
