package dev.podflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void runDefaultsIncludeContentGeneration() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");
    Path base = Path.of(System.getProperty("user.home", "."), ".podflow");

    assertEquals(base.resolve("work").toString(), defaults.get("workDir"));
    assertEquals("en-US", defaults.get("language"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("${ANTHROPIC_API_KEY}", defaults.get("anthropic.apiKey"));
    assertEquals("2000", defaults.get("anthropic.maxTokens"));
    assertEquals("true", defaults.get("art19.enabled"));
  }

  @Test
  void publishDefaultsOmitRunOnlyKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Publish ");

    assertFalse(defaults.containsKey("anthropic.apiKey"));
    assertFalse(defaults.containsKey("transcriptDir"));
    assertEquals("4", defaults.get("publishWorkers"));
    assertTrue(defaults.containsKey("twitter.bearerToken"));
  }

  @Test
  void defaultsBuildAValidConfiguration() {
    PodflowConfig config = PodflowConfig.fromMap(DefaultsForMode.asFlatMap("run"), name -> null);

    assertEquals(4, config.publishWorkers());
    assertTrue(config.anthropic().apiKey().isEmpty());
    assertEquals(java.util.List.of("art19.seriesId", "art19.token"), config.art19().missingSettings());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
