package dev.podflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("language", "en-US", "publishWorkers", "4");
    Map<String, String> yaml = Map.of("language", "fr-FR", "publishWorkers", "2");
    Map<String, String> cli = Map.of("language", "de-DE", "publishWorkers", "8");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("de-DE", merged.get("language"));
    assertEquals("8", merged.get("publishWorkers"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: language"));
    assertTrue(warnings.contains("CLI overrides YAML for key: publishWorkers"));
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.of(Map.of("author", "Ada")),
        Map.of(),
        DefaultsForMode.asFlatMap("run"),
        warnings::add);

    assertEquals("Ada", merged.get("author"));
    assertEquals("en-US", merged.get("language"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void cliDeployHookClearsInheritedContentApi() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "publish",
        Optional.of(Map.of("website.contentApiUrl", "https://site/api")),
        Map.of("website.deployHookUrl", "https://hooks/deploy"),
        DefaultsForMode.asFlatMap("publish"),
        msg -> {});

    assertEquals("", merged.get("website.contentApiUrl"));
    assertEquals("https://hooks/deploy", merged.get("website.deployHookUrl"));
  }

  @Test
  void rejectsUnknownExporter() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "run",
            Optional.empty(),
            Map.of("metricsExporter", "prometheus"),
            Map.of(),
            msg -> {}));
  }

  @Test
  void otelEndpointRequiresOtlpExporter() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "run",
            Optional.empty(),
            Map.of("otelEndpoint", "http://collector:4317"),
            Map.of("metricsExporter", "none"),
            msg -> {}));
  }

  @Test
  void publishRequiresAtLeastOnePlatform() {
    Map<String, String> cli = Map.of(
        "art19.enabled", "false", "website.enabled", "false", "twitter.enabled", "false");

    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "publish",
            Optional.empty(),
            cli,
            DefaultsForMode.asFlatMap("publish"),
            msg -> {}));
  }

  @Test
  void runToleratesNoPlatformsUntilPublishing() {
    Map<String, String> cli = Map.of(
        "art19.enabled", "false", "website.enabled", "false", "twitter.enabled", "false");

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run", Optional.empty(), cli, DefaultsForMode.asFlatMap("run"), msg -> {});

    assertEquals("false", merged.get("twitter.enabled"));
  }
}
