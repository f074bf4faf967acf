package dev.podflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("podflow.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          publishWorkers: 4
        publish:
          publishWorkers: 2
        run:
          transcriptDir: /srv/transcripts
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "publish");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("2", map.get("publishWorkers"));
    assertFalse(map.containsKey("transcriptDir"));
  }

  @Test
  void loadFlattensNestedMapsAndJoinsScalarLists() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        common:
          art19:
            enabled: true
            seriesId: abc
        run:
          tags: [tech, streaming]
          transcriptDir:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "RUN").orElseThrow();
    assertEquals("true", map.get("art19.enabled"));
    assertEquals("abc", map.get("art19.seriesId"));
    assertEquals("tech,streaming", map.get("tags"));
    assertEquals("", map.get("transcriptDir"));
  }

  @Test
  void nestedListsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("lists.yaml");
    Files.writeString(yaml, """
        run:
          tags:
            - [a, b]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "run");

    assertFalse(result.isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - run:
            language: en
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }

  @Test
  void unknownTopLevelSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("typo.yaml");
    Files.writeString(yaml, """
        commn:
          language: en
        """);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
    assertTrue(ex.getMessage().contains("commn"), ex.getMessage());
  }

  @Test
  void typeTagsAreNotInstantiated() throws IOException {
    Path yaml = tempDir.resolve("tagged.yaml");
    Files.writeString(yaml, """
        run:
          workDir: !!java.io.File [/tmp]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }

  @Test
  void bundledExampleLoadsForBothModes() throws Exception {
    Path example = Path.of(YamlConfigLoaderTest.class.getResource("/podflow-example.yaml").toURI());

    Map<String, String> run = YamlConfigLoader.load(example, "run").orElseThrow();
    Map<String, String> publish = YamlConfigLoader.load(example, "publish").orElseThrow();

    assertEquals("${ART19_SERIES_ID}", run.get("art19.seriesId"));
    assertEquals("./transcripts", run.get("transcriptDir"));
    assertEquals("3", run.get("publishWorkers"));
    assertEquals("2", publish.get("publishWorkers"));
    assertEquals("false", publish.get("twitter.enabled"));
  }
}
