package dev.podflow.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a podflow YAML file into the flat dotted-key layer consumed by {@link ConfigMerger}.
 *
 * <p>The document has up to three top-level sections. {@code common} applies to every command; {@code run} and
 * {@code publish} apply to their command only and override {@code common}. Example:</p>
 * <pre>
 * common:
 *   language: en-US
 *   art19:
 *     seriesId: abc
 * publish:
 *   publishWorkers: 2
 * </pre>
 * <p>yields {@code language}, {@code art19.seriesId} and, for {@code publish}, {@code publishWorkers}. Scalar lists
 * (episode tags) become the comma-separated form the CLI accepts.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final List<String> SECTIONS =
      List.of(COMMON, DefaultsForMode.MODE_RUN, DefaultsForMode.MODE_PUBLISH);

  private YamlConfigLoader() {}

  /**
   * Loads the {@code common} section overlaid with the section for {@code mode}.
   *
   * @param path YAML file
   * @param mode {@code run} or {@code publish}, case-insensitive
   * @return flattened settings; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid podflow YAML
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = new LinkedHashMap<>();
    mapping(document, "root").forEach((name, body) -> {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(normalized)) {
        throw new IllegalArgumentException(
            "unknown top-level section '" + name + "'; expected one of " + SECTIONS);
      }
      sections.put(normalized, body);
    });

    Map<String, String> settings = new LinkedHashMap<>();
    for (String name : List.of(COMMON, section)) {
      Object body = sections.get(name);
      if (body != null) {
        flattenInto(settings, "", mapping(body, name));
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> typed = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(where + " contains a blank or non-string key: " + key);
      }
      typed.put(name, value);
    });
    return typed;
  }

  private static void flattenInto(Map<String, String> settings, String prefix, Map<String, Object> node) {
    node.forEach((name, value) -> {
      String key = prefix + name;
      if (value instanceof Map<?, ?>) {
        flattenInto(settings, key + '.', mapping(value, key));
      } else if (value instanceof List<?> items) {
        settings.put(key, joinScalars(key, items));
      } else {
        settings.put(key, value == null ? "" : value.toString());
      }
    });
  }

  private static String joinScalars(String key, List<?> items) {
    StringJoiner joined = new StringJoiner(",");
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException("YAML lists must contain scalars for key " + key);
      }
      if (item != null) {
        joined.add(item.toString());
      }
    }
    return joined.toString();
  }
}
