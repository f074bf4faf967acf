package dev.podflow.api;

import dev.podflow.validation.Strings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} settings into the CLI layer of the configuration merge. Keys are dotted paths
 * ({@code art19.seriesId}) matching the flattened YAML keys they override.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern SEGMENT = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");

  private CliArgsParser() {}

  /**
   * Splits each setting on its first {@code '='}. A repeated key keeps the last value.
   *
   * @param settings setting arguments; {@code null} returns an empty map
   * @return mutable map in first-seen key order
   * @throws IllegalArgumentException if a setting is not {@code key=value}, its key is not a dotted path, or its
   *     value is whitespace only
   */
  public static Map<String, String> toMap(List<String> settings) {
    Map<String, String> map = new LinkedHashMap<>();
    if (settings == null) {
      return map;
    }
    for (String setting : settings) {
      int idx = setting.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + setting + "')");
      }
      String key = setting.substring(0, idx).trim();
      String value = setting.substring(idx + 1).trim();
      requireDottedKey(key);
      // Empty clears a YAML setting; whitespace-only is a typo.
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }

  private static void requireDottedKey(String key) {
    for (String segment : key.split("\\.", -1)) {
      if (!SEGMENT.matcher(segment).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
    }
  }
}
