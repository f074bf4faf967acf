package dev.podflow.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each podflow CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys. Secrets default to
 * {@code ${ENV}} references that {@link PodflowConfig} resolves from the environment.</p>
 */
public final class DefaultsForMode {
  /** Mode running every stage from raw audio. */
  public static final String MODE_RUN = "run";
  /** Mode re-publishing already generated content. */
  public static final String MODE_PUBLISH = "publish";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code run} or {@code publish})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case MODE_RUN -> buildRunDefaults();
      case MODE_PUBLISH -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("workDir", defaultBaseDirectory().resolve("work").toString());
    map.put("language", "en-US");
    map.put("author", "Podflow");
    map.put("timezone", "UTC");
    map.put("publishWorkers", "4");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");

    map.put("art19.enabled", "true");
    map.put("art19.baseUrl", "https://api.art19.com");
    map.put("art19.seriesId", "${ART19_SERIES_ID}");
    map.put("art19.token", "${ART19_API_TOKEN}");
    map.put("art19.autoPublish", "false");
    map.put("art19.timeoutSeconds", "30");
    map.put("art19.uploadTimeoutSeconds", "300");

    map.put("website.enabled", "true");
    map.put("website.contentApiUrl", "${WEBSITE_API_ENDPOINT}");
    map.put("website.deployHookUrl", "${VERCEL_DEPLOY_HOOK}");
    map.put("website.token", "${VERCEL_API_TOKEN}");
    map.put("website.timeoutSeconds", "30");

    map.put("twitter.enabled", "true");
    map.put("twitter.baseUrl", "https://api.twitter.com/2");
    map.put("twitter.bearerToken", "${TWITTER_BEARER_TOKEN}");
    map.put("twitter.timeoutSeconds", "30");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("transcriptDir", "");
    map.put("anthropic.apiKey", "${ANTHROPIC_API_KEY}");
    map.put("anthropic.model", "claude-3-sonnet-20240229");
    map.put("anthropic.baseUrl", "https://api.anthropic.com");
    map.put("anthropic.maxTokens", "2000");
    map.put("anthropic.timeoutSeconds", "120");
    return map;
  }

  private static Path defaultBaseDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".podflow");
  }
}
