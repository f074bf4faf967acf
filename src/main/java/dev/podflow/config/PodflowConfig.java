package dev.podflow.config;

import dev.podflow.domain.workflow.WorkflowRequest;
import dev.podflow.validation.Net;
import dev.podflow.validation.Numbers;
import dev.podflow.validation.Paths;
import dev.podflow.validation.Strings;
import java.net.URI;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Immutable podflow configuration built from the merged key/value map.
 * <p><strong>Why:</strong> Normalizes CLI and YAML strings into typed settings once, so adapters never parse text.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve {@code ${ENV}} references in values against the environment.</li>
 *   <li>Validate numbers, URLs, paths, language tags and zones.</li>
 *   <li>Group per-platform settings and report which required settings are missing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param workDir directory receiving processed audio
 * @param transcriptDir directory searched for transcripts before the audio's own directory
 * @param language default language tag
 * @param author default author credit
 * @param zone zone used for default publication dates
 * @param publishWorkers maximum concurrent platform tasks
 * @param metrics metrics exporter settings
 * @param anthropic content generator settings
 * @param art19 Art19 host settings
 * @param website website settings
 * @param twitter Twitter settings
 * @since 0.1.0
 */
public record PodflowConfig(
    Path workDir,
    Optional<Path> transcriptDir,
    String language,
    String author,
    ZoneId zone,
    int publishWorkers,
    MetricsSettings metrics,
    AnthropicSettings anthropic,
    Art19Settings art19,
    WebsiteSettings website,
    TwitterSettings twitter) {
  private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

  public PodflowConfig {
    Objects.requireNonNull(workDir, "workDir");
    Objects.requireNonNull(transcriptDir, "transcriptDir");
    Objects.requireNonNull(language, "language");
    Objects.requireNonNull(author, "author");
    Objects.requireNonNull(zone, "zone");
    Numbers.requireRange("publishWorkers", publishWorkers, 1, 64);
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(anthropic, "anthropic");
    Objects.requireNonNull(art19, "art19");
    Objects.requireNonNull(website, "website");
    Objects.requireNonNull(twitter, "twitter");
  }

  /**
   * Builds configuration from a merged map, resolving {@code ${ENV}} references with {@link System#getenv(String)}.
   *
   * @param args merged configuration
   * @return typed configuration
   * @throws IllegalArgumentException if a value is malformed
   */
  public static PodflowConfig fromMap(Map<String, String> args) {
    return fromMap(args, System::getenv);
  }

  /**
   * Builds configuration from a merged map.
   *
   * @param args merged configuration
   * @param env environment lookup; returns {@code null} for unset variables
   * @return typed configuration
   * @throws IllegalArgumentException if a value is malformed
   */
  public static PodflowConfig fromMap(Map<String, String> args, Function<String, String> env) {
    Objects.requireNonNull(args, "args");
    Objects.requireNonNull(env, "env");
    Values values = new Values(args, env);

    Path workDir = Paths.parse("workDir", values.require("workDir"));
    Optional<Path> transcriptDir = values.optional("transcriptDir").map(v -> Paths.parse("transcriptDir", v));
    String language = WorkflowRequest.normalizeLanguage(values.require("language"));
    String author = values.require("author");
    ZoneId zone;
    try {
      zone = ZoneId.of(values.require("timezone"));
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("timezone is not a valid zone id: " + args.get("timezone"), ex);
    }
    int workers = Numbers.parseInt("publishWorkers", values.require("publishWorkers"), 1, 64);

    MetricsSettings metrics = new MetricsSettings(
        values.optional("metricsExporter").orElse("none"),
        values.optional("otelEndpoint"),
        values.optional("otelResourceAttributes"));

    AnthropicSettings anthropic = new AnthropicSettings(
        values.optional("anthropic.apiKey"),
        values.optional("anthropic.model").orElse("claude-3-sonnet-20240229"),
        Net.requireHttpUrl("anthropic.baseUrl", values.optional("anthropic.baseUrl").orElse("https://api.anthropic.com")),
        values.optional("anthropic.maxTokens")
            .map(v -> Numbers.parseInt("anthropic.maxTokens", v, 1, 100_000))
            .orElse(2000),
        values.seconds("anthropic.timeoutSeconds", 120));

    Art19Settings art19 = new Art19Settings(
        values.flag("art19.enabled", false),
        Net.requireHttpUrl("art19.baseUrl", values.optional("art19.baseUrl").orElse("https://api.art19.com")),
        values.optional("art19.seriesId"),
        values.optional("art19.token"),
        values.flag("art19.autoPublish", false),
        values.seconds("art19.timeoutSeconds", 30),
        values.seconds("art19.uploadTimeoutSeconds", 300));

    WebsiteSettings website = new WebsiteSettings(
        values.flag("website.enabled", false),
        values.optional("website.contentApiUrl").map(v -> Net.requireHttpUrl("website.contentApiUrl", v)),
        values.optional("website.deployHookUrl").map(v -> Net.requireHttpUrl("website.deployHookUrl", v)),
        values.optional("website.token"),
        values.seconds("website.timeoutSeconds", 30));

    TwitterSettings twitter = new TwitterSettings(
        values.flag("twitter.enabled", false),
        Net.requireHttpUrl("twitter.baseUrl", values.optional("twitter.baseUrl").orElse("https://api.twitter.com/2")),
        values.optional("twitter.bearerToken"),
        values.seconds("twitter.timeoutSeconds", 30));

    return new PodflowConfig(
        workDir, transcriptDir, language, author, zone, workers, metrics, anthropic, art19, website, twitter);
  }

  /**
   * Returns platform settings in launch order: art19, website, twitter.
   *
   * @return all platform settings, enabled or not
   */
  public List<PlatformSettings> platforms() {
    return List.of(art19, website, twitter);
  }

  /**
   * Replaces {@code ${NAME}} references with environment values; unset variables resolve to empty text.
   *
   * @param raw configured value
   * @param env environment lookup
   * @return resolved value
   */
  static String resolveReferences(String raw, Function<String, String> env) {
    if (raw == null || raw.indexOf("${") < 0) {
      return raw;
    }
    Matcher matcher = ENV_REFERENCE.matcher(raw);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String value = env.apply(matcher.group(1));
      matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  /**
   * Settings shared by every publishing platform.
   */
  public sealed interface PlatformSettings permits Art19Settings, WebsiteSettings, TwitterSettings {
    /**
     * Platform name used in results and metrics.
     *
     * @return name
     */
    String name();

    /**
     * Whether the operator enabled the platform.
     *
     * @return enabled flag
     */
    boolean enabled();

    /**
     * Lists the required settings that are absent.
     *
     * @return missing setting keys; empty when the platform can be built
     */
    List<String> missingSettings();
  }

  /**
   * Metrics exporter settings.
   *
   * @param exporter {@code otlp} or {@code none}
   * @param endpoint OTLP endpoint
   * @param resourceAttributes extra resource attributes
   */
  public record MetricsSettings(String exporter, Optional<String> endpoint, Optional<String> resourceAttributes) {}

  /**
   * Anthropic Messages API settings; the generator is used only when an API key is present.
   *
   * @param apiKey API key
   * @param model model name
   * @param baseUrl API base URL
   * @param maxTokens response token limit
   * @param timeout request timeout
   */
  public record AnthropicSettings(
      Optional<String> apiKey, String model, URI baseUrl, int maxTokens, Duration timeout) {}

  /**
   * Art19 host settings.
   *
   * @param enabled operator toggle
   * @param baseUrl API base URL
   * @param seriesId series receiving episodes
   * @param token API token
   * @param autoPublish publish the created draft immediately
   * @param timeout API request timeout
   * @param uploadTimeout audio file upload timeout
   */
  public record Art19Settings(
      boolean enabled,
      URI baseUrl,
      Optional<String> seriesId,
      Optional<String> token,
      boolean autoPublish,
      Duration timeout,
      Duration uploadTimeout) implements PlatformSettings {
    @Override
    public String name() {
      return "art19";
    }

    @Override
    public List<String> missingSettings() {
      List<String> missing = new ArrayList<>(2);
      if (seriesId.isEmpty()) {
        missing.add("art19.seriesId");
      }
      if (token.isEmpty()) {
        missing.add("art19.token");
      }
      return List.copyOf(missing);
    }
  }

  /**
   * Website settings; either endpoint suffices.
   *
   * @param enabled operator toggle
   * @param contentApiUrl content API endpoint
   * @param deployHookUrl static-site deploy hook
   * @param token bearer token for the content API
   * @param timeout request timeout
   */
  public record WebsiteSettings(
      boolean enabled,
      Optional<URI> contentApiUrl,
      Optional<URI> deployHookUrl,
      Optional<String> token,
      Duration timeout) implements PlatformSettings {
    @Override
    public String name() {
      return "website";
    }

    @Override
    public List<String> missingSettings() {
      if (contentApiUrl.isEmpty() && deployHookUrl.isEmpty()) {
        return List.of("website.contentApiUrl|website.deployHookUrl");
      }
      return List.of();
    }
  }

  /**
   * Twitter v2 settings.
   *
   * @param enabled operator toggle
   * @param baseUrl API base URL
   * @param bearerToken user-context bearer token
   * @param timeout request timeout
   */
  public record TwitterSettings(
      boolean enabled, URI baseUrl, Optional<String> bearerToken, Duration timeout) implements PlatformSettings {
    @Override
    public String name() {
      return "twitter";
    }

    @Override
    public List<String> missingSettings() {
      return bearerToken.isEmpty() ? List.of("twitter.bearerToken") : List.of();
    }
  }

  private static final class Values {
    private final Map<String, String> args;
    private final Function<String, String> env;

    Values(Map<String, String> args, Function<String, String> env) {
      this.args = args;
      this.env = env;
    }

    Optional<String> optional(String key) {
      return Strings.optional(resolveReferences(args.get(key), env));
    }

    String require(String key) {
      return optional(key).orElseThrow(() -> new IllegalArgumentException(key + " is required"));
    }

    boolean flag(String key, boolean defaultValue) {
      return Strings.parseBoolean(key, resolveReferences(args.get(key), env), defaultValue);
    }

    Duration seconds(String key, int defaultSeconds) {
      return Duration.ofSeconds(optional(key)
          .map(v -> Numbers.parseInt(key, v, 1, 3600))
          .orElse(defaultSeconds));
    }
  }
}
