package dev.podflow.config;

import dev.podflow.application.pipeline.EpisodeDataAssembler;
import dev.podflow.application.pipeline.EpisodeIdGenerator;
import dev.podflow.application.pipeline.PublishingCoordinator;
import dev.podflow.application.pipeline.WorkflowCoordinator;
import dev.podflow.application.port.AudioProcessor;
import dev.podflow.application.port.ClockPort;
import dev.podflow.application.port.ContentGenerator;
import dev.podflow.application.port.MetricsPort;
import dev.podflow.application.port.PlatformConnector;
import dev.podflow.application.port.Transcriber;
import dev.podflow.config.PodflowConfig.Art19Settings;
import dev.podflow.config.PodflowConfig.PlatformSettings;
import dev.podflow.config.PodflowConfig.TwitterSettings;
import dev.podflow.config.PodflowConfig.WebsiteSettings;
import dev.podflow.infrastructure.audio.JavaSoundAudioProcessor;
import dev.podflow.infrastructure.content.AnthropicContentGenerator;
import dev.podflow.infrastructure.content.FallbackContentGenerator;
import dev.podflow.infrastructure.content.FallbackingContentGenerator;
import dev.podflow.infrastructure.http.JsonHttpClient;
import dev.podflow.infrastructure.http.JsonSupport;
import dev.podflow.infrastructure.publish.Art19Connector;
import dev.podflow.infrastructure.publish.TwitterConnector;
import dev.podflow.infrastructure.publish.WebsiteConnector;
import dev.podflow.infrastructure.transcription.SidecarTranscriber;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires podflow coordinators to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate configuration into a runnable pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Derive the ordered enabled-platform set, excluding platforms that lack required settings.</li>
 *   <li>Choose the content generator: Anthropic with fallback when an API key is configured.</li>
 *   <li>Share one HTTP client and JSON helper across adapters.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods create new instances.</p>
 * <p><strong>Observability:</strong> Logs excluded platforms at WARN; supplies the metrics port to both coordinators.</p>
 *
 * @since 0.1.0
 * @see WorkflowCoordinator
 * @see PublishingCoordinator
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final PodflowConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final JsonHttpClient http;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a composition root with a default HTTP client.
   *
   * @param config typed configuration
   * @param metrics metrics adapter used by both coordinators
   * @param clock time source
   */
  public CompositionRoot(PodflowConfig config, MetricsPort metrics, ClockPort clock) {
    this(config, metrics, clock, new JsonHttpClient(CONNECT_TIMEOUT));
  }

  /**
   * Creates a composition root with an explicit HTTP client.
   *
   * @param config typed configuration
   * @param metrics metrics adapter used by both coordinators
   * @param clock time source
   * @param http HTTP client shared by every remote adapter
   */
  public CompositionRoot(PodflowConfig config, MetricsPort metrics, ClockPort clock, JsonHttpClient http) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.http = Objects.requireNonNull(http, "http");
  }

  /**
   * Returns the enabled platforms that have every required setting, in launch order.
   *
   * @return usable platform settings
   */
  public List<PlatformSettings> enabledPlatforms() {
    List<PlatformSettings> usable = new ArrayList<>(3);
    for (PlatformSettings settings : config.platforms()) {
      if (!settings.enabled()) {
        log.debug("Platform {} disabled", settings.name());
        continue;
      }
      List<String> missing = settings.missingSettings();
      if (!missing.isEmpty()) {
        log.warn("Platform {} enabled but missing {}; excluding it from publishing",
            settings.name(), String.join(", ", missing));
        continue;
      }
      usable.add(settings);
    }
    return List.copyOf(usable);
  }

  /**
   * Builds connectors for {@link #enabledPlatforms()}.
   *
   * @return connectors in launch order
   */
  public List<PlatformConnector> platformConnectors() {
    List<PlatformConnector> connectors = new ArrayList<>(3);
    for (PlatformSettings settings : enabledPlatforms()) {
      connectors.add(connectorFor(settings));
    }
    return List.copyOf(connectors);
  }

  private PlatformConnector connectorFor(PlatformSettings settings) {
    if (settings instanceof Art19Settings a) {
      return new Art19Connector(
          http, json, a.baseUrl(), a.seriesId().orElseThrow(), a.token().orElseThrow(),
          a.autoPublish(), a.timeout(), a.uploadTimeout(), clock);
    }
    if (settings instanceof WebsiteSettings w) {
      return new WebsiteConnector(
          http, json, w.contentApiUrl(), w.deployHookUrl(), w.token(), w.timeout(), clock);
    }
    TwitterSettings t = (TwitterSettings) settings;
    return new TwitterConnector(http, json, t.baseUrl(), t.bearerToken().orElseThrow(), t.timeout());
  }

  public AudioProcessor audioProcessor() {
    return new JavaSoundAudioProcessor(config.workDir());
  }

  public Transcriber transcriber() {
    return new SidecarTranscriber(config.transcriptDir());
  }

  /**
   * Builds the content generator. Without an API key the transcript-derived generator is used directly and
   * runs finish as fallback content.
   *
   * @return content generator
   */
  public ContentGenerator contentGenerator() {
    PodflowConfig.AnthropicSettings anthropic = config.anthropic();
    FallbackContentGenerator fallback = new FallbackContentGenerator();
    if (anthropic.apiKey().isEmpty()) {
      log.warn("No Anthropic API key configured; content will be derived from the transcript");
      return fallback;
    }
    AnthropicContentGenerator primary = new AnthropicContentGenerator(
        http, json, anthropic.baseUrl(), anthropic.apiKey().get(), anthropic.model(),
        anthropic.maxTokens(), anthropic.timeout());
    return new FallbackingContentGenerator(primary, fallback);
  }

  public EpisodeDataAssembler episodeDataAssembler() {
    return new EpisodeDataAssembler(
        new EpisodeIdGenerator(clock), clock, config.zone(), config.author(), config.language());
  }

  public PublishingCoordinator publishingCoordinator() {
    return new PublishingCoordinator(
        platformConnectors(), episodeDataAssembler(), config.publishWorkers(), metrics, clock);
  }

  public WorkflowCoordinator workflowCoordinator() {
    return new WorkflowCoordinator(
        audioProcessor(), transcriber(), contentGenerator(), publishingCoordinator(), metrics, clock);
  }
}
