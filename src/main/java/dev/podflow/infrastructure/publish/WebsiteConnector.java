package dev.podflow.infrastructure.publish;

import com.fasterxml.jackson.core.JsonGenerator;
import dev.podflow.application.port.ClockPort;
import dev.podflow.application.port.PlatformConnector;
import dev.podflow.domain.publish.EpisodeData;
import dev.podflow.domain.publish.PlatformKind;
import dev.podflow.domain.publish.PlatformResult;
import dev.podflow.infrastructure.http.HttpResponseData;
import dev.podflow.infrastructure.http.JsonHttpClient;
import dev.podflow.infrastructure.http.JsonSupport;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adds the episode to the show website.
 * <p>Posts an {@code add_episode} action to the site's content API when one is configured; otherwise triggers
 * a rebuild through the deploy hook with the episode attached.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings.</p>
 *
 * @since 0.1.0
 */
public final class WebsiteConnector implements PlatformConnector {
  /** Platform name used in outcomes. */
  public static final String NAME = "website";

  private static final Logger log = LoggerFactory.getLogger(WebsiteConnector.class);

  private final JsonHttpClient http;
  private final JsonSupport json;
  private final Optional<URI> contentApi;
  private final Optional<URI> deployHook;
  private final Optional<String> token;
  private final Duration timeout;
  private final ClockPort clock;

  /**
   * Creates the connector; at least one of {@code contentApi} and {@code deployHook} is required.
   *
   * @param http shared HTTP client
   * @param json JSON helper
   * @param contentApi content API endpoint accepting {@code add_episode}
   * @param deployHook deploy hook used when no content API is configured
   * @param token optional bearer token for the content API
   * @param timeout per-request timeout
   * @param clock clock for request timestamps
   */
  public WebsiteConnector(
      JsonHttpClient http,
      JsonSupport json,
      Optional<URI> contentApi,
      Optional<URI> deployHook,
      Optional<String> token,
      Duration timeout,
      ClockPort clock) {
    this.http = Objects.requireNonNull(http, "http");
    this.json = Objects.requireNonNull(json, "json");
    this.contentApi = Objects.requireNonNull(contentApi, "contentApi");
    this.deployHook = Objects.requireNonNull(deployHook, "deployHook");
    this.token = Objects.requireNonNull(token, "token");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (contentApi.isEmpty() && deployHook.isEmpty()) {
      throw new IllegalArgumentException("website requires a content API endpoint or a deploy hook");
    }
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public PlatformKind kind() {
    return PlatformKind.WEBSITE;
  }

  @Override
  public PlatformResult publish(EpisodeData episode) {
    try {
      if (contentApi.isPresent()) {
        return addEpisode(contentApi.get(), episode);
      }
      return triggerDeployment(deployHook.get(), episode);
    } catch (IOException ex) {
      return PlatformResult.failed(NAME, "website request failed: " + ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return PlatformResult.failed(NAME, "interrupted");
    } catch (IllegalArgumentException ex) {
      return PlatformResult.failed(NAME, "website returned an unreadable response: " + ex.getMessage());
    }
  }

  private PlatformResult addEpisode(URI endpoint, EpisodeData episode) throws IOException, InterruptedException {
    String body = json.write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("action", "add_episode");
      gen.writeFieldName("episode");
      writeEpisode(gen, episode);
      gen.writeStringField("timestamp", now());
      gen.writeEndObject();
    });
    Map<String, String> headers = token.map(t -> Map.of("Authorization", "Bearer " + t)).orElse(Map.of());
    HttpResponseData response = http.postJson(endpoint, body, headers, timeout);
    if (response.status() != 200 && response.status() != 201) {
      return PlatformResult.failed(NAME, response.describeError("website"));
    }
    Object parsed = response.body().isBlank() ? Map.of() : json.parse(response.body());
    Optional<String> url = JsonSupport.text(parsed, "episode_url")
        .or(() -> JsonSupport.text(parsed, "website_url"));
    log.info("Website updated with episode {}", episode.episodeId());
    return PlatformResult.published(NAME, url.orElse(null), episode.episodeId(), Map.of("status", "updated"));
  }

  private PlatformResult triggerDeployment(URI hook, EpisodeData episode) throws IOException, InterruptedException {
    String body = json.write(gen -> {
      gen.writeStartObject();
      gen.writeFieldName("episode_data");
      writeEpisode(gen, episode);
      gen.writeStringField("triggered_at", now());
      gen.writeStringField("trigger_source", "podflow");
      gen.writeStringField("deployment_type", "episode_update");
      gen.writeEndObject();
    });
    HttpResponseData response = http.postJson(hook, body, Map.of(), timeout);
    if (!response.isSuccess() || response.status() > 202) {
      return PlatformResult.failed(NAME, response.describeError("website deploy hook"));
    }
    Object parsed = parseLenient(response.body());
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("status", JsonSupport.text(parsed, "status").orElse("triggered"));
    JsonSupport.text(parsed, "url").ifPresent(v -> attributes.put("deploymentUrl", v));
    Optional<String> deploymentId = JsonSupport.text(parsed, "id")
        .or(() -> JsonSupport.text(parsed, "job", "id"));
    log.info("Website deployment triggered for episode {}", episode.episodeId());
    return PlatformResult.published(NAME, null, deploymentId.orElse(null), attributes);
  }

  private Object parseLenient(String body) {
    if (body.isBlank()) {
      return Map.of();
    }
    try {
      return json.parse(body);
    } catch (IllegalArgumentException ex) {
      log.debug("Deploy hook returned non-JSON body; treating as triggered");
      return Map.of();
    }
  }

  private static void writeEpisode(JsonGenerator gen, EpisodeData episode) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("episode_id", episode.episodeId());
    gen.writeStringField("title", episode.title());
    gen.writeStringField("description", episode.description());
    gen.writeStringField("show_notes", episode.showNotes());
    gen.writeStringField("summary", episode.summary().orElse(""));
    gen.writeStringField("audio_filename", String.valueOf(episode.audioRef().getFileName()));
    gen.writeStringField("language", episode.language());
    JsonSupport.writeStringArray(gen, "tags", episode.tags());
    gen.writeStringField("category", episode.category());
    gen.writeStringField("publication_date", episode.publicationDate().toString());
    gen.writeStringField("author", episode.author());
    gen.writeEndObject();
  }

  private String now() {
    return Instant.ofEpochMilli(clock.nowMillis()).toString();
  }
}
