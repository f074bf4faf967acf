package dev.podflow.infrastructure.publish;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Publishes episodes to the Art19 hosting platform through its JSON:API endpoints.
 * <p><strong>Role:</strong> {@link PlatformKind#HOST} connector; its canonical URL is preferred over every other
 * platform's.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Upload the processed audio: request a pre-signed slot from {@code /audio_uploads}, then stream the file
 *       to it as a multipart form.</li>
 *   <li>Create the episode as a draft under the configured series, linked to the uploaded audio.</li>
 *   <li>Optionally publish the draft with a follow-up {@code PATCH}.</li>
 *   <li>Report transport and API errors as failed results.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings.</p>
 *
 * @since 0.1.0
 */
public final class Art19Connector implements PlatformConnector {
  /** Platform name used in outcomes. */
  public static final String NAME = "art19";

  private static final Logger log = LoggerFactory.getLogger(Art19Connector.class);
  private static final String JSON_API = "application/vnd.api+json";
  private static final Map<String, String> AUDIO_TYPES = Map.of(
      ".mp3", "audio/mpeg",
      ".wav", "audio/wav",
      ".m4a", "audio/mp4",
      ".aac", "audio/aac",
      ".flac", "audio/flac",
      ".ogg", "audio/ogg");

  private final JsonHttpClient http;
  private final JsonSupport json;
  private final URI baseUrl;
  private final String seriesId;
  private final String token;
  private final boolean autoPublish;
  private final Duration timeout;
  private final Duration uploadTimeout;
  private final ClockPort clock;

  /**
   * Creates the connector.
   *
   * @param http shared HTTP client
   * @param json JSON helper
   * @param baseUrl API base such as {@code https://api.art19.com}
   * @param seriesId series the episode belongs to
   * @param token API bearer token
   * @param autoPublish whether to publish the created draft immediately
   * @param timeout per-request timeout for API calls
   * @param uploadTimeout timeout for streaming the audio file
   * @param clock clock for the {@code published_at} stamp
   */
  public Art19Connector(
      JsonHttpClient http,
      JsonSupport json,
      URI baseUrl,
      String seriesId,
      String token,
      boolean autoPublish,
      Duration timeout,
      Duration uploadTimeout,
      ClockPort clock) {
    this.http = Objects.requireNonNull(http, "http");
    this.json = Objects.requireNonNull(json, "json");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    this.seriesId = Objects.requireNonNull(seriesId, "seriesId");
    this.token = Objects.requireNonNull(token, "token");
    this.autoPublish = autoPublish;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.uploadTimeout = Objects.requireNonNull(uploadTimeout, "uploadTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public PlatformKind kind() {
    return PlatformKind.HOST;
  }

  @Override
  public PlatformResult publish(EpisodeData episode) {
    Path audio = episode.audioRef();
    if (!Files.isRegularFile(audio)) {
      return PlatformResult.failed(NAME, "audio file not found: " + audio);
    }
    try {
      AudioUpload upload = uploadAudio(audio);
      log.info("Art19 audio upload {} stored", upload.id());

      HttpResponseData created = http.send(
          "POST", Endpoints.append(baseUrl, "/episodes"), createPayload(episode, upload.id()), JSON_API, headers(),
          timeout);
      if (created.status() != 200 && created.status() != 201) {
        return PlatformResult.failed(NAME, created.describeError("Art19"));
      }
      Object body = json.parse(created.body());
      Optional<String> remoteId = JsonSupport.text(body, "data", "id");
      if (remoteId.isEmpty()) {
        return PlatformResult.failed(NAME, "Art19 response did not contain an episode id");
      }
      Optional<String> url = JsonSupport.text(body, "data", "attributes", "canonical_url");
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put("status", "draft");
      attributes.put("audioUploadId", upload.id());
      attributes.put("audioUrl", upload.fileUrl());
      JsonSupport.text(body, "data", "attributes", "embed_url").ifPresent(v -> attributes.put("embedUrl", v));

      if (autoPublish) {
        HttpResponseData published = http.send(
            "PATCH",
            Endpoints.append(baseUrl, "/episodes/" + remoteId.get()),
            publishPayload(remoteId.get()),
            JSON_API,
            headers(),
            timeout);
        if (published.status() != 200 && published.status() != 204) {
          return PlatformResult.failed(NAME,
              "episode " + remoteId.get() + " created but not published: " + published.describeError("Art19"));
        }
        attributes.put("status", "published");
      }
      log.info("Art19 episode {} created ({})", remoteId.get(), attributes.get("status"));
      return PlatformResult.published(NAME, url.orElse(null), remoteId.get(), attributes);
    } catch (UploadRejectedException ex) {
      return PlatformResult.failed(NAME, ex.getMessage());
    } catch (IOException ex) {
      return PlatformResult.failed(NAME, "Art19 request failed: " + ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return PlatformResult.failed(NAME, "interrupted");
    } catch (IllegalArgumentException ex) {
      return PlatformResult.failed(NAME, "Art19 returned an unreadable response: " + ex.getMessage());
    }
  }

  private AudioUpload uploadAudio(Path audio) throws IOException, InterruptedException, UploadRejectedException {
    HttpResponseData slot = http.send(
        "POST", Endpoints.append(baseUrl, "/audio_uploads"), uploadRequestPayload(audio), JSON_API, headers(),
        timeout);
    if (slot.status() != 200 && slot.status() != 201) {
      throw new UploadRejectedException("audio upload slot not granted: " + slot.describeError("Art19"));
    }
    Object body = json.parse(slot.body());
    Optional<String> uploadId = JsonSupport.text(body, "data", "id");
    Optional<String> uploadUrl = JsonSupport.text(body, "data", "attributes", "upload_url");
    if (uploadId.isEmpty() || uploadUrl.isEmpty()) {
      throw new UploadRejectedException("Art19 audio upload response did not contain an upload id and URL");
    }
    Map<String, String> fields = new LinkedHashMap<>();
    JsonSupport.at(body, "data", "attributes", "upload_fields")
        .filter(v -> v instanceof Map<?, ?>)
        .map(v -> (Map<?, ?>) v)
        .ifPresent(map -> map.forEach((k, v) -> fields.put(String.valueOf(k), String.valueOf(v))));

    HttpResponseData stored = http.uploadFile(
        URI.create(uploadUrl.get()), fields, "file", audio, contentType(audio), uploadTimeout);
    if (!stored.isSuccess()) {
      throw new UploadRejectedException("audio upload failed: " + stored.describeError("storage"));
    }
    return new AudioUpload(
        uploadId.get(), JsonSupport.text(body, "data", "attributes", "file_url").orElse(uploadUrl.get()));
  }

  String uploadRequestPayload(Path audio) throws IOException {
    long size = Files.size(audio);
    return json.write(gen -> {
      gen.writeStartObject();
      gen.writeObjectFieldStart("data");
      gen.writeStringField("type", "audio_uploads");
      gen.writeObjectFieldStart("attributes");
      gen.writeStringField("filename", audio.getFileName().toString());
      gen.writeNumberField("file_size", size);
      gen.writeStringField("content_type", contentType(audio));
      gen.writeEndObject();
      gen.writeEndObject();
      gen.writeEndObject();
    });
  }

  static String contentType(Path audio) {
    String name = audio.getFileName().toString().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "audio/mpeg" : AUDIO_TYPES.getOrDefault(name.substring(dot), "audio/mpeg");
  }

  String createPayload(EpisodeData episode, String audioUploadId) {
    return json.write(gen -> {
      gen.writeStartObject();
      gen.writeObjectFieldStart("data");
      gen.writeStringField("type", "episodes");
      gen.writeObjectFieldStart("attributes");
      gen.writeStringField("title", episode.title());
      gen.writeStringField("description", episode.description());
      gen.writeStringField("content", episode.showNotes());
      gen.writeStringField("audio_upload_id", audioUploadId);
      JsonSupport.writeOptional(gen, "episode_number", episode.episodeNumber());
      gen.writeNumberField("season_number", episode.seasonNumber().orElse(1));
      gen.writeStringField("published_at", episode.publicationDate().toString());
      gen.writeBooleanField("explicit", episode.explicit());
      JsonSupport.writeStringArray(gen, "tags", episode.tags());
      gen.writeEndObject();
      gen.writeObjectFieldStart("relationships");
      gen.writeObjectFieldStart("series");
      gen.writeObjectFieldStart("data");
      gen.writeStringField("type", "series");
      gen.writeStringField("id", seriesId);
      gen.writeEndObject();
      gen.writeEndObject();
      gen.writeEndObject();
      gen.writeEndObject();
      gen.writeEndObject();
    });
  }

  private String publishPayload(String remoteId) {
    return json.write(gen -> {
      gen.writeStartObject();
      gen.writeObjectFieldStart("data");
      gen.writeStringField("type", "episodes");
      gen.writeStringField("id", remoteId);
      gen.writeObjectFieldStart("attributes");
      gen.writeBooleanField("published", true);
      gen.writeStringField("published_at", Instant.ofEpochMilli(clock.nowMillis()).toString());
      gen.writeEndObject();
      gen.writeEndObject();
      gen.writeEndObject();
    });
  }

  private Map<String, String> headers() {
    return Map.of("Authorization", "Bearer " + token);
  }

  private record AudioUpload(String id, String fileUrl) {}

  /** Audio upload refused by Art19 or the storage target; reported as a failed result. */
  private static final class UploadRejectedException extends Exception {
    private static final long serialVersionUID = 1L;

    UploadRejectedException(String message) {
      super(message);
    }
  }
}
