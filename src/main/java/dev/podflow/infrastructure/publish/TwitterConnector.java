package dev.podflow.infrastructure.publish;

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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Announces the episode with a tweet through the v2 tweets endpoint.
 * <p>Uses the generated {@code twitter} copy when present, otherwise {@link TweetComposer#defaultAnnouncement}.</p>
 *
 * @since 0.1.0
 */
public final class TwitterConnector implements PlatformConnector {
  /** Platform name used in outcomes. */
  public static final String NAME = "twitter";

  private static final Logger log = LoggerFactory.getLogger(TwitterConnector.class);
  private static final String STATUS_URL = "https://twitter.com/i/status/";

  private final JsonHttpClient http;
  private final JsonSupport json;
  private final URI baseUrl;
  private final String bearerToken;
  private final Duration timeout;

  /**
   * Creates the connector.
   *
   * @param http shared HTTP client
   * @param json JSON helper
   * @param baseUrl API base such as {@code https://api.twitter.com/2}
   * @param bearerToken user-context bearer token
   * @param timeout per-request timeout
   */
  public TwitterConnector(
      JsonHttpClient http, JsonSupport json, URI baseUrl, String bearerToken, Duration timeout) {
    this.http = Objects.requireNonNull(http, "http");
    this.json = Objects.requireNonNull(json, "json");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    this.bearerToken = Objects.requireNonNull(bearerToken, "bearerToken");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public PlatformKind kind() {
    return PlatformKind.SOCIAL;
  }

  @Override
  public PlatformResult publish(EpisodeData episode) {
    String text = TweetComposer.truncate(
        episode.socialCopy("twitter").orElseGet(() -> TweetComposer.defaultAnnouncement(episode)));
    String body = json.write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("text", text);
      gen.writeEndObject();
    });
    try {
      HttpResponseData response = http.postJson(
          Endpoints.append(baseUrl, "/tweets"), body, Map.of("Authorization", "Bearer " + bearerToken), timeout);
      if (!response.isSuccess()) {
        return PlatformResult.failed(NAME, response.describeError("Twitter"));
      }
      Optional<String> tweetId = JsonSupport.text(json.parse(response.body()), "data", "id");
      if (tweetId.isEmpty()) {
        return PlatformResult.failed(NAME, "Twitter response did not contain a tweet id");
      }
      log.info("Tweet {} posted for episode {}", tweetId.get(), episode.episodeId());
      return PlatformResult.published(NAME, STATUS_URL + tweetId.get(), tweetId.get());
    } catch (IOException ex) {
      return PlatformResult.failed(NAME, "Twitter request failed: " + ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return PlatformResult.failed(NAME, "interrupted");
    } catch (IllegalArgumentException ex) {
      return PlatformResult.failed(NAME, "Twitter returned an unreadable response: " + ex.getMessage());
    }
  }
}
