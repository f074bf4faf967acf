package dev.podflow.infrastructure.publish;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.podflow.domain.publish.EpisodeData;
import dev.podflow.domain.publish.PlatformResult;
import dev.podflow.infrastructure.http.JsonSupport;
import dev.podflow.testutil.Fixtures;
import dev.podflow.testutil.TestHttp;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TwitterConnectorTest {
  private final JsonSupport json = new JsonSupport();
  private MockWebServer server;

  @BeforeEach
  void start() throws IOException {
    server = new MockWebServer();
    server.start();
  }

  @AfterEach
  void stop() throws IOException {
    server.shutdown();
  }

  @Test
  void postsDefaultAnnouncementWhenNoCopyWasGenerated() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"data\":{\"id\":\"1789\",\"text\":\"x\"}}"));

    PlatformResult result = connector().publish(Fixtures.episode(Path.of("/a.wav")));

    assertTrue(result.success());
    assertEquals(Optional.of("https://twitter.com/i/status/1789"), result.publishedUrl());
    assertEquals(Optional.of("1789"), result.remoteId());
    RecordedRequest request = server.takeRequest();
    assertEquals("/2/tweets", request.getPath());
    assertEquals("Bearer tw-token", request.getHeader("Authorization"));
    assertEquals(
        Optional.of("New episode: Scaling Event Pipelines - We talk about pipelines #podcast #ai"),
        JsonSupport.text(json.parse(request.getBody().readUtf8()), "text"));
  }

  @Test
  void generatedCopyIsPostedTruncated() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"data\":{\"id\":\"1\"}}"));
    EpisodeData base = Fixtures.episode(Path.of("/a.wav"));
    EpisodeData withCopy = new EpisodeData(base.episodeId(), base.title(), base.description(), base.showNotes(),
        base.summary(), base.audioRef(), base.language(), Map.of("twitter", "y".repeat(400)), base.tags(),
        base.category(), base.explicit(), base.episodeNumber(), base.seasonNumber(), base.publicationDate(),
        base.author(), base.copyright());

    connector().publish(withCopy);

    String text = JsonSupport.text(json.parse(server.takeRequest().getBody().readUtf8()), "text").orElseThrow();
    assertEquals(TweetComposer.MAX_LENGTH, text.length());
    assertTrue(text.endsWith("..."));
  }

  @Test
  void unauthorizedIsAFailure() {
    server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"title\":\"Unauthorized\"}"));

    PlatformResult result = connector().publish(Fixtures.episode(Path.of("/a.wav")));

    assertFalse(result.success());
    assertEquals(Optional.of("Twitter API error: 401 - {\"title\":\"Unauthorized\"}"), result.error());
  }

  @Test
  void malformedResponseIsAFailure() {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("not json"));

    PlatformResult result = connector().publish(Fixtures.episode(Path.of("/a.wav")));

    assertTrue(result.error().orElseThrow().startsWith("Twitter returned an unreadable response"));
  }

  private TwitterConnector connector() {
    return new TwitterConnector(
        TestHttp.client(), json, server.url("/2").uri(), "tw-token", Duration.ofSeconds(5));
  }
}
