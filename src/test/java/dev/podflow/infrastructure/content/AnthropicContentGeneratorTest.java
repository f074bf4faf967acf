package dev.podflow.infrastructure.content;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.Transcript;
import dev.podflow.infrastructure.http.JsonSupport;
import dev.podflow.testutil.TestHttp;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnthropicContentGeneratorTest {
  private static final Transcript TRANSCRIPT = Transcript.of("We discuss backpressure in depth.", null, 1.0);

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
  void parsesJsonObjectFromReplyText() throws Exception {
    String reply = "Here you go:\n{\"title\":\"Backpressure 101\",\"description\":\"All about it\","
        + "\"show_notes\":\"- flow control\",\"summary\":\"Short.\","
        + "\"social_media\":{\"twitter\":\"Listen now\",\"linkedin\":\"New episode\"}}";
    server.enqueue(new MockResponse().setResponseCode(200).setBody(messagesResponse(reply)));

    GeneratedContent content = generator().generate(TRANSCRIPT, "fr-FR");

    assertEquals("Backpressure 101", content.title());
    assertEquals("All about it", content.description());
    assertEquals("- flow control", content.showNotes());
    assertEquals(Optional.of("Short."), content.summary());
    assertEquals(Optional.of("Listen now"), content.socialCopy("twitter"));
    assertEquals(Optional.of("New episode"), content.socialCopy("linkedin"));
    assertFalse(content.fallback());
    assertEquals("anthropic", content.metadata().get("provider"));
    assertEquals("fr-FR", content.metadata().get("language"));

    RecordedRequest request = server.takeRequest();
    assertEquals("/v1/messages", request.getPath());
    assertEquals("secret", request.getHeader("x-api-key"));
    assertEquals("2023-06-01", request.getHeader("anthropic-version"));
    Object body = json.parse(request.getBody().readUtf8());
    assertEquals(Optional.of("test-model"), JsonSupport.text(body, "model"));
    assertEquals(Optional.of("512"), JsonSupport.text(body, "max_tokens"));
    List<?> messages = (List<?>) JsonSupport.at(body, "messages").orElseThrow();
    String prompt = JsonSupport.text(messages.get(0), "content").orElseThrow();
    assertTrue(prompt.contains("language fr-FR"));
    assertTrue(prompt.endsWith("We discuss backpressure in depth."));
  }

  @Test
  void missingFieldsAreLeftForTheGate() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200)
        .setBody(messagesResponse("{\"title\":\"Only a title\"}")));

    GeneratedContent content = generator().generate(TRANSCRIPT, "en-US");

    assertEquals(List.of("description", "show_notes"), content.missingRequiredFields());
  }

  @Test
  void apiErrorIsThrown() {
    server.enqueue(new MockResponse().setResponseCode(529).setBody("overloaded"));

    IOException ex = assertThrows(IOException.class, () -> generator().generate(TRANSCRIPT, "en-US"));

    assertEquals("Anthropic API error: 529 - overloaded", ex.getMessage());
  }

  @Test
  void replyWithoutJsonIsThrown() {
    server.enqueue(new MockResponse().setResponseCode(200).setBody(messagesResponse("Sorry, I cannot help.")));

    IOException ex = assertThrows(IOException.class, () -> generator().generate(TRANSCRIPT, "en-US"));

    assertEquals("Anthropic reply was not a JSON object", ex.getMessage());
  }

  @Test
  void promptCapsVeryLongTranscripts() {
    String prompt = AnthropicContentGenerator.prompt("z".repeat(20_000), "en-US");

    assertTrue(prompt.endsWith("z".repeat(100) + "..."));
    assertTrue(prompt.length() < 13_000);
  }

  private AnthropicContentGenerator generator() {
    return new AnthropicContentGenerator(
        TestHttp.client(), json, server.url("/").uri(), "secret", "test-model", 512, Duration.ofSeconds(5));
  }

  private String messagesResponse(String text) {
    return json.write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("id", "msg_1");
      gen.writeArrayFieldStart("content");
      gen.writeStartObject();
      gen.writeStringField("type", "text");
      gen.writeStringField("text", text);
      gen.writeEndObject();
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }
}
