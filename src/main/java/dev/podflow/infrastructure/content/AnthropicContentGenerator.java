package dev.podflow.infrastructure.content;

import dev.podflow.application.port.ContentGenerator;
import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.Transcript;
import dev.podflow.infrastructure.http.HttpResponseData;
import dev.podflow.infrastructure.http.JsonHttpClient;
import dev.podflow.infrastructure.http.JsonSupport;
import dev.podflow.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Generates episode content with the Anthropic Messages API.
 * <p><strong>Role:</strong> Primary content generator; wrapped by {@link FallbackingContentGenerator} so a provider
 * outage degrades to flagged fallback content.</p>
 * <p>A single prompt asks for one JSON object with every content field; the reply text is parsed with
 * {@link JsonSupport}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings.</p>
 *
 * @since 0.1.0
 */
public final class AnthropicContentGenerator implements ContentGenerator {
  /** Provider name recorded in the content metadata. */
  public static final String PROVIDER = "anthropic";

  private static final Logger log = LoggerFactory.getLogger(AnthropicContentGenerator.class);
  private static final String API_VERSION = "2023-06-01";
  private static final int TRANSCRIPT_LIMIT = 12_000;

  private final JsonHttpClient http;
  private final JsonSupport json;
  private final URI baseUrl;
  private final String apiKey;
  private final String model;
  private final int maxTokens;
  private final Duration timeout;

  /**
   * Creates the generator.
   *
   * @param http shared HTTP client
   * @param json JSON helper
   * @param baseUrl API base such as {@code https://api.anthropic.com}
   * @param apiKey API key
   * @param model model identifier
   * @param maxTokens response token limit
   * @param timeout request timeout
   */
  public AnthropicContentGenerator(
      JsonHttpClient http,
      JsonSupport json,
      URI baseUrl,
      String apiKey,
      String model,
      int maxTokens,
      Duration timeout) {
    this.http = Objects.requireNonNull(http, "http");
    this.json = Objects.requireNonNull(json, "json");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    this.model = Objects.requireNonNull(model, "model");
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be positive");
    }
    this.maxTokens = maxTokens;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public GeneratedContent generate(Transcript transcript, String languageCode)
      throws IOException, InterruptedException {
    String body = json.write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("model", model);
      gen.writeNumberField("max_tokens", maxTokens);
      gen.writeArrayFieldStart("messages");
      gen.writeStartObject();
      gen.writeStringField("role", "user");
      gen.writeStringField("content", prompt(transcript.text(), languageCode));
      gen.writeEndObject();
      gen.writeEndArray();
      gen.writeEndObject();
    });
    String base = baseUrl.toString().replaceAll("/+$", "");
    log.info("Requesting content from {} ({} transcript words)", model, transcript.wordCount());
    HttpResponseData response = http.postJson(
        URI.create(base + "/v1/messages"),
        body,
        Map.of("x-api-key", apiKey, "anthropic-version", API_VERSION),
        timeout);
    if (!response.isSuccess()) {
      throw new IOException(response.describeError("Anthropic"));
    }
    String reply = replyText(json.parse(response.body()))
        .orElseThrow(() -> new IOException("Anthropic reply contained no text"));
    log.debug("Model reply: {}", Logs.truncate(reply, 200));
    return toContent(reply, languageCode);
  }

  static String prompt(String transcript, String languageCode) {
    String excerpt = transcript.length() > TRANSCRIPT_LIMIT
        ? transcript.substring(0, TRANSCRIPT_LIMIT) + "..."
        : transcript;
    return "You write podcast episode content in the language " + languageCode + ".\n"
        + "Reply with one JSON object and nothing else, with string fields "
        + "\"title\", \"description\", \"show_notes\" (bullet points), \"summary\", "
        + "and an object \"social_media\" with string fields \"twitter\" (under 280 characters), "
        + "\"linkedin\" and \"instagram\".\n\nTranscript:\n" + excerpt;
  }

  private static Optional<String> replyText(Object response) {
    Optional<Object> content = JsonSupport.at(response, "content");
    if (content.isEmpty() || !(content.get() instanceof List<?> blocks)) {
      return Optional.empty();
    }
    StringBuilder text = new StringBuilder();
    for (Object block : blocks) {
      if ("text".equals(JsonSupport.text(block, "type").orElse(""))) {
        JsonSupport.text(block, "text").ifPresent(text::append);
      }
    }
    return text.length() == 0 ? Optional.empty() : Optional.of(text.toString());
  }

  GeneratedContent toContent(String reply, String languageCode) throws IOException {
    int start = reply.indexOf('{');
    int end = reply.lastIndexOf('}');
    if (start < 0 || end <= start) {
      throw new IOException("Anthropic reply was not a JSON object");
    }
    Object parsed;
    try {
      parsed = json.parse(reply.substring(start, end + 1));
    } catch (IllegalArgumentException ex) {
      throw new IOException("Anthropic reply was not valid JSON", ex);
    }
    Map<String, String> social = new LinkedHashMap<>();
    for (String network : List.of("twitter", "linkedin", "instagram")) {
      JsonSupport.text(parsed, "social_media", network).ifPresent(v -> social.put(network, v));
    }
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("provider", PROVIDER);
    metadata.put("model", model);
    metadata.put("language", languageCode);
    return new GeneratedContent(
        JsonSupport.text(parsed, "title").orElse(null),
        JsonSupport.text(parsed, "description").orElse(null),
        JsonSupport.text(parsed, "show_notes").orElse(null),
        JsonSupport.text(parsed, "summary"),
        social,
        metadata,
        false);
  }
}
