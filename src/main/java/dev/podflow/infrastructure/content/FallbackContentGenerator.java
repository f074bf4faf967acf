package dev.podflow.infrastructure.content;

import dev.podflow.application.port.ContentGenerator;
import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.Transcript;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Derives basic episode content from the transcript text alone.
 * <p><strong>Role:</strong> Used when no model provider is configured or the provider failed. Output is always
 * flagged as fallback so the workflow can report degraded content.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class FallbackContentGenerator implements ContentGenerator {
  /** Provider name recorded in the content metadata. */
  public static final String PROVIDER = "fallback_content_generator";

  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?。！？])\\s*");
  private static final int TITLE_LIMIT = 80;
  private static final int DESCRIPTION_LIMIT = 500;
  private static final int DESCRIPTION_SENTENCES = 3;
  private static final int NOTE_BULLETS = 5;
  private static final int SUMMARY_SENTENCES = 2;
  private static final String UNTITLED = "Untitled Episode";

  @Override
  public GeneratedContent generate(Transcript transcript, String languageCode) {
    List<String> sentences = sentences(transcript.text());
    String title = sentences.isEmpty() ? UNTITLED : clip(stripTerminal(sentences.get(0)), TITLE_LIMIT);
    if (title.isBlank()) {
      title = UNTITLED;
    }
    String description = clip(join(sentences, DESCRIPTION_SENTENCES), DESCRIPTION_LIMIT);
    if (description.isBlank()) {
      description = title;
    }

    StringBuilder notes = new StringBuilder("Episode highlights:");
    for (String sentence : sentences.subList(0, Math.min(NOTE_BULLETS, sentences.size()))) {
      notes.append("\n• ").append(sentence);
    }
    if (sentences.isEmpty()) {
      notes.append("\n• ").append(title);
    }
    String summary = join(sentences, SUMMARY_SENTENCES);

    Map<String, String> social = new LinkedHashMap<>();
    social.put("twitter", "New episode: " + title + " #podcast");
    social.put("linkedin", description);

    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("provider", PROVIDER);
    metadata.put("language", languageCode);

    return new GeneratedContent(
        title, description, notes.toString(), Optional.of(summary), social, metadata, true);
  }

  static List<String> sentences(String text) {
    List<String> sentences = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return sentences;
    }
    Arrays.stream(SENTENCE_END.split(text.strip()))
        .map(s -> s.replaceAll("\\s+", " ").trim())
        .filter(s -> !s.isEmpty())
        .forEach(sentences::add);
    return sentences;
  }

  private static String join(List<String> sentences, int count) {
    return String.join(" ", sentences.subList(0, Math.min(count, sentences.size())));
  }

  private static String stripTerminal(String sentence) {
    return sentence.replaceAll("[.!?。！？]+$", "").trim();
  }

  private static String clip(String text, int limit) {
    if (text.length() <= limit) {
      return text;
    }
    String cut = text.substring(0, limit);
    int space = cut.lastIndexOf(' ');
    return (space > limit / 2 ? cut.substring(0, space) : cut).trim() + "...";
  }
}
