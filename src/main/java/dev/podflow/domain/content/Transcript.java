package dev.podflow.domain.content;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Output of the transcription stage.
 * <p>The text is not required to be non-blank here; the workflow gate rejects blank transcripts so that a
 * collaborator returning whitespace is reported as a stage failure.</p>
 *
 * @param text transcript text; never {@code null}
 * @param detectedLanguage language the provider detected or used, when it reported one
 * @param confidence provider confidence in {@code [0, 1]}
 * @param wordCount whitespace-delimited word count
 * @since 0.1.0
 */
public record Transcript(
    String text, Optional<String> detectedLanguage, double confidence, int wordCount) {

  public Transcript {
    Objects.requireNonNull(text, "text");
    detectedLanguage =
        detectedLanguage == null ? Optional.empty() : detectedLanguage.filter(s -> !s.isBlank());
    if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
      throw new IllegalArgumentException("confidence must be within [0, 1]");
    }
    if (wordCount < 0) {
      throw new IllegalArgumentException("wordCount must be >= 0");
    }
  }

  /**
   * Builds a transcript, counting words from the text.
   *
   * @param text transcript text
   * @param detectedLanguage detected language or {@code null}
   * @param confidence provider confidence
   * @return transcript
   */
  public static Transcript of(String text, String detectedLanguage, double confidence) {
    return new Transcript(text, Optional.ofNullable(detectedLanguage), confidence, countWords(text));
  }

  /**
   * Counts whitespace-delimited words.
   *
   * @param text text to scan; {@code null} counts as empty
   * @return number of words
   */
  public static int countWords(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    return text.trim().split("\\s+").length;
  }
}
