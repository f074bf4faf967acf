package dev.podflow.domain.workflow;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Immutable input to a single pipeline run.
 * <p><strong>Role:</strong> Argument of {@code WorkflowCoordinator.run}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param audioRef raw audio source; existence is checked by the coordinator, not here
 * @param languageCode BCP-47-like code such as {@code en-US} or {@code ja}
 * @param metadata optional episode metadata; {@link EpisodeMetadata#EMPTY} when absent
 * @since 0.1.0
 */
public record WorkflowRequest(Path audioRef, String languageCode, EpisodeMetadata metadata) {
  private static final Pattern LANGUAGE = Pattern.compile("[a-zA-Z]{2,3}(-[a-zA-Z0-9]{2,8})*");

  /**
   * Validates the language code and defaults the metadata.
   */
  public WorkflowRequest {
    Objects.requireNonNull(audioRef, "audioRef");
    languageCode = normalizeLanguage(languageCode);
    metadata = metadata == null ? EpisodeMetadata.EMPTY : metadata;
  }

  /**
   * Creates a request without metadata.
   *
   * @param audioRef raw audio source
   * @param languageCode language code
   * @return request with {@link EpisodeMetadata#EMPTY}
   */
  public static WorkflowRequest of(Path audioRef, String languageCode) {
    return new WorkflowRequest(audioRef, languageCode, EpisodeMetadata.EMPTY);
  }

  /**
   * Validates a BCP-47-like code and canonicalizes its case ({@code EN-us} becomes {@code en-US}).
   *
   * @param languageCode raw code
   * @return canonical code
   * @throws IllegalArgumentException if the code is blank or malformed
   */
  public static String normalizeLanguage(String languageCode) {
    if (languageCode == null || languageCode.isBlank()) {
      throw new IllegalArgumentException("languageCode must not be blank");
    }
    String trimmed = languageCode.trim().replace('_', '-');
    if (!LANGUAGE.matcher(trimmed).matches()) {
      throw new IllegalArgumentException("languageCode is not a valid language tag: " + languageCode);
    }
    String[] parts = trimmed.split("-");
    StringBuilder sb = new StringBuilder(parts[0].toLowerCase(Locale.ROOT));
    for (int i = 1; i < parts.length; i++) {
      String part = parts[i];
      sb.append('-').append(part.length() == 2 ? part.toUpperCase(Locale.ROOT) : part);
    }
    return sb.toString();
  }
}
