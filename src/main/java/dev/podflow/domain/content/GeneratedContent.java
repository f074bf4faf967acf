package dev.podflow.domain.content;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Output of the content generation stage.
 * <p><strong>Why:</strong> Required fields are nullable on purpose: a generator may omit them and the workflow
 * gate must be able to name what is missing instead of failing at construction.</p>
 * <p><strong>Role:</strong> Validated by the workflow, then folded into {@code EpisodeData}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param title episode title; required by the gate
 * @param description episode description; required by the gate
 * @param showNotes episode show notes; required by the gate
 * @param summary short summary; optional
 * @param socialMedia social copy keyed by network ({@code twitter}, {@code linkedin}, ...)
 * @param metadata provider metadata such as {@code provider} and {@code language}
 * @param fallback {@code true} when produced by the fallback generator instead of a model
 * @since 0.1.0
 */
public record GeneratedContent(
    String title,
    String description,
    String showNotes,
    Optional<String> summary,
    Map<String, String> socialMedia,
    Map<String, String> metadata,
    boolean fallback) {

  /** Snake-case names of the fields the workflow gate requires, in reporting order. */
  public static final List<String> REQUIRED_FIELDS = List.of("title", "description", "show_notes");

  public GeneratedContent {
    summary = summary == null ? Optional.empty() : summary.filter(s -> !s.isBlank());
    socialMedia = socialMedia == null ? Map.of() : Map.copyOf(socialMedia);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Creates model-generated content with only the required fields.
   *
   * @param title title
   * @param description description
   * @param showNotes show notes
   * @return content without summary, social copy or metadata
   */
  public static GeneratedContent of(String title, String description, String showNotes) {
    return new GeneratedContent(title, description, showNotes, Optional.empty(), Map.of(), Map.of(), false);
  }

  /**
   * Lists the required fields that are {@code null} or blank.
   *
   * @return missing field names in {@link #REQUIRED_FIELDS} order; empty when complete
   */
  public List<String> missingRequiredFields() {
    Map<String, String> required = new LinkedHashMap<>();
    required.put("title", title);
    required.put("description", description);
    required.put("show_notes", showNotes);
    List<String> missing = new ArrayList<>();
    required.forEach((name, value) -> {
      if (value == null || value.isBlank()) {
        missing.add(name);
      }
    });
    return List.copyOf(missing);
  }

  /**
   * Returns the copy for one social network.
   *
   * @param network network key such as {@code twitter}
   * @return non-blank copy, if generated
   */
  public Optional<String> socialCopy(String network) {
    return Optional.ofNullable(socialMedia.get(network)).filter(s -> !s.isBlank());
  }

  /**
   * Returns a copy marked as fallback content.
   *
   * @return same content with {@code fallback=true}
   */
  public GeneratedContent asFallback() {
    return new GeneratedContent(title, description, showNotes, summary, socialMedia, metadata, true);
  }
}
