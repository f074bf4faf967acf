package dev.podflow.application.pipeline;

import dev.podflow.application.port.ClockPort;
import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.publish.EpisodeData;
import dev.podflow.domain.workflow.EpisodeMetadata;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Builds the platform-agnostic {@link EpisodeData} from generated content and metadata.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Re-check the required content fields before anything is published.</li>
 *   <li>Use a supplied episode id verbatim, otherwise generate one exactly once.</li>
 *   <li>Apply defaults for category, author, copyright and publication date.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; holds only immutable settings and a thread-safe id generator.</p>
 *
 * @since 0.1.0
 */
public final class EpisodeDataAssembler {
  /** Category applied when metadata has none. */
  public static final String DEFAULT_CATEGORY = "Technology";

  private final EpisodeIdGenerator ids;
  private final ClockPort clock;
  private final ZoneId zone;
  private final String defaultAuthor;
  private final String defaultLanguage;

  /**
   * Creates an assembler.
   *
   * @param ids episode id generator
   * @param clock clock used for the default publication date and copyright year
   * @param zone zone in which "today" is computed
   * @param defaultAuthor author credit when metadata has none
   * @param defaultLanguage language when neither the caller nor the content metadata supply one
   */
  public EpisodeDataAssembler(
      EpisodeIdGenerator ids, ClockPort clock, ZoneId zone, String defaultAuthor, String defaultLanguage) {
    this.ids = Objects.requireNonNull(ids, "ids");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.defaultAuthor = requireText(defaultAuthor, "defaultAuthor");
    this.defaultLanguage = requireText(defaultLanguage, "defaultLanguage");
  }

  /**
   * Assembles the episode record.
   *
   * @param audioRef processed audio reference
   * @param content generated content
   * @param metadata caller metadata
   * @param language language of the content, or {@code null} to read it from the content metadata
   * @return immutable episode data
   * @throws IllegalArgumentException if required content fields are missing
   */
  public EpisodeData assemble(
      Path audioRef, GeneratedContent content, EpisodeMetadata metadata, String language) {
    Objects.requireNonNull(audioRef, "audioRef");
    Objects.requireNonNull(content, "content");
    EpisodeMetadata meta = metadata == null ? EpisodeMetadata.EMPTY : metadata;
    List<String> missing = content.missingRequiredFields();
    if (!missing.isEmpty()) {
      throw new IllegalArgumentException(
          "cannot assemble episode, content is missing: " + String.join(", ", missing));
    }

    String title = meta.title().orElse(content.title());
    String episodeId = meta.episodeId().orElseGet(() -> ids.generate(title));
    LocalDate today = LocalDate.ofInstant(Instant.ofEpochMilli(clock.nowMillis()), zone);
    String author = meta.author().orElse(defaultAuthor);
    String effectiveLanguage = language != null && !language.isBlank()
        ? language
        : content.metadata().getOrDefault("language", defaultLanguage);

    return new EpisodeData(
        episodeId,
        title,
        content.description(),
        content.showNotes(),
        content.summary(),
        audioRef,
        effectiveLanguage,
        content.socialMedia(),
        meta.tags(),
        meta.category().orElse(DEFAULT_CATEGORY),
        meta.explicit().orElse(Boolean.FALSE),
        meta.episodeNumber(),
        meta.seasonNumber(),
        meta.publicationDate().orElse(today),
        author,
        meta.copyright().orElse("© " + today.getYear() + " " + author));
  }

  private static String requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value;
  }
}
