package dev.podflow.domain.publish;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Platform-agnostic record describing one episode for publishing.
 * <p><strong>Role:</strong> Built once per publish call by the assembler and shared read-only by every
 * fan-out task.</p>
 * <p><strong>Thread-safety:</strong> Deeply immutable; collections are copied on construction.</p>
 *
 * @param episodeId stable identifier; never regenerated within a publish call
 * @param title episode title
 * @param description episode description
 * @param showNotes show notes
 * @param summary optional summary
 * @param audioRef conditioned audio reference
 * @param language content language code
 * @param socialMedia social copy keyed by network
 * @param tags episode tags
 * @param category category label
 * @param explicit explicit-content flag
 * @param episodeNumber optional episode number
 * @param seasonNumber optional season number
 * @param publicationDate publication date
 * @param author author credit
 * @param copyright copyright line
 * @since 0.1.0
 */
public record EpisodeData(
    String episodeId,
    String title,
    String description,
    String showNotes,
    Optional<String> summary,
    Path audioRef,
    String language,
    Map<String, String> socialMedia,
    List<String> tags,
    String category,
    boolean explicit,
    Optional<Integer> episodeNumber,
    Optional<Integer> seasonNumber,
    LocalDate publicationDate,
    String author,
    String copyright) {

  public EpisodeData {
    episodeId = requireText(episodeId, "episodeId");
    title = requireText(title, "title");
    description = requireText(description, "description");
    showNotes = requireText(showNotes, "showNotes");
    summary = summary == null ? Optional.empty() : summary;
    Objects.requireNonNull(audioRef, "audioRef");
    language = requireText(language, "language");
    socialMedia = socialMedia == null ? Map.of() : Map.copyOf(socialMedia);
    tags = tags == null ? List.of() : List.copyOf(tags);
    category = requireText(category, "category");
    episodeNumber = episodeNumber == null ? Optional.empty() : episodeNumber;
    seasonNumber = seasonNumber == null ? Optional.empty() : seasonNumber;
    Objects.requireNonNull(publicationDate, "publicationDate");
    author = requireText(author, "author");
    copyright = requireText(copyright, "copyright");
  }

  /**
   * Returns the copy for one social network.
   *
   * @param network network key such as {@code twitter}
   * @return non-blank copy, if present
   */
  public Optional<String> socialCopy(String network) {
    return Optional.ofNullable(socialMedia.get(network)).filter(s -> !s.isBlank());
  }

  private static String requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value;
  }
}
