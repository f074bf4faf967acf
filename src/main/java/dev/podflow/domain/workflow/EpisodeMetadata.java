package dev.podflow.domain.workflow;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Optional, caller-supplied episode metadata for a pipeline run or a standalone publish.
 * <p><strong>Role:</strong> Part of {@link WorkflowRequest}; folded into {@code EpisodeData} by the assembler.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param episodeId identifier to use verbatim instead of generating one
 * @param title title overriding the generated one
 * @param tags episode tags; never {@code null}, may be empty
 * @param category category label (assembler defaults to {@code Technology})
 * @param explicit explicit-content flag
 * @param episodeNumber episode number within the season
 * @param seasonNumber season number
 * @param publicationDate scheduled publication date
 * @param author author credit
 * @param copyright copyright line
 * @since 0.1.0
 */
public record EpisodeMetadata(
    Optional<String> episodeId,
    Optional<String> title,
    List<String> tags,
    Optional<String> category,
    Optional<Boolean> explicit,
    Optional<Integer> episodeNumber,
    Optional<Integer> seasonNumber,
    Optional<LocalDate> publicationDate,
    Optional<String> author,
    Optional<String> copyright) {

  /** Metadata with every field absent. */
  public static final EpisodeMetadata EMPTY = builder().build();

  /**
   * Normalizes absent optionals and validates numeric fields.
   */
  public EpisodeMetadata {
    episodeId = blankToEmpty(episodeId);
    title = blankToEmpty(title);
    tags = tags == null ? List.of() : List.copyOf(tags);
    category = blankToEmpty(category);
    explicit = explicit == null ? Optional.empty() : explicit;
    episodeNumber = positive(episodeNumber, "episodeNumber");
    seasonNumber = positive(seasonNumber, "seasonNumber");
    publicationDate = publicationDate == null ? Optional.empty() : publicationDate;
    author = blankToEmpty(author);
    copyright = blankToEmpty(copyright);
  }

  /**
   * Starts a builder with every field absent.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  private static Optional<String> blankToEmpty(Optional<String> value) {
    if (value == null) {
      return Optional.empty();
    }
    return value.map(String::trim).filter(s -> !s.isEmpty());
  }

  private static Optional<Integer> positive(Optional<Integer> value, String name) {
    if (value == null) {
      return Optional.empty();
    }
    value.ifPresent(v -> {
      if (v <= 0) {
        throw new IllegalArgumentException(name + " must be positive");
      }
    });
    return value;
  }

  /** Mutable builder for {@link EpisodeMetadata}. Not thread-safe. */
  public static final class Builder {
    private String episodeId;
    private String title;
    private List<String> tags = List.of();
    private String category;
    private Boolean explicit;
    private Integer episodeNumber;
    private Integer seasonNumber;
    private LocalDate publicationDate;
    private String author;
    private String copyright;

    private Builder() {}

    public Builder episodeId(String value) {
      this.episodeId = value;
      return this;
    }

    public Builder title(String value) {
      this.title = value;
      return this;
    }

    public Builder tags(List<String> value) {
      this.tags = Objects.requireNonNull(value, "tags");
      return this;
    }

    public Builder category(String value) {
      this.category = value;
      return this;
    }

    public Builder explicit(boolean value) {
      this.explicit = value;
      return this;
    }

    public Builder episodeNumber(int value) {
      this.episodeNumber = value;
      return this;
    }

    public Builder seasonNumber(int value) {
      this.seasonNumber = value;
      return this;
    }

    public Builder publicationDate(LocalDate value) {
      this.publicationDate = value;
      return this;
    }

    public Builder author(String value) {
      this.author = value;
      return this;
    }

    public Builder copyright(String value) {
      this.copyright = value;
      return this;
    }

    /**
     * Builds the immutable metadata.
     *
     * @return metadata record
     * @throws IllegalArgumentException if episode or season numbers are not positive
     */
    public EpisodeMetadata build() {
      return new EpisodeMetadata(
          Optional.ofNullable(episodeId),
          Optional.ofNullable(title),
          tags,
          Optional.ofNullable(category),
          Optional.ofNullable(explicit),
          Optional.ofNullable(episodeNumber),
          Optional.ofNullable(seasonNumber),
          Optional.ofNullable(publicationDate),
          Optional.ofNullable(author),
          Optional.ofNullable(copyright));
    }
  }
}
