package dev.podflow.domain.error;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raised when the audio source referenced by a request does not exist. No stage is attempted.
 *
 * @since 0.1.0
 */
public final class MissingInputException extends PodflowException {
  private static final long serialVersionUID = 1L;

  private final transient Path audioRef;

  /**
   * Creates the exception for a missing audio source.
   *
   * @param audioRef unresolved audio reference; must not be {@code null}
   */
  public MissingInputException(Path audioRef) {
    super("Audio file not found: " + Objects.requireNonNull(audioRef, "audioRef"));
    this.audioRef = audioRef;
  }

  /**
   * Returns the reference that could not be resolved.
   *
   * @return missing audio reference
   */
  public Path audioRef() {
    return audioRef;
  }
}
