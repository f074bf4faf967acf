package dev.podflow.domain.content;

import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Output of the audio conditioning stage.
 * <p><strong>Role:</strong> Input of transcription and the audio reference handed to publishing.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param source raw audio the stage was given
 * @param processedRef conditioned audio; must resolve to a readable file before the run advances
 * @param durationSeconds playback duration in seconds; non-negative
 * @param sampleRate sample rate in Hz; non-negative ({@code 0} when unknown)
 * @param channels channel count; non-negative ({@code 0} when unknown)
 * @since 0.1.0
 */
public record ProcessedAudio(
    Path source, Path processedRef, double durationSeconds, int sampleRate, int channels) {

  public ProcessedAudio {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(processedRef, "processedRef");
    if (durationSeconds < 0 || Double.isNaN(durationSeconds)) {
      throw new IllegalArgumentException("durationSeconds must be >= 0");
    }
    if (sampleRate < 0) {
      throw new IllegalArgumentException("sampleRate must be >= 0");
    }
    if (channels < 0) {
      throw new IllegalArgumentException("channels must be >= 0");
    }
  }
}
