package dev.podflow.application.port;

import dev.podflow.domain.content.ProcessedAudio;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Stage 1 collaborator that conditions a raw recording.
 * <p><strong>Thread-safety:</strong> Implementations may be invoked from one run thread at a time.</p>
 *
 * @since 0.1.0
 */
public interface AudioProcessor {
  /**
   * Produces a processed audio file from the raw source.
   *
   * @param audioRef raw audio file; exists when called
   * @return processed audio descriptor
   * @throws Exception when the input is unreadable or its format unsupported
   */
  ProcessedAudio process(Path audioRef) throws Exception;
}
