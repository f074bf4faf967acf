package dev.podflow.application.port;

import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.Transcript;

/**
 * <strong>What:</strong> Stage 3 collaborator producing title, description, show notes, summary and social copy.
 * <p><strong>Role:</strong> Implementations backed by a model may degrade to fallback content; such content must
 * be flagged with {@link GeneratedContent#fallback()}.</p>
 *
 * @since 0.1.0
 */
public interface ContentGenerator {
  /**
   * Generates episode content.
   *
   * @param transcript validated transcript
   * @param languageCode language detected or used by transcription
   * @return generated content; required fields are validated by the caller
   * @throws Exception when no content can be produced
   */
  GeneratedContent generate(Transcript transcript, String languageCode) throws Exception;
}
