package dev.podflow.infrastructure.content;

import dev.podflow.application.port.ContentGenerator;
import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.Transcript;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries a primary generator and degrades to a fallback one when it throws. Fallback output is always marked with
 * {@link GeneratedContent#fallback()}.
 *
 * @since 0.1.0
 */
public final class FallbackingContentGenerator implements ContentGenerator {
  private static final Logger log = LoggerFactory.getLogger(FallbackingContentGenerator.class);

  private final ContentGenerator primary;
  private final ContentGenerator fallback;

  /**
   * Creates the generator chain.
   *
   * @param primary generator tried first
   * @param fallback generator used when the primary throws
   */
  public FallbackingContentGenerator(ContentGenerator primary, ContentGenerator fallback) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  @Override
  public GeneratedContent generate(Transcript transcript, String languageCode) throws Exception {
    try {
      return primary.generate(transcript, languageCode);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw ex;
    } catch (Exception ex) {
      log.warn("Content provider failed ({}); using fallback content", ex.toString());
      log.debug("Content provider failure", ex);
      return fallback.generate(transcript, languageCode).asFallback();
    }
  }
}
