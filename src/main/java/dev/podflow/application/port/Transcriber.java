package dev.podflow.application.port;

import dev.podflow.domain.content.ProcessedAudio;
import dev.podflow.domain.content.Transcript;

/**
 * <strong>What:</strong> Stage 2 collaborator that turns processed audio into text.
 *
 * @since 0.1.0
 */
public interface Transcriber {
  /**
   * Transcribes the audio.
   *
   * @param audio validated stage 1 output
   * @param languageCode requested language
   * @return transcript; the detected language, when reported, overrides the requested one downstream
   * @throws Exception on missing input or when every provider failed
   */
  Transcript transcribe(ProcessedAudio audio, String languageCode) throws Exception;
}
