package dev.podflow.application.pipeline;

import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.ProcessedAudio;
import dev.podflow.domain.content.Transcript;
import dev.podflow.domain.workflow.Stage;
import dev.podflow.domain.workflow.StageFailure;
import dev.podflow.domain.workflow.StageOutcome;
import java.nio.file.Files;
import java.util.List;

/**
 * Validation gates applied to each stage's output before the workflow advances.
 *
 * @since 0.1.0
 */
public final class StageOutputValidator {

  /**
   * Creates the validator.
   */
  public StageOutputValidator() {}

  /**
   * Requires the processed audio reference to resolve to a readable file.
   *
   * @param audio stage 1 output
   * @return ok, or a failure tagged {@code audio_processing}
   */
  public StageOutcome<ProcessedAudio> audio(ProcessedAudio audio) {
    if (!Files.isRegularFile(audio.processedRef()) || !Files.isReadable(audio.processedRef())) {
      return StageOutcome.failed(StageFailure.invalidOutput(
          Stage.AUDIO_PROCESSING, "processed audio is not a readable file: " + audio.processedRef()));
    }
    return StageOutcome.ok(audio);
  }

  /**
   * Requires non-blank transcript text.
   *
   * @param transcript stage 2 output
   * @return ok, or a failure tagged {@code transcription}
   */
  public StageOutcome<Transcript> transcript(Transcript transcript) {
    if (transcript.text().isBlank()) {
      return StageOutcome.failed(
          StageFailure.invalidOutput(Stage.TRANSCRIPTION, "transcript text is empty"));
    }
    return StageOutcome.ok(transcript);
  }

  /**
   * Requires non-blank title, description and show notes.
   *
   * @param content stage 3 output
   * @return ok, or a failure tagged {@code content_generation} listing the missing fields
   */
  public StageOutcome<GeneratedContent> content(GeneratedContent content) {
    List<String> missing = content.missingRequiredFields();
    if (!missing.isEmpty()) {
      return StageOutcome.failed(StageFailure.missingFields(Stage.CONTENT_GENERATION, missing));
    }
    return StageOutcome.ok(content);
  }
}
