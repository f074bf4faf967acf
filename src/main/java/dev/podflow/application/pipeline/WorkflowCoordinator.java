package dev.podflow.application.pipeline;

import dev.podflow.application.port.AudioProcessor;
import dev.podflow.application.port.ClockPort;
import dev.podflow.application.port.ContentGenerator;
import dev.podflow.application.port.MetricsPort;
import dev.podflow.application.port.Transcriber;
import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.ProcessedAudio;
import dev.podflow.domain.content.Transcript;
import dev.podflow.domain.error.ConfigurationException;
import dev.podflow.domain.error.MissingInputException;
import dev.podflow.domain.publish.PublishingOutcome;
import dev.podflow.domain.workflow.Stage;
import dev.podflow.domain.workflow.StageFailure;
import dev.podflow.domain.workflow.StageOutcome;
import dev.podflow.domain.workflow.WorkflowRequest;
import dev.podflow.domain.workflow.WorkflowResult;
import dev.podflow.domain.workflow.WorkflowState;
import java.nio.file.Files;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs the four-stage pipeline (audio, transcript, content, publish) for one request.
 * <p><strong>Why:</strong> Each stage's validated output is the precondition of the next, so stages 1 to 3 fail
 * fast; publishing is tolerant because a partially published episode is still a produced episode.</p>
 * <p><strong>Role:</strong> Application-layer entry point behind {@code podflow run}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject a missing audio source before any collaborator is invoked.</li>
 *   <li>Invoke collaborators strictly in sequence and gate each output.</li>
 *   <li>Carry the language detected during transcription into content generation and publishing.</li>
 *   <li>Surface fallback content as {@link WorkflowState#COMPLETED_WITH_FALLBACK_CONTENT}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent runs provided the collaborators are; each run owns its
 * {@link WorkflowResult.Builder}.</p>
 * <p><strong>Observability:</strong> Sets the {@code workflow} MDC key for the run; emits
 * {@code workflow.run.started|completed|failed}, {@code workflow.stage.<stage>.latencyMillis} and
 * {@code workflow.stage.<stage>.failed}.</p>
 *
 * @since 0.1.0
 */
public final class WorkflowCoordinator {
  private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);
  private static final String MDC_WORKFLOW = "workflow";

  private final AudioProcessor audioProcessor;
  private final Transcriber transcriber;
  private final ContentGenerator contentGenerator;
  private final PublishingCoordinator publishing;
  private final StageOutputValidator validator;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Supplier<String> runIds;

  /**
   * Creates a coordinator with random run identifiers.
   *
   * @param audioProcessor stage 1 collaborator
   * @param transcriber stage 2 collaborator
   * @param contentGenerator stage 3 collaborator
   * @param publishing stage 4 coordinator
   * @param metrics metrics sink
   * @param clock time source
   */
  public WorkflowCoordinator(
      AudioProcessor audioProcessor,
      Transcriber transcriber,
      ContentGenerator contentGenerator,
      PublishingCoordinator publishing,
      MetricsPort metrics,
      ClockPort clock) {
    this(audioProcessor, transcriber, contentGenerator, publishing, metrics, clock,
        () -> UUID.randomUUID().toString());
  }

  /**
   * Creates a coordinator with a custom run id source.
   *
   * @param audioProcessor stage 1 collaborator
   * @param transcriber stage 2 collaborator
   * @param contentGenerator stage 3 collaborator
   * @param publishing stage 4 coordinator
   * @param metrics metrics sink
   * @param clock time source
   * @param runIds run identifier supplier
   */
  public WorkflowCoordinator(
      AudioProcessor audioProcessor,
      Transcriber transcriber,
      ContentGenerator contentGenerator,
      PublishingCoordinator publishing,
      MetricsPort metrics,
      ClockPort clock,
      Supplier<String> runIds) {
    this.audioProcessor = Objects.requireNonNull(audioProcessor, "audioProcessor");
    this.transcriber = Objects.requireNonNull(transcriber, "transcriber");
    this.contentGenerator = Objects.requireNonNull(contentGenerator, "contentGenerator");
    this.publishing = Objects.requireNonNull(publishing, "publishing");
    this.validator = new StageOutputValidator();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.runIds = Objects.requireNonNull(runIds, "runIds");
  }

  /**
   * Runs the pipeline.
   *
   * @param request run request; must not be {@code null}
   * @return terminal result; {@link WorkflowState#FAILED} when a stage aborted the run
   * @throws MissingInputException if the audio source does not exist
   * @throws ConfigurationException if no publishing platform is enabled; checked before any stage runs
   */
  public WorkflowResult run(WorkflowRequest request) {
    Objects.requireNonNull(request, "request");
    if (!Files.isRegularFile(request.audioRef())) {
      throw new MissingInputException(request.audioRef());
    }
    if (publishing.enabledPlatforms().isEmpty()) {
      throw new ConfigurationException("no publishing platforms enabled");
    }

    String runId = runIds.get();
    String previousWorkflow = MDC.get(MDC_WORKFLOW);
    MDC.put(MDC_WORKFLOW, runId);
    try {
      metrics.increment("workflow.run.started");
      log.info("Workflow started for {} (language={})", request.audioRef(), request.languageCode());
      WorkflowResult result = execute(runId, request, clock.nowMillis());
      if (result.success()) {
        metrics.increment("workflow.run.completed");
        log.info("Workflow finished in {} with episode {}",
            result.state(), result.episodeId().orElse("<none>"));
      } else {
        metrics.increment("workflow.run.failed");
        log.error("Workflow failed at {}", result.failure().map(StageFailure::describe).orElse("unknown"));
      }
      return result;
    } finally {
      if (previousWorkflow == null) {
        MDC.remove(MDC_WORKFLOW);
      } else {
        MDC.put(MDC_WORKFLOW, previousWorkflow);
      }
    }
  }

  private WorkflowResult execute(String runId, WorkflowRequest request, long started) {
    WorkflowResult.Builder result = WorkflowResult.builder(runId, request);

    StageOutcome<ProcessedAudio> audio = runStage(
        result, Stage.AUDIO_PROCESSING, () -> audioProcessor.process(request.audioRef()), validator::audio);
    if (!audio.isOk()) {
      return result.fail(audio.failure(), elapsed(started));
    }
    ProcessedAudio processed = audio.value();
    result.processedAudio(processed);

    StageOutcome<Transcript> transcription = runStage(
        result, Stage.TRANSCRIPTION,
        () -> transcriber.transcribe(processed, request.languageCode()), validator::transcript);
    if (!transcription.isOk()) {
      return result.fail(transcription.failure(), elapsed(started));
    }
    Transcript transcript = transcription.value();
    result.transcript(transcript);
    String language = transcript.detectedLanguage().orElse(request.languageCode());
    if (!language.equals(request.languageCode())) {
      log.info("Transcription detected {}; requested {}", language, request.languageCode());
    }

    StageOutcome<GeneratedContent> generation = runStage(
        result, Stage.CONTENT_GENERATION,
        () -> contentGenerator.generate(transcript, language), validator::content);
    if (!generation.isOk()) {
      return result.fail(generation.failure(), elapsed(started));
    }
    GeneratedContent content = generation.value();
    result.content(content);
    if (content.fallback()) {
      log.warn("Content generation fell back to placeholder content");
    }

    StageOutcome<PublishingOutcome> publication = runStage(
        result, Stage.PUBLISHING,
        () -> publishing.publish(processed.processedRef(), content, request.metadata(), language),
        StageOutcome::ok);
    if (!publication.isOk()) {
      return result.fail(publication.failure(), elapsed(started));
    }
    result.publishing(publication.value());

    WorkflowState terminal = content.fallback()
        ? WorkflowState.COMPLETED_WITH_FALLBACK_CONTENT
        : WorkflowState.COMPLETED;
    return result.complete(terminal, elapsed(started));
  }

  private <T> StageOutcome<T> runStage(
      WorkflowResult.Builder result,
      Stage stage,
      Callable<T> call,
      Function<T, StageOutcome<T>> gate) {
    result.enter(stage.runningState());
    log.info("Stage {} started", stage.tag());
    long started = clock.nowMillis();
    StageOutcome<T> outcome;
    try {
      T value = call.call();
      outcome = value == null
          ? StageOutcome.failed(StageFailure.invalidOutput(stage, "collaborator returned no output"))
          : gate.apply(value);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      outcome = StageOutcome.failed(StageFailure.thrown(stage, ex));
    } catch (Exception ex) {
      outcome = StageOutcome.failed(StageFailure.thrown(stage, ex));
    }
    long latency = elapsed(started);
    metrics.observe("workflow.stage." + stage.tag() + ".latencyMillis", latency);
    if (outcome.isOk()) {
      log.info("Stage {} completed in {} ms", stage.tag(), latency);
    } else {
      metrics.increment("workflow.stage." + stage.tag() + ".failed");
      StageFailure failure = outcome.failure();
      if (failure.cause().isPresent()) {
        log.error("Stage {} failed: {}", stage.tag(), failure.message(), failure.cause().get());
      } else {
        log.error("Stage {} failed: {}", stage.tag(), failure.message());
      }
    }
    return outcome;
  }

  private long elapsed(long started) {
    return Math.max(0L, clock.nowMillis() - started);
  }
}
