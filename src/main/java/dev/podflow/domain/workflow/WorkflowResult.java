package dev.podflow.domain.workflow;

import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.ProcessedAudio;
import dev.podflow.domain.content.Transcript;
import dev.podflow.domain.error.StageFailureException;
import dev.podflow.domain.publish.PublishingOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Terminal record of one pipeline run.
 * <p><strong>Role:</strong> Returned by {@code WorkflowCoordinator.run}; carries every validated stage output
 * produced before the run terminated, the state transitions taken, and the failure when one aborted it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report which stage aborted the run and why.</li>
 *   <li>On completion, expose the publishing outcome even when every platform failed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built; the {@link Builder} is confined to the running thread.</p>
 *
 * @param runId identifier of the run, also used as the {@code workflow} MDC value
 * @param request request that started the run
 * @param state terminal state
 * @param transitions states entered, in order, starting with {@link WorkflowState#PENDING}
 * @param processedAudio stage 1 output, if it passed validation
 * @param transcript stage 2 output, if it passed validation
 * @param content stage 3 output, if it passed validation
 * @param publishing stage 4 outcome, if publishing returned
 * @param failure reason the run aborted; present exactly when {@code state} is {@link WorkflowState#FAILED}
 * @param durationMillis wall-clock duration of the run
 * @since 0.1.0
 */
public record WorkflowResult(
    String runId,
    WorkflowRequest request,
    WorkflowState state,
    List<WorkflowState> transitions,
    Optional<ProcessedAudio> processedAudio,
    Optional<Transcript> transcript,
    Optional<GeneratedContent> content,
    Optional<PublishingOutcome> publishing,
    Optional<StageFailure> failure,
    long durationMillis) {

  public WorkflowResult {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(state, "state");
    if (!state.isTerminal()) {
      throw new IllegalArgumentException("result state must be terminal: " + state);
    }
    transitions = List.copyOf(transitions);
    if ((state == WorkflowState.FAILED) != failure.isPresent()) {
      throw new IllegalArgumentException("failure must be present exactly for FAILED runs");
    }
  }

  /**
   * Indicates overall success: stages 1 to 3 ran and passed validation and publishing returned.
   * Publishing may still have failed on every platform.
   *
   * @return {@code true} for both completed states
   */
  public boolean success() {
    return state.isSuccess();
  }

  /**
   * Returns the episode identifier from the publishing outcome.
   *
   * @return episode id, if publishing ran
   */
  public Optional<String> episodeId() {
    return publishing.map(PublishingOutcome::episodeId);
  }

  /**
   * Lists the stages whose outputs passed validation, in execution order.
   *
   * @return completed stages
   */
  public List<Stage> completedStages() {
    List<Stage> stages = new ArrayList<>(4);
    processedAudio.ifPresent(a -> stages.add(Stage.AUDIO_PROCESSING));
    transcript.ifPresent(t -> stages.add(Stage.TRANSCRIPTION));
    content.ifPresent(c -> stages.add(Stage.CONTENT_GENERATION));
    publishing.ifPresent(p -> stages.add(Stage.PUBLISHING));
    return List.copyOf(stages);
  }

  /**
   * Returns this result when the run succeeded.
   *
   * @return this result
   * @throws StageFailureException if the run failed
   */
  public WorkflowResult orThrow() {
    if (failure.isPresent()) {
      throw new StageFailureException(failure.get());
    }
    return this;
  }

  /**
   * Starts accumulating a run.
   *
   * @param runId run identifier
   * @param request request being run
   * @return builder in {@link WorkflowState#PENDING}
   */
  public static Builder builder(String runId, WorkflowRequest request) {
    return new Builder(runId, request);
  }

  /**
   * Accumulates stage outputs monotonically. Confined to the thread executing the run.
   */
  public static final class Builder {
    private final String runId;
    private final WorkflowRequest request;
    private final List<WorkflowState> transitions = new ArrayList<>();
    private WorkflowState state = WorkflowState.PENDING;
    private ProcessedAudio processedAudio;
    private Transcript transcript;
    private GeneratedContent content;
    private PublishingOutcome publishing;

    private Builder(String runId, WorkflowRequest request) {
      this.runId = Objects.requireNonNull(runId, "runId");
      this.request = Objects.requireNonNull(request, "request");
      transitions.add(state);
    }

    /**
     * Moves to the next state.
     *
     * @param next state to enter
     * @return this builder
     * @throws IllegalStateException if the run already terminated
     */
    public Builder enter(WorkflowState next) {
      Objects.requireNonNull(next, "next");
      if (state.isTerminal()) {
        throw new IllegalStateException("run already terminated in " + state);
      }
      state = next;
      transitions.add(next);
      return this;
    }

    /**
     * Returns the current state.
     *
     * @return state
     */
    public WorkflowState state() {
      return state;
    }

    /**
     * Records the stage 1 output once it has passed validation.
     *
     * @param value processed audio
     * @return this builder
     */
    public Builder processedAudio(ProcessedAudio value) {
      this.processedAudio = Objects.requireNonNull(value, "processedAudio");
      return this;
    }

    /**
     * Records the stage 2 output once it has passed validation.
     *
     * @param value transcript
     * @return this builder
     */
    public Builder transcript(Transcript value) {
      this.transcript = Objects.requireNonNull(value, "transcript");
      return this;
    }

    /**
     * Records the stage 3 output, generated or fallback, once it has passed validation.
     *
     * @param value generated content
     * @return this builder
     */
    public Builder content(GeneratedContent value) {
      this.content = Objects.requireNonNull(value, "content");
      return this;
    }

    /**
     * Records the publishing outcome, including one where every platform failed.
     *
     * @param value publishing outcome
     * @return this builder
     */
    public Builder publishing(PublishingOutcome value) {
      this.publishing = Objects.requireNonNull(value, "publishing");
      return this;
    }

    /**
     * Terminates the run as completed.
     *
     * @param terminal {@link WorkflowState#COMPLETED} or {@link WorkflowState#COMPLETED_WITH_FALLBACK_CONTENT}
     * @param durationMillis run duration
     * @return immutable result
     */
    public WorkflowResult complete(WorkflowState terminal, long durationMillis) {
      if (!terminal.isSuccess()) {
        throw new IllegalArgumentException("not a completed state: " + terminal);
      }
      enter(terminal);
      return build(Optional.empty(), durationMillis);
    }

    /**
     * Terminates the run as failed.
     *
     * @param failure reason
     * @param durationMillis run duration
     * @return immutable result
     */
    public WorkflowResult fail(StageFailure failure, long durationMillis) {
      Objects.requireNonNull(failure, "failure");
      enter(WorkflowState.FAILED);
      return build(Optional.of(failure), durationMillis);
    }

    private WorkflowResult build(Optional<StageFailure> failure, long durationMillis) {
      return new WorkflowResult(
          runId,
          request,
          state,
          transitions,
          Optional.ofNullable(processedAudio),
          Optional.ofNullable(transcript),
          Optional.ofNullable(content),
          Optional.ofNullable(publishing),
          failure,
          Math.max(0L, durationMillis));
    }
  }
}
