package dev.podflow.domain.workflow;

/**
 * <strong>What:</strong> The four production stages, in execution order.
 * <p><strong>Role:</strong> Tags {@link StageFailure}s and metric names.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Stage {
  /** Audio conditioning of the raw recording. */
  AUDIO_PROCESSING("audio_processing", WorkflowState.AUDIO_PROCESSING),
  /** Speech-to-text. */
  TRANSCRIPTION("transcription", WorkflowState.TRANSCRIBING),
  /** Title, description, show notes and social copy generation. */
  CONTENT_GENERATION("content_generation", WorkflowState.GENERATING_CONTENT),
  /** Fan-out to publishing platforms. */
  PUBLISHING("publishing", WorkflowState.PUBLISHING);

  private final String tag;
  private final WorkflowState runningState;

  Stage(String tag, WorkflowState runningState) {
    this.tag = tag;
    this.runningState = runningState;
  }

  /**
   * Returns the stable snake_case tag used in failures, logs and metrics.
   *
   * @return stage tag such as {@code content_generation}
   */
  public String tag() {
    return tag;
  }

  /**
   * Returns the workflow state entered while this stage runs.
   *
   * @return running state
   */
  public WorkflowState runningState() {
    return runningState;
  }
}
