package dev.podflow.domain.workflow;

/**
 * <strong>What:</strong> States of a single pipeline run.
 * <p>{@code PENDING -> AUDIO_PROCESSING -> TRANSCRIBING -> GENERATING_CONTENT -> PUBLISHING -> terminal}.
 * Terminal states are {@link #COMPLETED}, {@link #COMPLETED_WITH_FALLBACK_CONTENT} and {@link #FAILED}.</p>
 *
 * @since 0.1.0
 */
public enum WorkflowState {
  PENDING,
  AUDIO_PROCESSING,
  TRANSCRIBING,
  GENERATING_CONTENT,
  PUBLISHING,
  /** All stages ran; publishing may still have partially or wholly failed. */
  COMPLETED,
  /** Completed, but the content came from the fallback generator rather than a model. */
  COMPLETED_WITH_FALLBACK_CONTENT,
  /** A stage aborted the run. */
  FAILED;

  /**
   * Indicates whether no further transition is possible.
   *
   * @return {@code true} for completed and failed states
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == COMPLETED_WITH_FALLBACK_CONTENT || this == FAILED;
  }

  /**
   * Indicates a successful terminal state.
   *
   * @return {@code true} for both completed variants
   */
  public boolean isSuccess() {
    return this == COMPLETED || this == COMPLETED_WITH_FALLBACK_CONTENT;
  }
}
