package dev.podflow.domain.error;

import dev.podflow.domain.workflow.StageFailure;
import java.util.Objects;

/**
 * Exception form of a {@link StageFailure}, for callers that prefer to throw a failed workflow result.
 *
 * @since 0.1.0
 * @see dev.podflow.domain.workflow.WorkflowResult#orThrow()
 */
public final class StageFailureException extends PodflowException {
  private static final long serialVersionUID = 1L;

  private final transient StageFailure failure;

  /**
   * Wraps a stage failure.
   *
   * @param failure failure description; must not be {@code null}
   */
  public StageFailureException(StageFailure failure) {
    super(Objects.requireNonNull(failure, "failure").describe(), failure.cause().orElse(null));
    this.failure = failure;
  }

  /**
   * Returns the wrapped failure.
   *
   * @return stage failure; never {@code null}
   */
  public StageFailure failure() {
    return failure;
  }
}
