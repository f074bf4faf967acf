package dev.podflow.domain.workflow;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * <strong>What:</strong> Result of one stage at the collaborator boundary: a validated value or a
 * {@link StageFailure}.
 * <p><strong>Why:</strong> Keeps the coordinator's fail-fast sequencing as plain data flow instead of nested
 * exception handling.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 *
 * @param <T> stage output type
 * @since 0.1.0
 */
public sealed interface StageOutcome<T> permits StageOutcome.Ok, StageOutcome.Failed {

  /**
   * Wraps a validated value.
   *
   * @param value stage output; must not be {@code null}
   * @param <T> output type
   * @return successful outcome
   */
  static <T> StageOutcome<T> ok(T value) {
    return new Ok<>(value);
  }

  /**
   * Wraps a failure.
   *
   * @param failure failure description; must not be {@code null}
   * @param <T> output type
   * @return failed outcome
   */
  static <T> StageOutcome<T> failed(StageFailure failure) {
    return new Failed<>(failure);
  }

  /**
   * Indicates whether this outcome carries a value.
   *
   * @return {@code true} for {@link Ok}
   */
  boolean isOk();

  /**
   * Returns the value of an {@link Ok} outcome.
   *
   * @return stage output
   * @throws NoSuchElementException if this outcome failed
   */
  T value();

  /**
   * Returns the failure of a {@link Failed} outcome.
   *
   * @return failure description
   * @throws NoSuchElementException if this outcome succeeded
   */
  StageFailure failure();

  /**
   * Successful outcome.
   *
   * @param value validated output
   * @param <T> output type
   */
  record Ok<T>(T value) implements StageOutcome<T> {
    public Ok {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isOk() {
      return true;
    }

    @Override
    public StageFailure failure() {
      throw new NoSuchElementException("outcome succeeded");
    }
  }

  /**
   * Failed outcome.
   *
   * @param failure failure description
   * @param <T> output type
   */
  record Failed<T>(StageFailure failure) implements StageOutcome<T> {
    public Failed {
      Objects.requireNonNull(failure, "failure");
    }

    @Override
    public boolean isOk() {
      return false;
    }

    @Override
    public T value() {
      throw new NoSuchElementException("outcome failed: " + failure.describe());
    }
  }
}
