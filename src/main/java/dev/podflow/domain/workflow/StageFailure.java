package dev.podflow.domain.workflow;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Describes why a stage aborted the run.
 * <p><strong>Role:</strong> Error variant of {@link StageOutcome}; attached to a failed {@link WorkflowResult}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param stage stage that failed; never {@code null}
 * @param message human-readable reason; never blank
 * @param missingFields required output fields that were absent (content generation only); never {@code null}
 * @param cause collaborator exception, when one was thrown
 * @since 0.1.0
 */
public record StageFailure(
    Stage stage, String message, List<String> missingFields, Optional<Throwable> cause) {

  /**
   * Validates invariants and copies the field list.
   */
  public StageFailure {
    Objects.requireNonNull(stage, "stage");
    if (message == null || message.isBlank()) {
      throw new IllegalArgumentException("message must not be blank");
    }
    missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    cause = cause == null ? Optional.empty() : cause;
  }

  /**
   * Failure caused by an exception escaping the collaborator.
   *
   * @param stage failing stage
   * @param cause thrown exception
   * @return failure carrying the cause
   */
  public static StageFailure thrown(Stage stage, Throwable cause) {
    Objects.requireNonNull(cause, "cause");
    String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    return new StageFailure(stage, detail, List.of(), Optional.of(cause));
  }

  /**
   * Failure caused by output that did not pass validation.
   *
   * @param stage failing stage
   * @param message validation message
   * @return failure without a cause
   */
  public static StageFailure invalidOutput(Stage stage, String message) {
    return new StageFailure(stage, message, List.of(), Optional.empty());
  }

  /**
   * Failure caused by required output fields being absent.
   *
   * @param stage failing stage
   * @param missingFields names of the missing fields
   * @return failure listing the fields
   */
  public static StageFailure missingFields(Stage stage, List<String> missingFields) {
    return new StageFailure(
        stage,
        "missing required fields: " + String.join(", ", missingFields),
        missingFields,
        Optional.empty());
  }

  /**
   * Renders the failure as {@code stage: message}.
   *
   * @return one-line description
   */
  public String describe() {
    return stage.tag() + ": " + message;
  }
}
