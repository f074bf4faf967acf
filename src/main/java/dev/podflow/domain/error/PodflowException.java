package dev.podflow.domain.error;

/**
 * <strong>What:</strong> Root of the unchecked exception hierarchy raised by podflow pipelines.
 * <p><strong>Why:</strong> Lets CLI and HTTP wrappers distinguish pipeline errors from unrelated runtime failures.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public class PodflowException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message human-readable description
   */
  public PodflowException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message human-readable description
   * @param cause underlying failure; may be {@code null}
   */
  public PodflowException(String message, Throwable cause) {
    super(message, cause);
  }
}
