package dev.podflow.domain.error;

/**
 * <strong>What:</strong> Signals a configuration problem that no retry can fix.
 * <p><strong>Why:</strong> Callers must be able to tell "nothing is enabled" apart from transient platform or
 * collaborator failures.</p>
 * <p><strong>Role:</strong> Raised by {@code PublishingCoordinator} when no platform is enabled and by the
 * composition root when a required collaborator cannot be built.</p>
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends PodflowException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a configuration exception.
   *
   * @param message description of the misconfiguration
   */
  public ConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates a configuration exception with a cause.
   *
   * @param message description of the misconfiguration
   * @param cause underlying failure
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
