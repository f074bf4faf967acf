package dev.podflow.domain.publish;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Outcome of publishing one episode to one platform.
 * <p><strong>Role:</strong> Returned by connectors; synthesized by the publishing coordinator when a connector
 * throws instead of returning.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param platform platform name as configured
 * @param success whether the platform accepted the episode
 * @param publishedUrl public URL, when the platform supplied one
 * @param remoteId platform-side identifier (episode or post id)
 * @param error human-readable error; present exactly when {@code success} is {@code false}
 * @param attributes extra platform-specific details (e.g. {@code status})
 * @since 0.1.0
 */
public record PlatformResult(
    String platform,
    boolean success,
    Optional<String> publishedUrl,
    Optional<String> remoteId,
    Optional<String> error,
    Map<String, String> attributes) {

  public PlatformResult {
    if (platform == null || platform.isBlank()) {
      throw new IllegalArgumentException("platform must not be blank");
    }
    publishedUrl = publishedUrl == null ? Optional.empty() : publishedUrl.filter(s -> !s.isBlank());
    remoteId = remoteId == null ? Optional.empty() : remoteId.filter(s -> !s.isBlank());
    error = error == null ? Optional.empty() : error;
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    if (success && error.isPresent()) {
      throw new IllegalArgumentException("successful result must not carry an error");
    }
    if (!success && error.filter(s -> !s.isBlank()).isEmpty()) {
      throw new IllegalArgumentException("failed result requires an error message");
    }
  }

  /**
   * Successful publication.
   *
   * @param platform platform name
   * @param publishedUrl public URL or {@code null}
   * @param remoteId platform identifier or {@code null}
   * @return successful result
   */
  public static PlatformResult published(String platform, String publishedUrl, String remoteId) {
    return published(platform, publishedUrl, remoteId, Map.of());
  }

  /**
   * Successful publication with extra attributes.
   *
   * @param platform platform name
   * @param publishedUrl public URL or {@code null}
   * @param remoteId platform identifier or {@code null}
   * @param attributes platform-specific details
   * @return successful result
   */
  public static PlatformResult published(
      String platform, String publishedUrl, String remoteId, Map<String, String> attributes) {
    return new PlatformResult(
        platform,
        true,
        Optional.ofNullable(publishedUrl),
        Optional.ofNullable(remoteId),
        Optional.empty(),
        attributes);
  }

  /**
   * Failed publication.
   *
   * @param platform platform name
   * @param error human-readable reason
   * @return failed result
   */
  public static PlatformResult failed(String platform, String error) {
    return new PlatformResult(
        platform, false, Optional.empty(), Optional.empty(), Optional.of(error), Map.of());
  }

  /**
   * Failure synthesized from an exception that escaped a connector.
   *
   * @param platform platform name
   * @param error escaped exception
   * @return failed result with {@code ExceptionType: message}
   */
  public static PlatformResult fromException(String platform, Throwable error) {
    Objects.requireNonNull(error, "error");
    String message = error.getMessage();
    String text = error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    return failed(platform, text);
  }
}
