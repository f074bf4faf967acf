package dev.podflow.domain.publish;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Aggregate of every platform's result for one episode.
 * <p><strong>Role:</strong> Returned by the publishing coordinator and attached to the workflow result.</p>
 * <p>{@code published} and {@code failed} partition the enabled platforms; {@code details} iterates in the
 * enabled-platform order.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param episodeId identifier of the published episode
 * @param published platforms that accepted the episode, in enabled order
 * @param failed platforms that did not, in enabled order
 * @param details per-platform results keyed by platform name, in enabled order
 * @param episodeUrl canonical episode URL chosen by platform priority, if any platform supplied one
 * @since 0.1.0
 */
public record PublishingOutcome(
    String episodeId,
    List<String> published,
    List<String> failed,
    Map<String, PlatformResult> details,
    Optional<String> episodeUrl) {

  public PublishingOutcome {
    if (episodeId == null || episodeId.isBlank()) {
      throw new IllegalArgumentException("episodeId must not be blank");
    }
    published = List.copyOf(published);
    failed = List.copyOf(failed);
    details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    episodeUrl = episodeUrl == null ? Optional.empty() : episodeUrl;
    for (String name : published) {
      if (failed.contains(name)) {
        throw new IllegalArgumentException("platform listed as both published and failed: " + name);
      }
    }
    if (published.size() + failed.size() != details.size()) {
      throw new IllegalArgumentException("published and failed must partition the detail map");
    }
  }

  /**
   * Builds an outcome by partitioning ordered results.
   *
   * @param episodeId episode identifier
   * @param results results in enabled-platform order
   * @param episodeUrl canonical URL, if resolved
   * @return outcome
   */
  public static PublishingOutcome of(
      String episodeId, List<PlatformResult> results, Optional<String> episodeUrl) {
    List<String> ok = new ArrayList<>();
    List<String> ko = new ArrayList<>();
    Map<String, PlatformResult> details = new LinkedHashMap<>();
    for (PlatformResult result : results) {
      if (details.putIfAbsent(result.platform(), result) != null) {
        throw new IllegalArgumentException("duplicate platform result: " + result.platform());
      }
      (result.success() ? ok : ko).add(result.platform());
    }
    return new PublishingOutcome(episodeId, ok, ko, details, episodeUrl);
  }

  /**
   * Indicates that no platform accepted the episode.
   *
   * @return {@code true} when the published list is empty
   */
  public boolean allFailed() {
    return published.isEmpty();
  }

  /**
   * Returns one platform's result.
   *
   * @param platform platform name
   * @return result, if the platform was enabled
   */
  public Optional<PlatformResult> result(String platform) {
    return Optional.ofNullable(details.get(platform));
  }
}
