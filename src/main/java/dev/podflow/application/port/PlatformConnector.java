package dev.podflow.application.port;

import dev.podflow.domain.publish.EpisodeData;
import dev.podflow.domain.publish.PlatformKind;
import dev.podflow.domain.publish.PlatformResult;

/**
 * <strong>What:</strong> One publishing destination's capability to accept an episode.
 * <p><strong>Role:</strong> Fan-out target of {@code PublishingCoordinator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Bound every remote call with a platform-appropriate timeout.</li>
 *   <li>Translate transport and API errors into {@link PlatformResult#failed(String, String)}.</li>
 *   <li>Never mutate the shared {@link EpisodeData}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #publish(EpisodeData)} runs on a fan-out worker thread; implementations
 * must tolerate being called concurrently with other connectors.</p>
 *
 * @since 0.1.0
 */
public interface PlatformConnector {
  /**
   * Returns the unique platform name used in outcomes, logs and metrics.
   *
   * @return platform name such as {@code art19}
   */
  String name();

  /**
   * Returns the platform category, which decides canonical URL priority.
   *
   * @return platform kind
   */
  PlatformKind kind();

  /**
   * Publishes the episode.
   *
   * @param episode shared read-only episode record
   * @return platform result whose {@code platform} equals {@link #name()}
   * @throws Exception only for unexpected faults; the coordinator records them as failures
   */
  PlatformResult publish(EpisodeData episode) throws Exception;
}
