package dev.podflow.domain.publish;

/**
 * <strong>What:</strong> Category of a publishing destination.
 * <p><strong>Role:</strong> Declaration order is the canonical episode URL priority: the host platform's URL wins
 * over the website's, which wins over a social post's.</p>
 *
 * @since 0.1.0
 */
public enum PlatformKind {
  /** Podcast hosting platform that serves the feed (e.g. Art19). */
  HOST,
  /** Show website. */
  WEBSITE,
  /** Social network announcement. */
  SOCIAL
}
