/**
 * Exception taxonomy for podflow pipelines.
 * <p><strong>Role:</strong> Fatal conditions only; per-platform failures are data
 * ({@link dev.podflow.domain.publish.PlatformResult}) and never appear here.
 *
 * @since 0.1.0
 */
package dev.podflow.domain.error;
