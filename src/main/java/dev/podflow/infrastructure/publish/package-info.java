/**
 * Platform connectors: Art19 hosting, the show website and Twitter announcements.
 */
package dev.podflow.infrastructure.publish;
