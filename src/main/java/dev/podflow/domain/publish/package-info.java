/**
 * Publishing domain: the episode record shared by the fan-out and the per-platform and aggregate outcomes.
 */
package dev.podflow.domain.publish;
