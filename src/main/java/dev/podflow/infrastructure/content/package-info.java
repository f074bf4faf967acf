/**
 * Content generation adapters: the Anthropic-backed generator and the transcript-derived fallback.
 */
package dev.podflow.infrastructure.content;
