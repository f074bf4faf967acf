/**
 * Typed outputs of the audio, transcription and content generation stages.
 */
package dev.podflow.domain.content;
