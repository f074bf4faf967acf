/**
 * Transcription adapters.
 */
package dev.podflow.infrastructure.transcription;
