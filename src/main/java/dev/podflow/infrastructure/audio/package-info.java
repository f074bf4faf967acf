/**
 * Audio conditioning adapters.
 */
package dev.podflow.infrastructure.audio;
