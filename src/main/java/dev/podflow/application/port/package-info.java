/**
 * Ports consumed by the pipeline: the stage collaborators, the platform connector capability, metrics and time.
 */
package dev.podflow.application.port;
