/**
 * OpenTelemetry metrics adapter and bootstrap.
 */
package dev.podflow.infrastructure.metrics;
