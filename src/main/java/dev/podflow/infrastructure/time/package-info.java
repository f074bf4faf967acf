/**
 * Time adapters implementing {@link dev.podflow.application.port.ClockPort}.
 */
package dev.podflow.infrastructure.time;
