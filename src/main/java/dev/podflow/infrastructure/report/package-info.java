/**
 * JSON report output for CLI runs.
 */
package dev.podflow.infrastructure.report;
