/**
 * Logging setup and hygiene helpers.
 */
package dev.podflow.logging;
