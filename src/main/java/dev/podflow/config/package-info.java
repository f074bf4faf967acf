/**
 * Configuration loading (defaults, YAML, CLI), typed settings and the composition root.
 */
package dev.podflow.config;
