/**
 * Input validation helpers for configuration and CLI values.
 */
package dev.podflow.validation;
