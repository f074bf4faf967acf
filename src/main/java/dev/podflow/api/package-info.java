/**
 * Command-line entry points: the {@code podflow} dispatcher and the {@code run} and {@code publish} commands.
 */
package dev.podflow.api;
