/**
 * Pipeline use cases: the sequential workflow and the concurrent publishing fan-out.
 */
package dev.podflow.application.pipeline;
