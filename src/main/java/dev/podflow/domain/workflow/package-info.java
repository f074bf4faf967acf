/**
 * Workflow domain: the run request, its per-stage outcomes, state machine and terminal result.
 */
package dev.podflow.domain.workflow;
