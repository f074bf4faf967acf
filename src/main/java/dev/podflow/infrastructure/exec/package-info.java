/**
 * Executor factories for the publishing fan-out pool.
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe; each call returns a new executor owned by the
 * caller.</p>
 * <p><strong>Observability:</strong> Worker threads are named {@code podflow-publish-N} so thread dumps and logs
 * identify publish tasks.</p>
 */
package dev.podflow.infrastructure.exec;
