/**
 * In-memory Task Queue adapter.
 *
 * <p>{@link com.ryuqq.bridge.adapter.inmemory.queue.InMemoryTaskQueue} is the default
 * queue used by the runner adapter.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.inmemory.queue;
