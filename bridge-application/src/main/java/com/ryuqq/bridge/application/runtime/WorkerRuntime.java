package com.ryuqq.bridge.application.runtime;

/**
 * Single-consumer worker runtime.
 *
 * <p>This interface defines the loop that is the only code path allowed to
 * touch the underlying resource.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * run() starts on the dedicated worker thread
 *   ↓
 * loop:
 *   1. pump(): poll one work item (bounded wait)
 *      a. item → execute synchronously → report Ok/Fail to its handle
 *      b. timeout → return false
 *   2. nothing polled and not running → exit
 * </pre>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>One failing item never stops the loop</li>
 *   <li>Items keep being drained after {@link #stop()} until the queue is empty</li>
 *   <li>Every dequeued item runs to completion; there is no mid-flight cancellation</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkerRuntime extends Runnable {

    /**
     * Executes a single pump cycle: poll, execute, report.
     *
     * @return true if an item was processed, false if the poll timed out
     * @throws InterruptedException if interrupted while waiting for an item
     */
    boolean pump() throws InterruptedException;

    /**
     * Runs pump cycles until stopped and drained.
     */
    @Override
    void run();

    /**
     * Requests the loop to exit once the queue is drained.
     *
     * <p>Idempotent. Items already queued are still processed.</p>
     */
    void stop();

    /**
     * Returns whether the loop still accepts new work.
     *
     * @return false once {@link #stop()} was called
     */
    boolean isRunning();
}
