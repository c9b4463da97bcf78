package com.ryuqq.bridge.core.spi;

/**
 * Task Queue SPI: thread-safe FIFO channel between submitters and the worker.
 *
 * <p>This interface abstracts the queue that carries work items from any number of
 * producer threads to exactly one consumer (the worker loop).</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Accepting items from multiple concurrent producers without blocking</li>
 *   <li>Handing items to the single consumer in exact push order</li>
 *   <li>Bounded-wait dequeue so the consumer can periodically re-check shutdown</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: push may be called from any thread at any time</li>
 *   <li>FIFO: no priority, no reordering</li>
 *   <li>Unbounded: push always succeeds while the process is alive (no backpressure)</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // producer side
 * queue.push(item);
 *
 * // consumer side
 * WorkItem&lt;?&gt; next = queue.poll(100);
 * if (next == null) {
 *     // timed out, re-check running flag
 * }
 * </pre>
 *
 * @param <E> element type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskQueue<E> {

    /**
     * Appends an element to the tail of the queue.
     *
     * <p>This method is non-blocking and always succeeds.</p>
     *
     * @param element the element to push
     * @throws IllegalArgumentException if element is null
     */
    void push(E element);

    /**
     * Removes the head of the queue, waiting up to {@code timeoutMs} for one to arrive.
     *
     * @param timeoutMs maximum wait in milliseconds (0 for a non-blocking poll)
     * @return the head element, or null if the queue stayed empty for the whole wait
     * @throws IllegalArgumentException if timeoutMs is negative
     * @throws InterruptedException if interrupted while waiting
     */
    E poll(long timeoutMs) throws InterruptedException;

    /**
     * Returns the number of elements waiting in the queue.
     *
     * @return queue size (a snapshot; may be stale under concurrency)
     */
    int size();

    /**
     * Returns whether the queue currently holds no elements.
     *
     * @return true if empty (a snapshot; may be stale under concurrency)
     */
    default boolean isEmpty() {
        return size() == 0;
    }
}
