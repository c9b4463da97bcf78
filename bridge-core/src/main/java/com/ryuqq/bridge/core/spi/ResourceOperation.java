package com.ryuqq.bridge.core.spi;

/**
 * One synchronous call against the underlying resource.
 *
 * <p>Implementations are executed on the worker thread only and receive the
 * worker-confined resource handle. They must not let the handle escape.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CompletableFuture&lt;Integer&gt; rows =
 *     bridge.submit(conn -&gt; conn.createStatement().executeUpdate(sql));
 * </pre>
 *
 * @param <R> resource type
 * @param <T> result type
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceOperation<R, T> {

    /**
     * Runs the operation against the resource.
     *
     * @param resource the live resource handle
     * @return the operation result (may be null)
     * @throws Exception any failure; delivered raw to the submitting caller
     */
    T apply(R resource) throws Exception;
}
