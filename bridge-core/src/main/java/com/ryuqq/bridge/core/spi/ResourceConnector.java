package com.ryuqq.bridge.core.spi;

/**
 * Bootstrap operation that creates the underlying resource handle.
 *
 * <p>Always invoked on the worker thread, exactly once per connection, so the
 * handle is constructed on the same thread that will use it for its whole lifetime.</p>
 *
 * @param <R> resource type (for example a JDBC {@code Connection})
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceConnector<R> {

    /**
     * Opens the underlying resource.
     *
     * @return the resource handle (must not be null)
     * @throws Exception if the resource cannot be opened; delivered to the connect caller
     */
    R connect() throws Exception;
}
