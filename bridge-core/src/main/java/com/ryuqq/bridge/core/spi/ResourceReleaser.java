package com.ryuqq.bridge.core.spi;

/**
 * Teardown operation that releases the underlying resource handle.
 *
 * <p>Invoked on the worker thread as the last queued item of a connection.</p>
 *
 * @param <R> resource type
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceReleaser<R> {

    /**
     * Releases the resource.
     *
     * @param resource the resource handle being released
     * @throws Exception if releasing fails; the connection still ends up closed
     */
    void release(R resource) throws Exception;

    /**
     * Releaser for resources that are {@link AutoCloseable}.
     *
     * @param <R> resource type
     * @return a releaser calling {@link AutoCloseable#close()}
     */
    static <R extends AutoCloseable> ResourceReleaser<R> autoClosing() {
        return AutoCloseable::close;
    }
}
