package com.ryuqq.bridge.testkit.contract;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-threaded caller scheduler with a known thread name.
 *
 * <p>Tasks run in submission order, so it also stands in for an event loop when tests need
 * to observe the order in which callers resume.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NamedScheduler implements Executor, AutoCloseable {

    private final String threadName;
    private final ExecutorService delegate;
    private final AtomicInteger executeCount = new AtomicInteger();

    public NamedScheduler(String threadName) {
        this.threadName = threadName;
        this.delegate = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void execute(Runnable command) {
        executeCount.incrementAndGet();
        delegate.execute(command);
    }

    public String threadName() {
        return threadName;
    }

    /**
     * Number of tasks posted to this scheduler so far.
     *
     * @return execute() call count
     */
    public int executeCount() {
        return executeCount.get();
    }

    /**
     * Waits until every task posted so far has run.
     *
     * @param timeoutMs maximum wait
     * @return true if the scheduler caught up within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean drain(long timeoutMs) throws InterruptedException {
        CountDownLatch marker = new CountDownLatch(1);
        delegate.execute(marker::countDown);
        return marker.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        delegate.shutdownNow();
    }
}
