package com.ryuqq.bridge.testkit.contract;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-thread-safe resource stand-in used by the contract tests.
 *
 * <p>Every access goes through {@link #enter()}/{@link #exit()}, which record how many
 * threads were inside the resource at once and whether any thread other than the one that
 * created it touched it. A correctly serialized bridge keeps {@link #maxConcurrentAccess()}
 * at 1 and {@link #foreignAccessCount()} at 0.</p>
 *
 * <p>The counter is a plain field on purpose: lost updates show up as a wrong total when
 * access is not serialized.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeResource implements AutoCloseable {

    private final Thread owner;
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();
    private final AtomicInteger foreignAccesses = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private final List<String> trace = new CopyOnWriteArrayList<>();

    private volatile Exception closeFailure;
    private volatile boolean closed;
    private int counter;

    /**
     * Creates a resource owned by the calling thread.
     */
    public FakeResource() {
        this.owner = Thread.currentThread();
    }

    /**
     * Appends an entry to the execution trace.
     *
     * @param entry trace entry
     * @return the entry
     */
    public String record(String entry) {
        enter();
        try {
            trace.add(entry);
            return entry;
        } finally {
            exit();
        }
    }

    /**
     * Read-modify-write on an unsynchronized counter, widened by a yield.
     *
     * @return counter value after the increment
     */
    public int increment() {
        enter();
        try {
            int current = counter;
            Thread.yield();
            counter = current + 1;
            return counter;
        } finally {
            exit();
        }
    }

    /**
     * Holds the resource for the given time, simulating a slow call.
     *
     * @param millis time to hold
     * @throws InterruptedException if interrupted while holding
     */
    public void hold(long millis) throws InterruptedException {
        enter();
        try {
            Thread.sleep(millis);
        } finally {
            exit();
        }
    }

    public int counter() {
        enter();
        try {
            return counter;
        } finally {
            exit();
        }
    }

    public Thread owner() {
        return owner;
    }

    public List<String> trace() {
        return Collections.unmodifiableList(new ArrayList<>(trace));
    }

    public int maxConcurrentAccess() {
        return maxConcurrent.get();
    }

    public int foreignAccessCount() {
        return foreignAccesses.get();
    }

    public int closeCount() {
        return closeCount.get();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Makes the next {@link #close()} fail with the given exception.
     *
     * @param failure exception to throw from close
     */
    public void failOnClose(Exception failure) {
        this.closeFailure = failure;
    }

    @Override
    public void close() throws Exception {
        closeCount.incrementAndGet();
        closed = true;
        Exception failure = closeFailure;
        if (failure != null) {
            throw failure;
        }
    }

    private void enter() {
        if (closed) {
            throw new IllegalStateException(new IOException("resource already closed"));
        }
        if (Thread.currentThread() != owner) {
            foreignAccesses.incrementAndGet();
        }
        int now = active.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
    }

    private void exit() {
        active.decrementAndGet();
    }
}
