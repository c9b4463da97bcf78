package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.adapter.runner.SerialConnection;
import com.ryuqq.bridge.adapter.runner.SerialConnections;
import com.ryuqq.bridge.adapter.runner.WorkerConfig;
import com.ryuqq.bridge.core.spi.ResourceConnector;
import com.ryuqq.bridge.core.spi.ResourceReleaser;
import com.ryuqq.bridge.core.statemachine.ConnectionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Every test gets a fresh {@link SerialConnection} over {@link FakeResource}, wired with
 * the in-memory queue and a short worker poll timeout, plus a single-threaded caller
 * scheduler named {@value #CALLER_THREAD}.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() throws Exception {
 *         connectBridge();
 *
 *         String result = await(connection.submit(r -&gt; r.record("a"), caller));
 *
 *         assertEquals("a", result);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final long TIMEOUT_SECONDS = 5;
    protected static final String CALLER_THREAD = "contract-caller";
    protected static final String WORKER_PREFIX = "contract-worker";

    protected NamedScheduler caller;
    protected List<FakeResource> openedResources;
    protected SerialConnection<FakeResource> connection;

    private final List<NamedScheduler> schedulers = new ArrayList<>();
    private final List<SerialConnection<?>> connections = new ArrayList<>();

    /**
     * Sets up test fixtures before each test.
     *
     * <p>The connection is created but not connected.</p>
     */
    @BeforeEach
    void setUpBridge() {
        caller = newScheduler(CALLER_THREAD);
        openedResources = new CopyOnWriteArrayList<>();
        connection = newConnection(this::openFakeResource, ResourceReleaser.autoClosing());
    }

    /**
     * Closes every connection and scheduler the test created.
     *
     * <p>Teardown failures staged by a test are expected here and not rethrown.</p>
     */
    @AfterEach
    void tearDownBridge() throws Exception {
        for (SerialConnection<?> created : connections) {
            created.closeAsync(Runnable::run)
                .handle((ignored, failure) -> null)
                .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            created.awaitTermination(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));
        }
        for (NamedScheduler scheduler : schedulers) {
            scheduler.close();
        }
    }

    /**
     * Worker settings used by {@link #newConnection}.
     */
    protected WorkerConfig workerConfig() {
        return new WorkerConfig()
            .withPollTimeoutMs(20)
            .withThreadNamePrefix(WORKER_PREFIX)
            .withTerminationTimeoutMs(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));
    }

    protected SerialConnection<FakeResource> newConnection(
        ResourceConnector<FakeResource> connector,
        ResourceReleaser<FakeResource> releaser
    ) {
        SerialConnection<FakeResource> created = SerialConnections.open(connector, releaser, workerConfig());
        connections.add(created);
        return created;
    }

    protected NamedScheduler newScheduler(String threadName) {
        NamedScheduler scheduler = new NamedScheduler(threadName);
        schedulers.add(scheduler);
        return scheduler;
    }

    /**
     * Default connector: creates a {@link FakeResource} on the calling (worker) thread.
     */
    protected FakeResource openFakeResource() {
        FakeResource resource = new FakeResource();
        openedResources.add(resource);
        return resource;
    }

    /**
     * Connects the default connection and waits until it is OPEN.
     *
     * @return the single resource opened by the bootstrap
     */
    protected FakeResource connectBridge() throws Exception {
        await(connection.connect(caller));
        assertConnectionState(connection, ConnectionState.OPEN);
        assertEquals(1, openedResources.size(), "bootstrap should open exactly one resource");
        return openedResources.get(0);
    }

    protected <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Waits for the future to fail and returns the raw cause it failed with.
     */
    protected Throwable awaitFailure(CompletableFuture<?> future) throws Exception {
        ExecutionException exception = assertThrows(ExecutionException.class,
            () -> future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS),
            "future should complete exceptionally");
        return exception.getCause();
    }

    protected void assertConnectionState(SerialConnection<?> target, ConnectionState expected) {
        assertEquals(expected, target.state(),
            () -> "Expected connection state " + expected + " but was " + target.state());
    }

    protected void assertWorkerTerminated(SerialConnection<?> target) throws InterruptedException {
        assertTrue(target.awaitTermination(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS)),
            "worker thread should terminate");
        assertFalse(target.isWorkerAlive(), "worker thread should not be alive");
    }
}
