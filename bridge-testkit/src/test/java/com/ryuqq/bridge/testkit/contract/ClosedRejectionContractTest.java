package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.core.statemachine.ConnectionClosedException;
import com.ryuqq.bridge.core.statemachine.ConnectionState;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: submissions outside OPEN are rejected synchronously.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Before connect: ConnectionClosedException(UNCONNECTED)</li>
 *   <li>While CLOSING: ConnectionClosedException(CLOSING), nothing enqueued</li>
 *   <li>After close: ConnectionClosedException(CLOSED), operation never executed</li>
 *   <li>connect() after close is rejected the same way</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ClosedRejectionContractTest extends AbstractContractTest {

    @Test
    void testClosedRejection_BeforeConnect_Throws() {
        // When/Then
        ConnectionClosedException exception = assertThrows(ConnectionClosedException.class,
            () -> connection.submit(r -> r.record("too-early"), caller));

        assertEquals(ConnectionState.UNCONNECTED, exception.getState());
        assertTrue(openedResources.isEmpty(), "rejected submit must not bootstrap");
    }

    @Test
    void testClosedRejection_WhileClosing_Throws() throws Exception {
        // Given: worker busy, so close stays in CLOSING
        FakeResource resource = connectBridge();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> blocker = connection.submit(r -> {
            entered.countDown();
            release.await();
            return r.record("blocker");
        }, caller);
        entered.await();
        CompletableFuture<Void> closed = connection.closeAsync(caller);
        assertConnectionState(connection, ConnectionState.CLOSING);
        int pendingBefore = connection.pendingCount();

        // When/Then
        ConnectionClosedException exception = assertThrows(ConnectionClosedException.class,
            () -> connection.submit(r -> r.record("late"), caller));
        assertEquals(ConnectionState.CLOSING, exception.getState());
        assertEquals(pendingBefore, connection.pendingCount(), "rejected work must not be enqueued");

        release.countDown();
        assertEquals("blocker", await(blocker));
        await(closed);
        assertFalse(resource.trace().contains("late"));
    }

    @Test
    void testClosedRejection_AfterClose_ThrowsAndNeverExecutes() throws Exception {
        // Given
        FakeResource resource = connectBridge();
        await(connection.closeAsync(caller));
        long processedBefore = connection.processedCount();

        // When/Then
        ConnectionClosedException exception = assertThrows(ConnectionClosedException.class,
            () -> connection.submit(r -> r.record("after-close"), caller));
        assertEquals(ConnectionState.CLOSED, exception.getState());
        assertTrue(exception.getMessage().contains("CLOSED"));

        assertWorkerTerminated(connection);
        assertEquals(processedBefore, connection.processedCount());
        assertTrue(resource.trace().isEmpty());
    }

    @Test
    void testClosedRejection_ConnectAfterClose_Throws() throws Exception {
        // Given
        connectBridge();
        await(connection.closeAsync(caller));

        // When/Then
        ConnectionClosedException exception = assertThrows(ConnectionClosedException.class,
            () -> connection.connect(caller));
        assertEquals(ConnectionState.CLOSED, exception.getState());
        assertEquals(1, openedResources.size(), "a closed connection must not reopen");
    }

    @Test
    void testClosedRejection_IsIllegalStateException() throws Exception {
        // Given
        await(connection.closeAsync(caller));

        // When/Then
        assertThrows(IllegalStateException.class,
            () -> connection.submit(r -> r.record("x"), caller));
    }
}
