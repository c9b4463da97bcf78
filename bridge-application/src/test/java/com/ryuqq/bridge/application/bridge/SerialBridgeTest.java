package com.ryuqq.bridge.application.bridge;

import com.ryuqq.bridge.core.spi.ResourceOperation;
import com.ryuqq.bridge.core.statemachine.ConnectionState;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SerialBridge 기본 메서드 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SerialBridgeTest {

    /**
     * 고정된 상태만 보고하는 스텁.
     */
    private static final class FixedStateBridge implements SerialBridge<Object> {
        private final ConnectionState state;

        FixedStateBridge(ConnectionState state) {
            this.state = state;
        }

        @Override
        public <T> CompletableFuture<T> submit(ResourceOperation<Object, T> operation) {
            throw new UnsupportedOperationException();
        }

        @Override
        public <T> CompletableFuture<T> submit(ResourceOperation<Object, T> operation, Executor scheduler) {
            throw new UnsupportedOperationException();
        }

        @Override
        public CompletableFuture<SerialBridge<Object>> connect() {
            throw new UnsupportedOperationException();
        }

        @Override
        public CompletableFuture<SerialBridge<Object>> connect(Executor scheduler) {
            throw new UnsupportedOperationException();
        }

        @Override
        public CompletableFuture<Void> closeAsync() {
            throw new UnsupportedOperationException();
        }

        @Override
        public CompletableFuture<Void> closeAsync(Executor scheduler) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void close() {
        }

        @Override
        public ConnectionState state() {
            return state;
        }
    }

    @ParameterizedTest
    @EnumSource(ConnectionState.class)
    void isOpen_OPEN일_때만_true(ConnectionState state) {
        // given
        SerialBridge<Object> bridge = new FixedStateBridge(state);

        // when
        boolean open = bridge.isOpen();

        // then
        assertThat(open).isEqualTo(state == ConnectionState.OPEN);
    }
}
