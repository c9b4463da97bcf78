package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.application.bridge.SerialBridge;
import com.ryuqq.bridge.core.statemachine.ConnectionState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

/**
 * SerialConnections 팩토리 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SerialConnectionsTest {

    @Mock
    private AutoCloseable resource;

    @Test
    void open_UNCONNECTED_상태로_생성() {
        // when
        SerialConnection<AutoCloseable> connection = SerialConnections.open(() -> resource);

        // then
        assertThat(connection.state()).isEqualTo(ConnectionState.UNCONNECTED);
        assertThat(connection.isWorkerAlive()).isFalse();
        connection.close();
    }

    @Test
    void connect_AutoCloseable_리소스는_close로_해제() throws Exception {
        // when
        SerialBridge<AutoCloseable> bridge = SerialConnections.connect(() -> resource, Runnable::run)
            .get(5, TimeUnit.SECONDS);
        bridge.close();

        // then
        assertThat(bridge.state()).isEqualTo(ConnectionState.CLOSED);
        verify(resource).close();
    }

    @Test
    void connect_설정의_스레드_이름_사용() throws Exception {
        // given
        WorkerConfig config = new WorkerConfig().withThreadNamePrefix("custom-io");

        // when
        SerialBridge<AutoCloseable> bridge = SerialConnections.connect(
            () -> resource, AutoCloseable::close, config, Runnable::run
        ).get(5, TimeUnit.SECONDS);
        String workerName = bridge.submit(r -> Thread.currentThread().getName(), Runnable::run)
            .get(5, TimeUnit.SECONDS);
        bridge.close();

        // then
        assertThat(workerName).startsWith("custom-io-");
    }
}
