package com.ryuqq.bridge.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkerConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkerConfigTest {

    @Test
    void 기본값() {
        // when
        WorkerConfig config = new WorkerConfig();

        // then
        assertThat(config.pollTimeoutMs()).isEqualTo(100);
        assertThat(config.threadNamePrefix()).isEqualTo("serial-bridge-worker");
        assertThat(config.daemon()).isTrue();
        assertThat(config.terminationTimeoutMs()).isEqualTo(5000);
    }

    @Test
    void with_메서드는_한_필드만_변경() {
        // given
        WorkerConfig base = new WorkerConfig();

        // when
        WorkerConfig changed = base.withPollTimeoutMs(10)
            .withThreadNamePrefix("db-worker")
            .withDaemon(false)
            .withTerminationTimeoutMs(250);

        // then
        assertThat(changed).isEqualTo(new WorkerConfig(10, "db-worker", false, 250));
        assertThat(base).isEqualTo(new WorkerConfig());
    }

    @Test
    void pollTimeoutMs_양수가_아니면_거부() {
        assertThatThrownBy(() -> new WorkerConfig().withPollTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pollTimeoutMs");
    }

    @Test
    void threadNamePrefix_blank_거부() {
        assertThatThrownBy(() -> new WorkerConfig().withThreadNamePrefix("  "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkerConfig().withThreadNamePrefix(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void terminationTimeoutMs_양수가_아니면_거부() {
        assertThatThrownBy(() -> new WorkerConfig().withTerminationTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("terminationTimeoutMs");
    }
}
