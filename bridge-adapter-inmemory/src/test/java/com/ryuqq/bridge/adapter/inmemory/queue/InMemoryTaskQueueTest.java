package com.ryuqq.bridge.adapter.inmemory.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryTaskQueue 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryTaskQueueTest {

    private InMemoryTaskQueue<String> queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryTaskQueue<>();
    }

    @Test
    void poll_삽입_순서대로_반환() throws InterruptedException {
        // given
        queue.push("a");
        queue.push("b");
        queue.push("c");

        // when & then
        assertThat(queue.poll(10)).isEqualTo("a");
        assertThat(queue.poll(10)).isEqualTo("b");
        assertThat(queue.poll(10)).isEqualTo("c");
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void poll_빈_큐는_타임아웃_후_null() throws InterruptedException {
        // given
        long start = System.nanoTime();

        // when
        String polled = queue.poll(50);

        // then
        assertThat(polled).isNull();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(40);
    }

    @Test
    void poll_타임아웃_0은_즉시_반환() throws InterruptedException {
        assertThat(queue.poll(0)).isNull();

        queue.push("ready");
        assertThat(queue.poll(0)).isEqualTo("ready");
    }

    @Test
    void poll_대기_중_삽입되면_깨어남() throws Exception {
        // given
        ExecutorService producer = Executors.newSingleThreadExecutor();
        try {
            producer.submit(() -> {
                Thread.sleep(20);
                queue.push("late");
                return null;
            });

            // when
            String polled = queue.poll(TimeUnit.SECONDS.toMillis(5));

            // then
            assertThat(polled).isEqualTo("late");
        } finally {
            producer.shutdownNow();
        }
    }

    @Test
    void poll_인터럽트_시_InterruptedException() {
        // given
        Thread.currentThread().interrupt();

        // when & then
        assertThatThrownBy(() -> queue.poll(1000)).isInstanceOf(InterruptedException.class);
        assertThat(Thread.interrupted()).isFalse();
    }

    @Test
    void push_null_거부() {
        assertThatThrownBy(() -> queue.push(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("element cannot be null");
    }

    @Test
    void poll_음수_타임아웃_거부() {
        assertThatThrownBy(() -> queue.poll(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void push_다중_생산자_모두_전달() throws Exception {
        // given
        int producers = 4;
        int perProducer = 250;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch done = new CountDownLatch(producers);

        // when
        try {
            for (int p = 0; p < producers; p++) {
                int producerId = p;
                pool.execute(() -> {
                    for (int i = 0; i < perProducer; i++) {
                        queue.push(producerId + "-" + i);
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        // then: 생산자별 순서 유지
        assertThat(queue.size()).isEqualTo(producers * perProducer);
        List<String> drained = queue.drain();
        Set<String> unique = new HashSet<>(drained);
        assertThat(unique).hasSize(producers * perProducer);
        for (int p = 0; p < producers; p++) {
            String prefix = p + "-";
            List<String> own = new ArrayList<>();
            for (String element : drained) {
                if (element.startsWith(prefix)) {
                    own.add(element);
                }
            }
            for (int i = 0; i < perProducer; i++) {
                assertThat(own.get(i)).isEqualTo(prefix + i);
            }
        }
    }

    @Test
    void drain_남은_원소_전부_제거() {
        // given
        queue.push("x");
        queue.push("y");

        // when
        List<String> drained = queue.drain();

        // then
        assertThat(drained).containsExactly("x", "y");
        assertThat(queue.size()).isZero();
    }
}
