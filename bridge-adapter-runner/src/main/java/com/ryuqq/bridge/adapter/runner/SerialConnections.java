package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.adapter.inmemory.queue.InMemoryTaskQueue;
import com.ryuqq.bridge.application.bridge.SerialBridge;
import com.ryuqq.bridge.core.contract.WorkItem;
import com.ryuqq.bridge.core.spi.ResourceConnector;
import com.ryuqq.bridge.core.spi.ResourceReleaser;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * SerialConnection 생성 진입점.
 *
 * <p>{@code open(..)}은 아직 연결되지 않은 연결 객체를 반환하고 (Worker 스레드 미시작),
 * {@code connect(..)}는 생성과 연결을 한 번에 수행하여 OPEN 상태 브리지의 future를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // JDBC Connection 은 AutoCloseable 이므로 releaser 생략 가능
 * SerialBridge&lt;Connection&gt; bridge = SerialConnections
 *     .connect(() -&gt; DriverManager.getConnection(url), callerExecutor)
 *     .join();
 * </pre>
 *
 * <p>기본 구성: {@link InMemoryTaskQueue}, {@link WorkerConfig#WorkerConfig()},
 * 콜백 스케줄러 {@link ForkJoinPool#commonPool()}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SerialConnections {

    // Utility class - prevent instantiation
    private SerialConnections() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 연결 객체 생성 (기본 설정).
     *
     * @param connector 부트스트랩
     * @param releaser teardown
     * @param <R> 리소스 타입
     * @return UNCONNECTED 상태의 연결
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <R> SerialConnection<R> open(ResourceConnector<R> connector, ResourceReleaser<R> releaser) {
        return open(connector, releaser, new WorkerConfig());
    }

    /**
     * 연결 객체 생성.
     *
     * @param connector 부트스트랩
     * @param releaser teardown
     * @param config Worker 설정
     * @param <R> 리소스 타입
     * @return UNCONNECTED 상태의 연결
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <R> SerialConnection<R> open(
        ResourceConnector<R> connector,
        ResourceReleaser<R> releaser,
        WorkerConfig config
    ) {
        return new SerialConnection<>(connector, releaser, new InMemoryTaskQueue<WorkItem<?>>(), config, ForkJoinPool.commonPool());
    }

    /**
     * AutoCloseable 리소스용 연결 객체 생성 (teardown = {@link AutoCloseable#close()}).
     *
     * @param connector 부트스트랩
     * @param <R> 리소스 타입
     * @return UNCONNECTED 상태의 연결
     * @throws IllegalArgumentException connector가 null인 경우
     */
    public static <R extends AutoCloseable> SerialConnection<R> open(ResourceConnector<R> connector) {
        return open(connector, ResourceReleaser.<R>autoClosing());
    }

    /**
     * AutoCloseable 리소스용 연결 생성 및 연결.
     *
     * @param connector 부트스트랩
     * @param scheduler 결과를 전달받을 호출자 스케줄러
     * @param <R> 리소스 타입
     * @return OPEN 상태 브리지 future (부트스트랩 실패 시 원본 예외로 실패)
     */
    public static <R extends AutoCloseable> CompletableFuture<SerialBridge<R>> connect(
        ResourceConnector<R> connector,
        Executor scheduler
    ) {
        return open(connector).connect(scheduler);
    }

    /**
     * 연결 생성 및 연결.
     *
     * @param connector 부트스트랩
     * @param releaser teardown
     * @param config Worker 설정
     * @param scheduler 결과를 전달받을 호출자 스케줄러
     * @param <R> 리소스 타입
     * @return OPEN 상태 브리지 future (부트스트랩 실패 시 원본 예외로 실패)
     */
    public static <R> CompletableFuture<SerialBridge<R>> connect(
        ResourceConnector<R> connector,
        ResourceReleaser<R> releaser,
        WorkerConfig config,
        Executor scheduler
    ) {
        return open(connector, releaser, config).connect(scheduler);
    }
}
