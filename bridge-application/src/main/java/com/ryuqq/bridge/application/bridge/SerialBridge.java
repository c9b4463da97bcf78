package com.ryuqq.bridge.application.bridge;

import com.ryuqq.bridge.core.spi.ResourceOperation;
import com.ryuqq.bridge.core.statemachine.ConnectionState;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 단일 스레드 전용 동기 리소스에 대한 비동기 브리지.
 *
 * <p>여러 스레드/스케줄러에서 동시에 제출된 작업을 하나의 직렬 실행 흐름으로 모아
 * 제출 순서대로 실행하고, 각 결과를 제출한 호출자의 스케줄러에서 돌려줍니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (SerialBridge&lt;Connection&gt; bridge = SerialConnections.open(connector, releaser)) {
 *     bridge.connect(callerExecutor).join();
 *
 *     bridge.submit(conn -&gt; conn.prepareStatement(sql).executeUpdate(), callerExecutor)
 *           .thenAccept(rows -&gt; ...);   // callerExecutor에서 재개
 * }
 * </pre>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>모든 호출자를 합쳐 제출 순서(FIFO)대로 리소스에 적용</li>
 *   <li>리소스에 대해 동시에 실행되는 작업은 최대 하나</li>
 *   <li>결과/예외는 반드시 제출한 호출자의 스케줄러에서 정확히 한 번 전달</li>
 *   <li>close 전에 수락된 작업은 모두 결과를 받음 (유실 없음)</li>
 * </ul>
 *
 * @param <R> 리소스 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SerialBridge<R> extends AutoCloseable {

    /**
     * 작업 제출 (기본 콜백 스케줄러 사용).
     *
     * @param operation 리소스에 대해 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과 future
     * @throws IllegalArgumentException operation이 null인 경우
     * @throws com.ryuqq.bridge.core.statemachine.ConnectionClosedException 연결이 OPEN이 아닌 경우
     * @see #submit(ResourceOperation, Executor)
     */
    <T> CompletableFuture<T> submit(ResourceOperation<R, T> operation);

    /**
     * 작업 제출.
     *
     * <p>호출자 스케줄러에 묶인 결과 핸들을 만들고, 작업을 큐에 넣은 뒤 즉시 반환합니다.
     * 반환된 future는 Worker 스레드가 아니라 {@code scheduler}에서 완료됩니다.</p>
     *
     * <p>연결이 OPEN이 아니면 큐에 넣지 않고 즉시 예외를 던집니다.</p>
     *
     * @param operation 리소스에 대해 실행할 작업
     * @param scheduler 결과를 전달받을 호출자 스케줄러
     * @param <T> 결과 타입
     * @return 작업 결과 future (작업이 던진 예외는 래핑 없이 전달)
     * @throws IllegalArgumentException operation 또는 scheduler가 null인 경우
     * @throws com.ryuqq.bridge.core.statemachine.ConnectionClosedException 연결이 OPEN이 아닌 경우
     */
    <T> CompletableFuture<T> submit(ResourceOperation<R, T> operation, Executor scheduler);

    /**
     * 연결 (기본 콜백 스케줄러 사용).
     *
     * @return 연결된 브리지 future
     * @see #connect(Executor)
     */
    CompletableFuture<SerialBridge<R>> connect();

    /**
     * 연결.
     *
     * <p>최초 호출이 Worker 스레드를 시작하고 부트스트랩 작업을 큐에 넣습니다.
     * 연결 중이거나 이미 연결된 경우 같은 부트스트랩 결과를 돌려줍니다 (멱등).
     * 부트스트랩이 실패하면 상태는 CLOSED가 되고 실패가 그대로 전달됩니다.</p>
     *
     * @param scheduler 결과를 전달받을 호출자 스케줄러
     * @return 연결된 브리지 future
     * @throws IllegalArgumentException scheduler가 null인 경우
     * @throws com.ryuqq.bridge.core.statemachine.ConnectionClosedException 이미 close가 시작된 경우
     */
    CompletableFuture<SerialBridge<R>> connect(Executor scheduler);

    /**
     * 비동기 종료 (기본 콜백 스케줄러 사용).
     *
     * @return 종료 완료 future
     * @see #closeAsync(Executor)
     */
    CompletableFuture<Void> closeAsync();

    /**
     * 비동기 종료.
     *
     * <p>teardown 작업을 큐에 넣어 앞서 수락된 작업을 모두 처리한 뒤 리소스를 해제합니다.
     * teardown 성공 여부와 무관하게 상태는 CLOSED로 전이하며, teardown 실패는
     * 반환된 future로 전달됩니다. 여러 번 호출해도 안전합니다 (멱등).</p>
     *
     * @param scheduler 결과를 전달받을 호출자 스케줄러
     * @return 종료 완료 future
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    CompletableFuture<Void> closeAsync(Executor scheduler);

    /**
     * 블로킹 종료 (try-with-resources).
     *
     * <p>{@link #closeAsync(Executor)}가 끝나고 Worker 스레드가 종료된 뒤, close 전에 수락된
     * 작업의 future가 호출자 스케줄러에서 모두 완료될 때까지 대기합니다.</p>
     *
     * @throws RuntimeException teardown 실패 또는 대기 중 인터럽트 발생 시
     */
    @Override
    void close();

    /**
     * 현재 연결 상태.
     *
     * @return 연결 상태 (동시성 하에서 즉시 낡을 수 있음, CLOSED는 영구)
     */
    ConnectionState state();

    /**
     * 작업 제출 가능 여부.
     *
     * @return 상태가 OPEN이면 true
     */
    default boolean isOpen() {
        return state().acceptsSubmissions();
    }
}
