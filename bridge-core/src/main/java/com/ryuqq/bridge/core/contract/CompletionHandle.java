package com.ryuqq.bridge.core.contract;

import com.ryuqq.bridge.core.outcome.Fail;
import com.ryuqq.bridge.core.outcome.Ok;
import com.ryuqq.bridge.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 호출자 스케줄러에 묶인 단일 할당 결과 슬롯.
 *
 * <p>하나의 제출(submit)마다 하나씩 생성되며, 오직 그 제출을 한 호출자만 결과를 관측합니다.
 * 결과는 Worker 스레드에서 직접 기록되지 않고, 생성 시 지정된 스케줄러({@link Executor})에
 * "이 future를 완료하라"는 작업을 게시하는 방식(message passing)으로 전달됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>resolve는 최대 한 번만 효과가 있음 (두 번째 이후 호출은 no-op, 예외 아님)</li>
 *   <li>호출자가 future를 먼저 취소/완료(abandon)해도 이후 resolve는 안전하게 무시됨</li>
 *   <li>완료는 바인딩된 스케줄러에서 수행되므로, future에 등록된 후속 작업은
 *       호출자 자신의 스케줄러에서 재개됨</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CompletionHandle&lt;Integer&gt; handle = CompletionHandle.bind(callerExecutor);
 * queue.push(WorkItem.of(1, handle, () -&gt; 42));
 * handle.future().thenAccept(value -&gt; ...); // callerExecutor에서 실행
 * </pre>
 *
 * @param <T> 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompletionHandle<T> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandle.class);

    private final CompletableFuture<T> future;
    private final Executor scheduler;
    private final AtomicBoolean resolved;

    private CompletionHandle(Executor scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.future = new CompletableFuture<>();
        this.scheduler = scheduler;
        this.resolved = new AtomicBoolean(false);
    }

    /**
     * 지정한 스케줄러에 묶인 미해결 핸들 생성.
     *
     * @param scheduler 결과를 전달받을 호출자 스케줄러
     * @param <T> 결과 타입
     * @return 새 핸들
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public static <T> CompletionHandle<T> bind(Executor scheduler) {
        return new CompletionHandle<>(scheduler);
    }

    /**
     * 호출자가 대기/합성할 future.
     *
     * @return 이 핸들의 future
     */
    public CompletableFuture<T> future() {
        return future;
    }

    /**
     * 바인딩된 스케줄러.
     *
     * @return 호출자 스케줄러
     */
    public Executor scheduler() {
        return scheduler;
    }

    /**
     * 이미 resolve 되었는지 확인.
     *
     * @return resolve가 한 번이라도 수락되었거나 future가 이미 완료된 경우 true
     */
    public boolean isResolved() {
        return resolved.get() || future.isDone();
    }

    /**
     * Outcome으로 핸들 resolve.
     *
     * <p>최초 호출만 효과가 있으며, 완료 작업을 바인딩된 스케줄러에 게시합니다.
     * 스케줄러가 작업을 거부하면(이미 종료된 경우) 경고 로그를 남기고 호출 스레드에서
     * 직접 완료합니다. 이 경우에도 future는 미해결 상태로 남지 않습니다.</p>
     *
     * @param outcome 실행 결과
     * @return 이번 호출이 resolve를 수행했으면 true, 이미 resolve된 경우 false
     * @throws IllegalArgumentException outcome이 null인 경우
     */
    public boolean resolve(Outcome<T> outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (!resolved.compareAndSet(false, true)) {
            return false;
        }

        Runnable completion = () -> complete(outcome);
        try {
            scheduler.execute(completion);
        } catch (RejectedExecutionException e) {
            log.warn("Caller scheduler rejected completion, completing inline", e);
            completion.run();
        } catch (RuntimeException e) {
            log.error("Caller scheduler failed to accept completion, completing inline", e);
            completion.run();
        }
        return true;
    }

    /**
     * 값으로 resolve.
     *
     * @param value 결과 값 (null 허용)
     * @return 이번 호출이 resolve를 수행했으면 true
     */
    public boolean resolveValue(T value) {
        return resolve(Ok.of(value));
    }

    /**
     * 실패로 resolve.
     *
     * @param cause 실패 원인
     * @return 이번 호출이 resolve를 수행했으면 true
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public boolean resolveFailure(Throwable cause) {
        return resolve(Fail.of(cause));
    }

    /**
     * 다른 future의 결과를 이 핸들로 전달.
     *
     * <p>공유된 내부 future(부트스트랩, teardown)를 호출자마다 별도 핸들로
     * 재개시킬 때 사용합니다.</p>
     *
     * @param source 결과를 가져올 future
     * @return 이 핸들의 future
     * @throws IllegalArgumentException source가 null인 경우
     */
    public CompletableFuture<T> follow(CompletableFuture<? extends T> source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        source.whenComplete((value, failure) -> resolve(Outcome.<T>of(value, failure)));
        return future;
    }

    private void complete(Outcome<T> outcome) {
        if (outcome instanceof Ok<T> ok) {
            future.complete(ok.value());
        } else if (outcome instanceof Fail<T> fail) {
            future.completeExceptionally(fail.cause());
        }
    }

    @Override
    public String toString() {
        return "CompletionHandle{resolved=" + isResolved() + ", future=" + future + "}";
    }
}
