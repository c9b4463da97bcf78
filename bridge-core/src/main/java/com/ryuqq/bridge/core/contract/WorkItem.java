package com.ryuqq.bridge.core.contract;

import com.ryuqq.bridge.core.outcome.Outcome;

import java.util.concurrent.Callable;

/**
 * 큐에 들어가는 작업 단위 (불변).
 *
 * <p>인자 없는 작업(operation)과, 그 결과를 특정 호출자에게 돌려줄
 * {@link CompletionHandle}을 묶은 봉투입니다. Future Bridge가 생성하고,
 * Worker Loop가 꺼내어 한 번 실행한 뒤 버립니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>sequence:</strong> 연결 단위 제출 순번 (로그/추적용, 1부터 증가)</li>
 *   <li><strong>handle:</strong> 결과 전달 핸들</li>
 *   <li><strong>operation:</strong> 호출자 인자를 캡처한 작업 (브리지에게는 불투명)</li>
 *   <li><strong>acceptedAt:</strong> 큐 진입 시각 (epoch milliseconds)</li>
 * </ul>
 *
 * @param sequence 제출 순번
 * @param handle 결과 전달 핸들
 * @param operation 실행할 작업
 * @param acceptedAt 큐 진입 시각 (epoch millis)
 * @param <T> 작업 반환 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkItem<T>(
    long sequence,
    CompletionHandle<T> handle,
    Callable<T> operation,
    long acceptedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 sequence/acceptedAt이 음수인 경우
     */
    public WorkItem {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (acceptedAt < 0) {
            throw new IllegalArgumentException("acceptedAt must be non-negative (current: " + acceptedAt + ")");
        }
    }

    /**
     * 현재 시각으로 WorkItem 생성.
     *
     * @param sequence 제출 순번
     * @param handle 결과 전달 핸들
     * @param operation 실행할 작업
     * @param <T> 작업 반환 타입
     * @return 생성된 WorkItem
     */
    public static <T> WorkItem<T> of(long sequence, CompletionHandle<T> handle, Callable<T> operation) {
        return new WorkItem<>(sequence, handle, operation, System.currentTimeMillis());
    }

    /**
     * 작업을 동기 실행하고 결과를 포착.
     *
     * <p>예외는 던지지 않고 {@link com.ryuqq.bridge.core.outcome.Fail}로 반환합니다.</p>
     *
     * @return 실행 결과
     */
    public Outcome<T> execute() {
        return Outcome.capture(operation);
    }

    /**
     * 실행 결과를 호출자에게 보고.
     *
     * @param outcome 실행 결과
     * @return 이번 보고로 핸들이 resolve되었으면 true
     */
    public boolean report(Outcome<T> outcome) {
        return handle.resolve(outcome);
    }

    @Override
    public String toString() {
        return "WorkItem{sequence=" + sequence + ", operation=" + operation + "}";
    }
}
