package com.ryuqq.bridge.core.outcome;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * 작업 실행 결과.
 *
 * <p>Worker Loop가 하나의 작업을 실행한 뒤 만들어내는 결과이며, 두 가지 경우만 존재합니다:</p>
 * <ul>
 *   <li>{@link Ok}: 작업이 정상 반환됨 (반환값 포함, null 허용)</li>
 *   <li>{@link Fail}: 작업 실행 중 예외 발생 (원본 예외 그대로 보존)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;Integer&gt; outcome = Outcome.capture(() -&gt; counter.incrementAndGet());
 * if (outcome.isOk()) {
 *     Integer value = ((Ok&lt;Integer&gt;) outcome).value();
 * }
 * </pre>
 *
 * @param <T> 작업 반환 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * 작업을 실행하고 결과를 Outcome으로 포착.
     *
     * <p>어떤 예외가 발생해도 호출자에게 전파하지 않고 {@link Fail}로 변환합니다.
     * Worker Loop는 이 메서드 덕분에 개별 작업 실패로 중단되지 않습니다.</p>
     *
     * @param operation 실행할 작업
     * @param <T> 반환 타입
     * @return 실행 결과 (Ok 또는 Fail)
     * @throws IllegalArgumentException operation이 null인 경우
     */
    static <T> Outcome<T> capture(Callable<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        try {
            return Ok.of(operation.call());
        } catch (Throwable t) {
            return Fail.of(t);
        }
    }

    /**
     * {@code CompletableFuture} 완료 콜백 인자 (value, failure)를 Outcome으로 변환.
     *
     * <p>파생 stage에서 전달되는 {@link CompletionException} 래핑은 벗겨내어
     * 원본 예외를 보존합니다.</p>
     *
     * @param value 완료 값 (failure가 null일 때만 의미 있음)
     * @param failure 실패 원인 (성공 시 null)
     * @param <T> 값 타입
     * @return failure가 null이면 Ok, 아니면 Fail
     */
    static <T> Outcome<T> of(T value, Throwable failure) {
        if (failure == null) {
            return Ok.of(value);
        }
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return Fail.of(cause);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
