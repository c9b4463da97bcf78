package com.ryuqq.bridge.core.outcome;

/**
 * 성공 결과.
 *
 * <p>작업이 예외 없이 반환되었음을 나타냅니다.</p>
 *
 * @param value 작업 반환값 (null 허용, 예: {@code Void} 작업)
 * @param <T> 반환 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * 성공 결과 생성.
     *
     * @param value 반환값 (null 허용)
     * @param <T> 반환 타입
     * @return Ok 인스턴스
     */
    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }
}
