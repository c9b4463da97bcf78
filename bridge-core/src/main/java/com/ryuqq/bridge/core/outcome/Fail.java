package com.ryuqq.bridge.core.outcome;

/**
 * 실패 결과.
 *
 * <p>작업 실행 중 발생한 예외를 래핑 없이 그대로 보존합니다.
 * 호출자는 자신이 제출한 작업이 던진 예외를 원형 그대로 받아야 하며,
 * 브리지가 재시도하거나 다른 예외로 변환하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>리소스가 던진 도메인 예외 (SQL 오류 등)</li>
 *   <li>부트스트랩 실패 (리소스 생성 불가)</li>
 *   <li>해제(teardown) 실패</li>
 * </ul>
 *
 * @param cause 원인 예외 (non-null)
 * @param <T> 작업 반환 타입 (실패이므로 값은 없음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail<T>(Throwable cause) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public Fail {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    /**
     * 실패 결과 생성.
     *
     * @param cause 원인 예외
     * @param <T> 작업 반환 타입
     * @return Fail 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static <T> Fail<T> of(Throwable cause) {
        return new Fail<>(cause);
    }
}
