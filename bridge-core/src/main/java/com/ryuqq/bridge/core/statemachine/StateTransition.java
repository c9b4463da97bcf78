package com.ryuqq.bridge.core.statemachine;

/**
 * 연결 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 연결 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>UNCONNECTED → CONNECTING</li>
 *   <li>UNCONNECTED → CLOSED</li>
 *   <li>CONNECTING → OPEN</li>
 *   <li>CONNECTING → CLOSED</li>
 *   <li>OPEN → CLOSING</li>
 *   <li>CLOSING → CLOSED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(CLOSED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>OPEN에서 CLOSED로 바로 갈 수 없음 (반드시 CLOSING을 거쳐 남은 작업 처리)</li>
 *   <li>역방향 전이 불가 (예: OPEN → CONNECTING)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ConnectionState from, ConnectionState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 종료 상태에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = isAllowed(from, to);

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * <p>검증을 통과한 경우에만 새로운 상태를 반환합니다.</p>
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ConnectionState transition(ConnectionState current, ConnectionState next) {
        validate(current, next);
        return next;
    }

    /**
     * 전이 허용 여부 (예외 없이).
     *
     * @param from 현재 상태 (non-null)
     * @param to 전이할 상태 (non-null)
     * @return 허용된 전이이면 true
     */
    public static boolean isAllowed(ConnectionState from, ConnectionState to) {
        return switch (from) {
            case UNCONNECTED -> to == ConnectionState.CONNECTING || to == ConnectionState.CLOSED;
            case CONNECTING -> to == ConnectionState.OPEN || to == ConnectionState.CLOSED;
            case OPEN -> to == ConnectionState.CLOSING;
            case CLOSING -> to == ConnectionState.CLOSED;
            case CLOSED -> false;
        };
    }
}
