package com.ryuqq.bridge.core.statemachine;

/**
 * 연결(Connection)의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>UNCONNECTED → CONNECTING (최초 connect)</li>
 *   <li>UNCONNECTED → CLOSED (connect 없이 close)</li>
 *   <li>CONNECTING → OPEN (부트스트랩 성공)</li>
 *   <li>CONNECTING → CLOSED (부트스트랩 실패)</li>
 *   <li>OPEN → CLOSING (close 요청)</li>
 *   <li>CLOSING → CLOSED (teardown 종료, 성공/실패 무관)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * UNCONNECTED ──────────────┐
 *    │                      │
 *    ▼ (connect)            │
 * CONNECTING ───────────┐   │
 *    │ (부트스트랩 성공)   │ (부트스트랩 실패)
 *    ▼                  │   │
 * OPEN                  │   │
 *    │ (close)          │   │
 *    ▼                  ▼   ▼
 * CLOSING ──────────► CLOSED
 * </pre>
 *
 * <p>리소스 핸들은 OPEN 상태에서만 정확히 하나 존재합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ConnectionState {

    /**
     * 생성됨, 아직 connect 호출 전.
     */
    UNCONNECTED,

    /**
     * 부트스트랩 작업이 Worker 스레드에서 실행 중.
     */
    CONNECTING,

    /**
     * 리소스 핸들 보유, 작업 제출 가능.
     */
    OPEN,

    /**
     * close 요청됨, 남은 작업과 teardown을 처리 중.
     */
    CLOSING,

    /**
     * 종료 (리소스 없음, Worker 종료 또는 종료 중).
     */
    CLOSED;

    /**
     * 종료 상태인지 확인.
     *
     * @return CLOSED인 경우 true
     */
    public boolean isTerminal() {
        return this == CLOSED;
    }

    /**
     * 일반 작업 제출이 허용되는 상태인지 확인.
     *
     * <p>부트스트랩 작업은 CONNECTING 상태에서 내부적으로만 큐에 들어가며,
     * 외부 제출은 OPEN 상태에서만 허용됩니다.</p>
     *
     * @return OPEN인 경우 true
     */
    public boolean acceptsSubmissions() {
        return this == OPEN;
    }

    /**
     * close가 이미 시작되었거나 끝났는지 확인.
     *
     * @return CLOSING 또는 CLOSED인 경우 true
     */
    public boolean isShuttingDown() {
        return this == CLOSING || this == CLOSED;
    }
}
