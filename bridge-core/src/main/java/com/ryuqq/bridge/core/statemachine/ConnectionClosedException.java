package com.ryuqq.bridge.core.statemachine;

/**
 * 연결이 작업을 받을 수 없는 상태에서 제출을 시도한 경우.
 *
 * <p>제출 시점에 동기적으로 던져지며, 이 예외가 발생한 제출은 큐에 들어가지 않습니다.
 * 아직 connect되지 않았거나(UNCONNECTED, CONNECTING), 이미 close가 시작된 경우
 * (CLOSING, CLOSED) 모두 해당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConnectionClosedException extends IllegalStateException {

    private final ConnectionState state;

    /**
     * 생성자.
     *
     * @param state 제출 시점에 관측된 연결 상태
     */
    public ConnectionClosedException(ConnectionState state) {
        super("Connection closed (state: " + state + ")");
        this.state = state;
    }

    /**
     * 제출 시점에 관측된 연결 상태.
     *
     * @return 연결 상태
     */
    public ConnectionState getState() {
        return state;
    }
}
