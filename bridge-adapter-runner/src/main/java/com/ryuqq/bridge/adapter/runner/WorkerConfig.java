package com.ryuqq.bridge.adapter.runner;

/**
 * Worker Loop 및 연결 설정 (불변 record).
 *
 * <p>이 record는 WorkerLoop와 SerialConnection의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollTimeoutMs: 큐 대기 최대 시간, 유휴 상태에서 running 플래그 재확인 주기 (기본 100ms)</li>
 *   <li>threadNamePrefix: Worker 스레드 이름 접두사 (기본 "serial-bridge-worker")</li>
 *   <li>daemon: Worker 스레드 데몬 여부 (기본 true)</li>
 *   <li>terminationTimeoutMs: 블로킹 close()가 Worker 종료를 기다리는 최대 시간 (기본 5000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>빠른 종료: pollTimeoutMs 감소 (100 → 10), 유휴 시 CPU 사용량은 증가</li>
 *   <li>JVM 종료를 Worker가 막아야 하는 경우: daemon=false</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollTimeoutMs 큐 대기 시간 (밀리초, 양수여야 함)
 * @param threadNamePrefix Worker 스레드 이름 접두사 (blank 불가)
 * @param daemon Worker 스레드 데몬 여부
 * @param terminationTimeoutMs Worker 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record WorkerConfig(
    long pollTimeoutMs,
    String threadNamePrefix,
    boolean daemon,
    long terminationTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollTimeoutMs=100ms, threadNamePrefix="serial-bridge-worker",
     * daemon=true, terminationTimeoutMs=5000ms</p>
     */
    public WorkerConfig() {
        this(100, "serial-bridge-worker", true, 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerConfig {
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "pollTimeoutMs must be positive (current: " + pollTimeoutMs + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (terminationTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "terminationTimeoutMs must be positive (current: " + terminationTimeoutMs + ")"
            );
        }
    }

    /**
     * pollTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withPollTimeoutMs(long pollTimeoutMs) {
        return new WorkerConfig(pollTimeoutMs, threadNamePrefix, daemon, terminationTimeoutMs);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withThreadNamePrefix(String threadNamePrefix) {
        return new WorkerConfig(pollTimeoutMs, threadNamePrefix, daemon, terminationTimeoutMs);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withDaemon(boolean daemon) {
        return new WorkerConfig(pollTimeoutMs, threadNamePrefix, daemon, terminationTimeoutMs);
    }

    /**
     * terminationTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withTerminationTimeoutMs(long terminationTimeoutMs) {
        return new WorkerConfig(pollTimeoutMs, threadNamePrefix, daemon, terminationTimeoutMs);
    }
}
