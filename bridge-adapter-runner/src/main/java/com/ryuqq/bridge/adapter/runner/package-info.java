/**
 * Runner Adapter Layer - SerialBridge 구현체.
 *
 * <p>이 패키지는 SerialBridge 인터페이스의 구체적인 구현체와 Worker Loop를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.SerialConnection} - Future Bridge + 연결 생명주기</li>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.WorkerLoop} - 전용 Worker 스레드에서 도는 단일 소비자 루프</li>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.SerialConnections} - 생성 진입점</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (SerialConnection, WorkerLoop)
 *   ↓ implements
 * application (SerialBridge, WorkerRuntime)
 *   ↓ depends on
 * core (WorkItem, CompletionHandle, Outcome, ConnectionState)
 *   ↓ depends on
 * core/spi (TaskQueue, ResourceConnector, ResourceOperation, ResourceReleaser)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.runner;
