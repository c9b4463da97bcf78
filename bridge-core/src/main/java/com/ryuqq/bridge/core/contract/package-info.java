/**
 * 큐를 오가는 계약 타입.
 *
 * <ul>
 *   <li>{@link com.ryuqq.bridge.core.contract.WorkItem} - 작업 + 결과 핸들</li>
 *   <li>{@link com.ryuqq.bridge.core.contract.CompletionHandle} - 호출자 스케줄러에 묶인 단일 할당 결과 슬롯</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.core.contract;
