/**
 * 작업 실행 결과 (Ok, Fail).
 *
 * <p>Worker Loop는 모든 실행을 {@link com.ryuqq.bridge.core.outcome.Outcome}으로 포착한 뒤
 * 해당 작업의 {@link com.ryuqq.bridge.core.contract.CompletionHandle}에 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.core.outcome;
