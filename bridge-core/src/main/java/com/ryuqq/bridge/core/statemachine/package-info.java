/**
 * Connection lifecycle state machine package.
 *
 * <p>This package implements the state transition rules that gate submission
 * and drive the connect/close protocol.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bridge.core.statemachine.ConnectionState} - Connection lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.bridge.core.statemachine.StateTransition} - State transition validation and execution</li>
 *   <li>{@link com.ryuqq.bridge.core.statemachine.ConnectionClosedException} - Submission rejected by the current state</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * UNCONNECTED → CONNECTING (connect)
 * UNCONNECTED → CLOSED     (close before connect)
 * CONNECTING  → OPEN       (bootstrap succeeded)
 * CONNECTING  → CLOSED     (bootstrap failed)
 * OPEN        → CLOSING    (close requested)
 * CLOSING     → CLOSED     (teardown finished, success or not)
 *
 * Forbidden:
 * - CLOSED → * (terminal state)
 * - OPEN → CLOSED (must drain through CLOSING)
 * - Backward transitions (e.g., OPEN → CONNECTING)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ConnectionState state = ConnectionState.UNCONNECTED;
 * state = StateTransition.transition(state, ConnectionState.CONNECTING);
 * state = StateTransition.transition(state, ConnectionState.OPEN);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(state, ConnectionState.CLOSED);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.bridge.core.statemachine;
