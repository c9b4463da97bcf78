/**
 * Serial bridge port.
 *
 * <p>The single entry point the proxy layer talks to: {@code submit} plus the
 * lifecycle operations {@code connect} and {@code close}.</p>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (SerialConnection)
 *   ↓ implements
 * application (SerialBridge interface)
 *   ↓ depends on
 * core (WorkItem, CompletionHandle, Outcome, ConnectionState, SPI)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.application.bridge;
