/**
 * Worker runtime port.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.application.runtime;
