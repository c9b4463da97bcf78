/**
 * Service Provider Interfaces of the serial bridge.
 *
 * <ul>
 *   <li>{@link com.ryuqq.bridge.core.spi.TaskQueue} - FIFO channel from submitters to the worker</li>
 *   <li>{@link com.ryuqq.bridge.core.spi.ResourceConnector} - bootstrap (opens the resource on the worker)</li>
 *   <li>{@link com.ryuqq.bridge.core.spi.ResourceOperation} - one call against the resource</li>
 *   <li>{@link com.ryuqq.bridge.core.spi.ResourceReleaser} - teardown (releases the resource on the worker)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.core.spi;
