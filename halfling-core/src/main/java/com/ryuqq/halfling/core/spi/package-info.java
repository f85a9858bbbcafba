/**
 * Service Provider Interfaces for the task engine.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.halfling.core.spi.TaskLauncher} - Starts one unit of concurrent work</li>
 * </ul>
 *
 * <p>The engine itself never creates threads. Every point where concurrency is introduced
 * ({@code runAsync} and the parallel fan-out) goes through a launcher, so a bounded pool can
 * replace the default thread-per-task strategy without changing task semantics.</p>
 *
 * @since 1.0.0
 * @author Halfling Team
 */
package com.ryuqq.halfling.core.spi;
