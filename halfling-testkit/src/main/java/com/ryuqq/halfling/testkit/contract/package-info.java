/**
 * Task contract test suites.
 *
 * <p>{@link com.ryuqq.halfling.testkit.contract.AbstractTaskContractTest} supplies the launcher
 * lifecycle, fixtures and assertions. The abstract suites built on it describe behavior every
 * {@link com.ryuqq.halfling.core.spi.TaskLauncher} must preserve:</p>
 * <ul>
 *   <li>{@link com.ryuqq.halfling.testkit.contract.MonadLawContract} - left/right identity, associativity</li>
 *   <li>{@link com.ryuqq.halfling.testkit.contract.ParallelContract} - ordering and aggregation of parallel groups</li>
 *   <li>{@link com.ryuqq.halfling.testkit.contract.RecoveryContract} - recovery, spentness, laziness</li>
 * </ul>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
package com.ryuqq.halfling.testkit.contract;
