/**
 * Fan-out / fan-in combinators.
 *
 * <p>This package builds {@code PARALLEL} tasks from a fixed or variable set of tasks.</p>
 *
 * <h2>Combinators</h2>
 * <ul>
 *   <li>{@link com.ryuqq.halfling.core.combinator.Tasks#mapply} - Run branches concurrently, combine with a gather function</li>
 *   <li>{@link com.ryuqq.halfling.core.combinator.Tasks#zip} - mapply with a list constructor</li>
 *   <li>{@link com.ryuqq.halfling.core.combinator.Tasks#sequencedPar} - zip, then re-wrap in the input's shape</li>
 *   <li>{@link com.ryuqq.halfling.core.combinator.Tasks#sequenced} - Same shape rules, elements run one after another</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <p>Branches are launched in declaration order and results are collected in declaration
 * order regardless of completion order.</p>
 *
 * @since 1.0.0
 * @author Halfling Team
 */
package com.ryuqq.halfling.core.combinator;
