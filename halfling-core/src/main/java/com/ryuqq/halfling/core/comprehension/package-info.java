/**
 * Comprehension syntax for tasks.
 *
 * <p>{@link com.ryuqq.halfling.core.comprehension.TaskComprehension} turns a sequence of named
 * bindings plus a body into nested {@code then} calls, with an optional recovery attached to the
 * whole chain. It adds no execution semantics of its own.</p>
 *
 * @since 1.0.0
 * @author Halfling Team
 */
package com.ryuqq.halfling.core.comprehension;
