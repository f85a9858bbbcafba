/**
 * Checked functional interfaces.
 *
 * <p>Java's {@code java.util.function} types cannot throw checked exceptions. Task
 * actions, recovery functions and gather functions are user code that may throw
 * anything, so the engine uses these variants and converts every exception into a
 * {@link com.ryuqq.halfling.core.result.Failure} at a single capture point.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
package com.ryuqq.halfling.core.function;
