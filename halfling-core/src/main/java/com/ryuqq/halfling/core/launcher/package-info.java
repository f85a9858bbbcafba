/**
 * Default launcher.
 *
 * <p>{@link com.ryuqq.halfling.core.launcher.ThreadPerTaskLauncher} spawns one thread per
 * launched unit. It is what {@code Task.run()} and {@code Task.runAsync()} use when no
 * launcher is given.</p>
 *
 * @since 1.0.0
 * @author Halfling Team
 */
package com.ryuqq.halfling.core.launcher;
