/**
 * Result value type.
 *
 * <p>This package defines the sealed {@code Success | Failure} hierarchy used by the
 * task engine to make outcomes explicit data.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.halfling.core.result.Result} - Sealed interface (permits Success, Failure)</li>
 *   <li>{@link com.ryuqq.halfling.core.result.ErrorInfo} - Opaque failure payload</li>
 *   <li>{@link com.ryuqq.halfling.core.result.TaskFailedException} - Raised only when a caller
 *       explicitly asks for the value of a failure</li>
 * </ul>
 *
 * <h2>Exception Boundary</h2>
 * <p>{@link com.ryuqq.halfling.core.result.Result#attempt} is the sole place where user
 * exceptions become data. Everything built on top of it ({@code map}, {@code bind},
 * {@code recover}, task actions) inherits that guarantee.</p>
 *
 * @since 1.0.0
 * @author Halfling Team
 */
package com.ryuqq.halfling.core.result;
