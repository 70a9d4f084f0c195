/**
 * Guarded call outcome package.
 *
 * <p>This package defines the sealed result type returned by the Catch combinator.
 * A suppressed failure is a {@code Suppressed} case, distinct from a {@code Returned}
 * case holding a {@code null} value.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.core.outcome.Guarded} - Sealed interface (permits Returned, Suppressed)</li>
 * </ul>
 *
 * <h2>Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.core.outcome.Returned} - Target completed normally</li>
 *   <li>{@link com.ryuqq.wrapper.core.outcome.Suppressed} - Matched failure, not propagated</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Wrapper Team
 */
package com.ryuqq.wrapper.core.outcome;
