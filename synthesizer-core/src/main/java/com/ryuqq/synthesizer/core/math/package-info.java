/**
 * Numeric value types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.core.math.Complex} - Immutable complex number</li>
 *   <li>{@link com.ryuqq.synthesizer.core.math.ComplexMatrix} - Immutable square complex matrix</li>
 *   <li>{@link com.ryuqq.synthesizer.core.math.Turns} - Turn (rotation fraction) helpers and canonicalization</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synthesizer Team
 */
package com.ryuqq.synthesizer.core.math;
