package com.ryuqq.synthesizer.core.spi;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.model.Unitary2;

/**
 * Result of {@link KakDecomposer#decompose}.
 *
 * <p>The global phase is informational; synthesis ignores it.</p>
 *
 * @param globalPhase g
 * @param q1After a1, applied last to q1
 * @param q0After a0, applied last to q0
 * @param interaction (x, y, z)
 * @param q1Before b1, applied first to q1
 * @param q0Before b0, applied first to q0
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record KakDecomposition(
    Complex globalPhase,
    Unitary2 q1After,
    Unitary2 q0After,
    InteractionCoefficients interaction,
    Unitary2 q1Before,
    Unitary2 q0Before
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if any component is null
     */
    public KakDecomposition {
        if (globalPhase == null) {
            throw new IllegalArgumentException("globalPhase cannot be null");
        }
        if (q1After == null || q0After == null) {
            throw new IllegalArgumentException("single qubit operations after cannot be null");
        }
        if (interaction == null) {
            throw new IllegalArgumentException("interaction cannot be null");
        }
        if (q1Before == null || q0Before == null) {
            throw new IllegalArgumentException("single qubit operations before cannot be null");
        }
    }
}
