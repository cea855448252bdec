package com.ryuqq.synthesizer.testkit.matrix;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.math.ComplexMatrix;
import com.ryuqq.synthesizer.core.model.Unitary4;
import com.ryuqq.synthesizer.core.spi.InteractionCoefficients;
import com.ryuqq.synthesizer.core.spi.KakDecomposition;

/**
 * Builds the matrices a KAK factorization describes.
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class Interactions {

    private static final ComplexMatrix X = Unitaries.pauliX().matrix();
    private static final ComplexMatrix Y = Unitaries.pauliY().matrix();
    private static final ComplexMatrix Z = Unitaries.pauliZ().matrix();

    private Interactions() {}

    /**
     * exp(i·(x·XX + y·YY + z·ZZ)).
     *
     * <p>XX, YY, ZZ는 서로 교환 가능하고 제곱이 I 이므로
     * 각 항은 cos θ·I + i·sin θ·PP 로 계산됩니다.</p>
     */
    public static Unitary4 interaction(InteractionCoefficients coefficients) {
        ComplexMatrix result = parity(X, coefficients.x())
            .multiply(parity(Y, coefficients.y()))
            .multiply(parity(Z, coefficients.z()));
        return new Unitary4(result);
    }

    /**
     * g · (q0After ⊗ q1After) · interaction · (q0Before ⊗ q1Before).
     */
    public static Unitary4 reconstruct(KakDecomposition kak) {
        ComplexMatrix before = kak.q0Before().matrix().kron(kak.q1Before().matrix());
        ComplexMatrix after = kak.q0After().matrix().kron(kak.q1After().matrix());
        ComplexMatrix result = after
            .multiply(interaction(kak.interaction()).matrix())
            .multiply(before)
            .scale(kak.globalPhase());
        return new Unitary4(result);
    }

    private static ComplexMatrix parity(ComplexMatrix pauli, double theta) {
        ComplexMatrix pp = pauli.kron(pauli);
        Complex c = Complex.ofReal(Math.cos(theta));
        Complex s = new Complex(0.0, Math.sin(theta));
        Complex[][] rows = new Complex[4][4];
        for (int r = 0; r < 4; r++) {
            for (int col = 0; col < 4; col++) {
                Complex identityPart = r == col ? c : Complex.ZERO;
                rows[r][col] = identityPart.add(pp.get(r, col).multiply(s));
            }
        }
        return ComplexMatrix.of(rows);
    }
}
