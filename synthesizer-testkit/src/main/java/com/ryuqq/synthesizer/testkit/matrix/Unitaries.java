package com.ryuqq.synthesizer.testkit.matrix;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.math.ComplexMatrix;
import com.ryuqq.synthesizer.core.model.Unitary2;
import com.ryuqq.synthesizer.core.model.Unitary4;

import java.util.Random;

/**
 * Unitary fixtures for tests.
 *
 * <p>Named single qubit operations, controlled lifts, and seeded random unitaries.
 * Random generators take an explicit {@link Random} so that test runs are reproducible.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class Unitaries {

    private static final double INV_SQRT2 = 1.0 / Math.sqrt(2.0);

    private Unitaries() {}

    public static Unitary2 pauliX() {
        return Unitary2.of(Complex.ZERO, Complex.ONE, Complex.ONE, Complex.ZERO);
    }

    public static Unitary2 pauliY() {
        return Unitary2.of(Complex.ZERO, Complex.I.negate(), Complex.I, Complex.ZERO);
    }

    public static Unitary2 pauliZ() {
        return Unitary2.of(Complex.ONE, Complex.ZERO, Complex.ZERO, Complex.ofReal(-1.0));
    }

    public static Unitary2 hadamard() {
        Complex h = Complex.ofReal(INV_SQRT2);
        return Unitary2.of(h, h, h, h.negate());
    }

    /**
     * diag(1, e^(i·angle)).
     */
    public static Unitary2 phase(double angle) {
        return new Unitary2(ComplexMatrix.diagonal(Complex.ONE, Complex.expi(angle)));
    }

    /**
     * exp(−i·angle/2·(n·σ)), 블로흐 구면에서 단위 축 n 주위로 angle 만큼 회전.
     */
    public static Unitary2 rotation(double nx, double ny, double nz, double angle) {
        double norm = Math.sqrt(nx * nx + ny * ny + nz * nz);
        double x = nx / norm;
        double y = ny / norm;
        double z = nz / norm;
        double c = Math.cos(angle / 2);
        double s = Math.sin(angle / 2);
        return Unitary2.of(
            new Complex(c, -s * z), new Complex(-s * y, -s * x),
            new Complex(s * y, -s * x), new Complex(c, s * z)
        );
    }

    /**
     * 전체 행렬에 전역 위상 e^(i·angle)을 곱함.
     */
    public static Unitary2 withGlobalPhase(Unitary2 mat, double angle) {
        return new Unitary2(mat.matrix().scale(Complex.expi(angle)));
    }

    /**
     * Haar-like random 2x2 unitary, including a random global phase.
     *
     * @param random seeded source
     * @return e^(iφ)·[[a, −e^(iψ)·conj(b)], [b, e^(iψ)·conj(a)]] with |a|² + |b|² = 1
     */
    public static Unitary2 random2(Random random) {
        double ar = random.nextGaussian();
        double ai = random.nextGaussian();
        double br = random.nextGaussian();
        double bi = random.nextGaussian();
        double norm = Math.sqrt(ar * ar + ai * ai + br * br + bi * bi);
        Complex a = new Complex(ar / norm, ai / norm);
        Complex b = new Complex(br / norm, bi / norm);
        Complex psi = Complex.expi(random.nextDouble() * 2 * Math.PI);
        Unitary2 special = Unitary2.of(
            a, psi.multiply(b.conjugate()).negate(),
            b, psi.multiply(a.conjugate())
        );
        return withGlobalPhase(special, random.nextDouble() * 2 * Math.PI);
    }

    /**
     * Controlled lift with the control on q0 (high index bit): diag-block(I, mat).
     */
    public static Unitary4 controlled(Unitary2 mat) {
        Complex[][] rows = new Complex[4][4];
        for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 4; c++) {
                rows[r][c] = (r == c && r < 2) ? Complex.ONE : Complex.ZERO;
            }
        }
        for (int r = 0; r < 2; r++) {
            for (int c = 0; c < 2; c++) {
                rows[r + 2][c + 2] = mat.get(r, c);
            }
        }
        return new Unitary4(ComplexMatrix.of(rows));
    }

    /**
     * Two qubit SWAP.
     */
    public static Unitary4 swap() {
        return new Unitary4(ComplexMatrix.ofReal(new double[][]{
            {1, 0, 0, 0},
            {0, 0, 1, 0},
            {0, 1, 0, 0},
            {0, 0, 0, 1}
        }));
    }
}
