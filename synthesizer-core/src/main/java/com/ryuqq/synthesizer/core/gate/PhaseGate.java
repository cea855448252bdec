package com.ryuqq.synthesizer.core.gate;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.math.ComplexMatrix;
import com.ryuqq.synthesizer.core.math.Turns;

/**
 * Z축 위상 게이트: diag(1, e^(2πi·turns)).
 *
 * <p>{@link #Z}는 turns=0.5 (diag(1, −1)) 이며, {@code Z.pow(h)}는 diag(1, e^(iπh)) 입니다.</p>
 *
 * @param turns 위상량 (turn 단위)
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record PhaseGate(double turns) implements SingleQubitGate {

    public static final PhaseGate Z = new PhaseGate(0.5);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException turns가 유한하지 않은 경우
     */
    public PhaseGate {
        NativeGate.requireFinite("turns", turns);
    }

    @Override
    public PhaseGate pow(double exponent) {
        NativeGate.requireFinite("exponent", exponent);
        return new PhaseGate(turns * exponent);
    }

    @Override
    public PhaseGate inverse() {
        return new PhaseGate(-turns);
    }

    @Override
    public double traceDistanceBound() {
        return Math.abs(Math.sin(Math.PI * Turns.signedMod1(turns)));
    }

    @Override
    public ComplexMatrix matrix() {
        return ComplexMatrix.diagonal(Complex.ONE, Complex.expi(Turns.toRadians(turns)));
    }
}
