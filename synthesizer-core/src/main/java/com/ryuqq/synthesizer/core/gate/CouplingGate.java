package com.ryuqq.synthesizer.core.gate;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.math.ComplexMatrix;
import com.ryuqq.synthesizer.core.math.Turns;

/**
 * 2-큐비트 결합 게이트 (제어 위상): diag(1, 1, 1, e^(2πi·turns)).
 *
 * <p>두 큐비트에 대해 대칭이므로 제어/대상 구분이 없습니다.
 * {@link #CZ}는 turns=0.5 이며, {@code CZ.pow(e)}는 diag(1, 1, 1, e^(iπe)) 입니다.</p>
 *
 * @param turns 위상량 (turn 단위)
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record CouplingGate(double turns) implements NativeGate {

    public static final CouplingGate CZ = new CouplingGate(0.5);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException turns가 유한하지 않은 경우
     */
    public CouplingGate {
        NativeGate.requireFinite("turns", turns);
    }

    @Override
    public int qubitCount() {
        return 2;
    }

    @Override
    public CouplingGate pow(double exponent) {
        NativeGate.requireFinite("exponent", exponent);
        return new CouplingGate(turns * exponent);
    }

    @Override
    public CouplingGate inverse() {
        return new CouplingGate(-turns);
    }

    @Override
    public double traceDistanceBound() {
        return Math.abs(Math.sin(Math.PI * Turns.signedMod1(turns)));
    }

    @Override
    public ComplexMatrix matrix() {
        return ComplexMatrix.diagonal(
            Complex.ONE, Complex.ONE, Complex.ONE, Complex.expi(Turns.toRadians(turns))
        );
    }
}
