package com.ryuqq.synthesizer.core.gate;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.math.ComplexMatrix;
import com.ryuqq.synthesizer.core.math.Turns;

/**
 * XY 평면의 축 주위 회전 게이트.
 *
 * <p>축은 X축에서 Y축 방향으로 {@code axisPhaseTurns} 만큼 기울어져 있습니다.</p>
 *
 * <p><strong>행렬:</strong></p>
 * <pre>
 * M = cos(πt)·I − i·sin(πt)·A
 * A = [[0, e^(−iφ)], [e^(iφ), 0]],  φ = 2π·axisPhaseTurns,  t = turns
 * </pre>
 *
 * <ul>
 *   <li>turns=0.5, axisPhaseTurns=0: X (전역 위상 무시)</li>
 *   <li>turns=0.5, axisPhaseTurns=0.25: Y (전역 위상 무시)</li>
 * </ul>
 *
 * @param turns 회전량 (turn 단위)
 * @param axisPhaseTurns 축의 위상 (turn 단위)
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record AxisRotationGate(double turns, double axisPhaseTurns) implements SingleQubitGate {

    /**
     * X축 반바퀴 회전.
     */
    public static final AxisRotationGate X = new AxisRotationGate(0.5, 0.0);

    /**
     * Y축 반바퀴 회전.
     */
    public static final AxisRotationGate Y = new AxisRotationGate(0.5, 0.25);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터가 유한하지 않은 경우
     */
    public AxisRotationGate {
        NativeGate.requireFinite("turns", turns);
        NativeGate.requireFinite("axisPhaseTurns", axisPhaseTurns);
    }

    @Override
    public AxisRotationGate pow(double exponent) {
        NativeGate.requireFinite("exponent", exponent);
        return new AxisRotationGate(turns * exponent, axisPhaseTurns);
    }

    @Override
    public AxisRotationGate inverse() {
        return new AxisRotationGate(-turns, axisPhaseTurns);
    }

    @Override
    public double traceDistanceBound() {
        return Math.abs(Math.sin(Math.PI * Turns.signedMod1(turns)));
    }

    @Override
    public ComplexMatrix matrix() {
        double angle = Math.PI * turns;
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        double phi = Turns.toRadians(axisPhaseTurns);
        // −i·s·e^(∓iφ)
        Complex upper = Complex.expi(-phi).multiply(new Complex(0.0, -s));
        Complex lower = Complex.expi(phi).multiply(new Complex(0.0, -s));
        return ComplexMatrix.of2x2(Complex.ofReal(c), upper, lower, Complex.ofReal(c));
    }
}
