package com.ryuqq.synthesizer.core.decompose;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.math.ComplexMatrix;
import com.ryuqq.synthesizer.core.model.AngleTriple;
import com.ryuqq.synthesizer.core.model.Unitary2;

/**
 * 2x2 유니터리를 ZYZ 각도로 분해.
 *
 * <p>결과 각도 (pre, rotation, post)에 대해 다음이 전역 위상을 제외하고 성립합니다:</p>
 * <pre>
 * mat ≅ P(post) · R(rotation) · P(pre)
 * P(a) = diag(1, e^(ia)),  R(a) = [[cos a, −sin a], [sin a, cos a]]
 * </pre>
 *
 * <p><strong>알고리즘 (순서가 수치 동작에 영향을 주므로 고정):</strong></p>
 * <ol>
 *   <li>상단 행의 좌/우 위상 차를 반대로 상쇄 (+π): mat · P(−rightPhase)</li>
 *   <li>좌측 열의 상/하 위상 차 상쇄: P(−bottomPhase) · mat</li>
 *   <li>비대각 원소를 회전으로 제거: R(−rotation) · mat</li>
 *   <li>남은 대각 위상 차 측정</li>
 * </ol>
 *
 * <p>mat[0,0]이 0이어도 예외 없이 동작합니다 (0의 위상은 0).</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class AngleDeconstructor {

    /**
     * ZYZ 각도 분해.
     *
     * @param mat 2x2 유니터리
     * @return (pre-phase, rotation, post-phase) 라디안
     * @throws IllegalArgumentException mat이 null인 경우
     */
    public AngleTriple deconstruct(Unitary2 mat) {
        if (mat == null) {
            throw new IllegalArgumentException("mat cannot be null");
        }
        ComplexMatrix m = mat.matrix();

        double rightPhase = m.get(0, 1).multiply(m.get(0, 0).conjugate()).phase() + Math.PI;
        m = m.multiply(phaseMatrix(-rightPhase));

        double bottomPhase = m.get(1, 0).multiply(m.get(0, 0).conjugate()).phase();
        m = phaseMatrix(-bottomPhase).multiply(m);

        double rotation = Math.atan2(m.get(1, 0).abs(), m.get(0, 0).abs());
        m = rotationMatrix(-rotation).multiply(m);

        double diagonalPhase = m.get(1, 1).multiply(m.get(0, 0).conjugate()).phase();

        // global phase is dropped
        return new AngleTriple(rightPhase + diagonalPhase, rotation, bottomPhase);
    }

    static ComplexMatrix phaseMatrix(double angle) {
        return ComplexMatrix.diagonal(Complex.ONE, Complex.expi(angle));
    }

    static ComplexMatrix rotationMatrix(double angle) {
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return ComplexMatrix.ofReal(new double[][]{{c, -s}, {s, c}});
    }
}
