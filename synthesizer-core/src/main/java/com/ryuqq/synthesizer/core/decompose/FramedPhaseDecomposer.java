package com.ryuqq.synthesizer.core.decompose;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.model.FramedPhaseForm;
import com.ryuqq.synthesizer.core.model.Unitary2;
import com.ryuqq.synthesizer.core.spi.EigenDecomposer;
import com.ryuqq.synthesizer.core.spi.EigenPairs;

/**
 * 2x2 유니터리를 프레임 위상 형식으로 분해.
 *
 * <p>M = V · diag(v0, v1) · V^-1 (V: 고유벡터 행렬) 에서</p>
 * <pre>
 * U             = V†
 * relativePhase = v1 / v0
 * globalPhase   = v0
 * </pre>
 *
 * <p>M 적용은 (전역 위상을 제외하고) U 적용 → Z축으로 relativePhase 만큼 위상 회전 →
 * U^-1 적용과 같습니다. M이 제어 연산으로 쓰이면 제어 큐비트가 globalPhase 만큼
 * 위상 회전을 받아야 합니다.</p>
 *
 * <p>고유값 순서는 {@link EigenDecomposer} 구현의 규약을 그대로 따르며 보정하지 않습니다.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class FramedPhaseDecomposer {

    private final EigenDecomposer eigenDecomposer;

    /**
     * 생성자.
     *
     * @param eigenDecomposer 고유값 분해 협력자
     * @throws IllegalArgumentException eigenDecomposer가 null인 경우
     */
    public FramedPhaseDecomposer(EigenDecomposer eigenDecomposer) {
        if (eigenDecomposer == null) {
            throw new IllegalArgumentException("eigenDecomposer cannot be null");
        }
        this.eigenDecomposer = eigenDecomposer;
    }

    /**
     * 프레임 위상 분해.
     *
     * @param mat 2x2 유니터리
     * @return (U, relativePhase, globalPhase)
     * @throws IllegalArgumentException mat이 null인 경우
     */
    public FramedPhaseForm decompose(Unitary2 mat) {
        if (mat == null) {
            throw new IllegalArgumentException("mat cannot be null");
        }
        EigenPairs pairs = eigenDecomposer.decompose(mat);
        Unitary2 u = pairs.eigenvectors().adjoint();
        Complex relativePhase = pairs.eigenvalue1().divide(pairs.eigenvalue0());
        return new FramedPhaseForm(u, relativePhase, pairs.eigenvalue0());
    }
}
