package com.ryuqq.synthesizer.core.decompose;

import com.ryuqq.synthesizer.core.math.Turns;
import com.ryuqq.synthesizer.core.model.AngleTriple;
import com.ryuqq.synthesizer.core.model.TurnTriple;
import com.ryuqq.synthesizer.core.model.Unitary2;

/**
 * ZYZ 각도를 네이티브 게이트 파라미터(turn)로 변환.
 *
 * <p><strong>변환 공식 (τ = 2π):</strong></p>
 * <pre>
 * xyTurn      = 2·rotation / τ
 * xyPhaseTurn = 0.25 − pre / τ
 * totalZTurn  = (post + pre) / τ
 * </pre>
 * <p>세 값 모두 {@link Turns#signedMod1(double)}로 [-0.5, 0.5) 범위에 정규화됩니다.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class TurnsNormalizer {

    private final AngleDeconstructor angleDeconstructor;

    public TurnsNormalizer() {
        this(new AngleDeconstructor());
    }

    /**
     * 생성자.
     *
     * @param angleDeconstructor 각도 분해기
     * @throws IllegalArgumentException angleDeconstructor가 null인 경우
     */
    public TurnsNormalizer(AngleDeconstructor angleDeconstructor) {
        if (angleDeconstructor == null) {
            throw new IllegalArgumentException("angleDeconstructor cannot be null");
        }
        this.angleDeconstructor = angleDeconstructor;
    }

    /**
     * 각도를 정규화된 turn으로 변환.
     *
     * @param angles ZYZ 각도
     * @return 정규화된 TurnTriple
     * @throws IllegalArgumentException angles가 null인 경우
     */
    public TurnTriple normalize(AngleTriple angles) {
        if (angles == null) {
            throw new IllegalArgumentException("angles cannot be null");
        }
        double xyTurn = 2 * angles.rotation() / Turns.TAU;
        double xyPhaseTurn = 0.25 - angles.prePhase() / Turns.TAU;
        double totalZTurn = (angles.postPhase() + angles.prePhase()) / Turns.TAU;

        return new TurnTriple(
            Turns.signedMod1(xyTurn),
            Turns.signedMod1(xyPhaseTurn),
            Turns.signedMod1(totalZTurn)
        );
    }

    /**
     * 2x2 유니터리를 바로 게이트 파라미터로 분해 (각도 분해 → 정규화).
     *
     * @param mat 2x2 유니터리
     * @return 정규화된 TurnTriple
     */
    public TurnTriple deconstructIntoTurns(Unitary2 mat) {
        return normalize(angleDeconstructor.deconstruct(mat));
    }
}
