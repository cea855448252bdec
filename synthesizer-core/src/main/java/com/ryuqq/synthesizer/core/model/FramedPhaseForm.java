package com.ryuqq.synthesizer.core.model;

import com.ryuqq.synthesizer.core.math.Complex;

/**
 * 2x2 유니터리 M의 프레임 위상 형식: M = U^-1 · diag(1, r) · U · g.
 *
 * <p>U는 M의 회전 축을 Z축으로 옮기고, r의 위상은 그 축 주위의 회전량이며,
 * g는 축 변환으로 생긴 전역 위상 차이입니다. M이 제어 연산일 때 제어 큐비트는
 * g 만큼 Z축 위상 회전을 받아야 합니다.</p>
 *
 * @param u 프레임 변환 유니터리
 * @param relativePhase 상대 위상 인자 r (단위 크기)
 * @param globalPhase 전역 위상 인자 g (단위 크기)
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record FramedPhaseForm(Unitary2 u, Complex relativePhase, Complex globalPhase) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public FramedPhaseForm {
        if (u == null) {
            throw new IllegalArgumentException("u cannot be null");
        }
        if (relativePhase == null) {
            throw new IllegalArgumentException("relativePhase cannot be null");
        }
        if (globalPhase == null) {
            throw new IllegalArgumentException("globalPhase cannot be null");
        }
    }
}
