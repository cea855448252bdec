package com.ryuqq.synthesizer.application.synthesis;

import com.ryuqq.synthesizer.core.gate.AxisRotationGate;
import com.ryuqq.synthesizer.core.gate.CouplingGate;
import com.ryuqq.synthesizer.core.gate.NativeOperation;
import com.ryuqq.synthesizer.core.gate.OperationSequence;
import com.ryuqq.synthesizer.core.gate.PhaseGate;
import com.ryuqq.synthesizer.core.gate.SingleQubitGate;
import com.ryuqq.synthesizer.core.model.QubitId;
import com.ryuqq.synthesizer.core.model.Unitary4;
import com.ryuqq.synthesizer.core.spi.InteractionCoefficients;
import com.ryuqq.synthesizer.core.spi.KakDecomposer;
import com.ryuqq.synthesizer.core.spi.KakDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 임의의 2-큐비트 연산을 Z/XY/CZ 네이티브 게이트로 합성.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. mat → KAK: (a1, a0), (x, y, z), (b1, b0)
 * 2. pre     = b1 @ q1, b0 @ q0           (SingleQubitSynthesizer)
 * 3. xx_part = parity(x, framing = Y^-0.5)
 *    yy_part = parity(y, framing = X^0.5)
 *    zz_part = parity(z, framing 없음)
 * 4. post    = a1 @ q1, a0 @ q0
 * 5. pre, xx_part, yy_part, zz_part, post
 * </pre>
 *
 * <p><strong>Parity interaction (rads):</strong></p>
 * <pre>
 * |rads| &lt; tolerance → 생략
 * e = 4·rads/π,  h = −e/2
 * framing @ q0, framing @ q1           (framing이 있을 때)
 * CZ^e @ (q0, q1)
 * Z^h @ q0, Z^h @ q1
 * framing^-1 @ q0, framing^-1 @ q1     (framing이 있을 때)
 * </pre>
 *
 * <p>프레이밍 게이트는 결합 게이트의 고정된 ZZ 상호작용 축을 XX/YY 축으로 옮깁니다.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class TwoQubitSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(TwoQubitSynthesizer.class);

    /**
     * 기본 허용 오차.
     */
    public static final double DEFAULT_TOLERANCE = 1e-8;

    /**
     * Y^-0.5: Z축을 X축으로 옮김.
     */
    static final AxisRotationGate XX_FRAMING = AxisRotationGate.Y.pow(-0.5);

    /**
     * X^0.5: Z축을 Y축으로 옮김.
     */
    static final AxisRotationGate YY_FRAMING = AxisRotationGate.X.pow(0.5);

    private final KakDecomposer kakDecomposer;
    private final SingleQubitSynthesizer singleQubitSynthesizer;

    public TwoQubitSynthesizer(KakDecomposer kakDecomposer) {
        this(kakDecomposer, new SingleQubitSynthesizer());
    }

    /**
     * 생성자.
     *
     * @param kakDecomposer KAK 분해 협력자
     * @param singleQubitSynthesizer 국소 연산 합성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TwoQubitSynthesizer(KakDecomposer kakDecomposer, SingleQubitSynthesizer singleQubitSynthesizer) {
        if (kakDecomposer == null) {
            throw new IllegalArgumentException("kakDecomposer cannot be null");
        }
        if (singleQubitSynthesizer == null) {
            throw new IllegalArgumentException("singleQubitSynthesizer cannot be null");
        }
        this.kakDecomposer = kakDecomposer;
        this.singleQubitSynthesizer = singleQubitSynthesizer;
    }

    /**
     * 기본 허용 오차({@value #DEFAULT_TOLERANCE})로 합성.
     */
    public List<NativeOperation> synthesize(QubitId q0, QubitId q1, Unitary4 mat) {
        return synthesize(q0, q1, mat, DEFAULT_TOLERANCE);
    }

    /**
     * 2-큐비트 합성.
     *
     * @param q0 첫 번째 큐비트 (기저 인덱스 상위 비트)
     * @param q1 두 번째 큐비트
     * @param mat 4x4 유니터리
     * @param tolerance 허용 오차
     * @return 적용 순서대로의 연산 리스트 (불변)
     * @throws IllegalArgumentException 인자가 null이거나, q0 == q1 이거나, tolerance가 NaN인 경우
     */
    public List<NativeOperation> synthesize(QubitId q0, QubitId q1, Unitary4 mat, double tolerance) {
        if (q0 == null || q1 == null) {
            throw new IllegalArgumentException("q0 and q1 cannot be null");
        }
        if (q0.equals(q1)) {
            throw new IllegalArgumentException("q0 and q1 must differ (current: " + q0 + ")");
        }
        if (mat == null) {
            throw new IllegalArgumentException("mat cannot be null");
        }
        SingleQubitSynthesizer.requireTolerance(tolerance);

        KakDecomposition kak = kakDecomposer.decompose(mat, tolerance);
        InteractionCoefficients interaction = kak.interaction();

        List<NativeOperation> result = OperationSequence.builder()
            .addAll(singleQubitSynthesizer.synthesizeOn(q1, kak.q1Before(), tolerance))
            .addAll(singleQubitSynthesizer.synthesizeOn(q0, kak.q0Before(), tolerance))
            .addAll(parityInteraction(q0, q1, interaction.x(), XX_FRAMING, tolerance))
            .addAll(parityInteraction(q0, q1, interaction.y(), YY_FRAMING, tolerance))
            .addAll(parityInteraction(q0, q1, interaction.z(), null, tolerance))
            .addAll(singleQubitSynthesizer.synthesizeOn(q1, kak.q1After(), tolerance))
            .addAll(singleQubitSynthesizer.synthesizeOn(q0, kak.q0After(), tolerance))
            .build();

        log.debug("Two qubit operation on ({}, {}) with interaction {} synthesized into {} operation(s)",
            q0, q1, interaction, result.size());
        return result;
    }

    /**
     * framing으로 감싼 ZZ 상호작용 exp(i·rads·PP), P는 framing이 Z를 옮긴 축.
     *
     * @param framing 프레이밍 게이트 (null 허용: ZZ 그대로)
     * @return 연산 리스트, |rads| &lt; tolerance 이면 빈 리스트
     */
    static List<NativeOperation> parityInteraction(
        QubitId q0,
        QubitId q1,
        double rads,
        SingleQubitGate framing,
        double tolerance
    ) {
        if (Math.abs(rads) < tolerance) {
            log.debug("Elided negligible parity interaction of {} rad (tolerance: {})", rads, tolerance);
            return List.of();
        }
        double e = rads * 4 / Math.PI;
        double h = -e / 2;

        OperationSequence.Builder sequence = OperationSequence.builder();
        if (framing != null) {
            sequence.add(framing.on(q0)).add(framing.on(q1));
        }
        sequence.add(CouplingGate.CZ.pow(e).on(q0, q1))
            .add(PhaseGate.Z.pow(h).on(q0))
            .add(PhaseGate.Z.pow(h).on(q1));
        if (framing != null) {
            SingleQubitGate unframing = framing.inverse();
            sequence.add(unframing.on(q0)).add(unframing.on(q1));
        }
        return sequence.build();
    }
}
