package com.ryuqq.synthesizer.application.synthesis;

import com.ryuqq.synthesizer.core.decompose.FramedPhaseDecomposer;
import com.ryuqq.synthesizer.core.gate.NativeOperation;
import com.ryuqq.synthesizer.core.model.QubitId;
import com.ryuqq.synthesizer.core.model.Unitary2;
import com.ryuqq.synthesizer.core.model.Unitary4;
import com.ryuqq.synthesizer.core.spi.EigenDecomposer;
import com.ryuqq.synthesizer.core.spi.KakDecomposer;

import java.util.List;

/**
 * 네이티브 게이트 합성 진입점.
 *
 * <p>세 합성 경로를 하나로 묶고 {@link SynthesisConfig}의 허용 오차를 적용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * GateSynthesizer synthesizer = new GateSynthesizer(
 *     new ClosedFormEigenDecomposer(), kakDecomposer, new SynthesisConfig());
 *
 * List&lt;NativeOperation&gt; single = synthesizer.singleQubit(q0, hadamard);
 * List&lt;NativeOperation&gt; cnot = synthesizer.controlled(q0, q1, pauliX);
 * List&lt;NativeOperation&gt; swap = synthesizer.twoQubit(q0, q1, swapMatrix);
 * </pre>
 *
 * <p><strong>스레드 안전성:</strong> 가변 상태가 없으므로 여러 스레드에서 잠금 없이
 * 공유할 수 있습니다 (주입된 SPI 구현도 재진입 가능해야 함).</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class GateSynthesizer {

    private final SingleQubitSynthesizer singleQubitSynthesizer;
    private final ControlledOpSynthesizer controlledOpSynthesizer;
    private final TwoQubitSynthesizer twoQubitSynthesizer;
    private final SynthesisConfig config;

    /**
     * 생성자.
     *
     * @param eigenDecomposer 고유값 분해 협력자
     * @param kakDecomposer KAK 분해 협력자
     * @param config 허용 오차 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public GateSynthesizer(EigenDecomposer eigenDecomposer, KakDecomposer kakDecomposer, SynthesisConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        SingleQubitSynthesizer single = new SingleQubitSynthesizer();
        this.singleQubitSynthesizer = single;
        this.controlledOpSynthesizer = new ControlledOpSynthesizer(
            new FramedPhaseDecomposer(eigenDecomposer), single);
        this.twoQubitSynthesizer = new TwoQubitSynthesizer(kakDecomposer, single);
        this.config = config;
    }

    /**
     * 단일 큐비트 연산 합성 (singleQubitTolerance 적용).
     */
    public List<NativeOperation> singleQubit(QubitId qubit, Unitary2 mat) {
        return singleQubitSynthesizer.synthesizeOn(qubit, mat, config.singleQubitTolerance());
    }

    /**
     * 제어 연산 합성 (controlledTolerance 적용).
     */
    public List<NativeOperation> controlled(QubitId control, QubitId target, Unitary2 operation) {
        return controlledOpSynthesizer.synthesize(control, target, operation, config.controlledTolerance());
    }

    /**
     * 2-큐비트 연산 합성 (twoQubitTolerance 적용).
     */
    public List<NativeOperation> twoQubit(QubitId q0, QubitId q1, Unitary4 mat) {
        return twoQubitSynthesizer.synthesize(q0, q1, mat, config.twoQubitTolerance());
    }

    public SynthesisConfig getConfig() {
        return config;
    }
}
