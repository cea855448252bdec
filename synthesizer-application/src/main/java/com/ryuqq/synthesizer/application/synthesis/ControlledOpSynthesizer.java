package com.ryuqq.synthesizer.application.synthesis;

import com.ryuqq.synthesizer.core.decompose.FramedPhaseDecomposer;
import com.ryuqq.synthesizer.core.gate.CouplingGate;
import com.ryuqq.synthesizer.core.gate.NativeOperation;
import com.ryuqq.synthesizer.core.gate.OperationSequence;
import com.ryuqq.synthesizer.core.gate.PhaseGate;
import com.ryuqq.synthesizer.core.gate.SingleQubitGate;
import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.model.FramedPhaseForm;
import com.ryuqq.synthesizer.core.model.QubitId;
import com.ryuqq.synthesizer.core.model.Unitary2;
import com.ryuqq.synthesizer.core.spi.EigenDecomposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 제어 단일 큐비트 연산을 Z/XY/CZ 네이티브 게이트로 합성.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. operation → (U, r, g)  (FramedPhaseDecomposer)
 * 2. |r − 1| ≤ tolerance 이면 빈 리스트 (대상 큐비트에 관측 가능한 효과 없음)
 * 3. U → 경계 게이트 (SingleQubitSynthesizer), 마지막 게이트가 PhaseGate면 제거
 *    (CZ와 교환 가능하므로 불필요)
 * 4. before = 경계 게이트 @ target
 *    after  = before의 역 (역순, 각 게이트 역연산)
 * 5. effect   = CZ^(phase(r)/π) @ (control, target)
 * 6. kickback = Z^(phase(g)/π) @ control   (|g − 1| > tolerance 일 때만)
 * 7. before, effect, kickback?, after
 * </pre>
 *
 * <p>2단계에서 빈 리스트를 반환할 때 남는 제어 큐비트 쪽 전역 위상은
 * 호출자가 필요하면 별도로 처리해야 합니다.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class ControlledOpSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ControlledOpSynthesizer.class);

    private final FramedPhaseDecomposer framedPhaseDecomposer;
    private final SingleQubitSynthesizer singleQubitSynthesizer;

    /**
     * 기본 단일 큐비트 합성기로 생성.
     *
     * @param eigenDecomposer 고유값 분해 협력자
     * @throws IllegalArgumentException eigenDecomposer가 null인 경우
     */
    public ControlledOpSynthesizer(EigenDecomposer eigenDecomposer) {
        this(new FramedPhaseDecomposer(eigenDecomposer), new SingleQubitSynthesizer());
    }

    /**
     * 생성자.
     *
     * @param framedPhaseDecomposer 프레임 위상 분해기
     * @param singleQubitSynthesizer 경계 게이트 합성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ControlledOpSynthesizer(
        FramedPhaseDecomposer framedPhaseDecomposer,
        SingleQubitSynthesizer singleQubitSynthesizer
    ) {
        if (framedPhaseDecomposer == null) {
            throw new IllegalArgumentException("framedPhaseDecomposer cannot be null");
        }
        if (singleQubitSynthesizer == null) {
            throw new IllegalArgumentException("singleQubitSynthesizer cannot be null");
        }
        this.framedPhaseDecomposer = framedPhaseDecomposer;
        this.singleQubitSynthesizer = singleQubitSynthesizer;
    }

    /**
     * 허용 오차 0으로 합성.
     */
    public List<NativeOperation> synthesize(QubitId control, QubitId target, Unitary2 operation) {
        return synthesize(control, target, operation, 0.0);
    }

    /**
     * 제어 연산 합성.
     *
     * @param control 제어 큐비트
     * @param target 대상 큐비트
     * @param operation 제어될 2x2 유니터리
     * @param tolerance 허용 오차
     * @return 적용 순서대로의 연산 리스트 (불변)
     * @throws IllegalArgumentException 인자가 null이거나, control == target 이거나, tolerance가 NaN인 경우
     */
    public List<NativeOperation> synthesize(
        QubitId control,
        QubitId target,
        Unitary2 operation,
        double tolerance
    ) {
        if (control == null || target == null) {
            throw new IllegalArgumentException("control and target cannot be null");
        }
        if (control.equals(target)) {
            throw new IllegalArgumentException("control and target must differ (current: " + control + ")");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        SingleQubitSynthesizer.requireTolerance(tolerance);

        // 1. 프레임 위상 분해
        FramedPhaseForm form = framedPhaseDecomposer.decompose(operation);
        Complex zPhase = form.relativePhase();
        Complex globalPhase = form.globalPhase();

        // 2. 대상 쪽 효과가 없는 경우
        if (zPhase.distanceTo(Complex.ONE) <= tolerance) {
            log.debug("Controlled operation acts as identity on {} within tolerance {}", target, tolerance);
            return List.of();
        }

        // 3. 경계 게이트
        List<SingleQubitGate> uGates = new ArrayList<>(singleQubitSynthesizer.synthesize(form.u(), tolerance));
        if (!uGates.isEmpty() && uGates.get(uGates.size() - 1) instanceof PhaseGate) {
            uGates.remove(uGates.size() - 1);
        }

        // 4. 앞/뒤 경계 연산
        List<NativeOperation> before = new ArrayList<>(uGates.size());
        for (SingleQubitGate gate : uGates) {
            before.add(gate.on(target));
        }
        List<NativeOperation> after = OperationSequence.inverseOf(before);

        // 5~7. 결합 게이트 + 위상 킥백
        OperationSequence.Builder sequence = OperationSequence.builder()
            .addAll(before)
            .add(CouplingGate.CZ.pow(zPhase.phase() / Math.PI).on(control, target));
        if (globalPhase.distanceTo(Complex.ONE) > tolerance) {
            sequence.add(PhaseGate.Z.pow(globalPhase.phase() / Math.PI).on(control));
        }
        List<NativeOperation> result = sequence.addAll(after).build();

        log.debug("Controlled operation on ({}, {}) synthesized into {} operation(s)", control, target, result.size());
        return result;
    }
}
