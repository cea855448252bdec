package com.ryuqq.synthesizer.application.synthesis;

import com.ryuqq.synthesizer.core.decompose.TurnsNormalizer;
import com.ryuqq.synthesizer.core.gate.AxisRotationGate;
import com.ryuqq.synthesizer.core.gate.NativeOperation;
import com.ryuqq.synthesizer.core.gate.PhaseGate;
import com.ryuqq.synthesizer.core.gate.SingleQubitGate;
import com.ryuqq.synthesizer.core.model.QubitId;
import com.ryuqq.synthesizer.core.model.TurnTriple;
import com.ryuqq.synthesizer.core.model.Unitary2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 단일 큐비트 연산을 소수의 네이티브 게이트로 합성.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. mat → (xyTurn, xyPhaseTurn, totalZTurn)  (AngleDeconstructor → TurnsNormalizer)
 * 2. 후보: [AxisRotationGate(xyTurn, xyPhaseTurn), PhaseGate(totalZTurn)]
 * 3. traceDistanceBound() ≤ tolerance 인 게이트 제거 (순서 유지)
 * 4. 두 게이트가 모두 남고 |xyTurn| ≥ 0.5 − tolerance 이면
 *    → [AxisRotationGate(0.5, xyPhaseTurn + totalZTurn / 2)] 하나로 대체
 * 5. 그 외에는 남은 게이트 그대로 반환 (0, 1, 2개)
 * </pre>
 *
 * <p><strong>반바퀴 흡수:</strong> XY 반바퀴 회전은 뒤따르는 Z 위상을 축 위상 조정으로
 * 흡수할 수 있습니다. 이 검사는 반드시 제거(3단계) 이후에 수행되므로,
 * 위상 게이트가 이미 제거된 경우에는 적용되지 않습니다.</p>
 *
 * <p>결과 게이트를 순서대로 적용하면 전역 위상을 제외하고 mat과 같습니다.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class SingleQubitSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(SingleQubitSynthesizer.class);

    private final TurnsNormalizer turnsNormalizer;

    public SingleQubitSynthesizer() {
        this(new TurnsNormalizer());
    }

    /**
     * 생성자.
     *
     * @param turnsNormalizer turn 분해기
     * @throws IllegalArgumentException turnsNormalizer가 null인 경우
     */
    public SingleQubitSynthesizer(TurnsNormalizer turnsNormalizer) {
        if (turnsNormalizer == null) {
            throw new IllegalArgumentException("turnsNormalizer cannot be null");
        }
        this.turnsNormalizer = turnsNormalizer;
    }

    /**
     * 허용 오차 0으로 합성 (정확히 항등인 게이트만 제거).
     *
     * @param mat 2x2 유니터리
     * @return 적용 순서대로의 게이트 리스트 (불변)
     */
    public List<SingleQubitGate> synthesize(Unitary2 mat) {
        return synthesize(mat, 0.0);
    }

    /**
     * 단일 큐비트 합성.
     *
     * @param mat 2x2 유니터리
     * @param tolerance 허용 오차 (0 이하이면 사실상 생략 없음)
     * @return 적용 순서대로의 게이트 리스트 (불변, 0~2개)
     * @throws IllegalArgumentException mat이 null이거나 tolerance가 NaN인 경우
     */
    public List<SingleQubitGate> synthesize(Unitary2 mat, double tolerance) {
        if (mat == null) {
            throw new IllegalArgumentException("mat cannot be null");
        }
        requireTolerance(tolerance);

        TurnTriple turns = turnsNormalizer.deconstructIntoTurns(mat);

        List<SingleQubitGate> candidates = List.of(
            new AxisRotationGate(turns.xyTurn(), turns.xyPhaseTurn()),
            new PhaseGate(turns.totalZTurn())
        );
        List<SingleQubitGate> result = new ArrayList<>(candidates.size());
        for (SingleQubitGate gate : candidates) {
            if (gate.traceDistanceBound() > tolerance) {
                result.add(gate);
            } else {
                log.debug("Elided negligible gate {} (tolerance: {})", gate, tolerance);
            }
        }

        if (result.size() == 2 && Math.abs(turns.xyTurn()) >= 0.5 - tolerance) {
            AxisRotationGate absorbed = new AxisRotationGate(
                0.5,
                turns.xyPhaseTurn() + turns.totalZTurn() / 2
            );
            log.debug("Half turn absorbed trailing phase: {} → {}", result, absorbed);
            return List.of(absorbed);
        }

        return List.copyOf(result);
    }

    /**
     * 합성 결과를 큐비트에 바인딩.
     *
     * @param qubit 대상 큐비트
     * @param mat 2x2 유니터리
     * @param tolerance 허용 오차
     * @return 적용 순서대로의 연산 리스트 (불변)
     * @throws IllegalArgumentException qubit 또는 mat이 null인 경우
     */
    public List<NativeOperation> synthesizeOn(QubitId qubit, Unitary2 mat, double tolerance) {
        if (qubit == null) {
            throw new IllegalArgumentException("qubit cannot be null");
        }
        List<SingleQubitGate> gates = synthesize(mat, tolerance);
        List<NativeOperation> operations = new ArrayList<>(gates.size());
        for (SingleQubitGate gate : gates) {
            operations.add(gate.on(qubit));
        }
        return List.copyOf(operations);
    }

    static void requireTolerance(double tolerance) {
        if (Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("tolerance must not be NaN");
        }
    }
}
