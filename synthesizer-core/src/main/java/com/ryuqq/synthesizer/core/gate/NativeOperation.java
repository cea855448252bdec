package com.ryuqq.synthesizer.core.gate;

import com.ryuqq.synthesizer.core.model.QubitId;

import java.util.HashSet;
import java.util.List;

/**
 * 큐비트에 바인딩된 네이티브 게이트.
 *
 * <p>합성 결과는 NativeOperation의 순서 있는 리스트이며,
 * 리스트 순서가 곧 적용 순서입니다 (첫 번째 → 마지막).</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>gate, qubits는 null 불가</li>
 *   <li>qubits 개수 == gate.qubitCount()</li>
 *   <li>qubits 중복 불가</li>
 * </ul>
 *
 * @param gate 적용할 게이트
 * @param qubits 대상 큐비트 (2-큐비트 게이트의 경우 순서 유지)
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record NativeOperation(NativeGate gate, List<QubitId> qubits) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 검증 실패 시
     */
    public NativeOperation {
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        if (qubits == null) {
            throw new IllegalArgumentException("qubits cannot be null");
        }
        if (qubits.size() != gate.qubitCount()) {
            throw new IllegalArgumentException(
                "gate acts on " + gate.qubitCount() + " qubit(s) (current: " + qubits.size() + ")"
            );
        }
        for (QubitId qubit : qubits) {
            if (qubit == null) {
                throw new IllegalArgumentException("qubits cannot contain null");
            }
        }
        if (new HashSet<>(qubits).size() != qubits.size()) {
            throw new IllegalArgumentException("qubits must be distinct (current: " + qubits + ")");
        }
        qubits = List.copyOf(qubits);
    }

    /**
     * 같은 큐비트에 역게이트를 적용하는 연산.
     */
    public NativeOperation inverse() {
        return new NativeOperation(gate.inverse(), qubits);
    }

    /**
     * 특정 큐비트에 작용하는지 확인.
     */
    public boolean actsOn(QubitId qubit) {
        return qubit != null && qubits.contains(qubit);
    }
}
