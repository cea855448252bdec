package com.ryuqq.synthesizer.testkit.matrix;

import com.ryuqq.synthesizer.core.gate.NativeOperation;
import com.ryuqq.synthesizer.core.gate.SingleQubitGate;
import com.ryuqq.synthesizer.core.math.ComplexMatrix;
import com.ryuqq.synthesizer.core.model.QubitId;
import com.ryuqq.synthesizer.core.model.Unitary2;
import com.ryuqq.synthesizer.core.model.Unitary4;

import java.util.List;

/**
 * Multiplies native gate sequences back into a unitary.
 *
 * <p>Sequences are applied first-to-last, so the result is {@code M_n · … · M_1}.</p>
 *
 * <p><strong>Qubit Ordering:</strong> For two-qubit reconstruction, {@code q0} is the
 * high bit of the basis index, matching {@link Unitary4}.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class OperationSimulator {

    private OperationSimulator() {}

    /**
     * 단일 큐비트 게이트 시퀀스의 유니터리.
     *
     * @param gates 적용 순서대로의 게이트
     * @return 누적 유니터리 (빈 시퀀스는 항등)
     */
    public static Unitary2 unitaryOf(List<? extends SingleQubitGate> gates) {
        ComplexMatrix result = ComplexMatrix.identity(2);
        for (SingleQubitGate gate : gates) {
            result = gate.matrix().multiply(result);
        }
        return new Unitary2(result);
    }

    /**
     * 2-큐비트 연산 시퀀스의 유니터리.
     *
     * @param operations 적용 순서대로의 연산
     * @param q0 상위 비트 큐비트
     * @param q1 하위 비트 큐비트
     * @return 누적 유니터리
     * @throws IllegalArgumentException 연산이 q0, q1 이외의 큐비트에 작용하는 경우
     */
    public static Unitary4 unitaryOf(List<NativeOperation> operations, QubitId q0, QubitId q1) {
        ComplexMatrix identity2 = ComplexMatrix.identity(2);
        ComplexMatrix result = ComplexMatrix.identity(4);
        for (NativeOperation operation : operations) {
            ComplexMatrix step;
            List<QubitId> qubits = operation.qubits();
            ComplexMatrix gate = operation.gate().matrix();
            if (qubits.size() == 1) {
                QubitId qubit = qubits.get(0);
                if (qubit.equals(q0)) {
                    step = gate.kron(identity2);
                } else if (qubit.equals(q1)) {
                    step = identity2.kron(gate);
                } else {
                    throw new IllegalArgumentException("operation acts on unknown qubit " + qubit);
                }
            } else if (qubits.equals(List.of(q0, q1))) {
                step = gate;
            } else if (qubits.equals(List.of(q1, q0))) {
                ComplexMatrix swap = Unitaries.swap().matrix();
                step = swap.multiply(gate).multiply(swap);
            } else {
                throw new IllegalArgumentException("operation acts on unknown qubits " + qubits);
            }
            result = step.multiply(result);
        }
        return new Unitary4(result);
    }
}
