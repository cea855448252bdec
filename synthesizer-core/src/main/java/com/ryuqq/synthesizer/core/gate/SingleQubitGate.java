package com.ryuqq.synthesizer.core.gate;

import com.ryuqq.synthesizer.core.model.QubitId;

/**
 * 단일 큐비트 네이티브 게이트.
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public sealed interface SingleQubitGate extends NativeGate permits AxisRotationGate, PhaseGate {

    @Override
    SingleQubitGate pow(double exponent);

    @Override
    SingleQubitGate inverse();

    @Override
    default int qubitCount() {
        return 1;
    }

    /**
     * 단일 큐비트에 바인딩.
     *
     * @param qubit 대상 큐비트
     * @return NativeOperation
     */
    default NativeOperation on(QubitId qubit) {
        return on(new QubitId[]{qubit});
    }
}
