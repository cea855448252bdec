package com.ryuqq.synthesizer.core.gate;

import com.ryuqq.synthesizer.core.math.ComplexMatrix;
import com.ryuqq.synthesizer.core.model.QubitId;

import java.util.Arrays;

/**
 * 네이티브 게이트 집합.
 *
 * <p>합성 결과가 도달해야 하는 고정된 물리 게이트 어휘입니다:</p>
 * <ul>
 *   <li>{@link AxisRotationGate}: XY 평면 축 주위의 연속 회전</li>
 *   <li>{@link PhaseGate}: Z축 위상 게이트</li>
 *   <li>{@link CouplingGate}: 2-큐비트 제어 위상(CZ 계열) 결합 게이트</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 게이트 집합이 닫혀 있음을 컴파일 타임에 보장합니다.</p>
 *
 * <p><strong>공통 능력 계약:</strong></p>
 * <ul>
 *   <li>{@link #pow(double)}: 실수 거듭제곱 (부분 적용)</li>
 *   <li>{@link #inverse()}: 정확한 역연산</li>
 *   <li>{@link #on(QubitId...)}: 큐비트 바인딩</li>
 *   <li>{@link #traceDistanceBound()}: 게이트가 유발하는 연산자 거리의 상한</li>
 * </ul>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public sealed interface NativeGate permits SingleQubitGate, CouplingGate {

    /**
     * 게이트가 작용하는 큐비트 수.
     *
     * @return 1 또는 2
     */
    int qubitCount();

    /**
     * 게이트를 실수 지수만큼 거듭제곱.
     *
     * @param exponent 지수 (유한한 값)
     * @return 부분 적용을 나타내는 같은 종류의 새 게이트
     * @throws IllegalArgumentException exponent가 유한하지 않은 경우
     */
    NativeGate pow(double exponent);

    /**
     * 역게이트.
     *
     * @return this와 곱하면 항등이 되는 게이트
     */
    NativeGate inverse();

    /**
     * 게이트를 순수 상태에 적용했을 때 생길 수 있는 trace distance의 상한.
     *
     * <p>값이 허용 오차 이하이면 게이트를 생략해도 됩니다.</p>
     *
     * @return 0 이상 1 이하의 값
     */
    double traceDistanceBound();

    /**
     * 게이트의 유니터리 행렬.
     *
     * @return 2^qubitCount 차원의 행렬
     */
    ComplexMatrix matrix();

    /**
     * 게이트를 큐비트에 바인딩.
     *
     * @param qubits 대상 큐비트 (qubitCount 개, 서로 달라야 함)
     * @return NativeOperation
     * @throws IllegalArgumentException 큐비트 수가 맞지 않거나 중복/null인 경우
     */
    default NativeOperation on(QubitId... qubits) {
        if (qubits == null) {
            throw new IllegalArgumentException("qubits cannot be null");
        }
        return new NativeOperation(this, Arrays.asList(qubits));
    }

    /**
     * turn 파라미터 공통 검증.
     */
    static double requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite (current: " + value + ")");
        }
        return value;
    }
}
