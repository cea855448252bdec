package com.ryuqq.synthesizer.core.model;

import com.ryuqq.synthesizer.core.math.ComplexMatrix;

/**
 * 2-큐비트 연산을 나타내는 4x4 유니터리 행렬.
 *
 * <p><strong>기저 순서:</strong> 첫 번째 큐비트(q0)가 기저 인덱스의 상위 비트입니다.
 * 즉 {@code |q0 q1>} 순서로 |00>, |01>, |10>, |11> 입니다.</p>
 *
 * <p>유니터리성은 검증하지 않습니다 (호출자 책임).</p>
 *
 * @param matrix 4x4 복소 행렬
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record Unitary4(ComplexMatrix matrix) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException matrix가 null이거나 4x4가 아닌 경우
     */
    public Unitary4 {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix cannot be null");
        }
        if (matrix.size() != 4) {
            throw new IllegalArgumentException(
                "Unitary4 requires a 4x4 matrix (current: " + matrix.size() + "x" + matrix.size() + ")"
            );
        }
    }

    /**
     * 두 단일 큐비트 연산의 텐서 곱.
     *
     * @param onQ0 q0에 작용하는 연산
     * @param onQ1 q1에 작용하는 연산
     * @return onQ0 ⊗ onQ1
     */
    public static Unitary4 kron(Unitary2 onQ0, Unitary2 onQ1) {
        if (onQ0 == null || onQ1 == null) {
            throw new IllegalArgumentException("onQ0 and onQ1 cannot be null");
        }
        return new Unitary4(onQ0.matrix().kron(onQ1.matrix()));
    }

    public static Unitary4 identity() {
        return new Unitary4(ComplexMatrix.identity(4));
    }

    /**
     * 연산 합성: this를 먼저 적용한 뒤 next를 적용.
     *
     * @param next 이후에 적용할 연산
     * @return next · this
     */
    public Unitary4 then(Unitary4 next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        return new Unitary4(next.matrix.multiply(matrix));
    }

    public boolean isUnitary(double atol) {
        return matrix.isUnitary(atol);
    }
}
