package com.ryuqq.synthesizer.core.model;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.math.ComplexMatrix;

/**
 * 단일 큐비트 연산을 나타내는 2x2 유니터리 행렬.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 불가</li>
 *   <li>차원: 정확히 2x2</li>
 *   <li>유니터리성은 검증하지 않음 (호출자 책임, {@link #isUnitary(double)} 참고)</li>
 * </ul>
 *
 * @param matrix 2x2 복소 행렬
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record Unitary2(ComplexMatrix matrix) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException matrix가 null이거나 2x2가 아닌 경우
     */
    public Unitary2 {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix cannot be null");
        }
        if (matrix.size() != 2) {
            throw new IllegalArgumentException(
                "Unitary2 requires a 2x2 matrix (current: " + matrix.size() + "x" + matrix.size() + ")"
            );
        }
    }

    /**
     * 원소로부터 생성.
     *
     * @return [[a, b], [c, d]]
     */
    public static Unitary2 of(Complex a, Complex b, Complex c, Complex d) {
        return new Unitary2(ComplexMatrix.of2x2(a, b, c, d));
    }

    /**
     * 2x2 항등 행렬.
     */
    public static Unitary2 identity() {
        return new Unitary2(ComplexMatrix.identity(2));
    }

    public Complex get(int row, int col) {
        return matrix.get(row, col);
    }

    /**
     * 연산 합성: this를 먼저 적용한 뒤 next를 적용.
     *
     * @param next 이후에 적용할 연산
     * @return next · this
     */
    public Unitary2 then(Unitary2 next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        return new Unitary2(next.matrix.multiply(matrix));
    }

    public Unitary2 adjoint() {
        return new Unitary2(matrix.adjoint());
    }

    public boolean isUnitary(double atol) {
        return matrix.isUnitary(atol);
    }
}
