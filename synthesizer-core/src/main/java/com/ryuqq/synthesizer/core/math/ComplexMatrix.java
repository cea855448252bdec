package com.ryuqq.synthesizer.core.math;

import java.util.Arrays;

/**
 * 불변 정사각 복소 행렬.
 *
 * <p>단일/2-큐비트 연산자를 표현하는 데 필요한 최소한의 연산만 제공합니다:
 * 곱셈, 크로네커 곱, 켤레 전치, 원소 조회.</p>
 *
 * <p><strong>불변성:</strong> 생성 시 입력 배열을 방어적으로 복사하며,
 * 모든 연산은 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>인덱스 규약:</strong> {@code get(row, col)}, 0부터 시작.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class ComplexMatrix {

    private final int size;
    private final Complex[] entries;

    private ComplexMatrix(int size, Complex[] entries) {
        this.size = size;
        this.entries = entries;
    }

    /**
     * 행 배열로부터 행렬 생성.
     *
     * @param rows 행 우선(row-major) 원소 배열
     * @return ComplexMatrix 인스턴스
     * @throws IllegalArgumentException rows가 null/비어있거나, 정사각이 아니거나, null 원소를 포함하는 경우
     */
    public static ComplexMatrix of(Complex[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new IllegalArgumentException("rows cannot be null or empty");
        }
        int n = rows.length;
        Complex[] entries = new Complex[n * n];
        for (int r = 0; r < n; r++) {
            if (rows[r] == null || rows[r].length != n) {
                throw new IllegalArgumentException(
                    "matrix must be square (row " + r + " has length "
                        + (rows[r] == null ? "null" : rows[r].length) + ", expected " + n + ")"
                );
            }
            for (int c = 0; c < n; c++) {
                if (rows[r][c] == null) {
                    throw new IllegalArgumentException("entry (" + r + ", " + c + ") cannot be null");
                }
                entries[r * n + c] = rows[r][c];
            }
        }
        return new ComplexMatrix(n, entries);
    }

    /**
     * 실수 행렬로부터 생성.
     *
     * @param rows 행 우선 실수 원소 배열
     * @return ComplexMatrix 인스턴스
     * @throws IllegalArgumentException rows가 정사각이 아닌 경우
     */
    public static ComplexMatrix ofReal(double[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new IllegalArgumentException("rows cannot be null or empty");
        }
        Complex[][] complexRows = new Complex[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            if (rows[r] == null) {
                throw new IllegalArgumentException("row " + r + " cannot be null");
            }
            complexRows[r] = new Complex[rows[r].length];
            for (int c = 0; c < rows[r].length; c++) {
                complexRows[r][c] = Complex.ofReal(rows[r][c]);
            }
        }
        return of(complexRows);
    }

    /**
     * 2x2 행렬 생성 편의 메서드.
     */
    public static ComplexMatrix of2x2(Complex a, Complex b, Complex c, Complex d) {
        return of(new Complex[][]{{a, b}, {c, d}});
    }

    /**
     * n x n 항등 행렬.
     *
     * @param n 차원 (1 이상)
     * @return 항등 행렬
     * @throws IllegalArgumentException n이 양수가 아닌 경우
     */
    public static ComplexMatrix identity(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive (current: " + n + ")");
        }
        Complex[] entries = new Complex[n * n];
        Arrays.fill(entries, Complex.ZERO);
        for (int i = 0; i < n; i++) {
            entries[i * n + i] = Complex.ONE;
        }
        return new ComplexMatrix(n, entries);
    }

    /**
     * 대각 행렬.
     *
     * @param diagonal 대각 원소
     * @return diag(diagonal...)
     * @throws IllegalArgumentException diagonal이 null이거나 비어있는 경우
     */
    public static ComplexMatrix diagonal(Complex... diagonal) {
        if (diagonal == null || diagonal.length == 0) {
            throw new IllegalArgumentException("diagonal cannot be null or empty");
        }
        int n = diagonal.length;
        Complex[] entries = new Complex[n * n];
        Arrays.fill(entries, Complex.ZERO);
        for (int i = 0; i < n; i++) {
            if (diagonal[i] == null) {
                throw new IllegalArgumentException("diagonal entry " + i + " cannot be null");
            }
            entries[i * n + i] = diagonal[i];
        }
        return new ComplexMatrix(n, entries);
    }

    public int size() {
        return size;
    }

    public Complex get(int row, int col) {
        if (row < 0 || row >= size || col < 0 || col >= size) {
            throw new IndexOutOfBoundsException(
                "(" + row + ", " + col + ") is outside a " + size + "x" + size + " matrix"
            );
        }
        return entries[row * size + col];
    }

    /**
     * 행렬 곱 this · other.
     *
     * @param other 우측 피연산자
     * @return 곱 행렬
     * @throws IllegalArgumentException 차원이 다른 경우
     */
    public ComplexMatrix multiply(ComplexMatrix other) {
        requireSameSize(other);
        Complex[] result = new Complex[size * size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                double re = 0.0;
                double im = 0.0;
                for (int k = 0; k < size; k++) {
                    Complex a = entries[r * size + k];
                    Complex b = other.entries[k * size + c];
                    re += a.real() * b.real() - a.imag() * b.imag();
                    im += a.real() * b.imag() + a.imag() * b.real();
                }
                result[r * size + c] = new Complex(re, im);
            }
        }
        return new ComplexMatrix(size, result);
    }

    /**
     * 크로네커 곱 this ⊗ other.
     *
     * <p>좌측 인자가 결과 기저 인덱스의 상위 비트에 해당합니다.</p>
     *
     * @param other 우측 인자
     * @return (size·other.size) 차원 행렬
     */
    public ComplexMatrix kron(ComplexMatrix other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        int n = size * other.size;
        Complex[] result = new Complex[n * n];
        for (int r1 = 0; r1 < size; r1++) {
            for (int c1 = 0; c1 < size; c1++) {
                Complex a = entries[r1 * size + c1];
                for (int r2 = 0; r2 < other.size; r2++) {
                    for (int c2 = 0; c2 < other.size; c2++) {
                        int row = r1 * other.size + r2;
                        int col = c1 * other.size + c2;
                        result[row * n + col] = a.multiply(other.entries[r2 * other.size + c2]);
                    }
                }
            }
        }
        return new ComplexMatrix(n, result);
    }

    /**
     * 켤레 전치 (Hermitian adjoint).
     */
    public ComplexMatrix adjoint() {
        Complex[] result = new Complex[size * size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                result[c * size + r] = entries[r * size + c].conjugate();
            }
        }
        return new ComplexMatrix(size, result);
    }

    public ComplexMatrix scale(Complex factor) {
        Complex[] result = new Complex[size * size];
        for (int i = 0; i < result.length; i++) {
            result[i] = entries[i].multiply(factor);
        }
        return new ComplexMatrix(size, result);
    }

    /**
     * 원소별 최대 거리 max|this[i,j] - other[i,j]|.
     *
     * @param other 비교 대상 (같은 차원)
     * @return 최대 원소 거리
     */
    public double maxDistanceTo(ComplexMatrix other) {
        requireSameSize(other);
        double max = 0.0;
        for (int i = 0; i < entries.length; i++) {
            max = Math.max(max, entries[i].distanceTo(other.entries[i]));
        }
        return max;
    }

    /**
     * 유니터리 여부 검사 (M·M† ≈ I).
     *
     * @param atol 원소별 절대 허용 오차
     * @return 유니터리이면 true
     */
    public boolean isUnitary(double atol) {
        return multiply(adjoint()).maxDistanceTo(identity(size)) <= atol;
    }

    private void requireSameSize(ComplexMatrix other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        if (other.size != size) {
            throw new IllegalArgumentException(
                "matrix sizes must match (this: " + size + ", other: " + other.size + ")"
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComplexMatrix that = (ComplexMatrix) o;
        return size == that.size && Arrays.equals(entries, that.entries);
    }

    @Override
    public int hashCode() {
        return 31 * size + Arrays.hashCode(entries);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ComplexMatrix{");
        for (int r = 0; r < size; r++) {
            sb.append(r == 0 ? "[" : ", [");
            for (int c = 0; c < size; c++) {
                if (c > 0) {
                    sb.append(", ");
                }
                sb.append(entries[r * size + c]);
            }
            sb.append(']');
        }
        return sb.append('}').toString();
    }
}
