package com.ryuqq.synthesizer.core.math;

/**
 * 불변 복소수 값 객체.
 *
 * <p>행렬 원소, 고유값, 위상 인자(phase factor)를 표현하는 데 사용됩니다.</p>
 *
 * <p><strong>위상 규약:</strong></p>
 * <ul>
 *   <li>{@link #phase()}는 {@code atan2(imag, real)}이며 (-π, π] 범위</li>
 *   <li>0의 위상은 0 (예외를 던지지 않음)</li>
 * </ul>
 *
 * @param real 실수부
 * @param imag 허수부
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record Complex(double real, double imag) {

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);
    public static final Complex I = new Complex(0.0, 1.0);

    /**
     * 실수로부터 생성.
     *
     * @param real 실수 값
     * @return 허수부가 0인 Complex
     */
    public static Complex ofReal(double real) {
        return new Complex(real, 0.0);
    }

    /**
     * 단위 크기 위상 인자 e^{i·angle} 생성.
     *
     * @param angle 라디안 단위 각도
     * @return cos(angle) + i·sin(angle)
     */
    public static Complex expi(double angle) {
        return new Complex(Math.cos(angle), Math.sin(angle));
    }

    public Complex add(Complex other) {
        return new Complex(real + other.real, imag + other.imag);
    }

    public Complex subtract(Complex other) {
        return new Complex(real - other.real, imag - other.imag);
    }

    public Complex multiply(Complex other) {
        double r = real * other.real - imag * other.imag;
        double i = real * other.imag + imag * other.real;
        return new Complex(r, i);
    }

    /**
     * 복소 나눗셈.
     *
     * <p>분모가 0이면 IEEE 754 규칙에 따라 NaN/Infinity가 전파됩니다.</p>
     *
     * @param other 제수
     * @return this / other
     */
    public Complex divide(Complex other) {
        double denominator = other.absSquared();
        double r = (real * other.real + imag * other.imag) / denominator;
        double i = (imag * other.real - real * other.imag) / denominator;
        return new Complex(r, i);
    }

    public Complex scale(double factor) {
        return new Complex(real * factor, imag * factor);
    }

    public Complex conjugate() {
        return new Complex(real, -imag);
    }

    public Complex negate() {
        return new Complex(-real, -imag);
    }

    public double abs() {
        return Math.hypot(real, imag);
    }

    public double absSquared() {
        return real * real + imag * imag;
    }

    public double phase() {
        return Math.atan2(imag, real);
    }

    /**
     * 주 제곱근 (principal square root).
     *
     * <p>결과의 실수부는 항상 0 이상입니다.</p>
     *
     * @return sqrt(this)
     */
    public Complex sqrt() {
        double modulus = abs();
        double r = Math.sqrt((modulus + real) / 2.0);
        double i = Math.copySign(Math.sqrt((modulus - real) / 2.0), imag);
        return new Complex(r, i);
    }

    /**
     * 다른 복소수와의 거리 |this - other|.
     *
     * @param other 비교 대상
     * @return 두 값의 차의 크기
     */
    public double distanceTo(Complex other) {
        return Math.hypot(real - other.real, imag - other.imag);
    }

    public boolean isFinite() {
        return Double.isFinite(real) && Double.isFinite(imag);
    }

    @Override
    public String toString() {
        return String.format("(%f %s %fi)", real, (imag < 0 ? "-" : "+"), Math.abs(imag));
    }
}
