package com.ryuqq.synthesizer.core.math;

/**
 * Turn(회전 비율) 단위 유틸리티.
 *
 * <p>1.0 turn은 완전한 한 바퀴 회전입니다. 게이트 파라미터는 모두 turn 단위이며,
 * 정규 대표값은 [-0.5, 0.5) 범위에 있습니다.</p>
 *
 * <p><strong>정규화 공식:</strong></p>
 * <pre>
 * signedMod1(x) = ((x + 0.5) mod 1) - 0.5
 * </pre>
 * <p>mod는 수학적 나머지(결과가 항상 0 이상)입니다.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class Turns {

    /**
     * 완전한 한 바퀴의 라디안 값 (2π).
     */
    public static final double TAU = 2 * Math.PI;

    private Turns() {}

    /**
     * turn 값을 [-0.5, 0.5) 범위로 정규화.
     *
     * <p>음수 입력도 올바르게 감싸며(wrap), 결과는 멱등입니다:
     * {@code signedMod1(signedMod1(x)) == signedMod1(x)}.</p>
     *
     * @param x 임의의 turn 값
     * @return [-0.5, 0.5) 범위의 동치 값
     */
    public static double signedMod1(double x) {
        double m = (x + 0.5) % 1.0;
        if (m < 0) {
            m += 1.0;
        }
        // -1e-17 + 1.0 rounds up to 1.0
        if (m >= 1.0) {
            m -= 1.0;
        }
        return m - 0.5;
    }

    public static double toRadians(double turns) {
        return turns * TAU;
    }
}
