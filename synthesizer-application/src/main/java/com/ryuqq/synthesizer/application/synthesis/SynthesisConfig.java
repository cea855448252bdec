package com.ryuqq.synthesizer.application.synthesis;

/**
 * 합성 허용 오차 설정 (불변 record).
 *
 * <p>이 record는 {@link GateSynthesizer}가 각 합성 경로에 사용할 기본 허용 오차를 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>singleQubitTolerance: 단일 큐비트 합성 허용 오차 (기본 0.0)</li>
 *   <li>controlledTolerance: 제어 연산 합성 허용 오차 (기본 0.0)</li>
 *   <li>twoQubitTolerance: 2-큐비트 합성 허용 오차 (기본 1e-8)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>게이트 수 감소: 허용 오차 증가 (무시 가능한 회전/상호작용 생략)</li>
 *   <li>정확도 우선: 허용 오차 0 (정확히 항등인 게이트만 생략)</li>
 * </ul>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 * @param singleQubitTolerance 단일 큐비트 허용 오차 (유한, 0 이상)
 * @param controlledTolerance 제어 연산 허용 오차 (유한, 0 이상)
 * @param twoQubitTolerance 2-큐비트 허용 오차 (유한, 0 이상)
 */
public record SynthesisConfig(
    double singleQubitTolerance,
    double controlledTolerance,
    double twoQubitTolerance
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: singleQubitTolerance=0.0, controlledTolerance=0.0, twoQubitTolerance=1e-8</p>
     */
    public SynthesisConfig() {
        this(0.0, 0.0, TwoQubitSynthesizer.DEFAULT_TOLERANCE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SynthesisConfig {
        requireValid("singleQubitTolerance", singleQubitTolerance);
        requireValid("controlledTolerance", controlledTolerance);
        requireValid("twoQubitTolerance", twoQubitTolerance);
    }

    /**
     * 세 경로 모두 같은 허용 오차를 쓰는 설정.
     *
     * @param tolerance 허용 오차
     * @return SynthesisConfig 인스턴스
     */
    public static SynthesisConfig uniform(double tolerance) {
        return new SynthesisConfig(tolerance, tolerance, tolerance);
    }

    /**
     * singleQubitTolerance만 변경한 새 인스턴스 생성.
     */
    public SynthesisConfig withSingleQubitTolerance(double singleQubitTolerance) {
        return new SynthesisConfig(singleQubitTolerance, controlledTolerance, twoQubitTolerance);
    }

    /**
     * controlledTolerance만 변경한 새 인스턴스 생성.
     */
    public SynthesisConfig withControlledTolerance(double controlledTolerance) {
        return new SynthesisConfig(singleQubitTolerance, controlledTolerance, twoQubitTolerance);
    }

    /**
     * twoQubitTolerance만 변경한 새 인스턴스 생성.
     */
    public SynthesisConfig withTwoQubitTolerance(double twoQubitTolerance) {
        return new SynthesisConfig(singleQubitTolerance, controlledTolerance, twoQubitTolerance);
    }

    private static void requireValid(String name, double tolerance) {
        if (!Double.isFinite(tolerance) || tolerance < 0.0) {
            throw new IllegalArgumentException(
                name + " must be finite and non-negative (current: " + tolerance + ")"
            );
        }
    }
}
