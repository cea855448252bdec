package com.ryuqq.synthesizer.testkit.matrix;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.math.ComplexMatrix;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Global-phase-insensitive matrix assertions.
 *
 * <p>Two unitaries are equivalent up to global phase when {@code actual = e^(iθ)·expected}
 * for some θ. The phase is estimated from the largest-magnitude entry of {@code expected}.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class MatrixAssertions {

    private MatrixAssertions() {}

    /**
     * 전역 위상 보정 후 원소별 최대 거리.
     *
     * @return min over θ 근사값 max|e^(iθ)·expected − actual|
     */
    public static double distanceUpToGlobalPhase(ComplexMatrix expected, ComplexMatrix actual) {
        int size = expected.size();
        int bestRow = 0;
        int bestCol = 0;
        double bestAbs = -1.0;
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                double abs = expected.get(r, c).abs();
                if (abs > bestAbs) {
                    bestAbs = abs;
                    bestRow = r;
                    bestCol = c;
                }
            }
        }
        Complex ratio = actual.get(bestRow, bestCol).divide(expected.get(bestRow, bestCol));
        double ratioAbs = ratio.abs();
        Complex phase = ratioAbs == 0.0 || !ratio.isFinite() ? Complex.ONE : ratio.scale(1.0 / ratioAbs);
        return expected.scale(phase).maxDistanceTo(actual);
    }

    /**
     * 전역 위상을 제외하고 같은지 검증.
     *
     * @param expected 기대 행렬
     * @param actual 실제 행렬
     * @param atol 원소별 절대 허용 오차
     */
    public static void assertEquivalentUpToGlobalPhase(ComplexMatrix expected, ComplexMatrix actual, double atol) {
        assertThat(actual.size())
            .as("matrix size")
            .isEqualTo(expected.size());
        assertThat(distanceUpToGlobalPhase(expected, actual))
            .as("distance up to global phase between%n  expected: %s%n  actual:   %s", expected, actual)
            .isLessThanOrEqualTo(atol);
    }
}
