package com.ryuqq.synthesizer.testkit.contract;

import com.ryuqq.synthesizer.core.model.Unitary4;
import com.ryuqq.synthesizer.core.spi.KakDecomposer;
import com.ryuqq.synthesizer.core.spi.KakDecomposition;
import com.ryuqq.synthesizer.testkit.matrix.Interactions;

/**
 * {@link KakDecomposer} that replays a known factorization.
 *
 * <p>Tests choose the local operations and interaction coefficients, derive the
 * matching 4x4 unitary with {@link #target()}, and hand both to the synthesizer.
 * The decomposer does not inspect its input.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * FixedKakDecomposer kak = new FixedKakDecomposer(decomposition);
 * TwoQubitSynthesizer synthesizer = new TwoQubitSynthesizer(kak);
 * List&lt;NativeOperation&gt; ops = synthesizer.synthesize(q0, q1, kak.target());
 * </pre>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class FixedKakDecomposer implements KakDecomposer {

    private final KakDecomposition decomposition;

    /**
     * 생성자.
     *
     * @param decomposition 반환할 분해 결과
     * @throws IllegalArgumentException decomposition이 null인 경우
     */
    public FixedKakDecomposer(KakDecomposition decomposition) {
        if (decomposition == null) {
            throw new IllegalArgumentException("decomposition cannot be null");
        }
        this.decomposition = decomposition;
    }

    @Override
    public KakDecomposition decompose(Unitary4 mat, double tolerance) {
        if (mat == null) {
            throw new IllegalArgumentException("mat cannot be null");
        }
        return decomposition;
    }

    /**
     * 분해 결과가 나타내는 4x4 유니터리.
     */
    public Unitary4 target() {
        return Interactions.reconstruct(decomposition);
    }

    public KakDecomposition getDecomposition() {
        return decomposition;
    }
}
