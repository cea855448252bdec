package com.ryuqq.synthesizer.core.spi;

import com.ryuqq.synthesizer.core.model.Unitary4;

/**
 * Cartan (KAK) decomposition SPI for 4x4 unitaries.
 *
 * <p>Factors a two-qubit operation into local single-qubit operations sandwiching
 * a three-parameter interaction. The two-qubit synthesizer treats the routine
 * as a black box.</p>
 *
 * <p><strong>Contract (up to floating point error bounded by the tolerance):</strong></p>
 * <pre>
 * mat = g · (q0After ⊗ q1After) · exp(i·(x·XX + y·YY + z·ZZ)) · (q0Before ⊗ q1Before)
 * </pre>
 * <p>The left tensor factor acts on q0, the most significant bit of the basis index
 * (see {@link Unitary4}).</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Pure and reentrant</li>
 *   <li>Deterministic for identical input</li>
 * </ul>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public interface KakDecomposer {

    /**
     * Decomposes a two-qubit unitary.
     *
     * @param mat the 4x4 unitary
     * @param tolerance absolute tolerance the routine may use for its internal checks
     * @return the KAK factorization
     * @throws IllegalArgumentException if mat is null
     */
    KakDecomposition decompose(Unitary4 mat, double tolerance);
}
