package com.ryuqq.synthesizer.core.spi;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.model.Unitary2;

/**
 * Result of {@link EigenDecomposer#decompose(Unitary2)}.
 *
 * @param eigenvalue0 first eigenvalue
 * @param eigenvalue1 second eigenvalue
 * @param eigenvectors matrix whose column i is the eigenvector of eigenvalue i
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record EigenPairs(Complex eigenvalue0, Complex eigenvalue1, Unitary2 eigenvectors) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if any component is null
     */
    public EigenPairs {
        if (eigenvalue0 == null || eigenvalue1 == null) {
            throw new IllegalArgumentException("eigenvalues cannot be null");
        }
        if (eigenvectors == null) {
            throw new IllegalArgumentException("eigenvectors cannot be null");
        }
    }
}
