package com.ryuqq.synthesizer.core.spi;

import com.ryuqq.synthesizer.core.model.Unitary2;

/**
 * Eigendecomposition SPI for 2x2 unitaries.
 *
 * <p>The core never computes eigenvectors itself; it only interprets the result
 * of this collaborator (see {@code FramedPhaseDecomposer}).</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>{@code mat · v_i = λ_i · v_i} for i = 0, 1, where {@code v_i} is column i of the eigenvector matrix</li>
 *   <li>The eigenvector matrix is unitary (orthonormal columns)</li>
 *   <li>Ordering between the two eigenpairs is implementation-defined but
 *       deterministic: identical input always yields identical output</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Pure and reentrant: safely callable from multiple threads without locking</li>
 *   <li>No validation of unitarity is required; behaviour on non-unitary input is undefined</li>
 * </ul>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public interface EigenDecomposer {

    /**
     * Computes the eigenpairs of a 2x2 unitary.
     *
     * @param mat the matrix to decompose
     * @return the two eigenvalues and the matching eigenvector matrix
     * @throws IllegalArgumentException if mat is null
     */
    EigenPairs decompose(Unitary2 mat);
}
