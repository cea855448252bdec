/**
 * Analytic adapter implementation package.
 *
 * <p>This package provides closed-form implementations of the numeric SPIs
 * declared in {@code com.ryuqq.synthesizer.core.spi}.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.adapter.analytic.ClosedFormEigenDecomposer}:
 *       Deterministic eigendecomposition of 2x2 unitaries via the characteristic polynomial</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Determinism:</strong> Fixed eigenvalue ordering, documented on each implementation</li>
 *   <li><strong>Reentrancy:</strong> Stateless, no locking required</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Only 2x2 inputs; the 4x4 KAK factorization is not provided here</li>
 *   <li>Unitarity of the input is assumed, not checked</li>
 * </ul>
 *
 * @see com.ryuqq.synthesizer.core.spi.EigenDecomposer
 * @author Synthesizer Team
 * @since 1.0.0
 */
package com.ryuqq.synthesizer.adapter.analytic;
