/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the numeric collaborators the synthesizers depend on
 * but do not implement themselves.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.core.spi.EigenDecomposer} - Eigenpairs of a 2x2 unitary</li>
 *   <li>{@link com.ryuqq.synthesizer.core.spi.KakDecomposer} - Cartan KAK factorization of a 4x4 unitary</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., synthesizer-adapter-analytic) provide concrete implementations.
 * The testkit module ships a replaying {@code FixedKakDecomposer} for tests.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on a linear algebra library</li>
 *   <li><strong>Reentrancy:</strong> Implementations must be pure; synthesizers hold no shared mutable state</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synthesizer Team
 */
package com.ryuqq.synthesizer.core.spi;
