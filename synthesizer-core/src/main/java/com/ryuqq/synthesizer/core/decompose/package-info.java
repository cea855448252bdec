/**
 * Leaf decomposers.
 *
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.core.decompose.AngleDeconstructor} - 2x2 unitary → ZYZ angles</li>
 *   <li>{@link com.ryuqq.synthesizer.core.decompose.TurnsNormalizer} - ZYZ angles → canonical turns</li>
 *   <li>{@link com.ryuqq.synthesizer.core.decompose.FramedPhaseDecomposer} - 2x2 unitary → framed phase form via the eigen SPI</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synthesizer Team
 */
package com.ryuqq.synthesizer.core.decompose;
