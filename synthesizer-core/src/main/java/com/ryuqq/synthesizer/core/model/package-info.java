/**
 * Domain model package.
 *
 * <p>Immutable value objects exchanged between the decomposers and synthesizers.</p>
 *
 * <h2>Matrices</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.core.model.Unitary2} - Single qubit operation (2x2)</li>
 *   <li>{@link com.ryuqq.synthesizer.core.model.Unitary4} - Two qubit operation (4x4, q0 is the high index bit)</li>
 * </ul>
 *
 * <h2>Intermediate Forms</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.core.model.AngleTriple} - ZYZ angles in radians</li>
 *   <li>{@link com.ryuqq.synthesizer.core.model.TurnTriple} - Canonical native gate parameters in turns</li>
 *   <li>{@link com.ryuqq.synthesizer.core.model.FramedPhaseForm} - (U, relative phase, global phase)</li>
 * </ul>
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.core.model.QubitId} - Opaque qubit handle</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> No value changes after construction</li>
 *   <li><strong>No Unitarity Validation:</strong> Matrices are checked for shape only; callers own unitarity</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synthesizer Team
 */
package com.ryuqq.synthesizer.core.model;
