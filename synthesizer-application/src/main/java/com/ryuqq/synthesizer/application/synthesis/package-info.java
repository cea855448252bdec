/**
 * Native gate synthesis package.
 *
 * <p>This package turns small unitary matrices into ordered sequences of native
 * operations drawn from the fixed gate set (axis rotation, phase, coupling).</p>
 *
 * <h2>Entry Points</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.application.synthesis.SingleQubitSynthesizer} - 2x2 unitary → at most two gates</li>
 *   <li>{@link com.ryuqq.synthesizer.application.synthesis.ControlledOpSynthesizer} - controlled 2x2 unitary → bordered CZ power</li>
 *   <li>{@link com.ryuqq.synthesizer.application.synthesis.TwoQubitSynthesizer} - 4x4 unitary → KAK-based sequence</li>
 *   <li>{@link com.ryuqq.synthesizer.application.synthesis.GateSynthesizer} - Facade applying {@link com.ryuqq.synthesizer.application.synthesis.SynthesisConfig} tolerances</li>
 * </ul>
 *
 * <h2>Data Flow</h2>
 * <pre>
 * TwoQubitSynthesizer ──┐
 *                       ├─→ SingleQubitSynthesizer → TurnsNormalizer → AngleDeconstructor
 * ControlledOpSynthesizer ┘        (+ FramedPhaseDecomposer → EigenDecomposer SPI)
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Purity:</strong> Every call builds a fresh result; no process-wide state</li>
 *   <li><strong>Tolerance Boundaries:</strong> Gate elision drops {@code bound <= tolerance},
 *       the controlled identity check uses {@code <= tolerance},
 *       parity interactions are elided when {@code |rads| < tolerance}</li>
 *   <li><strong>Global Phase:</strong> Results match the input only up to a global phase</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synthesizer Team
 */
package com.ryuqq.synthesizer.application.synthesis;
