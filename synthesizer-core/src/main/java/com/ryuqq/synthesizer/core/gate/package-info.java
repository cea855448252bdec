/**
 * Native gate set package.
 *
 * <p>This package defines the sealed interface hierarchy for the fixed native gate
 * vocabulary, providing compile-time exhaustiveness over gate kinds.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.core.gate.NativeGate} - permits SingleQubitGate, CouplingGate</li>
 *   <li>{@link com.ryuqq.synthesizer.core.gate.SingleQubitGate} - permits AxisRotationGate, PhaseGate</li>
 * </ul>
 *
 * <h2>Gates</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.core.gate.AxisRotationGate} - Rotation around an axis in the XY plane</li>
 *   <li>{@link com.ryuqq.synthesizer.core.gate.PhaseGate} - Rotation around Z</li>
 *   <li>{@link com.ryuqq.synthesizer.core.gate.CouplingGate} - Controlled phase between two qubits</li>
 * </ul>
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.core.gate.NativeOperation} - Gate bound to qubits</li>
 *   <li>{@link com.ryuqq.synthesizer.core.gate.OperationSequence} - Ordered flattening and inversion of operation lists</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synthesizer Team
 */
package com.ryuqq.synthesizer.core.gate;
