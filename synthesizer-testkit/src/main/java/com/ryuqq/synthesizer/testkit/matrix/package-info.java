/**
 * Matrix fixtures, reconstruction and assertions for tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.testkit.matrix.Unitaries} - Named and seeded random unitaries</li>
 *   <li>{@link com.ryuqq.synthesizer.testkit.matrix.Interactions} - KAK interaction and reconstruction matrices</li>
 *   <li>{@link com.ryuqq.synthesizer.testkit.matrix.OperationSimulator} - Native sequence → unitary</li>
 *   <li>{@link com.ryuqq.synthesizer.testkit.matrix.MatrixAssertions} - Equivalence up to global phase</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synthesizer Team
 */
package com.ryuqq.synthesizer.testkit.matrix;
