/**
 * Contract test infrastructure for SPI implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.synthesizer.testkit.contract.AbstractEigenDecomposerContractTest} -
 *       Abstract contract suite every {@code EigenDecomposer} adapter must pass</li>
 *   <li>{@link com.ryuqq.synthesizer.testkit.contract.FixedKakDecomposer} -
 *       Replaying {@code KakDecomposer} for two qubit synthesis tests</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synthesizer Team
 */
package com.ryuqq.synthesizer.testkit.contract;
