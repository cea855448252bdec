package com.ryuqq.synthesizer.application.synthesis;

import com.ryuqq.synthesizer.core.gate.AxisRotationGate;
import com.ryuqq.synthesizer.core.gate.CouplingGate;
import com.ryuqq.synthesizer.core.gate.NativeOperation;
import com.ryuqq.synthesizer.core.gate.PhaseGate;
import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.model.QubitId;
import com.ryuqq.synthesizer.core.model.Unitary2;
import com.ryuqq.synthesizer.core.model.Unitary4;
import com.ryuqq.synthesizer.core.spi.InteractionCoefficients;
import com.ryuqq.synthesizer.core.spi.KakDecomposer;
import com.ryuqq.synthesizer.core.spi.KakDecomposition;
import com.ryuqq.synthesizer.testkit.contract.FixedKakDecomposer;
import com.ryuqq.synthesizer.testkit.matrix.Interactions;
import com.ryuqq.synthesizer.testkit.matrix.MatrixAssertions;
import com.ryuqq.synthesizer.testkit.matrix.OperationSimulator;
import com.ryuqq.synthesizer.testkit.matrix.Unitaries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * TwoQubitSynthesizer 테스트.
 *
 * <p>KAK 분해는 {@link FixedKakDecomposer}로 알려진 분해를 재생하거나 Mock으로 대체합니다.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
@DisplayName("TwoQubitSynthesizer 테스트")
class TwoQubitSynthesizerTest {

    private static final double ATOL = 1e-6;
    private static final QubitId Q0 = QubitId.of("q0");
    private static final QubitId Q1 = QubitId.of("q1");

    private static KakDecomposition randomDecomposition(Random random, InteractionCoefficients interaction) {
        return new KakDecomposition(
            Complex.expi(random.nextDouble() * 2 * Math.PI),
            Unitaries.random2(random),
            Unitaries.random2(random),
            interaction,
            Unitaries.random2(random),
            Unitaries.random2(random)
        );
    }

    private static double randomCoefficient(Random random) {
        return (random.nextDouble() - 0.5) * Math.PI / 2;
    }

    private static double reconstructionError(FixedKakDecomposer kak, double tolerance) {
        List<NativeOperation> operations = new TwoQubitSynthesizer(kak).synthesize(Q0, Q1, kak.target(), tolerance);
        Unitary4 actual = OperationSimulator.unitaryOf(operations, Q0, Q1);
        return MatrixAssertions.distanceUpToGlobalPhase(kak.target().matrix(), actual.matrix());
    }

    @Nested
    @DisplayName("재구성")
    class Reconstruction {

        @Test
        @DisplayName("알려진 KAK 분해로부터 무작위 2-큐비트 유니터리를 재구성한다")
        void 무작위_분해_재구성() {
            Random random = new Random(1234L);

            for (int i = 0; i < 30; i++) {
                // given
                InteractionCoefficients interaction = new InteractionCoefficients(
                    randomCoefficient(random), randomCoefficient(random), randomCoefficient(random)
                );
                FixedKakDecomposer kak = new FixedKakDecomposer(randomDecomposition(random, interaction));

                // when
                List<NativeOperation> operations = new TwoQubitSynthesizer(kak).synthesize(Q0, Q1, kak.target());

                // then
                assertThat(operations).filteredOn(op -> op.gate() instanceof CouplingGate).hasSize(3);
                MatrixAssertions.assertEquivalentUpToGlobalPhase(
                    kak.target().matrix(), OperationSimulator.unitaryOf(operations, Q0, Q1).matrix(), ATOL
                );
            }
        }

        @Test
        @DisplayName("CZ 와 SWAP 같은 표준 2-큐비트 게이트의 분해를 재구성한다")
        void 표준_게이트_재구성() {
            // given: SWAP ≅ exp(iπ/4·(XX + YY + ZZ))
            FixedKakDecomposer swap = new FixedKakDecomposer(new KakDecomposition(
                Complex.ONE, Unitary2.identity(), Unitary2.identity(),
                new InteractionCoefficients(Math.PI / 4, Math.PI / 4, Math.PI / 4),
                Unitary2.identity(), Unitary2.identity()
            ));

            // when
            List<NativeOperation> operations = new TwoQubitSynthesizer(swap).synthesize(Q0, Q1, Unitaries.swap());

            // then
            MatrixAssertions.assertEquivalentUpToGlobalPhase(
                Unitaries.swap().matrix(), OperationSimulator.unitaryOf(operations, Q0, Q1).matrix(), ATOL
            );
        }

        @Test
        @DisplayName("상호작용이 없으면 국소 연산만 남는다")
        void 상호작용_없음_국소_연산만() {
            // given
            FixedKakDecomposer kak = new FixedKakDecomposer(
                randomDecomposition(new Random(8L), new InteractionCoefficients(0, 0, 0))
            );

            // when
            List<NativeOperation> operations = new TwoQubitSynthesizer(kak).synthesize(Q0, Q1, kak.target());

            // then
            assertThat(operations).allSatisfy(op -> assertThat(op.qubits()).hasSize(1));
            MatrixAssertions.assertEquivalentUpToGlobalPhase(
                kak.target().matrix(), OperationSimulator.unitaryOf(operations, Q0, Q1).matrix(), ATOL
            );
        }

        @Test
        @DisplayName("허용 오차를 줄이면 재구성 오차가 늘어나지 않는다")
        void 허용_오차_감소시_오차_비증가() {
            // given
            FixedKakDecomposer kak = new FixedKakDecomposer(
                randomDecomposition(new Random(99L), new InteractionCoefficients(5e-4, 0.3, -0.2))
            );

            // when
            double coarse = reconstructionError(kak, 1e-3);
            double fine = reconstructionError(kak, 1e-10);

            // then
            assertThat(coarse).isGreaterThan(0.0).isLessThan(1e-2);
            assertThat(fine).isLessThanOrEqualTo(coarse);
            assertThat(fine).isLessThan(ATOL);
        }
    }

    @Nested
    @DisplayName("연산 순서")
    class Ordering {

        @Test
        @DisplayName("앞쪽 국소 연산은 q1, q0 순서이며 XX 상호작용은 Y^-0.5 프레이밍을 사용한다")
        void 순서_및_프레이밍() {
            // given
            FixedKakDecomposer kak = new FixedKakDecomposer(new KakDecomposition(
                Complex.ONE, Unitary2.identity(), Unitary2.identity(),
                new InteractionCoefficients(Math.PI / 8, 0, 0),
                Unitaries.pauliX(), Unitaries.hadamard()
            ));

            // when
            List<NativeOperation> operations = new TwoQubitSynthesizer(kak).synthesize(Q0, Q1, kak.target());

            // then
            assertThat(operations.get(0).qubits()).containsExactly(Q1);
            int coupling = indexOfCoupling(operations);
            assertThat(operations).hasSize(coupling + 5);
            assertThat(operations.subList(coupling - 2, coupling + 5)).containsExactly(
                TwoQubitSynthesizer.XX_FRAMING.on(Q0),
                TwoQubitSynthesizer.XX_FRAMING.on(Q1),
                CouplingGate.CZ.pow(0.5).on(Q0, Q1),
                PhaseGate.Z.pow(-0.25).on(Q0),
                PhaseGate.Z.pow(-0.25).on(Q1),
                TwoQubitSynthesizer.XX_FRAMING.inverse().on(Q0),
                TwoQubitSynthesizer.XX_FRAMING.inverse().on(Q1)
            );
            List<NativeOperation> locals = operations.subList(0, coupling - 2);
            int firstQ0 = locals.indexOf(locals.stream().filter(op -> op.actsOn(Q0)).findFirst().orElseThrow());
            assertThat(locals.subList(0, firstQ0)).allSatisfy(op -> assertThat(op.actsOn(Q1)).isTrue());
            assertThat(locals.subList(firstQ0, locals.size())).allSatisfy(op -> assertThat(op.actsOn(Q0)).isTrue());
        }

        @Test
        @DisplayName("프레이밍 게이트는 Z 를 X, Y 축으로 옮긴다")
        void 프레이밍_게이트_상수() {
            assertThat(TwoQubitSynthesizer.XX_FRAMING).isEqualTo(new AxisRotationGate(-0.25, 0.25));
            assertThat(TwoQubitSynthesizer.YY_FRAMING).isEqualTo(new AxisRotationGate(0.25, 0.0));
        }

        @Test
        @DisplayName("ZZ 상호작용은 프레이밍 없이 CZ^e, Z^h, Z^h 이다")
        void zz_상호작용_구조() {
            // when
            List<NativeOperation> operations = TwoQubitSynthesizer.parityInteraction(Q0, Q1, Math.PI / 4, null, 1e-8);

            // then
            assertThat(operations).containsExactly(
                CouplingGate.CZ.pow(1.0).on(Q0, Q1),
                PhaseGate.Z.pow(-0.5).on(Q0),
                PhaseGate.Z.pow(-0.5).on(Q1)
            );
        }

        @Test
        @DisplayName("허용 오차보다 작은 상호작용은 생략한다")
        void 작은_상호작용_생략() {
            assertThat(TwoQubitSynthesizer.parityInteraction(Q0, Q1, 5e-9, null, 1e-8)).isEmpty();
            assertThat(TwoQubitSynthesizer.parityInteraction(Q0, Q1, -5e-9, null, 1e-8)).isEmpty();
            assertThat(TwoQubitSynthesizer.parityInteraction(Q0, Q1, 1e-8, null, 1e-8)).hasSize(3);
        }

        @Test
        @DisplayName("parity 상호작용은 exp(i·θ·PP) 와 전역 위상을 제외하고 같다")
        void parity_상호작용_행렬() {
            double theta = 0.37;
            List<NativeOperation> xx = TwoQubitSynthesizer.parityInteraction(
                Q0, Q1, theta, TwoQubitSynthesizer.XX_FRAMING, 0.0);
            List<NativeOperation> yy = TwoQubitSynthesizer.parityInteraction(
                Q0, Q1, theta, TwoQubitSynthesizer.YY_FRAMING, 0.0);

            MatrixAssertions.assertEquivalentUpToGlobalPhase(
                Interactions.interaction(new InteractionCoefficients(theta, 0, 0)).matrix(),
                OperationSimulator.unitaryOf(xx, Q0, Q1).matrix(), 1e-12
            );
            MatrixAssertions.assertEquivalentUpToGlobalPhase(
                Interactions.interaction(new InteractionCoefficients(0, theta, 0)).matrix(),
                OperationSimulator.unitaryOf(yy, Q0, Q1).matrix(), 1e-12
            );
        }
    }

    @Nested
    @DisplayName("KAK 협력자")
    @ExtendWith(MockitoExtension.class)
    class KakCollaborator {

        @Mock
        private KakDecomposer kakDecomposer;

        @Test
        @DisplayName("기본 허용 오차 1e-8 을 KAK 분해에 전달한다")
        void 기본_허용_오차_전달() {
            // given
            Unitary4 mat = Unitary4.identity();
            when(kakDecomposer.decompose(any(), anyDouble())).thenReturn(new KakDecomposition(
                Complex.ONE, Unitary2.identity(), Unitary2.identity(),
                new InteractionCoefficients(0, 0, 0), Unitary2.identity(), Unitary2.identity()
            ));
            TwoQubitSynthesizer synthesizer = new TwoQubitSynthesizer(kakDecomposer);

            // when
            List<NativeOperation> operations = synthesizer.synthesize(Q0, Q1, mat);

            // then
            verify(kakDecomposer).decompose(eq(mat), eq(TwoQubitSynthesizer.DEFAULT_TOLERANCE));
            assertThat(operations).isEmpty();
        }

        @Test
        @DisplayName("잘못된 큐비트는 분해 전에 거부한다")
        void 잘못된_큐비트_거부() {
            TwoQubitSynthesizer synthesizer = new TwoQubitSynthesizer(kakDecomposer);

            assertThatThrownBy(() -> synthesizer.synthesize(Q0, Q0, Unitary4.identity()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
            assertThatThrownBy(() -> synthesizer.synthesize(null, Q1, Unitary4.identity()))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> synthesizer.synthesize(Q0, Q1, Unitary4.identity(), Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(kakDecomposer);
        }
    }

    private static int indexOfCoupling(List<NativeOperation> operations) {
        for (int i = 0; i < operations.size(); i++) {
            if (operations.get(i).gate() instanceof CouplingGate) {
                return i;
            }
        }
        throw new AssertionError("no coupling gate in " + operations);
    }
}
