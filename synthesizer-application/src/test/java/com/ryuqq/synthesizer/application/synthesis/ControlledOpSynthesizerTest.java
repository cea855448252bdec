package com.ryuqq.synthesizer.application.synthesis;

import com.ryuqq.synthesizer.adapter.analytic.ClosedFormEigenDecomposer;
import com.ryuqq.synthesizer.core.gate.CouplingGate;
import com.ryuqq.synthesizer.core.gate.NativeOperation;
import com.ryuqq.synthesizer.core.gate.PhaseGate;
import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.model.QubitId;
import com.ryuqq.synthesizer.core.model.Unitary2;
import com.ryuqq.synthesizer.core.model.Unitary4;
import com.ryuqq.synthesizer.core.spi.EigenDecomposer;
import com.ryuqq.synthesizer.core.spi.EigenPairs;
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
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ControlledOpSynthesizer 테스트.
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
@DisplayName("ControlledOpSynthesizer 테스트")
class ControlledOpSynthesizerTest {

    private static final double ATOL = 1e-9;
    private static final QubitId CONTROL = QubitId.of("control");
    private static final QubitId TARGET = QubitId.of("target");

    @Nested
    @DisplayName("닫힌 형식 고유분해 사용")
    class WithClosedFormEigen {

        private final ControlledOpSynthesizer synthesizer =
            new ControlledOpSynthesizer(new ClosedFormEigenDecomposer());

        @Test
        @DisplayName("제어 항등은 빈 리스트이다")
        void 제어_항등_빈_리스트() {
            assertThat(synthesizer.synthesize(CONTROL, TARGET, Unitary2.identity())).isEmpty();
            assertThat(synthesizer.synthesize(CONTROL, TARGET, Unitary2.identity(), 1e-3)).isEmpty();
        }

        @Test
        @DisplayName("전역 위상만 있는 연산도 빈 리스트이다")
        void 전역_위상만_빈_리스트() {
            // when
            List<NativeOperation> operations = synthesizer.synthesize(
                CONTROL, TARGET, Unitaries.withGlobalPhase(Unitary2.identity(), 0.6)
            );

            // then
            assertThat(operations).isEmpty();
        }

        @Test
        @DisplayName("CNOT 을 재구성한다")
        void cnot_재구성() {
            // when
            List<NativeOperation> operations = synthesizer.synthesize(CONTROL, TARGET, Unitaries.pauliX());

            // then
            assertThat(operations).filteredOn(op -> op.gate() instanceof CouplingGate).hasSize(1);
            assertReconstructs(Unitaries.controlled(Unitaries.pauliX()), operations, CONTROL, TARGET);
        }

        @Test
        @DisplayName("제어 큐비트가 하위 비트여도 재구성한다")
        void 제어_큐비트_하위_비트() {
            // given: q0 = target, q1 = control
            Unitary2 op = Unitaries.hadamard();
            Unitary4 swap = Unitaries.swap();
            Unitary4 expected = new Unitary4(
                swap.matrix().multiply(Unitaries.controlled(op).matrix()).multiply(swap.matrix())
            );

            // when
            List<NativeOperation> operations = synthesizer.synthesize(CONTROL, TARGET, op);

            // then
            assertReconstructs(expected, operations, TARGET, CONTROL);
        }

        @Test
        @DisplayName("무작위 제어 유니터리를 허용 오차 0 에서 재구성한다")
        void 무작위_제어_유니터리_재구성() {
            Random random = new Random(31L);

            for (int i = 0; i < 50; i++) {
                Unitary2 op = Unitaries.random2(random);

                List<NativeOperation> operations = synthesizer.synthesize(CONTROL, TARGET, op);

                assertReconstructs(Unitaries.controlled(op), operations, CONTROL, TARGET);
            }
        }

        @Test
        @DisplayName("뒤쪽 경계 연산은 앞쪽 경계 연산의 역순 역연산이다")
        void 경계_연산_대칭() {
            // when
            List<NativeOperation> operations = synthesizer.synthesize(
                CONTROL, TARGET, Unitaries.random2(new Random(5L))
            );

            // then
            int coupling = indexOfCoupling(operations);
            List<NativeOperation> before = operations.subList(0, coupling);
            List<NativeOperation> after = operations.subList(operations.size() - before.size(), operations.size());
            for (int i = 0; i < before.size(); i++) {
                assertThat(after.get(i)).isEqualTo(before.get(before.size() - 1 - i).inverse());
                assertThat(before.get(i).qubits()).containsExactly(TARGET);
            }
        }
    }

    @Nested
    @DisplayName("Mock 고유분해 사용")
    @ExtendWith(MockitoExtension.class)
    class WithMockedEigen {

        @Mock
        private EigenDecomposer eigenDecomposer;

        @Test
        @DisplayName("상대 위상이 허용 오차 내이면 경계 게이트를 만들지 않는다")
        void 허용_오차_내_항등() {
            // given
            when(eigenDecomposer.decompose(any())).thenReturn(
                new EigenPairs(Complex.ONE, Complex.expi(1e-4), Unitary2.identity())
            );
            ControlledOpSynthesizer synthesizer = new ControlledOpSynthesizer(eigenDecomposer);

            // when
            List<NativeOperation> operations = synthesizer.synthesize(CONTROL, TARGET, Unitaries.pauliZ(), 1e-3);

            // then
            assertThat(operations).isEmpty();
        }

        @Test
        @DisplayName("|z − 1| 이 허용 오차와 같으면 항등으로 본다 (≤ 비교)")
        void 상대_위상_허용_오차_경계() {
            // given: λ0 = 1 이면 z = λ1 이 그대로 전달된다
            Complex z = Complex.expi(0.05);
            double distance = z.distanceTo(Complex.ONE);
            when(eigenDecomposer.decompose(any())).thenReturn(
                new EigenPairs(Complex.ONE, z, Unitary2.identity())
            );
            ControlledOpSynthesizer synthesizer = new ControlledOpSynthesizer(eigenDecomposer);

            // when
            List<NativeOperation> atBound = synthesizer.synthesize(CONTROL, TARGET, Unitaries.pauliZ(), distance);
            List<NativeOperation> belowBound = synthesizer.synthesize(
                CONTROL, TARGET, Unitaries.pauliZ(), Math.nextDown(distance));

            // then
            assertThat(atBound).isEmpty();
            assertThat(belowBound).hasSize(1);
            assertThat(belowBound.get(0).gate()).isInstanceOf(CouplingGate.class);
        }

        @Test
        @DisplayName("|g − 1| 이 허용 오차와 같으면 위상 킥백을 생략한다 (> 비교)")
        void 위상_킥백_허용_오차_경계() {
            // given: z ≈ −1 이라 결합 게이트는 항상 남는다
            Complex g = Complex.expi(0.1);
            double distance = g.distanceTo(Complex.ONE);
            when(eigenDecomposer.decompose(any())).thenReturn(
                new EigenPairs(g, g.negate(), Unitary2.identity())
            );
            ControlledOpSynthesizer synthesizer = new ControlledOpSynthesizer(eigenDecomposer);

            // when
            List<NativeOperation> atBound = synthesizer.synthesize(CONTROL, TARGET, Unitaries.pauliZ(), distance);
            List<NativeOperation> belowBound = synthesizer.synthesize(
                CONTROL, TARGET, Unitaries.pauliZ(), Math.nextDown(distance));

            // then
            assertThat(atBound).hasSize(1);
            assertThat(atBound.get(0).gate()).isInstanceOf(CouplingGate.class);
            assertThat(belowBound).hasSize(2);
            assertThat(belowBound.get(1).gate()).isInstanceOf(PhaseGate.class);
            assertThat(belowBound.get(1).qubits()).containsExactly(CONTROL);
        }

        @Test
        @DisplayName("경계 게이트의 마지막 위상 게이트는 제거된다")
        void 마지막_위상_게이트_제거() {
            // given: U = V† = diag(1, e^(−0.9i)) 는 위상 게이트 하나로 합성된다
            Unitary2 eigenvectors = Unitaries.phase(0.9);
            when(eigenDecomposer.decompose(any())).thenReturn(
                new EigenPairs(Complex.ONE, Complex.I, eigenvectors)
            );
            ControlledOpSynthesizer synthesizer = new ControlledOpSynthesizer(eigenDecomposer);

            // when
            List<NativeOperation> operations = synthesizer.synthesize(CONTROL, TARGET, Unitaries.pauliZ());

            // then
            assertThat(operations).containsExactly(CouplingGate.CZ.pow(0.5).on(CONTROL, TARGET));
        }

        @Test
        @DisplayName("전역 위상이 1 이 아니면 제어 큐비트에 위상 킥백을 추가한다")
        void 위상_킥백() {
            // given
            double globalAngle = 0.4;
            when(eigenDecomposer.decompose(any())).thenReturn(new EigenPairs(
                Complex.expi(globalAngle), Complex.expi(globalAngle + Math.PI / 2), Unitary2.identity()
            ));
            ControlledOpSynthesizer synthesizer = new ControlledOpSynthesizer(eigenDecomposer);

            // when
            List<NativeOperation> operations = synthesizer.synthesize(CONTROL, TARGET, Unitaries.pauliZ());

            // then
            assertThat(operations).hasSize(2);
            assertThat(operations.get(0).gate()).isInstanceOf(CouplingGate.class);
            assertThat(operations.get(0).qubits()).containsExactly(CONTROL, TARGET);
            NativeOperation kickback = operations.get(1);
            assertThat(kickback.qubits()).containsExactly(CONTROL);
            assertThat(((PhaseGate) kickback.gate()).turns())
                .isCloseTo(0.5 * globalAngle / Math.PI, within(1e-12));
        }

        @Test
        @DisplayName("같은 큐비트를 제어/대상으로 주면 분해 전에 거부한다")
        void 같은_큐비트_거부() {
            ControlledOpSynthesizer synthesizer = new ControlledOpSynthesizer(eigenDecomposer);

            assertThatThrownBy(() -> synthesizer.synthesize(CONTROL, CONTROL, Unitaries.pauliX()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
            assertThatThrownBy(() -> synthesizer.synthesize(CONTROL, TARGET, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("operation cannot be null");
            verifyNoInteractions(eigenDecomposer);
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

    private static void assertReconstructs(
        Unitary4 expected,
        List<NativeOperation> operations,
        QubitId q0,
        QubitId q1
    ) {
        Unitary4 actual = OperationSimulator.unitaryOf(operations, q0, q1);
        MatrixAssertions.assertEquivalentUpToGlobalPhase(expected.matrix(), actual.matrix(), ATOL);
    }
}
