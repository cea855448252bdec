package com.ryuqq.synthesizer.core.gate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * NativeOperation 순서 있는 시퀀스 빌더.
 *
 * <p>중첩된 연산 조각(앞쪽 경계 게이트, 결합 게이트, 위상 보정 등)을
 * 주어진 순서대로 평탄화(flatten)하여 하나의 불변 리스트로 만듭니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * List&lt;NativeOperation&gt; ops = OperationSequence.builder()
 *     .addAll(before)
 *     .add(effect)
 *     .addAll(after)
 *     .build();
 * </pre>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class OperationSequence {

    private OperationSequence() {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 연산 시퀀스의 역.
     *
     * <p>순서를 뒤집고 각 연산을 역연산으로 바꿉니다.
     * 결과를 원래 시퀀스 뒤에 적용하면 항등이 됩니다.</p>
     *
     * @param operations 원래 시퀀스
     * @return 역 시퀀스 (불변)
     * @throws IllegalArgumentException operations가 null인 경우
     */
    public static List<NativeOperation> inverseOf(List<NativeOperation> operations) {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        List<NativeOperation> result = new ArrayList<>(operations.size());
        for (int i = operations.size() - 1; i >= 0; i--) {
            result.add(operations.get(i).inverse());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 순서 있는 시퀀스 빌더.
     */
    public static final class Builder {

        private final List<NativeOperation> operations = new ArrayList<>();

        private Builder() {}

        public Builder add(NativeOperation operation) {
            if (operation == null) {
                throw new IllegalArgumentException("operation cannot be null");
            }
            operations.add(operation);
            return this;
        }

        public Builder addAll(Collection<NativeOperation> more) {
            if (more == null) {
                throw new IllegalArgumentException("operations cannot be null");
            }
            for (NativeOperation operation : more) {
                add(operation);
            }
            return this;
        }

        public List<NativeOperation> build() {
            return List.copyOf(operations);
        }
    }
}
