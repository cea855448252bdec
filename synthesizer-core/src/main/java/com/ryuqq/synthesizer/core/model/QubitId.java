package com.ryuqq.synthesizer.core.model;

/**
 * 큐비트 식별자 (불투명 핸들).
 *
 * <p>합성기는 QubitId의 의미를 해석하지 않으며, 결과 연산에 그대로 바인딩합니다.</p>
 *
 * <p>null 또는 빈 문자열만 거부하며, 그 외 문자나 길이는 제한하지 않습니다.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class QubitId {

    private final String value;

    private QubitId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("QubitId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * QubitId 생성.
     *
     * @param value 식별자 값
     * @return QubitId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static QubitId of(String value) {
        return new QubitId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QubitId qubitId = (QubitId) o;
        return value.equals(qubitId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "QubitId{" + value + '}';
    }
}
