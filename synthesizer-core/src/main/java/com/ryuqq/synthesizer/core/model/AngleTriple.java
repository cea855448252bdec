package com.ryuqq.synthesizer.core.model;

/**
 * ZYZ 분해 각도 (라디안).
 *
 * <p>적용 순서: prePhase 만큼 Z축 위상 → rotation 만큼 Y축 회전 → postPhase 만큼 Z축 위상.
 * 전역 위상은 포함하지 않습니다.</p>
 *
 * @param prePhase 먼저 적용되는 Z 위상
 * @param rotation Y축 회전 각도
 * @param postPhase 마지막에 적용되는 Z 위상
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record AngleTriple(double prePhase, double rotation, double postPhase) {
}
