package com.ryuqq.synthesizer.core.model;

/**
 * 네이티브 게이트 파라미터 (turn 단위, 각 값은 [-0.5, 0.5) 범위로 정규화됨).
 *
 * @param xyTurn XY 평면 축 회전량
 * @param xyPhaseTurn 회전 축의 위상 (X축에서 Y축 방향으로의 각도)
 * @param totalZTurn 마지막에 적용할 Z 위상량
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record TurnTriple(double xyTurn, double xyPhaseTurn, double totalZTurn) {
}
