package com.ryuqq.retry.core.statemachine;

/**
 * 사이클 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → ATTEMPTING, EXHAUSTED</li>
 *   <li>ATTEMPTING → WAITING, SUCCEEDED, EXHAUSTED, CANCELLED</li>
 *   <li>WAITING → ATTEMPTING, PAUSED, EXHAUSTED, CANCELLED</li>
 *   <li>PAUSED → ATTEMPTING, CANCELLED</li>
 *   <li>SUCCEEDED, EXHAUSTED, CANCELLED → IDLE</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 IDLE로만 돌아갈 수 있음</li>
 *   <li>한 사이클에서 종료 상태는 한 번만 도달</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CycleTransition {

    private CycleTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CycleState from, CycleState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case IDLE -> to == CycleState.ATTEMPTING || to == CycleState.EXHAUSTED;
            case ATTEMPTING -> to == CycleState.WAITING
                || to == CycleState.SUCCEEDED
                || to == CycleState.EXHAUSTED
                || to == CycleState.CANCELLED;
            case WAITING -> to == CycleState.ATTEMPTING
                || to == CycleState.PAUSED
                || to == CycleState.EXHAUSTED
                || to == CycleState.CANCELLED;
            case PAUSED -> to == CycleState.ATTEMPTING || to == CycleState.CANCELLED;
            case SUCCEEDED, EXHAUSTED, CANCELLED -> to == CycleState.IDLE;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid cycle transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CycleState transition(CycleState current, CycleState next) {
        validate(current, next);
        return next;
    }
}
