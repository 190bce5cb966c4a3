package com.ryuqq.retry.core.statemachine;

/**
 * 재시도 사이클의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *  │
 *  ├─► EXHAUSTED (maxAttempts &lt; 1)
 *  ▼
 * ATTEMPTING ◄──────────────┐
 *  │                        │
 *  ├─► SUCCEEDED            │ (AUTO)
 *  ├─► EXHAUSTED (복구 불가 오류)
 *  ▼                        │
 * WAITING ──────────────────┤
 *  │                        │
 *  ├─► EXHAUSTED            │
 *  ▼ (MANUAL)               │
 * PAUSED ───── resume() ────┘
 *
 * ATTEMPTING, WAITING, PAUSED ─► CANCELLED
 * SUCCEEDED, EXHAUSTED, CANCELLED ─► IDLE (teardown)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CycleState {

    /**
     * 진행 중인 사이클 없음.
     */
    IDLE,

    /**
     * 액션 호출 중 (완료 대기).
     */
    ATTEMPTING,

    /**
     * 다음 시도까지 지연 타이머 대기 중.
     */
    WAITING,

    /**
     * MANUAL 모드에서 resume() 대기 중.
     */
    PAUSED,

    /**
     * 성공 (종료).
     */
    SUCCEEDED,

    /**
     * 시도 소진 (종료).
     */
    EXHAUSTED,

    /**
     * 취소 (종료).
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED, EXHAUSTED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED || this == CANCELLED;
    }

    /**
     * 사이클이 진행 중인지 확인.
     *
     * <p>진행 중인 동안 들어온 execute() 호출은 skip 처리됩니다.</p>
     *
     * @return ATTEMPTING, WAITING, PAUSED인 경우 true
     */
    public boolean isRunning() {
        return this == ATTEMPTING || this == WAITING || this == PAUSED;
    }
}
