package com.ryuqq.retry.core.model;

/**
 * 재시도 사이클의 상태 이벤트.
 *
 * <p>RetryController가 상태 채널과 상태 콜백으로 브로드캐스트하는 이벤트 어휘입니다.</p>
 *
 * <p><strong>이벤트 순서:</strong></p>
 * <pre>
 * ATTEMPT* → (SUCCESS | FAIL | CANCELED)
 * </pre>
 *
 * <ul>
 *   <li>ATTEMPT는 유일한 비종료 이벤트이며 0회 이상 발생</li>
 *   <li>종료 이벤트는 사이클당 정확히 한 번, 항상 마지막에 발생</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RetryStatus {

    /**
     * 실패한 시도 이후 다음 시도가 허용됨 (사이클 계속).
     */
    ATTEMPT,

    /**
     * 액션이 non-null 값을 반환함.
     */
    SUCCESS,

    /**
     * 시도 횟수 소진 또는 전략이 재시도를 거부함.
     */
    FAIL,

    /**
     * cancel() 호출로 사이클이 취소됨.
     */
    CANCELED;

    /**
     * 종료 이벤트인지 확인.
     *
     * @return ATTEMPT를 제외한 모든 상태에서 true
     */
    public boolean isTerminal() {
        return this != ATTEMPT;
    }
}
