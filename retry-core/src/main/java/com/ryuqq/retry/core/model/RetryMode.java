package com.ryuqq.retry.core.model;

/**
 * 실패한 시도 이후 다음 시도를 누가 시작할지 결정하는 모드.
 *
 * <p>RetryController 생성 시점에 고정되며 이후 변경되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RetryMode {

    /**
     * 지연 후 컨트롤러가 직접 다음 시도를 수행.
     */
    AUTO,

    /**
     * ATTEMPT 이벤트 이후 사이클을 일시정지하고 resume() 호출을 기다림.
     */
    MANUAL
}
