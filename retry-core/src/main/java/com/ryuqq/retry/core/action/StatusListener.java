package com.ryuqq.retry.core.action;

import com.ryuqq.retry.core.model.RetryStatus;

/**
 * 상태 이벤트 콜백.
 *
 * <p>상태 채널 발행 직후, 컨트롤러 이벤트 루프 스레드에서 호출됩니다.
 * 블로킹 작업을 수행하면 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StatusListener {

    void onStatus(RetryStatus status);
}
