package com.ryuqq.retry.runtime;

import com.ryuqq.retry.core.model.RetryMode;

import java.util.concurrent.Flow;

/**
 * RetryController 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>mode: 실패 후 다음 시도 방식 (기본 AUTO)</li>
 *   <li>threadName: 이벤트 루프 스레드 이름 (기본 "retry-controller")</li>
 *   <li>statusBufferCapacity: 상태 구독자별 버퍼 크기 (기본 {@link Flow#defaultBufferSize()})</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param mode 재시도 모드 (null 불가)
 * @param threadName 이벤트 루프 스레드 이름 (blank 불가)
 * @param statusBufferCapacity 상태 구독자별 버퍼 크기 (1 이상이어야 함)
 */
public record RetryControllerConfig(
    RetryMode mode,
    String threadName,
    int statusBufferCapacity
) {

    public static final String DEFAULT_THREAD_NAME = "retry-controller";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: mode=AUTO, threadName="retry-controller", statusBufferCapacity=Flow.defaultBufferSize()</p>
     */
    public RetryControllerConfig() {
        this(RetryMode.AUTO, DEFAULT_THREAD_NAME, Flow.defaultBufferSize());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryControllerConfig {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        if (statusBufferCapacity <= 0) {
            throw new IllegalArgumentException(
                "statusBufferCapacity must be positive (current: " + statusBufferCapacity + ")"
            );
        }
    }

    /**
     * mode만 변경한 새 인스턴스 생성.
     */
    public RetryControllerConfig withMode(RetryMode mode) {
        return new RetryControllerConfig(mode, threadName, statusBufferCapacity);
    }

    /**
     * threadName만 변경한 새 인스턴스 생성.
     */
    public RetryControllerConfig withThreadName(String threadName) {
        return new RetryControllerConfig(mode, threadName, statusBufferCapacity);
    }

    /**
     * statusBufferCapacity만 변경한 새 인스턴스 생성.
     */
    public RetryControllerConfig withStatusBufferCapacity(int statusBufferCapacity) {
        return new RetryControllerConfig(mode, threadName, statusBufferCapacity);
    }
}
