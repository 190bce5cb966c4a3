package com.ryuqq.retry.core.strategy;

import java.time.Duration;

/**
 * 고정 지연 전략 (불변 record).
 *
 * <p>모든 시도 사이에 같은 지연 시간을 적용하고, shouldRetry는 기본 규칙
 * ({@code attemptNumber < maxAttempts})을 따릅니다.</p>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param delay 시도 간 지연 시간 (음수 불가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FixedDelayRetryStrategy(
    int maxAttempts,
    Duration delay
) implements RetryStrategy {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FixedDelayRetryStrategy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException(
                "delay must be non-negative (current: " + delay + ")"
            );
        }
    }

    @Override
    public Duration attemptDelay(int attemptNumber) {
        return delay;
    }
}
