package com.ryuqq.retry.core.strategy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff with Jitter 전략.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 여러 컨트롤러가 같은 시점에 몰리는 현상을 완화합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attemptNumber-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=200ms, maxDelay=10s, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attemptNumber=1: 200ms + jitter(0-20ms)</li>
 *   <li>attemptNumber=2: 400ms + jitter(0-40ms)</li>
 *   <li>attemptNumber=3: 800ms + jitter(0-80ms)</li>
 *   <li>attemptNumber=10: 102400ms → 10000ms (maxDelay로 제한)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExponentialBackoffRetryStrategy implements RetryStrategy {

    // 2^62 이상은 long 범위를 넘으므로 shift를 제한
    private static final int MAX_SHIFT = 62;

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 생성자.
     *
     * @param maxAttempts 최대 시도 횟수 (양수여야 함)
     * @param baseDelay 기본 지연 시간 (양수여야 함)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExponentialBackoffRetryStrategy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFactor) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelay == null || maxDelay == null) {
            throw new IllegalArgumentException(
                "delays cannot be null (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (baseDelay.toMillis() <= 0) {
            throw new IllegalArgumentException(
                "baseDelay must be positive (current: " + baseDelay + ")"
            );
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.jitterFactor = jitterFactor;
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * 지연 시간 계산.
     *
     * <p>0 이하의 attemptNumber는 1로 취급합니다 (계약상 예외를 던지지 않음).</p>
     *
     * @param attemptNumber 방금 끝난 시도 번호 (1부터 시작)
     * @return baseDelay 이상 maxDelay 이하의 지연 시간
     */
    @Override
    public Duration attemptDelay(int attemptNumber) {
        int shift = Math.min(Math.max(attemptNumber, 1) - 1, MAX_SHIFT);

        // 1. 지수적 백오프 (overflow 시 maxDelay로 고정)
        long multiplier = 1L << shift;
        long exponential = baseDelayMs > maxDelayMs / multiplier
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());

        // 3. 최대값 제한
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public Duration getBaseDelay() {
        return Duration.ofMillis(baseDelayMs);
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryStrategy{maxAttempts=" + maxAttempts
            + ", baseDelayMs=" + baseDelayMs
            + ", maxDelayMs=" + maxDelayMs
            + ", jitterFactor=" + jitterFactor + "}";
    }
}
