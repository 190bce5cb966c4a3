package com.ryuqq.retry.core.strategy;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 재시도 불가능한 오류에서 사이클을 조기 종료시키는 데코레이터.
 *
 * <p>지연 시간과 maxAttempts는 delegate를 그대로 따르고, shouldRetry에서만
 * lastError를 검사합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see RetryStrategy#retryOn(Predicate)
 */
public final class ErrorFilteringRetryStrategy implements RetryStrategy {

    private final RetryStrategy delegate;
    private final Predicate<? super Throwable> retryable;

    /**
     * 생성자.
     *
     * @param delegate 감쌀 전략
     * @param retryable 재시도 가능한 오류 판별 함수
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ErrorFilteringRetryStrategy(RetryStrategy delegate, Predicate<? super Throwable> retryable) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (retryable == null) {
            throw new IllegalArgumentException("retryable cannot be null");
        }
        this.delegate = delegate;
        this.retryable = retryable;
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    @Override
    public Duration attemptDelay(int attemptNumber) {
        return delegate.attemptDelay(attemptNumber);
    }

    @Override
    public boolean shouldRetry(int attemptNumber, Throwable lastError) {
        if (lastError != null && !retryable.test(lastError)) {
            return false;
        }
        return delegate.shouldRetry(attemptNumber, lastError);
    }

    public RetryStrategy getDelegate() {
        return delegate;
    }

    @Override
    public String toString() {
        return "ErrorFilteringRetryStrategy{delegate=" + delegate + "}";
    }
}
