package com.ryuqq.retry.core.strategy;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 재시도 정책.
 *
 * <p>시도 번호(1부터 시작)와 마지막 오류를 받아 계속할지, 다음 시도까지 얼마나 기다릴지 결정합니다.
 * 구현체는 불변이어야 합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #maxAttempts()}: 한 사이클에서 액션을 호출하는 최대 횟수 (hard ceiling)</li>
 *   <li>{@link #attemptDelay(int)}: 음수가 아닌 지연 시간, 예외를 던지지 않음</li>
 *   <li>{@link #shouldRetry(int, Throwable)}: 기본 규칙은 {@code attemptNumber < maxAttempts}</li>
 * </ul>
 *
 * <p>컨트롤러는 shouldRetry 결과와 무관하게 maxAttempts를 넘겨 액션을 호출하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RetryStrategy fixed = RetryStrategy.fixed(4, Duration.ofSeconds(1));
 *
 * RetryStrategy backoff = RetryStrategy.exponential(5, Duration.ofMillis(200), Duration.ofSeconds(10), 0.1)
 *     .retryOn(e -&gt; e instanceof java.io.IOException);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RetryStrategy {

    /**
     * 한 사이클의 최대 시도 횟수.
     *
     * @return 최대 시도 횟수 (포함)
     */
    int maxAttempts();

    /**
     * attemptNumber번째 시도 이후 다음 시도까지의 지연 시간.
     *
     * @param attemptNumber 방금 끝난 시도 번호 (1부터 시작)
     * @return 지연 시간 (non-null, 음수 아님)
     */
    Duration attemptDelay(int attemptNumber);

    /**
     * attemptNumber번째 시도가 실패한 뒤 다음 시도를 계속할지 결정.
     *
     * @param attemptNumber 방금 끝난 시도 번호
     * @param lastError 마지막 시도의 오류 (액션이 null을 반환한 경우 null)
     * @return 계속하면 true
     */
    default boolean shouldRetry(int attemptNumber, Throwable lastError) {
        return attemptNumber < maxAttempts();
    }

    /**
     * lastError가 predicate를 통과할 때만 재시도하도록 감싼 전략을 반환.
     *
     * <p>액션이 null을 반환한 경우(lastError == null)는 항상 재시도 대상입니다.</p>
     *
     * @param retryable 재시도 가능한 오류 판별 함수
     * @return 오류 필터가 적용된 전략
     * @throws IllegalArgumentException retryable이 null인 경우
     */
    default RetryStrategy retryOn(Predicate<? super Throwable> retryable) {
        return new ErrorFilteringRetryStrategy(this, retryable);
    }

    /**
     * 고정 지연 전략 생성.
     *
     * @param maxAttempts 최대 시도 횟수 (양수)
     * @param delay 시도 간 지연 시간 (음수 불가)
     * @return FixedDelayRetryStrategy
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    static RetryStrategy fixed(int maxAttempts, Duration delay) {
        return new FixedDelayRetryStrategy(maxAttempts, delay);
    }

    /**
     * Exponential Backoff with Jitter 전략 생성.
     *
     * @param maxAttempts 최대 시도 횟수 (양수)
     * @param baseDelay 첫 지연 시간 (양수)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @return ExponentialBackoffRetryStrategy
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    static RetryStrategy exponential(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFactor) {
        return new ExponentialBackoffRetryStrategy(maxAttempts, baseDelay, maxDelay, jitterFactor);
    }
}
