/**
 * Retry strategy package.
 *
 * <p>Pure policy objects deciding, per attempt, whether a cycle continues and how long
 * the controller waits before the next attempt.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.strategy.RetryStrategy} - maxAttempts, attemptDelay, shouldRetry</li>
 * </ul>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.strategy.FixedDelayRetryStrategy} - Same delay for every attempt</li>
 *   <li>{@link com.ryuqq.retry.core.strategy.ExponentialBackoffRetryStrategy} - Doubling delay with jitter, capped</li>
 *   <li>{@link com.ryuqq.retry.core.strategy.ErrorFilteringRetryStrategy} - Stops early on non-retryable errors</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * RetryStrategy strategy = RetryStrategy.fixed(3, Duration.ofMillis(500));
 * strategy.attemptDelay(2);        // PT0.5S
 * strategy.shouldRetry(2, null);   // true
 * strategy.shouldRetry(3, null);   // false
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.core.strategy;
