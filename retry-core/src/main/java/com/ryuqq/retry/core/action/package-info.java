/**
 * Caller-facing callback contracts.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.action.RetryAction} - Synchronous action (value, null, or exception)</li>
 *   <li>{@link com.ryuqq.retry.core.action.AsyncRetryAction} - Action backed by a CompletionStage</li>
 *   <li>{@link com.ryuqq.retry.core.action.StatusListener} - Optional status callback</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.core.action;
