/**
 * Testkit for RetryController.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retry.testkit.ScriptedAction} - Action returning scripted outcomes, sync or async</li>
 *   <li>{@link com.ryuqq.retry.testkit.StatusRecorder} - Status subscriber and callback that records events</li>
 *   <li>{@link com.ryuqq.retry.testkit.AbstractRetryControllerContractTest} - Base class for contract tests</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.testkit;
