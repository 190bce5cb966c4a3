/**
 * Retry value types package.
 *
 * <p>Immutable values shared between the strategy layer and the controller.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.model.RetryStatus} - Status events broadcast per cycle</li>
 *   <li>{@link com.ryuqq.retry.core.model.RetryMode} - Auto vs. manual continuation</li>
 *   <li>{@link com.ryuqq.retry.core.model.ActionResult} - The single result of one cycle</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.core.model;
