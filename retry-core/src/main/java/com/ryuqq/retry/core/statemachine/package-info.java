/**
 * Retry cycle state machine package.
 *
 * <p>Defines the lifecycle of one retry cycle and the transitions the controller may take.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.statemachine.CycleState} - Cycle lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.retry.core.statemachine.CycleTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * CycleState state = CycleState.IDLE;
 * state = CycleTransition.transition(state, CycleState.ATTEMPTING);
 * state = CycleTransition.transition(state, CycleState.SUCCEEDED);
 * state = CycleTransition.transition(state, CycleState.IDLE);
 *
 * // This will throw IllegalStateException
 * CycleTransition.validate(CycleState.SUCCEEDED, CycleState.ATTEMPTING);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.core.statemachine;
