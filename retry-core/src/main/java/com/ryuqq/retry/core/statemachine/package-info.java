/**
 * Retry invocation state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.statemachine.RetryState} - Lifecycle states of one retry invocation (enum)</li>
 *   <li>{@link com.ryuqq.retry.core.statemachine.RetryStateTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * IDLE → ATTEMPTING (start)
 * IDLE → EXHAUSTED (zero budget)
 * ATTEMPTING → SUCCEEDED (call returned)
 * ATTEMPTING → WAITING (call failed)
 * WAITING → ATTEMPTING (interval elapsed, budget left)
 * WAITING → EXHAUSTED (interval elapsed, budget spent)
 *
 * Forbidden:
 * - SUCCEEDED → * (terminal state)
 * - EXHAUSTED → * (terminal state)
 * - Skipping WAITING after a failure
 * </pre>
 *
 * @since 1.0.0
 * @author Retry Team
 */
package com.ryuqq.retry.core.statemachine;
