/**
 * Retry notification and terminal failure types.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.outcome.RetryOutcome} - Per-notification record (attempt failure or exhaustion)</li>
 *   <li>{@link com.ryuqq.retry.core.outcome.RetryExhaustedException} - Thrown by value-returning retries once the budget is spent</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * RetryExecutor.executeWithRetry(action, 3, 100,
 *     outcome -&gt; log.warn("attempt {} failed", outcome.attemptCount(), outcome.exception()),
 *     outcome -&gt; log.error("gave up after {} attempts", outcome.attemptCount()));
 * </pre>
 *
 * @since 1.0.0
 * @author Retry Team
 */
package com.ryuqq.retry.core.outcome;
