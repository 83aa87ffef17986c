/**
 * Retry testkit - test doubles and contract-test base.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retry.testkit.RecordingSleeper} - Records waits without blocking</li>
 *   <li>{@link com.ryuqq.retry.testkit.FlakyAction} - Fails n times, then succeeds</li>
 *   <li>{@link com.ryuqq.retry.testkit.OutcomeRecorder} - Records callback notifications</li>
 *   <li>{@link com.ryuqq.retry.testkit.AbstractRetryContractTest} - Shared fixtures and assertions</li>
 * </ul>
 *
 * @author Retry Team
 * @since 1.0.0
 */
package com.ryuqq.retry.testkit;
