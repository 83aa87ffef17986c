/**
 * Retry configuration.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.policy.RetryPolicy} - Fixed attempt budget and fixed wait interval</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retry Team
 */
package com.ryuqq.retry.core.policy;
