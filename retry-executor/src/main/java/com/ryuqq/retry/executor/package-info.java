/**
 * Retry Executor - 고정 간격 재시도 실행.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.executor.RetryExecutor} - 콜백/리플렉션/Callable 재시도 정적 헬퍼</li>
 *   <li>{@link com.ryuqq.retry.executor.ThreadSleeper} - 취소되지 않는 기본 대기</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * retry-executor (RetryExecutor, ThreadSleeper)
 *   ↓ depends on
 * retry-core (RetryOutcome, RetryPolicy, RetryState, Sleeper SPI)
 * </pre>
 *
 * @author Retry Team
 * @since 1.0.0
 */
package com.ryuqq.retry.executor;
