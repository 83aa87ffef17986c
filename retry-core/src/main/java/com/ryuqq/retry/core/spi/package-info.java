/**
 * Retry SPI (Service Provider Interface) 패키지.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.spi.RetryableAction} - 재시도 대상 작업 (checked exception 허용)</li>
 *   <li>{@link com.ryuqq.retry.core.spi.Sleeper} - 실패 후 블로킹 대기</li>
 * </ul>
 *
 * @author Retry Team
 * @since 1.0.0
 */
package com.ryuqq.retry.core.spi;
