package com.ryuqq.retry.core.spi;

/**
 * 인자와 반환값이 없는 재시도 대상 작업.
 *
 * <p>{@link Runnable}과 달리 checked exception을 던질 수 있습니다.
 * 던져진 {@link Exception}은 모두 시도 실패로 처리됩니다.</p>
 *
 * @author Retry Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryableAction {

    /**
     * 작업 실행.
     *
     * @throws Exception 시도 실패 시
     */
    void run() throws Exception;
}
