package com.ryuqq.retry.core.spi;

/**
 * 실패 후 대기 단계 SPI.
 *
 * <p>Executor는 시도가 실패할 때마다 (마지막 시도 포함) 설정된 간격으로 한 번 호출합니다.
 * 호출 스레드에서 동기적으로 실행됩니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>millis 동안 호출 스레드를 블로킹</li>
 *   <li>0은 즉시 반환</li>
 *   <li>대기를 중간에 취소하지 않음</li>
 * </ul>
 *
 * <p>테스트에서는 실제로 대기하지 않고 호출만 기록하는 구현으로 교체할 수 있습니다.</p>
 *
 * @author Retry Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정된 시간 동안 대기.
     *
     * @param millis 대기 시간 (밀리초, 0 이상)
     */
    void sleep(long millis);
}
