package com.ryuqq.retry.executor;

import com.ryuqq.retry.core.spi.Sleeper;

import java.util.concurrent.TimeUnit;

/**
 * {@link Thread#sleep(long)} 기반 기본 Sleeper.
 *
 * <p>대기는 취소되지 않습니다. 대기 중 인터럽트가 발생해도 남은 시간만큼 계속 대기하고,
 * 반환 직전에 인터럽트 플래그를 복원합니다.</p>
 *
 * @author Retry Team
 * @since 1.0.0
 */
public final class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(long millis) {
        if (millis <= 0) {
            return;
        }

        boolean interrupted = false;
        try {
            long remainingNanos = TimeUnit.MILLISECONDS.toNanos(millis);
            long end = System.nanoTime() + remainingNanos;
            // Thread.sleep은 나노초를 반올림하므로 마감 시각까지 반복
            while (remainingNanos > 0) {
                try {
                    TimeUnit.NANOSECONDS.sleep(remainingNanos);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
                remainingNanos = end - System.nanoTime();
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
