package com.ryuqq.retry.testkit;

import com.ryuqq.retry.core.spi.Sleeper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 실제로 대기하지 않고 요청된 대기 시간만 기록하는 Sleeper.
 *
 * <p>재시도 루프가 대기를 몇 번, 얼마의 간격으로 요청했는지 검증할 때 사용합니다.
 * 여러 스레드에서 공유해도 안전합니다.</p>
 *
 * @author Retry Team
 * @since 1.0.0
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
    }

    /**
     * 대기 요청 횟수 조회.
     *
     * @return sleep() 호출 횟수
     */
    public int getSleepCount() {
        return sleeps.size();
    }

    /**
     * 요청된 대기 시간 목록 조회 (호출 순서).
     *
     * @return 대기 시간 목록 (불변 복사본)
     */
    public List<Long> getSleeps() {
        synchronized (sleeps) {
            return List.copyOf(sleeps);
        }
    }

    /**
     * 요청된 대기 시간의 합계.
     *
     * @return 대기 시간 합계 (밀리초)
     */
    public long getTotalSleepMillis() {
        synchronized (sleeps) {
            return sleeps.stream().mapToLong(Long::longValue).sum();
        }
    }

    /**
     * 기록 초기화.
     */
    public void clear() {
        sleeps.clear();
    }
}
