package com.ryuqq.retry.testkit;

import com.ryuqq.retry.core.spi.RetryableAction;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 지정된 횟수만큼 실패한 뒤 성공하는 작업.
 *
 * <p>{@link #alwaysFailing()}은 매 호출마다 실패하고, {@link #failingTimes(int)}는
 * n번 실패한 뒤부터 성공합니다. 실패 시 던진 예외는 호출 순서대로 기록됩니다.</p>
 *
 * @author Retry Team
 * @since 1.0.0
 */
public class FlakyAction implements RetryableAction {

    private final int failures;
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<Exception> thrown = new CopyOnWriteArrayList<>();

    private FlakyAction(int failures) {
        if (failures < 0) {
            throw new IllegalArgumentException("failures must be non-negative (current: " + failures + ")");
        }
        this.failures = failures;
    }

    /**
     * n번 실패한 뒤 성공하는 작업 생성.
     *
     * @param failures 실패 횟수 (0이면 첫 호출부터 성공)
     * @return FlakyAction 인스턴스
     */
    public static FlakyAction failingTimes(int failures) {
        return new FlakyAction(failures);
    }

    /**
     * 항상 실패하는 작업 생성.
     *
     * @return FlakyAction 인스턴스
     */
    public static FlakyAction alwaysFailing() {
        return new FlakyAction(Integer.MAX_VALUE);
    }

    @Override
    public void run() throws Exception {
        int invocation = invocations.incrementAndGet();
        if (invocation <= failures) {
            Exception e = new IllegalStateException("simulated failure #" + invocation);
            thrown.add(e);
            throw e;
        }
    }

    /**
     * 호출 횟수 조회.
     *
     * @return run() 호출 횟수
     */
    public int getInvocationCount() {
        return invocations.get();
    }

    /**
     * 지금까지 던진 예외 목록 (호출 순서).
     *
     * @return 예외 목록 (불변 복사본)
     */
    public List<Exception> getThrown() {
        return List.copyOf(thrown);
    }
}
