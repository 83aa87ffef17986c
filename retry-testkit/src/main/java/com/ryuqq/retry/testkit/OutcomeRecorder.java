package com.ryuqq.retry.testkit;

import com.ryuqq.retry.core.outcome.RetryOutcome;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 전달받은 {@link RetryOutcome}을 순서대로 기록하는 콜백.
 *
 * @author Retry Team
 * @since 1.0.0
 */
public class OutcomeRecorder implements Consumer<RetryOutcome> {

    private final List<RetryOutcome> outcomes = new CopyOnWriteArrayList<>();

    @Override
    public void accept(RetryOutcome outcome) {
        outcomes.add(outcome);
    }

    public List<RetryOutcome> getOutcomes() {
        return List.copyOf(outcomes);
    }

    public int getCount() {
        return outcomes.size();
    }

    /**
     * 기록된 attemptCount 목록 (호출 순서).
     *
     * @return attemptCount 목록
     */
    public List<Integer> getAttemptCounts() {
        return outcomes.stream().map(RetryOutcome::attemptCount).toList();
    }

    /**
     * 마지막으로 기록된 결과 조회.
     *
     * @return 마지막 RetryOutcome
     * @throws IllegalStateException 기록이 없는 경우
     */
    public RetryOutcome last() {
        if (outcomes.isEmpty()) {
            throw new IllegalStateException("No outcome recorded");
        }
        return outcomes.get(outcomes.size() - 1);
    }

    public void clear() {
        outcomes.clear();
    }
}
