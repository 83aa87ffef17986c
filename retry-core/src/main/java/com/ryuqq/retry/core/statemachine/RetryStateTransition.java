package com.ryuqq.retry.core.statemachine;

/**
 * 재시도 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → ATTEMPTING</li>
 *   <li>IDLE → EXHAUSTED (시도 횟수 0)</li>
 *   <li>ATTEMPTING → SUCCEEDED</li>
 *   <li>ATTEMPTING → WAITING</li>
 *   <li>WAITING → ATTEMPTING</li>
 *   <li>WAITING → EXHAUSTED</li>
 * </ul>
 *
 * @author Retry Team
 * @since 1.0.0
 */
public final class RetryStateTransition {

    // Utility class - prevent instantiation
    private RetryStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RetryState from, RetryState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case IDLE -> to == RetryState.ATTEMPTING || to == RetryState.EXHAUSTED;
            case ATTEMPTING -> to == RetryState.SUCCEEDED || to == RetryState.WAITING;
            case WAITING -> to == RetryState.ATTEMPTING || to == RetryState.EXHAUSTED;
            case SUCCEEDED, EXHAUSTED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RetryState transition(RetryState current, RetryState next) {
        validate(current, next);
        return next;
    }
}
