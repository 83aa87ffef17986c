package com.ryuqq.retry.core.outcome;

import java.util.Optional;

/**
 * 재시도 알림 단위의 결과.
 *
 * <p>시도 실패 시마다, 그리고 재시도 횟수 소진 시 한 번 새로 생성되어 콜백에 전달됩니다.
 * 콜백이 반환된 뒤에는 Executor가 이 값을 보관하지 않습니다.</p>
 *
 * <p><strong>두 가지 형태:</strong></p>
 * <ul>
 *   <li>시도 실패: {@code exception}이 존재 ({@link #ofFailure(int, long, Exception)})</li>
 *   <li>횟수 소진: {@code exception}이 없음 ({@link #ofExhaustion(int, long)})</li>
 * </ul>
 *
 * @param attemptCount 현재까지 시도 횟수 (0 이상, 소진 알림에서는 설정된 retryCount)
 * @param retryIntervalMillis 설정된 재시도 간격 (밀리초, 0 이상)
 * @param exception 시도 중 발생한 예외 (소진 알림에서는 null)
 *
 * @author Retry Team
 * @since 1.0.0
 */
public record RetryOutcome(
    int attemptCount,
    long retryIntervalMillis,
    Exception exception
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException attemptCount 또는 retryIntervalMillis가 음수인 경우
     */
    public RetryOutcome {
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be non-negative (current: " + attemptCount + ")");
        }
        if (retryIntervalMillis < 0) {
            throw new IllegalArgumentException("retryIntervalMillis must be non-negative (current: " + retryIntervalMillis + ")");
        }
        // exception은 null 허용 (소진 알림)
    }

    /**
     * 시도 실패 결과 생성.
     *
     * @param attemptCount 실패한 시도 번호 (1부터 시작)
     * @param retryIntervalMillis 재시도 간격 (밀리초)
     * @param exception 시도 중 발생한 예외
     * @return RetryOutcome 인스턴스
     * @throws IllegalArgumentException exception이 null이거나 attemptCount가 양수가 아닌 경우
     */
    public static RetryOutcome ofFailure(int attemptCount, long retryIntervalMillis, Exception exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        return new RetryOutcome(attemptCount, retryIntervalMillis, exception);
    }

    /**
     * 재시도 횟수 소진 결과 생성.
     *
     * @param retryCount 설정된 재시도 횟수
     * @param retryIntervalMillis 재시도 간격 (밀리초)
     * @return exception이 없는 RetryOutcome 인스턴스
     */
    public static RetryOutcome ofExhaustion(int retryCount, long retryIntervalMillis) {
        return new RetryOutcome(retryCount, retryIntervalMillis, null);
    }

    /**
     * 시도 실패 예외 조회.
     *
     * @return 시도 실패 예외, 소진 알림인 경우 empty
     */
    public Optional<Exception> failure() {
        return Optional.ofNullable(exception);
    }

    /**
     * 소진 알림인지 확인.
     *
     * @return exception이 없으면 true
     */
    public boolean isExhausted() {
        return exception == null;
    }

    @Override
    public String toString() {
        return "RetryOutcome{attemptCount=" + attemptCount
            + ", retryIntervalMillis=" + retryIntervalMillis
            + ", exception=" + exception + '}';
    }
}
