package com.ryuqq.retry.core.policy;

/**
 * 재시도 설정 (불변 record).
 *
 * <p>재시도 횟수와 고정 대기 간격을 담습니다. 간격은 시도마다 증가하지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>retryCount: 최대 시도 횟수 (기본 3, 0이면 시도 없이 바로 소진)</li>
 *   <li>retryIntervalMillis: 실패 후 대기 간격 (기본 1000ms)</li>
 * </ul>
 *
 * <p><strong>전체 대기 상한:</strong> 모든 시도가 실패하면 마지막 시도 후에도 대기하므로
 * 대기 시간의 합은 {@link #maxTotalWaitMillis()}와 같습니다.
 * 호출자는 이 값으로 전체 소요 시간을 제한할 수 있습니다.</p>
 *
 * @author Retry Team
 * @since 1.0.0
 * @param retryCount 최대 시도 횟수 (0 이상이어야 함)
 * @param retryIntervalMillis 대기 간격 (밀리초, 0 이상이어야 함)
 */
public record RetryPolicy(
    int retryCount,
    long retryIntervalMillis
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: retryCount=3, retryIntervalMillis=1000ms</p>
     */
    public RetryPolicy() {
        this(3, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (retryCount < 0) {
            throw new IllegalArgumentException(
                "retryCount must be non-negative (current: " + retryCount + ")"
            );
        }
        if (retryIntervalMillis < 0) {
            throw new IllegalArgumentException(
                "retryIntervalMillis must be non-negative (current: " + retryIntervalMillis + ")"
            );
        }
    }

    /**
     * RetryPolicy 생성.
     *
     * @param retryCount 최대 시도 횟수
     * @param retryIntervalMillis 대기 간격 (밀리초)
     * @return RetryPolicy 인스턴스
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public static RetryPolicy of(int retryCount, long retryIntervalMillis) {
        return new RetryPolicy(retryCount, retryIntervalMillis);
    }

    /**
     * retryCount만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withRetryCount(int retryCount) {
        return new RetryPolicy(retryCount, retryIntervalMillis);
    }

    /**
     * retryIntervalMillis만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withRetryIntervalMillis(long retryIntervalMillis) {
        return new RetryPolicy(retryCount, retryIntervalMillis);
    }

    /**
     * 모든 시도가 실패했을 때의 대기 시간 합계.
     *
     * @return retryCount * retryIntervalMillis (overflow 시 Long.MAX_VALUE)
     */
    public long maxTotalWaitMillis() {
        if (retryIntervalMillis != 0 && retryCount > Long.MAX_VALUE / retryIntervalMillis) {
            return Long.MAX_VALUE;
        }
        return retryCount * retryIntervalMillis;
    }
}
