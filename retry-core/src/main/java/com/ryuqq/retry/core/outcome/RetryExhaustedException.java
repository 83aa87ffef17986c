package com.ryuqq.retry.core.outcome;

/**
 * 설정된 재시도 횟수를 모두 소진했을 때 발생하는 예외.
 *
 * <p>값을 반환하는 재시도(리플렉션 호출, Callable 호출)에서만 발생합니다.
 * 콜백 기반 재시도는 이 예외 대신 소진 콜백을 호출합니다.</p>
 *
 * <p>마지막 시도의 실패가 있으면 {@link #getCause()}로 조회할 수 있습니다.
 * retryCount가 0이면 시도 자체가 없으므로 cause도 null입니다.</p>
 *
 * @author Retry Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends RuntimeException {

    private final int retryCount;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param retryCount 도달한 재시도 횟수
     * @param lastFailure 마지막 시도의 실패 (null 가능)
     */
    public RetryExhaustedException(String message, int retryCount, Throwable lastFailure) {
        super(message, lastFailure);
        this.retryCount = retryCount;
    }

    /**
     * 기본 메시지로 생성.
     *
     * @param retryCount 도달한 재시도 횟수
     * @param lastFailure 마지막 시도의 실패 (null 가능)
     * @return RetryExhaustedException 인스턴스
     */
    public static RetryExhaustedException of(int retryCount, Throwable lastFailure) {
        return new RetryExhaustedException(
            "Unable to perform action; retry count reached (retryCount: " + retryCount + ")",
            retryCount,
            lastFailure
        );
    }

    /**
     * 도달한 재시도 횟수 조회.
     *
     * @return 설정된 재시도 횟수
     */
    public int getRetryCount() {
        return retryCount;
    }
}
