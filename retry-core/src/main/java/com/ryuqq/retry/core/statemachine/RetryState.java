package com.ryuqq.retry.core.statemachine;

/**
 * 재시도 호출 한 건의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *  │
 *  ├─► EXHAUSTED (retryCount = 0)
 *  │
 *  ▼ (시작)
 * ATTEMPTING ◄──────────┐
 *  │                    │ (대기 완료, 횟수 남음)
 *  ├─► SUCCEEDED (성공) │
 *  │                    │
 *  └─► WAITING (실패) ──┤
 *                       │
 *                       └─► EXHAUSTED (대기 완료, 횟수 소진)
 *
 * 금지된 전이:
 * - SUCCEEDED → * ❌
 * - EXHAUSTED → * ❌
 * - ATTEMPTING → ATTEMPTING ❌ (실패 후 대기 생략 불가)
 * - ATTEMPTING → EXHAUSTED ❌ (마지막 실패 후에도 대기)
 * </pre>
 *
 * @author Retry Team
 * @since 1.0.0
 */
public enum RetryState {

    /**
     * 호출 전.
     */
    IDLE,

    /**
     * 작업 실행 중.
     */
    ATTEMPTING,

    /**
     * 실패 후 대기 중.
     */
    WAITING,

    /**
     * 성공 (종료).
     */
    SUCCEEDED,

    /**
     * 재시도 횟수 소진 (종료).
     */
    EXHAUSTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 EXHAUSTED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
