package com.ryuqq.retry.executor;

import com.ryuqq.retry.core.outcome.RetryExhaustedException;
import com.ryuqq.retry.core.outcome.RetryOutcome;
import com.ryuqq.retry.core.policy.RetryPolicy;
import com.ryuqq.retry.core.spi.RetryableAction;
import com.ryuqq.retry.core.spi.Sleeper;
import com.ryuqq.retry.core.statemachine.RetryState;
import com.ryuqq.retry.core.statemachine.RetryStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * 고정 간격 재시도 실행기.
 *
 * <p>작업을 최대 retryCount번 호출하고, 실패할 때마다 retryIntervalMillis만큼 대기합니다.
 * 성공하면 남은 시도 없이 즉시 반환합니다.</p>
 *
 * <p><strong>진입점:</strong></p>
 * <ul>
 *   <li>{@code executeWithRetry(RetryableAction, ...)}: 콜백 기반, 반환값 없음, 소진 시 예외 없음</li>
 *   <li>{@code executeWithRetry(Method, Object, ...)}: 리플렉션 호출, 반환값 전달, 소진 시 {@link RetryExhaustedException}</li>
 *   <li>{@code callWithRetry(Callable, ...)}: Callable 호출, 반환값 전달, 소진 시 {@link RetryExhaustedException}</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * count = 0
 * while (count &lt; retryCount):
 *   1. 작업 호출 → 성공 시 즉시 반환 (SUCCEEDED)
 *   2. 실패 시:
 *      a. 실패 알림 (콜백 또는 로그)
 *      b. sleeper.sleep(retryIntervalMillis) (마지막 실패 후에도 대기)
 *      c. count++
 * 소진 (EXHAUSTED): 소진 콜백 호출 또는 RetryExhaustedException
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>모든 작업은 호출 스레드에서 동기적으로 실행됩니다.</li>
 *   <li>호출 간 공유 상태가 없어 동시 호출이 서로 영향을 주지 않습니다.</li>
 * </ul>
 *
 * @author Retry Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    // Utility class - prevent instantiation
    private RetryExecutor() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // ============================================================
    // 콜백 기반 재시도
    // ============================================================

    /**
     * 콜백 없이 작업을 재시도.
     *
     * <p>모든 시도가 실패해도 호출자에게 아무것도 알리지 않습니다.</p>
     *
     * @param action 실행할 작업
     * @param retryCount 최대 시도 횟수
     * @param retryIntervalMillis 실패 후 대기 간격 (밀리초)
     * @throws IllegalArgumentException action이 null이거나 설정값이 음수인 경우
     */
    public static void executeWithRetry(RetryableAction action, int retryCount, long retryIntervalMillis) {
        executeWithRetry(action, retryCount, retryIntervalMillis, null, null);
    }

    /**
     * 작업을 재시도하고 실패/소진을 콜백으로 알림.
     *
     * @param action 실행할 작업
     * @param retryCount 최대 시도 횟수
     * @param retryIntervalMillis 실패 후 대기 간격 (밀리초)
     * @param onRetryFailure 시도 실패마다 호출 (null 가능)
     * @param onRetryCountExceeded 재시도 횟수 소진 시 한 번 호출 (null 가능)
     * @throws IllegalArgumentException action이 null이거나 설정값이 음수인 경우
     */
    public static void executeWithRetry(
        RetryableAction action,
        int retryCount,
        long retryIntervalMillis,
        Consumer<RetryOutcome> onRetryFailure,
        Consumer<RetryOutcome> onRetryCountExceeded
    ) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        executeWithRetry(action, RetryPolicy.of(retryCount, retryIntervalMillis), new ThreadSleeper(),
            onRetryFailure, onRetryCountExceeded);
    }

    /**
     * 작업을 재시도하고 실패/소진을 콜백으로 알림 (Policy, Sleeper 주입).
     *
     * <p>콜백이 던진 예외는 그대로 호출자에게 전파되며 재시도를 중단합니다.
     * {@link Error}는 시도 실패로 처리하지 않고 그대로 전파합니다.</p>
     *
     * @param action 실행할 작업
     * @param policy 재시도 설정
     * @param sleeper 대기 구현
     * @param onRetryFailure 시도 실패마다 호출 (null 가능)
     * @param onRetryCountExceeded 재시도 횟수 소진 시 한 번 호출 (null 가능)
     * @throws IllegalArgumentException action, policy 또는 sleeper가 null인 경우
     */
    public static void executeWithRetry(
        RetryableAction action,
        RetryPolicy policy,
        Sleeper sleeper,
        Consumer<RetryOutcome> onRetryFailure,
        Consumer<RetryOutcome> onRetryCountExceeded
    ) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        validate(policy, sleeper);

        int retryCount = policy.retryCount();
        long interval = policy.retryIntervalMillis();
        RetryState state = RetryState.IDLE;
        int count = 0;

        while (count < retryCount) {
            state = RetryStateTransition.transition(state, RetryState.ATTEMPTING);
            try {
                action.run();
                RetryStateTransition.transition(state, RetryState.SUCCEEDED);
                return;
            } catch (Exception e) {
                state = RetryStateTransition.transition(state, RetryState.WAITING);
                restoreInterrupt(e);
                log.debug("Attempt {}/{} failed: {}", count + 1, retryCount, e.getMessage());

                if (onRetryFailure != null) {
                    onRetryFailure.accept(RetryOutcome.ofFailure(count + 1, interval, e));
                }

                sleeper.sleep(interval);
                count++;
            }
        }

        RetryStateTransition.transition(state, RetryState.EXHAUSTED);
        if (onRetryCountExceeded != null) {
            onRetryCountExceeded.accept(RetryOutcome.ofExhaustion(retryCount, interval));
        } else {
            log.debug("Retry count {} reached with no exhaustion callback", retryCount);
        }
    }

    // ============================================================
    // 리플렉션 호출 재시도
    // ============================================================

    /**
     * target에 대해 method를 재시도 호출하고 반환값을 전달.
     *
     * @param method 호출할 메서드
     * @param target 메서드를 호출할 인스턴스
     * @param retryCount 최대 시도 횟수
     * @param retryIntervalMillis 실패 후 대기 간격 (밀리초)
     * @param args 매 시도마다 그대로 전달할 인자
     * @return 메서드 반환값 (void 메서드는 null)
     * @throws IllegalArgumentException method 또는 target이 null이거나 설정값이 음수인 경우
     * @throws RetryExhaustedException 모든 시도가 실패한 경우
     */
    public static Object executeWithRetry(
        Method method,
        Object target,
        int retryCount,
        long retryIntervalMillis,
        Object... args
    ) {
        validate(method, target);
        return executeWithRetry(method, target, RetryPolicy.of(retryCount, retryIntervalMillis),
            new ThreadSleeper(), args);
    }

    /**
     * target에 대해 method를 재시도 호출하고 반환값을 전달 (Policy, Sleeper 주입).
     *
     * <p>시도 실패는 WARN 로그로만 기록됩니다. {@link InvocationTargetException}은
     * 메서드가 던진 원래 예외로 풀어서 기록합니다.</p>
     *
     * @param method 호출할 메서드
     * @param target 메서드를 호출할 인스턴스
     * @param policy 재시도 설정
     * @param sleeper 대기 구현
     * @param args 매 시도마다 그대로 전달할 인자
     * @return 메서드 반환값 (void 메서드는 null)
     * @throws IllegalArgumentException method, target, policy 또는 sleeper가 null인 경우
     * @throws RetryExhaustedException 모든 시도가 실패한 경우
     */
    public static Object executeWithRetry(
        Method method,
        Object target,
        RetryPolicy policy,
        Sleeper sleeper,
        Object... args
    ) {
        validate(method, target);
        validate(policy, sleeper);
        return retryUntilExhausted(() -> invoke(method, target, args), policy, sleeper);
    }

    // ============================================================
    // Callable 재시도
    // ============================================================

    /**
     * Callable을 재시도 호출하고 반환값을 전달.
     *
     * @param callable 호출할 작업
     * @param retryCount 최대 시도 횟수
     * @param retryIntervalMillis 실패 후 대기 간격 (밀리초)
     * @param <T> 반환 타입
     * @return callable 반환값
     * @throws IllegalArgumentException callable이 null이거나 설정값이 음수인 경우
     * @throws RetryExhaustedException 모든 시도가 실패한 경우
     */
    public static <T> T callWithRetry(Callable<T> callable, int retryCount, long retryIntervalMillis) {
        if (callable == null) {
            throw new IllegalArgumentException("callable cannot be null");
        }
        return callWithRetry(callable, RetryPolicy.of(retryCount, retryIntervalMillis), new ThreadSleeper());
    }

    /**
     * Callable을 재시도 호출하고 반환값을 전달 (Policy, Sleeper 주입).
     *
     * @param callable 호출할 작업
     * @param policy 재시도 설정
     * @param sleeper 대기 구현
     * @param <T> 반환 타입
     * @return callable 반환값
     * @throws IllegalArgumentException callable, policy 또는 sleeper가 null인 경우
     * @throws RetryExhaustedException 모든 시도가 실패한 경우
     */
    public static <T> T callWithRetry(Callable<T> callable, RetryPolicy policy, Sleeper sleeper) {
        if (callable == null) {
            throw new IllegalArgumentException("callable cannot be null");
        }
        validate(policy, sleeper);
        return retryUntilExhausted(callable, policy, sleeper);
    }

    /**
     * 반환값 전달형 재시도 루프 (리플렉션/Callable 공용).
     */
    private static <T> T retryUntilExhausted(Callable<T> callable, RetryPolicy policy, Sleeper sleeper) {
        int retryCount = policy.retryCount();
        long interval = policy.retryIntervalMillis();
        RetryState state = RetryState.IDLE;
        Exception lastFailure = null;
        int count = 0;

        while (count < retryCount) {
            state = RetryStateTransition.transition(state, RetryState.ATTEMPTING);
            try {
                T result = callable.call();
                RetryStateTransition.transition(state, RetryState.SUCCEEDED);
                return result;
            } catch (Exception e) {
                state = RetryStateTransition.transition(state, RetryState.WAITING);
                lastFailure = e;
                restoreInterrupt(e);
                log.warn("Retry error (attempt {}/{}): {}", count + 1, retryCount, e.getMessage(), e);

                sleeper.sleep(interval);
                count++;
            }
        }

        RetryStateTransition.transition(state, RetryState.EXHAUSTED);
        log.warn("Retry count {} reached; giving up", retryCount);
        throw RetryExhaustedException.of(retryCount, lastFailure);
    }

    private static Object invoke(Method method, Object target, Object[] args) throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * 시도 중 인터럽트로 실패한 경우 호출자가 인터럽트를 잃지 않도록 플래그를 복원.
     *
     * <p>시도 실패로 계속 집계되며 재시도는 중단하지 않습니다.</p>
     */
    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    private static void validate(Method method, Object target) {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }

    private static void validate(RetryPolicy policy, Sleeper sleeper) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
    }
}
