package com.ryuqq.retry.executor;

import com.ryuqq.retry.core.outcome.RetryExhaustedException;
import com.ryuqq.retry.core.policy.RetryPolicy;
import com.ryuqq.retry.testkit.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryExecutor 리플렉션 호출 재시도 테스트.
 *
 * @author Retry Team
 * @since 1.0.0
 */
@DisplayName("RetryExecutor 리플렉션 호출 테스트")
class RetryExecutorReflectiveTest {

    private RecordingSleeper sleeper;
    private InventoryClient client;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        client = new InventoryClient();
    }

    @Test
    @DisplayName("항상 실패하면 RetryExhaustedException 에 retryCount 를 담아 던진다")
    void 항상_실패하면_RetryExhaustedException() throws Exception {
        // given
        Method method = InventoryClient.class.getMethod("reserve", String.class, int.class);
        client.failuresBeforeSuccess = Integer.MAX_VALUE;

        // when & then
        assertThatThrownBy(() ->
            RetryExecutor.executeWithRetry(method, client, RetryPolicy.of(2, 10), sleeper, "SKU-1", 3))
            .isInstanceOfSatisfying(RetryExhaustedException.class,
                e -> assertThat(e.getRetryCount()).isEqualTo(2));

        assertThat(client.calls).hasSize(2);
        assertThat(client.calls).containsOnly("SKU-1:3");
        assertThat(sleeper.getSleeps()).containsExactly(10L, 10L);
    }

    @Test
    @DisplayName("소진 예외의 cause 는 메서드가 던진 원래 예외이다")
    void 소진_예외의_cause는_풀어낸_원래_예외() throws Exception {
        // given
        Method method = InventoryClient.class.getMethod("reserve", String.class, int.class);
        client.failuresBeforeSuccess = Integer.MAX_VALUE;

        // when & then
        assertThatThrownBy(() ->
            RetryExecutor.executeWithRetry(method, client, RetryPolicy.of(2, 0), sleeper, "SKU-1", 1))
            .isInstanceOf(RetryExhaustedException.class)
            .hasCauseInstanceOf(IllegalStateException.class)
            .cause()
            .hasMessage("inventory unavailable (call 2)");
    }

    @Test
    @DisplayName("k번째 시도에서 성공하면 반환값을 즉시 전달한다")
    void k번째_성공시_반환값_전달() throws Exception {
        // given
        Method method = InventoryClient.class.getMethod("reserve", String.class, int.class);
        client.failuresBeforeSuccess = 1;

        // when
        Object result = RetryExecutor.executeWithRetry(method, client, RetryPolicy.of(5, 5), sleeper, "SKU-9", 2);

        // then
        assertThat(result).isEqualTo("reserved SKU-9 x2");
        assertThat(client.calls).hasSize(2);
        assertThat(sleeper.getSleepCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("void 메서드는 null 을 반환한다")
    void void_메서드는_null_반환() throws Exception {
        // given
        Method method = InventoryClient.class.getMethod("ping");

        // when
        Object result = RetryExecutor.executeWithRetry(method, client, RetryPolicy.of(1, 0), sleeper);

        // then
        assertThat(result).isNull();
        assertThat(client.pings).isEqualTo(1);
    }

    @Test
    @DisplayName("인자 타입이 맞지 않는 호출도 시도 실패로 처리한다")
    void 인자_불일치도_시도_실패() throws Exception {
        // given
        Method method = InventoryClient.class.getMethod("reserve", String.class, int.class);

        // when & then
        assertThatThrownBy(() ->
            RetryExecutor.executeWithRetry(method, client, RetryPolicy.of(3, 1), sleeper, "SKU-1", "not-an-int"))
            .isInstanceOf(RetryExhaustedException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(client.calls).isEmpty();
        assertThat(sleeper.getSleepCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("메서드가 던진 Error 는 재시도 없이 그대로 전파된다")
    void 메서드가_던진_Error는_그대로_전파() throws Exception {
        // given
        Method method = InventoryClient.class.getMethod("corrupt");

        // when & then
        assertThatThrownBy(() ->
            RetryExecutor.executeWithRetry(method, client, RetryPolicy.of(3, 10), sleeper))
            .isInstanceOf(AssertionError.class)
            .hasMessage("inventory state corrupted");
        assertThat(client.corruptCalls).isEqualTo(1);
        assertThat(sleeper.getSleepCount()).isZero();
    }

    @Test
    @DisplayName("retryCount 가 0 이면 호출 없이 RetryExhaustedException")
    void retryCount_0이면_호출없이_소진() throws Exception {
        // given
        Method method = InventoryClient.class.getMethod("reserve", String.class, int.class);

        // when & then
        assertThatThrownBy(() ->
            RetryExecutor.executeWithRetry(method, client, RetryPolicy.of(0, 10), sleeper, "SKU-1", 1))
            .hasNoCause()
            .isInstanceOfSatisfying(RetryExhaustedException.class,
                e -> assertThat(e.getRetryCount()).isZero());
        assertThat(client.calls).isEmpty();
        assertThat(sleeper.getSleepCount()).isZero();
    }

    @Test
    @DisplayName("method 또는 target 이 null 이면 시도 전에 IllegalArgumentException")
    void null_method_또는_target은_즉시_예외() throws Exception {
        Method method = InventoryClient.class.getMethod("ping");

        assertThatThrownBy(() -> RetryExecutor.executeWithRetry((Method) null, client, 3, 10L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("method cannot be null");
        assertThatThrownBy(() -> RetryExecutor.executeWithRetry(method, null, RetryPolicy.of(3, 10), sleeper))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("target cannot be null");

        assertThat(client.pings).isZero();
        assertThat(sleeper.getSleepCount()).isZero();
    }

    @Test
    @DisplayName("기본 오버로드는 실제로 대기하며 동일한 계약을 따른다")
    void 기본_오버로드_실제_대기() throws Exception {
        // given
        Method method = InventoryClient.class.getMethod("reserve", String.class, int.class);
        client.failuresBeforeSuccess = Integer.MAX_VALUE;
        long start = System.nanoTime();

        // when & then
        assertThatThrownBy(() -> RetryExecutor.executeWithRetry(method, client, 2, 10L, "SKU-2", 4))
            .isInstanceOf(RetryExhaustedException.class);

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(20);
        assertThat(client.calls).containsExactly("SKU-2:4", "SKU-2:4");
    }

    /**
     * 리플렉션 호출 대상.
     */
    public static class InventoryClient {

        int failuresBeforeSuccess;
        int pings;
        int corruptCalls;
        final List<String> calls = new ArrayList<>();

        public String reserve(String sku, int quantity) {
            calls.add(sku + ":" + quantity);
            if (calls.size() <= failuresBeforeSuccess) {
                throw new IllegalStateException("inventory unavailable (call " + calls.size() + ")");
            }
            return "reserved " + sku + " x" + quantity;
        }

        public void ping() {
            pings++;
        }

        public void corrupt() {
            corruptCalls++;
            throw new AssertionError("inventory state corrupted");
        }
    }
}
