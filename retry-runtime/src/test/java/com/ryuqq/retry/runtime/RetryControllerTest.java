package com.ryuqq.retry.runtime;

import com.ryuqq.retry.core.action.RetryAction;
import com.ryuqq.retry.core.action.StatusListener;
import com.ryuqq.retry.core.model.ActionResult;
import com.ryuqq.retry.core.model.RetryMode;
import com.ryuqq.retry.core.model.RetryStatus;
import com.ryuqq.retry.core.statemachine.CycleState;
import com.ryuqq.retry.core.strategy.RetryStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * RetryController 유닛 테스트.
 *
 * <p>시나리오 단위 계약은 retry-testkit의 Contract Test가 검증하고,
 * 여기서는 생성자 검증, 전략 호출 방식, 콜백 순서를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryControllerTest {

    private static final Duration DELAY = Duration.ofMillis(10);
    private static final long TIMEOUT_SECONDS = 5;

    @Mock
    private StatusListener listener;

    @Mock
    private RetryStrategy strategy;

    private RetryController<String> controller;

    @AfterEach
    void tearDown() {
        if (controller != null) {
            controller.close();
        }
    }

    // ============================================================
    // 1. 생성자 검증
    // ============================================================

    @Test
    void constructor_strategy가_null이면_예외() {
        assertThatThrownBy(() -> new RetryController<String>(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("strategy cannot be null");
    }

    @Test
    void constructor_config가_null이면_예외() {
        RetryStrategy fixed = RetryStrategy.fixed(3, DELAY);

        assertThatThrownBy(() -> new RetryController<String>(fixed, (RetryControllerConfig) null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
    }

    @Test
    void constructor_mode가_null이면_예외() {
        RetryStrategy fixed = RetryStrategy.fixed(3, DELAY);

        assertThatThrownBy(() -> new RetryController<String>(fixed, (RetryMode) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("mode cannot be null");
    }

    @Test
    void constructor_기본값은_AUTO_모드_IDLE_상태() {
        controller = new RetryController<>(RetryStrategy.fixed(3, DELAY));

        assertThat(controller.mode()).isEqualTo(RetryMode.AUTO);
        assertThat(controller.state()).isEqualTo(CycleState.IDLE);
        assertThat(controller.attempt()).isZero();
        assertThat(controller.isActive()).isFalse();
        assertThat(controller.isRunning()).isFalse();
        assertThat(controller.isClosed()).isFalse();
    }

    // ============================================================
    // 2. execute 입력 검증
    // ============================================================

    @Test
    void execute_action이_null이면_예외() {
        controller = new RetryController<>(RetryStrategy.fixed(3, DELAY));

        assertThatThrownBy(() -> controller.execute(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("action cannot be null");
        assertThatThrownBy(() -> controller.executeAsync(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("action cannot be null");
    }

    @Test
    void execute_close된_컨트롤러면_예외() {
        controller = new RetryController<>(RetryStrategy.fixed(3, DELAY));
        controller.close();

        assertThatThrownBy(() -> controller.execute(() -> "value"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("RetryController is closed");
    }

    // ============================================================
    // 3. 전략 호출 방식
    // ============================================================

    @Test
    void execute_shouldRetry가_false를_반환하면_FAIL() throws Exception {
        // given
        when(strategy.maxAttempts()).thenReturn(5);
        when(strategy.attemptDelay(anyInt())).thenReturn(DELAY);
        when(strategy.shouldRetry(anyInt(), isNull())).thenReturn(true, false);
        controller = new RetryController<>(strategy, RetryMode.AUTO, listener);
        AtomicInteger calls = new AtomicInteger();

        // when
        ActionResult<String> result = controller.execute(() -> {
            calls.incrementAndGet();
            return null;
        }).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo(ActionResult.fail());
        assertThat(calls.get()).isEqualTo(2);
        verify(strategy).shouldRetry(1, null);
        verify(strategy).shouldRetry(2, null);
        verify(strategy).attemptDelay(1);
        verify(strategy).attemptDelay(2);

        InOrder inOrder = inOrder(listener);
        inOrder.verify(listener).onStatus(RetryStatus.ATTEMPT);
        inOrder.verify(listener).onStatus(RetryStatus.FAIL);
        inOrder.verifyNoMoreInteractions();
    }

    @Test
    void execute_maxAttempts에_도달하면_shouldRetry를_묻지_않음() throws Exception {
        // given
        when(strategy.maxAttempts()).thenReturn(1);
        when(strategy.attemptDelay(anyInt())).thenReturn(DELAY);
        controller = new RetryController<>(strategy, RetryMode.AUTO, listener);

        // when
        ActionResult<String> result = controller.execute(() -> null).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(result.isFailed()).isTrue();
        verify(strategy, never()).shouldRetry(anyInt(), any());
        verify(listener).onStatus(RetryStatus.FAIL);
        verifyNoMoreInteractions(listener);
    }

    @Test
    void execute_첫_시도에서_성공하면_지연을_계산하지_않음() throws Exception {
        // given
        when(strategy.maxAttempts()).thenReturn(3);
        controller = new RetryController<>(strategy, RetryMode.AUTO, listener);

        // when
        ActionResult<String> result = controller.execute(() -> "first").get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo(ActionResult.success("first"));
        verify(strategy, never()).attemptDelay(anyInt());
        verify(listener).onStatus(RetryStatus.SUCCESS);
        verifyNoMoreInteractions(listener);
    }

    // ============================================================
    // 4. 상태 콜백 / 상태 스트림
    // ============================================================

    @Test
    void execute_콜백과_스트림에_같은_순서로_전달() throws Exception {
        // given
        controller = new RetryController<>(RetryStrategy.fixed(3, DELAY), RetryMode.AUTO, listener);
        RecordingSubscriber subscriber = new RecordingSubscriber();
        controller.status().subscribe(subscriber);
        AtomicInteger calls = new AtomicInteger();
        RetryAction<String> action = () -> calls.incrementAndGet() == 3 ? "third" : null;

        // when
        ActionResult<String> result = controller.execute(action).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo(ActionResult.success("third"));
        assertThat(subscriber.awaitCompletion(TIMEOUT_SECONDS)).isTrue();
        assertThat(subscriber.received())
            .containsExactly(RetryStatus.ATTEMPT, RetryStatus.ATTEMPT, RetryStatus.SUCCESS);

        InOrder inOrder = inOrder(listener);
        inOrder.verify(listener, times(2)).onStatus(RetryStatus.ATTEMPT);
        inOrder.verify(listener).onStatus(RetryStatus.SUCCESS);
    }

    @Test
    void status_사이클이_끝나면_새_채널로_교체() throws Exception {
        controller = new RetryController<>(RetryStrategy.fixed(1, DELAY));
        Flow.Publisher<RetryStatus> before = controller.status();

        controller.execute(() -> "done").get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertThat(controller.status()).isNotSameAs(before);
    }

    @Test
    void status_콜백_없이도_동작() throws Exception {
        controller = new RetryController<>(RetryStrategy.fixed(2, DELAY), RetryMode.AUTO);

        ActionResult<String> result = controller.execute(() -> null).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertThat(result).isEqualTo(ActionResult.fail());
        assertThat(controller.state()).isEqualTo(CycleState.IDLE);
    }

    // ============================================================
    // 5. close
    // ============================================================

    @Test
    void close_멱등이며_현재_채널을_종료() throws Exception {
        controller = new RetryController<>(RetryStrategy.fixed(3, DELAY));
        RecordingSubscriber subscriber = new RecordingSubscriber();
        controller.status().subscribe(subscriber);

        controller.close();
        controller.close();

        assertThat(controller.isClosed()).isTrue();
        assertThat(subscriber.awaitCompletion(TIMEOUT_SECONDS)).isTrue();
        assertThat(subscriber.received()).isEmpty();
    }
}
