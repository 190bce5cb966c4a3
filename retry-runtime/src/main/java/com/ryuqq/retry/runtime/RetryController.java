package com.ryuqq.retry.runtime;

import com.ryuqq.retry.core.action.AsyncRetryAction;
import com.ryuqq.retry.core.action.RetryAction;
import com.ryuqq.retry.core.action.StatusListener;
import com.ryuqq.retry.core.model.ActionResult;
import com.ryuqq.retry.core.model.RetryMode;
import com.ryuqq.retry.core.model.RetryStatus;
import com.ryuqq.retry.core.statemachine.CycleState;
import com.ryuqq.retry.core.statemachine.CycleTransition;
import com.ryuqq.retry.core.strategy.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 단일 작업 재시도 컨트롤러.
 *
 * <p>호출자가 제공한 액션을 성공, 소진, 취소 중 하나가 될 때까지 반복 호출하고,
 * 시도 사이에는 {@link RetryStrategy}가 정한 지연을 적용합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(action)
 *   ↓
 * 사이클 진행 중? → ActionResult.skip()
 *   ↓
 * 새 사이클: action 캐시, pending future 생성
 *   ↓
 * attempt++ → action 호출 (완료 대기)
 *   ├─ non-null → SUCCESS → teardown → success(value)
 *   └─ null / 예외 → 타이머(attemptDelay) 예약
 *                       ↓ (타이머 만료)
 *                 다음 시도 불가? → FAIL → teardown → fail()
 *                       ↓
 *                 ATTEMPT 발행
 *                   ├─ AUTO   → 즉시 다음 시도
 *                   └─ MANUAL → PAUSED (resume() 대기)
 * </pre>
 *
 * <p><strong>다음 시도 가능 여부:</strong> 타이머가 만료되면 {@code attempt + 1 > maxAttempts}인지와
 * {@link RetryStrategy#shouldRetry(int, Throwable)}를 모드와 관계없이 확인합니다.
 * MANUAL 모드에서도 shouldRetry가 거절하면 PAUSED로 멈추지 않고 FAIL로 사이클을 종료하므로,
 * 이 경우 ATTEMPT 이벤트 없이 FAIL이 발행되고 이후의 resume()은 IllegalStateException을 던집니다.</p>
 *
 * <p><strong>오류 처리:</strong> 액션이 던진 예외는 {@link Error}를 포함해 모두 시도 실패로 취급되어
 * shouldRetry에 전달됩니다. 그 밖에 루프 내부에서 예상하지 못한 예외가 발생하면 진행 중인 사이클을
 * FAIL로 종료하므로 future가 완료되지 않은 채 남지 않습니다.</p>
 *
 * <p><strong>동시성 모델:</strong></p>
 * <ul>
 *   <li>컨트롤러마다 단일 스레드 이벤트 루프(ScheduledThreadPoolExecutor)를 소유</li>
 *   <li>모든 사이클 상태는 루프 스레드에서만 변경 (single-writer, 락 없음)</li>
 *   <li>지연 타이머와 비동기 액션 완료 모두 루프로 돌아와 처리되므로, 액션이 동시에 두 번 호출되지 않음</li>
 *   <li>공개 메서드는 어느 스레드에서나 호출 가능</li>
 *   <li>상태 구독자와 상태 콜백은 루프 스레드에서 호출됨</li>
 * </ul>
 *
 * <p><strong>순서 보장:</strong> ATTEMPT 이벤트 → 종료 이벤트(정확히 한 번) → 채널 종료 → future 완료.
 * future가 완료되는 시점에는 컨트롤러가 이미 IDLE이므로, 결과 콜백에서 바로 새 사이클을 시작할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (RetryController&lt;Boolean&gt; controller =
 *          new RetryController&lt;&gt;(RetryStrategy.fixed(4, Duration.ofSeconds(1)))) {
 *     controller.status().subscribe(subscriber);
 *     ActionResult&lt;Boolean&gt; result = controller.execute(this::tryConnect).join();
 * }
 * </pre>
 *
 * @param <T> 액션 성공 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryController<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final RetryStrategy strategy;
    private final RetryControllerConfig config;
    private final StatusListener onStatus;
    private final ScheduledThreadPoolExecutor loop;

    private volatile Thread loopThread;
    private volatile boolean closed;

    // 아래 필드는 루프 스레드에서만 변경됨
    private volatile CycleState state = CycleState.IDLE;
    private volatile int currentAttempt;
    private volatile ScheduledFuture<?> timer;
    private volatile StatusChannel statusChannel;
    private CompletableFuture<ActionResult<T>> pending;
    private AsyncRetryAction<T> retryAction;
    private long cycleId;

    /**
     * 생성자 (AUTO 모드, 콜백 없음).
     *
     * @param strategy 재시도 전략
     * @throws IllegalArgumentException strategy가 null인 경우
     */
    public RetryController(RetryStrategy strategy) {
        this(strategy, new RetryControllerConfig(), null);
    }

    /**
     * 생성자 (모드 지정, 콜백 없음).
     *
     * @param strategy 재시도 전략
     * @param mode 재시도 모드
     * @throws IllegalArgumentException strategy 또는 mode가 null인 경우
     */
    public RetryController(RetryStrategy strategy, RetryMode mode) {
        this(strategy, mode, null);
    }

    /**
     * 생성자 (모드 및 상태 콜백 지정).
     *
     * @param strategy 재시도 전략
     * @param mode 재시도 모드
     * @param onStatus 상태 콜백 (null 허용)
     * @throws IllegalArgumentException strategy 또는 mode가 null인 경우
     */
    public RetryController(RetryStrategy strategy, RetryMode mode, StatusListener onStatus) {
        this(strategy, new RetryControllerConfig().withMode(mode), onStatus);
    }

    /**
     * 생성자 (설정 주입).
     *
     * @param strategy 재시도 전략
     * @param config 컨트롤러 설정
     * @param onStatus 상태 콜백 (null 허용)
     * @throws IllegalArgumentException strategy 또는 config가 null인 경우
     */
    public RetryController(RetryStrategy strategy, RetryControllerConfig config, StatusListener onStatus) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.strategy = strategy;
        this.config = config;
        this.onStatus = onStatus;
        this.statusChannel = new StatusChannel(config.statusBufferCapacity());
        this.loop = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, config.threadName());
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        this.loop.setRemoveOnCancelPolicy(true);
    }

    /**
     * 동기 액션으로 재시도 사이클 시작.
     *
     * @param action 재시도 대상 액션
     * @return 이 사이클의 결과로 완료될 future (진행 중인 사이클이 있으면 skip())
     * @throws IllegalArgumentException action이 null인 경우
     * @throws IllegalStateException 컨트롤러가 close된 경우
     * @see #executeAsync(AsyncRetryAction)
     */
    public CompletableFuture<ActionResult<T>> execute(RetryAction<T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return executeAsync(action.toAsync());
    }

    /**
     * 비동기 액션으로 재시도 사이클 시작.
     *
     * <p>호출자를 블로킹하지 않습니다. 사이클은 이벤트 루프에서 시작됩니다.</p>
     *
     * <p><strong>동작:</strong></p>
     * <ul>
     *   <li>사이클 진행 중: 진행 중인 사이클에 영향 없이 {@link ActionResult#skip()}으로 완료</li>
     *   <li>strategy.maxAttempts() &lt; 1: 액션을 호출하지 않고 FAIL 발행 후 {@link ActionResult#fail()}</li>
     *   <li>그 외: 첫 번째 시도를 즉시 수행</li>
     * </ul>
     *
     * @param action 재시도 대상 액션
     * @return 이 사이클의 결과로 완료될 future
     * @throws IllegalArgumentException action이 null인 경우
     * @throws IllegalStateException 컨트롤러가 close된 경우
     */
    public CompletableFuture<ActionResult<T>> executeAsync(AsyncRetryAction<T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        ensureOpen();

        if (inLoop()) {
            return startCycle(action);
        }
        if (state.isRunning()) {
            // 루프가 동기 액션을 수행 중이어도 즉시 응답, 최종 판단은 startCycle에서
            log.debug("Retry cycle already running (state={}), execute skipped", state);
            return CompletableFuture.completedFuture(ActionResult.skip());
        }
        return CompletableFuture.supplyAsync(() -> startCycle(action), loop)
            .thenCompose(Function.identity());
    }

    /**
     * MANUAL 모드에서 일시정지된 사이클의 다음 시도 수행.
     *
     * <p>루프가 요청을 처리할 때까지 대기하므로, 사용 오류는 호출 스레드에서 바로 던져집니다.</p>
     *
     * @throws IllegalStateException AUTO 모드인 경우, execute() 전에 호출한 경우,
     *                               시도 또는 지연 타이머가 아직 진행 중인 경우
     */
    public void resume() {
        if (config.mode() != RetryMode.MANUAL) {
            throw new IllegalStateException("resume() is only allowed in MANUAL mode");
        }
        ensureOpen();
        runOnLoopAndWait(this::resumeCycle);
    }

    /**
     * 진행 중인 사이클 취소.
     *
     * <p>CANCELED를 발행하고 사이클을 정리한 뒤 future를 {@link ActionResult#canceled()}로 완료합니다.
     * 진행 중인 사이클이 없으면 아무 동작도 하지 않습니다.</p>
     */
    public void cancel() {
        runOnLoopAndWait(this::cancelCycle);
    }

    /**
     * 사이클 정리 (멱등).
     *
     * <p>시도 횟수 초기화, 상태 채널 종료, 타이머 취소, 캐시된 액션과 pending future 해제를 수행합니다.
     * 상태 이벤트는 발행하지 않습니다.</p>
     *
     * <p>완료되지 않은 future가 남아 있으면 {@link ActionResult#canceled()}로 완료하여
     * 호출자가 영원히 대기하지 않도록 합니다.</p>
     */
    public void stop() {
        runOnLoopAndWait(this::stopCycle);
    }

    /**
     * 컨트롤러 종료.
     *
     * <p>stop() 후 이벤트 루프를 종료합니다. 이후 execute()/resume()은 IllegalStateException을 던집니다.</p>
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        stop();
        closed = true;
        statusChannel.close();
        loop.shutdown();
    }

    /**
     * 지연 타이머가 대기 중인지 확인.
     *
     * @return 타이머가 살아 있으면 true
     */
    public boolean isActive() {
        return timer != null;
    }

    /**
     * 사이클이 진행 중인지 확인.
     *
     * @return ATTEMPTING, WAITING, PAUSED인 경우 true
     */
    public boolean isRunning() {
        return state.isRunning();
    }

    public int attempt() {
        return currentAttempt;
    }

    public CycleState state() {
        return state;
    }

    public RetryMode mode() {
        return config.mode();
    }

    public RetryStrategy strategy() {
        return strategy;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 현재 사이클(또는 사이클이 없으면 다음 사이클)의 상태 스트림.
     *
     * <p>사이클마다 새 채널로 교체되며, 종료 이벤트 직후 onComplete가 전달됩니다.</p>
     *
     * @return 상태 Publisher
     */
    public Flow.Publisher<RetryStatus> status() {
        return statusChannel.publisher();
    }

    // ============================================================
    // 루프 스레드 전용
    // ============================================================

    private CompletableFuture<ActionResult<T>> startCycle(AsyncRetryAction<T> action) {
        if (state.isRunning()) {
            log.debug("Retry cycle already running (state={}, attempt={}), execute skipped", state, currentAttempt);
            return CompletableFuture.completedFuture(ActionResult.skip());
        }
        if (state.isTerminal()) {
            // 종료 이벤트 콜백 안에서 호출됨: 현재 사이클 정리가 끝난 뒤 시작
            return CompletableFuture.supplyAsync(() -> startCycle(action), loop)
                .thenCompose(Function.identity());
        }
        if (currentAttempt != 0) {
            log.warn("Stale attempt counter {} on idle controller, resetting", currentAttempt);
            teardown();
        }

        cycleId++;
        retryAction = action;
        pending = new CompletableFuture<>();
        CompletableFuture<ActionResult<T>> result = pending.copy();

        log.info("Retry cycle started (maxAttempts={}, mode={})", strategy.maxAttempts(), config.mode());

        if (strategy.maxAttempts() < 1) {
            state = CycleTransition.transition(state, CycleState.EXHAUSTED);
            log.warn("Strategy permits no attempts (maxAttempts={}), cycle failed", strategy.maxAttempts());
            finish(RetryStatus.FAIL, ActionResult.fail());
        } else {
            runGuarded(this::performAttempt);
        }
        return result;
    }

    private void performAttempt() {
        state = CycleTransition.transition(state, CycleState.ATTEMPTING);
        int attemptNumber = currentAttempt + 1;
        currentAttempt = attemptNumber;
        long cycle = cycleId;

        log.debug("Attempt {}/{} started", attemptNumber, strategy.maxAttempts());

        CompletionStage<T> stage;
        try {
            stage = retryAction.invoke();
        } catch (RuntimeException | Error e) {
            stage = CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            stage = CompletableFuture.completedFuture(null);
        }

        stage.whenCompleteAsync(
            (value, error) -> runGuarded(() -> onAttemptCompleted(cycle, attemptNumber, value, error)),
            loop
        );
    }

    private void onAttemptCompleted(long cycle, int attemptNumber, T value, Throwable error) {
        if (cycle != cycleId || state != CycleState.ATTEMPTING) {
            log.debug("Ignoring completion of attempt {} from an abandoned cycle", attemptNumber);
            return;
        }

        if (error == null && value != null) {
            state = CycleTransition.transition(state, CycleState.SUCCEEDED);
            log.info("Retry cycle succeeded on attempt {}", attemptNumber);
            finish(RetryStatus.SUCCESS, ActionResult.success(value));
            return;
        }

        Throwable lastError = unwrap(error);
        if (lastError != null) {
            log.warn("Attempt {}/{} failed: {}", attemptNumber, strategy.maxAttempts(), lastError.toString());
        } else {
            log.debug("Attempt {}/{} returned no result", attemptNumber, strategy.maxAttempts());
        }
        scheduleNextAttempt(lastError);
    }

    private void scheduleNextAttempt(Throwable lastError) {
        state = CycleTransition.transition(state, CycleState.WAITING);
        Duration delay = strategy.attemptDelay(currentAttempt);
        long cycle = cycleId;

        log.debug("Next attempt check scheduled in {}ms", delay.toMillis());
        timer = loop.schedule(
            () -> runGuarded(() -> onTimerFired(cycle, lastError)),
            delay.toNanos(),
            TimeUnit.NANOSECONDS
        );
    }

    private void onTimerFired(long cycle, Throwable lastError) {
        if (cycle != cycleId || state != CycleState.WAITING) {
            return;
        }
        timer = null;
        int attemptNumber = currentAttempt;

        if (attemptNumber + 1 > strategy.maxAttempts() || !strategy.shouldRetry(attemptNumber, lastError)) {
            state = CycleTransition.transition(state, CycleState.EXHAUSTED);
            log.warn("Retry cycle exhausted after {} attempt(s)", attemptNumber);
            finish(RetryStatus.FAIL, ActionResult.fail());
            return;
        }

        if (config.mode() == RetryMode.MANUAL) {
            // 콜백에서 resume()을 호출할 수 있도록 발행 전에 PAUSED로 전이
            state = CycleTransition.transition(state, CycleState.PAUSED);
            emit(RetryStatus.ATTEMPT);
            return;
        }

        emit(RetryStatus.ATTEMPT);
        if (state == CycleState.WAITING) {
            performAttempt();
        }
    }

    private void resumeCycle() {
        if (retryAction == null || pending == null) {
            throw new IllegalStateException("Call execute() before using resume()");
        }
        if (state != CycleState.PAUSED) {
            throw new IllegalStateException("resume() requires a paused cycle (current: " + state + ")");
        }
        log.debug("Resuming cycle at attempt {}", currentAttempt + 1);
        runGuarded(this::performAttempt);
    }

    private void cancelCycle() {
        if (!state.isRunning()) {
            log.debug("cancel() ignored, no running cycle (state={})", state);
            return;
        }
        state = CycleTransition.transition(state, CycleState.CANCELLED);
        log.info("Retry cycle cancelled at attempt {}", currentAttempt);
        finish(RetryStatus.CANCELED, ActionResult.canceled());
    }

    private void stopCycle() {
        CompletableFuture<ActionResult<T>> abandoned = pending;
        teardown();
        if (abandoned != null && abandoned.complete(ActionResult.canceled())) {
            log.info("Retry cycle stopped before completion, result resolved as canceled");
        }
    }

    /**
     * 종료 상태 처리: 발행 → 정리 → future 완료.
     *
     * <p>pending을 먼저 분리하므로, 콜백에서 stop()을 호출해도 결과가 바뀌지 않습니다.</p>
     */
    private void finish(RetryStatus status, ActionResult<T> result) {
        CompletableFuture<ActionResult<T>> completing = pending;
        pending = null;

        emit(status);
        teardown();

        if (completing != null) {
            completing.complete(result);
        }
    }

    private void emit(RetryStatus status) {
        statusChannel.publish(status);
        if (onStatus != null) {
            try {
                onStatus.onStatus(status);
            } catch (RuntimeException | Error e) {
                log.warn("Status listener threw while handling {}", status, e);
            }
        }
    }

    private void teardown() {
        currentAttempt = 0;

        ScheduledFuture<?> outstanding = timer;
        if (outstanding != null) {
            outstanding.cancel(false);
            timer = null;
        }

        // 다음 사이클 구독을 위해 새 채널을 미리 준비
        StatusChannel finished = statusChannel;
        statusChannel = new StatusChannel(config.statusBufferCapacity());
        finished.close();

        pending = null;
        retryAction = null;

        if (state.isRunning()) {
            state = CycleTransition.transition(state, CycleState.CANCELLED);
        }
        if (state.isTerminal()) {
            state = CycleTransition.transition(state, CycleState.IDLE);
        }
    }

    private void runGuarded(Runnable step) {
        try {
            step.run();
        } catch (RuntimeException | Error e) {
            log.error("Unexpected error in retry cycle (state={}, attempt={})", state, currentAttempt, e);
            if (state == CycleState.ATTEMPTING || state == CycleState.WAITING) {
                state = CycleTransition.transition(state, CycleState.EXHAUSTED);
                finish(RetryStatus.FAIL, ActionResult.fail());
            }
        }
    }

    // ============================================================
    // 스레드 전환
    // ============================================================

    private boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("RetryController is closed");
        }
    }

    /**
     * 루프 스레드에서 task를 실행하고 완료까지 대기.
     *
     * <p>이미 루프 스레드라면 바로 실행합니다. 루프가 종료된 경우 아무 동작도 하지 않습니다.</p>
     *
     * @param task 실행할 작업
     * @throws IllegalStateException 대기 중 인터럽트 발생 시
     */
    private void runOnLoopAndWait(Runnable task) {
        if (inLoop()) {
            task.run();
            return;
        }
        if (loop.isShutdown()) {
            return;
        }

        Future<?> submitted = loop.submit(task);
        try {
            submitted.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the retry loop", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Retry loop task failed", cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
