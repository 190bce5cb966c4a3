package com.ryuqq.retry.testkit;

import com.ryuqq.retry.core.action.AsyncRetryAction;
import com.ryuqq.retry.core.action.RetryAction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test action that returns pre-scripted outcomes in call order.
 *
 * <p>Once the script is exhausted, the last step repeats.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedAction&lt;Boolean&gt; action = ScriptedAction.&lt;Boolean&gt;script()
 *     .returnNull()
 *     .fail(new IOException("reset"))
 *     .succeed(true);
 *
 * controller.execute(action);                                  // sync
 * controller.executeAsync(action.async(Duration.ofMillis(20))); // async (completes after latency)
 *
 * assertThat(action.invocations()).isEqualTo(3);
 * </pre>
 *
 * @param <T> the success data type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedAction<T> implements RetryAction<T> {

    private final List<Step<T>> steps = new ArrayList<>();
    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private ScriptedAction() {
    }

    /**
     * Creates an empty script.
     *
     * @param <T> the success data type
     * @return ScriptedAction
     */
    public static <T> ScriptedAction<T> script() {
        return new ScriptedAction<>();
    }

    /**
     * Action that always returns null.
     */
    public static <T> ScriptedAction<T> alwaysNull() {
        return ScriptedAction.<T>script().returnNull();
    }

    /**
     * Action that returns null (k-1) times, then {@code value} on the k-th call.
     *
     * @param k the call number that succeeds (1 or more)
     * @param value the success value
     */
    public static <T> ScriptedAction<T> succeedOnCall(int k, T value) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive (current: " + k + ")");
        }
        ScriptedAction<T> action = script();
        for (int i = 1; i < k; i++) {
            action.returnNull();
        }
        return action.succeed(value);
    }

    public ScriptedAction<T> returnNull() {
        steps.add(new Step<>(null, null));
        return this;
    }

    public ScriptedAction<T> succeed(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null, use returnNull()");
        }
        steps.add(new Step<>(value, null));
        return this;
    }

    public ScriptedAction<T> fail(Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        steps.add(new Step<>(null, error));
        return this;
    }

    @Override
    public T call() throws Exception {
        Step<T> step = nextStep();
        if (step.error() != null) {
            throw step.error();
        }
        return step.value();
    }

    /**
     * Asynchronous variant whose stages complete after {@code latency}.
     *
     * <p>Overlapping invocations are tracked by {@link #maxConcurrentInvocations()}.</p>
     *
     * @param latency delay before each stage completes
     * @return AsyncRetryAction
     */
    public AsyncRetryAction<T> async(Duration latency) {
        if (latency == null) {
            throw new IllegalArgumentException("latency cannot be null");
        }
        return () -> {
            Step<T> step = nextStep();
            int concurrent = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(concurrent, Math::max);

            CompletableFuture<T> stage = new CompletableFuture<>();
            CompletableFuture.delayedExecutor(latency.toNanos(), TimeUnit.NANOSECONDS).execute(() -> {
                inFlight.decrementAndGet();
                if (step.error() != null) {
                    stage.completeExceptionally(step.error());
                } else {
                    stage.complete(step.value());
                }
            });
            return stage;
        };
    }

    /**
     * Number of invocations so far.
     */
    public int invocations() {
        return invocations.get();
    }

    /**
     * Highest number of async invocations in flight at the same time.
     */
    public int maxConcurrentInvocations() {
        return maxInFlight.get();
    }

    private Step<T> nextStep() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("ScriptedAction has no steps");
        }
        int index = invocations.getAndIncrement();
        return steps.get(Math.min(index, steps.size() - 1));
    }

    private record Step<T>(T value, Exception error) {
    }
}
