package com.ryuqq.retry.testkit;

import com.ryuqq.retry.core.action.StatusListener;
import com.ryuqq.retry.core.model.RetryStatus;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/**
 * Recorder used both as a status stream subscriber and as a status callback.
 *
 * <p>Records received events in order and lets tests wait for stream completion (onComplete).
 * When used only as a callback, receiving a terminal event counts as completion.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusRecorder implements Flow.Subscriber<RetryStatus>, StatusListener {

    private final List<RetryStatus> events = new CopyOnWriteArrayList<>();
    private final CountDownLatch completed = new CountDownLatch(1);
    private final CountDownLatch terminal = new CountDownLatch(1);
    private volatile Throwable error;

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(RetryStatus item) {
        record(item);
    }

    @Override
    public void onError(Throwable throwable) {
        this.error = throwable;
        completed.countDown();
    }

    @Override
    public void onComplete() {
        completed.countDown();
    }

    @Override
    public void onStatus(RetryStatus status) {
        record(status);
    }

    /**
     * Waits until the stream completes (onComplete/onError).
     *
     * @param timeout maximum time to wait
     * @return true if the stream completed in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return completed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Waits until a terminal event (SUCCESS, FAIL, CANCELED) is received.
     *
     * @param timeout maximum time to wait
     * @return true if a terminal event arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTerminal(Duration timeout) throws InterruptedException {
        return terminal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Polls until at least {@code count} events have been received.
     *
     * @param count expected number of events
     * @param timeout maximum time to wait
     * @return true if the count was reached in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitEvents(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (events.size() < count) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    public List<RetryStatus> events() {
        return List.copyOf(events);
    }

    public long count(RetryStatus status) {
        return events.stream().filter(status::equals).count();
    }

    public boolean isCompleted() {
        return completed.getCount() == 0;
    }

    public Throwable error() {
        return error;
    }

    private void record(RetryStatus status) {
        events.add(status);
        if (status.isTerminal()) {
            terminal.countDown();
        }
    }
}
