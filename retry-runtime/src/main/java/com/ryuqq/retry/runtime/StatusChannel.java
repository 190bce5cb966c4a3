package com.ryuqq.retry.runtime;

import com.ryuqq.retry.core.model.RetryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;

/**
 * 사이클 하나의 상태 브로드캐스트 채널.
 *
 * <p>{@link SubmissionPublisher} 위에 구성되며, 발행 스레드(컨트롤러 이벤트 루프)에서
 * 구독자에게 동기적으로 전달합니다. 따라서 구독자는 발행 순서대로 이벤트를 받습니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>publish()는 블로킹하지 않음: 구독자 버퍼가 가득 차면 이벤트를 버리고 경고 로그</li>
 *   <li>close()는 멱등: 모든 구독자에게 onComplete 전달</li>
 *   <li>닫힌 채널에 구독하면 즉시 onComplete 수신</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusChannel {

    private static final Logger log = LoggerFactory.getLogger(StatusChannel.class);

    private final SubmissionPublisher<RetryStatus> publisher;

    /**
     * 생성자.
     *
     * @param bufferCapacity 구독자별 버퍼 크기 (양수여야 함)
     * @throws IllegalArgumentException bufferCapacity가 양수가 아닌 경우
     */
    public StatusChannel(int bufferCapacity) {
        if (bufferCapacity <= 0) {
            throw new IllegalArgumentException(
                "bufferCapacity must be positive (current: " + bufferCapacity + ")"
            );
        }
        this.publisher = new SubmissionPublisher<>(Runnable::run, bufferCapacity);
    }

    /**
     * 구독 가능한 Publisher 조회.
     *
     * @return 이 채널의 Publisher
     */
    public Flow.Publisher<RetryStatus> publisher() {
        return publisher;
    }

    /**
     * 상태 이벤트 발행.
     *
     * <p>이미 닫힌 채널에서는 아무 동작도 하지 않습니다.</p>
     *
     * @param status 발행할 상태
     * @throws IllegalArgumentException status가 null인 경우
     */
    public void publish(RetryStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (publisher.isClosed()) {
            log.debug("Status {} not published, channel already closed", status);
            return;
        }
        publisher.offer(status, (subscriber, dropped) -> {
            log.warn("Status subscriber buffer full, dropped {} for {}", dropped, subscriber);
            return false;
        });
    }

    /**
     * 채널 종료 (멱등).
     */
    public void close() {
        publisher.close();
    }

    public boolean isClosed() {
        return publisher.isClosed();
    }

    public int subscriberCount() {
        return publisher.getNumberOfSubscribers();
    }
}
