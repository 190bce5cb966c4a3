package com.ryuqq.retry.runtime;

import com.ryuqq.retry.core.model.RetryStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StatusChannel 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StatusChannelTest {

    @Test
    void constructor_bufferCapacity가_양수가_아니면_예외() {
        assertThatThrownBy(() -> new StatusChannel(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("bufferCapacity must be positive (current: 0)");
    }

    @Test
    void publish_구독자에게_발행_순서대로_동기_전달() {
        // given
        StatusChannel channel = new StatusChannel(8);
        RecordingSubscriber first = new RecordingSubscriber();
        RecordingSubscriber second = new RecordingSubscriber();
        channel.publisher().subscribe(first);
        channel.publisher().subscribe(second);

        // when
        channel.publish(RetryStatus.ATTEMPT);
        channel.publish(RetryStatus.ATTEMPT);
        channel.publish(RetryStatus.FAIL);

        // then
        assertThat(channel.subscriberCount()).isEqualTo(2);
        assertThat(first.received()).containsExactly(RetryStatus.ATTEMPT, RetryStatus.ATTEMPT, RetryStatus.FAIL);
        assertThat(second.received()).containsExactly(RetryStatus.ATTEMPT, RetryStatus.ATTEMPT, RetryStatus.FAIL);
    }

    @Test
    void publish_null이면_예외() {
        StatusChannel channel = new StatusChannel(8);

        assertThatThrownBy(() -> channel.publish(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("status cannot be null");
    }

    @Test
    void publish_구독자가_없어도_예외_없음() {
        StatusChannel channel = new StatusChannel(8);

        channel.publish(RetryStatus.SUCCESS);

        assertThat(channel.subscriberCount()).isZero();
    }

    @Test
    void publish_닫힌_채널이면_무시() throws Exception {
        // given
        StatusChannel channel = new StatusChannel(8);
        RecordingSubscriber subscriber = new RecordingSubscriber();
        channel.publisher().subscribe(subscriber);
        channel.close();

        // when
        channel.publish(RetryStatus.SUCCESS);

        // then
        assertThat(channel.isClosed()).isTrue();
        assertThat(subscriber.awaitCompletion(1)).isTrue();
        assertThat(subscriber.received()).isEmpty();
    }

    @Test
    void publish_버퍼가_가득_차면_버리고_블로킹하지_않음() {
        // given: 요청 0건 + 버퍼 1칸
        StatusChannel channel = new StatusChannel(1);
        RecordingSubscriber slow = new RecordingSubscriber(0);
        channel.publisher().subscribe(slow);

        // when
        for (int i = 0; i < 10; i++) {
            channel.publish(RetryStatus.ATTEMPT);
        }
        slow.request(Long.MAX_VALUE);

        // then
        assertThat(slow.received()).isNotEmpty().hasSizeLessThan(10);
    }

    @Test
    void close_멱등이며_onComplete_전달() throws Exception {
        StatusChannel channel = new StatusChannel(8);
        RecordingSubscriber subscriber = new RecordingSubscriber();
        channel.publisher().subscribe(subscriber);

        channel.close();
        channel.close();

        assertThat(subscriber.awaitCompletion(1)).isTrue();
    }

    @Test
    void subscribe_닫힌_채널이면_즉시_onComplete() throws Exception {
        StatusChannel channel = new StatusChannel(8);
        channel.close();

        RecordingSubscriber late = new RecordingSubscriber();
        channel.publisher().subscribe(late);

        assertThat(late.awaitCompletion(1)).isTrue();
    }
}
