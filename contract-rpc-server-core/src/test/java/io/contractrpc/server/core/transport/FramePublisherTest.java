package io.contractrpc.server.core.transport;

import io.contractrpc.server.core.TestSubscriber;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FramePublisherTest {

    @Test
    void framesArriveInOfferOrderAndCompleteAfterBuffer() throws Exception {
        FramePublisher<String> frames = new FramePublisher<>(8);
        TestSubscriber<String> sub = new TestSubscriber<>(0);
        frames.subscribe(sub);

        frames.offer("a");
        frames.offer("b");
        frames.offer("c");
        frames.complete();
        assertThat(sub.items()).isEmpty();

        sub.request(2);
        assertThat(sub.items()).containsExactly("a", "b");
        assertThat(sub.completed()).isFalse();

        sub.request(1);
        assertThat(sub.items()).containsExactly("a", "b", "c");
        assertThat(sub.awaitTermination()).isTrue();
        assertThat(sub.completed()).isTrue();
    }

    @Test
    void offerBlocksWhileBufferIsFull() throws Exception {
        FramePublisher<Integer> frames = new FramePublisher<>(2);
        TestSubscriber<Integer> sub = new TestSubscriber<>(0);
        frames.subscribe(sub);
        frames.offer(1);
        frames.offer(2);

        CountDownLatch offered = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            frames.offer(3);
            offered.countDown();
        });
        producer.start();

        assertThat(offered.await(200, TimeUnit.MILLISECONDS)).isFalse();
        sub.request(1);
        assertThat(offered.await(5, TimeUnit.SECONDS)).isTrue();
        sub.request(10);
        assertThat(sub.items()).containsExactly(1, 2, 3);
        producer.join();
    }

    @Test
    void cancelReleasesBlockedProducerAndDropsFrames() throws Exception {
        AtomicInteger cancels = new AtomicInteger();
        FramePublisher<Integer> frames = new FramePublisher<Integer>(1).onCancel(cancels::incrementAndGet);
        TestSubscriber<Integer> sub = new TestSubscriber<>(0);
        frames.subscribe(sub);
        frames.offer(1);

        AtomicBoolean accepted = new AtomicBoolean(true);
        Thread producer = new Thread(() -> accepted.set(frames.offer(2)));
        producer.start();
        Thread.sleep(50);

        sub.cancel();
        sub.cancel();
        producer.join(5000);

        assertThat(accepted).isFalse();
        assertThat(frames.offer(3)).isFalse();
        assertThat(sub.items()).isEmpty();
        assertThat(cancels).hasValue(1);
        assertThat(frames.isCancelled()).isTrue();
    }

    @Test
    void failureIsDeliveredAfterBufferedFrames() throws Exception {
        FramePublisher<String> frames = new FramePublisher<>(4);
        TestSubscriber<String> sub = new TestSubscriber<>();
        frames.subscribe(sub);
        frames.offer("x");
        frames.fail(new IllegalStateException("boom"));

        assertThat(sub.awaitTermination()).isTrue();
        assertThat(sub.items()).containsExactly("x");
        assertThat(sub.error()).hasMessage("boom");
    }

    @Test
    void startActionRunsOnSubscribeAndSecondSubscriberFails() throws Exception {
        AtomicInteger starts = new AtomicInteger();
        FramePublisher<String> frames = new FramePublisher<String>(4).onStart(starts::incrementAndGet);
        frames.subscribe(new TestSubscriber<>());
        TestSubscriber<String> second = new TestSubscriber<>();
        frames.subscribe(second);

        assertThat(starts).hasValue(1);
        assertThat(second.error()).isInstanceOf(IllegalStateException.class);
    }
}
