package com.gzh.webhooks.queue;

import com.gzh.webhooks.TestEvents;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventQueueTest {

    @Test
    void offerFailsImmediatelyWhenFull() {
        EventQueue queue = new EventQueue(2);

        assertThat(queue.offer(TestEvents.push())).isTrue();
        assertThat(queue.offer(TestEvents.push())).isTrue();
        assertThat(queue.offer(TestEvents.push())).isFalse();
        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.capacity()).isEqualTo(2);
    }

    @Test
    void pollReturnsNullAfterTimeout() throws InterruptedException {
        assertThat(new EventQueue().poll(Duration.ofMillis(10))).isNull();
    }

    @Test
    void clearReportsDroppedCount() {
        EventQueue queue = new EventQueue(5);
        queue.offer(TestEvents.push());
        queue.offer(TestEvents.push());

        assertThat(queue.clear()).isEqualTo(2);
        assertThat(queue.size()).isZero();
    }

    @Test
    void defaultCapacityIsOneHundred() {
        assertThat(new EventQueue().capacity()).isEqualTo(100);
        assertThatThrownBy(() -> new EventQueue(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
