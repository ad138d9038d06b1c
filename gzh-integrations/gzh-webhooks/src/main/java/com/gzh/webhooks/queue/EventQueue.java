package com.gzh.webhooks.queue;

import com.gzh.webhooks.model.WebhookEvent;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-capacity hand-off between request threads and workers.  Producers
 * never block: {@link #offer} fails immediately when the queue is full.
 */
public class EventQueue {

    public static final int DEFAULT_CAPACITY = 100;

    private final BlockingQueue<WebhookEvent> queue;
    private final int capacity;

    public EventQueue() {
        this(DEFAULT_CAPACITY);
    }

    public EventQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.queue    = new ArrayBlockingQueue<>(capacity);
    }

    /** @return {@code false} when the queue is full */
    public boolean offer(WebhookEvent event) {
        return queue.offer(event);
    }

    /** Waits up to {@code timeout} for the next event; {@code null} when none arrived. */
    public WebhookEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public int size()     { return queue.size(); }
    public int capacity() { return capacity; }

    /** Discards every queued event and returns how many there were. */
    public int clear() {
        int dropped = 0;
        while (queue.poll() != null) {
            dropped++;
        }
        return dropped;
    }
}
