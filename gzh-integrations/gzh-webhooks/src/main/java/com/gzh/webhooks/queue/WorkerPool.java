package com.gzh.webhooks.queue;

import com.gzh.webhooks.engine.RuleEngine;
import com.gzh.webhooks.handler.ExecutionContext;
import com.gzh.webhooks.model.WebhookEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed set of worker threads draining an {@link EventQueue} into the
 * {@link RuleEngine}, one event at a time per worker.
 *
 * <p>The pool owns the root {@link ExecutionContext} of the engine.
 * {@link #stop(Duration)} cancels it, lets in-flight events finish within the
 * grace period and drops whatever is still queued.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    public static final int DEFAULT_WORKERS = 10;

    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);

    private final EventQueue queue;
    private final RuleEngine engine;
    private final int        workerCount;
    private final ExecutionContext root = ExecutionContext.background();
    private final List<Thread> threads  = new ArrayList<>();

    private volatile boolean running;

    public WorkerPool(EventQueue queue, RuleEngine engine, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        this.queue       = queue;
        this.engine      = engine;
        this.workerCount = workerCount;
    }

    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("Worker pool already started");
        }
        running = true;
        for (int i = 1; i <= workerCount; i++) {
            Thread t = new Thread(this::runWorker, "webhook-worker-" + i);
            t.setDaemon(true);
            threads.add(t);
            t.start();
        }
        log.info("Started {} webhook worker(s), queue capacity {}", workerCount, queue.capacity());
    }

    /**
     * Stops taking new events, waits up to {@code grace} for in-flight events,
     * then interrupts stragglers.  Events still queued are dropped.
     */
    public synchronized void stop(Duration grace) {
        if (!running) {
            return;
        }
        running = false;
        root.cancel();

        long deadline = System.nanoTime() + grace.toNanos();
        for (Thread t : threads) {
            long left = deadline - System.nanoTime();
            try {
                if (left > 0) {
                    t.join(Math.max(1, left / 1_000_000));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        for (Thread t : threads) {
            if (t.isAlive()) {
                log.warn("Worker {} did not finish within {}ms, interrupting", t.getName(), grace.toMillis());
                t.interrupt();
            }
        }
        threads.clear();

        int dropped = queue.clear();
        if (dropped > 0) {
            log.warn("Dropped {} queued event(s) at shutdown", dropped);
        }
        log.info("Webhook workers stopped");
    }

    public boolean isRunning() { return running; }

    public int workerCount() { return workerCount; }

    private void runWorker() {
        log.debug("{} started", Thread.currentThread().getName());
        while (running && !root.isCancelled()) {
            WebhookEvent event;
            try {
                event = queue.poll(POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) {
                continue;
            }
            try {
                engine.processEvent(event, root);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable t) {
                engine.metrics().recordError();
                log.error("Unexpected error processing event {}", event.getId(), t);
            }
        }
        log.debug("{} exiting", Thread.currentThread().getName());
    }
}
