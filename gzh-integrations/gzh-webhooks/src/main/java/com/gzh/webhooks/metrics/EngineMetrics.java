package com.gzh.webhooks.metrics;

import java.time.Duration;

/**
 * Process-wide counters for the automation engine.
 *
 * <p>Updated by every worker after each unit of work and read through
 * {@link #snapshot()}.  Guarded by its own monitor, independent of the rule
 * list lock, so a read never waits on more than a counter update.
 */
public class EngineMetrics {

    private long eventsProcessed;
    private long rulesEvaluated;
    private long actionsExecuted;
    private long errors;
    private long processingNanos;

    public synchronized void recordEventProcessed(Duration processingTime) {
        eventsProcessed++;
        processingNanos += processingTime.toNanos();
    }

    public synchronized void recordRuleEvaluated() {
        rulesEvaluated++;
    }

    public synchronized void recordActionExecuted() {
        actionsExecuted++;
    }

    public synchronized void recordError() {
        errors++;
    }

    /** Consistent copy of all counters. */
    public synchronized MetricsSnapshot snapshot() {
        return new MetricsSnapshot(eventsProcessed, rulesEvaluated, actionsExecuted, errors,
                Duration.ofNanos(processingNanos));
    }
}
