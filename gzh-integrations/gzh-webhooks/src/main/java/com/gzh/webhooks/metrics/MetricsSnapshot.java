package com.gzh.webhooks.metrics;

import java.time.Duration;

/** Immutable point-in-time copy of {@link EngineMetrics}. */
public final class MetricsSnapshot {

    private final long eventsProcessed;
    private final long rulesEvaluated;
    private final long actionsExecuted;
    private final long errors;
    private final Duration processingTime;

    public MetricsSnapshot(long eventsProcessed, long rulesEvaluated, long actionsExecuted,
                           long errors, Duration processingTime) {
        this.eventsProcessed = eventsProcessed;
        this.rulesEvaluated  = rulesEvaluated;
        this.actionsExecuted = actionsExecuted;
        this.errors          = errors;
        this.processingTime  = processingTime;
    }

    public long getEventsProcessed()     { return eventsProcessed; }
    public long getRulesEvaluated()      { return rulesEvaluated; }
    public long getActionsExecuted()     { return actionsExecuted; }
    public long getErrors()              { return errors; }
    public Duration getProcessingTime()  { return processingTime; }

    /** Cumulative processing time divided by events processed; 0 before the first event. */
    public double averageProcessingMillis() {
        if (eventsProcessed == 0) {
            return 0.0;
        }
        return processingTime.toNanos() / 1_000_000.0 / eventsProcessed;
    }

    @Override
    public String toString() {
        return "MetricsSnapshot{events=" + eventsProcessed +
               ", rules=" + rulesEvaluated +
               ", actions=" + actionsExecuted +
               ", errors=" + errors +
               ", avgMs=" + averageProcessingMillis() + '}';
    }
}
