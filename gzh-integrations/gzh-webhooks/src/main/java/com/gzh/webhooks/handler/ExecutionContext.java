package com.gzh.webhooks.handler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cancellation scope handed to action handlers.
 *
 * <p>Scopes form a tree: a child is cancelled when it is cancelled itself,
 * when its deadline passes, or when any ancestor is cancelled.  The worker
 * pool owns a root scope for the lifetime of the engine; synchronous actions
 * run in children of it, asynchronous actions in children of a fresh
 * {@link #background()} scope so they outlive the delivery that triggered them.
 */
public final class ExecutionContext {

    private final ExecutionContext parent;
    private final Instant deadline;
    private volatile boolean cancelled;

    private ExecutionContext(ExecutionContext parent, Instant deadline) {
        this.parent   = parent;
        this.deadline = deadline;
    }

    /** New root scope with no deadline. */
    public static ExecutionContext background() {
        return new ExecutionContext(null, null);
    }

    /** Child scope without a deadline of its own. */
    public ExecutionContext child() {
        return new ExecutionContext(this, null);
    }

    /** Child scope that expires {@code timeout} from now, or earlier if an ancestor does. */
    public ExecutionContext withTimeout(Duration timeout) {
        return new ExecutionContext(this, Instant.now().plus(timeout));
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        if (cancelled) {
            return true;
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            return true;
        }
        return parent != null && parent.isCancelled();
    }

    /** Earliest deadline of this scope and its ancestors. */
    public Optional<Instant> deadline() {
        Optional<Instant> inherited = parent == null ? Optional.empty() : parent.deadline();
        if (deadline == null) {
            return inherited;
        }
        return inherited.filter(d -> d.isBefore(deadline)).or(() -> Optional.of(deadline));
    }

    /** Time left before the effective deadline; {@link Duration#ZERO} once it has passed. */
    public Optional<Duration> remaining() {
        return deadline().map(d -> {
            Duration left = Duration.between(Instant.now(), d);
            return left.isNegative() ? Duration.ZERO : left;
        });
    }

    /**
     * @throws ActionException if this scope is cancelled or expired
     */
    public void checkNotCancelled() throws ActionException {
        if (isCancelled()) {
            throw new ActionException("Execution cancelled");
        }
    }
}
