package com.gzh.webhooks.engine;

import com.gzh.webhooks.handler.ActionException;
import com.gzh.webhooks.handler.ActionHandler;
import com.gzh.webhooks.handler.ActionHandlerRegistry;
import com.gzh.webhooks.handler.ActionTimeoutException;
import com.gzh.webhooks.handler.ExecutionContext;
import com.gzh.webhooks.metrics.EngineMetrics;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Action;
import com.gzh.webhooks.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the actions of a matched rule through their registered handlers.
 *
 * <h2>Execution</h2>
 * <ul>
 *   <li>Actions run in list order and each one counts as an executed action.</li>
 *   <li>An <b>async</b> action is handed to a background thread in a fresh
 *       {@link ExecutionContext#background()} scope, bounded by its timeout.
 *       Its failure is logged and counted, never reported to the caller.</li>
 *   <li>A <b>sync</b> action runs in a child of the caller's scope.  Without
 *       a timeout it runs on the calling thread; with one, it runs on a
 *       background thread and the caller waits at most that long.</li>
 *   <li>The first sync failure stops the remaining actions of the rule and
 *       is thrown to the caller.  A handler that throws an {@link Error}
 *       other than a {@link VirtualMachineError} fails like any other.</li>
 *   <li>Async actions dispatched after {@link #close()} are counted as errors.</li>
 * </ul>
 */
public class ActionDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final ActionHandlerRegistry registry;
    private final EngineMetrics         metrics;
    private final ExecutorService       executor;

    public ActionDispatcher(ActionHandlerRegistry registry, EngineMetrics metrics) {
        this.registry = registry;
        this.metrics  = metrics;
        this.executor = Executors.newCachedThreadPool(new ActionThreadFactory());
    }

    /**
     * Executes every action of {@code rule} for {@code event}.
     *
     * @throws ActionException the first synchronous action failure
     */
    public void dispatch(Rule rule, WebhookEvent event, ExecutionContext context) throws ActionException {
        for (Action action : rule.getActions()) {
            metrics.recordActionExecuted();
            if (action.isAsync()) {
                dispatchAsync(rule, event, action);
            } else {
                executeSync(event, action, context);
            }
        }
    }

    // ------------------------------------------------------------------
    // Async
    // ------------------------------------------------------------------

    private void dispatchAsync(Rule rule, WebhookEvent event, Action action) {
        Optional<Duration> timeout = timeout(action);
        ExecutionContext scope = scoped(ExecutionContext.background(), timeout);
        try {
            executor.execute(() -> runAsync(rule, event, action, scope, timeout));
        } catch (RejectedExecutionException e) {
            scope.cancel();
            metrics.recordError();
            log.error("Async action '{}' of rule '{}' rejected for event {}: dispatcher is closed",
                    action.getType(), rule.getId(), event.getId());
        }
    }

    private void runAsync(Rule rule, WebhookEvent event, Action action, ExecutionContext scope,
                          Optional<Duration> timeout) {
        try {
            if (timeout.isPresent()) {
                runBounded(scope, event, action, timeout.get());
            } else {
                invoke(scope, event, action);
            }
            log.debug("Async action '{}' of rule '{}' completed for event {}",
                    action.getType(), rule.getId(), event.getId());
        } catch (ActionException e) {
            metrics.recordError();
            log.error("Async action '{}' of rule '{}' failed for event {}: {}",
                    action.getType(), rule.getId(), event.getId(), e.getMessage(), e);
        } finally {
            scope.cancel();
        }
    }

    // ------------------------------------------------------------------
    // Sync
    // ------------------------------------------------------------------

    private void executeSync(WebhookEvent event, Action action, ExecutionContext parent) throws ActionException {
        Optional<Duration> timeout = timeout(action);
        ExecutionContext scope = scoped(parent, timeout);
        try {
            if (timeout.isPresent()) {
                runBounded(scope, event, action, timeout.get());
            } else {
                invoke(scope, event, action);
            }
        } finally {
            scope.cancel();
        }
    }

    /** Runs the handler on the executor and waits at most {@code timeout}. */
    private void runBounded(ExecutionContext scope, WebhookEvent event, Action action, Duration timeout)
            throws ActionException {
        Future<?> task;
        try {
            task = executor.submit(() -> {
                invoke(scope, event, action);
                return null;
            });
        } catch (RejectedExecutionException e) {
            throw new ActionException("Action '" + action.getType() + "' rejected: dispatcher is closed", e);
        }
        try {
            task.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            scope.cancel();
            throw new ActionTimeoutException(action.getType(), timeout);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ActionException("Interrupted while waiting for action '" + action.getType() + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ActionException ae) {
                throw ae;
            }
            throw new ActionException("Action '" + action.getType() + "' failed: " + cause.getMessage(), cause);
        }
    }

    private void invoke(ExecutionContext scope, WebhookEvent event, Action action) throws ActionException {
        ActionHandler handler = registry.find(action.getType())
                .orElseThrow(() -> new ActionException("No handler registered for action type: " + action.getType()));
        try {
            handler.execute(scope, event, action);
        } catch (RuntimeException | Error e) {
            if (e instanceof VirtualMachineError fatal) {
                throw fatal;
            }
            throw new ActionException("Handler for '" + action.getType() + "' threw " + e, e);
        }
    }

    private static ExecutionContext scoped(ExecutionContext parent, Optional<Duration> timeout) {
        return timeout.map(parent::withTimeout).orElseGet(parent::child);
    }

    private Optional<Duration> timeout(Action action) {
        try {
            return action.timeoutDuration();
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid timeout '{}' on action '{}': {}", action.getTimeout(), action.getType(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class ActionThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "webhook-action-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
