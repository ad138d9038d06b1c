package com.gzh.webhooks.engine;

import com.gzh.webhooks.handler.ActionException;
import com.gzh.webhooks.handler.ActionHandler;
import com.gzh.webhooks.handler.ActionHandlerRegistry;
import com.gzh.webhooks.handler.ExecutionContext;
import com.gzh.webhooks.metrics.EngineMetrics;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Action;
import com.gzh.webhooks.rule.Condition;
import com.gzh.webhooks.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the active rules and runs events through them.
 *
 * <p>The rule list is guarded by a read/write lock.  Event processing takes a
 * copy under the read lock and evaluates and dispatches without holding it, so
 * rule registration never waits on a slow action.
 *
 * <pre>
 *   ActionHandlerRegistry registry = new ActionHandlerRegistry();
 *   registry.register(LoggingActionHandler.TYPE, new LoggingActionHandler());
 *
 *   RuleEngine engine = new RuleEngine(registry);
 *   engine.addRule(Rule.builder("log-pushes", "Log pushes")
 *       .condition(Condition.eventType(Operator.EQUALS, "push"))
 *       .action(new Action("log", Map.of("message", "push to {{repo.full_name}}")))
 *       .build());
 *   engine.processEvent(event, ExecutionContext.background());
 * </pre>
 */
public class RuleEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final ReentrantReadWriteLock lock  = new ReentrantReadWriteLock();
    private final List<Rule>             rules = new ArrayList<>();

    private final ActionHandlerRegistry registry;
    private final EngineMetrics         metrics;
    private final ActionDispatcher      dispatcher;
    private final ConditionEvaluator    evaluator = new ConditionEvaluator();

    public RuleEngine(ActionHandlerRegistry registry) {
        this(registry, new EngineMetrics());
    }

    public RuleEngine(ActionHandlerRegistry registry, EngineMetrics metrics) {
        this(registry, metrics, new ActionDispatcher(registry, metrics));
    }

    public RuleEngine(ActionHandlerRegistry registry, EngineMetrics metrics, ActionDispatcher dispatcher) {
        this.registry   = registry;
        this.metrics    = metrics;
        this.dispatcher = dispatcher;
    }

    // ------------------------------------------------------------------
    // Rule registration
    // ------------------------------------------------------------------

    /**
     * Validates and appends a rule.
     *
     * @throws RuleValidationException if the rule is malformed or its id is already registered
     */
    public void addRule(Rule rule) {
        validate(rule);
        lock.writeLock().lock();
        try {
            for (Rule existing : rules) {
                if (existing.getId().equals(rule.getId())) {
                    throw new RuleValidationException("rule with ID " + rule.getId() + " already exists");
                }
            }
            rules.add(rule);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Added rule '{}' ({}) with {} condition(s) and {} action(s)",
                rule.getId(), rule.getName(), rule.getConditions().size(), rule.getActions().size());
    }

    /**
     * Validates every rule, then swaps the active list in one step.  On a
     * validation failure the active list is left unchanged.
     *
     * @throws RuleValidationException for the first malformed or duplicate rule
     */
    public void replaceRules(List<Rule> replacement) {
        Set<String> ids = new HashSet<>();
        for (Rule rule : replacement) {
            validate(rule);
            if (!ids.add(rule.getId())) {
                throw new RuleValidationException("duplicate rule ID: " + rule.getId());
            }
        }
        lock.writeLock().lock();
        try {
            rules.clear();
            rules.addAll(replacement);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded {} rule(s)", replacement.size());
    }

    /** Copy of the active rules in registration order. */
    public List<Rule> rules() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(rules));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Rule> findRule(String id) {
        return rules().stream().filter(r -> r.getId().equals(id)).findFirst();
    }

    // ------------------------------------------------------------------
    // Evaluation
    // ------------------------------------------------------------------

    /** True iff every condition of {@code rule} holds for {@code event}. */
    public boolean evaluateRule(Rule rule, WebhookEvent event) {
        for (Condition condition : rule.getConditions()) {
            if (!evaluator.evaluate(condition, event)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Evaluates every enabled rule against {@code event} and dispatches the
     * actions of those that match.  A failing rule is logged and counted; the
     * remaining matched rules still run.
     *
     * @param context scope the synchronous actions run in
     * @return the rules that matched, in registration order
     */
    public List<Rule> processEvent(WebhookEvent event, ExecutionContext context) {
        long started = System.nanoTime();
        try {
            log.debug("Processing event {} ({})", event.getId(), event.qualifiedType());

            List<Rule> matched = new ArrayList<>();
            for (Rule rule : rules()) {
                if (!rule.isEnabled()) {
                    continue;
                }
                metrics.recordRuleEvaluated();
                if (evaluateRule(rule, event)) {
                    log.debug("Rule '{}' matched event {}", rule.getId(), event.getId());
                    matched.add(rule);
                }
            }

            for (Rule rule : matched) {
                try {
                    dispatcher.dispatch(rule, event, context);
                } catch (ActionException e) {
                    metrics.recordError();
                    log.error("Rule '{}' failed for event {}: {}", rule.getId(), event.getId(), e.getMessage(), e);
                }
            }
            return Collections.unmodifiableList(matched);
        } finally {
            metrics.recordEventProcessed(Duration.ofNanos(System.nanoTime() - started));
        }
    }

    public EngineMetrics metrics() { return metrics; }

    public ActionHandlerRegistry registry() { return registry; }

    @Override
    public void close() {
        dispatcher.close();
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    private void validate(Rule rule) {
        if (rule == null) {
            throw new RuleValidationException("rule must not be null");
        }
        if (isBlank(rule.getId())) {
            throw new RuleValidationException("rule ID is required");
        }
        if (isBlank(rule.getName())) {
            throw new RuleValidationException("rule " + rule.getId() + ": name is required");
        }
        if (rule.getConditions().isEmpty()) {
            throw new RuleValidationException("rule " + rule.getId() + ": at least one condition is required");
        }
        if (rule.getActions().isEmpty()) {
            throw new RuleValidationException("rule " + rule.getId() + ": at least one action is required");
        }
        for (int i = 0; i < rule.getActions().size(); i++) {
            validateAction(rule, i, rule.getActions().get(i));
        }
    }

    private void validateAction(Rule rule, int index, Action action) {
        String where = "rule " + rule.getId() + ": action[" + index + "]";
        if (isBlank(action.getType())) {
            throw new RuleValidationException(where + " type is required");
        }
        if (action.getParameters() == null) {
            throw new RuleValidationException(where + " parameters are required");
        }
        try {
            action.timeoutDuration();
        } catch (IllegalArgumentException e) {
            throw new RuleValidationException(where + " has invalid timeout: " + action.getTimeout(), e);
        }
        Optional<ActionHandler> handler = registry.find(action.getType());
        if (handler.isPresent()) {
            try {
                handler.get().validateParameters(action.getParameters());
            } catch (ActionException e) {
                throw new RuleValidationException(where + " (" + action.getType() + ") invalid parameters: "
                        + e.getMessage(), e);
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
