package com.gzh.webhooks.handler;

import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Action;

import java.util.Map;

/**
 * SPI for performing the effect of an {@link Action}.
 *
 * <p>Implementations are registered by action type in an
 * {@link ActionHandlerRegistry}.  The engine never inspects them beyond
 * this contract.
 *
 * <p>Handlers must be thread-safe: every worker, and every detached async
 * action, may call {@link #execute} concurrently.
 */
public interface ActionHandler {

    /**
     * Performs the action for {@code event}.
     *
     * @param context cancellation scope; long-running handlers should honour
     *                {@link ExecutionContext#isCancelled()} and {@link ExecutionContext#remaining()}
     * @param event   the event that matched the rule
     * @param action  the action descriptor, including its parameters
     * @throws ActionException if the action fails (the engine logs it and moves
     *         on to the next rule)
     */
    void execute(ExecutionContext context, WebhookEvent event, Action action) throws ActionException;

    /**
     * Checks the parameters of an action before its rule is registered.
     *
     * @throws ActionException describing the first invalid parameter
     */
    void validateParameters(Map<String, Object> parameters) throws ActionException;
}
