package com.gzh.webhooks.github.handler;

import com.gzh.webhooks.handler.ActionException;
import com.gzh.webhooks.handler.ActionHandler;
import com.gzh.webhooks.handler.ExecutionContext;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Stands in for a real handler when rules are tried against a sample event:
 * parameters are validated by the real handler, execution is only logged.
 */
public class DryRunActionHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(DryRunActionHandler.class);

    private final ActionHandler delegate;

    public DryRunActionHandler(ActionHandler delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(ExecutionContext context, WebhookEvent event, Action action) {
        log.info("Dry run: would execute {} for event {} with {}", action.getType(), event.getId(), action.getParameters());
    }

    @Override
    public void validateParameters(Map<String, Object> parameters) throws ActionException {
        delegate.validateParameters(parameters);
    }
}
