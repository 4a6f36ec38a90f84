package com.webfront.core.routing;

import java.util.Optional;

import com.webfront.core.handler.RequestHandler;
import com.webfront.entity.Rule;

/**
 * A {@link Rule} paired with the handler built for it at load time.
 * The handler is absent for inert rules.
 */
public final class ResolvedRule {

    private final Rule rule;
    private final RequestHandler handler;

    /**
     * @param rule    The routing directive.
     * @param handler The handler resolved for it, or null if the rule is inert.
     */
    public ResolvedRule(Rule rule, RequestHandler handler) {
        this.rule = rule;
        this.handler = handler;
    }

    public Rule getRule() {
        return rule;
    }

    public String getHost() {
        return rule.getHost();
    }

    public Optional<RequestHandler> getHandler() {
        return Optional.ofNullable(handler);
    }

    /**
     * @return true if no handler could be built for this rule.
     */
    public boolean isInert() {
        return handler == null;
    }

    @Override
    public String toString() {
        return rule.getHost() + " -> " + (handler != null ? handler.describe() : "(inert)");
    }
}
