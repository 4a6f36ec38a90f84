package com.webfront.core.routing;

import java.util.Optional;
import java.util.function.Supplier;

import com.webfront.core.handler.RequestHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the handler for an inbound request by its host.
 *
 * <p>
 * Each call reads the current table exactly once and matches against that
 * snapshot, so a concurrent reload can never change the table mid-scan. The
 * returned handler is invoked by the caller without holding anything.
 * </p>
 */
public class HostRouter {

    private static final Logger log = LoggerFactory.getLogger(HostRouter.class);

    private final Supplier<RuleTable> tables;

    /**
     * @param tables Source of the current rule table.
     */
    public HostRouter(Supplier<RuleTable> tables) {
        this.tables = tables;
    }

    /**
     * Routes a request host.
     *
     * @param hostHeader The Host header value (a port is ignored).
     * @return The handler of the first matching rule, or empty if no rule matches
     *         or the first matching rule is inert.
     */
    public Optional<RequestHandler> route(String hostHeader) {
        RuleTable table = tables.get();
        String host = HostMatcher.normalize(hostHeader);

        Optional<ResolvedRule> match = HostMatcher.firstMatch(table.getRules(), host);
        if (match.isEmpty()) {
            log.debug("No rule for host {}", host);
            return Optional.empty();
        }
        ResolvedRule rule = match.get();
        if (rule.isInert()) {
            log.debug("Host {} matched inert rule {}", host, rule.getRule());
        }
        return rule.getHandler();
    }
}
