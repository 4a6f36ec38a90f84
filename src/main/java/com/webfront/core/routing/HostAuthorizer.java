package com.webfront.core.routing;

import java.util.function.Supplier;

/**
 * Decides whether a host name is served by the current rule table. Intended as
 * the policy behind certificate issuance and TLS server-name checks: a name is
 * allowed if it equals a rule's host or that host with a {@code www.} prefix.
 */
public class HostAuthorizer {

    private static final String WWW_PREFIX = "www.";

    private final Supplier<RuleTable> tables;

    /**
     * @param tables Source of the current rule table.
     */
    public HostAuthorizer(Supplier<RuleTable> tables) {
        this.tables = tables;
    }

    /**
     * @param hostname The name a certificate or TLS session is requested for.
     * @return {@link Authorization#allow()} or a denial with its reason.
     */
    public Authorization authorize(String hostname) {
        if (hostname == null || hostname.isEmpty()) {
            return Authorization.deny("empty host");
        }
        RuleTable table = tables.get();
        for (ResolvedRule rule : table.getRules()) {
            String host = rule.getHost();
            if (host.isEmpty()) {
                continue;
            }
            if (hostname.equals(host) || hostname.equals(WWW_PREFIX + host)) {
                return Authorization.allow();
            }
        }
        return Authorization.deny("unrecognized host: " + hostname);
    }

    /**
     * @param hostname The name to check.
     * @return true if {@link #authorize(String)} allows it.
     */
    public boolean isAuthorized(String hostname) {
        return authorize(hostname).allowed();
    }
}
