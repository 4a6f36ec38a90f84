package com.webfront.core.routing;

import java.util.List;
import java.util.Optional;

/**
 * Host normalization and rule matching.
 */
public final class HostMatcher {

    private HostMatcher() {
        // Private constructor for utility class
    }

    /**
     * Strips the port from a Host header value. Bracketed IPv6 literals keep
     * their brackets.
     *
     * @param hostHeader The raw host, e.g. {@code example.com:8080}.
     * @return The host without port; empty for null input.
     */
    public static String normalize(String hostHeader) {
        if (hostHeader == null) {
            return "";
        }
        String h = hostHeader.trim();
        if (h.startsWith("[")) {
            int end = h.indexOf(']');
            return end >= 0 ? h.substring(0, end + 1) : h;
        }
        int colon = h.indexOf(':');
        return colon >= 0 ? h.substring(0, colon) : h;
    }

    /**
     * A host matches a rule host if it is equal to it or is a subdomain of it.
     * Only dot-delimited suffixes count: {@code evilexample.com} does not match
     * {@code example.com}. Comparison is case-sensitive.
     *
     * @param host     Normalized request host.
     * @param ruleHost Host from the rule.
     * @return true on a match.
     */
    public static boolean matches(String host, String ruleHost) {
        if (ruleHost == null || ruleHost.isEmpty() || host == null) {
            return false;
        }
        if (host.equals(ruleHost)) {
            return true;
        }
        return host.length() > ruleHost.length() + 1
                && host.endsWith(ruleHost)
                && host.charAt(host.length() - ruleHost.length() - 1) == '.';
    }

    /**
     * Finds the first rule, in table order, whose host matches.
     *
     * @param rules Rules in table order.
     * @param host  Normalized request host.
     * @return The first matching rule, inert or not.
     */
    public static Optional<ResolvedRule> firstMatch(List<ResolvedRule> rules, String host) {
        for (ResolvedRule rule : rules) {
            if (matches(host, rule.getHost())) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
