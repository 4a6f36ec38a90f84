package com.webfront.entity;

import java.util.Objects;

/**
 * A single host-to-target routing directive as written in the rule file.
 * Instances are immutable; unused targets are stored as empty strings.
 */
public final class Rule {
    /** The host name to match (e.g., example.com). Subdomains match as well. */
    private final String host;

    /** Upstream authority to forward to (e.g., localhost:8080). */
    private final String forward;

    /** Directory to serve files from. */
    private final String serve;

    private Rule(String host, String forward, String serve) {
        this.host = host == null ? "" : host;
        this.forward = forward == null ? "" : forward;
        this.serve = serve == null ? "" : serve;
    }

    /**
     * Creates a rule. {@code null} values are treated as empty.
     *
     * @param host    The host to match.
     * @param forward The upstream authority, or empty.
     * @param serve   The directory to serve, or empty.
     * @return A new Rule.
     */
    public static Rule of(String host, String forward, String serve) {
        return new Rule(host, forward, serve);
    }

    /**
     * Creates a forwarding rule.
     *
     * @param host     The host to match.
     * @param upstream The upstream authority ({@code host:port}).
     * @return A new Rule.
     */
    public static Rule forward(String host, String upstream) {
        return new Rule(host, upstream, "");
    }

    /**
     * Creates a static file rule.
     *
     * @param host      The host to match.
     * @param directory The directory to serve.
     * @return A new Rule.
     */
    public static Rule serve(String host, String directory) {
        return new Rule(host, "", directory);
    }

    public String getHost() {
        return host;
    }

    public String getForward() {
        return forward;
    }

    public String getServe() {
        return serve;
    }

    /**
     * Forwarding takes precedence over serving when both are set.
     *
     * @return true if requests matching this rule are forwarded upstream.
     */
    public boolean isForwarding() {
        return !forward.isEmpty();
    }

    /**
     * @return true if requests matching this rule are answered from a directory.
     */
    public boolean isServing() {
        return forward.isEmpty() && !serve.isEmpty();
    }

    /**
     * An inert rule names no target. It stays in the table but never produces a
     * handler.
     *
     * @return true if neither {@code forward} nor {@code serve} is set.
     */
    public boolean isInert() {
        return forward.isEmpty() && serve.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Rule rule = (Rule) o;
        return host.equals(rule.host) &&
                forward.equals(rule.forward) &&
                serve.equals(rule.serve);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, forward, serve);
    }

    @Override
    public String toString() {
        return "Rule{host='" + host + "', forward='" + forward + "', serve='" + serve + "'}";
    }
}
