package com.webfront.core.routing;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered snapshot of resolved rules plus the modification time of
 * the file they were parsed from. A new table replaces the old one as a whole;
 * nothing inside a published table ever changes.
 */
public final class RuleTable {

    private final List<ResolvedRule> rules;
    private final Instant lastModified;

    /**
     * @param rules        Resolved rules in file order.
     * @param lastModified Modification time of the source file.
     */
    public RuleTable(List<ResolvedRule> rules, Instant lastModified) {
        this.rules = List.copyOf(rules);
        this.lastModified = Objects.requireNonNull(lastModified, "lastModified");
    }

    /**
     * @return Unmodifiable rules in file order; first match wins.
     */
    public List<ResolvedRule> getRules() {
        return rules;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public int size() {
        return rules.size();
    }

    /**
     * @return Number of rules that have no handler.
     */
    public long inertCount() {
        return rules.stream().filter(ResolvedRule::isInert).count();
    }

    @Override
    public String toString() {
        return "RuleTable{" + rules.size() + " rules, lastModified=" + lastModified + "}";
    }
}
