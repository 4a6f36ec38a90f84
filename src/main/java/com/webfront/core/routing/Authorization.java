package com.webfront.core.routing;

/**
 * Outcome of a {@link HostAuthorizer} check.
 *
 * @param allowed Whether the host is covered by the rule table.
 * @param reason  Why the host was denied; null when allowed.
 */
public record Authorization(boolean allowed, String reason) {

    private static final Authorization ALLOWED = new Authorization(true, null);

    public static Authorization allow() {
        return ALLOWED;
    }

    public static Authorization deny(String reason) {
        return new Authorization(false, reason);
    }
}
