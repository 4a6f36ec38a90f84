package com.webfront.core.routing;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

import com.webfront.core.handler.ForwardingHandler;
import com.webfront.core.handler.RequestHandler;
import com.webfront.core.handler.StaticFileHandler;
import com.webfront.entity.Rule;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the handler for a rule. Called once per rule while a table is loaded,
 * never on the request path. {@code Forward} takes precedence over
 * {@code Serve}.
 */
public class HandlerResolver {

    private static final Logger log = LoggerFactory.getLogger(HandlerResolver.class);

    private final HttpClient httpClient;
    private final Duration upstreamTimeout;

    /**
     * @param httpClient      Client shared by every forwarding handler.
     * @param upstreamTimeout Per-request upstream timeout, or null for none.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public HandlerResolver(HttpClient httpClient, Duration upstreamTimeout) {
        this.httpClient = httpClient;
        this.upstreamTimeout = upstreamTimeout;
    }

    /**
     * Creates a resolver with its own HTTP/1.1 client that never follows
     * redirects, so upstream redirects reach the client unchanged.
     *
     * @param upstreamTimeout Connect and request timeout.
     * @return A new resolver.
     */
    public static HandlerResolver withDefaultClient(Duration upstreamTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(upstreamTimeout)
                .build();
        return new HandlerResolver(client, upstreamTimeout);
    }

    /**
     * Resolves the handler for a rule.
     *
     * @param rule The rule.
     * @return The handler, or empty if the rule names no usable target.
     */
    public Optional<RequestHandler> resolve(Rule rule) {
        try {
            if (rule.isForwarding()) {
                return Optional.of(new ForwardingHandler(rule.getForward(), httpClient, upstreamTimeout));
            }
            if (rule.isServing()) {
                return Optional.of(new StaticFileHandler(rule.getServe()));
            }
        } catch (IllegalArgumentException e) {
            log.warn("Cannot build handler for {}: {}", rule, e.getMessage());
        }
        return Optional.empty();
    }
}
