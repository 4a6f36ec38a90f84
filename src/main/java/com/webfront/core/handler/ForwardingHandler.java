package com.webfront.core.handler;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.webfront.core.constants.HeaderConstants;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reverse-proxy handler: sends the request to a fixed upstream authority over
 * plain HTTP and relays the response back to the client.
 */
public final class ForwardingHandler implements RequestHandler {

    private static final Logger log = LoggerFactory.getLogger(ForwardingHandler.class);

    /**
     * Bodies smaller than this threshold are buffered in memory; larger bodies are
     * streamed.
     */
    private static final int LARGE_BODY_THRESHOLD = 64 * 1024;

    /** Headers that are not forwarded from client to upstream. */
    private static final Set<String> DISALLOWED_HEADERS;

    /** Hop-by-hop headers that must be removed per RFC 7230. */
    private static final Set<String> HOP_BY_HOP_HEADERS;

    static {
        Set<String> hopByHop = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        hopByHop.addAll(List.of(
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                HeaderConstants.PROXY_AUTHENTICATE.getValue(),
                HeaderConstants.PROXY_AUTHORIZATION.getValue(),
                HeaderConstants.TE.getValue(),
                HeaderConstants.TRAILERS.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.UPGRADE.getValue()));
        HOP_BY_HOP_HEADERS = Collections.unmodifiableSet(hopByHop);

        // The JDK client sets these itself and rejects them on the builder
        Set<String> disallowed = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        disallowed.addAll(hopByHop);
        disallowed.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.EXPECT.getValue()));
        DISALLOWED_HEADERS = Collections.unmodifiableSet(disallowed);
    }

    private final String upstream;
    private final URI baseUri;
    private final HttpClient httpClient;
    private final Duration timeout;

    /**
     * Creates a forwarding handler.
     *
     * @param upstream   The upstream authority ({@code host:port}).
     * @param httpClient Shared client used for all upstream requests.
     * @param timeout    Per-request timeout, or null for none.
     * @throws IllegalArgumentException if {@code upstream} is not a valid
     *                                  authority.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ForwardingHandler(String upstream, HttpClient httpClient, Duration timeout) {
        URI uri = URI.create("http://" + upstream);
        if (uri.getHost() == null || uri.getRawPath() != null && !uri.getRawPath().isEmpty()) {
            throw new IllegalArgumentException("Not a host:port authority: " + upstream);
        }
        this.upstream = upstream;
        this.baseUri = uri;
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    /**
     * @return The upstream authority requests are sent to.
     */
    public String getUpstream() {
        return upstream;
    }

    @Override
    public String describe() {
        return "forward to " + upstream;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        HttpResponse<InputStream> response;
        try {
            HttpRequest request = buildRequest(exchange, targetUri(exchange.getUri()));
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IllegalArgumentException e) {
            log.debug("Request for {} cannot be forwarded: {}", exchange.getUri(), e.getMessage());
            exchange.closeConnection();
            exchange.sendEmpty(HttpExchange.HTTP_BAD_REQUEST, Map.of());
            return;
        } catch (IOException e) {
            log.warn("Upstream {} failed for {}: {}", upstream, exchange.getUri(), e.getMessage());
            exchange.closeConnection();
            exchange.sendEmpty(HttpExchange.HTTP_BAD_GATEWAY, Map.of());
            return;
        } catch (InterruptedException e) {
            log.warn("Upstream request to {} interrupted", upstream);
            Thread.currentThread().interrupt();
            exchange.closeConnection();
            exchange.sendEmpty(HttpExchange.HTTP_BAD_GATEWAY, Map.of());
            return;
        }

        forwardResponse(response, exchange);
    }

    /**
     * Rewrites scheme and authority, keeping the client's path and query.
     *
     * @param requestUri The absolute request URI.
     * @return The URI on the upstream.
     */
    URI targetUri(URI requestUri) {
        String path = requestUri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        String query = requestUri.getRawQuery();
        return URI.create(baseUri + path + (query != null ? "?" + query : ""));
    }

    private HttpRequest buildRequest(HttpExchange exchange, URI target) throws IOException {
        HttpRequest.Builder rb = HttpRequest.newBuilder()
                .uri(target)
                .version(HttpClient.Version.HTTP_1_1)
                .method(exchange.getMethod(), createBodyPublisher(exchange));

        if (timeout != null) {
            rb.timeout(timeout);
        }

        Set<String> connectionScoped = connectionTokens(
                List.of(exchange.getHeaders().getOrDefault(HeaderConstants.CONNECTION.getValue(), "")));
        exchange.getHeaders().forEach((k, v) -> {
            if (isForwardable(k) && !connectionScoped.contains(k)) {
                try {
                    rb.header(k, v);
                } catch (IllegalArgumentException e) {
                    log.debug("Dropping header {} for upstream {}: {}", k, upstream, e.getMessage());
                }
            }
        });

        String existingXff = exchange.getHeader(HeaderConstants.X_FORWARDED_FOR.getValue());
        String xff = (existingXff != null ? existingXff + ", " : "") + exchange.getRemoteAddr();
        rb.setHeader(HeaderConstants.X_FORWARDED_FOR.getValue(), xff);
        rb.setHeader(HeaderConstants.X_FORWARDED_PROTO.getValue(), exchange.isSecure() ? "https" : "http");
        if (exchange.getHost() != null && !exchange.getHost().isEmpty()) {
            rb.setHeader(HeaderConstants.X_FORWARDED_HOST.getValue(), exchange.getHost());
        }

        return rb.build();
    }

    /**
     * Buffers small bodies and streams larger ones with a fixed length.
     */
    private HttpRequest.BodyPublisher createBodyPublisher(HttpExchange exchange) throws IOException {
        long length = exchange.getContentLength();
        if (length <= 0) {
            return HttpRequest.BodyPublishers.noBody();
        }
        if (length < LARGE_BODY_THRESHOLD) {
            byte[] body = exchange.getRequestBody().readNBytes((int) length);
            return HttpRequest.BodyPublishers.ofByteArray(body);
        }
        return HttpRequest.BodyPublishers.fromPublisher(
                HttpRequest.BodyPublishers.ofInputStream(exchange::getRequestBody), length);
    }

    private void forwardResponse(HttpResponse<InputStream> response, HttpExchange exchange) throws IOException {
        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        Set<String> connectionScoped = connectionTokens(
                response.headers().allValues(HeaderConstants.CONNECTION.getValue()));
        response.headers().map().forEach((k, vv) -> {
            if (!k.startsWith(":") && !HOP_BY_HOP_HEADERS.contains(k) && !connectionScoped.contains(k)) {
                headers.put(k, vv);
            }
        });
        long length = response.headers().firstValueAsLong(HeaderConstants.CONTENT_LENGTH.getValue()).orElse(-1L);

        exchange.sendResponseHeaders(response.statusCode(), headers, length);
        OutputStream body = exchange.getResponseBody();
        try (InputStream upstreamBody = response.body()) {
            upstreamBody.transferTo(body);
        }
        exchange.flush();
    }

    /**
     * Header names listed in {@code Connection} apply to a single hop only
     * (RFC 7230 section 6.1).
     *
     * @param values The {@code Connection} header values.
     * @return The listed header names, matched case-insensitively.
     */
    static Set<String> connectionTokens(List<String> values) {
        Set<String> tokens = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (String value : values) {
            for (String token : value.split(",")) {
                String name = token.trim();
                if (!name.isEmpty()) {
                    tokens.add(name);
                }
            }
        }
        return tokens;
    }

    private static boolean isForwardable(String header) {
        return !DISALLOWED_HEADERS.contains(header);
    }
}
