package com.webfront.core.server;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.webfront.config.ListenerConfig;
import com.webfront.config.WebfrontProperties;
import com.webfront.core.constants.HeaderConstants;
import com.webfront.core.exceptions.ProtocolException;
import com.webfront.core.handler.HttpExchange;
import com.webfront.core.handler.RequestHandler;
import com.webfront.core.routing.HostAuthorizer;
import com.webfront.core.routing.HostRouter;
import com.webfront.core.services.AccessLogService;
import com.webfront.core.utils.IoUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * HTTP/1.1 listener that routes every request by its host.
 *
 * <p>
 * Each request is matched against the rule table current at the time it
 * arrives. Requests whose host matches no rule, or only an inert one, are
 * answered with {@code 404 Not found.}.
 * </p>
 */
public class HttpFrontServer extends AbstractFrontServer {

    private static final int MAX_HTTP_HEADERS = 100;
    private static final String NOT_FOUND_BODY = "Not found.\n";
    private static final int LINGER_TIMEOUT_MS = 1000;
    private static final long MAX_LINGER_BYTES = 64 * 1024;

    private final HostRouter router;
    private final Counter requestsTotal;
    private final Counter requestsNotFound;

    /**
     * @param config      The listener configuration.
     * @param globalProps The global configuration.
     * @param router      Chooses the handler for each request.
     * @param authorizer  Host policy for the TLS server name check.
     * @param accessLog   The access log writer.
     * @param registry    The Micrometer meter registry.
     */
    public HttpFrontServer(ListenerConfig config, WebfrontProperties globalProps, HostRouter router,
            HostAuthorizer authorizer, AccessLogService accessLog, MeterRegistry registry) {
        super(config, globalProps, authorizer, accessLog, registry);
        this.router = router;
        this.requestsTotal = Counter.builder("webfront.http.requests.total")
                .tag("name", metricName)
                .description("Total number of HTTP requests")
                .register(registry);
        this.requestsNotFound = Counter.builder("webfront.http.requests.not_found")
                .tag("name", metricName)
                .description("Requests whose host matched no usable rule")
                .register(registry);
    }

    @Override
    public void stop() {
        super.stop();
        registry.remove(requestsTotal);
        registry.remove(requestsNotFound);
    }

    @Override
    protected String getServerName() {
        return config.isTlsEnabled() ? "HTTPS" : "HTTP";
    }

    /**
     * Reads requests from the connection until the client or a response ends it.
     */
    @Override
    protected void handleClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try (client) {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = new BufferedOutputStream(client.getOutputStream());
            try {
                while (!client.isClosed() && processNextRequest(in, out, remoteAddr)) {
                    // Keep-alive: next request on the same connection
                }
            } catch (ProtocolException e) {
                log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
                writeErrorResponse(out, e.getStatus());
                lingeringClose(client, in);
            }
        } catch (IOException e) {
            log.debug("Connection from {} ended: {}", remoteAddr, e.getMessage());
        }
    }

    /**
     * Reads, routes and answers one request.
     *
     * @return {@code true} if the connection may carry another request.
     */
    private boolean processNextRequest(InputStream in, OutputStream out, String remoteAddr) throws IOException {
        String requestLine = IoUtils.readLine(in);
        if (requestLine == null || requestLine.isEmpty()) {
            return false;
        }
        requestsTotal.increment();

        String[] parts = requestLine.split(" ");
        if (parts.length != 3 || !parts[2].startsWith("HTTP/1.")) {
            throw new ProtocolException("Malformed request line: " + requestLine);
        }
        String method = parts[0];
        String target = parts[1];
        boolean http11 = "HTTP/1.1".equals(parts[2]);

        Map<String, String> headers = readHeaders(in);
        if (headers.containsKey(HeaderConstants.TRANSFER_ENCODING.getValue())) {
            throw new ProtocolException(HttpExchange.HTTP_LENGTH_REQUIRED,
                    "Transfer-Encoding request bodies are not supported");
        }
        long contentLength = parseContentLength(headers);

        URI uri;
        try {
            uri = new URI(target);
        } catch (URISyntaxException e) {
            throw new ProtocolException("Invalid request target " + target + ": " + e.getMessage());
        }
        String host = uri.isAbsolute() && uri.getRawAuthority() != null
                ? uri.getRawAuthority()
                : headers.getOrDefault(HeaderConstants.HOST.getValue(), "");

        LimitInputStream body = new LimitInputStream(in, contentLength);
        HttpExchange exchange = new HttpExchange(method, uri, host, headers, remoteAddr, config.isTlsEnabled(),
                body, contentLength, out);
        if (!config.isKeepAlive() || !clientWantsKeepAlive(headers, http11)) {
            exchange.closeConnection();
        }
        if (contentLength > 0 && "100-continue".equalsIgnoreCase(headers.get(HeaderConstants.EXPECT.getValue()))) {
            out.write("HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
        }

        try {
            dispatch(exchange);
            exchange.flush();
        } finally {
            accessLog.logRequest(remoteAddr, method, target, exchange.getStatus(), exchange.getBytesSent(), host);
        }

        // Keep the stream aligned on the next request line
        body.drain();
        return exchange.isKeepAlive();
    }

    /**
     * Routes the exchange and runs the chosen handler. Nothing is locked while
     * the handler runs.
     */
    private void dispatch(HttpExchange exchange) throws IOException {
        Optional<RequestHandler> handler = router.route(exchange.getHost());
        if (handler.isEmpty()) {
            requestsNotFound.increment();
            exchange.sendText(HttpExchange.HTTP_NOT_FOUND, NOT_FOUND_BODY);
            return;
        }

        try {
            handler.get().handle(exchange);
        } catch (RuntimeException e) {
            recordConnectionError();
            log.error("Handler {} failed for {}: {}", handler.get().describe(), exchange.getUri(),
                    e.getMessage(), e);
            exchange.closeConnection();
            if (!exchange.isCommitted()) {
                exchange.sendText(HttpExchange.HTTP_INTERNAL_ERROR, "Internal Server Error\n");
            }
            return;
        }
        if (!exchange.isCommitted()) {
            log.warn("Handler {} sent no response for {}", handler.get().describe(), exchange.getUri());
            exchange.closeConnection();
            exchange.sendText(HttpExchange.HTTP_INTERNAL_ERROR, "Internal Server Error\n");
        }
    }

    private Map<String, String> readHeaders(InputStream in) throws IOException {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        String line;
        int headerCount = 0;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HTTP_HEADERS) {
                throw new ProtocolException("Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx <= 0) {
                throw new ProtocolException("Malformed header line: " + line);
            }
            String name = line.substring(0, idx).trim();
            String value = line.substring(idx + 1).trim();
            // Repeated headers are folded into one comma-separated value
            headers.merge(name, value, (a, b) -> a + ", " + b);
        }
        return headers;
    }

    private static long parseContentLength(Map<String, String> headers) {
        String clStr = headers.get(HeaderConstants.CONTENT_LENGTH.getValue());
        if (clStr == null) {
            return 0;
        }
        try {
            long length = Long.parseLong(clStr.trim());
            if (length < 0) {
                throw new ProtocolException("Negative Content-Length: " + clStr);
            }
            return length;
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length: " + clStr);
        }
    }

    private static boolean clientWantsKeepAlive(Map<String, String> headers, boolean http11) {
        String connection = headers.get(HeaderConstants.CONNECTION.getValue());
        if (connection == null) {
            return http11;
        }
        String lower = connection.toLowerCase(Locale.ROOT);
        if (lower.contains("close")) {
            return false;
        }
        return http11 || lower.contains("keep-alive");
    }

    /**
     * Writes a bodyless error response for requests that could not be parsed.
     */
    private void writeErrorResponse(OutputStream out, int status) {
        String reason = status == HttpExchange.HTTP_LENGTH_REQUIRED ? "Length Required" : "Bad Request";
        String response = "HTTP/1.1 " + status + " " + reason + "\r\n"
                + "Content-Length: 0\r\n"
                + "Connection: close\r\n\r\n";
        try {
            out.write(response.getBytes(StandardCharsets.US_ASCII));
            out.flush();
        } catch (IOException e) {
            log.debug("Failed to send {} response: {}", status, e.getMessage());
        }
    }

    /**
     * Half-closes the connection and discards what the client still sends, so the
     * error response is not lost to a connection reset.
     */
    private void lingeringClose(Socket client, InputStream in) {
        try {
            client.shutdownOutput();
            client.setSoTimeout(LINGER_TIMEOUT_MS);
            byte[] discard = new byte[4096];
            long total = 0;
            int n;
            while (total < MAX_LINGER_BYTES && (n = in.read(discard)) != -1) {
                total += n;
            }
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Lingering close ended: {}", e.getMessage());
        }
    }

    /**
     * Limits reads to the declared request body length. Closing does not close
     * the connection stream.
     */
    private static class LimitInputStream extends FilterInputStream {
        private long left;

        LimitInputStream(InputStream in, long limit) {
            super(in);
            this.left = limit;
        }

        @Override
        public int read() throws IOException {
            if (left <= 0) {
                return -1;
            }
            int res = super.read();
            if (res != -1) {
                left--;
            }
            return res;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (left <= 0) {
                return -1;
            }
            int toRead = (int) Math.min(len, left);
            int res = super.read(b, off, toRead);
            if (res != -1) {
                left -= res;
            }
            return res;
        }

        @Override
        public long skip(long n) throws IOException {
            long skipped = super.skip(Math.min(n, left));
            left -= skipped;
            return skipped;
        }

        @Override
        public int available() throws IOException {
            return (int) Math.min(super.available(), left);
        }

        @Override
        public boolean markSupported() {
            return false;
        }

        @Override
        public void close() {
            // The connection outlives the request body
        }

        /**
         * Discards the unread rest of the body so the next request can be read.
         */
        void drain() throws IOException {
            if (left > 0) {
                in.skipNBytes(left);
                left = 0;
            }
        }
    }
}
