package com.webfront.core.handler;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.webfront.core.constants.HeaderConstants;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A single HTTP request read from a client connection together with the means
 * to answer it. Handlers write exactly one response per exchange.
 */
public class HttpExchange {

    // HTTP status codes used across handlers.
    public static final int HTTP_OK = 200;
    public static final int HTTP_MOVED_PERMANENTLY = 301;
    public static final int HTTP_NOT_MODIFIED = 304;
    public static final int HTTP_BAD_REQUEST = 400;
    public static final int HTTP_FORBIDDEN = 403;
    public static final int HTTP_NOT_FOUND = 404;
    public static final int HTTP_METHOD_NOT_ALLOWED = 405;
    public static final int HTTP_LENGTH_REQUIRED = 411;
    public static final int HTTP_INTERNAL_ERROR = 500;
    public static final int HTTP_BAD_GATEWAY = 502;

    /** Standard HTTP reason phrases. */
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(200, "OK"), Map.entry(201, "Created"),
            Map.entry(204, "No Content"), Map.entry(206, "Partial Content"),
            Map.entry(301, "Moved Permanently"), Map.entry(302, "Found"),
            Map.entry(303, "See Other"), Map.entry(304, "Not Modified"),
            Map.entry(307, "Temporary Redirect"), Map.entry(308, "Permanent Redirect"),
            Map.entry(400, "Bad Request"), Map.entry(401, "Unauthorized"),
            Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"), Map.entry(408, "Request Timeout"),
            Map.entry(411, "Length Required"), Map.entry(413, "Payload Too Large"),
            Map.entry(429, "Too Many Requests"), Map.entry(500, "Internal Server Error"),
            Map.entry(502, "Bad Gateway"), Map.entry(503, "Service Unavailable"),
            Map.entry(504, "Gateway Timeout"));

    /** Headers the exchange writes itself; values supplied by handlers are dropped. */
    private static final Set<String> FRAMING_HEADERS;

    static {
        Set<String> framing = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        framing.addAll(List.of(
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                "Date"));
        FRAMING_HEADERS = Collections.unmodifiableSet(framing);
    }

    private final String method;
    private final URI uri;
    private final String host;
    private final Map<String, String> headers;
    private final String remoteAddr;
    private final boolean secure;
    private final InputStream requestBody;
    private final long contentLength;
    private final CountingOutputStream out;

    private int status;
    private boolean committed;
    private boolean keepAlive = true;
    private boolean suppressBody;

    /**
     * Creates an exchange.
     *
     * @param method        The request method.
     * @param uri           The request target, origin-form or absolute.
     * @param host          The host the client asked for, as sent (may carry a
     *                      port).
     * @param headers       The request headers.
     * @param remoteAddr    The client address.
     * @param secure        Whether the connection is TLS.
     * @param requestBody   The request body, limited to {@code contentLength}.
     * @param contentLength The declared body length (0 when absent).
     * @param clientOut     The raw client output stream.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public HttpExchange(String method, URI uri, String host, Map<String, String> headers, String remoteAddr,
            boolean secure, InputStream requestBody, long contentLength, OutputStream clientOut) {
        this.method = method;
        this.uri = uri;
        this.host = host;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.remoteAddr = remoteAddr;
        this.secure = secure;
        this.requestBody = requestBody;
        this.contentLength = contentLength;
        this.out = new CountingOutputStream(clientOut);
    }

    public String getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    public String getHost() {
        return host;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @param name Header name (case-insensitive).
     * @return The header value, or null if absent.
     */
    public String getHeader(String name) {
        return headers.get(name);
    }

    public String getRemoteAddr() {
        return remoteAddr;
    }

    public boolean isSecure() {
        return secure;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public InputStream getRequestBody() {
        return requestBody;
    }

    public long getContentLength() {
        return contentLength;
    }

    /**
     * @return The status that was sent, or 0 if no response has been started.
     */
    public int getStatus() {
        return status;
    }

    /**
     * @return Number of body bytes written to the client.
     */
    public long getBytesSent() {
        return out.getCount();
    }

    public boolean isCommitted() {
        return committed;
    }

    /**
     * @return Whether the connection may carry another request after this one.
     */
    public boolean isKeepAlive() {
        return keepAlive;
    }

    /**
     * Marks the connection to be closed once this response has been written.
     * Must be called before the response is started.
     */
    public void closeConnection() {
        this.keepAlive = false;
    }

    /**
     * Writes the status line and headers. A negative {@code length} means the
     * length is unknown; the body then ends when the connection is closed.
     *
     * @param status          The HTTP status code.
     * @param responseHeaders Headers to send (framing headers are ignored).
     * @param length          The body length, or -1 if unknown.
     * @throws IOException If the client connection fails.
     */
    public void sendResponseHeaders(int status, Map<String, List<String>> responseHeaders, long length)
            throws IOException {
        if (committed) {
            throw new IllegalStateException("Response already started with status " + this.status);
        }
        committed = true;
        this.status = status;

        boolean bodyless = status < 200 || status == 204 || status == HTTP_NOT_MODIFIED;
        suppressBody = bodyless || "HEAD".equalsIgnoreCase(method);
        if (length < 0 && !bodyless) {
            keepAlive = false;
        }

        StringBuilder head = new StringBuilder(256);
        head.append("HTTP/1.1 ").append(status).append(' ')
                .append(REASON_PHRASES.getOrDefault(status, "Unknown")).append("\r\n");
        head.append("Date: ")
                .append(DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(ZoneOffset.UTC)))
                .append("\r\n");
        responseHeaders.forEach((k, vv) -> {
            if (!FRAMING_HEADERS.contains(k)) {
                vv.forEach(v -> head.append(k).append(": ").append(v).append("\r\n"));
            }
        });
        if (length >= 0 && status != HTTP_NOT_MODIFIED && status >= 200 && status != 204) {
            head.append("Content-Length: ").append(length).append("\r\n");
        }
        if (!keepAlive) {
            head.append("Connection: close\r\n");
        }
        head.append("\r\n");

        // Header bytes are written straight to the client and not counted as body
        out.out().write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Returns the stream the response body is written to. For HEAD requests and
     * bodyless statuses the bytes are discarded. Closing the returned stream
     * only flushes it.
     *
     * @return The response body stream.
     */
    public OutputStream getResponseBody() {
        if (!committed) {
            throw new IllegalStateException("Response headers have not been sent");
        }
        if (suppressBody) {
            return OutputStream.nullOutputStream();
        }
        return out;
    }

    /**
     * Sends a complete {@code text/plain} response.
     *
     * @param status The HTTP status code.
     * @param body   The body text.
     * @throws IOException If the client connection fails.
     */
    public void sendText(int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        Map<String, List<String>> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        h.put(HeaderConstants.CONTENT_TYPE.getValue(), List.of("text/plain; charset=utf-8"));
        h.put("X-Content-Type-Options", List.of("nosniff"));
        sendResponseHeaders(status, h, bytes.length);
        getResponseBody().write(bytes);
        flush();
    }

    /**
     * Sends a response without a body.
     *
     * @param status          The HTTP status code.
     * @param responseHeaders Extra headers.
     * @throws IOException If the client connection fails.
     */
    public void sendEmpty(int status, Map<String, List<String>> responseHeaders) throws IOException {
        sendResponseHeaders(status, responseHeaders, 0);
        flush();
    }

    /**
     * Flushes buffered response bytes to the client.
     *
     * @throws IOException If the client connection fails.
     */
    public void flush() throws IOException {
        out.flush();
    }

    /**
     * OutputStream that counts body bytes and never closes the client stream.
     */
    private static class CountingOutputStream extends FilterOutputStream {
        private long count = 0;

        CountingOutputStream(OutputStream out) {
            super(out);
        }

        OutputStream out() {
            return out;
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b) throws IOException {
            out.write(b);
            count += b.length;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }

        /**
         * The client socket outlives a single response; closing only flushes.
         */
        @Override
        public void close() throws IOException {
            out.flush();
        }

        long getCount() {
            return count;
        }
    }
}
