package com.webfront.core.handler;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLConnection;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.webfront.core.constants.HeaderConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves files below a root directory.
 *
 * <p>
 * Directory requests without a trailing slash are redirected to the slashed
 * form. A directory is answered with its {@code index.html} when present and
 * with an HTML listing otherwise. Paths that escape the root are reported as
 * missing.
 * </p>
 */
public final class StaticFileHandler implements RequestHandler {

    private static final Logger log = LoggerFactory.getLogger(StaticFileHandler.class);

    private static final String INDEX_FILE = "index.html";
    private static final String NOT_FOUND_BODY = "404 page not found\n";
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final String directory;
    private final Path root;

    /**
     * Creates a handler rooted at {@code directory}. Relative paths are resolved
     * against the working directory once, at construction.
     *
     * @param directory The directory to serve.
     * @throws IllegalArgumentException if {@code directory} is not a valid path.
     */
    public StaticFileHandler(String directory) {
        try {
            this.root = Paths.get(directory).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid directory: " + directory, e);
        }
        this.directory = directory;
    }

    /**
     * @return The directory as configured in the rule.
     */
    public String getDirectory() {
        return directory;
    }

    /**
     * @return The absolute directory files are served from.
     */
    public Path getRoot() {
        return root;
    }

    @Override
    public String describe() {
        return "serve " + directory;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getMethod();
        if (!"GET".equalsIgnoreCase(method) && !"HEAD".equalsIgnoreCase(method)) {
            exchange.sendEmpty(HttpExchange.HTTP_METHOD_NOT_ALLOWED,
                    Map.of(HeaderConstants.ALLOW.getValue(), List.of("GET, HEAD")));
            return;
        }

        String requestPath = exchange.getUri().getPath();
        if (requestPath == null || requestPath.isEmpty()) {
            requestPath = "/";
        }

        Path file = resolve(requestPath);
        if (file == null || !Files.exists(file)) {
            exchange.sendText(HttpExchange.HTTP_NOT_FOUND, NOT_FOUND_BODY);
            return;
        }

        if (Files.isDirectory(file)) {
            if (!requestPath.endsWith("/")) {
                redirectToDirectory(exchange);
                return;
            }
            Path index = file.resolve(INDEX_FILE);
            if (Files.isRegularFile(index)) {
                file = index;
            } else {
                listDirectory(exchange, file);
                return;
            }
        }

        if (!Files.isReadable(file)) {
            exchange.sendText(HttpExchange.HTTP_FORBIDDEN, "403 Forbidden\n");
            return;
        }
        serveFile(exchange, file);
    }

    /**
     * Maps a decoded request path onto the file system.
     *
     * @param requestPath The decoded URI path.
     * @return The file, or null if the path is invalid or leaves the root.
     */
    Path resolve(String requestPath) {
        if (requestPath.indexOf('\0') >= 0) {
            return null;
        }
        String relative = requestPath.replaceFirst("^/+", "");
        try {
            Path candidate = root.resolve(relative).normalize();
            return candidate.startsWith(root) ? candidate : null;
        } catch (InvalidPathException e) {
            log.debug("Invalid path {}: {}", requestPath, e.getMessage());
            return null;
        }
    }

    private void redirectToDirectory(HttpExchange exchange) throws IOException {
        String location = exchange.getUri().getRawPath() + "/";
        if (exchange.getUri().getRawQuery() != null) {
            location += "?" + exchange.getUri().getRawQuery();
        }
        exchange.sendEmpty(HttpExchange.HTTP_MOVED_PERMANENTLY,
                Map.of(HeaderConstants.LOCATION.getValue(), List.of(location)));
    }

    private void serveFile(HttpExchange exchange, Path file) throws IOException {
        Instant modified = Files.getLastModifiedTime(file).toInstant().truncatedTo(ChronoUnit.SECONDS);
        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put(HeaderConstants.LAST_MODIFIED.getValue(), List.of(formatDate(modified)));

        Instant since = parseDate(exchange.getHeader(HeaderConstants.IF_MODIFIED_SINCE.getValue()));
        if (since != null && !modified.isAfter(since)) {
            exchange.sendEmpty(HttpExchange.HTTP_NOT_MODIFIED, headers);
            return;
        }

        headers.put(HeaderConstants.CONTENT_TYPE.getValue(), List.of(contentType(file)));
        exchange.sendResponseHeaders(HttpExchange.HTTP_OK, headers, Files.size(file));
        try (InputStream in = Files.newInputStream(file)) {
            in.transferTo(exchange.getResponseBody());
        }
        exchange.flush();
    }

    private void listDirectory(HttpExchange exchange, Path dir) throws IOException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                names.add(Files.isDirectory(entry) ? name + "/" : name);
            }
        }
        names.sort(String::compareTo);

        StringBuilder html = new StringBuilder("<pre>\n");
        for (String name : names) {
            html.append("<a href=\"").append(escapeHtml(encodeHref(name))).append("\">")
                    .append(escapeHtml(name)).append("</a>\n");
        }
        html.append("</pre>\n");

        byte[] body = html.toString().getBytes(StandardCharsets.UTF_8);
        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put(HeaderConstants.CONTENT_TYPE.getValue(), List.of("text/html; charset=utf-8"));
        exchange.sendResponseHeaders(HttpExchange.HTTP_OK, headers, body.length);
        exchange.getResponseBody().write(body);
        exchange.flush();
    }

    private static String contentType(Path file) {
        String type = null;
        try {
            type = Files.probeContentType(file);
        } catch (IOException e) {
            log.debug("Content type lookup failed for {}: {}", file, e.getMessage());
        }
        if (type == null) {
            type = URLConnection.guessContentTypeFromName(file.getFileName().toString());
        }
        if (type == null) {
            return DEFAULT_CONTENT_TYPE;
        }
        if (type.startsWith("text/") && !type.contains("charset")) {
            type += "; charset=utf-8";
        }
        return type;
    }

    /**
     * Percent-encodes a listing entry so it is read as a single relative path
     * segment. A trailing slash marking a directory is kept.
     */
    static String encodeHref(String name) {
        boolean directory = name.endsWith("/");
        String segment = directory ? name.substring(0, name.length() - 1) : name;
        String encoded = URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
        return directory ? encoded + "/" : encoded;
    }

    private static String formatDate(Instant instant) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    private static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String escapeHtml(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append("&#34;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
