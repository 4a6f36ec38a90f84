package com.webfront.core.services;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import com.webfront.config.LoggingConfig;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one access log line per handled request to the {@code webfront.access}
 * logger, using a configurable Apache-style format.
 */
public class AccessLogService {

    /** Name of the logger access lines are written to. */
    public static final String ACCESS_LOGGER = "webfront.access";

    private static final Logger accessLog = LoggerFactory.getLogger(ACCESS_LOGGER);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z",
            Locale.ENGLISH);

    private final LoggingConfig config;

    /**
     * Cached formatted timestamp, refreshed at most once per second.
     */
    private volatile String cachedTimestamp = "";
    private volatile long cachedTimestampSec = 0;

    /**
     * @param config Access log settings.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public AccessLogService(LoggingConfig config) {
        this.config = config;
    }

    /**
     * Values available to the format placeholders.
     */
    record LogRecord(String remoteHost, String time, String requestLine, String status, String bytes,
            String method, String query, String virtualHost) {
    }

    /**
     * Logs a handled request.
     *
     * @param remoteHost  Client IP address.
     * @param method      HTTP method.
     * @param uri         Request target as sent by the client.
     * @param status      Response status, 0 if none was sent.
     * @param bytes       Response body bytes.
     * @param virtualHost Host the request was routed by.
     */
    public void logRequest(String remoteHost, String method, String uri, int status, long bytes,
            String virtualHost) {
        if (!config.isAccessLog() || !accessLog.isInfoEnabled()) {
            return;
        }
        String query = "";
        int queryIndex = uri.indexOf('?');
        if (queryIndex != -1) {
            query = uri.substring(queryIndex);
        }
        LogRecord logRecord = new LogRecord(remoteHost, "[" + getCachedTimestamp() + "]",
                method + " " + uri + " HTTP/1.1", String.valueOf(status),
                bytes > 0 ? String.valueOf(bytes) : "-", method, query,
                virtualHost != null && !virtualHost.isEmpty() ? virtualHost : "-");
        accessLog.info(format(config.getFormat(), logRecord));
    }

    /**
     * Formats a log line. Supported tokens: %h, %l, %u, %t, %r, %>s, %b, %m, %q,
     * %v. Unknown tokens are copied literally.
     *
     * @param format    The format string.
     * @param logRecord The request data.
     * @return The formatted log line.
     */
    String format(String format, LogRecord logRecord) {
        StringBuilder sb = new StringBuilder(format.length() + 100);
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                i = appendToken(sb, format, i, logRecord);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private int appendToken(StringBuilder sb, String format, int currentIdx, LogRecord logRecord) {
        char next = format.charAt(currentIdx + 1);
        int skip = 1;
        switch (next) {
            case 'h' -> sb.append(logRecord.remoteHost());
            case 'l', 'u' -> sb.append('-');
            case 't' -> sb.append(logRecord.time());
            case 'r' -> sb.append(logRecord.requestLine());
            case 'm' -> sb.append(logRecord.method());
            case 'q' -> sb.append(logRecord.query());
            case 'v' -> sb.append(logRecord.virtualHost());
            case '>' -> {
                if (currentIdx + 2 < format.length() && format.charAt(currentIdx + 2) == 's') {
                    sb.append(logRecord.status());
                    skip = 2;
                } else {
                    sb.append('%');
                    skip = 0;
                }
            }
            case 'b' -> sb.append(logRecord.bytes());
            default -> {
                sb.append('%');
                skip = 0;
            }
        }
        return currentIdx + skip + 1;
    }

    private String getCachedTimestamp() {
        long nowSec = Instant.now().getEpochSecond();
        if (nowSec != cachedTimestampSec) {
            cachedTimestampSec = nowSec;
            cachedTimestamp = ZonedDateTime.now().format(DATE_FORMATTER);
        }
        return cachedTimestamp;
    }
}
