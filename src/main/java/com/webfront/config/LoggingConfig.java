package com.webfront.config;

/**
 * Configuration for the access log.
 */
public class LoggingConfig {
    /** Whether every handled request is written to the access log. */
    private boolean accessLog = true;

    /**
     * Access log format (Apache-style placeholders: %h, %l, %u, %t, %r, %>s, %b,
     * %m, %q, %v).
     */
    private String format = "%h %l %u %t \"%r\" %>s %b %v";

    public boolean isAccessLog() {
        return accessLog;
    }

    public void setAccessLog(boolean accessLog) {
        this.accessLog = accessLog;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }
}
