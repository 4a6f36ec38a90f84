package com.webfront.core.utils;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import com.webfront.core.exceptions.ConfigException;

/**
 * Parses human-friendly durations such as {@code 10s}, {@code 500ms},
 * {@code 2m} or {@code 1h}. ISO-8601 strings ({@code PT10S}) are accepted too.
 */
public final class DurationUtils {

    private DurationUtils() {
        // Utility class
    }

    /**
     * Parses a duration string.
     *
     * @param value The duration text.
     * @return The parsed, strictly positive duration.
     * @throws ConfigException if the text is not a valid positive duration.
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Duration must not be empty");
        }
        String s = value.trim().toLowerCase(Locale.ROOT);
        Duration result;
        try {
            if (s.startsWith("p")) {
                result = Duration.parse(s.toUpperCase(Locale.ROOT));
            } else if (s.endsWith("ms")) {
                result = Duration.ofMillis(Long.parseLong(s.substring(0, s.length() - 2).trim()));
            } else if (s.endsWith("s")) {
                result = Duration.ofSeconds(Long.parseLong(s.substring(0, s.length() - 1).trim()));
            } else if (s.endsWith("m")) {
                result = Duration.ofMinutes(Long.parseLong(s.substring(0, s.length() - 1).trim()));
            } else if (s.endsWith("h")) {
                result = Duration.ofHours(Long.parseLong(s.substring(0, s.length() - 1).trim()));
            } else {
                // Bare numbers are milliseconds
                result = Duration.ofMillis(Long.parseLong(s));
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new ConfigException("Invalid duration: " + value, e);
        }
        if (result.isNegative() || result.isZero()) {
            throw new ConfigException("Duration must be positive: " + value);
        }
        return result;
    }
}
