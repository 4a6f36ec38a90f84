package com.webfront.core.exceptions;

/**
 * Thrown when the application configuration or the rule file cannot be used.
 */
public class ConfigException extends WebfrontException {
    /**
     * Constructs a new ConfigException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public ConfigException(String message) {
        super(message);
    }

    /**
     * Constructs a new ConfigException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
