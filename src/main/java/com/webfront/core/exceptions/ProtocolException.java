package com.webfront.core.exceptions;

/**
 * Thrown when an inbound HTTP request cannot be parsed or framed.
 */
public class ProtocolException extends WebfrontException {

    /** Status code the connection should be answered with before closing. */
    private final int status;

    /**
     * Constructs a new ProtocolException answered with {@code 400 Bad Request}.
     * 
     * @param message the detail message.
     */
    public ProtocolException(String message) {
        this(400, message);
    }

    /**
     * Constructs a new ProtocolException with an explicit response status.
     * 
     * @param status  the HTTP status to answer with.
     * @param message the detail message.
     */
    public ProtocolException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
