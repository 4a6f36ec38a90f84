package com.webfront.core.constants;

/**
 * Common HTTP header names used by the front server and its handlers.
 */
public enum HeaderConstants {
    /** The Standard HTTP Host header. */
    HOST("Host"),
    /** Hop-by-hop Connection header. */
    CONNECTION("Connection"),
    /** Length of the entity body in bytes. */
    CONTENT_LENGTH("Content-Length"),
    /** Media type of the entity body. */
    CONTENT_TYPE("Content-Type"),
    /** Type of encoding used to transfer the entity. */
    TRANSFER_ENCODING("Transfer-Encoding"),
    /** Specifies the persistent connection parameters. */
    KEEP_ALIVE("Keep-Alive"),
    /** Header used for authentication challenges from proxy to client. */
    PROXY_AUTHENTICATE("Proxy-Authenticate"),
    /** Header used for credentials from client to proxy. */
    PROXY_AUTHORIZATION("Proxy-Authorization"),
    /** Specifies the transfer encodings the client is willing to accept. */
    TE("TE"),
    /** Specifies that a set of header fields is present in the trailer. */
    TRAILERS("Trailers"),
    /** Used by the client to request a protocol change. */
    UPGRADE("Upgrade"),
    /** Expectation header; restricted by the JDK HTTP client. */
    EXPECT("Expect"),
    /** Redirect target. */
    LOCATION("Location"),
    /** Methods supported by a resource. */
    ALLOW("Allow"),
    /** Modification time of a served file. */
    LAST_MODIFIED("Last-Modified"),
    /** Conditional request header for cached files. */
    IF_MODIFIED_SINCE("If-Modified-Since"),
    /** Client addresses seen by the front end. */
    X_FORWARDED_FOR("X-Forwarded-For"),
    /** Scheme the client used to reach the front end. */
    X_FORWARDED_PROTO("X-Forwarded-Proto"),
    /** Host the client asked for. */
    X_FORWARDED_HOST("X-Forwarded-Host");

    private final String value;

    HeaderConstants(String value) {
        this.value = value;
    }

    /**
     * Retrieves the standard string value of the header.
     * 
     * @return The standard string value of the header.
     */
    public String getValue() {
        return value;
    }
}
