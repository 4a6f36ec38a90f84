package com.webfront.core.handler;

import java.io.IOException;

/**
 * Executable target of a routing rule. The variant is chosen once, when the
 * rule table is loaded, and never changes for the lifetime of that table.
 */
public sealed interface RequestHandler permits ForwardingHandler, StaticFileHandler {

    /**
     * Answers the request. Runs on the connection's worker thread and may block
     * on network or disk I/O.
     *
     * @param exchange The request to answer.
     * @throws IOException If writing to the client fails.
     */
    void handle(HttpExchange exchange) throws IOException;

    /**
     * @return A short description of the target for logs.
     */
    String describe();
}
