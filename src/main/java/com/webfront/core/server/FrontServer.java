package com.webfront.core.server;

import com.webfront.config.ListenerConfig;

/**
 * A listening socket that accepts client connections and routes their requests.
 */
public interface FrontServer {
    /**
     * Binds the listener and runs the accept loop until {@link #stop()}.
     */
    void start();

    /**
     * Stops accepting and closes all client connections.
     */
    void stop();

    /**
     * @return The listener configuration of this server.
     */
    ListenerConfig getConfig();
}
