package com.webfront.core.server;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.webfront.config.ListenerConfig;
import com.webfront.core.exceptions.WebfrontException;
import com.webfront.core.utils.ThreadUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts and stops the configured listeners.
 */
public class ServerManager {

    private static final Logger log = LoggerFactory.getLogger(ServerManager.class);

    private final List<ListenerConfig> listeners;
    private final FrontServerFactory factory;
    private final Map<String, FrontServer> activeServers = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newCachedThreadPool(ThreadUtils.daemonFactory("listener"));

    /**
     * @param listeners Listener configurations to start.
     * @param factory   Factory to create server instances.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ServerManager(List<ListenerConfig> listeners, FrontServerFactory factory) {
        this.listeners = List.copyOf(listeners);
        this.factory = factory;
    }

    /**
     * Starts every listener and waits for each to bind.
     *
     * @throws WebfrontException if a listener cannot bind; listeners already
     *                           started are stopped again.
     */
    public synchronized void startServers() {
        for (ListenerConfig config : listeners) {
            try {
                startServer(config);
            } catch (WebfrontException e) {
                stopAll();
                throw e;
            }
        }
    }

    private void startServer(ListenerConfig config) {
        FrontServer server = factory.create(config);
        String key = keyOf(config);
        executor.submit(server::start);
        // A listener counts as running only once its socket is bound
        if (server instanceof AbstractFrontServer abs && abs.awaitBind(2, TimeUnit.SECONDS)) {
            activeServers.put(key, server);
            log.info("Started listener {} on port {}", key, abs.getLocalPort());
        } else {
            server.stop();
            throw new WebfrontException("Listener " + key + " failed to bind on port " + config.getPort());
        }
    }

    /**
     * @param name Listener name (or port, for unnamed listeners).
     * @return The running server, if any.
     */
    public Optional<FrontServer> getServer(String name) {
        return Optional.ofNullable(activeServers.get(name));
    }

    private void stopServer(String key) {
        FrontServer server = activeServers.remove(key);
        if (server != null) {
            log.info("Stopping listener {}...", key);
            try {
                server.stop();
            } catch (Exception e) {
                log.error("Error stopping listener {}: {}", key, e.getMessage());
            }
        }
    }

    /**
     * Stops all running listeners and shuts down the internal executor.
     */
    public synchronized void stopAll() {
        log.info("Stopping all listeners...");
        for (String key : new ArrayList<>(activeServers.keySet())) {
            stopServer(key);
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("ServerManager executor did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String keyOf(ListenerConfig config) {
        return config.getName() != null ? config.getName() : String.valueOf(config.getPort());
    }
}
