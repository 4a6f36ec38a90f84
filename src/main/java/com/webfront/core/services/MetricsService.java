package com.webfront.core.services;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.sun.net.httpserver.HttpServer;
import com.webfront.config.AdminConfig;
import com.webfront.config.WebfrontProperties;
import com.webfront.core.utils.ThreadUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service providing application metrics via Micrometer and a simple HTTP admin
 * server.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private final AdminConfig config;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;

    public MetricsService(WebfrontProperties properties) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = properties.getAdmin();
        setupAdminServer();
    }

    private void setupAdminServer() {
        if (!config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            adminServer.createContext("/health", exchange -> {
                byte[] response = "OK".getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(200, response.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(response);
                }
            });

            // Prometheus text format
            adminServer.createContext("/metrics", exchange -> {
                byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            });

            this.adminExecutor = Executors.newFixedThreadPool(2, ThreadUtils.daemonFactory("admin"));
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics)", getAdminPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
            adminServer = null;
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * @return The port the admin server listens on, or -1 if it is not running.
     */
    public int getAdminPort() {
        return adminServer != null ? adminServer.getAddress().getPort() : -1;
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
        registry.close();
    }
}
