package com.webfront;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import com.webfront.config.ListenerConfig;
import com.webfront.config.WebfrontProperties;
import com.webfront.core.exceptions.ConfigException;
import com.webfront.core.exceptions.WebfrontException;
import com.webfront.core.routing.HandlerResolver;
import com.webfront.core.routing.HostAuthorizer;
import com.webfront.core.routing.HostRouter;
import com.webfront.core.routing.RuleFileParser;
import com.webfront.core.routing.RuleLoader;
import com.webfront.core.routing.RuleRefresher;
import com.webfront.core.server.FrontServerFactory;
import com.webfront.core.server.ServerManager;
import com.webfront.core.services.AccessLogService;
import com.webfront.core.services.MetricsService;
import com.webfront.core.utils.DurationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main entry point for webfront.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "webfront", mixinStandardHelpOptions = true, version = "1.0.0",
        description = "Host-based HTTP front end: forwards to upstreams or serves static files per host.")
public class WebfrontApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WebfrontApplication.class);

    private static final String DEFAULT_HTTP_ADDRESS = ":80";

    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)")
    private String configPath;

    @Option(names = "--rules", description = "Rule definition file (JSON)")
    private String rulesFile;

    @Option(names = "--poll", description = "Rule file poll interval, e.g. 10s")
    private String pollInterval;

    @Option(names = "--http", description = "HTTP listen address, [host]:port (default: " + DEFAULT_HTTP_ADDRESS + ")")
    private String httpAddress;

    @Option(names = "--https", description = "HTTPS listen address, [host]:port")
    private String httpsAddress;

    @Option(names = "--keystore", description = "PKCS12 keystore for the HTTPS listener")
    private String keystore;

    @Option(names = "--keystore-password", description = "Keystore password")
    private String keystorePassword;

    @Option(names = "--sni-host-check", description = "Refuse TLS handshakes for hosts not in the rule table")
    private boolean sniHostCheck;

    private MetricsService metricsService;
    private RuleRefresher refresher;
    private ServerManager serverManager;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private final AtomicBoolean running = new AtomicBoolean(true);

    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     *
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(new CommandLine(new WebfrontApplication()).execute(args));
    }

    /**
     * Loads the rules, starts the listeners and blocks until {@link #stop()}.
     *
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting webfront...");

            WebfrontProperties props = loadProperties();
            if (props.getRulesFile() == null || props.getRulesFile().isBlank()) {
                throw new ConfigException("No rule file configured (use --rules or rulesFile)");
            }
            Duration poll = DurationUtils.parse(props.getPollInterval());
            Duration upstreamTimeout = DurationUtils.parse(props.getUpstreamTimeout());

            this.metricsService = new MetricsService(props);

            RuleLoader loader = new RuleLoader(Paths.get(props.getRulesFile()), new RuleFileParser(),
                    HandlerResolver.withDefaultClient(upstreamTimeout));
            this.refresher = new RuleRefresher(loader, poll, metricsService.getRegistry());
            refresher.start();

            FrontServerFactory factory = new FrontServerFactory(new HostRouter(refresher),
                    new HostAuthorizer(refresher), new AccessLogService(props.getLogging()),
                    metricsService.getRegistry(), props);
            this.serverManager = new ServerManager(props.getListeners(), factory);
            serverManager.startServers();

            if (System.getProperty("webfront.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (WebfrontException e) {
            log.error("Fatal error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Stops the listeners, the rule refresher and the admin server. Safe to call
     * more than once.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down webfront...");

            unregisterShutdownHook();

            if (serverManager != null) {
                serverManager.stopAll();
            }
            if (refresher != null) {
                refresher.close();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            shutdownLatch.countDown();
        }
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ignored) {
                // Expected if stop() is called from the hook itself
            }
        }
    }

    /**
     * Builds the effective configuration: the YAML file, if given, overridden by
     * command-line options.
     *
     * @return The merged properties.
     * @throws ConfigException if the file or an option is invalid.
     */
    WebfrontProperties loadProperties() {
        WebfrontProperties props = configPath != null ? loadConfig(configPath) : new WebfrontProperties();

        if (rulesFile != null) {
            props.setRulesFile(rulesFile);
        }
        if (pollInterval != null) {
            props.setPollInterval(pollInterval);
        }

        if (httpAddress != null || httpsAddress != null) {
            List<ListenerConfig> listeners = new ArrayList<>();
            if (httpAddress != null) {
                listeners.add(parseListenAddress("http", httpAddress));
            }
            if (httpsAddress != null) {
                ListenerConfig https = parseListenAddress("https", httpsAddress);
                https.setTlsEnabled(true);
                listeners.add(https);
            }
            props.setListeners(listeners);
        } else if (props.getListeners() == null || props.getListeners().isEmpty()) {
            props.setListeners(List.of(parseListenAddress("http", DEFAULT_HTTP_ADDRESS)));
        }

        for (ListenerConfig listener : props.getListeners()) {
            if (!listener.isTlsEnabled()) {
                continue;
            }
            if (keystore != null) {
                // Command-line paths are relative to the working directory, not certificatesPath
                listener.setKeystorePath(Paths.get(keystore).toAbsolutePath().normalize().toString());
            }
            if (keystorePassword != null) {
                listener.setKeystorePassword(keystorePassword);
            }
            if (sniHostCheck) {
                listener.setSniHostCheck(true);
            }
        }
        return props;
    }

    /**
     * Parses a listen address of the form {@code [host]:port}.
     *
     * @param name    Listener name.
     * @param address The address, e.g. {@code :80} or {@code 127.0.0.1:8080}.
     * @return A listener configuration.
     * @throws ConfigException if the address is malformed.
     */
    static ListenerConfig parseListenAddress(String name, String address) {
        int colon = address.lastIndexOf(':');
        if (colon < 0) {
            throw new ConfigException("Invalid listen address '" + address + "', expected [host]:port");
        }
        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid port in listen address '" + address + "'");
        }
        if (port < 0 || port > 65535) {
            throw new ConfigException("Port out of range in listen address '" + address + "'");
        }

        ListenerConfig config = new ListenerConfig();
        config.setName(name);
        config.setPort(port);
        config.setBindAddress(host.isEmpty() ? null : host);
        return config;
    }

    /**
     * Loads the configuration from the specified path or classpath.
     *
     * @param path Path to the configuration file.
     * @return Loaded properties.
     * @throws ConfigException if configuration cannot be loaded.
     */
    private WebfrontProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(WebfrontProperties.class, new LoaderOptions()));

        WebfrontProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        WebfrontProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private WebfrontProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orDefaults(yaml.load(is));
            } catch (YAMLException | ClassCastException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage(), e);
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private WebfrontProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    /**
     * An empty YAML document yields null.
     */
    private static WebfrontProperties orDefaults(WebfrontProperties loaded) {
        return loaded != null ? loaded : new WebfrontProperties();
    }
}
