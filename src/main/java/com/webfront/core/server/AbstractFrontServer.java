package com.webfront.core.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLServerSocket;
import javax.net.ssl.SSLServerSocketFactory;

import com.webfront.config.ListenerConfig;
import com.webfront.config.WebfrontProperties;
import com.webfront.core.routing.HostAuthorizer;
import com.webfront.core.services.AccessLogService;
import com.webfront.core.utils.IoUtils;
import com.webfront.core.utils.SslUtils;
import com.webfront.core.utils.ThreadUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for listeners. Handles the socket lifecycle, TLS setup, the
 * connection limit and the worker pool; subclasses speak the protocol.
 */
public abstract class AbstractFrontServer implements FrontServer {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    /** Configuration for this listener. */
    protected final ListenerConfig config;

    /** Global properties. */
    protected final WebfrontProperties globalProps;

    /** Policy for the TLS server name check. */
    protected final HostAuthorizer authorizer;

    /** Access log writer. */
    protected final AccessLogService accessLog;

    /** Micrometer registry for metrics. */
    protected final MeterRegistry registry;

    /** One worker thread per client connection. */
    protected final ExecutorService executor;

    /** Enforces the maximum number of concurrent connections. */
    protected final Semaphore connectionSemaphore;

    /** Active client sockets, closed on shutdown. */
    protected final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();

    /** The socket accepting client connections. */
    protected volatile ServerSocket serverSocket;

    /** Tag value identifying this listener in metrics. */
    protected final String metricName;

    private final Counter totalConnections;
    private final Counter connectionErrors;
    private final Meter activeGauge;

    /**
     * Released once binding has completed, successfully or not.
     */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    private volatile boolean bindSuccess = false;

    /**
     * @param config      The listener configuration.
     * @param globalProps The global configuration.
     * @param authorizer  Host policy used for the TLS server name check.
     * @param accessLog   The access log writer.
     * @param registry    The Micrometer meter registry.
     */
    protected AbstractFrontServer(ListenerConfig config, WebfrontProperties globalProps,
            HostAuthorizer authorizer, AccessLogService accessLog, MeterRegistry registry) {
        this.config = config;
        this.globalProps = globalProps;
        this.authorizer = authorizer;
        this.accessLog = accessLog;
        this.registry = registry;

        String configName = config.getName() != null ? config.getName() : String.valueOf(config.getPort());
        this.metricName = configName.replace(" ", "_").toLowerCase(Locale.ROOT);
        this.executor = Executors.newCachedThreadPool(ThreadUtils.daemonFactory("webfront-" + metricName));
        this.connectionSemaphore = new Semaphore(config.getMaxConnections());

        String tls = String.valueOf(config.isTlsEnabled());
        this.totalConnections = Counter.builder("webfront.connections.total")
                .tag("name", metricName)
                .tag("tls", tls)
                .description("Total number of accepted connections")
                .register(registry);

        this.connectionErrors = Counter.builder("webfront.connections.errors")
                .tag("name", metricName)
                .tag("tls", tls)
                .description("Total number of connection errors")
                .register(registry);

        this.activeGauge = Gauge.builder("webfront.connections.active", activeSockets, Set::size)
                .tag("name", metricName)
                .tag("tls", tls)
                .description("Current number of active connections")
                .register(registry);
    }

    /**
     * Binds to the configured address and enters the accept loop.
     */
    @Override
    public void start() {
        try {
            if (!initializeServerSocket()) {
                return;
            }

            serverSocket.setReuseAddress(true);
            InetSocketAddress bindAddr = config.getBindAddress() != null && !config.getBindAddress().isEmpty()
                    ? new InetSocketAddress(config.getBindAddress(), config.getPort())
                    : new InetSocketAddress(config.getPort());
            serverSocket.bind(bindAddr);
            bindSuccess = true;
            bindLatch.countDown();
            log.info("{} listener started on {}:{}", getServerName(),
                    config.getBindAddress() != null ? config.getBindAddress() : "0.0.0.0", getLocalPort());

            while (!serverSocket.isClosed()) {
                if (!acceptAndProcessNextClient()) {
                    break;
                }
            }
        } catch (IOException e) {
            bindLatch.countDown();
            connectionErrors.increment();
            log.error("{} listener error on port {}: {}", getServerName(), config.getPort(), e.getMessage(), e);
        }
    }

    /**
     * @return {@code true} to continue the accept loop.
     */
    private boolean acceptAndProcessNextClient() {
        try {
            Socket client = serverSocket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (serverSocket.isClosed()) {
                return false;
            }
            connectionErrors.increment();
            log.error("{} accept error on port {}: {}", getServerName(), config.getPort(), e.getMessage());
            return true;
        } catch (IOException e) {
            connectionErrors.increment();
            log.error("{} I/O error during accept on port {}: {}", getServerName(), config.getPort(),
                    e.getMessage());
            return true;
        }
    }

    /**
     * Creates the server socket, with TLS and the server name check if enabled.
     *
     * @return {@code false} if TLS initialization failed.
     * @throws IOException If a plain ServerSocket cannot be created.
     */
    private boolean initializeServerSocket() throws IOException {
        if (config.isTlsEnabled()) {
            try {
                SSLServerSocketFactory ssf = SslUtils.createSslFactory(config, globalProps);
                SSLServerSocket sslSocket = (SSLServerSocket) ssf.createServerSocket();
                if (config.isSniHostCheck()) {
                    SSLParameters params = sslSocket.getSSLParameters();
                    params.setSNIMatchers(List.of(new AuthorizedHostSniMatcher(authorizer)));
                    sslSocket.setSSLParameters(params);
                }
                serverSocket = sslSocket;
            } catch (Exception e) {
                log.error("{} failed to initialize TLS: {}", getServerName(), e.getMessage(), e);
                bindLatch.countDown();
                return false;
            }
        } else {
            serverSocket = new ServerSocket();
        }
        return true;
    }

    /**
     * Waits for the listener to finish binding.
     *
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return {@code true} if the bind succeeded within the timeout.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return The bound port, useful when the configured port is 0; -1 if not
     *         bound.
     */
    public int getLocalPort() {
        ServerSocket s = serverSocket;
        return s != null ? s.getLocalPort() : -1;
    }

    private void processClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();

        totalConnections.increment();
        try {
            client.setTcpNoDelay(true);
            client.setSoTimeout(config.getTimeout() > 0 ? config.getTimeout() : 60000);
        } catch (SocketException e) {
            log.debug("{} failed to configure client socket: {}", getServerName(), e.getMessage());
        }

        if (connectionSemaphore.tryAcquire()) {
            activeSockets.add(client);
            executor.submit(() -> {
                try {
                    handleClient(client);
                } catch (Exception e) {
                    connectionErrors.increment();
                    log.error("{} unexpected error handling client {}: {}", getServerName(), remoteAddr,
                            e.getMessage(), e);
                } finally {
                    activeSockets.remove(client);
                    connectionSemaphore.release();
                    IoUtils.closeQuietly(client, "client socket");
                }
            });
        } else {
            log.warn("{} connection limit reached ({})", getServerName(), config.getMaxConnections());
            IoUtils.closeQuietly(client, "limit reached client socket");
        }
    }

    /**
     * Closes the server socket and all active client connections.
     */
    @Override
    public void stop() {
        log.info("Stopping {} listener on port {}...", getServerName(), getLocalPort());
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("{} failed to close server socket: {}", getServerName(), e.getMessage(), e);
        }

        for (Socket s : activeSockets) {
            IoUtils.closeQuietly(s);
        }
        activeSockets.clear();

        registry.remove(totalConnections);
        registry.remove(connectionErrors);
        registry.remove(activeGauge);

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} executor did not terminate cleanly after 5 s", getServerName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ListenerConfig getConfig() {
        return config;
    }

    /**
     * Counts a failed client connection.
     */
    protected void recordConnectionError() {
        connectionErrors.increment();
    }

    /**
     * @return Protocol name used in log messages (e.g. "HTTP", "HTTPS").
     */
    protected abstract String getServerName();

    /**
     * Serves one client connection. Runs on a worker thread; the socket is closed
     * by the caller afterwards.
     *
     * @param client The accepted client socket.
     */
    protected abstract void handleClient(Socket client);
}
