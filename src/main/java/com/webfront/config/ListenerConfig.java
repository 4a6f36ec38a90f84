package com.webfront.config;

import java.util.Objects;

/**
 * Configuration for one listening socket of the front server.
 */
public class ListenerConfig {
    /** Name used in logs and metric tags. */
    private String name;

    /** Port to listen on. */
    private int port;

    /** Local IP address to bind to. Null means all interfaces. */
    private String bindAddress;

    /** Whether to terminate TLS on this listener. */
    private boolean tlsEnabled = false;

    /** Path to the PKCS12 keystore file. */
    private String keystorePath;

    /** Password for the keystore. */
    private String keystorePassword;

    /** Refuse TLS handshakes whose server name is not covered by the rule table. */
    private boolean sniHostCheck = false;

    /** Whether to keep client connections open between requests. */
    private boolean keepAlive = true;

    /** Client socket read timeout in milliseconds. Default is 60s. */
    private int timeout = 60000;

    /** Maximum concurrent connections. Default is 10,000. */
    private int maxConnections = 10000;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    public boolean isTlsEnabled() {
        return tlsEnabled;
    }

    public void setTlsEnabled(boolean tlsEnabled) {
        this.tlsEnabled = tlsEnabled;
    }

    public String getKeystorePath() {
        return keystorePath;
    }

    public void setKeystorePath(String keystorePath) {
        this.keystorePath = keystorePath;
    }

    public String getKeystorePassword() {
        return keystorePassword;
    }

    public void setKeystorePassword(String keystorePassword) {
        this.keystorePassword = keystorePassword;
    }

    public boolean isSniHostCheck() {
        return sniHostCheck;
    }

    public void setSniHostCheck(boolean sniHostCheck) {
        this.sniHostCheck = sniHostCheck;
    }

    public boolean isKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(boolean keepAlive) {
        this.keepAlive = keepAlive;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ListenerConfig that = (ListenerConfig) o;
        return port == that.port &&
               tlsEnabled == that.tlsEnabled &&
               sniHostCheck == that.sniHostCheck &&
               keepAlive == that.keepAlive &&
               timeout == that.timeout &&
               maxConnections == that.maxConnections &&
               Objects.equals(name, that.name) &&
               Objects.equals(bindAddress, that.bindAddress) &&
               Objects.equals(keystorePath, that.keystorePath) &&
               Objects.equals(keystorePassword, that.keystorePassword);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, port, bindAddress, tlsEnabled, keystorePath, keystorePassword, sniHostCheck,
                keepAlive, timeout, maxConnections);
    }
}
