package com.webfront.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root configuration object for webfront.
 * Maps to the top-level structure of the YAML configuration file.
 */
public class WebfrontProperties {
    /**
     * Path to the JSON rule file mapping hosts to targets.
     */
    private String rulesFile;

    /**
     * How often the rule file is checked for changes (e.g. 10s, 500ms, PT1M).
     */
    private String pollInterval = "10s";

    /**
     * Connect and request timeout used when forwarding to upstreams.
     */
    private String upstreamTimeout = "30s";

    /**
     * Listeners accepting client connections.
     */
    private List<ListenerConfig> listeners;

    /**
     * Access log configuration.
     */
    private LoggingConfig logging = new LoggingConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    /**
     * Directory against which relative keystore paths are resolved.
     */
    private String certificatesPath = "certificates";

    public String getRulesFile() {
        return rulesFile;
    }

    public void setRulesFile(String rulesFile) {
        this.rulesFile = rulesFile;
    }

    public String getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(String pollInterval) {
        this.pollInterval = pollInterval;
    }

    public String getUpstreamTimeout() {
        return upstreamTimeout;
    }

    public void setUpstreamTimeout(String upstreamTimeout) {
        this.upstreamTimeout = upstreamTimeout;
    }

    public List<ListenerConfig> getListeners() {
        return listeners == null ? null : Collections.unmodifiableList(listeners);
    }

    public void setListeners(List<ListenerConfig> listeners) {
        this.listeners = listeners == null ? null : new ArrayList<>(listeners);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public LoggingConfig getLogging() {
        return logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    public String getCertificatesPath() {
        return certificatesPath;
    }

    public void setCertificatesPath(String certificatesPath) {
        this.certificatesPath = certificatesPath;
    }
}
