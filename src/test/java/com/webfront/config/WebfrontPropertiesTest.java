package com.webfront.config;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import static org.assertj.core.api.Assertions.assertThat;

class WebfrontPropertiesTest {

    @Test
    void defaults() {
        WebfrontProperties props = new WebfrontProperties();

        assertThat(props.getRulesFile()).isNull();
        assertThat(props.getPollInterval()).isEqualTo("10s");
        assertThat(props.getUpstreamTimeout()).isEqualTo("30s");
        assertThat(props.getListeners()).isNull();
        assertThat(props.getLogging().isAccessLog()).isTrue();
        assertThat(props.getAdmin().isEnabled()).isFalse();
        assertThat(props.getAdmin().getBindAddress()).isEqualTo("127.0.0.1");

        ListenerConfig listener = new ListenerConfig();
        assertThat(listener.isKeepAlive()).isTrue();
        assertThat(listener.isTlsEnabled()).isFalse();
        assertThat(listener.isSniHostCheck()).isFalse();
        assertThat(listener.getTimeout()).isEqualTo(60000);
        assertThat(listener.getMaxConnections()).isEqualTo(10000);
    }

    @Test
    void bindsYamlDocument() {
        String yaml = "rulesFile: /etc/webfront/rules.json\n"
                + "pollInterval: 5s\n"
                + "upstreamTimeout: 2s\n"
                + "certificatesPath: /etc/webfront/certs\n"
                + "listeners:\n"
                + "  - name: public\n"
                + "    port: 443\n"
                + "    bindAddress: 0.0.0.0\n"
                + "    tlsEnabled: true\n"
                + "    keystorePath: site.p12\n"
                + "    keystorePassword: changeit\n"
                + "    sniHostCheck: true\n"
                + "    keepAlive: false\n"
                + "    timeout: 1500\n"
                + "    maxConnections: 64\n"
                + "logging:\n"
                + "  accessLog: false\n"
                + "  format: '%h %v'\n"
                + "admin:\n"
                + "  enabled: true\n"
                + "  port: 9191\n";

        WebfrontProperties props = new Yaml(new Constructor(WebfrontProperties.class, new LoaderOptions()))
                .load(yaml);

        assertThat(props.getRulesFile()).isEqualTo("/etc/webfront/rules.json");
        assertThat(props.getPollInterval()).isEqualTo("5s");
        assertThat(props.getUpstreamTimeout()).isEqualTo("2s");
        assertThat(props.getCertificatesPath()).isEqualTo("/etc/webfront/certs");
        assertThat(props.getLogging().isAccessLog()).isFalse();
        assertThat(props.getLogging().getFormat()).isEqualTo("%h %v");
        assertThat(props.getAdmin().isEnabled()).isTrue();
        assertThat(props.getAdmin().getPort()).isEqualTo(9191);

        List<ListenerConfig> listeners = props.getListeners();
        assertThat(listeners).hasSize(1);
        ListenerConfig listener = listeners.get(0);
        assertThat(listener.getName()).isEqualTo("public");
        assertThat(listener.getPort()).isEqualTo(443);
        assertThat(listener.getBindAddress()).isEqualTo("0.0.0.0");
        assertThat(listener.isTlsEnabled()).isTrue();
        assertThat(listener.getKeystorePath()).isEqualTo("site.p12");
        assertThat(listener.getKeystorePassword()).isEqualTo("changeit");
        assertThat(listener.isSniHostCheck()).isTrue();
        assertThat(listener.isKeepAlive()).isFalse();
        assertThat(listener.getTimeout()).isEqualTo(1500);
        assertThat(listener.getMaxConnections()).isEqualTo(64);
    }

    @Test
    void listenersAreCopiedOnSet() {
        ListenerConfig a = new ListenerConfig();
        a.setName("a");
        ArrayList<ListenerConfig> source = new ArrayList<>(List.of(a));
        WebfrontProperties props = new WebfrontProperties();

        props.setListeners(source);
        source.clear();

        assertThat(props.getListeners()).containsExactly(a);
    }
}
