package com.webfront.core.services;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import com.webfront.config.WebfrontProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    private MetricsService metricsService;

    @AfterEach
    void tearDown() {
        if (metricsService != null) {
            metricsService.shutdown();
        }
    }

    private MetricsService startAdmin() {
        WebfrontProperties props = new WebfrontProperties();
        props.getAdmin().setEnabled(true);
        props.getAdmin().setPort(0);
        metricsService = new MetricsService(props);
        return metricsService;
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpClient client = HttpClient.newHttpClient();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + metricsService.getAdminPort() + path))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health_returnsOk() throws Exception {
        startAdmin();

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("OK");
    }

    @Test
    void metrics_returnsPrometheusData() throws Exception {
        startAdmin().getRegistry().counter("webfront.test").increment();

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("webfront_test_total 1.0");
    }

    @Test
    void adminDisabledByDefault() {
        metricsService = new MetricsService(new WebfrontProperties());

        assertThat(metricsService.getAdminPort()).isEqualTo(-1);
        assertThat(metricsService.getRegistry()).isNotNull();
    }
}
