package com.webfront.core.handler;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ForwardingHandlerTest {

    private static WireMockServer wireMock;
    private static HttpClient client;

    private ByteArrayOutputStream out;

    @BeforeAll
    static void startBackend() {
        wireMock = new WireMockServer(wireMockConfig().dynamicPort());
        wireMock.start();
        client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterAll
    static void stopBackend() {
        if (wireMock != null) {
            wireMock.stop();
        }
    }

    @BeforeEach
    void reset() {
        wireMock.resetAll();
        out = new ByteArrayOutputStream();
    }

    private ForwardingHandler handler() {
        return new ForwardingHandler("localhost:" + wireMock.port(), client, Duration.ofSeconds(5));
    }

    private String handle(ForwardingHandler handler, String method, String target, Map<String, String> headers,
            byte[] body) throws Exception {
        InputStream in = new ByteArrayInputStream(body);
        HttpExchange exchange = new HttpExchange(method, URI.create(target), "example.org", headers, "10.0.0.7",
                false, in, body.length, out);
        handler.handle(exchange);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static String body(String response) {
        return response.substring(response.indexOf("\r\n\r\n") + 4);
    }

    @Test
    void get_isForwardedWithPathQueryAndForwardingHeaders() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/api/items?id=7"))
                .willReturn(aResponse().withStatus(200).withHeader("X-Backend", "yes").withBody("items")));

        String response = handle(handler(), "GET", "/api/items?id=7",
                Map.of("Host", "example.org", "Accept", "text/plain", "Connection", "keep-alive"), new byte[0]);

        assertThat(response).startsWith("HTTP/1.1 200 OK").contains("X-Backend: yes");
        assertThat(body(response)).isEqualTo("items");
        wireMock.verify(getRequestedFor(urlEqualTo("/api/items?id=7"))
                .withHeader("Accept", equalTo("text/plain"))
                .withHeader("X-Forwarded-For", equalTo("10.0.0.7"))
                .withHeader("X-Forwarded-Proto", equalTo("http"))
                .withHeader("X-Forwarded-Host", equalTo("example.org")));
    }

    @Test
    void existingForwardedFor_isAppended() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/")).willReturn(aResponse().withStatus(204)));

        handle(handler(), "GET", "/", Map.of("X-Forwarded-For", "192.168.1.1"), new byte[0]);

        wireMock.verify(getRequestedFor(urlEqualTo("/"))
                .withHeader("X-Forwarded-For", equalTo("192.168.1.1, 10.0.0.7")));
    }

    @Test
    void postBody_isForwarded() throws Exception {
        wireMock.stubFor(post(urlEqualTo("/submit")).willReturn(aResponse().withStatus(201).withBody("created")));

        String response = handle(handler(), "POST", "/submit", Map.of("Content-Type", "application/json"),
                "{\"a\":1}".getBytes(StandardCharsets.UTF_8));

        assertThat(response).startsWith("HTTP/1.1 201 Created");
        wireMock.verify(postRequestedFor(urlEqualTo("/submit"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withRequestBody(equalTo("{\"a\":1}")));
    }

    @Test
    void largePostBody_isStreamed() throws Exception {
        wireMock.stubFor(post(urlEqualTo("/upload")).willReturn(aResponse().withStatus(200)));
        byte[] payload = new byte[200 * 1024];
        Arrays.fill(payload, (byte) 'x');

        String response = handle(handler(), "POST", "/upload", Map.of(), payload);

        assertThat(response).startsWith("HTTP/1.1 200");
        wireMock.verify(postRequestedFor(urlEqualTo("/upload"))
                .withHeader("Content-Length", equalTo(String.valueOf(payload.length))));
    }

    @Test
    void upstreamRedirect_isRelayedUnchanged() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/old"))
                .willReturn(aResponse().withStatus(302).withHeader("Location", "/new")));

        String response = handle(handler(), "GET", "/old", Map.of(), new byte[0]);

        assertThat(response).startsWith("HTTP/1.1 302").contains("Location: /new");
    }

    @Test
    void hopByHopHeaders_areNotForwarded() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/")).willReturn(aResponse().withStatus(200)));

        handle(handler(), "GET", "/", Map.of("Proxy-Authorization", "Basic eDp5", "TE", "trailers"),
                new byte[0]);

        wireMock.verify(getRequestedFor(urlEqualTo("/"))
                .withHeader("Proxy-Authorization", absent()));
    }

    @Test
    void headersNamedInConnection_areNotForwarded() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/")).willReturn(aResponse().withStatus(200)));

        handle(handler(), "GET", "/", Map.of("Connection", "keep-alive, X-Trace", "X-Trace", "abc",
                "X-Keep", "1"), new byte[0]);

        wireMock.verify(getRequestedFor(urlEqualTo("/"))
                .withHeader("X-Trace", absent())
                .withHeader("X-Keep", equalTo("1")));
    }

    @Test
    void responseHeadersNamedInConnection_areNotRelayed() throws Exception {
        try (ServerSocket upstream = new ServerSocket(0)) {
            CompletableFuture<Void> served = CompletableFuture.runAsync(() -> {
                try (Socket s = upstream.accept()) {
                    BufferedReader in = new BufferedReader(
                            new InputStreamReader(s.getInputStream(), StandardCharsets.ISO_8859_1));
                    String line;
                    while ((line = in.readLine()) != null && !line.isEmpty()) {
                        // Request head is discarded
                    }
                    OutputStream os = s.getOutputStream();
                    os.write(("HTTP/1.1 200 OK\r\n"
                            + "Connection: X-Internal\r\n"
                            + "X-Internal: secret\r\n"
                            + "X-Public: ok\r\n"
                            + "Content-Length: 2\r\n\r\nok").getBytes(StandardCharsets.ISO_8859_1));
                    os.flush();
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
            ForwardingHandler raw = new ForwardingHandler("127.0.0.1:" + upstream.getLocalPort(), client,
                    Duration.ofSeconds(5));

            String response = handle(raw, "GET", "/", Map.of(), new byte[0]);
            served.get(5, TimeUnit.SECONDS);

            assertThat(response).startsWith("HTTP/1.1 200 OK")
                    .containsIgnoringCase("X-Public: ok")
                    .doesNotContainIgnoringCase("X-Internal");
            assertThat(body(response)).isEqualTo("ok");
        }
    }

    @Test
    void connectionTokens_areSplitTrimmedAndCaseInsensitive() {
        Set<String> tokens = ForwardingHandler.connectionTokens(List.of("close, X-A", " x-b ,,"));

        assertThat(tokens).hasSize(3);
        assertThat(tokens.contains("x-a")).isTrue();
        assertThat(tokens.contains("X-B")).isTrue();
        assertThat(tokens.contains("CLOSE")).isTrue();
        assertThat(ForwardingHandler.connectionTokens(List.of(""))).isEmpty();
    }

    @Test
    void unreachableUpstream_is502() throws Exception {
        int deadPort;
        try (ServerSocket s = new ServerSocket(0)) {
            deadPort = s.getLocalPort();
        }
        ForwardingHandler dead = new ForwardingHandler("127.0.0.1:" + deadPort, client, Duration.ofSeconds(2));

        String response = handle(dead, "GET", "/", Map.of(), new byte[0]);

        assertThat(response).startsWith("HTTP/1.1 502 Bad Gateway").contains("Connection: close");
    }

    @Test
    void targetUri_keepsRawPathAndQuery() {
        ForwardingHandler handler = new ForwardingHandler("backend:8080", client, null);

        assertThat(handler.targetUri(URI.create("/a%20b/c?q=1&r=%2F")))
                .hasToString("http://backend:8080/a%20b/c?q=1&r=%2F");
        assertThat(handler.targetUri(URI.create("http://example.org")))
                .hasToString("http://backend:8080/");
    }

    @Test
    void invalidUpstream_isRejected() {
        assertThatThrownBy(() -> new ForwardingHandler("bad host:1", client, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ForwardingHandler("host:1/path", client, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
