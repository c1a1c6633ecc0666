package com.baselinesentinel.runner;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HealthServer} over real HTTP.
 */
class HealthServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private final AtomicInteger triggers = new AtomicInteger();
    private final AtomicBoolean accept = new AtomicBoolean(true);
    private HealthServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    @DisplayName("Should answer UP on /health")
    void health() throws Exception {
        start("");

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("Should answer 200 on /readiness only after markReady")
    void readiness() throws Exception {
        start("");

        assertThat(get("/readiness").statusCode()).isEqualTo(503);
        server.markReady();
        assertThat(get("/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should queue a run on POST /trigger")
    void triggerAccepted() throws Exception {
        start("");

        HttpResponse<String> response = post("/trigger", null);

        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(triggers.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse GET /trigger with 405")
    void triggerWrongMethod() throws Exception {
        start("");

        assertThat(get("/trigger").statusCode()).isEqualTo(405);
        assertThat(triggers.get()).isZero();
    }

    @Test
    @DisplayName("Should reject a wrong or missing api key with 401")
    void triggerUnauthorized() throws Exception {
        start("s3cret");

        assertThat(post("/trigger", null).statusCode()).isEqualTo(401);
        assertThat(post("/trigger?api_key=nope", null).statusCode()).isEqualTo(401);
        assertThat(triggers.get()).isZero();
    }

    @Test
    @DisplayName("Should accept the api key from a query parameter or header")
    void triggerAuthorized() throws Exception {
        start("s3cret");

        assertThat(post("/trigger?api_key=s3cret", null).statusCode()).isEqualTo(202);
        assertThat(post("/trigger", "s3cret").statusCode()).isEqualTo(202);
        assertThat(triggers.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should answer 503 when the trigger is refused after shutdown")
    void triggerUnavailable() throws Exception {
        start("");
        accept.set(false);

        assertThat(post("/trigger", null).statusCode()).isEqualTo(503);
    }

    @Test
    @DisplayName("Should reject a port outside the valid range")
    void badPort() {
        HealthServer unstarted = new HealthServer(() -> true, "");

        assertThatThrownBy(() -> unstarted.start(70_000)).isInstanceOf(IllegalArgumentException.class);
        assertThat(unstarted.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should URL-decode query parameters")
    void queryParam() {
        assertThat(HealthServer.queryParam("a=1&api_key=x%2By", "api_key")).isEqualTo("x+y");
        assertThat(HealthServer.queryParam("a=1", "api_key")).isNull();
        assertThat(HealthServer.queryParam(null, "api_key")).isNull();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void start(String apiKey) {
        server = new HealthServer(() -> {
            if (!accept.get()) {
                return false;
            }
            triggers.incrementAndGet();
            return true;
        }, apiKey);
        server.start(0);
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String apiKeyHeader) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri(path))
                .POST(HttpRequest.BodyPublishers.noBody());
        if (apiKeyHeader != null) {
            request.header("X-Api-Key", apiKeyHeader);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }
}
