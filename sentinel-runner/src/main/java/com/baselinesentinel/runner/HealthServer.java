package com.baselinesentinel.runner;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Lightweight HTTP server for liveness checks and manual runs.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200} with {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: {@code 200} once {@link #markReady()} was
 * called, {@code 503} before</li>
 * <li>{@code POST /trigger}: queues a detection run and answers
 * {@code 202}; {@code 401} on a wrong {@code api_key}, {@code 503} once the
 * scheduler is shut down, {@code 405} for other methods</li>
 * </ul>
 *
 * <p>
 * The API key is read from the {@code X-Api-Key} header or the
 * {@code api_key} query parameter. An empty configured key disables the
 * check.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private static final String API_KEY_HEADER = "X-Api-Key";
    private static final String API_KEY_PARAM = "api_key";

    private static final byte[] UP = json("{\"status\":\"UP\"}");
    private static final byte[] NOT_READY = json("{\"status\":\"STARTING\"}");
    private static final byte[] ACCEPTED = json("{\"status\":\"ACCEPTED\"}");
    private static final byte[] UNAVAILABLE = json("{\"status\":\"UNAVAILABLE\"}");
    private static final byte[] UNAUTHORIZED = json("{\"error\":\"invalid api key\"}");
    private static final byte[] NOT_ALLOWED = json("{\"error\":\"method not allowed\"}");

    private final BooleanSupplier trigger;
    private final String apiKey;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean ready = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    /**
     * @param trigger starts a run; returns {@code false} when runs are no
     *                longer accepted
     * @param apiKey  key required by {@code /trigger}; empty disables the check
     */
    public HealthServer(BooleanSupplier trigger, String apiKey) {
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start HTTP server on port " + port, e);
        }
        server.createContext("/health", exchange -> respond(exchange, 200, UP));
        server.createContext("/readiness", this::handleReadiness);
        server.createContext("/trigger", this::handleTrigger);

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("HTTP server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("HTTP server stopped");
        }
    }

    public void markReady() {
        ready.set(true);
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return bound port, useful when started on port {@code 0}
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (ready.get()) {
            respond(exchange, 200, UP);
        } else {
            respond(exchange, 503, NOT_READY);
        }
    }

    private void handleTrigger(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "POST");
            respond(exchange, 405, NOT_ALLOWED);
            return;
        }
        if (!authorized(exchange)) {
            LOG.warn("Rejected trigger from {}: invalid api key", exchange.getRemoteAddress());
            respond(exchange, 401, UNAUTHORIZED);
            return;
        }
        if (trigger.getAsBoolean()) {
            respond(exchange, 202, ACCEPTED);
        } else {
            respond(exchange, 503, UNAVAILABLE);
        }
    }

    private boolean authorized(HttpExchange exchange) {
        if (apiKey.isEmpty()) {
            return true;
        }
        String presented = exchange.getRequestHeaders().getFirst(API_KEY_HEADER);
        if (presented == null) {
            presented = queryParam(exchange.getRequestURI().getRawQuery(), API_KEY_PARAM);
        }
        return presented != null && MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8), apiKey.getBytes(StandardCharsets.UTF_8));
    }

    static String queryParam(String rawQuery, String name) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private static byte[] json(String body) {
        return body.getBytes(StandardCharsets.UTF_8);
    }
}
