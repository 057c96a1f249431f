package com.rcasentinel.flink;

import com.rcasentinel.core.config.AnalysisConfig;
import com.rcasentinel.core.config.Thresholds;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health, readiness and the active
 * detection thresholds.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - Returns {@code 200 OK} with body
 * {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} - Same; Kubernetes readiness probe target</li>
 * <li>{@code GET /thresholds} - Anomaly and correlation thresholds the
 * job was started with</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final AnalysisConfig config;
    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; must be in range [1, 65535]
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [1, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", HealthServer::handleHealthCheck);
            server.createContext("/readiness", HealthServer::handleHealthCheck);
            server.createContext("/thresholds", this::handleThresholds);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", port);
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return JSON body served on {@code /thresholds}
     */
    String thresholdsBody() {
        Thresholds t = config.snapshot();
        return String.format(Locale.ROOT, "{\"anomaly_threshold\":%s,\"correlation_threshold\":%s}",
                t.getAnomalyThreshold(), t.getCorrelationThreshold());
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, HEALTH_RESPONSE);
    }

    private void handleThresholds(HttpExchange exchange) throws IOException {
        respond(exchange, thresholdsBody().getBytes(StandardCharsets.UTF_8));
    }

    private static void respond(HttpExchange exchange, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
