package com.incidentsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.incidentsentinel.core.detection.DetectionReport;
import com.incidentsentinel.core.model.MetricKind;
import com.incidentsentinel.core.model.MetricSnapshot;
import com.incidentsentinel.core.spi.IncidentStore;
import com.incidentsentinel.core.spi.IncidentStoreException;
import com.incidentsentinel.core.spi.MetricsFetchException;
import com.incidentsentinel.core.spi.MetricsSource;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP API for health checks, incidents and raw metrics.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}, {@code GET /readiness} – {@code {"status":"UP"}}</li>
 * <li>{@code GET /incidents/detect} – run one detection cycle now and return
 * its incidents; {@code 503} when no metric kind could be fetched</li>
 * <li>{@code GET /incidents} – every stored incident, newest first</li>
 * <li>{@code GET /metrics/{cpu|memory|network}/{minutes}} – the snapshot
 * the metrics source returns for that window</li>
 * </ul>
 *
 * <p>
 * Errors are returned as {@code {"detail":"..."}}. Unknown paths give
 * {@code 404}, other methods on known paths {@code 405}.
 * </p>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class ApiServer {

    private static final Logger LOG = LoggerFactory.getLogger(ApiServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final DetectionScheduler detection;
    private final IncidentStore incidentStore;
    private final MetricsSource metricsSource;
    private final String resourceId;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(DetectionScheduler detection, IncidentStore incidentStore,
            MetricsSource metricsSource, String resourceId) {
        this.detection = Objects.requireNonNull(detection, "detection must not be null");
        this.incidentStore = Objects.requireNonNull(incidentStore, "incidentStore must not be null");
        this.metricsSource = Objects.requireNonNull(metricsSource, "metricsSource must not be null");
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId must not be null");
    }

    /**
     * Bind and start the server.
     *
     * @param host interface to bind
     * @param port TCP port; {@code 0} picks a free one (see {@link #getPort()})
     * @throws IOException if the address cannot be bound
     */
    public void start(String host, int port) throws IOException {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("API port must be in range [0, 65535], got: " + port);
        }
        server = HttpServer.create(new InetSocketAddress(host, port), 0);
        server.createContext("/", this::handle);

        executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "api-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("API server listening on {}:{}", host, getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("API server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} when not started
     */
    public int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Routing
    // ---------------------------------------------------------------

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            if (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            String[] parts = path.substring(1).split("/");

            Handler handler = route(parts);
            if (handler == null) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET");
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            handler.handle(exchange, parts);
        } catch (RuntimeException e) {
            LOG.error("Unhandled error serving {} {}: {}", exchange.getRequestMethod(),
                    exchange.getRequestURI(), e.getMessage(), e);
            sendError(exchange, 500, "Internal server error");
        } finally {
            exchange.close();
        }
    }

    private Handler route(String[] parts) {
        if (parts.length == 1 && ("health".equals(parts[0]) || "readiness".equals(parts[0]))) {
            return (exchange, p) -> send(exchange, 200, HEALTH_RESPONSE);
        }
        if (parts.length == 1 && "incidents".equals(parts[0])) {
            return (exchange, p) -> listIncidents(exchange);
        }
        if (parts.length == 2 && "incidents".equals(parts[0]) && "detect".equals(parts[1])) {
            return (exchange, p) -> detect(exchange);
        }
        if (parts.length == 3 && "metrics".equals(parts[0])) {
            return (exchange, p) -> metrics(exchange, p[1], p[2]);
        }
        return null;
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange, String[] parts) throws IOException;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void detect(HttpExchange exchange) throws IOException {
        DetectionReport report = detection.runCycleNow();
        if (report.isFetchFailedEntirely()) {
            sendError(exchange, 503, "Could not retrieve metrics for " + resourceId
                    + ": " + report.getFetchErrors().values());
            return;
        }
        sendJson(exchange, 200, report.getIncidents());
    }

    private void listIncidents(HttpExchange exchange) throws IOException {
        try {
            sendJson(exchange, 200, incidentStore.listAll());
        } catch (IncidentStoreException e) {
            LOG.warn("Failed to list incidents: {}", e.getMessage());
            sendError(exchange, 500, "Could not read incidents: " + e.getMessage());
        }
    }

    private void metrics(HttpExchange exchange, String kindName, String durationText) throws IOException {
        MetricKind kind;
        try {
            kind = MetricKind.fromName(kindName);
        } catch (IllegalArgumentException e) {
            sendError(exchange, 404, "Unknown metric kind: " + kindName);
            return;
        }
        int duration;
        try {
            duration = Integer.parseInt(durationText);
        } catch (NumberFormatException e) {
            duration = 0;
        }
        if (duration <= 0) {
            sendError(exchange, 400, "Duration must be a positive number of minutes.");
            return;
        }

        MetricSnapshot snapshot;
        try {
            snapshot = metricsSource.fetch(resourceId, duration, kind);
        } catch (MetricsFetchException e) {
            LOG.warn("Metrics fetch for {} failed: {}", kind, e.getMessage());
            sendError(exchange, 500, "Could not retrieve " + kind.pathName() + " metrics.");
            return;
        }
        if (snapshot == null || snapshot.isEmpty()) {
            sendError(exchange, 500, "Could not retrieve " + kind.pathName() + " metrics.");
            return;
        }
        sendJson(exchange, 200, snapshot);
    }

    // ---------------------------------------------------------------
    // Response helpers
    // ---------------------------------------------------------------

    private static void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes;
        try {
            bytes = IncidentJson.mapper().writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to encode response: {}", e.getOriginalMessage(), e);
            sendError(exchange, 500, "Internal server error");
            return;
        }
        send(exchange, status, bytes);
    }

    private static void sendError(HttpExchange exchange, int status, String detail) throws IOException {
        send(exchange, status, IncidentJson.mapper().writeValueAsBytes(Map.of("detail", detail)));
    }

    private static void send(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
