package com.signalgate.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalgate.core.events.Event;
import com.signalgate.core.model.TierAssignment;
import com.signalgate.core.util.JsonUtils;
import com.signalgate.lifecycle.approval.ApprovalStateMachine;
import com.signalgate.lifecycle.approval.CommandResult;
import com.signalgate.lifecycle.dispatch.SignalPreview;
import com.signalgate.lifecycle.store.StoreUnavailableException;
import com.signalgate.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP face of the admin surface. Same operations as the text commands, with lifecycle errors mapped to
 * status codes: unknown id 404, already decided 409, bad argument 400, store outage 503.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final int DEFAULT_EVENT_LIMIT = 200;

    private final int port;
    private final ApprovalStateMachine stateMachine;
    private final EventStore eventStore;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, ApprovalStateMachine stateMachine, EventStore eventStore) {
        this.port = port;
        this.stateMachine = stateMachine;
        this.eventStore = eventStore;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4, runnable -> {
                Thread thread = new Thread(runnable, "api-server");
                thread.setDaemon(true);
                return thread;
            });
            server.setExecutor(executor);
            server.createContext("/api/health", guarded(this::handleHealth));
            server.createContext("/api/signals", guarded(this::handleSignals));
            server.createContext("/api/stats", guarded(this::handleStats));
            server.createContext("/api/events", guarded(this::handleEvents));
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, stateMachine.stats());
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }

        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : DEFAULT_EVENT_LIMIT;
        } catch (RuntimeException invalidParamError) {
            writeError(exchange, 400, "invalid_query_params", "since must be ISO-8601 and limit an integer");
            return;
        }

        List<Event> events = eventStore.query(since, type, Math.max(1, limit));
        writeJson(exchange, 200, events);
    }

    /**
     * {@code /api/signals/pending}, {@code /api/signals/{id}/preview} and the three decision routes
     * {@code approve}, {@code override?tier=} and {@code reject}.
     */
    private void handleSignals(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String[] segments = path.substring("/api/signals".length()).split("/");
        List<String> parts = Arrays.stream(segments).filter(s -> !s.isEmpty()).toList();

        if (parts.size() == 1 && "pending".equals(parts.get(0))) {
            if (ensureMethod(exchange, "GET")) {
                writeJson(exchange, 200, stateMachine.listPending());
            }
            return;
        }
        if (parts.size() != 2) {
            writeError(exchange, 404, "not_found", "No route for " + path);
            return;
        }

        String id = parts.get(0);
        switch (parts.get(1)) {
            case "preview" -> {
                if (ensureMethod(exchange, "GET")) {
                    preview(exchange, id);
                }
            }
            case "approve" -> {
                if (ensureMethod(exchange, "POST")) {
                    writeResult(exchange, stateMachine.approve(id));
                }
            }
            case "override" -> {
                if (ensureMethod(exchange, "POST")) {
                    override(exchange, id);
                }
            }
            case "reject" -> {
                if (ensureMethod(exchange, "POST")) {
                    reject(exchange, id);
                }
            }
            default -> writeError(exchange, 404, "not_found", "No route for " + path);
        }
    }

    private void preview(HttpExchange exchange, String id) throws IOException {
        Optional<SignalPreview> preview = stateMachine.preview(id);
        if (preview.isEmpty()) {
            writeError(exchange, 404, "not_found", "No signal with id " + id);
            return;
        }
        writeJson(exchange, 200, preview.get());
    }

    private void override(HttpExchange exchange, String id) throws IOException {
        String raw = queryParams(exchange.getRequestURI()).get("tier");
        Optional<TierAssignment> tier = TierAssignment.parseOverride(raw);
        if (tier.isEmpty()) {
            writeError(exchange, 400, "invalid_argument", "tier must be one of premium, free, both");
            return;
        }
        writeResult(exchange, stateMachine.approveOverride(id, tier.get()));
    }

    private void reject(HttpExchange exchange, String id) throws IOException {
        String reason;
        try {
            reason = readReason(exchange);
        } catch (IOException e) {
            writeError(exchange, 400, "invalid_body", "Body must be a JSON object with an optional reason");
            return;
        }
        writeResult(exchange, stateMachine.reject(id, reason));
    }

    private static String readReason(HttpExchange exchange) throws IOException {
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }
        if (body.length == 0) {
            return null;
        }
        JsonNode node = JsonUtils.objectMapper().readTree(body);
        if (node == null || !node.isObject()) {
            throw new IOException("Expected a JSON object");
        }
        JsonNode reason = node.get("reason");
        return reason == null || reason.isNull() ? null : reason.asText();
    }

    private void writeResult(HttpExchange exchange, CommandResult result) throws IOException {
        if (result.success()) {
            writeJson(exchange, 200, result);
            return;
        }
        int status = switch (result.error()) {
            case NOT_FOUND -> 404;
            case ALREADY_PROCESSED -> 409;
            case INVALID_ARGUMENT -> 400;
        };
        writeJson(exchange, status, result);
    }

    private HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (StoreUnavailableException e) {
                LOGGER.log(Level.WARNING, "Store unavailable serving " + exchange.getRequestURI(), e);
                writeError(exchange, 503, "store_unavailable", e.getMessage());
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Failed serving " + exchange.getRequestURI(), e);
                writeError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                exchange.close();
            }
        };
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeError(HttpExchange exchange, int status, String error, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        writeJson(exchange, status, body);
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
