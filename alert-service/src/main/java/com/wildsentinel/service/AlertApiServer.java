package com.wildsentinel.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertRule;
import com.wildsentinel.core.model.FeedbackRecord;
import com.wildsentinel.core.model.InvalidStateTransitionException;
import com.wildsentinel.core.model.Severity;
import com.wildsentinel.core.repository.AlertQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * HTTP server for the alert REST surface, health probes and the metrics
 * scrape endpoint.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /alerts?severity=&resolved=&cameraId=&includeFiltered=&limit=&offset=}</li>
 * <li>{@code GET /alerts/{id}}</li>
 * <li>{@code POST /alerts/{id}/acknowledge}, {@code POST /alerts/{id}/resolve}</li>
 * <li>{@code POST /alerts/{id}/feedback}: body
 * {@code {"isFalsePositive": bool, "rating": 1-5?, "notes": str?}}, returns
 * {@code 201}</li>
 * <li>{@code GET /alerts/rules}, {@code POST /alerts/rules},
 * {@code PUT /alerts/rules/{id}}</li>
 * <li>{@code GET /alerts/analytics?days=&cameraId=}</li>
 * <li>{@code GET /health}, {@code GET /readiness}, {@code GET /metrics}</li>
 * </ul>
 *
 * <p>
 * The caller is identified by the {@code X-User-Id} header, required for
 * every mutating call and for rule endpoints. Uses the JDK built-in
 * {@link HttpServer}.
 * </p>
 *
 * <h3>Status codes</h3>
 * <p>
 * {@code 400} malformed input, {@code 401} missing user, {@code 404} unknown
 * alert or rule, {@code 405} wrong method, {@code 409} state conflict (e.g.
 * acknowledging a filtered alert).
 * </p>
 *
 * @since 1.0.0
 */
public class AlertApiServer {

    private static final Logger LOG = LoggerFactory.getLogger(AlertApiServer.class);

    public static final String USER_HEADER = "X-User-Id";
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NOT_READY_RESPONSE = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);

    /** Body of {@code POST /alerts/{id}/feedback}. */
    record FeedbackRequest(@JsonProperty("isFalsePositive") Boolean isFalsePositive,
            @JsonProperty("rating") Integer rating,
            @JsonProperty("notes") String notes) {
    }

    private final AlertService service;
    private final ObjectMapper mapper;
    private final Supplier<String> metricsScrape;
    private final BooleanSupplier readiness;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param metricsScrape produces the Prometheus text exposition
     * @param readiness     {@code true} once the pipeline accepts detections
     */
    public AlertApiServer(AlertService service, ObjectMapper mapper, Supplier<String> metricsScrape,
            BooleanSupplier readiness) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.metricsScrape = Objects.requireNonNull(metricsScrape, "metricsScrape must not be null");
        this.readiness = Objects.requireNonNull(readiness, "readiness must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("API port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start API server on port " + port + ": " + e.getMessage(), e);
        }
        server.createContext("/health", exchange -> respond(exchange, 200, "application/json", HEALTH_RESPONSE));
        server.createContext("/readiness", exchange -> respond(exchange, readiness.getAsBoolean() ? 200 : 503,
                "application/json", readiness.getAsBoolean() ? HEALTH_RESPONSE : NOT_READY_RESPONSE));
        server.createContext("/metrics", exchange -> respond(exchange, 200, "text/plain; version=0.0.4",
                metricsScrape.get().getBytes(StandardCharsets.UTF_8)));
        server.createContext("/alerts", this::handleAlerts);

        executor = Executors.newFixedThreadPool(4, AlertPipeline.named("api-server"));
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("API server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("API server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, useful after {@code start(0)}
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Routing
    // ---------------------------------------------------------------

    private void handleAlerts(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        List<String> path = Arrays.stream(exchange.getRequestURI().getPath().split("/"))
                .filter(s -> !s.isEmpty())
                .toList();
        Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
        try {
            Object body = route(exchange, method, path, query);
            if (body instanceof Created created) {
                respondJson(exchange, 201, created.body());
            } else {
                respondJson(exchange, 200, body);
            }
        } catch (AlertNotFoundException e) {
            respondError(exchange, 404, e.getMessage());
        } catch (InvalidStateTransitionException e) {
            respondError(exchange, 409, e.getMessage());
        } catch (MethodNotAllowed e) {
            respondError(exchange, 405, "Method " + method + " not allowed");
        } catch (Unauthorized e) {
            respondError(exchange, 401, USER_HEADER + " header is required");
        } catch (JsonProcessingException e) {
            respondError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            respondError(exchange, 400, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unhandled error for {} {}: {}", method, exchange.getRequestURI(), e.getMessage(), e);
            respondError(exchange, 500, "Internal error");
        }
    }

    private Object route(HttpExchange exchange, String method, List<String> path, Map<String, String> query)
            throws IOException {
        // path.get(0) is "alerts"
        if (path.size() == 1) {
            requireMethod(method, "GET");
            return listAlerts(query);
        }
        String second = path.get(1);
        if (path.size() == 2 && "analytics".equals(second)) {
            requireMethod(method, "GET");
            int days = Integer.parseInt(query.getOrDefault("days", "30"));
            return service.analytics(days, blankToNull(query.get("cameraId")));
        }
        if ("rules".equals(second)) {
            return routeRules(exchange, method, path);
        }
        if (path.size() == 2) {
            requireMethod(method, "GET");
            return service.getAlert(second);
        }
        if (path.size() == 3) {
            requireMethod(method, "POST");
            String user = requireUser(exchange);
            switch (path.get(2)) {
                case "acknowledge":
                    return service.acknowledge(second, user);
                case "resolve":
                    return service.resolve(second, user);
                case "feedback":
                    return new Created(submitFeedback(exchange, second, user));
                default:
                    break;
            }
        }
        throw new AlertNotFoundException("No such resource: " + exchange.getRequestURI().getPath());
    }

    private Object routeRules(HttpExchange exchange, String method, List<String> path) throws IOException {
        String user = requireUser(exchange);
        if (path.size() == 2) {
            if ("GET".equals(method)) {
                return service.listRules(user);
            }
            requireMethod(method, "POST");
            AlertRule rule = mapper.readerForUpdating(service.ruleTemplate()).readValue(readBody(exchange));
            return new Created(service.createRule(rule, user));
        }
        if (path.size() == 3) {
            requireMethod(method, "PUT");
            AlertRule existing = service.getRule(path.get(2), user);
            AlertRule copy = mapper.convertValue(existing, AlertRule.class);
            AlertRule merged = mapper.readerForUpdating(copy).readValue(readBody(exchange));
            return service.updateRule(path.get(2), merged, user);
        }
        throw new AlertNotFoundException("No such resource: " + exchange.getRequestURI().getPath());
    }

    private Map<String, Object> listAlerts(Map<String, String> query) {
        AlertQuery q = AlertQuery.all()
                .cameraId(blankToNull(query.get("cameraId")))
                .includeFiltered(Boolean.parseBoolean(query.getOrDefault("includeFiltered", "false")));
        String severity = blankToNull(query.get("severity"));
        if (severity != null) {
            q.severity(Severity.valueOf(severity.toUpperCase(Locale.ROOT)));
        }
        String resolved = blankToNull(query.get("resolved"));
        if (resolved != null) {
            q.resolved(parseBoolean("resolved", resolved));
        }
        q.limit(Integer.parseInt(query.getOrDefault("limit", Integer.toString(AlertQuery.DEFAULT_LIMIT))));
        q.offset(Integer.parseInt(query.getOrDefault("offset", "0")));

        List<Alert> page = service.listAlerts(q);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("alerts", page);
        body.put("count", page.size());
        body.put("limit", q.getLimit());
        body.put("offset", q.getOffset());
        return body;
    }

    private FeedbackRecord submitFeedback(HttpExchange exchange, String alertId, String user) throws IOException {
        FeedbackRequest request = mapper.readValue(readBody(exchange), FeedbackRequest.class);
        if (request == null || request.isFalsePositive() == null) {
            throw new IllegalArgumentException("'isFalsePositive' is required");
        }
        return service.submitFeedback(alertId, user, request.isFalsePositive(), request.rating(), request.notes());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private record Created(Object body) {
    }

    private static final class MethodNotAllowed extends RuntimeException {
        private static final long serialVersionUID = 1L;
    }

    private static final class Unauthorized extends RuntimeException {
        private static final long serialVersionUID = 1L;
    }

    private static void requireMethod(String actual, String expected) {
        if (!expected.equals(actual)) {
            throw new MethodNotAllowed();
        }
    }

    private static String requireUser(HttpExchange exchange) {
        String user = exchange.getRequestHeaders().getFirst(USER_HEADER);
        if (user == null || user.isBlank()) {
            throw new Unauthorized();
        }
        return user.trim();
    }

    private static boolean parseBoolean(String name, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("'" + name + "' must be true or false, got: " + value);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static byte[] readBody(HttpExchange exchange) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        if (body.length == 0) {
            throw new IllegalArgumentException("Request body is required");
        }
        return body;
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private void respondJson(HttpExchange exchange, int status, Object body) throws IOException {
        respond(exchange, status, "application/json", mapper.writeValueAsBytes(body));
    }

    private void respondError(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("error", message);
        respondJson(exchange, status, body);
    }

    private static void respond(HttpExchange exchange, int status, String contentType, byte[] body)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
