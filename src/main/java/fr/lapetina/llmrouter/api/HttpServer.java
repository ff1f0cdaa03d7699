package fr.lapetina.llmrouter.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.llmrouter.LoadBalancer;
import fr.lapetina.llmrouter.api.dto.ApiRequest;
import fr.lapetina.llmrouter.api.dto.ApiResponse;
import fr.lapetina.llmrouter.domain.model.CircuitState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.domain.model.ProviderHealth;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/completions - Route a completion request
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /stats - Aggregated routing statistics
 * - GET /admin/providers - Per-provider health reports
 * - POST /admin/providers/{id}/reset - Force a provider's circuit breaker closed
 * - POST /admin/providers/{id}/cost - Override a provider's cost per token
 * - POST /admin/providers/{id}/quality - Record an external quality score
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final Pattern PROVIDER_ACTION = Pattern.compile("^/admin/providers/([^/]+)/(reset|cost|quality)$");
    private static final long RESPONSE_WAIT_SECONDS = 120;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final LoadBalancer loadBalancer;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            LoadBalancer loadBalancer,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.loadBalancer = loadBalancer;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "http-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/v1/completions", new CompletionHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/stats", new StatsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}:{}", host, port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== COMPLETION HANDLER ====================

    private class CompletionHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                // Parse request
                CompletionRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    ApiRequest apiRequest = objectMapper.readValue(is, ApiRequest.class);
                    String headerId = exchange.getRequestHeaders().getFirst("X-Request-ID");
                    if (apiRequest.getRequestId() == null && headerId != null) {
                        apiRequest.setRequestId(headerId);
                    }
                    request = apiRequest.toCompletionRequest();
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    sendJson(exchange, 400, ApiResponse.error(null, ErrorType.INVALID_REQUEST.name(), e.getMessage()));
                    return;
                }

                MDC.put("requestId", request.requestId());

                try {
                    CompletionResponse response = loadBalancer.complete(request)
                            .get(RESPONSE_WAIT_SECONDS, TimeUnit.SECONDS);
                    MDC.put("providerId", response.providerId());
                    sendJson(exchange, 200, ApiResponse.fromCompletionResponse(response));
                } catch (ExecutionException e) {
                    LoadBalancerException error = e.getCause() instanceof LoadBalancerException lbe
                            ? lbe
                            : new LoadBalancerException(ErrorType.INTERNAL_ERROR, null,
                                    String.valueOf(e.getCause()), e.getCause());
                    sendJson(exchange, statusFor(error.getErrorType()),
                            ApiResponse.fromException(request.requestId(), error));
                } catch (TimeoutException e) {
                    log.warn("Gave up waiting for response: requestId={}", request.requestId());
                    sendJson(exchange, 504, ApiResponse.error(request.requestId(), ErrorType.TIMEOUT.name(),
                            "No response within " + RESPONSE_WAIT_SECONDS + "s"));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    sendError(exchange, 503, "Interrupted");
                }

            } catch (Exception e) {
                log.error("Error handling completion request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    static int statusFor(ErrorType errorType) {
        return switch (errorType) {
            case INVALID_REQUEST -> 400;
            case AUTHENTICATION -> 401;
            case COST_BUDGET_EXCEEDED -> 402;
            case RATE_LIMIT -> 429;
            case NO_PROVIDERS_AVAILABLE, CIRCUIT_BREAKER_OPEN, CAPACITY_EXCEEDED -> 503;
            case TIMEOUT -> 504;
            case INTERNAL_ERROR -> 500;
            case PROVIDER_ERROR, MAX_RETRIES_EXCEEDED -> 502;
        };
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<ProviderHealth> providers = loadBalancer.providerHealth();
            long closed = providers.stream().filter(p -> p.circuitState() == CircuitState.CLOSED).count();
            long open = providers.stream().filter(p -> p.circuitState() == CircuitState.OPEN).count();

            String status;
            if (!loadBalancer.isRunning() || open == providers.size()) {
                status = "DOWN";
            } else if (closed < providers.size()) {
                status = "DEGRADED";
            } else {
                status = "UP";
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());

            Map<String, Object> circuits = new LinkedHashMap<>();
            for (ProviderHealth provider : providers) {
                circuits.put(provider.providerId(), provider.circuitState().name());
            }
            health.put("providers", circuits);

            // Pipeline stats
            Map<String, Object> pipelineStats = new LinkedHashMap<>();
            pipelineStats.put("inFlight", loadBalancer.getInFlight());
            pipelineStats.put("ringBufferRemaining", loadBalancer.getRemainingCapacity());
            pipelineStats.put("hourlySpendUsd", loadBalancer.getBudgetTracker().getSpentThisWindowUsd());
            health.put("pipeline", pipelineStats);

            sendJson(exchange, "DOWN".equals(status) ? 503 : 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== STATS HANDLER ====================

    private class StatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, loadBalancer.metricsSnapshot());
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                Matcher action = PROVIDER_ACTION.matcher(path);
                if (path.equals("/admin/providers") && "GET".equals(method)) {
                    sendJson(exchange, 200, loadBalancer.providerHealth());
                } else if (action.matches() && "POST".equals(method)) {
                    handleProviderAction(exchange, action.group(1), action.group(2));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (IllegalArgumentException e) {
                sendError(exchange, 404, e.getMessage());
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleProviderAction(HttpExchange exchange, String providerId, String action) throws IOException {
            MDC.put("providerId", providerId);
            try {
                switch (action) {
                    case "reset" -> {
                        loadBalancer.resetCircuitBreaker(providerId);
                        sendJson(exchange, 200, Map.of("provider", providerId, "circuitState", CircuitState.CLOSED.name()));
                    }
                    case "cost" -> {
                        Double cost = readNumber(exchange, "cost_per_token");
                        if (cost == null || cost < 0) {
                            sendError(exchange, 400, "Field 'cost_per_token' must be a number >= 0");
                            return;
                        }
                        loadBalancer.overrideCostPerToken(providerId, cost);
                        sendJson(exchange, 200, Map.of("provider", providerId, "costPerToken", cost));
                    }
                    case "quality" -> {
                        Double score = readNumber(exchange, "score");
                        if (score == null || score < 0 || score > 1) {
                            sendError(exchange, 400, "Field 'score' must be a number in [0, 1]");
                            return;
                        }
                        loadBalancer.recordQualityScore(providerId, score);
                        sendJson(exchange, 200, Map.of("provider", providerId, "score", score));
                    }
                    default -> sendError(exchange, 404, "Not Found");
                }
            } finally {
                MDC.remove("providerId");
            }
        }

        private Double readNumber(HttpExchange exchange, String field) throws IOException {
            JsonNode body;
            try (InputStream is = exchange.getRequestBody()) {
                body = objectMapper.readTree(is);
            } catch (JsonProcessingException e) {
                return null;
            }
            if (body == null || !body.path(field).isNumber()) {
                return null;
            }
            return body.path(field).asDouble();
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", String.valueOf(message));
        sendJson(exchange, statusCode, error);
    }
}
