package fr.lapetina.llmrouter.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.domain.model.ModelSize;
import fr.lapetina.llmrouter.domain.provider.LlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Provider adapter for any backend speaking the OpenAI chat completions protocol.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. The model is chosen from the request's
 * {@link ModelSize}; HTTP failures are mapped onto the router's {@link ErrorType}s so the retry
 * controller can tell transient from permanent errors.
 *
 * Responses are returned with a zero cost: the router prices them with the provider's current
 * cost per token.
 */
public class OpenAiCompatibleProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);

    private final String providerId;
    private final String baseUrl;
    private final String apiKey;
    private final Map<ModelSize, String> models;
    private final String defaultModel;
    private final double costPerToken;
    private final Duration healthCheckTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OpenAiCompatibleProvider(Builder builder) {
        this.providerId = builder.providerId;
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.apiKey = builder.apiKey;
        this.models = builder.models.isEmpty() ? Map.of() : new EnumMap<>(builder.models);
        this.defaultModel = builder.defaultModel;
        this.costPerToken = builder.costPerToken;
        this.healthCheckTimeout = builder.healthCheckTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public CompletableFuture<CompletionResponse> complete(CompletionRequest request) {
        String model = resolveModel(request.modelPreference());
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, model);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to build request: providerId={}, requestId={}", providerId, request.requestId(), e);
            return CompletableFuture.failedFuture(LoadBalancerException.invalidRequest(
                    "Failed to build request for provider " + providerId + ": " + e.getMessage()));
        }

        log.debug("Sending request: providerId={}, requestId={}, model={}, endpoint={}",
                providerId, request.requestId(), model, httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, ex) -> {
                    if (ex != null) {
                        throw new CompletionException(classifyException(request, ex));
                    }
                    return handleResponse(request, model, response);
                });
    }

    String resolveModel(ModelSize size) {
        if (size != null && models.containsKey(size)) {
            return models.get(size);
        }
        if (defaultModel != null) {
            return defaultModel;
        }
        if (models.containsKey(ModelSize.MEDIUM)) {
            return models.get(ModelSize.MEDIUM);
        }
        if (!models.isEmpty()) {
            return models.values().iterator().next();
        }
        throw new IllegalStateException("No model configured for provider " + providerId);
    }

    private HttpRequest buildHttpRequest(CompletionRequest request, String model) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));
        body.put("max_tokens", request.effectiveMaxTokens());
        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        body.put("stream", false);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("X-Request-ID", request.requestId())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));

        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        return builder.build();
    }

    private CompletionResponse handleResponse(CompletionRequest request, String model, HttpResponse<String> response) {
        int statusCode = response.statusCode();
        if (statusCode >= 200 && statusCode < 300) {
            return parseSuccessResponse(request, model, response.body());
        }

        String detail = "HTTP " + statusCode + extractErrorMessage(response.body());
        log.warn("Request failed with HTTP error: providerId={}, requestId={}, model={}, status={}",
                providerId, request.requestId(), model, statusCode);
        throw statusToException(statusCode, detail);
    }

    LoadBalancerException statusToException(int statusCode, String detail) {
        return switch (statusCode) {
            case 429 -> LoadBalancerException.rateLimited(providerId, detail);
            case 401, 403 -> new LoadBalancerException(ErrorType.AUTHENTICATION, providerId, detail);
            case 400, 404, 422 -> new LoadBalancerException(ErrorType.INVALID_REQUEST, providerId, detail);
            case 408 -> new LoadBalancerException(ErrorType.TIMEOUT, providerId, detail);
            default -> LoadBalancerException.providerError(providerId, detail, null);
        };
    }

    private CompletionResponse parseSuccessResponse(CompletionRequest request, String model, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw LoadBalancerException.providerError(providerId, "Unparseable response body", e);
        }

        JsonNode choice = root.path("choices").path(0);
        String content = choice.path("message").path("content").asText("");
        JsonNode usage = root.path("usage");
        int tokens = usage.path("total_tokens").asInt(
                usage.path("prompt_tokens").asInt(0) + usage.path("completion_tokens").asInt(0));

        return CompletionResponse.builder()
                .requestId(request.requestId())
                .content(content)
                .providerId(providerId)
                .model(root.path("model").asText(model))
                .tokensUsed(tokens)
                .costUsd(0.0)
                .build();
    }

    private String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return ": " + error.asText();
            }
            if (error.has("message")) {
                return ": " + error.path("message").asText();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: providerId={}", providerId);
        }
        return "";
    }

    private LoadBalancerException classifyException(CompletionRequest request, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;

        if (cause instanceof LoadBalancerException lbe) {
            return lbe;
        }
        if (cause instanceof HttpTimeoutException) {
            long timeoutMs = request.timeout() != null ? request.timeout().toMillis() : -1;
            log.warn("Request timeout: providerId={}, requestId={}, error={}",
                    providerId, request.requestId(), cause.getMessage());
            return LoadBalancerException.timeout(providerId, timeoutMs);
        }
        log.warn("Provider connection error: providerId={}, requestId={}, errorType={}, error={}",
                providerId, request.requestId(), cause.getClass().getSimpleName(), cause.getMessage());
        return LoadBalancerException.providerError(providerId, cause.getClass().getSimpleName()
                + ": " + cause.getMessage(), cause);
    }

    /**
     * Lists the backend's models; any 2xx answer counts as healthy.
     */
    @Override
    public CompletableFuture<Boolean> healthCheck() {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/models"))
                .timeout(healthCheckTimeout)
                .GET();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        return httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() >= 200 && response.statusCode() < 300;
                    if (!healthy) {
                        log.warn("Health check failed: providerId={}, status={}", providerId, response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check error: providerId={}, error={}", providerId, ex.getMessage());
                    return false;
                });
    }

    @Override
    public List<String> supportedModels() {
        List<String> names = new ArrayList<>(models.values());
        if (defaultModel != null && !names.contains(defaultModel)) {
            names.add(defaultModel);
        }
        return List.copyOf(names);
    }

    @Override
    public double baseCostPerToken() {
        return costPerToken;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String providerId;
        private String baseUrl;
        private String apiKey;
        private final Map<ModelSize, String> models = new EnumMap<>(ModelSize.class);
        private String defaultModel;
        private double costPerToken;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration healthCheckTimeout = Duration.ofSeconds(5);

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder model(ModelSize size, String model) {
            this.models.put(size, model);
            return this;
        }

        public Builder defaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder costPerToken(double costPerToken) {
            this.costPerToken = costPerToken;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder healthCheckTimeout(Duration healthCheckTimeout) {
            this.healthCheckTimeout = healthCheckTimeout;
            return this;
        }

        public OpenAiCompatibleProvider build() {
            Objects.requireNonNull(providerId, "providerId is required");
            Objects.requireNonNull(baseUrl, "baseUrl is required");
            if (models.isEmpty() && defaultModel == null) {
                throw new IllegalArgumentException("At least one model is required for provider " + providerId);
            }
            return new OpenAiCompatibleProvider(this);
        }
    }
}
