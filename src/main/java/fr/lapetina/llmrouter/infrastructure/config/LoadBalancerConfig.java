package fr.lapetina.llmrouter.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the router.
 * Designed to be populated from YAML.
 */
public class LoadBalancerConfig {

    private ServerConfig server = new ServerConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private RoutingConfig routing = new RoutingConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private RetryConfig retry = new RetryConfig();
    private CacheConfig cache = new CacheConfig();
    private BudgetConfig budget = new BudgetConfig();
    private LimitsConfig limits = new LimitsConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private ValidationConfig validation = new ValidationConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public BudgetConfig getBudget() { return budget; }
    public void setBudget(BudgetConfig budget) { this.budget = budget; }

    public LimitsConfig getLimits() { return limits; }
    public void setLimits(LimitsConfig limits) { this.limits = limits; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * One provider backend. {@code models} maps a model size (small, medium, large) to the
     * backend's model name; {@code defaultModel} is used when the request states no size.
     */
    public static class ProviderConfig {
        private String id;
        private String type = "openai-compatible";
        private String baseUrl;
        private String apiKeyEnv;
        private Map<String, String> models = new LinkedHashMap<>();
        private String defaultModel;
        private double costPerToken = 0.00001;
        private double initialQualityScore = 0.85;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public Map<String, String> getModels() { return models; }
        public void setModels(Map<String, String> models) { this.models = models; }

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

        public double getCostPerToken() { return costPerToken; }
        public void setCostPerToken(double costPerToken) { this.costPerToken = costPerToken; }

        public double getInitialQualityScore() { return initialQualityScore; }
        public void setInitialQualityScore(double initialQualityScore) { this.initialQualityScore = initialQualityScore; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Routing score weights.
     */
    public static class RoutingConfig {
        private WeightsConfig weights = new WeightsConfig();

        public WeightsConfig getWeights() { return weights; }
        public void setWeights(WeightsConfig weights) { this.weights = weights; }
    }

    public static class WeightsConfig {
        private double cost = 0.3;
        private double latency = 0.4;
        private double quality = 0.2;
        private double reliability = 0.1;

        public double getCost() { return cost; }
        public void setCost(double cost) { this.cost = cost; }

        public double getLatency() { return latency; }
        public void setLatency(double latency) { this.latency = latency; }

        public double getQuality() { return quality; }
        public void setQuality(double quality) { this.quality = quality; }

        public double getReliability() { return reliability; }
        public void setReliability(double reliability) { this.reliability = reliability; }
    }

    /**
     * Per-provider circuit breaker thresholds.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private int successThreshold = 3;
        private long timeoutMs = 60000;
        private int halfOpenMaxCalls = 3;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getHalfOpenMaxCalls() { return halfOpenMaxCalls; }
        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) { this.halfOpenMaxCalls = halfOpenMaxCalls; }
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxRetries = 3;
        private long initialBackoffMs = 100;
        private long maxBackoffMs = 5000;
        private double backoffMultiplier = 2.0;
        private boolean jitter = true;
        private boolean retryOnTimeout = true;
        private boolean retryOnRateLimit = true;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }

        public boolean isRetryOnTimeout() { return retryOnTimeout; }
        public void setRetryOnTimeout(boolean retryOnTimeout) { this.retryOnTimeout = retryOnTimeout; }

        public boolean isRetryOnRateLimit() { return retryOnRateLimit; }
        public void setRetryOnRateLimit(boolean retryOnRateLimit) { this.retryOnRateLimit = retryOnRateLimit; }
    }

    /**
     * Response cache configuration.
     */
    public static class CacheConfig {
        private boolean enabled = true;
        private long ttlSeconds = 3600;
        private int maxEntries = 10000;
        private double hitCostReduction = 0.05;
        private long cleanupIntervalSeconds = 300;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public double getHitCostReduction() { return hitCostReduction; }
        public void setHitCostReduction(double hitCostReduction) { this.hitCostReduction = hitCostReduction; }

        public long getCleanupIntervalSeconds() { return cleanupIntervalSeconds; }
        public void setCleanupIntervalSeconds(long cleanupIntervalSeconds) { this.cleanupIntervalSeconds = cleanupIntervalSeconds; }
    }

    /**
     * Spend ceiling. An absent or non-positive limit means unlimited.
     */
    public static class BudgetConfig {
        private Double hourlyLimitUsd;

        public Double getHourlyLimitUsd() { return hourlyLimitUsd; }
        public void setHourlyLimitUsd(Double hourlyLimitUsd) { this.hourlyLimitUsd = hourlyLimitUsd; }
    }

    public static class LimitsConfig {
        private int maxConcurrentRequests = 1000;

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long requestTimeoutMs = 30000;
        private long connectTimeoutMs = 10000;
        private long healthCheckTimeoutMs = 5000;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
        public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }
    }

    /**
     * Background provider probing.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 30000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxPromptLength = 100000;

        public int getMaxPromptLength() { return maxPromptLength; }
        public void setMaxPromptLength(int maxPromptLength) { this.maxPromptLength = maxPromptLength; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "llm_router";
        private int windowSize = 10000;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
    }
}
