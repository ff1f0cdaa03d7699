package fr.lapetina.llmrouter;

import fr.lapetina.llmrouter.domain.model.ProviderMetrics;
import fr.lapetina.llmrouter.domain.provider.LlmProvider;
import fr.lapetina.llmrouter.domain.routing.RoutingEngine;
import fr.lapetina.llmrouter.domain.routing.RoutingWeights;
import fr.lapetina.llmrouter.infrastructure.budget.CostBudgetTracker;
import fr.lapetina.llmrouter.infrastructure.cache.RequestCache;
import fr.lapetina.llmrouter.infrastructure.config.ConfigLoader;
import fr.lapetina.llmrouter.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.llmrouter.infrastructure.health.ProviderHealthChecker;
import fr.lapetina.llmrouter.infrastructure.http.ProviderFactory;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsCollector;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llmrouter.infrastructure.registry.RegisteredProvider;
import fr.lapetina.llmrouter.infrastructure.resilience.CircuitBreakerSettings;
import fr.lapetina.llmrouter.infrastructure.resilience.RetryController;
import fr.lapetina.llmrouter.infrastructure.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Factory for creating a fully-wired {@link LoadBalancer} from configuration.
 * This is the primary entry point for obtaining a configured router.
 *
 * <p>Usage:
 * <pre>{@code
 * try (LoadBalancerFactory factory = LoadBalancerFactory.create("config.yaml").start()) {
 *     LoadBalancer loadBalancer = factory.getLoadBalancer();
 *     // use loadBalancer...
 * }
 * }</pre>
 */
public class LoadBalancerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancerFactory.class);

    private final LoadBalancerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ProviderRegistry providerRegistry;
    private final RequestCache cache;
    private final CostBudgetTracker budgetTracker;
    private final ProviderHealthChecker healthChecker;
    private final ScheduledExecutorService maintenanceScheduler;
    private final LoadBalancer loadBalancer;

    /**
     * @param providersOverride providers to register instead of the configured ones (testing); the
     *                          configured quality score still applies to a provider with a matching id
     * @param clock             time source shared by breakers, metrics, cache and budget
     */
    protected LoadBalancerFactory(String configPath, List<LlmProvider> providersOverride, Clock clock) {
        log.info("Initializing LoadBalancerFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath).load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Initialize provider registry (allow override for testing)
        List<LlmProvider> providers = providersOverride != null ? providersOverride : createProviders();
        this.providerRegistry = buildRegistry(providers, clock);

        this.cache = config.getCache().isEnabled() ? createCache(clock) : null;
        this.budgetTracker = new CostBudgetTracker(config.getBudget().getHourlyLimitUsd(), clock);
        MetricsCollector metricsCollector = new MetricsCollector(
                config.getMetrics().getWindowSize(), metricsRegistry, clock);

        LoadBalancerConfig.WeightsConfig weights = config.getRouting().getWeights();
        RoutingEngine routingEngine = new RoutingEngine(new RoutingWeights(
                weights.getCost(), weights.getLatency(), weights.getQuality(), weights.getReliability()));

        RetryController retryController = new RetryController(
                providerRegistry,
                routingEngine,
                createRetryPolicy(),
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()),
                metricsRegistry
        );

        // Build load balancer
        this.loadBalancer = LoadBalancer.builder()
                .ringBufferSize(config.getDisruptor().getRingBufferSize())
                .waitStrategy(config.getDisruptor().getWaitStrategy())
                .maxConcurrentRequests(config.getLimits().getMaxConcurrentRequests())
                .maxPromptLength(config.getValidation().getMaxPromptLength())
                .providerRegistry(providerRegistry)
                .retryController(retryController)
                .budgetTracker(budgetTracker)
                .cache(cache)
                .metricsCollector(metricsCollector)
                .metricsRegistry(metricsRegistry)
                .build();

        // Initialize health checker
        this.healthChecker = new ProviderHealthChecker(
                providerRegistry,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs()),
                Duration.ofMillis(config.getTimeouts().getHealthCheckTimeoutMs())
        );

        this.maintenanceScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "llm-router-maintenance");
            t.setDaemon(true);
            return t;
        });

        // Register gauges
        registerMetrics();

        log.info("LoadBalancerFactory initialized with {} providers", providerRegistry.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static LoadBalancerFactory create(String configPath) {
        return new LoadBalancerFactory(configPath, null, Clock.systemUTC());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static LoadBalancerFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the pipeline, the health checker and the cache sweeper.
     */
    public LoadBalancerFactory start() {
        loadBalancer.start();
        if (config.getHealthCheck().isEnabled()) {
            healthChecker.start();
        }
        if (cache != null && config.getCache().getCleanupIntervalSeconds() > 0) {
            long interval = config.getCache().getCleanupIntervalSeconds();
            maintenanceScheduler.scheduleWithFixedDelay(this::sweepCache, interval, interval, TimeUnit.SECONDS);
        }
        log.info("Load balancer started");
        return this;
    }

    public LoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ProviderHealthChecker getHealthChecker() {
        return healthChecker;
    }

    public LoadBalancerConfig getConfig() {
        return config;
    }

    private List<LlmProvider> createProviders() {
        List<LlmProvider> providers = new ArrayList<>();
        for (LoadBalancerConfig.ProviderConfig providerConfig : config.getProviders()) {
            if (!providerConfig.isEnabled()) {
                log.info("Provider disabled in configuration: providerId={}", providerConfig.getId());
                continue;
            }
            providers.add(ProviderFactory.create(providerConfig, config.getTimeouts()));
        }
        return providers;
    }

    private ProviderRegistry buildRegistry(List<LlmProvider> providers, Clock clock) {
        Map<String, LoadBalancerConfig.ProviderConfig> configured = config.getProviders().stream()
                .collect(Collectors.toMap(LoadBalancerConfig.ProviderConfig::getId, Function.identity(), (a, b) -> a));

        LoadBalancerConfig.CircuitBreakerConfig breaker = config.getCircuitBreaker();
        ProviderRegistry.Builder builder = ProviderRegistry.builder()
                .clock(clock)
                .breakerSettings(new CircuitBreakerSettings(
                        breaker.getFailureThreshold(),
                        breaker.getSuccessThreshold(),
                        Duration.ofMillis(breaker.getTimeoutMs()),
                        breaker.getHalfOpenMaxCalls()));

        for (LlmProvider provider : providers) {
            LoadBalancerConfig.ProviderConfig providerConfig = configured.get(provider.providerId());
            double quality = providerConfig != null
                    ? providerConfig.getInitialQualityScore()
                    : ProviderMetrics.DEFAULT_QUALITY_SCORE;
            builder.register(provider, quality);
        }
        return builder.build();
    }

    private RequestCache createCache(Clock clock) {
        LoadBalancerConfig.CacheConfig cacheConfig = config.getCache();
        return new RequestCache(
                Duration.ofSeconds(cacheConfig.getTtlSeconds()),
                cacheConfig.getMaxEntries(),
                cacheConfig.getHitCostReduction(),
                clock
        );
    }

    private RetryPolicy createRetryPolicy() {
        LoadBalancerConfig.RetryConfig retry = config.getRetry();
        return new RetryPolicy(
                retry.getMaxRetries(),
                Duration.ofMillis(retry.getInitialBackoffMs()),
                Duration.ofMillis(retry.getMaxBackoffMs()),
                retry.getBackoffMultiplier(),
                retry.isJitter(),
                retry.isRetryOnTimeout(),
                retry.isRetryOnRateLimit()
        );
    }

    private void sweepCache() {
        try {
            int removed = cache.sweepExpired();
            if (removed > 0) {
                log.debug("Cache sweep removed {} expired entries, size={}", removed, cache.size());
            }
        } catch (RuntimeException e) {
            log.warn("Cache sweep failed", e);
        }
    }

    private void registerMetrics() {
        metricsRegistry.registerGauge("ringbuffer_remaining", "Remaining capacity in the ring buffer",
                loadBalancer::getRemainingCapacity);
        metricsRegistry.registerGauge("budget_hourly_spend_usd", "Spend in the current budget window",
                budgetTracker::getSpentThisWindowUsd);
        if (cache != null) {
            metricsRegistry.registerGauge("cache_entries", "Entries in the response cache", cache::size);
        }

        for (RegisteredProvider provider : providerRegistry.all()) {
            String id = provider.id();
            metricsRegistry.registerProviderGauge("circuit_state",
                    "Circuit breaker state (0=closed, 1=half-open, 2=open)", id, () -> {
                        return switch (provider.circuitBreaker().getState()) {
                            case CLOSED -> 0;
                            case HALF_OPEN -> 1;
                            case OPEN -> 2;
                        };
                    });
            metricsRegistry.registerProviderGauge("success_rate", "Smoothed success rate", id,
                    provider.metrics()::getSuccessRate);
            metricsRegistry.registerProviderGauge("latency_estimate_ms", "Smoothed latency estimate", id,
                    provider.metrics()::getLatencyEstimateMs);
            metricsRegistry.registerProviderGauge("quality_score", "Smoothed quality score", id,
                    provider.metrics()::getQualityScore);
            metricsRegistry.registerProviderGauge("cost_per_token_usd", "Current cost per token", id,
                    provider.metrics()::getCostPerToken);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down LoadBalancerFactory...");

        try {
            healthChecker.close();
        } catch (Exception e) {
            log.warn("Error closing health checker", e);
        }

        try {
            maintenanceScheduler.shutdownNow();
        } catch (Exception e) {
            log.warn("Error stopping maintenance scheduler", e);
        }

        try {
            loadBalancer.close();
        } catch (Exception e) {
            log.warn("Error closing load balancer", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("LoadBalancerFactory shut down");
    }
}
