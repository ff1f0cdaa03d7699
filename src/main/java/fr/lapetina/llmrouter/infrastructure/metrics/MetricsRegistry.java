package fr.lapetina.llmrouter.infrastructure.metrics;

import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Micrometer meters for the router, exposed in Prometheus format.
 *
 * Provides:
 * - Request counters per provider and pipeline state
 * - Attempt counters per provider and outcome
 * - End-to-end and per-stage latency timers
 * - Error counters by type, cache lookup counters, spend counters
 * - Gauges for in-flight requests, ring buffer capacity and per-provider state
 * - JVM and system metrics
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;
    private final JvmGcMetrics gcMetrics;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> costCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final Counter cacheHits;
    private final Counter cacheMisses;

    // Global gauges
    private final AtomicInteger globalInFlight = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        this.gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        // Register global gauges
        Gauge.builder(prefix + "_inflight_requests", globalInFlight, AtomicInteger::get)
                .description("Requests currently dispatched to providers")
                .register(registry);

        this.cacheHits = Counter.builder(prefix + "_cache_lookups_total")
                .description("Request cache lookups")
                .tag("result", "hit")
                .register(registry);
        this.cacheMisses = Counter.builder(prefix + "_cache_lookups_total")
                .description("Request cache lookups")
                .tag("result", "miss")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("llm_router");
    }

    /**
     * Increments the request counter for a provider/state combination.
     */
    public void incrementRequestCount(String providerId, EventState state) {
        String key = providerId + ":" + state.name();
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests")
                        .tag("provider", providerId)
                        .tag("state", state.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts one provider call attempt.
     *
     * @param outcome "success" or the error type name
     */
    public void incrementAttemptCount(String providerId, String outcome) {
        String key = providerId + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_provider_attempts_total")
                        .description("Provider call attempts, retries included")
                        .tag("provider", providerId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records end-to-end request latency.
     */
    public void recordLatency(String providerId, Duration latency) {
        latencyTimers.computeIfAbsent(providerId, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Request latency")
                        .tag("provider", providerId)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records stage-specific latency (validation, cache, admission, dispatch).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String providerId, ErrorType errorType) {
        String key = providerId + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of failed requests")
                        .tag("provider", providerId)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void recordCacheLookup(boolean hit) {
        (hit ? cacheHits : cacheMisses).increment();
    }

    /**
     * Adds reported spend, in USD, for a provider.
     */
    public void recordCost(String providerId, double costUsd) {
        if (costUsd <= 0) {
            return;
        }
        costCounters.computeIfAbsent(providerId, k ->
                Counter.builder(prefix + "_cost_usd_total")
                        .description("Reported spend in USD")
                        .tag("provider", providerId)
                        .register(registry)
        ).increment(costUsd);
    }

    /**
     * Registers a per-provider gauge, e.g. circuit state or success rate.
     */
    public void registerProviderGauge(String name, String description, String providerId,
                                      Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .tag("provider", providerId)
                .register(registry);
    }

    /**
     * Registers a router-wide gauge, e.g. hourly spend or cache size.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Updates the global in-flight counter.
     */
    public void setGlobalInFlight(int value) {
        globalInFlight.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        gcMetrics.close();
        registry.close();
    }
}
