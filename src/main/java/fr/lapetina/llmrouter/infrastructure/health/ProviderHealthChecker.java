package fr.lapetina.llmrouter.infrastructure.health;

import fr.lapetina.llmrouter.domain.model.CircuitState;
import fr.lapetina.llmrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llmrouter.infrastructure.registry.RegisteredProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health prober for providers.
 *
 * Periodically calls each provider's health check and stores the result in its metrics, where
 * it shows up in health reports. Probes are informational: routing decisions are driven by the
 * circuit breakers, which only react to real traffic.
 */
public final class ProviderHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthChecker.class);

    private final ProviderRegistry providerRegistry;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ProviderHealthChecker(ProviderRegistry providerRegistry, Duration checkInterval, Duration probeTimeout) {
        this.providerRegistry = providerRegistry;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "provider-health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAllProviders,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started with interval: {}", checkInterval);
        }
    }

    /**
     * Probes every registered provider once.
     */
    public void checkAllProviders() {
        log.debug("Starting health check cycle: providerCount={}", providerRegistry.size());
        for (RegisteredProvider provider : providerRegistry.all()) {
            checkProvider(provider);
        }
    }

    void checkProvider(RegisteredProvider provider) {
        try {
            provider.provider().healthCheck()
                    .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((healthy, ex) -> {
                        boolean result = ex == null && Boolean.TRUE.equals(healthy);
                        if (ex != null) {
                            log.warn("Health check failed: providerId={}, error={}", provider.id(), ex.toString());
                        }
                        recordResult(provider, result);
                    });
        } catch (RuntimeException e) {
            log.warn("Health check could not be started: providerId={}, error={}", provider.id(), e.toString());
            recordResult(provider, false);
        }
    }

    private void recordResult(RegisteredProvider provider, boolean healthy) {
        Boolean previous = provider.metrics().getLastProbeHealthy();
        provider.metrics().recordProbe(healthy);

        if (previous == null || previous != healthy) {
            CircuitState breakerState = provider.circuitBreaker().getState();
            if (healthy) {
                log.info("Provider probe healthy: providerId={}, circuitState={}", provider.id(), breakerState);
            } else {
                log.warn("Provider probe unhealthy: providerId={}, circuitState={}", provider.id(), breakerState);
            }
        }
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Health checker stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
