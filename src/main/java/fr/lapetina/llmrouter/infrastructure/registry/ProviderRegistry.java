package fr.lapetina.llmrouter.infrastructure.registry;

import fr.lapetina.llmrouter.domain.model.CircuitState;
import fr.lapetina.llmrouter.domain.model.ProviderHealth;
import fr.lapetina.llmrouter.domain.model.ProviderMetrics;
import fr.lapetina.llmrouter.domain.provider.LlmProvider;
import fr.lapetina.llmrouter.domain.routing.ProviderSnapshot;
import fr.lapetina.llmrouter.domain.routing.RoutingSnapshot;
import fr.lapetina.llmrouter.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.llmrouter.infrastructure.resilience.CircuitBreakerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable table of the registered providers, built once at startup.
 *
 * Each entry owns one {@link CircuitBreaker} and one {@link ProviderMetrics} for the lifetime of
 * the router. The table itself is never modified after construction, so lookups and snapshots
 * need no synchronization.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final List<RegisteredProvider> providers;
    private final Map<String, RegisteredProvider> byId;
    private final ProviderMetricsStore metricsStore;
    private final Clock clock;

    private ProviderRegistry(Builder builder) {
        if (builder.entries.isEmpty()) {
            throw new IllegalStateException("At least one provider must be registered");
        }
        this.clock = builder.clock;

        List<RegisteredProvider> ordered = new ArrayList<>();
        Map<String, RegisteredProvider> index = new LinkedHashMap<>();
        Map<String, ProviderMetrics> metricsById = new LinkedHashMap<>();
        for (Entry entry : builder.entries) {
            String id = Objects.requireNonNull(entry.provider.providerId(), "Provider ID is required");
            if (index.containsKey(id)) {
                throw new IllegalStateException("Duplicate provider id: " + id);
            }
            ProviderMetrics metrics = ProviderMetrics.builder()
                    .providerId(id)
                    .baseCostPerToken(entry.provider.baseCostPerToken())
                    .initialQualityScore(entry.initialQualityScore)
                    .clock(clock)
                    .build();
            CircuitBreaker breaker = builder.breakerSettings.create(id, clock);
            RegisteredProvider registered = new RegisteredProvider(ordered.size(), entry.provider, breaker, metrics);
            ordered.add(registered);
            index.put(id, registered);
            metricsById.put(id, metrics);
            log.info("Provider registered: providerId={}, order={}, costPerToken={}, models={}",
                    id, registered.registrationOrder(), entry.provider.baseCostPerToken(),
                    entry.provider.supportedModels());
        }

        this.providers = List.copyOf(ordered);
        this.byId = Collections.unmodifiableMap(index);
        this.metricsStore = new ProviderMetricsStore(metricsById);
    }

    /**
     * Captures breaker states and metrics of every provider. Reads are lock-free except for
     * breakers that are not CLOSED, which briefly lock to apply their lazy timeout transition.
     */
    public RoutingSnapshot snapshot() {
        List<ProviderSnapshot> views = new ArrayList<>(providers.size());
        for (RegisteredProvider entry : providers) {
            ProviderMetrics metrics = entry.metrics();
            CircuitBreaker breaker = entry.circuitBreaker();
            boolean permitted = breaker.isCallPermitted();
            views.add(new ProviderSnapshot(
                    entry.id(),
                    entry.registrationOrder(),
                    metrics.getCostPerToken(),
                    metrics.getLatencyEstimateMs(),
                    metrics.getQualityScore(),
                    metrics.getSuccessRate(),
                    metrics.getLastSuccess(),
                    breaker.getState(),
                    permitted));
        }
        return new RoutingSnapshot(clock.instant(), views);
    }

    public List<ProviderHealth> healthReport() {
        List<ProviderHealth> report = new ArrayList<>(providers.size());
        for (RegisteredProvider entry : providers) {
            ProviderMetrics metrics = entry.metrics();
            report.add(new ProviderHealth(
                    entry.id(),
                    entry.circuitBreaker().getState(),
                    metrics.getSuccessRate(),
                    metrics.getLatencyEstimateMs(),
                    metrics.getQualityScore(),
                    metrics.getCostPerToken(),
                    metrics.getRequestCount(),
                    metrics.getFailureCount(),
                    metrics.getLastSuccess(),
                    metrics.getLastProbeHealthy()));
        }
        return report;
    }

    /**
     * Breaker state per provider, in registration order.
     */
    public Map<String, CircuitState> circuitStates() {
        Map<String, CircuitState> states = new LinkedHashMap<>();
        for (RegisteredProvider entry : providers) {
            states.put(entry.id(), entry.circuitBreaker().getState());
        }
        return states;
    }

    /**
     * Lowest current cost per token across all providers.
     */
    public double lowestCostPerToken() {
        double lowest = Double.MAX_VALUE;
        for (RegisteredProvider entry : providers) {
            lowest = Math.min(lowest, entry.metrics().getCostPerToken());
        }
        return lowest;
    }

    public Optional<RegisteredProvider> find(String providerId) {
        return Optional.ofNullable(byId.get(providerId));
    }

    public RegisteredProvider require(String providerId) {
        RegisteredProvider entry = byId.get(providerId);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        return entry;
    }

    public List<RegisteredProvider> all() {
        return providers;
    }

    public int size() {
        return providers.size();
    }

    public ProviderMetricsStore metricsStore() {
        return metricsStore;
    }

    public static Builder builder() {
        return new Builder();
    }

    private record Entry(LlmProvider provider, double initialQualityScore) {
    }

    public static final class Builder {
        private final List<Entry> entries = new ArrayList<>();
        private CircuitBreakerSettings breakerSettings = CircuitBreakerSettings.defaults();
        private Clock clock = Clock.systemUTC();

        public Builder register(LlmProvider provider) {
            return register(provider, ProviderMetrics.DEFAULT_QUALITY_SCORE);
        }

        public Builder register(LlmProvider provider, double initialQualityScore) {
            entries.add(new Entry(Objects.requireNonNull(provider, "Provider is required"), initialQualityScore));
            return this;
        }

        public Builder breakerSettings(CircuitBreakerSettings settings) {
            this.breakerSettings = Objects.requireNonNull(settings);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(this);
        }
    }
}
