package fr.lapetina.llmrouter.infrastructure.registry;

import fr.lapetina.llmrouter.domain.model.ProviderMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Write side of the per-provider routing metrics.
 *
 * The provider set is fixed at construction; updates go straight to the provider's own
 * atomics, so writers for different providers never contend.
 */
public final class ProviderMetricsStore {

    private static final Logger log = LoggerFactory.getLogger(ProviderMetricsStore.class);

    private final Map<String, ProviderMetrics> metrics;

    ProviderMetricsStore(Map<String, ProviderMetrics> metrics) {
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public void recordSuccess(String providerId, long latencyMs, Double qualityScore) {
        get(providerId).recordSuccess(latencyMs, qualityScore);
    }

    public void recordFailure(String providerId) {
        get(providerId).recordFailure();
    }

    /**
     * Folds an externally computed quality score (0..1) into the provider's estimate.
     */
    public void recordQualityScore(String providerId, double score) {
        get(providerId).recordQualityScore(score);
        log.debug("Quality score recorded: providerId={}, score={}", providerId, score);
    }

    public void overrideCostPerToken(String providerId, double costPerToken) {
        ProviderMetrics target = get(providerId);
        double previous = target.getCostPerToken();
        target.overrideCostPerToken(costPerToken);
        log.info("Cost per token overridden: providerId={}, previous={}, current={}",
                providerId, previous, costPerToken);
    }

    public ProviderMetrics get(String providerId) {
        ProviderMetrics target = metrics.get(providerId);
        if (target == null) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        return target;
    }

    public Map<String, ProviderMetrics> all() {
        return metrics;
    }
}
