package fr.lapetina.llmrouter.domain.routing;

import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.domain.model.ModelSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-dimensional provider scoring.
 *
 * For every eligible provider:
 * <pre>
 * cost        = 1 / (1 + estimatedCost / 0.01)
 * latency     = min(1, target / (target + latencyEstimate))    target: 100ms high priority, 200ms otherwise
 * quality     = stored quality score
 * reliability = successRate * exp(-secondsSinceLastSuccess / 300)
 * overall     = wCost*cost + wLatency*latency + wQuality*quality + wReliability*reliability
 * </pre>
 * The highest overall score wins; ties go to the earliest registered provider.
 *
 * Stateless apart from the weights, and never takes a lock: all inputs come from the snapshot,
 * including the time used for freshness decay.
 */
public final class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    /** Estimated cost, in USD, that scores exactly 0.5 */
    public static final double REFERENCE_COST_USD = 0.01;

    static final double HIGH_PRIORITY_TARGET_LATENCY_MS = 100.0;
    static final double NORMAL_TARGET_LATENCY_MS = 200.0;
    static final double FRESHNESS_DECAY_SECONDS = 300.0;

    private final RoutingWeights weights;

    public RoutingEngine(RoutingWeights weights) {
        this.weights = Objects.requireNonNull(weights, "Routing weights are required");
        if (Math.abs(weights.sum() - 1.0) > 0.01) {
            log.warn("Routing weights do not sum to 1.0: weights={}, sum={}", weights, weights.sum());
        }
        log.info("RoutingEngine initialized: weights={}", weights);
    }

    /**
     * Selects the best eligible provider.
     *
     * @param excluded provider ids to skip, typically those already tried for this request
     * @throws LoadBalancerException with NO_PROVIDERS_AVAILABLE if nothing is eligible
     */
    public ProviderScore select(CompletionRequest request, RoutingSnapshot snapshot, Set<String> excluded) {
        return trySelect(request, snapshot, excluded)
                .orElseThrow(LoadBalancerException::noProvidersAvailable);
    }

    public ProviderScore select(CompletionRequest request, RoutingSnapshot snapshot) {
        return select(request, snapshot, Set.of());
    }

    /**
     * Same as {@link #select} but reports "nothing eligible" as an empty result.
     */
    public Optional<ProviderScore> trySelect(
            CompletionRequest request,
            RoutingSnapshot snapshot,
            Set<String> excluded
    ) {
        ProviderScore best = null;
        for (ProviderSnapshot provider : snapshot.providers()) {
            if (!isEligible(provider, excluded)) {
                continue;
            }
            ProviderScore candidate = score(request, provider, snapshot.capturedAt());
            // Strict comparison keeps the earlier provider on ties
            if (best == null || candidate.overall() > best.overall()) {
                best = candidate;
            }
        }

        if (best != null && log.isDebugEnabled()) {
            log.debug("Provider selected: requestId={}, providerId={}, overall={}, excluded={}",
                    request.requestId(), best.providerId(), best.overall(), excluded);
        }
        return Optional.ofNullable(best);
    }

    /**
     * Scores every eligible provider, best first. Intended for diagnostics.
     */
    public List<ProviderScore> rank(CompletionRequest request, RoutingSnapshot snapshot) {
        List<ProviderScore> scores = new ArrayList<>();
        for (ProviderSnapshot provider : snapshot.providers()) {
            if (isEligible(provider, Set.of())) {
                scores.add(score(request, provider, snapshot.capturedAt()));
            }
        }
        scores.sort(Comparator.comparingDouble(ProviderScore::overall).reversed()
                .thenComparingInt(ProviderScore::registrationOrder));
        return scores;
    }

    /**
     * Computes the full score breakdown of one provider, ignoring eligibility.
     */
    public ProviderScore score(CompletionRequest request, ProviderSnapshot provider, Instant now) {
        double estimatedCost = estimateCost(request, provider.costPerToken());
        double costScore = 1.0 / (1.0 + estimatedCost / REFERENCE_COST_USD);

        double target = request.priority().isHigh()
                ? HIGH_PRIORITY_TARGET_LATENCY_MS
                : NORMAL_TARGET_LATENCY_MS;
        double latency = Math.max(0.0, provider.latencyEstimateMs());
        double latencyScore = Math.min(1.0, target / (target + latency));

        double qualityScore = provider.qualityScore();

        double secondsSinceSuccess = provider.lastSuccess() == null
                ? Double.POSITIVE_INFINITY
                : Math.max(0.0, Duration.between(provider.lastSuccess(), now).toMillis() / 1000.0);
        double reliabilityScore = provider.successRate() * Math.exp(-secondsSinceSuccess / FRESHNESS_DECAY_SECONDS);

        double overall = weights.cost() * costScore
                + weights.latency() * latencyScore
                + weights.quality() * qualityScore
                + weights.reliability() * reliabilityScore;

        return new ProviderScore(provider.providerId(), provider.registrationOrder(), estimatedCost,
                costScore, latencyScore, qualityScore, reliabilityScore, overall);
    }

    /**
     * Expected USD cost of a request at the given per-token price.
     */
    public static double estimateCost(CompletionRequest request, double costPerToken) {
        return costPerToken * ModelSize.multiplierFor(request.modelPreference()) * request.effectiveMaxTokens();
    }

    public RoutingWeights getWeights() {
        return weights;
    }

    private static boolean isEligible(ProviderSnapshot provider, Set<String> excluded) {
        return provider.callPermitted() && !excluded.contains(provider.providerId());
    }
}
