package fr.lapetina.llmrouter.domain.routing;

/**
 * Score breakdown of one provider for one request.
 */
public record ProviderScore(
        String providerId,
        int registrationOrder,
        double estimatedCostUsd,
        double costScore,
        double latencyScore,
        double qualityScore,
        double reliabilityScore,
        double overall
) {
}
