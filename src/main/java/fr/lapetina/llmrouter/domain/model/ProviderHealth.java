package fr.lapetina.llmrouter.domain.model;

import java.time.Instant;

/**
 * Point-in-time health report of one provider, for operators and monitoring.
 *
 * @param lastProbeHealthy result of the latest background health probe, null if never probed
 */
public record ProviderHealth(
        String providerId,
        CircuitState circuitState,
        double successRate,
        double latencyEstimateMs,
        double qualityScore,
        double costPerToken,
        long requestCount,
        long failureCount,
        Instant lastSuccess,
        Boolean lastProbeHealthy
) {
}
