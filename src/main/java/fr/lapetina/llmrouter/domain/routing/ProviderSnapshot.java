package fr.lapetina.llmrouter.domain.routing;

import fr.lapetina.llmrouter.domain.model.CircuitState;

import java.time.Instant;

/**
 * Read-only copy of one provider's routing inputs at snapshot time.
 *
 * @param registrationOrder position in the provider table, used to break score ties
 * @param callPermitted     true if the breaker is CLOSED, or HALF_OPEN with trial budget left
 */
public record ProviderSnapshot(
        String providerId,
        int registrationOrder,
        double costPerToken,
        double latencyEstimateMs,
        double qualityScore,
        double successRate,
        Instant lastSuccess,
        CircuitState circuitState,
        boolean callPermitted
) {
}
