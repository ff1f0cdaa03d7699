package fr.lapetina.llmrouter.infrastructure.metrics;

import fr.lapetina.llmrouter.domain.model.CircuitState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated router statistics at one point in time.
 */
public record MetricsSnapshot(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long cacheHits,
        double averageLatencyMs,
        long p95LatencyMs,
        long p99LatencyMs,
        double totalCostUsd,
        double requestsPerSecond,
        Map<String, Long> providerDistribution,
        Map<String, CircuitState> circuitBreakerStates,
        Map<String, Long> errorsByType,
        double hourlySpendUsd,
        long uptimeSeconds
) {
    public MetricsSnapshot {
        providerDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(providerDistribution));
        circuitBreakerStates = Collections.unmodifiableMap(new LinkedHashMap<>(circuitBreakerStates));
        errorsByType = Collections.unmodifiableMap(new LinkedHashMap<>(errorsByType));
    }
}
