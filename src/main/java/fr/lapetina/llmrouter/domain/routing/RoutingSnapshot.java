package fr.lapetina.llmrouter.domain.routing;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time view of every registered provider, in registration order.
 * Scoring against the same snapshot always yields the same result.
 */
public record RoutingSnapshot(Instant capturedAt, List<ProviderSnapshot> providers) {

    public RoutingSnapshot {
        Objects.requireNonNull(capturedAt, "Capture time is required");
        providers = providers != null ? List.copyOf(providers) : List.of();
    }
}
