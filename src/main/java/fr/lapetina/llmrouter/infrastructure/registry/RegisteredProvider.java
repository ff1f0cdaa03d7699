package fr.lapetina.llmrouter.infrastructure.registry;

import fr.lapetina.llmrouter.domain.model.ProviderMetrics;
import fr.lapetina.llmrouter.domain.provider.LlmProvider;
import fr.lapetina.llmrouter.infrastructure.resilience.CircuitBreaker;

/**
 * A provider together with the breaker and metrics that live as long as the router does.
 */
public record RegisteredProvider(
        int registrationOrder,
        LlmProvider provider,
        CircuitBreaker circuitBreaker,
        ProviderMetrics metrics
) {
    public String id() {
        return provider.providerId();
    }
}
