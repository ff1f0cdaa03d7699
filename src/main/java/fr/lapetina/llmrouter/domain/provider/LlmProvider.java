package fr.lapetina.llmrouter.domain.provider;

import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Capability every provider backend exposes to the router.
 *
 * <p>Implementations must not block the calling thread in {@link #complete}: the call is
 * issued from a pipeline handler and the router waits on the returned future. Failures
 * should complete the future exceptionally with a
 * {@link fr.lapetina.llmrouter.domain.model.LoadBalancerException} carrying the matching
 * error type; any other exception is treated as a transient provider error.
 *
 * <p>The router measures latency itself and prices responses whose cost is not positive as
 * {@code tokensUsed * costPerToken}.
 */
public interface LlmProvider {

    /**
     * Unique, stable identifier of this provider.
     */
    String providerId();

    /**
     * Issues one completion call.
     */
    CompletableFuture<CompletionResponse> complete(CompletionRequest request);

    /**
     * Cheap liveness probe. Completes with false rather than exceptionally when unhealthy.
     */
    CompletableFuture<Boolean> healthCheck();

    List<String> supportedModels();

    /**
     * Price in USD of one token, before any model size multiplier.
     */
    double baseCostPerToken();
}
