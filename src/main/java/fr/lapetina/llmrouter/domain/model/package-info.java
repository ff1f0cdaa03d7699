/**
 * Domain model classes representing core concepts of the router.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.CompletionRequest} - Immutable request to be routed</li>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.CompletionResponse} - Immutable response from a provider or the cache</li>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.ProviderMetrics} - Thread-safe smoothed metrics of one provider</li>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.ErrorType} - Error taxonomy, transient or permanent</li>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.LoadBalancerException} - The only exception crossing the public boundary</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Requests and responses are immutable records. {@code ProviderMetrics} keeps every field in
 * an atomic and never locks; readers may see values from slightly different moments.
 */
package fr.lapetina.llmrouter.domain.model;
