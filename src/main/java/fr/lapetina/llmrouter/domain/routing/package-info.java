/**
 * Provider selection.
 *
 * <p>{@link fr.lapetina.llmrouter.domain.routing.RoutingEngine} is a pure function of a request
 * and a {@link fr.lapetina.llmrouter.domain.routing.RoutingSnapshot}: the same snapshot always
 * yields the same choice, and ties go to the provider registered first.
 *
 * <h2>Score</h2>
 * <pre>
 * overall = w_cost * cost + w_latency * latency + w_quality * quality + w_reliability * reliability
 * </pre>
 */
package fr.lapetina.llmrouter.domain.routing;
