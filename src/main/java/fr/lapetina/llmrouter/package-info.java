/**
 * LLM Router - in-process routing of completion requests across several LLM providers.
 *
 * <p>Each request is scored against every eligible provider on cost, latency, quality and
 * reliability, dispatched to the best one behind a per-provider circuit breaker, and retried on
 * another provider when it fails transiently. Intake runs on an LMAX Disruptor ring buffer.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmrouter.LoadBalancerFactory} - Main entry point for creating
 *       a fully-configured router from YAML configuration</li>
 *   <li>{@link fr.lapetina.llmrouter.LoadBalancer} - Request intake, {@code complete(request)}</li>
 *   <li>{@link fr.lapetina.llmrouter.LlmRouterApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (LoadBalancerFactory factory = LoadBalancerFactory.create("config.yaml").start()) {
 *     LoadBalancer loadBalancer = factory.getLoadBalancer();
 *
 *     CompletionRequest request = CompletionRequest.ofPrompt("Hello!");
 *     CompletionResponse response = loadBalancer.complete(request).get();
 *     System.out.println(response.content());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Weighted multi-criteria provider scoring</li>
 *   <li>Circuit breaker per provider with half-open trials</li>
 *   <li>Retries on other providers with exponential backoff</li>
 *   <li>Response cache with TTL and discounted hit cost</li>
 *   <li>Hourly spend ceiling</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.llmrouter.LoadBalancerFactory
 * @see fr.lapetina.llmrouter.LoadBalancer
 */
package fr.lapetina.llmrouter;
