/**
 * Configuration loading.
 *
 * <p>The YAML file is parsed with SnakeYAML into a mutable bean tree and validated once at
 * startup. Nothing is reloaded at runtime.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.config.LoadBalancerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.llmrouter.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, worker threads)</li>
 *   <li>{@code providers} - Provider backends, their models and prices</li>
 *   <li>{@code routing} - Score weights</li>
 *   <li>{@code circuitBreaker} - Per-provider breaker thresholds</li>
 *   <li>{@code retry} - Retry policy configuration</li>
 *   <li>{@code cache} - Response cache TTL, size and hit pricing</li>
 *   <li>{@code budget} - Hourly spend ceiling</li>
 *   <li>{@code limits} - Concurrent request limit</li>
 *   <li>{@code disruptor} - Ring buffer and wait strategy settings</li>
 *   <li>{@code timeouts} - Request and connection timeouts</li>
 *   <li>{@code healthCheck} - Background probe settings</li>
 *   <li>{@code metrics} - Prometheus prefix and latency window</li>
 * </ul>
 *
 * @see fr.lapetina.llmrouter.infrastructure.config.LoadBalancerConfig
 * @see fr.lapetina.llmrouter.infrastructure.config.ConfigLoader
 */
package fr.lapetina.llmrouter.infrastructure.config;
