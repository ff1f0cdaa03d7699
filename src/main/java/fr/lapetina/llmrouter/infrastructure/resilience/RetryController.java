package fr.lapetina.llmrouter.infrastructure.resilience;

import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.domain.routing.ProviderScore;
import fr.lapetina.llmrouter.domain.routing.RoutingEngine;
import fr.lapetina.llmrouter.domain.routing.RoutingSnapshot;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llmrouter.infrastructure.registry.RegisteredProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches a request to providers with selection, breaker admission, timeout and retry.
 *
 * Per attempt:
 * 1. Snapshot all providers and let the {@link RoutingEngine} pick one, skipping providers
 *    that already failed or refused this request. Once every eligible provider has failed
 *    the exclusion of failed providers is lifted, so a lone healthy provider can still be
 *    retried. Providers whose breaker refused stay excluded.
 * 2. Acquire a breaker permit. If the breaker tripped since the snapshot, the provider is
 *    skipped without consuming an attempt.
 * 3. Call the provider with the per-call timeout; a late result is discarded.
 * 4. Report the outcome exactly once to the provider's breaker and metrics.
 * 5. On a retryable failure, schedule the next attempt after the backoff delay.
 *
 * Nothing blocks: backoff uses a delayed executor and provider calls are futures.
 */
public final class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final ProviderRegistry registry;
    private final RoutingEngine routingEngine;
    private final RetryPolicy policy;
    private final Duration defaultTimeout;
    private final MetricsRegistry metricsRegistry;
    private final Executor retryExecutor;

    public RetryController(
            ProviderRegistry registry,
            RoutingEngine routingEngine,
            RetryPolicy policy,
            Duration defaultTimeout,
            MetricsRegistry metricsRegistry
    ) {
        this(registry, routingEngine, policy, defaultTimeout, metricsRegistry, ForkJoinPool.commonPool());
    }

    public RetryController(
            ProviderRegistry registry,
            RoutingEngine routingEngine,
            RetryPolicy policy,
            Duration defaultTimeout,
            MetricsRegistry metricsRegistry,
            Executor retryExecutor
    ) {
        this.registry = registry;
        this.routingEngine = routingEngine;
        this.policy = policy;
        this.defaultTimeout = defaultTimeout;
        this.metricsRegistry = metricsRegistry;
        this.retryExecutor = retryExecutor;
        log.info("RetryController initialized: maxRetries={}, baseDelayMs={}, maxDelayMs={}, multiplier={}, jitter={}",
                policy.maxRetries(), policy.baseDelay().toMillis(), policy.maxDelay().toMillis(),
                policy.multiplier(), policy.jitter());
    }

    /**
     * Dispatches the request, retrying transient failures on other providers.
     *
     * @return a future completing with the response, or exceptionally with a
     *         {@link LoadBalancerException} describing the terminal outcome
     */
    public CompletableFuture<CompletionResponse> dispatch(CompletionRequest request) {
        CompletableFuture<CompletionResponse> result = new CompletableFuture<>();
        attempt(new DispatchState(request), result);
        return result;
    }

    private void attempt(DispatchState state, CompletableFuture<CompletionResponse> result) {
        try {
            tryNextProvider(state, result);
        } catch (RuntimeException e) {
            log.error("Dispatch failed unexpectedly: requestId={}", state.request.requestId(), e);
            result.completeExceptionally(new LoadBalancerException(ErrorType.INTERNAL_ERROR, null,
                    "Dispatch failed: " + e.getMessage(), e));
        }
    }

    private void tryNextProvider(DispatchState state, CompletableFuture<CompletionResponse> result) {
        CompletionRequest request = state.request;

        while (true) {
            RoutingSnapshot snapshot = registry.snapshot();
            Optional<ProviderScore> choice = choose(state, snapshot);

            if (choice.isEmpty()) {
                LoadBalancerException failure;
                if (state.lastError != null) {
                    failure = state.lastError;
                } else if (!state.refused.isEmpty()) {
                    failure = LoadBalancerException.circuitOpen(state.lastRejectedProvider);
                } else {
                    failure = LoadBalancerException.noProvidersAvailable();
                }
                log.warn("No provider left: requestId={}, attempts={}, errorType={}",
                        request.requestId(), state.attempts, failure.getErrorType());
                result.completeExceptionally(failure);
                return;
            }

            RegisteredProvider target = registry.require(choice.get().providerId());
            Optional<CircuitBreaker.Permit> permit = target.circuitBreaker().tryAcquirePermission();
            if (permit.isEmpty()) {
                // Breaker tripped between snapshot and admission, pick another without using an attempt
                state.refused.add(target.id());
                state.lastRejectedProvider = target.id();
                log.debug("Circuit breaker refused call: requestId={}, providerId={}",
                        request.requestId(), target.id());
                continue;
            }

            call(state, target, permit.get(), result);
            return;
        }
    }

    private Optional<ProviderScore> choose(DispatchState state, RoutingSnapshot snapshot) {
        Set<String> excluded = new HashSet<>(state.failed);
        excluded.addAll(state.refused);
        Optional<ProviderScore> fresh = routingEngine.trySelect(state.request, snapshot, excluded);
        if (fresh.isPresent() || state.failed.isEmpty()) {
            return fresh;
        }
        // Every eligible provider already failed once for this request
        return routingEngine.trySelect(state.request, snapshot, state.refused);
    }

    private void call(
            DispatchState state,
            RegisteredProvider target,
            CircuitBreaker.Permit permit,
            CompletableFuture<CompletionResponse> result
    ) {
        CompletionRequest request = state.request;
        Duration timeout = request.timeout() != null ? request.timeout() : defaultTimeout;
        int attemptNumber = state.attempts++;
        long startNanos = System.nanoTime();

        log.debug("Attempt started: requestId={}, providerId={}, attempt={}, timeoutMs={}",
                request.requestId(), target.id(), attemptNumber + 1, timeout.toMillis());

        CompletableFuture<CompletionResponse> providerCall;
        try {
            providerCall = target.provider().complete(request);
            if (providerCall == null) {
                providerCall = CompletableFuture.failedFuture(LoadBalancerException.providerError(
                        target.id(), "provider returned no future", null));
            }
        } catch (RuntimeException e) {
            providerCall = CompletableFuture.failedFuture(e);
        }

        providerCall
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((response, throwable) -> {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                    try {
                        if (throwable == null && response != null) {
                            onSuccess(state, target, permit, response, latencyMs, result);
                        } else {
                            LoadBalancerException error = classify(throwable, target.id(), timeout);
                            onFailure(state, target, permit, error, latencyMs, result);
                        }
                    } catch (RuntimeException e) {
                        log.error("Outcome handling failed: requestId={}, providerId={}",
                                request.requestId(), target.id(), e);
                        result.completeExceptionally(new LoadBalancerException(ErrorType.INTERNAL_ERROR,
                                target.id(), "Outcome handling failed: " + e.getMessage(), e));
                    }
                });
    }

    private void onSuccess(
            DispatchState state,
            RegisteredProvider target,
            CircuitBreaker.Permit permit,
            CompletionResponse response,
            long latencyMs,
            CompletableFuture<CompletionResponse> result
    ) {
        CompletionResponse measured = response.withLatency(latencyMs);
        if (measured.costUsd() <= 0) {
            measured = measured.withCost(measured.tokensUsed() * target.metrics().getCostPerToken());
        }

        target.circuitBreaker().recordSuccess(permit);
        registry.metricsStore().recordSuccess(target.id(), latencyMs, measured.qualityScore());
        metricsRegistry.incrementAttemptCount(target.id(), "success");

        log.debug("Attempt succeeded: requestId={}, providerId={}, attempt={}, latencyMs={}, tokens={}",
                state.request.requestId(), target.id(), state.attempts, latencyMs, measured.tokensUsed());
        result.complete(measured);
    }

    private void onFailure(
            DispatchState state,
            RegisteredProvider target,
            CircuitBreaker.Permit permit,
            LoadBalancerException error,
            long latencyMs,
            CompletableFuture<CompletionResponse> result
    ) {
        target.circuitBreaker().recordFailure(permit);
        registry.metricsStore().recordFailure(target.id());
        metricsRegistry.incrementAttemptCount(target.id(), error.getErrorType().name());

        state.failed.add(target.id());
        state.lastError = error;

        String requestId = state.request.requestId();
        if (!policy.isRetryable(error.getErrorType())) {
            log.warn("Attempt failed permanently: requestId={}, providerId={}, attempt={}, errorType={}, message={}",
                    requestId, target.id(), state.attempts, error.getErrorType(), error.getMessage());
            result.completeExceptionally(error);
            return;
        }

        if (state.attempts > policy.maxRetries()) {
            log.warn("Retries exhausted: requestId={}, providerId={}, attempts={}, errorType={}",
                    requestId, target.id(), state.attempts, error.getErrorType());
            result.completeExceptionally(LoadBalancerException.maxRetriesExceeded(state.attempts, error));
            return;
        }

        Duration delay = policy.backoffDelay(state.attempts - 1);
        log.warn("Attempt failed, retrying: requestId={}, providerId={}, attempt={}, errorType={}, latencyMs={}, backoffMs={}",
                requestId, target.id(), state.attempts, error.getErrorType(), latencyMs, delay.toMillis());

        Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, retryExecutor);
        delayed.execute(() -> attempt(state, result));
    }

    /**
     * Maps a provider failure onto the router's error taxonomy.
     */
    static LoadBalancerException classify(Throwable throwable, String providerId, Duration timeout) {
        Throwable cause = unwrap(throwable);
        if (cause == null) {
            return LoadBalancerException.providerError(providerId, "empty response", null);
        }
        if (cause instanceof LoadBalancerException lbe) {
            return lbe;
        }
        if (cause instanceof TimeoutException) {
            return LoadBalancerException.timeout(providerId, timeout.toMillis());
        }
        return LoadBalancerException.providerError(providerId,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * Per-request retry bookkeeping. Accessed by one stage at a time; each stage is ordered
     * after the previous one by future completion.
     */
    private static final class DispatchState {
        private final CompletionRequest request;
        private final Set<String> failed = new LinkedHashSet<>();
        private final Set<String> refused = new LinkedHashSet<>();
        private int attempts;
        private String lastRejectedProvider;
        private LoadBalancerException lastError;

        private DispatchState(CompletionRequest request) {
            this.request = request;
        }
    }
}
