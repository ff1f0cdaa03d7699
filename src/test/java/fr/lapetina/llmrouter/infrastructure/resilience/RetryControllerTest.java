package fr.lapetina.llmrouter.infrastructure.resilience;

import fr.lapetina.llmrouter.domain.model.CircuitState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.domain.routing.RoutingEngine;
import fr.lapetina.llmrouter.domain.routing.RoutingWeights;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llmrouter.support.StubProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

class RetryControllerTest {

    private static final RetryPolicy FAST_RETRIES = new RetryPolicy(
            2, Duration.ofMillis(1), Duration.ofMillis(5), 2.0, false, true, true);

    private StubProvider first;
    private StubProvider second;
    private ProviderRegistry registry;
    private MetricsRegistry metricsRegistry;

    @BeforeEach
    void setUp() {
        // "first" is cheaper, so it is chosen first while both are healthy
        first = new StubProvider("first", 0.00001);
        second = new StubProvider("second", 0.00002);
        registry = ProviderRegistry.builder()
                .register(first)
                .register(second)
                .breakerSettings(new CircuitBreakerSettings(5, 2, Duration.ofSeconds(60), 1))
                .build();
        metricsRegistry = new MetricsRegistry("test");
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    private RetryController controller(RetryPolicy policy) {
        return new RetryController(registry, new RoutingEngine(RoutingWeights.defaults()), policy,
                Duration.ofSeconds(2), metricsRegistry);
    }

    private static CompletionResponse success(CompletableFuture<CompletionResponse> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static LoadBalancerException failure(CompletableFuture<CompletionResponse> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(LoadBalancerException.class);
            return (LoadBalancerException) e.getCause();
        }
        return fail("Expected the dispatch to fail");
    }

    @Test
    @DisplayName("should fail over to the next provider after a rate limit")
    void shouldFailOverAfterRateLimit() throws Exception {
        first.thenRateLimit();

        CompletionResponse response = success(controller(FAST_RETRIES).dispatch(CompletionRequest.ofPrompt("hi")));

        assertThat(response.providerId()).isEqualTo("second");
        assertThat(first.calls()).isEqualTo(1);
        assertThat(second.calls()).isEqualTo(1);
        assertThat(registry.require("first").circuitBreaker().getConsecutiveFailures()).isEqualTo(1);
        assertThat(registry.require("first").metrics().getFailureCount()).isEqualTo(1);
        assertThat(registry.require("second").metrics().getSuccessCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should price a response without cost from tokens and the provider's rate")
    void shouldPriceResponseFromTokens() throws Exception {
        CompletionResponse response = success(controller(FAST_RETRIES).dispatch(CompletionRequest.ofPrompt("hi")));

        assertThat(response.providerId()).isEqualTo("first");
        assertThat(response.costUsd()).isEqualTo(100 * 0.00001);
    }

    @Test
    @DisplayName("should not retry a permanent error")
    void shouldNotRetryPermanentError() throws Exception {
        first.thenFail(LoadBalancerException.invalidRequest("prompt rejected"));

        LoadBalancerException error = failure(controller(FAST_RETRIES).dispatch(CompletionRequest.ofPrompt("hi")));

        assertThat(error.getErrorType()).isEqualTo(ErrorType.INVALID_REQUEST);
        assertThat(first.calls()).isEqualTo(1);
        assertThat(second.calls()).isZero();
    }

    @Test
    @DisplayName("should report MAX_RETRIES_EXCEEDED once every attempt failed")
    void shouldExhaustRetries() throws Exception {
        first.thenServerError().thenServerError();
        second.thenServerError();

        LoadBalancerException error = failure(controller(FAST_RETRIES).dispatch(CompletionRequest.ofPrompt("hi")));

        assertThat(error.getErrorType()).isEqualTo(ErrorType.MAX_RETRIES_EXCEEDED);
        assertThat(error.getCause()).isInstanceOf(LoadBalancerException.class);
        assertThat(first.calls() + second.calls()).isEqualTo(3);
    }

    @Test
    @DisplayName("should report NO_PROVIDERS_AVAILABLE without calling anyone when every breaker is open")
    void shouldFailFastWhenAllBreakersOpen() throws Exception {
        registry.require("first").circuitBreaker().forceState(CircuitState.OPEN);
        registry.require("second").circuitBreaker().forceState(CircuitState.OPEN);

        LoadBalancerException error = failure(controller(FAST_RETRIES).dispatch(CompletionRequest.ofPrompt("hi")));

        assertThat(error.getErrorType()).isEqualTo(ErrorType.NO_PROVIDERS_AVAILABLE);
        assertThat(first.calls()).isZero();
        assertThat(second.calls()).isZero();
    }

    @Test
    @DisplayName("should time out a hanging provider and retry elsewhere")
    void shouldRetryAfterTimeout() throws Exception {
        first.thenHang();
        CompletionRequest request = CompletionRequest.ofPrompt("hi").withTimeout(Duration.ofMillis(50));

        CompletionResponse response = success(controller(FAST_RETRIES).dispatch(request));

        assertThat(response.providerId()).isEqualTo("second");
        assertThat(registry.require("first").circuitBreaker().getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("should surface TIMEOUT when timeouts are not retried")
    void shouldSurfaceTimeoutWhenNotRetried() throws Exception {
        first.thenHang();
        RetryPolicy noTimeoutRetry = new RetryPolicy(
                2, Duration.ofMillis(1), Duration.ofMillis(5), 2.0, false, false, true);
        CompletionRequest request = CompletionRequest.ofPrompt("hi").withTimeout(Duration.ofMillis(50));

        LoadBalancerException error = failure(controller(noTimeoutRetry).dispatch(request));

        assertThat(error.getErrorType()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(second.calls()).isZero();
    }

    @Test
    @DisplayName("should retry the only healthy provider once it has been tried")
    void shouldRetrySameProviderWhenAloneEligible() throws Exception {
        registry.require("second").circuitBreaker().forceState(CircuitState.OPEN);
        first.thenServerError();

        CompletionResponse response = success(controller(FAST_RETRIES).dispatch(CompletionRequest.ofPrompt("hi")));

        assertThat(response.providerId()).isEqualTo("first");
        assertThat(first.calls()).isEqualTo(2);
        assertThat(second.calls()).isZero();
    }

    @Test
    @DisplayName("should retry a failed provider when the other one trips its breaker after the snapshot")
    void shouldRetryFailedProviderAfterLateBreakerRefusal() throws Exception {
        TripwireClock clock = new TripwireClock();
        registry = ProviderRegistry.builder()
                .register(first)
                .register(second)
                .breakerSettings(new CircuitBreakerSettings(5, 2, Duration.ofSeconds(60), 1))
                .clock(clock)
                .build();
        // The next snapshot sees "second" as eligible, then its breaker opens before admission
        first.then(request -> {
            clock.armOnce(() -> registry.require("second").circuitBreaker().forceState(CircuitState.OPEN));
            return CompletableFuture.failedFuture(LoadBalancerException.providerError("first", "HTTP 503", null));
        });

        CompletionResponse response = success(controller(FAST_RETRIES).dispatch(CompletionRequest.ofPrompt("hi")));

        assertThat(response.providerId()).isEqualTo("first");
        assertThat(first.calls()).isEqualTo(2);
        assertThat(second.calls()).isZero();
    }

    @Test
    @DisplayName("should classify timeouts and unexpected exceptions")
    void shouldClassifyFailures() {
        Duration timeout = Duration.ofMillis(250);

        assertThat(RetryController.classify(new CompletionException(new TimeoutException()), "p", timeout)
                .getErrorType()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(RetryController.classify(new IOException("connection reset"), "p", timeout)
                .getErrorType()).isEqualTo(ErrorType.PROVIDER_ERROR);
        assertThat(RetryController.classify(LoadBalancerException.rateLimited("p", "429"), "p", timeout)
                .getErrorType()).isEqualTo(ErrorType.RATE_LIMIT);
    }

    /**
     * System clock that runs a one-shot action on the next read.
     */
    private static final class TripwireClock extends Clock {

        private final AtomicReference<Runnable> onNextRead = new AtomicReference<>();

        void armOnce(Runnable action) {
            onNextRead.set(action);
        }

        @Override
        public Instant instant() {
            Runnable action = onNextRead.getAndSet(null);
            if (action != null) {
                action.run();
            }
            return Instant.now();
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
