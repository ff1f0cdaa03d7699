package fr.lapetina.llmrouter.infrastructure.resilience;

import java.time.Clock;
import java.time.Duration;

/**
 * Thresholds shared by every provider's circuit breaker.
 */
public record CircuitBreakerSettings(
        int failureThreshold,
        int successThreshold,
        Duration openTimeout,
        int halfOpenMaxCalls
) {
    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(
                CircuitBreaker.DEFAULT_FAILURE_THRESHOLD,
                CircuitBreaker.DEFAULT_SUCCESS_THRESHOLD,
                CircuitBreaker.DEFAULT_OPEN_TIMEOUT,
                CircuitBreaker.DEFAULT_HALF_OPEN_MAX_CALLS);
    }

    public CircuitBreaker create(String providerId, Clock clock) {
        return new CircuitBreaker(providerId, failureThreshold, successThreshold,
                openTimeout, halfOpenMaxCalls, clock);
    }
}
