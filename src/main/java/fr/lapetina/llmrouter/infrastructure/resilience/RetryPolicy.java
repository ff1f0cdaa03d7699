package fr.lapetina.llmrouter.infrastructure.resilience;

import fr.lapetina.llmrouter.domain.model.ErrorType;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry budget and exponential backoff.
 *
 * @param maxRetries       retries after the first attempt, so at most {@code maxRetries + 1} calls
 * @param jitter           adds up to 30% uniform random delay on top of the computed backoff
 * @param retryOnTimeout   when false, timeouts fail the request immediately
 * @param retryOnRateLimit when false, rate limits fail the request immediately
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        double multiplier,
        boolean jitter,
        boolean retryOnTimeout,
        boolean retryOnRateLimit
) {
    static final double MAX_JITTER_RATIO = 0.3;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelay == null || baseDelay.isNegative() || maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(5000), 2.0, true, true, true);
    }

    /**
     * Delay before the retry that follows failed attempt number {@code attempt} (0-based):
     * {@code min(maxDelay, baseDelay * multiplier^attempt)}, plus jitter when enabled.
     */
    public Duration backoffDelay(int attempt) {
        double raw = baseDelay.toMillis() * Math.pow(multiplier, attempt);
        long delayMs = (long) Math.min(maxDelay.toMillis(), raw);
        if (jitter && delayMs > 0) {
            delayMs += (long) (ThreadLocalRandom.current().nextDouble() * MAX_JITTER_RATIO * delayMs);
        }
        return Duration.ofMillis(delayMs);
    }

    /**
     * Whether a failure of this type may be retried under this policy.
     */
    public boolean isRetryable(ErrorType errorType) {
        if (!errorType.isTransient()) {
            return false;
        }
        if (errorType == ErrorType.TIMEOUT) {
            return retryOnTimeout;
        }
        if (errorType == ErrorType.RATE_LIMIT) {
            return retryOnRateLimit;
        }
        return true;
    }
}
