package fr.lapetina.llmrouter.domain.model;

/**
 * Error taxonomy for completion requests.
 * Each type knows whether a retry against another provider may succeed.
 */
public enum ErrorType {
    /** No provider was eligible at selection time */
    NO_PROVIDERS_AVAILABLE(false),

    /** The chosen provider's circuit breaker refused the call */
    CIRCUIT_BREAKER_OPEN(false),

    /** Provider throttled the call (HTTP 429 or equivalent) */
    RATE_LIMIT(true),

    /** Provider did not answer within the per-call timeout */
    TIMEOUT(true),

    /** Provider-side failure (5xx, broken connection, unreadable body) */
    PROVIDER_ERROR(true),

    /** Every allowed attempt failed with a transient error */
    MAX_RETRIES_EXCEEDED(false),

    /** Dispatch would push hourly spend over the configured ceiling */
    COST_BUDGET_EXCEEDED(false),

    /** Malformed request, rejected by validation or by the provider */
    INVALID_REQUEST(false),

    /** Provider rejected our credentials */
    AUTHENTICATION(false),

    /** Too many requests in flight, or the intake ring buffer is full */
    CAPACITY_EXCEEDED(false),

    /** Unexpected failure inside the router */
    INTERNAL_ERROR(false);

    private final boolean retryable;

    ErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Returns true for errors that may succeed when retried, possibly on another provider.
     */
    public boolean isTransient() {
        return retryable;
    }
}
