package fr.lapetina.llmrouter.domain.model;

import java.util.Locale;

/**
 * The single typed failure surfaced by the router.
 *
 * Callers receive either a {@link CompletionResponse} or one of these, carrying the
 * {@link ErrorType} of the terminal outcome and, when known, the provider involved.
 */
public class LoadBalancerException extends RuntimeException {

    private final ErrorType errorType;
    private final String providerId;

    public LoadBalancerException(ErrorType errorType, String message) {
        this(errorType, null, message, null);
    }

    public LoadBalancerException(ErrorType errorType, String providerId, String message) {
        this(errorType, providerId, message, null);
    }

    public LoadBalancerException(ErrorType errorType, String providerId, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.providerId = providerId;
    }

    public static LoadBalancerException noProvidersAvailable() {
        return new LoadBalancerException(ErrorType.NO_PROVIDERS_AVAILABLE,
                "No eligible provider: every circuit breaker is open or out of trial calls");
    }

    public static LoadBalancerException circuitOpen(String providerId) {
        return new LoadBalancerException(ErrorType.CIRCUIT_BREAKER_OPEN, providerId,
                "Circuit breaker open for provider " + providerId);
    }

    public static LoadBalancerException rateLimited(String providerId, String detail) {
        return new LoadBalancerException(ErrorType.RATE_LIMIT, providerId,
                "Rate limited by provider " + providerId + ": " + detail);
    }

    public static LoadBalancerException timeout(String providerId, long timeoutMs) {
        return new LoadBalancerException(ErrorType.TIMEOUT, providerId,
                "Provider " + providerId + " did not answer within " + timeoutMs + "ms");
    }

    public static LoadBalancerException providerError(String providerId, String detail, Throwable cause) {
        return new LoadBalancerException(ErrorType.PROVIDER_ERROR, providerId,
                "Provider " + providerId + " failed: " + detail, cause);
    }

    public static LoadBalancerException invalidRequest(String detail) {
        return new LoadBalancerException(ErrorType.INVALID_REQUEST, detail);
    }

    public static LoadBalancerException maxRetriesExceeded(int attempts, LoadBalancerException last) {
        return new LoadBalancerException(ErrorType.MAX_RETRIES_EXCEEDED,
                last != null ? last.getProviderId() : null,
                "All " + attempts + " attempts failed, last error: "
                        + (last != null ? last.getMessage() : "unknown"),
                last);
    }

    public static LoadBalancerException costBudgetExceeded(double spentUsd, double estimateUsd, double ceilingUsd) {
        return new LoadBalancerException(ErrorType.COST_BUDGET_EXCEEDED, String.format(Locale.ROOT,
                "Hourly budget exceeded: spent=$%.4f, estimate=$%.4f, ceiling=$%.2f",
                spentUsd, estimateUsd, ceilingUsd));
    }

    public static LoadBalancerException capacityExceeded(String detail) {
        return new LoadBalancerException(ErrorType.CAPACITY_EXCEEDED, detail);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Provider involved in the failure, or null when the failure happened before dispatch.
     */
    public String getProviderId() {
        return providerId;
    }

    public boolean isTransient() {
        return errorType.isTransient();
    }
}
