package fr.lapetina.llmrouter.domain.model;

import java.util.Objects;

/**
 * A successful completion produced by one provider attempt.
 * Immutable; the router derives adjusted copies through the {@code with*} methods.
 *
 * <p>{@code qualityScore} is optional and, when present, lies in [0, 1].
 */
public record CompletionResponse(
        String requestId,
        String content,
        String providerId,
        String model,
        int tokensUsed,
        long latencyMs,
        double costUsd,
        Double qualityScore,
        boolean cached
) {
    public CompletionResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(providerId, "Provider ID is required");
        if (content == null) {
            content = "";
        }
        if (tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed must be >= 0");
        }
    }

    public CompletionResponse withLatency(long latencyMs) {
        return new CompletionResponse(requestId, content, providerId, model, tokensUsed,
                latencyMs, costUsd, qualityScore, cached);
    }

    public CompletionResponse withCost(double costUsd) {
        return new CompletionResponse(requestId, content, providerId, model, tokensUsed,
                latencyMs, costUsd, qualityScore, cached);
    }

    /**
     * Copy served from the cache to another request: new request id, reduced cost, cached flag set.
     */
    public CompletionResponse asCacheHit(String requestId, double costFactor) {
        return new CompletionResponse(requestId, content, providerId, model, tokensUsed,
                latencyMs, costUsd * costFactor, qualityScore, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String content;
        private String providerId;
        private String model;
        private int tokensUsed;
        private long latencyMs;
        private double costUsd;
        private Double qualityScore;
        private boolean cached;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder tokensUsed(int tokensUsed) {
            this.tokensUsed = tokensUsed;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder costUsd(double costUsd) {
            this.costUsd = costUsd;
            return this;
        }

        public Builder qualityScore(Double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder cached(boolean cached) {
            this.cached = cached;
            return this;
        }

        public CompletionResponse build() {
            return new CompletionResponse(requestId, content, providerId, model, tokensUsed,
                    latencyMs, costUsd, qualityScore, cached);
        }
    }
}
