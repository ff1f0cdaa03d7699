package fr.lapetina.llmrouter.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A completion request to be routed to one of the registered providers.
 * Immutable and thread-safe.
 *
 * <p>{@code maxTokens}, {@code temperature}, {@code modelPreference} and {@code timeout} are
 * optional; a null timeout means the router's configured default applies.
 */
public record CompletionRequest(
        String requestId,
        String prompt,
        Integer maxTokens,
        Double temperature,
        ModelSize modelPreference,
        RequestPriority priority,
        Duration timeout,
        Instant createdAt
) {
    /** Output budget assumed when the request does not set one */
    public static final int DEFAULT_MAX_TOKENS = 1000;

    public CompletionRequest {
        Objects.requireNonNull(prompt, "Prompt is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (priority == null) {
            priority = RequestPriority.NORMAL;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Creates a normal-priority request with every option left to its default.
     */
    public static CompletionRequest ofPrompt(String prompt) {
        return new CompletionRequest(null, prompt, null, null, null, null, null, null);
    }

    public int effectiveMaxTokens() {
        return maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS;
    }

    public CompletionRequest withTimeout(Duration timeout) {
        return new CompletionRequest(requestId, prompt, maxTokens, temperature,
                modelPreference, priority, timeout, createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String prompt;
        private Integer maxTokens;
        private Double temperature;
        private ModelSize modelPreference;
        private RequestPriority priority;
        private Duration timeout;
        private Instant createdAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder modelPreference(ModelSize modelPreference) {
            this.modelPreference = modelPreference;
            return this;
        }

        public Builder priority(RequestPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public CompletionRequest build() {
            return new CompletionRequest(requestId, prompt, maxTokens, temperature,
                    modelPreference, priority, timeout, createdAt);
        }
    }
}
