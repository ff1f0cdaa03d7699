package fr.lapetina.llmrouter.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.ModelSize;
import fr.lapetina.llmrouter.domain.model.RequestPriority;

import java.time.Duration;
import java.util.Locale;

/**
 * Completion request body accepted by {@code POST /v1/completions}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiRequest {

    private String prompt;
    private Double temperature;
    private String priority;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("model_size")
    private String modelSize;

    @JsonProperty("timeout_ms")
    private Long timeoutMs;

    @JsonProperty("request_id")
    private String requestId;

    // Getters and setters
    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public Integer getMaxTokens() { return maxTokens; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

    public String getModelSize() { return modelSize; }
    public void setModelSize(String modelSize) { this.modelSize = modelSize; }

    public Long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(Long timeoutMs) { this.timeoutMs = timeoutMs; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    /**
     * Converts to domain CompletionRequest.
     *
     * @throws IllegalArgumentException on an unknown model size or priority, or a missing prompt
     */
    public CompletionRequest toCompletionRequest() {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt is required");
        }
        return CompletionRequest.builder()
                .requestId(requestId)
                .prompt(prompt)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .modelPreference(modelSize != null ? ModelSize.valueOf(modelSize.toUpperCase(Locale.ROOT)) : null)
                .priority(priority != null ? RequestPriority.valueOf(priority.toUpperCase(Locale.ROOT)) : null)
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                .build();
    }
}
