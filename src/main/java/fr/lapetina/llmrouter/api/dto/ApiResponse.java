package fr.lapetina.llmrouter.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;

/**
 * Completion response body; error fields are set instead of content on failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {

    private String content;
    private String model;
    private Boolean cached;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("provider_id")
    private String providerId;

    @JsonProperty("tokens_used")
    private Integer tokensUsed;

    @JsonProperty("latency_ms")
    private Long latencyMs;

    @JsonProperty("cost_usd")
    private Double costUsd;

    @JsonProperty("quality_score")
    private Double qualityScore;

    private String error;

    @JsonProperty("error_type")
    private String errorType;

    // Getters and setters
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public Boolean getCached() { return cached; }
    public void setCached(Boolean cached) { this.cached = cached; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public Integer getTokensUsed() { return tokensUsed; }
    public void setTokensUsed(Integer tokensUsed) { this.tokensUsed = tokensUsed; }

    public Long getLatencyMs() { return latencyMs; }
    public void setLatencyMs(Long latencyMs) { this.latencyMs = latencyMs; }

    public Double getCostUsd() { return costUsd; }
    public void setCostUsd(Double costUsd) { this.costUsd = costUsd; }

    public Double getQualityScore() { return qualityScore; }
    public void setQualityScore(Double qualityScore) { this.qualityScore = qualityScore; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }

    /**
     * Creates from domain CompletionResponse.
     */
    public static ApiResponse fromCompletionResponse(CompletionResponse response) {
        ApiResponse api = new ApiResponse();
        api.setRequestId(response.requestId());
        api.setContent(response.content());
        api.setProviderId(response.providerId());
        api.setModel(response.model());
        api.setTokensUsed(response.tokensUsed());
        api.setLatencyMs(response.latencyMs());
        api.setCostUsd(response.costUsd());
        api.setQualityScore(response.qualityScore());
        api.setCached(response.cached());
        return api;
    }

    /**
     * Creates an error response from a routing failure.
     */
    public static ApiResponse fromException(String requestId, LoadBalancerException exception) {
        ApiResponse api = error(requestId, exception.getErrorType().name(), exception.getMessage());
        api.setProviderId(exception.getProviderId());
        return api;
    }

    /**
     * Creates an error response.
     */
    public static ApiResponse error(String requestId, String errorType, String message) {
        ApiResponse api = new ApiResponse();
        api.setRequestId(requestId);
        api.setErrorType(errorType);
        api.setError(message);
        return api;
    }
}
