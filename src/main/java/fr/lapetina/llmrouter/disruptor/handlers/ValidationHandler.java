package fr.lapetina.llmrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: validates incoming completion requests.
 *
 * Validates:
 * - Request is not null
 * - Prompt is present and within the configured length
 * - maxTokens, when set, is positive
 * - temperature, when set, lies in [0, 2]
 * - timeout, when set, is positive
 */
public final class ValidationHandler implements EventHandler<CompletionRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    static final double MAX_TEMPERATURE = 2.0;

    private final int maxPromptLength;

    public ValidationHandler(int maxPromptLength) {
        this.maxPromptLength = maxPromptLength;
    }

    /**
     * Creates a handler with the default prompt length limit.
     */
    public static ValidationHandler withDefaults() {
        return new ValidationHandler(100_000);
    }

    @Override
    public void onEvent(CompletionRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            log.debug("Skipping already processed event: sequence={}", sequence);
            return;
        }

        event.setSequence(sequence);
        CompletionRequest request = event.getRequest();

        try {
            validate(request);
            event.markValidated();

            log.debug("Request validated: requestId={}, priority={}, sequence={}",
                    request.requestId(), request.priority(), sequence);

        } catch (ValidationException e) {
            event.reject(EventState.VALIDATION_FAILED, LoadBalancerException.invalidRequest(e.getMessage()));

            log.warn("Validation failed: requestId={}, reason={}, sequence={}",
                    request != null ? request.requestId() : "null",
                    e.getMessage(),
                    sequence);
        }
    }

    private void validate(CompletionRequest request) throws ValidationException {
        if (request == null) {
            throw new ValidationException("Request is null");
        }

        String prompt = request.prompt();
        if (prompt == null || prompt.isBlank()) {
            throw new ValidationException("Prompt must not be blank");
        }
        if (prompt.length() > maxPromptLength) {
            throw new ValidationException("Prompt exceeds maximum length of " + maxPromptLength);
        }

        if (request.maxTokens() != null && request.maxTokens() <= 0) {
            throw new ValidationException("maxTokens must be positive");
        }

        Double temperature = request.temperature();
        if (temperature != null
                && (temperature.isNaN() || temperature < 0.0 || temperature > MAX_TEMPERATURE)) {
            throw new ValidationException("temperature must be within [0, " + MAX_TEMPERATURE + "]");
        }

        if (request.timeout() != null && (request.timeout().isNegative() || request.timeout().isZero())) {
            throw new ValidationException("timeout must be positive");
        }
    }

    private static class ValidationException extends Exception {
        ValidationException(String message) {
            super(message);
        }
    }
}
