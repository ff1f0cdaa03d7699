package fr.lapetina.llmrouter.disruptor.handlers;

import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationHandlerTest {

    private ValidationHandler handler;
    private CompletionRequestEvent event;

    @BeforeEach
    void setUp() {
        handler = new ValidationHandler(10000);
        event = new CompletionRequestEvent();
    }

    @Test
    @DisplayName("should validate valid prompt request")
    void shouldValidateValidPromptRequest() {
        event.initialize(CompletionRequest.ofPrompt("Hello, world!"), new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATED);
        assertThat(event.getError()).isNull();
        assertThat(event.getSequence()).isZero();
    }

    @Test
    @DisplayName("should reject null request")
    void shouldRejectNullRequest() {
        event.initialize(null, new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getError().getErrorType()).isEqualTo(ErrorType.INVALID_REQUEST);
    }

    @Test
    @DisplayName("should reject blank prompt")
    void shouldRejectBlankPrompt() {
        event.initialize(CompletionRequest.ofPrompt("   "), new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getError().getMessage()).contains("blank");
    }

    @Test
    @DisplayName("should reject prompt exceeding max length")
    void shouldRejectLongPrompt() {
        handler = new ValidationHandler(10);
        event.initialize(CompletionRequest.ofPrompt("A".repeat(100)), new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getError().getMessage()).contains("maximum length");
    }

    @Test
    @DisplayName("should reject non-positive max tokens")
    void shouldRejectNonPositiveMaxTokens() {
        event.initialize(CompletionRequest.builder().prompt("Hello").maxTokens(0).build(),
                new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getError().getMessage()).contains("maxTokens");
    }

    @Test
    @DisplayName("should reject temperature out of range")
    void shouldRejectTemperatureOutOfRange() {
        event.initialize(CompletionRequest.builder().prompt("Hello").temperature(2.5).build(),
                new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getError().getMessage()).contains("temperature");
    }

    @Test
    @DisplayName("should reject zero timeout")
    void shouldRejectZeroTimeout() {
        event.initialize(CompletionRequest.builder().prompt("Hello").timeout(Duration.ZERO).build(),
                new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
    }

    @Test
    @DisplayName("should skip already rejected events")
    void shouldSkipRejectedEvents() {
        event.initialize(CompletionRequest.ofPrompt("Hello"), new CompletableFuture<>());
        event.setState(EventState.CAPACITY_REJECTED);

        handler.onEvent(event, 0, true);

        // State should remain CAPACITY_REJECTED, not changed to VALIDATED
        assertThat(event.getState()).isEqualTo(EventState.CAPACITY_REJECTED);
    }
}
