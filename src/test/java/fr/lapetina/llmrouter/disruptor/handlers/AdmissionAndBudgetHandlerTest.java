package fr.lapetina.llmrouter.disruptor.handlers;

import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.domain.model.ModelSize;
import fr.lapetina.llmrouter.infrastructure.budget.CostBudgetTracker;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llmrouter.support.MutableClock;
import fr.lapetina.llmrouter.support.StubProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AdmissionAndBudgetHandlerTest {

    private MetricsRegistry metricsRegistry;
    private MutableClock clock;
    private ProviderRegistry providerRegistry;

    @BeforeEach
    void setUp() {
        metricsRegistry = new MetricsRegistry("test");
        clock = MutableClock.at("2024-01-01T10:00:00Z");
        providerRegistry = ProviderRegistry.builder()
                .register(new StubProvider("cheap", 0.001))
                .register(new StubProvider("pricey", 0.01))
                .clock(clock)
                .build();
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    private static CompletionRequestEvent cacheMissEvent(CompletionRequest request) {
        CompletionRequestEvent event = new CompletionRequestEvent();
        event.initialize(request, new CompletableFuture<>());
        event.markValidated();
        event.markCacheMiss();
        return event;
    }

    @Test
    @DisplayName("should reject requests beyond the in-flight limit")
    void shouldRejectBeyondLimit() {
        AdmissionHandler admission = new AdmissionHandler(2, metricsRegistry);

        CompletionRequestEvent first = cacheMissEvent(CompletionRequest.ofPrompt("one"));
        CompletionRequestEvent second = cacheMissEvent(CompletionRequest.ofPrompt("two"));
        CompletionRequestEvent third = cacheMissEvent(CompletionRequest.ofPrompt("three"));
        admission.onEvent(first, 0, false);
        admission.onEvent(second, 1, false);
        admission.onEvent(third, 2, true);

        assertThat(first.getState()).isEqualTo(EventState.ADMITTED);
        assertThat(second.getState()).isEqualTo(EventState.ADMITTED);
        assertThat(third.getState()).isEqualTo(EventState.CAPACITY_REJECTED);
        assertThat(third.getError().getErrorType()).isEqualTo(ErrorType.CAPACITY_EXCEEDED);
        assertThat(admission.getInFlight()).isEqualTo(2);

        admission.releaseSlot();
        CompletionRequestEvent fourth = cacheMissEvent(CompletionRequest.ofPrompt("four"));
        admission.onEvent(fourth, 3, true);
        assertThat(fourth.getState()).isEqualTo(EventState.ADMITTED);
    }

    @Test
    @DisplayName("should reserve the estimate at the cheapest provider's rate")
    void shouldReserveCheapestEstimate() {
        AdmissionHandler admission = new AdmissionHandler(10, metricsRegistry);
        CostBudgetTracker tracker = new CostBudgetTracker(100.0, clock);
        BudgetHandler budget = new BudgetHandler(tracker, providerRegistry, admission);

        CompletionRequestEvent event = cacheMissEvent(CompletionRequest.ofPrompt("hello"));
        admission.onEvent(event, 0, true);
        budget.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.BUDGET_RESERVED);
        // 0.001 per token * 1.2 unspecified size * 1000 default tokens
        assertThat(event.getBudgetReservation().amountUsd()).isCloseTo(1.2, within(1e-9));
        assertThat(tracker.getSpentThisWindowUsd()).isCloseTo(1.2, within(1e-9));
    }

    @Test
    @DisplayName("should reject over budget and give the admission slot back")
    void shouldRejectOverBudget() {
        AdmissionHandler admission = new AdmissionHandler(10, metricsRegistry);
        CostBudgetTracker tracker = new CostBudgetTracker(100.0, clock);
        tracker.settle(tracker.tryReserve(99.0), 99.0);
        BudgetHandler budget = new BudgetHandler(tracker, providerRegistry, admission);

        // Estimate is 0.001 * 1.0 * 2000 = $2, which would take spend from $99 to $101
        CompletionRequestEvent event = cacheMissEvent(CompletionRequest.builder()
                .prompt("hello")
                .maxTokens(2000)
                .modelPreference(ModelSize.SMALL)
                .build());
        admission.onEvent(event, 0, true);
        budget.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.BUDGET_REJECTED);
        assertThat(event.getError().getErrorType()).isEqualTo(ErrorType.COST_BUDGET_EXCEEDED);
        assertThat(admission.getInFlight()).isZero();
    }
}
