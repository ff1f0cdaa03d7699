package fr.lapetina.llmrouter.domain.routing;

import fr.lapetina.llmrouter.domain.model.CircuitState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.domain.model.ModelSize;
import fr.lapetina.llmrouter.domain.model.RequestPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RoutingEngineTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private RoutingEngine engine;
    private CompletionRequest request;

    @BeforeEach
    void setUp() {
        engine = new RoutingEngine(RoutingWeights.defaults());
        request = CompletionRequest.builder()
                .requestId("req-1")
                .prompt("Summarize this paragraph")
                .maxTokens(100)
                .build();
    }

    private static ProviderSnapshot provider(String id, int order, double costPerToken, double latencyMs,
                                             CircuitState state) {
        return new ProviderSnapshot(id, order, costPerToken, latencyMs, 0.85, 0.99, NOW,
                state, state != CircuitState.OPEN);
    }

    private static RoutingSnapshot snapshot(ProviderSnapshot... providers) {
        return new RoutingSnapshot(NOW, List.of(providers));
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("should pick the highest scoring provider and never an open one")
        void shouldPickBestClosedProvider() {
            RoutingSnapshot snapshot = snapshot(
                    provider("a", 0, 0.002, 50, CircuitState.CLOSED),
                    provider("b", 1, 0.0015, 300, CircuitState.CLOSED),
                    provider("c", 2, 0.0001, 10, CircuitState.OPEN)
            );

            ProviderScore selected = engine.select(request, snapshot);
            ProviderScore a = engine.score(request, snapshot.providers().get(0), NOW);
            ProviderScore b = engine.score(request, snapshot.providers().get(1), NOW);

            assertThat(selected.providerId()).isNotEqualTo("c");
            assertThat(selected.providerId()).isEqualTo(a.overall() > b.overall() ? "a" : "b");
            // The faster provider outweighs a 25% cheaper one under default weights
            assertThat(selected.providerId()).isEqualTo("a");
        }

        @Test
        @DisplayName("should make the same choice for the same snapshot")
        void shouldBeDeterministic() {
            RoutingSnapshot snapshot = snapshot(
                    provider("a", 0, 0.002, 120, CircuitState.CLOSED),
                    provider("b", 1, 0.0015, 130, CircuitState.HALF_OPEN)
            );

            ProviderScore first = engine.select(request, snapshot);
            for (int i = 0; i < 100; i++) {
                assertThat(engine.select(request, snapshot)).isEqualTo(first);
            }
        }

        @Test
        @DisplayName("should prefer the earlier registered provider on ties")
        void shouldBreakTiesByRegistrationOrder() {
            RoutingSnapshot snapshot = snapshot(
                    provider("first", 0, 0.001, 100, CircuitState.CLOSED),
                    provider("second", 1, 0.001, 100, CircuitState.CLOSED)
            );

            assertThat(engine.select(request, snapshot).providerId()).isEqualTo("first");
            assertThat(engine.rank(request, snapshot))
                    .extracting(ProviderScore::providerId)
                    .containsExactly("first", "second");
        }

        @Test
        @DisplayName("should skip excluded providers")
        void shouldSkipExcluded() {
            RoutingSnapshot snapshot = snapshot(
                    provider("a", 0, 0.002, 50, CircuitState.CLOSED),
                    provider("b", 1, 0.0015, 300, CircuitState.CLOSED)
            );

            assertThat(engine.select(request, snapshot, Set.of("a")).providerId()).isEqualTo("b");
            assertThat(engine.trySelect(request, snapshot, Set.of("a", "b"))).isEmpty();
        }

        @Test
        @DisplayName("should treat a half-open provider without free trial slots as ineligible")
        void shouldSkipProvidersThatRefuseCalls() {
            ProviderSnapshot saturated = new ProviderSnapshot("a", 0, 0.0001, 10, 0.99, 0.99, NOW,
                    CircuitState.HALF_OPEN, false);
            RoutingSnapshot snapshot = snapshot(saturated, provider("b", 1, 0.002, 400, CircuitState.CLOSED));

            assertThat(engine.select(request, snapshot).providerId()).isEqualTo("b");
        }

        @Test
        @DisplayName("should fail with NO_PROVIDERS_AVAILABLE when nothing is eligible")
        void shouldFailWhenNothingEligible() {
            RoutingSnapshot snapshot = snapshot(
                    provider("a", 0, 0.002, 50, CircuitState.OPEN),
                    provider("b", 1, 0.0015, 300, CircuitState.OPEN)
            );

            assertThatThrownBy(() -> engine.select(request, snapshot))
                    .isInstanceOf(LoadBalancerException.class)
                    .extracting(e -> ((LoadBalancerException) e).getErrorType())
                    .isEqualTo(ErrorType.NO_PROVIDERS_AVAILABLE);
        }
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("should estimate cost with the unspecified size multiplier and default max tokens")
        void shouldEstimateDefaultCost() {
            CompletionRequest plain = CompletionRequest.ofPrompt("hello");

            assertThat(RoutingEngine.estimateCost(plain, 0.00001)).isCloseTo(0.012, within(1e-12));
        }

        @Test
        @DisplayName("should apply the model size multiplier to the estimate")
        void shouldApplyModelSizeMultiplier() {
            CompletionRequest large = CompletionRequest.builder()
                    .prompt("hello")
                    .maxTokens(500)
                    .modelPreference(ModelSize.LARGE)
                    .build();

            assertThat(RoutingEngine.estimateCost(large, 0.00001)).isCloseTo(0.01, within(1e-12));
        }

        @Test
        @DisplayName("should score the reference cost at exactly one half")
        void shouldScoreReferenceCostAtHalf() {
            CompletionRequest large = CompletionRequest.builder()
                    .prompt("hello")
                    .maxTokens(500)
                    .modelPreference(ModelSize.LARGE)
                    .build();

            ProviderScore score = engine.score(large, provider("a", 0, 0.00001, 0, CircuitState.CLOSED), NOW);

            assertThat(score.costScore()).isCloseTo(0.5, within(1e-9));
            assertThat(score.latencyScore()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should use a tighter latency target for high priority requests")
        void shouldUseTighterTargetForHighPriority() {
            ProviderSnapshot slow = provider("a", 0, 0.001, 200, CircuitState.CLOSED);
            CompletionRequest urgent = CompletionRequest.builder()
                    .prompt("hello")
                    .priority(RequestPriority.CRITICAL)
                    .build();

            double normal = engine.score(request, slow, NOW).latencyScore();
            double high = engine.score(urgent, slow, NOW).latencyScore();

            assertThat(normal).isCloseTo(0.5, within(1e-9));
            assertThat(high).isCloseTo(100.0 / 300.0, within(1e-9));
        }

        @Test
        @DisplayName("should decay reliability with time since the last success")
        void shouldDecayReliability() {
            ProviderSnapshot stale = new ProviderSnapshot("a", 0, 0.001, 100, 0.85, 1.0,
                    NOW.minusSeconds(300), CircuitState.CLOSED, true);
            ProviderSnapshot never = new ProviderSnapshot("b", 1, 0.001, 100, 0.85, 1.0,
                    null, CircuitState.CLOSED, true);

            assertThat(engine.score(request, stale, NOW).reliabilityScore())
                    .isCloseTo(Math.exp(-1), within(1e-9));
            assertThat(engine.score(request, never, NOW).reliabilityScore()).isZero();
        }

        @Test
        @DisplayName("should combine the dimensions with the configured weights")
        void shouldCombineWithWeights() {
            RoutingEngine qualityOnly = new RoutingEngine(new RoutingWeights(0, 0, 1, 0));
            ProviderSnapshot provider = new ProviderSnapshot("a", 0, 0.001, 100, 0.7, 0.99, NOW,
                    CircuitState.CLOSED, true);

            assertThat(qualityOnly.score(request, provider, NOW).overall()).isCloseTo(0.7, within(1e-9));
        }
    }
}
