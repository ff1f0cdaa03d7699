package fr.lapetina.llmrouter.domain.model;

import fr.lapetina.llmrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProviderMetricsTest {

    private MutableClock clock;
    private ProviderMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T10:00:00Z");
        metrics = ProviderMetrics.builder()
                .providerId("openai")
                .baseCostPerToken(0.00002)
                .clock(clock)
                .build();
    }

    @Test
    @DisplayName("should start from the documented initial values")
    void shouldStartWithInitialValues() {
        assertThat(metrics.getLatencyEstimateMs()).isEqualTo(100.0);
        assertThat(metrics.getSuccessRate()).isEqualTo(0.99);
        assertThat(metrics.getQualityScore()).isEqualTo(0.85);
        assertThat(metrics.getCostPerToken()).isEqualTo(0.00002);
        assertThat(metrics.getLastSuccess()).isEqualTo(clock.instant());
        assertThat(metrics.getLastProbeHealthy()).isNull();
    }

    @Test
    @DisplayName("should blend latency, success rate and quality on success")
    void shouldBlendOnSuccess() {
        clock.advance(Duration.ofSeconds(5));

        metrics.recordSuccess(300, 0.5);

        assertThat(metrics.getLatencyEstimateMs()).isCloseTo(0.9 * 100 + 0.1 * 300, within(1e-9));
        assertThat(metrics.getSuccessRate()).isCloseTo(0.99 * 0.99 + 0.01, within(1e-12));
        assertThat(metrics.getQualityScore()).isCloseTo(0.9 * 0.85 + 0.1 * 0.5, within(1e-12));
        assertThat(metrics.getLastSuccess()).isEqualTo(clock.instant());
        assertThat(metrics.getSuccessCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should leave quality untouched when a success carries no score")
    void shouldKeepQualityWithoutScore() {
        metrics.recordSuccess(50, null);

        assertThat(metrics.getQualityScore()).isEqualTo(0.85);
    }

    @Test
    @DisplayName("should lower the success rate without touching latency on failure")
    void shouldBlendOnFailure() {
        metrics.recordFailure();

        assertThat(metrics.getSuccessRate()).isCloseTo(0.99 * 0.99, within(1e-12));
        assertThat(metrics.getLatencyEstimateMs()).isEqualTo(100.0);
        assertThat(metrics.getFailureCount()).isEqualTo(1);
        assertThat(metrics.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should clamp quality scores into [0, 1]")
    void shouldClampQuality() {
        metrics.recordQualityScore(7.0);

        assertThat(metrics.getQualityScore()).isCloseTo(0.9 * 0.85 + 0.1, within(1e-12));
    }

    @Test
    @DisplayName("should accept a cost override but refuse a negative one")
    void shouldOverrideCost() {
        metrics.overrideCostPerToken(0.00001);

        assertThat(metrics.getCostPerToken()).isEqualTo(0.00001);
        assertThat(metrics.getBaseCostPerToken()).isEqualTo(0.00002);
        assertThatThrownBy(() -> metrics.overrideCostPerToken(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should keep every update under concurrent writers")
    void shouldNotLoseConcurrentUpdates() throws Exception {
        Thread[] writers = new Thread[8];
        for (int i = 0; i < writers.length; i++) {
            writers[i] = new Thread(() -> {
                for (int n = 0; n < 1000; n++) {
                    metrics.recordSuccess(100, null);
                }
            });
            writers[i].start();
        }
        for (Thread writer : writers) {
            writer.join();
        }

        assertThat(metrics.getSuccessCount()).isEqualTo(8000);
        assertThat(metrics.getLatencyEstimateMs()).isCloseTo(100.0, within(1e-6));
        assertThat(metrics.getSuccessRate()).isBetween(0.99, 1.0);
    }
}
