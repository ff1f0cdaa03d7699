package fr.lapetina.llmrouter.infrastructure.health;

import fr.lapetina.llmrouter.domain.model.CircuitState;
import fr.lapetina.llmrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llmrouter.support.StubProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderHealthCheckerTest {

    private StubProvider up;
    private StubProvider down;
    private ProviderRegistry registry;
    private ProviderHealthChecker checker;

    @BeforeEach
    void setUp() {
        up = new StubProvider("up", 0.00001);
        down = new StubProvider("down", 0.00001);
        down.setHealthy(false);
        registry = ProviderRegistry.builder().register(up).register(down).build();
        checker = new ProviderHealthChecker(registry, Duration.ofMinutes(5), Duration.ofSeconds(1));
    }

    @AfterEach
    void tearDown() {
        checker.close();
    }

    @Test
    @DisplayName("should record the probe result of every provider")
    void shouldRecordProbeResults() {
        assertThat(registry.require("up").metrics().getLastProbeHealthy()).isNull();

        checker.checkAllProviders();

        assertThat(registry.require("up").metrics().getLastProbeHealthy()).isTrue();
        assertThat(registry.require("down").metrics().getLastProbeHealthy()).isFalse();
    }

    @Test
    @DisplayName("should track a provider recovering between probes")
    void shouldTrackRecovery() {
        checker.checkAllProviders();
        down.setHealthy(true);

        checker.checkAllProviders();

        assertThat(registry.require("down").metrics().getLastProbeHealthy()).isTrue();
    }

    @Test
    @DisplayName("should leave circuit breakers untouched")
    void shouldNotTouchBreakers() {
        checker.checkAllProviders();

        assertThat(registry.require("down").circuitBreaker().getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.require("down").circuitBreaker().getConsecutiveFailures()).isZero();
        assertThat(down.calls()).isZero();
    }
}
