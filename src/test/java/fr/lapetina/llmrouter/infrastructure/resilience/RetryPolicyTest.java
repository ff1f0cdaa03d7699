package fr.lapetina.llmrouter.infrastructure.resilience;

import fr.lapetina.llmrouter.domain.model.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private static RetryPolicy policy(boolean jitter) {
        return new RetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(1000), 2.0, jitter, true, true);
    }

    @Nested
    @DisplayName("Backoff")
    class Backoff {

        @Test
        @DisplayName("should grow exponentially from the base delay")
        void shouldGrowExponentially() {
            RetryPolicy policy = policy(false);

            assertThat(policy.backoffDelay(0)).isEqualTo(Duration.ofMillis(100));
            assertThat(policy.backoffDelay(1)).isEqualTo(Duration.ofMillis(200));
            assertThat(policy.backoffDelay(2)).isEqualTo(Duration.ofMillis(400));
            assertThat(policy.backoffDelay(3)).isEqualTo(Duration.ofMillis(800));
        }

        @Test
        @DisplayName("should cap the delay at maxDelay")
        void shouldCapAtMaxDelay() {
            RetryPolicy policy = policy(false);

            assertThat(policy.backoffDelay(4)).isEqualTo(Duration.ofMillis(1000));
            assertThat(policy.backoffDelay(30)).isEqualTo(Duration.ofMillis(1000));
        }

        @Test
        @DisplayName("should add at most 30% jitter on top of the computed delay")
        void shouldBoundJitter() {
            RetryPolicy policy = policy(true);

            for (int i = 0; i < 500; i++) {
                assertThat(policy.backoffDelay(1).toMillis()).isBetween(200L, 260L);
                assertThat(policy.backoffDelay(10).toMillis()).isBetween(1000L, 1300L);
            }
        }

        @Test
        @DisplayName("should keep a zero base delay at zero")
        void shouldKeepZeroDelay() {
            RetryPolicy policy = new RetryPolicy(2, Duration.ZERO, Duration.ofMillis(500), 2.0, true, true, true);

            assertThat(policy.backoffDelay(3)).isEqualTo(Duration.ZERO);
        }
    }

    @Nested
    @DisplayName("Retryable errors")
    class Retryable {

        @Test
        @DisplayName("should retry transient errors by default")
        void shouldRetryTransientErrors() {
            RetryPolicy policy = RetryPolicy.defaults();

            assertThat(policy.isRetryable(ErrorType.RATE_LIMIT)).isTrue();
            assertThat(policy.isRetryable(ErrorType.TIMEOUT)).isTrue();
            assertThat(policy.isRetryable(ErrorType.PROVIDER_ERROR)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = ErrorType.class, names = {"RATE_LIMIT", "TIMEOUT", "PROVIDER_ERROR"},
                mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("should never retry permanent errors")
        void shouldNotRetryPermanentErrors(ErrorType errorType) {
            assertThat(RetryPolicy.defaults().isRetryable(errorType)).isFalse();
        }

        @Test
        @DisplayName("should honour the timeout and rate limit switches")
        void shouldHonourSwitches() {
            RetryPolicy noTimeouts = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 2.0, false, false, true);
            RetryPolicy noRateLimits = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 2.0, false, true, false);

            assertThat(noTimeouts.isRetryable(ErrorType.TIMEOUT)).isFalse();
            assertThat(noTimeouts.isRetryable(ErrorType.RATE_LIMIT)).isTrue();
            assertThat(noRateLimits.isRetryable(ErrorType.RATE_LIMIT)).isFalse();
            assertThat(noRateLimits.isRetryable(ErrorType.PROVIDER_ERROR)).isTrue();
        }
    }

    @Test
    @DisplayName("should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, 2.0, false, true, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(-1), Duration.ZERO, 2.0, false, true, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.5, false, true, true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
