package fr.lapetina.llmrouter.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String MINIMAL = """
            providers:
              - id: openai
                baseUrl: "https://api.openai.com/v1"
                defaultModel: gpt-4o-mini
                costPerToken: 0.00001
            """;

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    private static LoadBalancerConfig load(String content) {
        return new ConfigLoader("unused.yaml").loadFromStream(yaml(content));
    }

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        LoadBalancerConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getProviders())
                .extracting(LoadBalancerConfig.ProviderConfig::getId)
                .containsExactly("primary", "secondary");
        assertThat(config.getProviders().get(0).getInitialQualityScore()).isEqualTo(0.9);
        assertThat(config.getCircuitBreaker().getFailureThreshold()).isEqualTo(3);
        assertThat(config.getRetry().isJitter()).isFalse();
        assertThat(config.getBudget().getHourlyLimitUsd()).isEqualTo(1.0);
        assertThat(config.getDisruptor().getRingBufferSize()).isEqualTo(64);
        assertThat(config.getHealthCheck().isEnabled()).isFalse();
    }

    @Test
    @DisplayName("should prefer a file on disk over the classpath")
    void shouldLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("router.yaml");
        Files.writeString(file, MINIMAL);

        LoadBalancerConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getProviders()).hasSize(1);
        assertThat(config.getProviders().get(0).getId()).isEqualTo("openai");
    }

    @Test
    @DisplayName("should apply defaults for every omitted section")
    void shouldApplyDefaults() {
        LoadBalancerConfig config = load(MINIMAL);

        LoadBalancerConfig.ProviderConfig provider = config.getProviders().get(0);
        assertThat(provider.getType()).isEqualTo("openai-compatible");
        assertThat(provider.getInitialQualityScore()).isEqualTo(0.85);
        assertThat(provider.isEnabled()).isTrue();
        assertThat(config.getRouting().getWeights().getLatency()).isEqualTo(0.4);
        assertThat(config.getCache().getTtlSeconds()).isEqualTo(3600);
        assertThat(config.getCache().getHitCostReduction()).isEqualTo(0.05);
        assertThat(config.getBudget().getHourlyLimitUsd()).isNull();
        assertThat(config.getTimeouts().getRequestTimeoutMs()).isEqualTo(30000);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("llm_router");
        assertThat(config.getServer().getPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("should map model sizes to model names")
    void shouldReadModelMap() {
        LoadBalancerConfig config = load("""
                providers:
                  - id: mistral
                    baseUrl: "https://api.mistral.ai/v1"
                    models:
                      small: mistral-small-latest
                      large: mistral-large-latest
                """);

        assertThat(config.getProviders().get(0).getModels())
                .containsEntry("small", "mistral-small-latest")
                .containsEntry("large", "mistral-large-latest");
    }

    @Test
    @DisplayName("should fail when the file cannot be found anywhere")
    void shouldFailWhenMissing() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should reject an empty document")
    void shouldRejectEmptyDocument() {
        assertThatThrownBy(() -> load(""))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("should reject malformed YAML")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> load("providers: [unclosed"))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Invalid configuration");
    }

    @Test
    @DisplayName("should require at least one provider")
    void shouldRequireProvider() {
        assertThatThrownBy(() -> load("budget:\n  hourlyLimitUsd: 10.0\n"))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("At least one provider");
    }

    @Test
    @DisplayName("should reject duplicate provider ids")
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> load(MINIMAL + """
                  - id: openai
                    baseUrl: "https://example.com/v1"
                    defaultModel: other
                """))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Duplicate provider id");
    }

    @Test
    @DisplayName("should reject a ring buffer size that is not a power of two")
    void shouldRejectRingBufferSize() {
        assertThatThrownBy(() -> load(MINIMAL + "disruptor:\n  ringBufferSize: 1000\n"))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("power of 2");
    }

    @Test
    @DisplayName("should reject a cache hit cost reduction outside [0, 1]")
    void shouldRejectCostReduction() {
        assertThatThrownBy(() -> load(MINIMAL + "cache:\n  hitCostReduction: 1.5\n"))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("hitCostReduction");
    }

    @Test
    @DisplayName("should reject negative routing weights")
    void shouldRejectNegativeWeights() {
        assertThatThrownBy(() -> load(MINIMAL + "routing:\n  weights:\n    cost: -0.1\n"))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("weights");
    }
}
