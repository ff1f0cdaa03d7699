package fr.lapetina.llmrouter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LlmRouterApplicationTest {

    @Test
    @DisplayName("should take the config path from the first argument")
    void shouldPreferArgument() {
        assertThat(LlmRouterApplication.resolveConfigPath(new String[]{"/etc/router.yaml"}, "env.yaml"))
                .isEqualTo("/etc/router.yaml");
    }

    @Test
    @DisplayName("should fall back to the environment variable")
    void shouldUseEnvironment() {
        assertThat(LlmRouterApplication.resolveConfigPath(new String[0], "env.yaml")).isEqualTo("env.yaml");
        assertThat(LlmRouterApplication.resolveConfigPath(new String[]{" "}, "env.yaml")).isEqualTo("env.yaml");
    }

    @Test
    @DisplayName("should default to config.yaml")
    void shouldDefault() {
        assertThat(LlmRouterApplication.resolveConfigPath(new String[0], null)).isEqualTo("config.yaml");
        assertThat(LlmRouterApplication.resolveConfigPath(new String[0], "")).isEqualTo("config.yaml");
    }
}
