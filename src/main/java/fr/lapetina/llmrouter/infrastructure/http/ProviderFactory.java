package fr.lapetina.llmrouter.infrastructure.http;

import fr.lapetina.llmrouter.domain.model.ModelSize;
import fr.lapetina.llmrouter.domain.provider.LlmProvider;
import fr.lapetina.llmrouter.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.llmrouter.infrastructure.config.LoadBalancerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Creates provider adapters from configuration, keyed by the provider's {@code type}.
 */
public final class ProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    private static final Map<String, BiFunction<LoadBalancerConfig.ProviderConfig, LoadBalancerConfig.TimeoutsConfig, LlmProvider>>
            REGISTRY = new ConcurrentHashMap<>();

    static {
        // Register built-in adapters
        register("openai-compatible", ProviderFactory::openAiCompatible);
    }

    private ProviderFactory() {
        // Utility class
    }

    /**
     * Registers a custom adapter type.
     *
     * @param type    Adapter type (used in configuration)
     * @param creator Builds an adapter from its provider section and the global timeouts
     */
    public static void register(
            String type,
            BiFunction<LoadBalancerConfig.ProviderConfig, LoadBalancerConfig.TimeoutsConfig, LlmProvider> creator
    ) {
        REGISTRY.put(type.toLowerCase(Locale.ROOT), creator);
    }

    /**
     * Creates the adapter for one provider section.
     *
     * @throws ConfigurationException if the type is unknown or the section is incomplete
     */
    public static LlmProvider create(
            LoadBalancerConfig.ProviderConfig providerConfig,
            LoadBalancerConfig.TimeoutsConfig timeouts
    ) {
        String type = Optional.ofNullable(providerConfig.getType()).orElse("openai-compatible");
        var creator = REGISTRY.get(type.toLowerCase(Locale.ROOT));
        if (creator == null) {
            throw new ConfigurationException("Unknown provider type '" + type + "' for provider " + providerConfig.getId());
        }
        try {
            LlmProvider provider = creator.apply(providerConfig, timeouts);
            log.debug("Created provider: providerId={}, type={}", provider.providerId(), type);
            return provider;
        } catch (NullPointerException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid provider configuration for " + providerConfig.getId()
                    + ": " + e.getMessage(), e);
        }
    }

    private static LlmProvider openAiCompatible(
            LoadBalancerConfig.ProviderConfig providerConfig,
            LoadBalancerConfig.TimeoutsConfig timeouts
    ) {
        OpenAiCompatibleProvider.Builder builder = OpenAiCompatibleProvider.builder()
                .providerId(providerConfig.getId())
                .baseUrl(providerConfig.getBaseUrl())
                .defaultModel(providerConfig.getDefaultModel())
                .costPerToken(providerConfig.getCostPerToken())
                .connectTimeout(Duration.ofMillis(timeouts.getConnectTimeoutMs()))
                .healthCheckTimeout(Duration.ofMillis(timeouts.getHealthCheckTimeoutMs()));

        if (providerConfig.getApiKeyEnv() != null) {
            String apiKey = System.getenv(providerConfig.getApiKeyEnv());
            if (apiKey == null || apiKey.isBlank()) {
                log.warn("API key variable not set: providerId={}, variable={}",
                        providerConfig.getId(), providerConfig.getApiKeyEnv());
            }
            builder.apiKey(apiKey);
        }

        for (Map.Entry<String, String> entry : providerConfig.getModels().entrySet()) {
            builder.model(ModelSize.valueOf(entry.getKey().toUpperCase(Locale.ROOT)), entry.getValue());
        }
        return builder.build();
    }
}
