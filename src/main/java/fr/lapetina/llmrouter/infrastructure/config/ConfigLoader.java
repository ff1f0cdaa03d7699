package fr.lapetina.llmrouter.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;

/**
 * Loads the router configuration once at startup.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation of the loaded values before any component is built
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(LoadBalancerConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public LoadBalancerConfig load() {
        LoadBalancerConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private LoadBalancerConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private LoadBalancerConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public LoadBalancerConfig loadFromStream(InputStream inputStream) {
        LoadBalancerConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private LoadBalancerConfig parse(InputStream is, String source) {
        try {
            LoadBalancerConfig config = yaml.load(is);
            if (config == null) {
                throw new ConfigurationException("Configuration is empty: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the values the components would otherwise reject one by one at startup.
     */
    static void validate(LoadBalancerConfig config) {
        if (config.getProviders() == null || config.getProviders().isEmpty()) {
            throw new ConfigurationException("At least one provider must be configured");
        }

        Set<String> ids = new HashSet<>();
        for (LoadBalancerConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getId() == null || provider.getId().isBlank()) {
                throw new ConfigurationException("Provider id is required");
            }
            if (!ids.add(provider.getId())) {
                throw new ConfigurationException("Duplicate provider id: " + provider.getId());
            }
            if (provider.getCostPerToken() < 0) {
                throw new ConfigurationException("costPerToken must be >= 0 for provider " + provider.getId());
            }
            if (provider.getInitialQualityScore() < 0 || provider.getInitialQualityScore() > 1) {
                throw new ConfigurationException("initialQualityScore must be in [0, 1] for provider " + provider.getId());
            }
        }

        LoadBalancerConfig.WeightsConfig weights = config.getRouting().getWeights();
        if (weights.getCost() < 0 || weights.getLatency() < 0
                || weights.getQuality() < 0 || weights.getReliability() < 0) {
            throw new ConfigurationException("Routing weights must be >= 0");
        }

        LoadBalancerConfig.CircuitBreakerConfig breaker = config.getCircuitBreaker();
        if (breaker.getFailureThreshold() < 1 || breaker.getSuccessThreshold() < 1
                || breaker.getHalfOpenMaxCalls() < 1 || breaker.getTimeoutMs() < 0) {
            throw new ConfigurationException("Circuit breaker thresholds must be >= 1 and timeout >= 0");
        }

        double reduction = config.getCache().getHitCostReduction();
        if (reduction < 0 || reduction > 1) {
            throw new ConfigurationException("cache.hitCostReduction must be in [0, 1]");
        }

        int ringBufferSize = config.getDisruptor().getRingBufferSize();
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("disruptor.ringBufferSize must be a power of 2: " + ringBufferSize);
        }

        if (config.getLimits().getMaxConcurrentRequests() < 1) {
            throw new ConfigurationException("limits.maxConcurrentRequests must be >= 1");
        }
        if (config.getTimeouts().getRequestTimeoutMs() <= 0) {
            throw new ConfigurationException("timeouts.requestTimeoutMs must be > 0");
        }
        if (config.getMetrics().getWindowSize() < 1) {
            throw new ConfigurationException("metrics.windowSize must be >= 1");
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
