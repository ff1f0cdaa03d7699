package fr.lapetina.llmrouter;

import fr.lapetina.llmrouter.api.HttpServer;
import fr.lapetina.llmrouter.infrastructure.config.LoadBalancerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the LLM router.
 *
 * The configuration file is the first argument, else the {@code LLM_ROUTER_CONFIG}
 * environment variable, else {@code config.yaml}.
 */
public class LlmRouterApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmRouterApplication.class);

    static final String CONFIG_ENV = "LLM_ROUTER_CONFIG";

    private final LoadBalancerFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public LlmRouterApplication(String configPath) throws Exception {
        log.info("Starting LLM router...");

        // Create and start the load balancer
        this.factory = LoadBalancerFactory.create(configPath).start();

        // Create HTTP server
        LoadBalancerConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                server.getThreads(),
                factory.getLoadBalancer(),
                factory.getMetricsRegistry()
        );

        log.info("LLM router initialized");
    }

    public void start() {
        httpServer.start();
        log.info("LLM router started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public LoadBalancerFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down LLM router...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("LLM router shut down");
    }

    static String resolveConfigPath(String[] args, String envValue) {
        if (args.length > 0 && !args[0].isBlank()) {
            return args[0];
        }
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return "config.yaml";
    }

    public static void main(String[] args) {
        String configPath = resolveConfigPath(args, System.getenv(CONFIG_ENV));

        try {
            LlmRouterApplication app = new LlmRouterApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start LLM router", e);
            System.exit(1);
        }
    }
}
