package fr.lapetina.llmrouter;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.llmrouter.disruptor.handlers.AdmissionHandler;
import fr.lapetina.llmrouter.disruptor.handlers.BudgetHandler;
import fr.lapetina.llmrouter.disruptor.handlers.CacheLookupHandler;
import fr.lapetina.llmrouter.disruptor.handlers.CompletionHandler;
import fr.lapetina.llmrouter.disruptor.handlers.DispatchHandler;
import fr.lapetina.llmrouter.disruptor.handlers.MetricsHandler;
import fr.lapetina.llmrouter.disruptor.handlers.ValidationHandler;
import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.CompletionRequestEventFactory;
import fr.lapetina.llmrouter.domain.model.CircuitState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.domain.model.ProviderHealth;
import fr.lapetina.llmrouter.infrastructure.budget.CostBudgetTracker;
import fr.lapetina.llmrouter.infrastructure.cache.RequestCache;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsCollector;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsSnapshot;
import fr.lapetina.llmrouter.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llmrouter.infrastructure.resilience.RetryController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Public entry point of the router: {@link #complete(CompletionRequest)}.
 *
 * Requests are published to an LMAX Disruptor ring buffer and flow through
 * validate -> cache lookup -> admission -> budget -> dispatch -> metrics -> completion.
 * Dispatch hands the request to the {@link RetryController}, which routes, calls providers and
 * retries asynchronously, so handler threads never wait on the network.
 *
 * PRODUCER TYPE CHOICE: MULTI
 *
 * Requests come from many caller threads concurrently (HTTP handlers, application code).
 *
 * BACKPRESSURE
 *
 * The ring buffer is the bounded intake queue. A full ring buffer, or more than
 * {@code maxConcurrentRequests} requests in dispatch, fails the request with CAPACITY_EXCEEDED
 * instead of blocking the caller.
 */
public final class LoadBalancer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final Disruptor<CompletionRequestEvent> disruptor;
    private final RingBuffer<CompletionRequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ProviderRegistry providerRegistry;
    private final CostBudgetTracker budgetTracker;
    private final RequestCache cache;
    private final MetricsCollector metricsCollector;
    private final AdmissionHandler admissionHandler;

    private LoadBalancer(Builder builder) {
        this.providerRegistry = builder.providerRegistry;
        this.budgetTracker = builder.budgetTracker;
        this.cache = builder.cache;
        this.metricsCollector = builder.metricsCollector;
        MetricsRegistry metricsRegistry = builder.metricsRegistry;

        ThreadFactory threadFactory = new DisruptorThreadFactory("llm-router-handler");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new CompletionRequestEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI, // Multiple caller threads publish concurrently
                waitStrategy
        );

        ValidationHandler validationHandler = new ValidationHandler(builder.maxPromptLength);
        CacheLookupHandler cacheLookupHandler = new CacheLookupHandler(cache, metricsRegistry);
        this.admissionHandler = new AdmissionHandler(builder.maxConcurrentRequests, metricsRegistry);
        BudgetHandler budgetHandler = new BudgetHandler(budgetTracker, providerRegistry, admissionHandler);
        DispatchHandler dispatchHandler = new DispatchHandler(
                builder.retryController, admissionHandler, budgetTracker, cache, metricsCollector);
        MetricsHandler metricsHandler = new MetricsHandler(metricsRegistry, metricsCollector);
        CompletionHandler completionHandler = new CompletionHandler();

        // Handlers run in sequence; each sees an event only after the previous one is done with it
        disruptor
                .handleEventsWith(validationHandler)
                .then(cacheLookupHandler)
                .then(admissionHandler)
                .then(budgetHandler)
                .then(dispatchHandler)
                .then(metricsHandler)
                .then(completionHandler);

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("LoadBalancer created: providers={}, ringBufferSize={}, waitStrategy={}, maxConcurrentRequests={}, cache={}",
                providerRegistry.size(), builder.ringBufferSize, builder.waitStrategy,
                builder.maxConcurrentRequests, cache != null ? "enabled" : "disabled");
    }

    /**
     * Starts the Disruptor processing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("LoadBalancer started");
        }
    }

    /**
     * Routes one completion request.
     *
     * @return a future completing with the response, or exceptionally with a
     *         {@link LoadBalancerException} carrying the terminal {@link ErrorType}
     */
    public CompletableFuture<CompletionResponse> complete(CompletionRequest request) {
        if (!running.get()) {
            return CompletableFuture.failedFuture(
                    new LoadBalancerException(ErrorType.INTERNAL_ERROR, "Load balancer not running"));
        }
        if (request == null) {
            return CompletableFuture.failedFuture(LoadBalancerException.invalidRequest("Request is null"));
        }

        CompletableFuture<CompletionResponse> responseFuture = new CompletableFuture<>();

        // Try to claim a slot in the ring buffer
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.warn("Ring buffer full, request rejected: requestId={}", request.requestId());
            return CompletableFuture.failedFuture(LoadBalancerException.capacityExceeded(
                    "Ring buffer full, remaining capacity: " + ringBuffer.remainingCapacity()));
        }

        try {
            CompletionRequestEvent event = ringBuffer.get(sequence);
            event.initialize(request, responseFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request submitted: requestId={}, sequence={}", request.requestId(), sequence);

        return responseFuture;
    }

    /**
     * Aggregated statistics, including current breaker states and hourly spend.
     */
    public MetricsSnapshot metricsSnapshot() {
        return metricsCollector.snapshot(providerRegistry.circuitStates(), budgetTracker.getSpentThisWindowUsd());
    }

    public List<ProviderHealth> providerHealth() {
        return providerRegistry.healthReport();
    }

    public void overrideCostPerToken(String providerId, double costPerToken) {
        providerRegistry.metricsStore().overrideCostPerToken(providerId, costPerToken);
    }

    /**
     * Feeds an externally computed quality score (0..1) for a provider into routing.
     */
    public void recordQualityScore(String providerId, double score) {
        providerRegistry.metricsStore().recordQualityScore(providerId, score);
    }

    /**
     * Forces a provider's circuit breaker back to CLOSED.
     */
    public void resetCircuitBreaker(String providerId) {
        providerRegistry.require(providerId).circuitBreaker().forceState(CircuitState.CLOSED);
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getInFlight() {
        return admissionHandler.getInFlight();
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public CostBudgetTracker getBudgetTracker() {
        return budgetTracker;
    }

    /**
     * The response cache, or null when caching is disabled.
     */
    public RequestCache getCache() {
        return cache;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Gracefully shuts down the pipeline.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down LoadBalancer...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("LoadBalancer shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("LoadBalancer shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Fails the caller's future when a handler throws.
     */
    private static class PipelineExceptionHandler implements ExceptionHandler<CompletionRequestEvent> {

        private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, CompletionRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            CompletableFuture<CompletionResponse> future = event.getResponseFuture();
            if (future != null && !future.isDone()) {
                future.completeExceptionally(new LoadBalancerException(ErrorType.INTERNAL_ERROR, null,
                        "Pipeline failure: " + ex.getMessage(), ex));
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for LoadBalancer.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxConcurrentRequests = 1000;
        private int maxPromptLength = 100_000;
        private ProviderRegistry providerRegistry;
        private RetryController retryController;
        private CostBudgetTracker budgetTracker;
        private RequestCache cache;
        private MetricsCollector metricsCollector;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder maxConcurrentRequests(int max) {
            this.maxConcurrentRequests = max;
            return this;
        }

        public Builder maxPromptLength(int maxLength) {
            this.maxPromptLength = maxLength;
            return this;
        }

        public Builder providerRegistry(ProviderRegistry registry) {
            this.providerRegistry = registry;
            return this;
        }

        public Builder retryController(RetryController controller) {
            this.retryController = controller;
            return this;
        }

        public Builder budgetTracker(CostBudgetTracker tracker) {
            this.budgetTracker = tracker;
            return this;
        }

        /**
         * Response cache; leave unset (null) to disable caching.
         */
        public Builder cache(RequestCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metricsCollector(MetricsCollector collector) {
            this.metricsCollector = collector;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public LoadBalancer build() {
            Objects.requireNonNull(providerRegistry, "ProviderRegistry is required");
            Objects.requireNonNull(retryController, "RetryController is required");
            Objects.requireNonNull(budgetTracker, "CostBudgetTracker is required");
            Objects.requireNonNull(metricsCollector, "MetricsCollector is required");
            Objects.requireNonNull(metricsRegistry, "MetricsRegistry is required");
            return new LoadBalancer(this);
        }
    }
}
