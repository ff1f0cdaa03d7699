package fr.lapetina.llmrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsCollector;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;

/**
 * Sixth stage handler: records intake metrics and tracing information.
 *
 * Records:
 * - Request count by pipeline state
 * - Stage latencies up to dispatch
 * - Outcomes of requests answered inside the pipeline (cache hits and rejections); dispatched
 *   requests are recorded by the dispatch callback once they complete
 * - Sets MDC context for structured logging
 */
public final class MetricsHandler implements EventHandler<CompletionRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;
    private final MetricsCollector metricsCollector;

    public MetricsHandler(MetricsRegistry metricsRegistry, MetricsCollector metricsCollector) {
        this.metricsRegistry = metricsRegistry;
        this.metricsCollector = metricsCollector;
    }

    @Override
    public void onEvent(CompletionRequestEvent event, long sequence, boolean endOfBatch) {
        setupMDC(event);

        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(CompletionRequestEvent event) {
        if (event.getRequest() != null) {
            MDC.put("requestId", event.getRequest().requestId());
            MDC.put("priority", event.getRequest().priority().name());
        }
        MDC.put("eventState", event.getState() != null ? event.getState().name() : "UNKNOWN");
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("priority");
        MDC.remove("eventState");
    }

    private void recordMetrics(CompletionRequestEvent event) {
        EventState state = event.getState();
        if (state == null) {
            return;
        }
        String providerId = event.getCachedResponse() != null ? event.getCachedResponse().providerId() : "none";

        // Record request count
        metricsRegistry.incrementRequestCount(providerId, state);

        // Record stage-specific timings
        recordStage("validation", event.getAcceptedAt(), event.getValidatedAt());
        recordStage("cache_lookup", event.getValidatedAt(), event.getCacheCheckedAt());
        recordStage("admission", event.getCacheCheckedAt(), event.getAdmittedAt());
        recordStage("queue", event.getAcceptedAt(), event.getDispatchedAt());

        if (state == EventState.CACHE_HIT) {
            metricsCollector.recordCacheHit(event.getCachedResponse());
        } else if (event.isTerminal() && event.getError() != null) {
            metricsCollector.recordFailure(event.getError().getErrorType(), null, -1);

            log.warn("Request rejected before dispatch: state={}, errorType={}, message={}",
                    state, event.getError().getErrorType(), event.getError().getMessage());
        }
    }

    private void recordStage(String stage, Instant from, Instant to) {
        if (from != null && to != null) {
            metricsRegistry.recordStageLatency(stage, Duration.between(from, to));
        }
    }
}
