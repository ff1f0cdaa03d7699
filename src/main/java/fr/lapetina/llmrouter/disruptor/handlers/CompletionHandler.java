package fr.lapetina.llmrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Final stage handler: completes requests answered inside the pipeline and recycles the event.
 *
 * Responsibilities:
 * - Completes the caller's future for cache hits and pre-dispatch rejections
 * - Leaves dispatched requests alone; their future completes from the dispatch callback
 * - Clears the event for reuse
 */
public final class CompletionHandler implements EventHandler<CompletionRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(CompletionRequestEvent event, long sequence, boolean endOfBatch) {
        try {
            complete(event);
        } finally {
            // Clear event for reuse (important for memory efficiency)
            event.clear();
        }
    }

    private void complete(CompletionRequestEvent event) {
        CompletableFuture<CompletionResponse> future = event.getResponseFuture();
        EventState state = event.getState();
        if (future == null || state == EventState.DISPATCHED) {
            return;
        }

        String requestId = event.getRequest() != null ? event.getRequest().requestId() : "unknown";

        if (state == EventState.CACHE_HIT) {
            future.complete(event.getCachedResponse());
            log.info("Request served from cache: requestId={}, providerId={}, costUsd={}",
                    requestId, event.getCachedResponse().providerId(), event.getCachedResponse().costUsd());
            return;
        }

        LoadBalancerException error = event.getError();
        if (error == null) {
            // Every non-terminal state must have been moved forward by an earlier stage
            error = new LoadBalancerException(ErrorType.INTERNAL_ERROR,
                    "Request left the pipeline in state " + state);
            log.error("Request stuck in pipeline: requestId={}, state={}", requestId, state);
        }
        future.completeExceptionally(error);

        log.info("Request rejected: requestId={}, state={}, errorType={}",
                requestId, state, error.getErrorType());
    }
}
