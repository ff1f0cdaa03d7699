package fr.lapetina.llmrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.infrastructure.cache.RequestCache;
import fr.lapetina.llmrouter.infrastructure.cache.RequestFingerprint;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Second stage handler: answers repeated requests from the {@link RequestCache}.
 *
 * Computes the request fingerprint (kept on the event so dispatch can populate the cache) and
 * short-circuits the pipeline on a hit. With caching disabled every request is a miss.
 */
public final class CacheLookupHandler implements EventHandler<CompletionRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CacheLookupHandler.class);

    private final RequestCache cache;
    private final MetricsRegistry metricsRegistry;

    /**
     * @param cache the cache, or null when caching is disabled
     */
    public CacheLookupHandler(RequestCache cache, MetricsRegistry metricsRegistry) {
        this.cache = cache;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(CompletionRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.VALIDATED) {
            return;
        }

        if (cache == null) {
            event.markCacheMiss();
            return;
        }

        CompletionRequest request = event.getRequest();
        String fingerprint = RequestFingerprint.of(request);
        event.setFingerprint(fingerprint);

        Optional<CompletionResponse> hit = cache.get(fingerprint);
        metricsRegistry.recordCacheLookup(hit.isPresent());

        if (hit.isPresent()) {
            CompletionResponse response = hit.get().asCacheHit(request.requestId(), 1.0);
            event.markCacheHit(response);
            log.debug("Cache hit: requestId={}, providerId={}, costUsd={}",
                    request.requestId(), response.providerId(), response.costUsd());
        } else {
            event.markCacheMiss();
        }
    }
}
