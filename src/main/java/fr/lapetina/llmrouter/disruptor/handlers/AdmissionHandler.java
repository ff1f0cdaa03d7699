package fr.lapetina.llmrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Third stage handler: bounds the number of requests dispatched at the same time.
 *
 * A request beyond {@code maxConcurrentRequests} is rejected with CAPACITY_EXCEEDED rather than
 * queued; the ring buffer in front of the pipeline is the only queue. Slots are released when the
 * dispatched request completes, or by a later stage that rejects the request.
 */
public final class AdmissionHandler implements EventHandler<CompletionRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(AdmissionHandler.class);

    // Threshold for warning about approaching capacity (percentage)
    private static final double CAPACITY_WARNING_THRESHOLD = 0.8;

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final int maxConcurrentRequests;
    private final MetricsRegistry metricsRegistry;
    private volatile boolean capacityWarningLogged = false;

    public AdmissionHandler(int maxConcurrentRequests, MetricsRegistry metricsRegistry) {
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("maxConcurrentRequests must be >= 1");
        }
        this.maxConcurrentRequests = maxConcurrentRequests;
        this.metricsRegistry = metricsRegistry;
        log.info("AdmissionHandler initialized: maxConcurrentRequests={}", maxConcurrentRequests);
    }

    @Override
    public void onEvent(CompletionRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.CACHE_MISS) {
            return;
        }

        if (!tryAcquireSlot()) {
            int current = inFlight.get();
            event.reject(EventState.CAPACITY_REJECTED, LoadBalancerException.capacityExceeded(
                    "In-flight limit reached: " + current + "/" + maxConcurrentRequests));
            log.warn("Request rejected for capacity: requestId={}, inFlight={}, max={}",
                    event.getRequest().requestId(), current, maxConcurrentRequests);
            return;
        }

        int current = inFlight.get();
        checkCapacityThreshold(current);
        metricsRegistry.setGlobalInFlight(current);
        event.markAdmitted();

        log.debug("Request admitted: requestId={}, inFlight={}/{}",
                event.getRequest().requestId(), current, maxConcurrentRequests);
    }

    private boolean tryAcquireSlot() {
        while (true) {
            int current = inFlight.get();
            if (current >= maxConcurrentRequests) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private void checkCapacityThreshold(int current) {
        double utilization = (double) current / maxConcurrentRequests;
        if (utilization >= CAPACITY_WARNING_THRESHOLD && !capacityWarningLogged) {
            log.warn("Approaching concurrency limit: inFlight={}/{} ({}%)",
                    current, maxConcurrentRequests, (int) (utilization * 100));
            capacityWarningLogged = true;
        } else if (utilization < CAPACITY_WARNING_THRESHOLD * 0.9) {
            // Reset warning flag when utilization drops significantly
            capacityWarningLogged = false;
        }
    }

    /**
     * Gives back a slot taken by {@link #onEvent}. Safe to call from any thread.
     */
    public void releaseSlot() {
        int remaining = inFlight.decrementAndGet();
        metricsRegistry.setGlobalInFlight(remaining);
        log.debug("Slot released: inFlight={}/{}", remaining, maxConcurrentRequests);
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }
}
