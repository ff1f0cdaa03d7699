package fr.lapetina.llmrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.ErrorType;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.infrastructure.budget.CostBudgetTracker;
import fr.lapetina.llmrouter.infrastructure.cache.RequestCache;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsCollector;
import fr.lapetina.llmrouter.infrastructure.resilience.RetryController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Fifth stage handler: hands admitted requests to the {@link RetryController}.
 *
 * IMPORTANT: provider calls complete asynchronously, long after the event slot has been
 * recycled. Everything the completion callback needs is copied out of the event before
 * dispatch; the callback never touches the event.
 *
 * On completion the callback settles or releases the budget reservation, records the outcome,
 * populates the cache, frees the admission slot and completes the caller's future, in that order.
 */
public final class DispatchHandler implements EventHandler<CompletionRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final RetryController retryController;
    private final AdmissionHandler admissionHandler;
    private final CostBudgetTracker budgetTracker;
    private final RequestCache cache;
    private final MetricsCollector metricsCollector;

    /**
     * @param cache the cache, or null when caching is disabled
     */
    public DispatchHandler(
            RetryController retryController,
            AdmissionHandler admissionHandler,
            CostBudgetTracker budgetTracker,
            RequestCache cache,
            MetricsCollector metricsCollector
    ) {
        this.retryController = retryController;
        this.admissionHandler = admissionHandler;
        this.budgetTracker = budgetTracker;
        this.cache = cache;
        this.metricsCollector = metricsCollector;
    }

    @Override
    public void onEvent(CompletionRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.BUDGET_RESERVED) {
            return;
        }

        CompletionRequest request = event.getRequest();
        String fingerprint = event.getFingerprint();
        CostBudgetTracker.Reservation reservation = event.getBudgetReservation();
        CompletableFuture<CompletionResponse> callerFuture = event.getResponseFuture();
        long startNanos = System.nanoTime();
        event.markDispatched();

        log.debug("Dispatching request: requestId={}, priority={}, sequence={}",
                request.requestId(), request.priority(), sequence);

        CompletableFuture<CompletionResponse> dispatch;
        try {
            dispatch = retryController.dispatch(request);
        } catch (RuntimeException e) {
            dispatch = CompletableFuture.failedFuture(e);
        }

        dispatch.whenComplete((response, throwable) -> {
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            try {
                if (throwable == null) {
                    handleSuccess(request, fingerprint, reservation, response, latencyMs);
                } else {
                    handleFailure(request, reservation, throwable, latencyMs);
                }
            } catch (RuntimeException e) {
                log.error("Completion bookkeeping failed: requestId={}", request.requestId(), e);
            } finally {
                // Always release the slot
                admissionHandler.releaseSlot();
            }

            if (throwable == null) {
                callerFuture.complete(response);
            } else {
                callerFuture.completeExceptionally(toLoadBalancerException(throwable));
            }
        });
    }

    private void handleSuccess(
            CompletionRequest request,
            String fingerprint,
            CostBudgetTracker.Reservation reservation,
            CompletionResponse response,
            long latencyMs
    ) {
        budgetTracker.settle(reservation, response.costUsd());
        metricsCollector.recordSuccess(response, latencyMs);
        if (cache != null && fingerprint != null) {
            cache.put(fingerprint, response);
        }

        log.info("Request completed: requestId={}, providerId={}, model={}, tokens={}, costUsd={}, latencyMs={}",
                request.requestId(), response.providerId(), response.model(),
                response.tokensUsed(), response.costUsd(), latencyMs);
    }

    private void handleFailure(
            CompletionRequest request,
            CostBudgetTracker.Reservation reservation,
            Throwable throwable,
            long latencyMs
    ) {
        LoadBalancerException error = toLoadBalancerException(throwable);
        budgetTracker.release(reservation);
        metricsCollector.recordFailure(error.getErrorType(), error.getProviderId(), latencyMs);

        log.warn("Request failed: requestId={}, providerId={}, errorType={}, message={}, latencyMs={}",
                request.requestId(), error.getProviderId(), error.getErrorType(), error.getMessage(), latencyMs);
    }

    private static LoadBalancerException toLoadBalancerException(Throwable throwable) {
        Throwable cause = throwable;
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof LoadBalancerException lbe) {
            return lbe;
        }
        return new LoadBalancerException(ErrorType.INTERNAL_ERROR, null,
                "Dispatch failed: " + cause.getMessage(), cause);
    }
}
