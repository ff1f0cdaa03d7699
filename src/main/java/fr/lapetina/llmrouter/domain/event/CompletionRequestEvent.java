package fr.lapetina.llmrouter.domain.event;

import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.infrastructure.budget.CostBudgetTracker;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * Each handler stage updates the event as it progresses through the pipeline.
 *
 * IMPORTANT: This class is intentionally mutable for Disruptor performance.
 * It should never be accessed outside the Disruptor pipeline handlers, and never from an
 * asynchronous callback: the slot is recycled as soon as the last handler clears it.
 */
public final class CompletionRequestEvent {

    // Immutable request data
    private CompletionRequest request;
    private String fingerprint;

    // Mutable state tracking
    private EventState state;
    private CompletionResponse cachedResponse;
    private LoadBalancerException error;
    private CostBudgetTracker.Reservation budgetReservation;

    // Timing
    private Instant acceptedAt;
    private Instant validatedAt;
    private Instant cacheCheckedAt;
    private Instant admittedAt;
    private Instant dispatchedAt;

    // Callback for async completion
    private CompletableFuture<CompletionResponse> responseFuture;

    // Sequence number (set by Disruptor)
    private long sequence;

    /**
     * Clears the event for reuse.
     * Called by the EventFactory and at the end of processing.
     */
    public void clear() {
        this.request = null;
        this.fingerprint = null;
        this.state = null;
        this.cachedResponse = null;
        this.error = null;
        this.budgetReservation = null;
        this.acceptedAt = null;
        this.validatedAt = null;
        this.cacheCheckedAt = null;
        this.admittedAt = null;
        this.dispatchedAt = null;
        this.responseFuture = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a new request.
     */
    public void initialize(CompletionRequest request, CompletableFuture<CompletionResponse> responseFuture) {
        clear();
        this.request = request;
        this.responseFuture = responseFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    // Getters
    public CompletionRequest getRequest() {
        return request;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public EventState getState() {
        return state;
    }

    public CompletionResponse getCachedResponse() {
        return cachedResponse;
    }

    public LoadBalancerException getError() {
        return error;
    }

    public CostBudgetTracker.Reservation getBudgetReservation() {
        return budgetReservation;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public Instant getCacheCheckedAt() {
        return cacheCheckedAt;
    }

    public Instant getAdmittedAt() {
        return admittedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public CompletableFuture<CompletionResponse> getResponseFuture() {
        return responseFuture;
    }

    public long getSequence() {
        return sequence;
    }

    // Setters for handler updates
    public void setState(EventState state) {
        this.state = state;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
        this.validatedAt = Instant.now();
    }

    public void markCacheHit(CompletionResponse response) {
        this.state = EventState.CACHE_HIT;
        this.cachedResponse = response;
        this.cacheCheckedAt = Instant.now();
    }

    public void markCacheMiss() {
        this.state = EventState.CACHE_MISS;
        this.cacheCheckedAt = Instant.now();
    }

    public void markAdmitted() {
        this.state = EventState.ADMITTED;
        this.admittedAt = Instant.now();
    }

    public void markBudgetReserved(CostBudgetTracker.Reservation reservation) {
        this.state = EventState.BUDGET_RESERVED;
        this.budgetReservation = reservation;
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
        this.dispatchedAt = Instant.now();
    }

    /**
     * Ends processing before dispatch with the given error.
     */
    public void reject(EventState rejectedState, LoadBalancerException error) {
        this.state = rejectedState;
        this.error = error;
    }

    /**
     * Checks if the request was fully answered inside the pipeline, without dispatch.
     */
    public boolean isTerminal() {
        return state == EventState.CACHE_HIT
            || state == EventState.VALIDATION_FAILED
            || state == EventState.CAPACITY_REJECTED
            || state == EventState.BUDGET_REJECTED;
    }

    /**
     * Checks if processing should skip remaining handlers.
     */
    public boolean shouldSkip() {
        return isTerminal() || state == EventState.DISPATCHED;
    }

    @Override
    public String toString() {
        return "CompletionRequestEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", state=" + state +
                ", seq=" + sequence +
                '}';
    }
}
