package fr.lapetina.llmrouter.domain.event;

/**
 * Lifecycle state of a completion request event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just published, awaiting validation */
    CREATED,

    /** Request validated successfully */
    VALIDATED,

    /** Validation failed */
    VALIDATION_FAILED,

    /** A cached response answers the request */
    CACHE_HIT,

    /** No usable cached response, request continues to dispatch */
    CACHE_MISS,

    /** Request holds an in-flight slot */
    ADMITTED,

    /** Too many requests in flight */
    CAPACITY_REJECTED,

    /** Estimated cost reserved against the hourly budget */
    BUDGET_RESERVED,

    /** Hourly budget would be exceeded */
    BUDGET_REJECTED,

    /** Handed to the retry controller, completes asynchronously */
    DISPATCHED
}
