package fr.lapetina.llmrouter.domain.model;

/**
 * State of a provider's circuit breaker.
 */
public enum CircuitState {
    /** Calls flow normally */
    CLOSED,

    /** Calls rejected until the open timeout elapses */
    OPEN,

    /** A limited number of trial calls probe recovery */
    HALF_OPEN
}
