package fr.lapetina.llmrouter.domain.model;

/**
 * Priority tier of a completion request.
 */
public enum RequestPriority {
    /** Background work, scored like NORMAL */
    LOW,

    /** Default tier */
    NORMAL,

    /** Latency-sensitive traffic, scored against a tighter latency target */
    HIGH,

    /** Same routing treatment as HIGH */
    CRITICAL;

    public boolean isHigh() {
        return this == HIGH || this == CRITICAL;
    }
}
