package fr.lapetina.llmrouter.domain.model;

/**
 * Model size preference carried by a request.
 * Larger models cost more per token; the multiplier feeds the cost estimate used for routing.
 */
public enum ModelSize {
    SMALL(1.0),
    MEDIUM(1.5),
    LARGE(2.0);

    /** Multiplier applied when the request expresses no preference */
    public static final double UNSPECIFIED_MULTIPLIER = 1.2;

    private final double costMultiplier;

    ModelSize(double costMultiplier) {
        this.costMultiplier = costMultiplier;
    }

    public double getCostMultiplier() {
        return costMultiplier;
    }

    public static double multiplierFor(ModelSize size) {
        return size != null ? size.costMultiplier : UNSPECIFIED_MULTIPLIER;
    }
}
