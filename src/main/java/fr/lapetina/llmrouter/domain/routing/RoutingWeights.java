package fr.lapetina.llmrouter.domain.routing;

/**
 * Weights of the four scoring dimensions. Expected, not required, to sum to 1.0.
 */
public record RoutingWeights(double cost, double latency, double quality, double reliability) {

    public RoutingWeights {
        if (cost < 0 || latency < 0 || quality < 0 || reliability < 0) {
            throw new IllegalArgumentException("Routing weights must be >= 0");
        }
    }

    public static RoutingWeights defaults() {
        return new RoutingWeights(0.3, 0.4, 0.2, 0.1);
    }

    public double sum() {
        return cost + latency + quality + reliability;
    }
}
