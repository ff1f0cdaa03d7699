package fr.lapetina.llmrouter.domain.model;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live routing metrics of one provider.
 * Thread-safe: every field is a single atomic value, so readers never block writers
 * and a reader may observe fields from slightly different moments.
 *
 * <p>Doubles are stored as raw long bits inside {@link AtomicLong}s and blended with
 * exponential moving averages:
 * <ul>
 *   <li>latency: {@code new = 0.9 * old + 0.1 * sample}</li>
 *   <li>success rate: {@code new = 0.99 * old + 0.01 * (success ? 1 : 0)}</li>
 *   <li>quality: {@code new = 0.9 * old + 0.1 * score}</li>
 * </ul>
 */
public final class ProviderMetrics {

    public static final double INITIAL_LATENCY_MS = 100.0;
    public static final double INITIAL_SUCCESS_RATE = 0.99;
    public static final double DEFAULT_QUALITY_SCORE = 0.85;

    static final double LATENCY_WEIGHT = 0.1;
    static final double SUCCESS_RATE_WEIGHT = 0.01;
    static final double QUALITY_WEIGHT = 0.1;

    private final String providerId;
    private final double baseCostPerToken;
    private final Clock clock;

    private final AtomicLong latencyEstimateBits;
    private final AtomicLong successRateBits;
    private final AtomicLong qualityScoreBits;
    private final AtomicLong costPerTokenBits;
    private final AtomicLong lastSuccessMillis;
    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();

    // Result of the most recent health probe, null until the first probe
    private final AtomicReference<Boolean> lastProbeHealthy = new AtomicReference<>();

    private ProviderMetrics(Builder builder) {
        this.providerId = Objects.requireNonNull(builder.providerId, "Provider ID is required");
        if (builder.baseCostPerToken < 0) {
            throw new IllegalArgumentException("costPerToken must be >= 0");
        }
        this.baseCostPerToken = builder.baseCostPerToken;
        this.clock = builder.clock;
        this.latencyEstimateBits = new AtomicLong(bits(INITIAL_LATENCY_MS));
        this.successRateBits = new AtomicLong(bits(INITIAL_SUCCESS_RATE));
        this.qualityScoreBits = new AtomicLong(bits(clamp(builder.initialQualityScore)));
        this.costPerTokenBits = new AtomicLong(bits(builder.baseCostPerToken));
        this.lastSuccessMillis = new AtomicLong(clock.millis());
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * Records a successful attempt with its measured latency and optional quality score.
     */
    public void recordSuccess(long latencyMs, Double qualityScore) {
        blend(latencyEstimateBits, Math.max(0, latencyMs), LATENCY_WEIGHT);
        blend(successRateBits, 1.0, SUCCESS_RATE_WEIGHT);
        if (qualityScore != null) {
            blend(qualityScoreBits, clamp(qualityScore), QUALITY_WEIGHT);
        }
        lastSuccessMillis.set(clock.millis());
        successCount.incrementAndGet();
    }

    public void recordFailure() {
        blend(successRateBits, 0.0, SUCCESS_RATE_WEIGHT);
        failureCount.incrementAndGet();
    }

    /**
     * Folds an externally computed quality score into the stored estimate.
     */
    public void recordQualityScore(double score) {
        blend(qualityScoreBits, clamp(score), QUALITY_WEIGHT);
    }

    public void overrideCostPerToken(double costPerToken) {
        if (costPerToken < 0 || Double.isNaN(costPerToken)) {
            throw new IllegalArgumentException("costPerToken must be >= 0");
        }
        costPerTokenBits.set(bits(costPerToken));
    }

    public void recordProbe(boolean healthy) {
        lastProbeHealthy.set(healthy);
    }

    public double getLatencyEstimateMs() {
        return value(latencyEstimateBits);
    }

    public double getSuccessRate() {
        return value(successRateBits);
    }

    public double getQualityScore() {
        return value(qualityScoreBits);
    }

    public double getCostPerToken() {
        return value(costPerTokenBits);
    }

    public double getBaseCostPerToken() {
        return baseCostPerToken;
    }

    public Instant getLastSuccess() {
        return Instant.ofEpochMilli(lastSuccessMillis.get());
    }

    public long getSuccessCount() {
        return successCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    public long getRequestCount() {
        return successCount.get() + failureCount.get();
    }

    /**
     * Last health probe result, or null if the provider has never been probed.
     */
    public Boolean getLastProbeHealthy() {
        return lastProbeHealthy.get();
    }

    private static void blend(AtomicLong target, double sample, double weight) {
        target.updateAndGet(current ->
                bits(Double.longBitsToDouble(current) * (1.0 - weight) + sample * weight));
    }

    private static double value(AtomicLong target) {
        return Double.longBitsToDouble(target.get());
    }

    private static long bits(double value) {
        return Double.doubleToRawLongBits(value);
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    @Override
    public String toString() {
        return "ProviderMetrics{" +
                "providerId='" + providerId + '\'' +
                ", latencyMs=" + Math.round(getLatencyEstimateMs()) +
                ", successRate=" + getSuccessRate() +
                ", quality=" + getQualityScore() +
                ", costPerToken=" + getCostPerToken() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String providerId;
        private double baseCostPerToken;
        private double initialQualityScore = DEFAULT_QUALITY_SCORE;
        private Clock clock = Clock.systemUTC();

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder baseCostPerToken(double baseCostPerToken) {
            this.baseCostPerToken = baseCostPerToken;
            return this;
        }

        public Builder initialQualityScore(double initialQualityScore) {
            this.initialQualityScore = initialQualityScore;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public ProviderMetrics build() {
            return new ProviderMetrics(this);
        }
    }
}
