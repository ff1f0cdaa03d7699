package fr.lapetina.llmrouter.infrastructure.metrics;

import fr.lapetina.llmrouter.domain.model.CircuitState;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import fr.lapetina.llmrouter.domain.model.ErrorType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process aggregation of terminal request outcomes.
 *
 * Keeps the last {@code windowSize} latency samples in a ring (oldest overwritten first) and
 * adder-based counters for everything else. Percentiles are computed on demand from a sorted
 * copy of the window, so statistics never hold up writers for longer than an array copy.
 * Every recording is mirrored to the Micrometer {@link MetricsRegistry}.
 */
public final class MetricsCollector {

    public static final int DEFAULT_WINDOW_SIZE = 10_000;

    private final long[] latencyWindow;
    private int nextSlot;
    private int sampleCount;

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder successfulRequests = new LongAdder();
    private final LongAdder failedRequests = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final DoubleAdder totalCost = new DoubleAdder();
    private final ConcurrentHashMap<String, LongAdder> providerDistribution = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, LongAdder> errorsByType = new ConcurrentHashMap<>();

    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final Instant startedAt;

    public MetricsCollector(int windowSize, MetricsRegistry metricsRegistry, Clock clock) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1");
        }
        this.latencyWindow = new long[windowSize];
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry);
        this.clock = Objects.requireNonNull(clock);
        this.startedAt = clock.instant();
    }

    /**
     * Records a response produced by a provider call.
     *
     * @param latencyMs end-to-end time of the request, retries and backoff included. The
     *                  per-provider timer takes the winning attempt's own latency instead.
     */
    public void recordSuccess(CompletionResponse response, long latencyMs) {
        totalRequests.increment();
        successfulRequests.increment();
        totalCost.add(response.costUsd());
        providerDistribution.computeIfAbsent(response.providerId(), k -> new LongAdder()).increment();
        addLatencySample(latencyMs);

        metricsRegistry.recordLatency(response.providerId(), Duration.ofMillis(response.latencyMs()));
        metricsRegistry.recordCost(response.providerId(), response.costUsd());
    }

    /**
     * Records a response served from the cache. No latency sample is taken.
     */
    public void recordCacheHit(CompletionResponse response) {
        totalRequests.increment();
        successfulRequests.increment();
        cacheHits.increment();
        totalCost.add(response.costUsd());
    }

    /**
     * Records a failed request.
     *
     * @param providerId provider of the last attempt, or null if nothing was dispatched
     * @param latencyMs  end-to-end time spent, or a negative value to take no latency sample
     */
    public void recordFailure(ErrorType errorType, String providerId, long latencyMs) {
        totalRequests.increment();
        failedRequests.increment();
        errorsByType.computeIfAbsent(errorType, k -> new LongAdder()).increment();
        if (latencyMs >= 0) {
            addLatencySample(latencyMs);
        }
        metricsRegistry.incrementErrorCount(providerId != null ? providerId : "none", errorType);
    }

    private synchronized void addLatencySample(long latencyMs) {
        latencyWindow[nextSlot] = latencyMs;
        nextSlot = (nextSlot + 1) % latencyWindow.length;
        if (sampleCount < latencyWindow.length) {
            sampleCount++;
        }
    }

    private synchronized long[] copyWindow() {
        return Arrays.copyOf(latencyWindow, sampleCount);
    }

    /**
     * Latency statistics over the current window.
     */
    public LatencyStats latencyStats() {
        long[] samples = copyWindow();
        if (samples.length == 0) {
            return LatencyStats.EMPTY;
        }
        Arrays.sort(samples);
        double sum = 0;
        for (long sample : samples) {
            sum += sample;
        }
        return new LatencyStats(samples.length, sum / samples.length,
                percentile(samples, 0.50), percentile(samples, 0.95), percentile(samples, 0.99),
                samples[samples.length - 1]);
    }

    /**
     * Nearest-rank percentile of an ascending array.
     */
    static long percentile(long[] sorted, double quantile) {
        int rank = (int) Math.ceil(quantile * sorted.length);
        int index = Math.min(sorted.length - 1, Math.max(0, rank - 1));
        return sorted[index];
    }

    public MetricsSnapshot snapshot(Map<String, CircuitState> circuitStates, double hourlySpendUsd) {
        LatencyStats latency = latencyStats();
        long total = totalRequests.sum();
        double uptimeSeconds = Math.max(0, Duration.between(startedAt, clock.instant()).toMillis()) / 1000.0;

        Map<String, Long> distribution = new LinkedHashMap<>();
        providerDistribution.forEach((provider, count) -> distribution.put(provider, count.sum()));
        Map<String, Long> errors = new LinkedHashMap<>();
        errorsByType.forEach((type, count) -> errors.put(type.name(), count.sum()));

        return new MetricsSnapshot(
                total,
                successfulRequests.sum(),
                failedRequests.sum(),
                cacheHits.sum(),
                latency.mean(),
                latency.p95(),
                latency.p99(),
                totalCost.sum(),
                uptimeSeconds > 0 ? total / uptimeSeconds : 0.0,
                distribution,
                circuitStates,
                errors,
                hourlySpendUsd,
                (long) uptimeSeconds);
    }

    public long getTotalRequests() {
        return totalRequests.sum();
    }

    public long getCacheHits() {
        return cacheHits.sum();
    }

    public int getWindowSize() {
        return latencyWindow.length;
    }

    /**
     * Latency summary of the sample window, in milliseconds.
     */
    public record LatencyStats(int samples, double mean, long p50, long p95, long p99, long max) {
        static final LatencyStats EMPTY = new LatencyStats(0, 0.0, 0, 0, 0, 0);
    }
}
