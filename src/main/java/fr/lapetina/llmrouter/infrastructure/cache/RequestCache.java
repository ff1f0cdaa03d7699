package fr.lapetina.llmrouter.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.CompletionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * TTL cache of completed responses keyed by {@link RequestFingerprint}, backed by Caffeine.
 *
 * Entries expire {@code ttl} after they were written; an entry exactly {@code ttl} old is a miss.
 * Expired entries are dropped during Caffeine's maintenance or an explicit {@link #sweepExpired()}.
 * Capacity is bounded by {@code maxEntries} with Caffeine's size eviction, which is approximate,
 * not LRU.
 *
 * Hits are served as copies with {@code cached=true} and the cost multiplied by
 * {@code hitCostFactor}, always relative to the cost originally cached.
 */
public final class RequestCache {

    private static final Logger log = LoggerFactory.getLogger(RequestCache.class);

    /**
     * An immutable cached response.
     */
    public record CacheEntry(String fingerprint, CompletionResponse response, Instant insertedAt) {
    }

    private final Cache<String, CacheEntry> entries;
    private final Duration ttl;
    private final double hitCostFactor;
    private final Clock clock;

    public RequestCache(Duration ttl, int maxEntries, double hitCostFactor, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        if (hitCostFactor < 0 || hitCostFactor > 1) {
            throw new IllegalArgumentException("hitCostFactor must be within [0, 1]");
        }
        this.ttl = ttl;
        this.hitCostFactor = hitCostFactor;
        this.clock = Objects.requireNonNull(clock);
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .ticker(clockTicker(clock))
                // Maintenance runs on the calling thread
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("RequestCache initialized: ttlSeconds={}, maxEntries={}, hitCostFactor={}",
                ttl.toSeconds(), maxEntries, hitCostFactor);
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    /**
     * Looks up a fingerprint.
     *
     * @return a cost-reduced copy of the cached response, or empty on miss or expiry
     */
    public Optional<CompletionResponse> get(String fingerprint) {
        CacheEntry entry = entries.getIfPresent(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }
        CompletionResponse cached = entry.response();
        return Optional.of(cached.asCacheHit(cached.requestId(), hitCostFactor));
    }

    /**
     * Looks up a request and rebinds a hit to the caller's request id.
     */
    public Optional<CompletionResponse> lookup(CompletionRequest request) {
        return get(RequestFingerprint.of(request))
                .map(hit -> hit.asCacheHit(request.requestId(), 1.0));
    }

    public void put(String fingerprint, CompletionResponse response) {
        Objects.requireNonNull(response, "Response is required");
        entries.put(fingerprint, new CacheEntry(fingerprint, response, clock.instant()));
    }

    public void store(CompletionRequest request, CompletionResponse response) {
        put(RequestFingerprint.of(request), response);
    }

    /**
     * Runs pending maintenance, which drops every expired entry.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        int removed = (int) Math.max(0, before - entries.estimatedSize());
        if (removed > 0) {
            log.debug("Expired cache entries swept: removed={}, remaining={}", removed, entries.estimatedSize());
        }
        return removed;
    }

    public long size() {
        return entries.estimatedSize();
    }

    public void clear() {
        entries.invalidateAll();
    }

    public long getHitCount() {
        return entries.stats().hitCount();
    }

    public long getMissCount() {
        return entries.stats().missCount();
    }

    /**
     * Entries removed by expiry or by size eviction.
     */
    public long getEvictionCount() {
        return entries.stats().evictionCount();
    }

    public double getHitCostFactor() {
        return hitCostFactor;
    }

    public Duration getTtl() {
        return ttl;
    }
}
