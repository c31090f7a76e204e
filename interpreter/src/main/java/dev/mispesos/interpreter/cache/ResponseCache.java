package dev.mispesos.interpreter.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import dev.mispesos.records.StructuredRecord;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches accepted interpretations by message fingerprint.
 *
 * <p>Entries expire {@code ttl} after insertion. Whenever an insertion pushes the cache above
 * {@code maximumSize}, the oldest entries are dropped so that only the newest
 * {@code retainSize} remain.
 */
public class ResponseCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseCache.class);

    private final Cache<String, StructuredRecord> cache;
    private final Object evictionLock = new Object();
    private final int maximumSize;
    private final int retainSize;
    private final double acceptanceThreshold;

    public ResponseCache(Duration ttl, int maximumSize, double retainRatio, double acceptanceThreshold,
        Ticker ticker) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("Cache maximum size must be positive");
        }
        if (retainRatio <= 0.0 || retainRatio > 1.0) {
            throw new IllegalArgumentException("Cache retain ratio must be in (0, 1]");
        }
        this.maximumSize = maximumSize;
        this.retainSize = (int) Math.floor(maximumSize * retainRatio);
        this.acceptanceThreshold = acceptanceThreshold;
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .ticker(ticker != null ? ticker : Ticker.systemTicker())
            .executor(Runnable::run)
            .build();
    }

    public Optional<StructuredRecord> get(String fingerprint) {
        if (fingerprint == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    /**
     * Stores the record when it is successful and confident enough.
     *
     * @return {@code true} when the record was cached
     */
    public boolean put(String fingerprint, StructuredRecord record) {
        if (fingerprint == null || record == null || !record.isSuccessful()
            || record.confidence() <= acceptanceThreshold) {
            return false;
        }
        cache.put(fingerprint, record);
        synchronized (evictionLock) {
            cache.cleanUp();
            if (cache.estimatedSize() > maximumSize) {
                evictOldest();
            }
        }
        return true;
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    // Runs under evictionLock.
    private void evictOldest() {
        long excess = cache.estimatedSize() - retainSize;
        if (excess <= 0) {
            return;
        }
        cache.policy().expireAfterWrite().ifPresent(expiration -> {
            Map<String, StructuredRecord> oldest = expiration.oldest((int) excess);
            cache.invalidateAll(oldest.keySet());
            cache.cleanUp();
            LOGGER.info("Evicted {} oldest cached interpretations; {} remain", oldest.size(), cache.estimatedSize());
        });
    }
}
