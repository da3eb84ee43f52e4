package com.zecinsight.performance;

import com.github.benmanes.caffeine.cache.Cache;
import com.zecinsight.performance.config.PerformanceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Generic TTL memoizer shared by dashboard and warmup queries.
 * Compute-then-publish: the producer runs outside any lock and its result is stored afterwards, so two
 * concurrent misses may both compute; the later write wins. Null results are not cached.
 */
@Component
@Slf4j
public class QueryCache {

    private final Cache<String, Entry> store;
    private final Duration defaultTtl;
    private final LongSupplier clockNanos;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    @Autowired
    public QueryCache(Cache<String, Entry> queryCacheStore, PerformanceProperties properties) {
        this(queryCacheStore, properties.getQueryCacheTtl(), System::nanoTime);
    }

    QueryCache(Cache<String, Entry> store, Duration defaultTtl, LongSupplier clockNanos) {
        this.store = store;
        this.defaultTtl = defaultTtl;
        this.clockNanos = clockNanos;
    }

    public <T> T cachedQuery(String key, Supplier<T> producer) {
        return cachedQuery(key, producer, defaultTtl);
    }

    @SuppressWarnings("unchecked")
    public <T> T cachedQuery(String key, Supplier<T> producer, Duration ttl) {
        long now = clockNanos.getAsLong();
        Entry cached = store.getIfPresent(key);
        if (cached != null && now - cached.writtenAtNanos() < ttl.toNanos()) {
            hits.incrementAndGet();
            log.debug("Query cache hit: {}", key);
            return (T) cached.value();
        }
        misses.incrementAndGet();
        T value = producer.get();
        if (value != null) {
            store.put(key, new Entry(value, clockNanos.getAsLong(), ttl.toNanos()));
        }
        return value;
    }

    public void invalidate(String key) {
        store.invalidate(key);
    }

    /** Drops every key starting with the prefix. */
    public void invalidatePrefix(String prefix) {
        store.asMap().keySet().removeIf(k -> k.startsWith(prefix));
    }

    public void invalidateAll() {
        store.invalidateAll();
    }

    /**
     * Removes entries whose own TTL has elapsed. Returns the number removed.
     */
    public int clearExpired() {
        long now = clockNanos.getAsLong();
        int before = store.asMap().size();
        store.asMap().values().removeIf(e -> now - e.writtenAtNanos() >= e.ttlNanos());
        store.cleanUp();
        return Math.max(0, before - store.asMap().size());
    }

    public QueryCacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        double hitRate = total == 0 ? 0.0 : (double) h / total;
        return new QueryCacheStats(h, m, store.estimatedSize(), hitRate);
    }

    /** Cached value with its write time and the TTL it was stored under. */
    public record Entry(Object value, long writtenAtNanos, long ttlNanos) {
    }
}
