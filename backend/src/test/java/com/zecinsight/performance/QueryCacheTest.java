package com.zecinsight.performance;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class QueryCacheTest {

    private final AtomicLong nanos = new AtomicLong(0);
    private final QueryCache cache = new QueryCache(Caffeine.newBuilder().<String, QueryCache.Entry>build(),
            Duration.ofMinutes(5), nanos::get);

    @Test
    @DisplayName("second lookup within TTL is a hit and skips the producer")
    void cachedQuery_withinTtl_hit() {
        AtomicInteger calls = new AtomicInteger();

        String first = cache.cachedQuery("dashboard:p1", () -> "v" + calls.incrementAndGet());
        nanos.addAndGet(Duration.ofMinutes(4).toNanos());
        String second = cache.cachedQuery("dashboard:p1", () -> "v" + calls.incrementAndGet());

        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(cache.stats().hits()).isEqualTo(1);
        assertThat(cache.stats().misses()).isEqualTo(1);
        assertThat(cache.stats().hitRate()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("entry older than TTL is recomputed")
    void cachedQuery_afterTtl_recomputes() {
        AtomicInteger calls = new AtomicInteger();
        cache.cachedQuery("k", () -> calls.incrementAndGet());
        nanos.addAndGet(Duration.ofMinutes(5).toNanos());

        Integer value = cache.cachedQuery("k", () -> calls.incrementAndGet());

        assertThat(value).isEqualTo(2);
    }

    @Test
    @DisplayName("per-call TTL shorter than the default expires earlier")
    void cachedQuery_customTtl() {
        cache.cachedQuery("short", () -> "a", Duration.ofSeconds(10));
        nanos.addAndGet(Duration.ofSeconds(11).toNanos());

        assertThat(cache.<String>cachedQuery("short", () -> "b", Duration.ofSeconds(10))).isEqualTo("b");
    }

    @Test
    @DisplayName("null results are not cached")
    void cachedQuery_nullNotCached() {
        AtomicInteger calls = new AtomicInteger();
        cache.cachedQuery("missing", () -> {
            calls.incrementAndGet();
            return null;
        });
        cache.cachedQuery("missing", () -> {
            calls.incrementAndGet();
            return null;
        });
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("prefix invalidation drops only matching keys")
    void invalidatePrefix_onlyMatching() {
        cache.cachedQuery("dashboard:p1", () -> "d");
        cache.cachedQuery("health:p1", () -> "h");

        cache.invalidatePrefix("dashboard:");

        assertThat(cache.<String>cachedQuery("dashboard:p1", () -> "d2")).isEqualTo("d2");
        assertThat(cache.<String>cachedQuery("health:p1", () -> "h2")).isEqualTo("h");
    }

    @Test
    @DisplayName("clearExpired removes entries whose own TTL elapsed")
    void clearExpired_removesElapsed() {
        cache.cachedQuery("short", () -> "a", Duration.ofSeconds(10));
        cache.cachedQuery("long", () -> "b", Duration.ofMinutes(10));
        nanos.addAndGet(Duration.ofSeconds(30).toNanos());

        assertThat(cache.clearExpired()).isEqualTo(1);
        assertThat(cache.stats().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("hit rate is zero before any lookup")
    void stats_empty() {
        assertThat(cache.stats()).isEqualTo(new QueryCacheStats(0, 0, 0, 0.0));
    }
}
