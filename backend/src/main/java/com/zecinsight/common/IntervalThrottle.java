package com.zecinsight.common;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Keyed throttle: at most one permit per key per interval. Used to bound indexer-triggered resyncs
 * to one per wallet set per configured interval. Check-and-take and eviction are atomic per key.
 */
public class IntervalThrottle {

    private final long minIntervalNanos;
    private final LongSupplier clock;
    private final ConcurrentMap<String, Long> nextFreeAtNanos = new ConcurrentHashMap<>();

    public IntervalThrottle(long intervalMillis) {
        this(intervalMillis, System::nanoTime);
    }

    IntervalThrottle(long intervalMillis, LongSupplier clock) {
        if (intervalMillis < 0) {
            throw new IllegalArgumentException("intervalMillis must not be negative");
        }
        this.minIntervalNanos = intervalMillis * 1_000_000L;
        this.clock = clock;
    }

    /**
     * Non-blocking: returns true if the key was idle long enough and a permit was taken.
     */
    public boolean tryAcquire(String key) {
        AtomicBoolean granted = new AtomicBoolean();
        nextFreeAtNanos.compute(key, (k, nextFree) -> {
            long now = clock.getAsLong();
            if (nextFree != null && now < nextFree) {
                return nextFree;
            }
            granted.set(true);
            return now + minIntervalNanos;
        });
        return granted.get();
    }

    /** Forgets keys whose interval has elapsed, so the map does not grow with one-off wallet sets. */
    public void evictIdle() {
        long now = clock.getAsLong();
        for (String key : nextFreeAtNanos.keySet()) {
            nextFreeAtNanos.computeIfPresent(key, (k, nextFree) -> now >= nextFree ? null : nextFree);
        }
    }

    int trackedKeys() {
        return nextFreeAtNanos.size();
    }
}
