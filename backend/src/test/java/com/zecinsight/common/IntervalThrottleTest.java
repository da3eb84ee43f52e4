package com.zecinsight.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class IntervalThrottleTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);
    private final IntervalThrottle throttle = new IntervalThrottle(60_000L, nanos::get);

    @Test
    @DisplayName("first acquire for a key succeeds, second within the interval is refused")
    void tryAcquire_secondCallWithinInterval_refused() {
        assertThat(throttle.tryAcquire("p1:w1")).isTrue();
        nanos.addAndGet(59_000L * 1_000_000L);
        assertThat(throttle.tryAcquire("p1:w1")).isFalse();
    }

    @Test
    @DisplayName("acquire succeeds again once the interval has elapsed")
    void tryAcquire_afterInterval_allowed() {
        assertThat(throttle.tryAcquire("p1:w1")).isTrue();
        nanos.addAndGet(60_000L * 1_000_000L);
        assertThat(throttle.tryAcquire("p1:w1")).isTrue();
    }

    @Test
    @DisplayName("keys are throttled independently")
    void tryAcquire_keysIndependent() {
        assertThat(throttle.tryAcquire("p1:w1")).isTrue();
        assertThat(throttle.tryAcquire("p1:w2")).isTrue();
        assertThat(throttle.tryAcquire("p2:w1")).isTrue();
    }

    @Test
    @DisplayName("evictIdle forgets keys whose interval has elapsed")
    void evictIdle_removesElapsedKeys() {
        throttle.tryAcquire("old");
        nanos.addAndGet(30_000L * 1_000_000L);
        throttle.tryAcquire("recent");
        nanos.addAndGet(30_000L * 1_000_000L);

        throttle.evictIdle();

        assertThat(throttle.trackedKeys()).isEqualTo(1);
        assertThat(throttle.tryAcquire("recent")).isFalse();
    }

    @Test
    @DisplayName("concurrent acquires racing an eviction sweep grant a single permit")
    void tryAcquire_concurrentWithEviction_singlePermit() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(9);
        AtomicInteger granted = new AtomicInteger();
        AtomicBoolean sweeping = new AtomicBoolean(true);
        CountDownLatch start = new CountDownLatch(1);
        try {
            pool.execute(() -> {
                while (sweeping.get()) {
                    throttle.evictIdle();
                }
            });
            List<Future<?>> callers = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                callers.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 1_000; i++) {
                        if (throttle.tryAcquire("p1:w1")) {
                            granted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : callers) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            sweeping.set(false);
            pool.shutdownNow();
        }

        assertThat(granted.get()).isEqualTo(1);
    }
}
