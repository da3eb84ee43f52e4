package com.zecinsight.indexer;

import com.zecinsight.common.IntervalThrottle;
import com.zecinsight.config.AsyncConfig;
import com.zecinsight.dashboard.DashboardService;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.indexer.config.IndexerConfig;
import com.zecinsight.indexer.config.IndexerProperties;
import com.zecinsight.performance.BatchProcessor;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the resync queue on its own thread. Each request passes the per wallet set throttle and the global
 * rate limiter, then rescoring runs under a time limiter with exponential backoff between attempts. A
 * timed-out attempt is interrupted before the next one starts. A request that exhausts its attempts is logged
 * and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResyncWorker {

    private static final long POLL_TIMEOUT_MS = 1_000L;

    private final ResyncQueue resyncQueue;
    @Qualifier("resyncThrottle")
    private final IntervalThrottle resyncThrottle;
    @Qualifier(IndexerConfig.RESYNC_RATE_LIMITER)
    private final RateLimiter resyncRateLimiter;
    @Qualifier(IndexerConfig.RESYNC_RETRY)
    private final Retry resyncRetry;
    @Qualifier(IndexerConfig.RESYNC_TIME_LIMITER)
    private final TimeLimiter resyncTimeLimiter;
    private final BatchProcessor batchProcessor;
    private final DashboardService dashboardService;
    private final IndexerProperties properties;
    @Qualifier(AsyncConfig.RESYNC_EXECUTOR)
    private final AsyncTaskExecutor resyncExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.isResyncEnabled()) {
            log.info("Indexer resync worker disabled");
            return;
        }
        if (running.compareAndSet(false, true)) {
            resyncExecutor.execute(this::runLoop);
            log.info("Indexer resync worker started (queue capacity {})", properties.getQueueCapacity());
        }
    }

    @PreDestroy
    public void stop() {
        running.set(false);
    }

    void runLoop() {
        while (running.get()) {
            try {
                ResyncRequest request = resyncQueue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (request != null) {
                    process(request);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running.set(false);
            } catch (RuntimeException e) {
                log.error("Resync worker iteration failed", e);
            }
        }
        log.info("Indexer resync worker stopped");
    }

    ResyncOutcome process(ResyncRequest request) throws InterruptedException {
        if (!resyncThrottle.tryAcquire(request.throttleKey())) {
            log.debug("Resync throttled for project {} ({} wallets)", request.projectId(), request.walletIds().size());
            return ResyncOutcome.THROTTLED;
        }
        if (!resyncRateLimiter.acquirePermission()) {
            log.warn("Resync rate limit reached, dropped block {} for project {}",
                    request.blockHeight(), request.projectId());
            return ResyncOutcome.RATE_LIMITED;
        }
        Callable<List<ProductivityScore>> rescore = () -> batchProcessor.batchCalculateProductivityScores(request.walletIds());
        try {
            List<ProductivityScore> scores = resyncRetry.executeCallable(
                    () -> resyncTimeLimiter.executeFutureSupplier(() -> resyncExecutor.submit(rescore)));
            dashboardService.clearDashboardCache(request.projectId());
            log.info("Resynced {} of {} wallets for project {} at block {}", scores.size(),
                    request.walletIds().size(), request.projectId(), request.blockHeight());
            return ResyncOutcome.PROCESSED;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Resync for project {} at block {} failed after {} attempts: {}", request.projectId(),
                    request.blockHeight(), resyncRetry.getRetryConfig().getMaxAttempts(), describe(e));
            return ResyncOutcome.FAILED;
        }
    }

    /** Sweeps throttle keys whose interval has passed. */
    @Scheduled(fixedDelayString = "${zecinsight.indexer.throttle-interval-ms:60000}")
    public void evictIdleThrottleKeys() {
        resyncThrottle.evictIdle();
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
    }

    enum ResyncOutcome {
        PROCESSED,
        THROTTLED,
        RATE_LIMITED,
        FAILED
    }
}
