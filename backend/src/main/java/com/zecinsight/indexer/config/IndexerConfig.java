package com.zecinsight.indexer.config;

import com.zecinsight.common.IntervalThrottle;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resync guards: global rate limiter, per wallet set throttle, attempt timeout and backoff between attempts.
 */
@Configuration
@EnableConfigurationProperties(IndexerProperties.class)
@Slf4j
public class IndexerConfig {

    public static final String RESYNC_RATE_LIMITER = "resyncRateLimiter";
    public static final String RESYNC_RETRY = "resyncRetry";
    public static final String RESYNC_TIME_LIMITER = "resyncTimeLimiter";

    @Bean(name = RESYNC_RATE_LIMITER)
    public RateLimiter resyncRateLimiter(IndexerProperties properties) {
        int rps = Math.max(1, properties.getRateLimitPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("resync", config);
    }

    @Bean
    public IntervalThrottle resyncThrottle(IndexerProperties properties) {
        return new IntervalThrottle(properties.getThrottleIntervalMs());
    }

    /**
     * Exponential backoff (x2 per attempt) with randomized jitter. An interrupted worker is never retried.
     */
    @Bean(name = RESYNC_RETRY)
    public Retry resyncRetry(IndexerProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getMaxRetryAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Math.max(1L, properties.getRetryBaseDelayMs()), 2.0, properties.getRetryJitterFactor()))
                .ignoreExceptions(InterruptedException.class)
                .build();
        Retry retry = Retry.of("resync", config);
        retry.getEventPublisher().onRetry(e -> log.debug("Resync attempt {} failed, retrying in {}: {}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval(), e.getLastThrowable().toString()));
        return retry;
    }

    /** Bounds one rescore attempt; a timed-out attempt is interrupted so it frees its thread. */
    @Bean(name = RESYNC_TIME_LIMITER)
    public TimeLimiter resyncTimeLimiter(IndexerProperties properties) {
        return TimeLimiter.of("resync", TimeLimiterConfig.custom()
                .timeoutDuration(properties.getResyncTimeout())
                .cancelRunningFuture(true)
                .build());
    }
}
