package com.zecinsight.indexer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Block-processed resync: queue bound, per wallet set throttle, global rate limit and retries.
 */
@ConfigurationProperties(prefix = "zecinsight.indexer")
@Getter
@Setter
public class IndexerProperties {

    private boolean resyncEnabled = true;
    /** Pending resync requests kept before new ones are dropped. */
    private int queueCapacity = 1_000;
    /** Minimum time between two resyncs of the same wallet set. */
    private long throttleIntervalMs = 60_000L;
    private Duration resyncTimeout = Duration.ofSeconds(30);
    private int rateLimitPerSecond = 5;
    /** How long the worker waits for a global rate limit permit before dropping the request. */
    private long limiterTimeoutMs = 5_000L;
    private int maxRetryAttempts = 3;
    private long retryBaseDelayMs = 500L;
    private double retryJitterFactor = 0.2;
}
