package com.zecinsight.performance.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Query cache and batch sizing.
 */
@ConfigurationProperties(prefix = "zecinsight.performance")
@Getter
@Setter
public class PerformanceProperties {

    /** Chunk size for batch scoring and metric upserts. */
    private int batchSize = 100;

    /** Chunks submitted to the batch executor at once; the next window starts when the current one is done. */
    private int maxInFlightChunks = 8;

    /** Default TTL for {@code cachedQuery} entries. */
    private Duration queryCacheTtl = Duration.ofMinutes(5);

    private long queryCacheMaxSize = 10_000;

    /** TTL for assembled project dashboards. */
    private Duration dashboardTtl = Duration.ofMinutes(5);
}
