package com.zecinsight.performance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Pre-populates frequent project reads and sweeps stale query cache entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheWarmupService {

    static final int WARMUP_WALLET_LIMIT = 50;

    private final ProjectQueryService projectQueryService;
    private final QueryCache queryCache;

    public void warmupCache(String projectId) {
        projectQueryService.getAggregatedMetrics(projectId);
        projectQueryService.findWallets(projectId, new WalletQueryFilter(null, null, null, WARMUP_WALLET_LIMIT));
        log.debug("Warmed query cache for project {}", projectId);
    }

    @Scheduled(fixedDelayString = "${zecinsight.performance.cache-sweep-interval-ms:60000}")
    public void clearExpiredCache() {
        int removed = queryCache.clearExpired();
        if (removed > 0) {
            log.debug("Query cache sweep removed {} expired entries", removed);
        }
    }
}
