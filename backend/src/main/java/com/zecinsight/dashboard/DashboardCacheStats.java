package com.zecinsight.dashboard;

import com.zecinsight.performance.QueryCacheStats;

public record DashboardCacheStats(QueryCacheStats queryCache, long dashboardTtlSeconds) {
}
