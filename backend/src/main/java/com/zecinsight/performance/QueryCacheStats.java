package com.zecinsight.performance;

/**
 * Snapshot of query cache counters. hitRate is 0 when nothing was looked up yet.
 */
public record QueryCacheStats(long hits, long misses, long size, double hitRate) {
}
