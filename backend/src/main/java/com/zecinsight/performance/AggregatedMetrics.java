package com.zecinsight.performance;

/**
 * Project-level rollup over the last 30 days. Productivity figures are null when no wallet has a score.
 */
public record AggregatedMetrics(
        int totalWallets,
        int activeWallets,
        long totalTransactions,
        long totalVolumeZatoshi,
        Double avgProductivity,
        Double medianProductivity
) {
}
