package com.zecinsight.dashboard;

import java.math.BigDecimal;

/**
 * Headline numbers over the last 30 days. avgProductivityScore is 0 when no wallet has been scored.
 */
public record ProjectOverview(
        int totalWallets,
        int activeWallets,
        long totalTransactions,
        BigDecimal totalVolumeZec,
        double avgProductivityScore
) {
}
