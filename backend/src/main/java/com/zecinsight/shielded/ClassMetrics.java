package com.zecinsight.shielded;

/**
 * Averages for one usage class. avgProductivityScore is null when no wallet in the class has a score.
 */
public record ClassMetrics(
        int walletCount,
        double percentageOfWallets,
        Double avgProductivityScore,
        double avgActiveDays,
        double avgTransactions,
        double avgVolumeZec
) {

    public static ClassMetrics empty() {
        return new ClassMetrics(0, 0, null, 0, 0, 0);
    }
}
