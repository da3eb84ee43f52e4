package com.zecinsight.shielded;

/**
 * One wallet's activity over the analysis window. productivityScore is null for wallets never scored.
 */
public record WalletUsage(
        String walletId,
        long totalTransactions,
        long shieldedTransactions,
        long volumeZatoshi,
        int activeDays,
        Integer productivityScore
) {

    public double shieldedPercentage() {
        return totalTransactions == 0 ? 0 : (double) shieldedTransactions * 100 / totalTransactions;
    }
}
