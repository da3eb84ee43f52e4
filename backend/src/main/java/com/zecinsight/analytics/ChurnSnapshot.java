package com.zecinsight.analytics;

/**
 * Latest-score tallies for a project. Percentages are 0..100 of totalWallets, 0 for an empty project.
 */
public record ChurnSnapshot(
        int totalWallets,
        int churnedWallets,
        int atRiskWallets,
        int highRiskWallets,
        double churnRate,
        double atRiskPercentage,
        double highRiskPercentage
) {
}
