package com.zecinsight.insight;

/**
 * Tallies over the latest wallet scores of a project. For an empty project averageScore is NaN and all
 * percentages are 0; callers check {@code totalWallets} first.
 */
public record ProjectHealth(
        int totalWallets,
        HealthDistribution healthDistribution,
        RiskDistribution riskDistribution,
        double healthPercentage,
        double atRiskPercentage,
        double churnPercentage,
        double averageScore
) {

    public record HealthDistribution(int healthy, int atRisk, int churn) {
    }

    public record RiskDistribution(int low, int medium, int high) {
    }
}
