package com.zecinsight.dashboard;

public record ProductivitySummary(
        double avgTotalScore,
        double avgRetentionScore,
        double avgAdoptionScore,
        double avgActivityScore,
        double avgDiversityScore,
        int atRiskWallets,
        int churnWallets
) {
}
