package com.zecinsight.scoring;

import com.zecinsight.domain.RiskLevel;
import com.zecinsight.domain.WalletHealthStatus;

/**
 * Component scores (each 0..100) and the weighted total.
 */
public record ScoreBreakdown(
        int retentionScore,
        int adoptionScore,
        int churnScore,
        int diversityScore,
        int activityScore,
        int totalScore,
        WalletHealthStatus status,
        RiskLevel riskLevel
) {
}
