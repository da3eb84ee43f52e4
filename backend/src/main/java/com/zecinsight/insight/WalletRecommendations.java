package com.zecinsight.insight;

import com.zecinsight.domain.Recommendation;
import com.zecinsight.domain.RiskLevel;
import com.zecinsight.domain.WalletHealthStatus;

import java.time.Instant;
import java.util.List;

public record WalletRecommendations(
        String walletId,
        int totalScore,
        WalletHealthStatus status,
        RiskLevel riskLevel,
        List<DecliningMetric> decliningMetrics,
        List<Recommendation> recommendations,
        Instant generatedAt
) {
}
