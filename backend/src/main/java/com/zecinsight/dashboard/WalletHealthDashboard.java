package com.zecinsight.dashboard;

import com.zecinsight.domain.RiskLevel;
import com.zecinsight.domain.WalletHealthStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Latest-score distribution for a project. Map keys are the lowercase status and risk values.
 */
public record WalletHealthDashboard(
        String projectId,
        int totalWallets,
        Map<String, Bucket> byStatus,
        Map<String, Bucket> byRiskLevel,
        List<WalletScoreRow> lowestScoring,
        Instant generatedAt
) {

    public record Bucket(int count, double avgScore) {
    }

    public record WalletScoreRow(String walletId, int totalScore, WalletHealthStatus status, RiskLevel riskLevel) {
    }
}
