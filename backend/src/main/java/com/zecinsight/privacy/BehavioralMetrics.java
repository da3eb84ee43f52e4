package com.zecinsight.privacy;

public record BehavioralMetrics(
        int activeDays,
        long totalTransactions,
        Integer avgProductivityScore,
        Integer avgRetentionScore,
        Integer avgAdoptionScore
) {
}
