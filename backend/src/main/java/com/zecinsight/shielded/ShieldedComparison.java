package com.zecinsight.shielded;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Shielded against transparent users of one project. byClass is keyed by the usage class value and always
 * holds all four classes; correlations pair shielded percentage with productivity, active days and
 * transaction count.
 */
public record ShieldedComparison(
        String projectId,
        LocalDate startDate,
        LocalDate endDate,
        int days,
        int totalWallets,
        double overallShieldedPercentage,
        double privacyAdoptionRate,
        Map<String, ClassMetrics> byClass,
        Map<String, Correlation> correlations,
        List<String> keyFindings,
        List<String> recommendations,
        Instant analyzedAt
) {
}
