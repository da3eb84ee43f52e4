package com.zecinsight.analytics;

import java.util.List;

/**
 * Funnel over created, first_tx, feature_usage, recurring, high_value. overallAdoptionRate is the mean of
 * the five stage percentages.
 */
public record AdoptionFunnel(int totalWallets, List<FunnelStage> stages, double overallAdoptionRate) {
}
