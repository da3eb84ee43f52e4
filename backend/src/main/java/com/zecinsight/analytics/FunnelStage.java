package com.zecinsight.analytics;

import com.zecinsight.scoring.AdoptionStage;

/**
 * One funnel step. dropOffPercentage is the share lost since the previous stage; null for the first stage.
 */
public record FunnelStage(AdoptionStage stage, int walletsReached, double percentage, Double dropOffPercentage) {
}
