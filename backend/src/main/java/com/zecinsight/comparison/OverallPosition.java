package com.zecinsight.comparison;

/**
 * score is the mean 1..5 range score over metrics with a benchmark; 0 with position UNKNOWN.
 */
public record OverallPosition(MarketPosition position, double score, int metricsCompared) {

    public static OverallPosition unknown() {
        return new OverallPosition(MarketPosition.UNKNOWN, 0, 0);
    }
}
