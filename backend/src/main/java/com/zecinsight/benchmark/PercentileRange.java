package com.zecinsight.benchmark;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bucket of a value relative to a benchmark's percentiles. {@code score} is the 1..5 position scale;
 * UNKNOWN has score 0 and means no benchmark.
 */
public enum PercentileRange {
    BELOW_25("below_25", 1),
    P25_50("25_50", 2),
    P50_75("50_75", 3),
    P75_90("75_90", 4),
    ABOVE_90("above_90", 5),
    UNKNOWN("unknown", 0);

    private final String value;
    private final int score;

    PercentileRange(String value, int score) {
        this.value = value;
        this.score = score;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getScore() {
        return score;
    }
}
