package com.zecinsight.benchmark;

/**
 * Difference between a value and a benchmark percentile. When status is NO_BENCHMARK every numeric
 * field is null and must not be read.
 */
public record PerformanceGap(Double gap, Double percentage, GapStatus status, Double targetValue, Double currentValue) {

    public static PerformanceGap noBenchmark(double currentValue) {
        return new PerformanceGap(null, null, GapStatus.NO_BENCHMARK, null, currentValue);
    }
}
