package com.zecinsight.benchmark;

import java.time.LocalDate;

/**
 * Per (type, category) history summary.
 */
public record BenchmarkStatistics(
        String benchmarkType,
        String category,
        long dataPoints,
        LocalDate earliestDate,
        LocalDate latestDate,
        double avgSampleSize
) {
}
