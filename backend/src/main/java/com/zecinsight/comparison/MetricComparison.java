package com.zecinsight.comparison;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zecinsight.benchmark.GapStatus;
import com.zecinsight.benchmark.PercentileRange;
import com.zecinsight.domain.MetricType;

/**
 * One metric of a project against its category benchmark. With status NO_BENCHMARK the target, gap and
 * benchmark fields are null and the range is UNKNOWN.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricComparison(
        MetricType metric,
        double currentValue,
        Double benchmarkTarget,
        Double gap,
        Double gapPercentage,
        GapStatus status,
        PercentileRange percentileRange,
        BenchmarkData benchmarkData
) {
}
