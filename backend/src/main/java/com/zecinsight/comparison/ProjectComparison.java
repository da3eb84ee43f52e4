package com.zecinsight.comparison;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zecinsight.analytics.ProjectMetrics;
import com.zecinsight.benchmark.TargetPercentile;

import java.time.Instant;
import java.util.List;

/**
 * Project-vs-market result. status is "compared", or "no_benchmarks" when the category has no benchmark at
 * all; in that case only the project metrics and message are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectComparison(
        String projectId,
        String projectName,
        String category,
        String status,
        String message,
        TargetPercentile targetPercentile,
        List<MetricComparison> comparisons,
        PerformanceGaps performanceGaps,
        List<ComparisonRecommendation> recommendations,
        OverallPosition overallPosition,
        ProjectMetrics projectMetrics,
        Instant comparedAt
) {

    public static final String STATUS_COMPARED = "compared";
    public static final String STATUS_NO_BENCHMARKS = "no_benchmarks";

    public boolean hasBenchmarks() {
        return STATUS_COMPARED.equals(status);
    }
}
