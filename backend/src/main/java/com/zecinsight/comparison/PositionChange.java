package com.zecinsight.comparison;

import java.util.Map;

/**
 * Movement of a project's market position over {@code periodDays}. Per-metric change is the difference in
 * gap percentage between today's benchmarks and those in force {@code periodDays} ago; null when either
 * side had no benchmark.
 */
public record PositionChange(
        String projectId,
        OverallPosition currentPosition,
        OverallPosition previousPosition,
        String trend,
        Map<String, MetricChange> changes,
        int periodDays
) {

    public record MetricChange(Double change, String direction) {
    }
}
