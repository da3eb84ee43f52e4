package com.zecinsight.comparison;

import com.zecinsight.benchmark.GapStatus;
import com.zecinsight.benchmark.PercentileRange;
import com.zecinsight.benchmark.TargetPercentile;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Side-by-side matrix. metrics and leaders are keyed by metric wire value; a leader is null when no project
 * has a value.
 */
public record MultiProjectComparison(
        List<ProjectEntry> projects,
        Map<String, List<Cell>> metrics,
        Map<String, String> leaders,
        TargetPercentile targetPercentile,
        Instant comparedAt
) {

    public record ProjectEntry(String id, String name, String category, OverallPosition position) {
    }

    public record Cell(String projectId, double value, Double gap, GapStatus status, PercentileRange percentileRange) {
    }
}
