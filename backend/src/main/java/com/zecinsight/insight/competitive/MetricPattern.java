package com.zecinsight.insight.competitive;

import com.zecinsight.domain.MetricType;

import java.util.List;

/**
 * What top performers of a category achieve on one metric, read off its latest benchmark.
 */
public record MetricPattern(
        MetricType metric,
        double topPerformerThreshold,
        double medianPerformance,
        double competitiveThreshold,
        List<String> insights,
        List<String> keyDrivers
) {
}
