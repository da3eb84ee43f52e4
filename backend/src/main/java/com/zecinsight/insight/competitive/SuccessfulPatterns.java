package com.zecinsight.insight.competitive;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zecinsight.domain.MetricType;

import java.util.List;
import java.util.Map;

/**
 * Patterns keyed by metric wire name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SuccessfulPatterns(
        boolean available,
        String category,
        String message,
        Map<String, MetricPattern> patterns,
        List<String> successFactors,
        int sampleSize
) {

    public static SuccessfulPatterns unavailable(String category) {
        return new SuccessfulPatterns(false, category, "No benchmark data available for " + category,
                Map.of(), List.of(), 0);
    }

    public MetricPattern pattern(MetricType metric) {
        return patterns.get(metric.getValue());
    }
}
