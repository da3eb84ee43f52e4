package com.zecinsight.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zecinsight.domain.MetricSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Result of checking one task. {@code error} is set, and the other fields empty, when the check failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusReport(
        String recommendationId,
        boolean isCompleted,
        double completionPercentage,
        List<IndicatorCheck> indicatorsMet,
        List<IndicatorCheck> indicatorsPending,
        Effectiveness effectiveness,
        MetricSnapshot currentMetrics,
        Instant checkedAt,
        String error
) {

    static TaskStatusReport failed(String recommendationId, String error) {
        return new TaskStatusReport(recommendationId, false, 0, null, null, null, null, Instant.now(), error);
    }
}
