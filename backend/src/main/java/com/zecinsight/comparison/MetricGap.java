package com.zecinsight.comparison;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zecinsight.domain.MetricType;

/**
 * Bucketed gap entry. severity is set for underperforming metrics only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricGap(
        MetricType metric,
        double current,
        Double target,
        Double gap,
        Double gapPercentage,
        GapSeverity severity
) {
}
