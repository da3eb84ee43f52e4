package com.zecinsight.analytics;

import com.zecinsight.domain.MetricType;

import java.time.Instant;

/**
 * The four comparison metrics of a project, each rounded to 2 decimals.
 */
public record ProjectMetrics(
        String projectId,
        String projectName,
        String category,
        double productivity,
        double retention,
        double adoption,
        double churn,
        Instant calculatedAt
) {

    public double value(MetricType metric) {
        return switch (metric) {
            case PRODUCTIVITY -> productivity;
            case RETENTION -> retention;
            case ADOPTION -> adoption;
            case CHURN -> churn;
        };
    }
}
