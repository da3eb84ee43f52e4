package com.zecinsight.comparison;

import java.util.List;

/**
 * type is "improvement" for an underperforming metric or "strength" for the single reinforcement entry.
 */
public record ComparisonRecommendation(
        String metric,
        int priority,
        String type,
        String title,
        String description,
        List<String> actions
) {
}
