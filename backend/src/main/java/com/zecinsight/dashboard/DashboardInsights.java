package com.zecinsight.dashboard;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zecinsight.domain.Recommendation;
import com.zecinsight.insight.ProjectHealth;

import java.util.List;

/**
 * Health tallies and the highest-priority recommendations, computed without persisting anything.
 * health is null when the project has no scored wallet.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DashboardInsights(ProjectHealth health, List<Recommendation> topRecommendations) {

    public static DashboardInsights empty() {
        return new DashboardInsights(null, List.of());
    }
}
