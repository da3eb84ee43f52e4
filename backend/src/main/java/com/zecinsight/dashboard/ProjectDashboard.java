package com.zecinsight.dashboard;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zecinsight.alert.AlertReport;
import com.zecinsight.analytics.AdoptionFunnel;
import com.zecinsight.analytics.RetentionCohort;

import java.time.Instant;
import java.util.List;

/**
 * One payload per project for the dashboard view. alerts is null when alert evaluation failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectDashboard(
        String projectId,
        String projectName,
        ProjectOverview overview,
        ProductivitySummary productivity,
        List<RetentionCohort> cohorts,
        AdoptionFunnel adoption,
        AlertReport alerts,
        DashboardInsights insights,
        Instant generatedAt
) {
}
