package com.zecinsight.dashboard;

import com.zecinsight.alert.Alert;
import com.zecinsight.alert.AlertReport;
import com.zecinsight.alert.AlertSeverity;
import com.zecinsight.alert.AlertSummary;
import com.zecinsight.alert.AlertType;
import com.zecinsight.analytics.AdoptionFunnel;
import com.zecinsight.analytics.FunnelStage;
import com.zecinsight.analytics.RetentionCohort;
import com.zecinsight.scoring.AdoptionStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReportExporterTest {

    private static ProjectDashboard dashboard(AlertReport alerts) {
        return new ProjectDashboard("p1", "Shield Swap",
                new ProjectOverview(12, 7, 340, new BigDecimal("12.50000000"), 61.5),
                new ProductivitySummary(61.5, 55, 70, 64.25, 40, 3, 1),
                List.of(new RetentionCohort(LocalDate.of(2025, 3, 3), 4, 50.0, 25.0, null, null)),
                new AdoptionFunnel(12, List.of(
                        new FunnelStage(AdoptionStage.CREATED, 12, 100, null),
                        new FunnelStage(AdoptionStage.FIRST_TX, 9, 75, 25.0)), 87.5),
                alerts, DashboardInsights.empty(), Instant.now());
    }

    @Test
    @DisplayName("csv has one labelled section per dashboard part")
    void toCsv_sections() {
        String csv = ReportExporter.toCsv(dashboard(null));
        List<String> lines = List.of(csv.split("\n", -1));

        assertThat(lines).startsWith("OVERVIEW", "Metric,Value", "Total Wallets,12");
        assertThat(lines).contains("Total Volume (ZEC),12.50000000", "Avg Productivity Score,61.50",
                "PRODUCTIVITY", "Avg Activity Score,64.25", "Churn Wallets,1",
                "RETENTION COHORTS", "2025-03-03,4,50.00,25.00,,",
                "ADOPTION FUNNEL", "created,12,100.00", "first_tx,9,75.00");
        assertThat(csv).doesNotContain("ALERTS");
    }

    @Test
    @DisplayName("alerts section is appended when alerts exist and titles are quoted when needed")
    void toCsv_alerts() {
        Alert alert = new Alert(AlertType.CHURN_CRITICAL, AlertSeverity.CRITICAL, "Churn at 45%, act now",
                "m", Map.of(), Instant.now());
        AlertReport report = new AlertReport("p1", List.of(), List.of(alert), List.of(), List.of(),
                AlertSummary.of(List.of(alert)), Instant.now());

        String csv = ReportExporter.toCsv(dashboard(report));

        assertThat(csv).endsWith("ALERTS\nType,Severity,Title\nchurn_critical,critical,\"Churn at 45%, act now\"\n");
    }

    @Test
    @DisplayName("embedded quotes in an alert title are doubled")
    void toCsv_alertTitleWithQuotes() {
        Alert alert = new Alert(AlertType.CHURN_CRITICAL, AlertSeverity.CRITICAL, "Wallets marked \"at risk\"",
                "m", Map.of(), Instant.now());
        AlertReport report = new AlertReport("p1", List.of(), List.of(alert), List.of(), List.of(),
                AlertSummary.of(List.of(alert)), Instant.now());

        String csv = ReportExporter.toCsv(dashboard(report));

        assertThat(csv).contains("churn_critical,critical,\"Wallets marked \"\"at risk\"\"\"\n");
    }
}
