package com.zecinsight.dashboard;

import com.zecinsight.alert.Alert;
import com.zecinsight.analytics.FunnelStage;
import com.zecinsight.analytics.RetentionCohort;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Renders a dashboard as section-labelled CSV. Each section is a title line, a header line and its rows,
 * followed by a blank line.
 */
public final class ReportExporter {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator('\n')
            .build();

    private ReportExporter() {
    }

    public static String toCsv(ProjectDashboard dashboard) {
        StringBuilder out = new StringBuilder();
        try (CSVPrinter csv = new CSVPrinter(out, FORMAT)) {
            ProjectOverview o = dashboard.overview();
            csv.printRecord("OVERVIEW");
            csv.printRecord("Metric", "Value");
            csv.printRecord("Total Wallets", o.totalWallets());
            csv.printRecord("Active Wallets", o.activeWallets());
            csv.printRecord("Total Transactions", o.totalTransactions());
            csv.printRecord("Total Volume (ZEC)", o.totalVolumeZec().toPlainString());
            csv.printRecord("Avg Productivity Score", fmt(o.avgProductivityScore()));
            csv.println();

            ProductivitySummary p = dashboard.productivity();
            csv.printRecord("PRODUCTIVITY");
            csv.printRecord("Metric", "Value");
            csv.printRecord("Avg Total Score", fmt(p.avgTotalScore()));
            csv.printRecord("Avg Retention Score", fmt(p.avgRetentionScore()));
            csv.printRecord("Avg Adoption Score", fmt(p.avgAdoptionScore()));
            csv.printRecord("Avg Activity Score", fmt(p.avgActivityScore()));
            csv.printRecord("At Risk Wallets", p.atRiskWallets());
            csv.printRecord("Churn Wallets", p.churnWallets());
            csv.println();

            csv.printRecord("RETENTION COHORTS");
            csv.printRecord("Cohort Week", "Size", "Week 1", "Week 2", "Week 3", "Week 4");
            for (RetentionCohort c : dashboard.cohorts()) {
                csv.printRecord(c.cohortWeek(), c.cohortSize(), fmt(c.week1()), fmt(c.week2()),
                        fmt(c.week3()), fmt(c.week4()));
            }
            csv.println();

            csv.printRecord("ADOPTION FUNNEL");
            csv.printRecord("Stage", "Wallet Count", "Percentage");
            for (FunnelStage s : dashboard.adoption().stages()) {
                csv.printRecord(s.stage().getValue(), s.walletsReached(), fmt(s.percentage()));
            }

            if (dashboard.alerts() != null && !dashboard.alerts().all().isEmpty()) {
                csv.println();
                csv.printRecord("ALERTS");
                csv.printRecord("Type", "Severity", "Title");
                for (Alert a : dashboard.alerts().all()) {
                    csv.printRecord(a.type().getValue(), a.severity().getValue(), a.title());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("CSV export failed for project " + dashboard.projectId(), e);
        }
        return out.toString();
    }

    /** Two decimals; null stays an empty cell. */
    private static String fmt(Double v) {
        return v == null ? null : String.format(Locale.ROOT, "%.2f", v);
    }
}
