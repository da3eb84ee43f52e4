package com.zecinsight.alert;

import com.zecinsight.analytics.AdoptionFunnel;
import com.zecinsight.analytics.ChurnSnapshot;
import com.zecinsight.analytics.FunnelStage;
import com.zecinsight.analytics.RetentionCohort;
import com.zecinsight.analytics.ShieldedDailyActivity;
import com.zecinsight.domain.AlertThresholds;
import com.zecinsight.scoring.AdoptionStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AlertEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-31T12:00:00Z");
    private final AlertThresholds thresholds = new AlertThresholds();

    private static RetentionCohort cohort(String week, Double week1) {
        return new RetentionCohort(LocalDate.parse(week), 20, week1, null, null, null);
    }

    private static List<ShieldedDailyActivity> days(int[] tx, long[] volume) {
        List<ShieldedDailyActivity> out = new ArrayList<>();
        for (int i = 0; i < tx.length; i++) {
            out.add(new ShieldedDailyActivity(LocalDate.of(2025, 3, 1).plusDays(i), tx[i], volume[i]));
        }
        return out;
    }

    @Test
    @DisplayName("halved week-1 retention raises a critical drop and a critical level alert")
    void checkRetention_bigDrop_criticalAlerts() {
        List<Alert> alerts = AlertEngine.checkRetention(
                List.of(cohort("2025-03-17", 30.0), cohort("2025-03-10", 60.0)), thresholds.getRetention(), NOW);

        assertThat(alerts).extracting(Alert::type)
                .containsExactly(AlertType.RETENTION_DROP, AlertType.RETENTION_CRITICAL);
        assertThat(alerts.get(0).severity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alerts.get(0).message()).isEqualTo("Week 1 retention dropped 50.0% from 60.0% to 30.0%");
        assertThat(alerts.get(0).data()).containsEntry("drop_percentage", 50.0);
    }

    @Test
    @DisplayName("small drop only triggers the warning level alert")
    void checkRetention_smallDrop_warningOnly() {
        List<Alert> alerts = AlertEngine.checkRetention(
                List.of(cohort("2025-03-17", 54.0), cohort("2025-03-10", 60.0)), thresholds.getRetention(), NOW);

        assertThat(alerts).extracting(Alert::type).containsExactly(AlertType.RETENTION_WARNING);
        assertThat(alerts.get(0).severity()).isEqualTo(AlertSeverity.WARNING);
    }

    @Test
    @DisplayName("fewer than two cohorts with elapsed week 1 raise nothing")
    void checkRetention_notEnoughCohorts() {
        assertThat(AlertEngine.checkRetention(
                List.of(cohort("2025-03-24", null), cohort("2025-03-17", 10.0)), thresholds.getRetention(), NOW))
                .isEmpty();
    }

    @Test
    @DisplayName("churn at the critical rate with many high-risk wallets fires all three churn alerts")
    void checkChurn_allRules() {
        ChurnSnapshot snapshot = new ChurnSnapshot(10, 4, 2, 3, 40, 20, 30);

        List<Alert> alerts = AlertEngine.checkChurn(snapshot, thresholds.getChurn(), NOW);

        assertThat(alerts).extracting(Alert::type)
                .containsExactly(AlertType.CHURN_CRITICAL, AlertType.HIGH_RISK_WALLETS, AlertType.COMBINED_RISK);
        assertThat(alerts).extracting(Alert::severity)
                .containsExactly(AlertSeverity.CRITICAL, AlertSeverity.WARNING, AlertSeverity.CRITICAL);
        assertThat(alerts.get(2).data()).containsEntry("affected_wallets", 6);
    }

    @Test
    @DisplayName("empty project raises no churn alerts")
    void checkChurn_empty() {
        assertThat(AlertEngine.checkChurn(new ChurnSnapshot(0, 0, 0, 0, 0, 0, 0), thresholds.getChurn(), NOW)).isEmpty();
    }

    @Test
    @DisplayName("funnel drop-offs grade by size and low conversion skips unreached stages")
    void checkFunnel_dropOffsAndConversion() {
        AdoptionFunnel funnel = new AdoptionFunnel(10, List.of(
                new FunnelStage(AdoptionStage.CREATED, 10, 100, null),
                new FunnelStage(AdoptionStage.FIRST_TX, 5, 50, 50.0),
                new FunnelStage(AdoptionStage.FEATURE_USAGE, 1, 10, 80.0),
                new FunnelStage(AdoptionStage.RECURRING, 1, 10, 0.0),
                new FunnelStage(AdoptionStage.HIGH_VALUE, 0, 0, 100.0)), 34);

        List<Alert> alerts = AlertEngine.checkFunnel(funnel, thresholds.getFunnel(), NOW);

        List<Alert> drops = alerts.stream().filter(a -> a.type() == AlertType.FUNNEL_DROP_OFF).toList();
        assertThat(drops).extracting(Alert::severity)
                .containsExactly(AlertSeverity.WARNING, AlertSeverity.CRITICAL, AlertSeverity.CRITICAL);
        assertThat(drops.get(0).title()).isEqualTo("High drop-off at first_tx stage");
        List<Alert> lowConversion = alerts.stream().filter(a -> a.type() == AlertType.LOW_CONVERSION).toList();
        assertThat(lowConversion).extracting(a -> a.data().get("stage"))
                .containsExactly("feature_usage", "recurring");
    }

    @Test
    @DisplayName("latest day far above average is a shielded spike")
    void checkShielded_spike() {
        List<Alert> alerts = AlertEngine.checkShielded(
                days(new int[]{10, 10, 10, 10, 10, 10, 40}, new long[7]), thresholds.getShielded(), NOW);

        assertThat(alerts).extracting(Alert::type).containsExactly(AlertType.SHIELDED_SPIKE);
        assertThat(alerts.get(0).severity()).isEqualTo(AlertSeverity.INFO);
        assertThat(alerts.get(0).data()).containsEntry("date", "2025-03-07");
    }

    @Test
    @DisplayName("latest day far below a busy average is a shielded drop")
    void checkShielded_drop() {
        List<Alert> alerts = AlertEngine.checkShielded(
                days(new int[]{20, 20, 20, 20, 20, 20, 2}, new long[7]), thresholds.getShielded(), NOW);

        assertThat(alerts).extracting(Alert::type).containsExactly(AlertType.SHIELDED_DROP);
    }

    @Test
    @DisplayName("large volume change against average is reported with its direction")
    void checkShielded_volumeChange() {
        List<Alert> alerts = AlertEngine.checkShielded(
                days(new int[7], new long[]{0, 0, 0, 0, 0, 0, 200_000_000L}), thresholds.getShielded(), NOW);

        assertThat(alerts).extracting(Alert::type).containsExactly(AlertType.SHIELDED_VOLUME_CHANGE);
        assertThat(alerts.get(0).title()).isEqualTo("Significant shielded volume increase");
    }

    @Test
    @DisplayName("less than a week of shielded data raises nothing")
    void checkShielded_tooFewDays() {
        assertThat(AlertEngine.checkShielded(days(new int[]{1, 100}, new long[2]), thresholds.getShielded(), NOW))
                .isEmpty();
    }

    @Test
    void summary_countsBySeverity() {
        List<Alert> alerts = AlertEngine.checkChurn(new ChurnSnapshot(10, 4, 2, 3, 40, 20, 30), thresholds.getChurn(), NOW);
        assertThat(AlertSummary.of(alerts)).isEqualTo(new AlertSummary(3, 2, 1, 0));
    }
}
