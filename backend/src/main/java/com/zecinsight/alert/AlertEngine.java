package com.zecinsight.alert;

import com.zecinsight.analytics.AdoptionFunnel;
import com.zecinsight.analytics.ChurnSnapshot;
import com.zecinsight.analytics.FunnelStage;
import com.zecinsight.analytics.RetentionCohort;
import com.zecinsight.analytics.ShieldedDailyActivity;
import com.zecinsight.domain.AlertThresholds;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stateless threshold rules. Whether an alert fires depends only on the inputs and thresholds; urgency
 * escalation happens later, during enrichment.
 */
public final class AlertEngine {

    static final int MAX_RETENTION_COHORTS = 4;
    static final double RETENTION_DROP_CRITICAL = 25;
    static final double COMBINED_RISK_CRITICAL = 60;
    static final int MIN_SHIELDED_DAYS = 7;
    static final double MIN_AVG_TX_FOR_DROP = 10;
    static final double ZATOSHI_PER_ZEC = 100_000_000d;

    private AlertEngine() {
    }

    /**
     * Compares week-1 retention of consecutive cohorts (newest first). Needs at least two cohorts with an
     * elapsed week 1.
     */
    public static List<Alert> checkRetention(List<RetentionCohort> cohorts, AlertThresholds.Retention t, Instant now) {
        List<RetentionCohort> usable = cohorts.stream()
                .filter(c -> c.week1() != null)
                .limit(MAX_RETENTION_COHORTS)
                .toList();
        List<Alert> alerts = new ArrayList<>();
        if (usable.size() < 2) {
            return alerts;
        }
        for (int i = 0; i < usable.size() - 1; i++) {
            RetentionCohort current = usable.get(i);
            RetentionCohort previous = usable.get(i + 1);
            double cur = current.week1();
            double prev = previous.week1();
            if (prev > 0) {
                double dropPct = (prev - cur) / prev * 100;
                if (dropPct >= t.getDropPercentage()) {
                    alerts.add(new Alert(AlertType.RETENTION_DROP,
                            dropPct >= RETENTION_DROP_CRITICAL ? AlertSeverity.CRITICAL : AlertSeverity.WARNING,
                            "Significant retention drop detected",
                            String.format(Locale.ROOT, "Week 1 retention dropped %.1f%% from %.1f%% to %.1f%%", dropPct, prev, cur),
                            data("current_cohort", current.cohortWeek().toString(),
                                    "previous_cohort", previous.cohortWeek().toString(),
                                    "current_retention", cur,
                                    "previous_retention", prev,
                                    "drop_percentage", dropPct),
                            now));
                }
            }
            if (cur < t.getCriticalLevel()) {
                alerts.add(new Alert(AlertType.RETENTION_CRITICAL, AlertSeverity.CRITICAL, "Critical retention level",
                        String.format(Locale.ROOT, "Week 1 retention is critically low at %.1f%% (threshold: %s%%)", cur, num(t.getCriticalLevel())),
                        data("cohort", current.cohortWeek().toString(), "retention", cur, "threshold", t.getCriticalLevel()),
                        now));
            } else if (cur < t.getWarningLevel()) {
                alerts.add(new Alert(AlertType.RETENTION_WARNING, AlertSeverity.WARNING, "Low retention level",
                        String.format(Locale.ROOT, "Week 1 retention is below target at %.1f%% (threshold: %s%%)", cur, num(t.getWarningLevel())),
                        data("cohort", current.cohortWeek().toString(), "retention", cur, "threshold", t.getWarningLevel()),
                        now));
            }
        }
        return alerts;
    }

    public static List<Alert> checkChurn(ChurnSnapshot s, AlertThresholds.Churn t, Instant now) {
        List<Alert> alerts = new ArrayList<>();
        if (s.totalWallets() == 0) {
            return alerts;
        }
        double churnRate = s.churnedWallets() * 100.0 / s.totalWallets();
        double highRiskPct = s.highRiskWallets() * 100.0 / s.totalWallets();
        double atRiskPct = s.atRiskWallets() * 100.0 / s.totalWallets();

        if (churnRate >= t.getCriticalRate()) {
            alerts.add(new Alert(AlertType.CHURN_CRITICAL, AlertSeverity.CRITICAL, "Critical churn rate",
                    String.format(Locale.ROOT, "%.1f%% of wallets are churning (%d/%d)", churnRate, s.churnedWallets(), s.totalWallets()),
                    data("churn_rate", churnRate, "churned_wallets", s.churnedWallets(),
                            "total_wallets", s.totalWallets(), "threshold", t.getCriticalRate()),
                    now));
        }
        if (highRiskPct >= t.getHighRiskPercentage()) {
            alerts.add(new Alert(AlertType.HIGH_RISK_WALLETS, AlertSeverity.WARNING, "High number of at-risk wallets",
                    String.format(Locale.ROOT, "%.1f%% of wallets are at high risk of churning (%d/%d)", highRiskPct, s.highRiskWallets(), s.totalWallets()),
                    data("high_risk_percentage", highRiskPct, "high_risk_wallets", s.highRiskWallets(),
                            "total_wallets", s.totalWallets(), "threshold", t.getHighRiskPercentage()),
                    now));
        }
        double combined = churnRate + atRiskPct;
        if (combined >= COMBINED_RISK_CRITICAL) {
            alerts.add(new Alert(AlertType.COMBINED_RISK, AlertSeverity.CRITICAL, "High combined churn and risk",
                    String.format(Locale.ROOT, "%.1f%% of wallets are churned or at risk", combined),
                    data("churn_rate", churnRate, "at_risk_percentage", atRiskPct, "combined_percentage", combined,
                            "affected_wallets", s.churnedWallets() + s.atRiskWallets(), "total_wallets", s.totalWallets()),
                    now));
        }
        return alerts;
    }

    public static List<Alert> checkFunnel(AdoptionFunnel funnel, AlertThresholds.Funnel t, Instant now) {
        List<Alert> alerts = new ArrayList<>();
        if (funnel.totalWallets() == 0) {
            return alerts;
        }
        List<FunnelStage> stages = funnel.stages();
        for (int i = 0; i < stages.size() - 1; i++) {
            FunnelStage from = stages.get(i);
            FunnelStage to = stages.get(i + 1);
            if (from.walletsReached() == 0) {
                continue;
            }
            double dropOff = (from.walletsReached() - to.walletsReached()) * 100.0 / from.walletsReached();
            if (dropOff >= t.getStageDropThreshold()) {
                String toName = to.stage().getValue();
                alerts.add(new Alert(AlertType.FUNNEL_DROP_OFF,
                        dropOff >= t.getCriticalStageDrop() ? AlertSeverity.CRITICAL : AlertSeverity.WARNING,
                        "High drop-off at " + toName + " stage",
                        String.format(Locale.ROOT, "%.1f%% of users drop off between %s and %s", dropOff, from.stage().getValue(), toName),
                        data("from_stage", from.stage().getValue(), "to_stage", toName,
                                "from_count", from.walletsReached(), "to_count", to.walletsReached(),
                                "drop_off_percentage", dropOff, "threshold", t.getStageDropThreshold()),
                        now));
            }
        }
        for (FunnelStage stage : stages) {
            if (stage.walletsReached() > 0 && stage.percentage() < t.getCriticalConversion()) {
                String name = stage.stage().getValue();
                alerts.add(new Alert(AlertType.LOW_CONVERSION, AlertSeverity.WARNING, "Low conversion rate at " + name,
                        String.format(Locale.ROOT, "Only %.1f%% of wallets reach %s stage", stage.percentage(), name),
                        data("stage", name, "conversion_rate", stage.percentage(), "wallets_achieved", stage.walletsReached(),
                                "total_wallets", funnel.totalWallets(), "threshold", t.getCriticalConversion()),
                        now));
            }
        }
        return alerts;
    }

    /**
     * Latest day against the window average. {@code days} is oldest first; needs a week of data.
     */
    public static List<Alert> checkShielded(List<ShieldedDailyActivity> days, AlertThresholds.Shielded t, Instant now) {
        List<Alert> alerts = new ArrayList<>();
        if (days.size() < MIN_SHIELDED_DAYS) {
            return alerts;
        }
        double avgTx = days.stream().mapToInt(ShieldedDailyActivity::shieldedTxCount).average().orElse(0);
        double avgVolume = days.stream().mapToLong(ShieldedDailyActivity::shieldedVolumeZatoshi).average().orElse(0);
        ShieldedDailyActivity latest = days.get(days.size() - 1);
        int tx = latest.shieldedTxCount();
        long volume = latest.shieldedVolumeZatoshi();
        String date = latest.date().toString();

        if (avgTx > 0 && tx > avgTx * t.getSpikeMultiplier()) {
            alerts.add(new Alert(AlertType.SHIELDED_SPIKE, AlertSeverity.INFO, "Shielded transaction spike detected",
                    String.format(Locale.ROOT, "Shielded transactions increased to %d (%.1fx average)", tx, tx / avgTx),
                    data("current_txs", tx, "average_txs", Math.round(avgTx), "multiplier", tx / avgTx, "date", date),
                    now));
        }
        if (tx < avgTx * t.getDropMultiplier() && avgTx > MIN_AVG_TX_FOR_DROP) {
            alerts.add(new Alert(AlertType.SHIELDED_DROP, AlertSeverity.WARNING, "Shielded transaction drop detected",
                    String.format(Locale.ROOT, "Shielded transactions dropped to %d (%.1f%% of average)", tx, tx / avgTx * 100),
                    data("current_txs", tx, "average_txs", Math.round(avgTx), "percentage_of_average", tx / avgTx * 100, "date", date),
                    now));
        }
        double change = Math.abs(volume - avgVolume);
        if (change > t.getVolumeThreshold()) {
            String direction = volume > avgVolume ? "increase" : "decrease";
            alerts.add(new Alert(AlertType.SHIELDED_VOLUME_CHANGE, AlertSeverity.INFO, "Significant shielded volume " + direction,
                    String.format(Locale.ROOT, "Shielded volume %sd by %.2f ZEC", direction, change / ZATOSHI_PER_ZEC),
                    data("current_volume", volume, "average_volume", Math.round(avgVolume), "change_zatoshi", Math.round(change),
                            "change_zec", change / ZATOSHI_PER_ZEC, "date", date),
                    now));
        }
        return alerts;
    }

    private static Map<String, Object> data(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    private static String num(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
