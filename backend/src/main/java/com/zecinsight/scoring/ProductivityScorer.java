package com.zecinsight.scoring;

import com.zecinsight.domain.RiskLevel;
import com.zecinsight.domain.WalletHealthStatus;
import com.zecinsight.domain.WalletMetricSample;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pure productivity scoring over daily samples. Bucket tables are additive point grids capped at 100.
 * Weights: retention 0.30, adoption 0.25, churn 0.20, diversity 0.15, activity 0.10.
 */
public final class ProductivityScorer {

    public static final double RETENTION_WEIGHT = 0.30;
    public static final double ADOPTION_WEIGHT = 0.25;
    public static final double CHURN_WEIGHT = 0.20;
    public static final double DIVERSITY_WEIGHT = 0.15;
    public static final double ACTIVITY_WEIGHT = 0.10;

    public static final int HEALTHY_THRESHOLD = 70;
    public static final int AT_RISK_THRESHOLD = 40;
    public static final int LOW_RISK_THRESHOLD = 60;
    public static final int MEDIUM_RISK_THRESHOLD = 30;

    private ProductivityScorer() {
    }

    /**
     * Scores a wallet from its sample history as of {@code today}.
     */
    public static ScoreBreakdown score(List<WalletMetricSample> samples, LocalDate today) {
        List<WalletMetricSample> all = samples == null ? List.of() : samples;
        int retention = retentionScore(within(all, today, 30), today);
        int adoption = adoptionScore(all);
        int churn = churnScore(within(all, today, 60), today);
        int diversity = diversityScore(within(all, today, 30));
        int activity = activityScore(within(all, today, 7));

        int total = (int) Math.round(retention * RETENTION_WEIGHT
                + adoption * ADOPTION_WEIGHT
                + churn * CHURN_WEIGHT
                + diversity * DIVERSITY_WEIGHT
                + activity * ACTIVITY_WEIGHT);
        total = Math.max(0, Math.min(100, total));
        return new ScoreBreakdown(retention, adoption, churn, diversity, activity, total,
                statusFor(total), riskFor(total));
    }

    public static WalletHealthStatus statusFor(int totalScore) {
        if (totalScore >= HEALTHY_THRESHOLD) {
            return WalletHealthStatus.HEALTHY;
        }
        if (totalScore >= AT_RISK_THRESHOLD) {
            return WalletHealthStatus.AT_RISK;
        }
        return WalletHealthStatus.CHURN;
    }

    public static RiskLevel riskFor(int totalScore) {
        if (totalScore >= LOW_RISK_THRESHOLD) {
            return RiskLevel.LOW;
        }
        if (totalScore >= MEDIUM_RISK_THRESHOLD) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }

    static int retentionScore(List<WalletMetricSample> last30, LocalDate today) {
        List<WalletMetricSample> active = last30.stream().filter(AdoptionStage::isActiveDay).toList();
        if (active.isEmpty()) {
            return 0;
        }
        int score = 0;
        int days = active.size();
        if (days >= 15) score += 30;
        else if (days >= 8) score += 20;
        else if (days >= 4) score += 10;
        else score += 5;

        long sinceLast = daysSinceLastActive(active, today).orElse(Long.MAX_VALUE);
        if (sinceLast <= 1) score += 30;
        else if (sinceLast <= 3) score += 20;
        else if (sinceLast <= 7) score += 10;
        else if (sinceLast <= 14) score += 5;

        long volume = active.stream().mapToLong(WalletMetricSample::getVolumeZatoshi).sum();
        if (volume > 100_000_000L) score += 20;
        else if (volume > 10_000_000L) score += 15;
        else if (volume > 1_000_000L) score += 10;
        else if (volume > 0) score += 5;

        score += Math.min(featureDiversity(active) * 5, 20);
        return Math.min(score, 100);
    }

    static int adoptionScore(List<WalletMetricSample> all) {
        Set<AdoptionStage> reached = AdoptionStage.reachedStages(all);
        if (all.isEmpty()) {
            return 0;
        }
        int score = reached.stream().mapToInt(AdoptionStage::getPoints).sum();
        return Math.min(score, 100);
    }

    static int churnScore(List<WalletMetricSample> last60, LocalDate today) {
        if (last60.isEmpty()) {
            return 0;
        }
        int score = 100;
        List<WalletMetricSample> active = last60.stream().filter(AdoptionStage::isActiveDay).toList();

        long sinceLast = daysSinceLastActive(active, today).orElse(Long.MAX_VALUE);
        if (sinceLast > 30) score -= 50;
        else if (sinceLast > 14) score -= 30;
        else if (sinceLast > 7) score -= 15;
        else if (sinceLast > 3) score -= 5;

        double ratio = (double) active.size() / last60.size();
        if (ratio < 0.1) score -= 30;
        else if (ratio < 0.2) score -= 20;
        else if (ratio < 0.3) score -= 10;

        long recentActive = active.stream().filter(s -> !s.getDate().isBefore(today.minusDays(7))).count();
        if (recentActive == 0) score -= 20;
        else if (recentActive <= 1) score -= 10;

        return Math.max(0, Math.min(score, 100));
    }

    static int diversityScore(List<WalletMetricSample> last30) {
        long txCount = last30.stream().mapToLong(WalletMetricSample::getTransactionCount).sum();
        if (txCount == 0) {
            return 0;
        }
        int score = 0;
        if (txCount >= 50) score += 40;
        else if (txCount >= 20) score += 30;
        else if (txCount >= 10) score += 20;
        else if (txCount >= 5) score += 10;
        else score += 5;

        List<WalletMetricSample> active = last30.stream().filter(AdoptionStage::isActiveDay).toList();
        int days = active.size();
        if (days >= 15) score += 30;
        else if (days >= 10) score += 20;
        else if (days >= 5) score += 15;
        else if (days >= 2) score += 10;
        else if (days >= 1) score += 5;

        if (days >= 2) {
            LocalDate first = active.stream().map(WalletMetricSample::getDate).min(LocalDate::compareTo).orElseThrow();
            LocalDate last = active.stream().map(WalletMetricSample::getDate).max(LocalDate::compareTo).orElseThrow();
            double avgHoursBetween = ChronoUnit.DAYS.between(first, last) * 24.0 / (days - 1);
            if (avgHoursBetween <= 168) score += 30;
            else if (avgHoursBetween <= 720) score += 15;
        }
        return Math.min(score, 100);
    }

    static int activityScore(List<WalletMetricSample> last7) {
        List<WalletMetricSample> active = last7.stream().filter(AdoptionStage::isActiveDay).toList();
        int score = 0;
        int days = active.size();
        if (days >= 7) score += 50;
        else if (days >= 5) score += 40;
        else if (days >= 3) score += 30;
        else if (days >= 2) score += 20;
        else if (days >= 1) score += 10;

        long tx = active.stream().mapToLong(WalletMetricSample::getTransactionCount).sum();
        if (tx >= 20) score += 30;
        else if (tx >= 10) score += 20;
        else if (tx >= 5) score += 15;
        else if (tx >= 2) score += 10;
        else if (tx >= 1) score += 5;

        double complexity = active.stream().mapToInt(WalletMetricSample::getFeatureTypeCount).average().orElse(0);
        if (complexity >= 4) score += 20;
        else if (complexity >= 3) score += 15;
        else if (complexity >= 2) score += 10;
        else if (complexity >= 1) score += 5;
        return Math.min(score, 100);
    }

    private static int featureDiversity(List<WalletMetricSample> samples) {
        int maxFeatureTypes = samples.stream().mapToInt(WalletMetricSample::getFeatureTypeCount).max().orElse(0);
        int pools = (samples.stream().anyMatch(s -> s.getShieldedTxCount() > 0) ? 1 : 0)
                + (samples.stream().anyMatch(s -> s.getTransparentTxCount() > 0) ? 1 : 0);
        return Math.max(maxFeatureTypes, pools);
    }

    private static Optional<Long> daysSinceLastActive(List<WalletMetricSample> active, LocalDate today) {
        return active.stream()
                .map(WalletMetricSample::getDate)
                .max(LocalDate::compareTo)
                .map(d -> ChronoUnit.DAYS.between(d, today));
    }

    private static List<WalletMetricSample> within(List<WalletMetricSample> samples, LocalDate today, int days) {
        LocalDate from = today.minusDays(days);
        return samples.stream()
                .filter(s -> s.getDate() != null && !s.getDate().isBefore(from) && !s.getDate().isAfter(today))
                .toList();
    }
}
