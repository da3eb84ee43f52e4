package com.zecinsight.shielded;

import com.zecinsight.common.Numbers;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Pure classification, averaging and correlation over per-wallet usage rows.
 */
public final class ShieldedAnalyzer {

    static final int MIN_CORRELATION_SAMPLES = 3;
    static final double SCORE_GAP_FINDING = 10;
    static final double VOLUME_RATIO_FINDING = 1.5;
    static final double LOW_ADOPTION = 20;
    static final double HIGH_ADOPTION = 60;

    private ShieldedAnalyzer() {
    }

    public static Map<PrivacyUsageClass, List<WalletUsage>> classify(List<WalletUsage> wallets) {
        Map<PrivacyUsageClass, List<WalletUsage>> out = new EnumMap<>(PrivacyUsageClass.class);
        for (PrivacyUsageClass c : PrivacyUsageClass.values()) {
            out.put(c, new ArrayList<>());
        }
        for (WalletUsage w : wallets) {
            out.get(PrivacyUsageClass.of(w.shieldedPercentage())).add(w);
        }
        return out;
    }

    public static ClassMetrics metrics(List<WalletUsage> group, int totalWallets) {
        if (group.isEmpty()) {
            return ClassMetrics.empty();
        }
        List<Integer> scores = group.stream().map(WalletUsage::productivityScore).filter(Objects::nonNull).toList();
        Double avgScore = scores.isEmpty() ? null
                : Numbers.round2(scores.stream().mapToInt(Integer::intValue).average().orElse(0));
        return new ClassMetrics(group.size(),
                Numbers.round2(Numbers.percentage(group.size(), totalWallets)),
                avgScore,
                Numbers.round2(group.stream().mapToInt(WalletUsage::activeDays).average().orElse(0)),
                Numbers.round2(group.stream().mapToLong(WalletUsage::totalTransactions).average().orElse(0)),
                Numbers.round2(group.stream().mapToLong(WalletUsage::volumeZatoshi).average().orElse(0) / 100_000_000d));
    }

    /**
     * Pearson correlation over the rows where both values exist. Strength: |r| at least 0.7 strong,
     * 0.4 moderate, 0.2 weak, else negligible.
     */
    public static Correlation correlate(List<double[]> pairs) {
        int n = pairs.size();
        if (n < MIN_CORRELATION_SAMPLES) {
            return new Correlation(0, "insufficient_data", n);
        }
        double xMean = pairs.stream().mapToDouble(p -> p[0]).average().orElse(0);
        double yMean = pairs.stream().mapToDouble(p -> p[1]).average().orElse(0);
        double num = 0;
        double xs = 0;
        double ys = 0;
        for (double[] p : pairs) {
            double dx = p[0] - xMean;
            double dy = p[1] - yMean;
            num += dx * dy;
            xs += dx * dx;
            ys += dy * dy;
        }
        double denominator = Math.sqrt(xs * ys);
        double r = denominator == 0 ? 0 : num / denominator;
        double abs = Math.abs(r);
        String strength;
        if (abs >= 0.7) {
            strength = "strong";
        } else if (abs >= 0.4) {
            strength = "moderate";
        } else if (abs >= 0.2) {
            strength = "weak";
        } else {
            strength = "negligible";
        }
        return new Correlation(Math.round(r * 1000) / 1000.0, strength, n);
    }

    public static Map<String, Correlation> correlations(List<WalletUsage> wallets) {
        Map<String, Correlation> out = new LinkedHashMap<>();
        out.put("shielded_vs_productivity", correlate(wallets.stream()
                .filter(w -> w.productivityScore() != null)
                .map(w -> new double[]{w.shieldedPercentage(), w.productivityScore()})
                .toList()));
        out.put("shielded_vs_active_days", correlate(pairs(wallets, w -> w.activeDays())));
        out.put("shielded_vs_transactions", correlate(pairs(wallets, w -> w.totalTransactions())));
        return out;
    }

    private static List<double[]> pairs(List<WalletUsage> wallets, ToDoubleFunction<WalletUsage> y) {
        return wallets.stream().map(w -> new double[]{w.shieldedPercentage(), y.applyAsDouble(w)}).toList();
    }

    /** Findings first, then recommendations; either may be empty. */
    public static Insights insights(Map<PrivacyUsageClass, ClassMetrics> byClass, double adoptionRate) {
        List<String> findings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        findings.add(String.format(Locale.ROOT, "%.1f%% of wallets use privacy features", adoptionRate));
        if (adoptionRate < LOW_ADOPTION) {
            recommendations.add("Low privacy adoption - consider privacy education and UX improvements");
        } else if (adoptionRate > HIGH_ADOPTION) {
            findings.add("High privacy adoption indicates a strong privacy-conscious user base");
        }

        ClassMetrics heavy = byClass.get(PrivacyUsageClass.SHIELDED_HEAVY);
        ClassMetrics moderate = byClass.get(PrivacyUsageClass.SHIELDED_MODERATE);
        ClassMetrics transparent = byClass.get(PrivacyUsageClass.TRANSPARENT_ONLY);
        if (heavy.avgProductivityScore() != null && transparent.avgProductivityScore() != null) {
            double diff = heavy.avgProductivityScore() - transparent.avgProductivityScore();
            if (diff > SCORE_GAP_FINDING) {
                findings.add(String.format(Locale.ROOT,
                        "Heavy privacy users score %.1f points higher on productivity", diff));
            } else if (-diff > SCORE_GAP_FINDING) {
                findings.add("Transparent users score higher on productivity - investigate privacy UX barriers");
                recommendations.add("Analyze privacy feature usability and user education needs");
            }
        }
        if (heavy.walletCount() > 0 && transparent.walletCount() > 0
                && heavy.avgVolumeZec() > transparent.avgVolumeZec() * VOLUME_RATIO_FINDING) {
            findings.add("Privacy users transact significantly higher volumes");
            recommendations.add("Focus on privacy features for high-value user acquisition");
        }
        if (heavy.walletCount() > moderate.walletCount() * 2) {
            findings.add("Users tend toward heavy privacy usage rather than moderate");
        }
        return new Insights(findings, recommendations);
    }

    public record Insights(List<String> keyFindings, List<String> recommendations) {
    }
}
