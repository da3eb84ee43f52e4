package com.zecinsight.comparison;

import com.zecinsight.analytics.ProjectMetrics;
import com.zecinsight.benchmark.BenchmarkCalculator;
import com.zecinsight.benchmark.GapStatus;
import com.zecinsight.benchmark.PercentileRange;
import com.zecinsight.benchmark.PerformanceGap;
import com.zecinsight.benchmark.TargetPercentile;
import com.zecinsight.common.Numbers;
import com.zecinsight.comparison.config.ComparisonProperties;
import com.zecinsight.domain.Benchmark;
import com.zecinsight.domain.MetricType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pure gap, position and recommendation logic. No I/O.
 */
public class GapAnalyzer {

    static final int STRENGTH_PRIORITY = 3;

    private final ComparisonProperties properties;

    public GapAnalyzer(ComparisonProperties properties) {
        this.properties = properties;
    }

    /**
     * One comparison per metric in {@link MetricType} order. benchmarksByType is keyed by benchmark type.
     */
    public List<MetricComparison> compare(ProjectMetrics metrics, Map<String, Benchmark> benchmarksByType,
                                          TargetPercentile target) {
        List<MetricComparison> out = new ArrayList<>();
        for (MetricType metric : MetricType.values()) {
            double value = metrics.value(metric);
            Benchmark b = benchmarksByType.get(metric.getValue());
            if (b == null) {
                out.add(new MetricComparison(metric, value, null, null, null, GapStatus.NO_BENCHMARK,
                        PercentileRange.UNKNOWN, null));
                continue;
            }
            PerformanceGap gap = BenchmarkCalculator.calculatePerformanceGap(value, b, target);
            out.add(new MetricComparison(metric, value, gap.targetValue(), gap.gap(), gap.percentage(), gap.status(),
                    BenchmarkCalculator.getPercentileRange(value, b), BenchmarkData.of(b)));
        }
        return out;
    }

    /**
     * Buckets metrics with a benchmark: below target by more than the band is underperforming, above by
     * more than the band is outperforming, everything else (exact included) is at target.
     */
    public PerformanceGaps identifyPerformanceGaps(List<MetricComparison> comparisons) {
        List<MetricGap> under = new ArrayList<>();
        List<MetricGap> over = new ArrayList<>();
        List<MetricGap> at = new ArrayList<>();
        for (MetricComparison c : comparisons) {
            if (c.status() == GapStatus.NO_BENCHMARK) {
                continue;
            }
            double abs = Math.abs(c.gapPercentage() == null ? 0 : c.gapPercentage());
            if (c.status() == GapStatus.BELOW_TARGET && abs > properties.getAtTargetBand()) {
                under.add(new MetricGap(c.metric(), c.currentValue(), c.benchmarkTarget(), c.gap(), c.gapPercentage(),
                        severityFor(c.gapPercentage())));
            } else if (c.status() == GapStatus.ABOVE_TARGET && abs > properties.getAtTargetBand()) {
                over.add(new MetricGap(c.metric(), c.currentValue(), c.benchmarkTarget(), c.gap(), c.gapPercentage(), null));
            } else {
                at.add(new MetricGap(c.metric(), c.currentValue(), c.benchmarkTarget(), null, null, null));
            }
        }
        return new PerformanceGaps(under, over, at);
    }

    public GapSeverity severityFor(double gapPercentage) {
        double abs = Math.abs(gapPercentage);
        if (abs > properties.getHighSeverityGap()) {
            return GapSeverity.HIGH;
        }
        if (abs > properties.getMediumSeverityGap()) {
            return GapSeverity.MEDIUM;
        }
        return GapSeverity.LOW;
    }

    public OverallPosition calculateOverallPosition(List<MetricComparison> comparisons) {
        List<MetricComparison> valid = comparisons.stream()
                .filter(c -> c.status() != GapStatus.NO_BENCHMARK && c.percentileRange() != PercentileRange.UNKNOWN)
                .toList();
        if (valid.isEmpty()) {
            return OverallPosition.unknown();
        }
        double avg = valid.stream().mapToInt(c -> c.percentileRange().getScore()).average().orElse(0);
        return new OverallPosition(positionFor(avg), Numbers.round2(avg), valid.size());
    }

    public MarketPosition positionFor(double avgScore) {
        if (avgScore >= properties.getTopPerformerScore()) {
            return MarketPosition.TOP_PERFORMER;
        }
        if (avgScore >= properties.getAboveAverageScore()) {
            return MarketPosition.ABOVE_AVERAGE;
        }
        if (avgScore >= properties.getAverageScore()) {
            return MarketPosition.AVERAGE;
        }
        return MarketPosition.BELOW_AVERAGE;
    }

    /**
     * One improvement per underperforming metric (priority 10/7/5 by severity) plus one strength entry when
     * anything outperforms, sorted by priority descending.
     */
    public List<ComparisonRecommendation> generateComparisonRecommendations(PerformanceGaps gaps) {
        List<ComparisonRecommendation> out = new ArrayList<>();
        for (MetricGap g : gaps.underperforming()) {
            out.add(new ComparisonRecommendation(g.metric().getValue(), priorityFor(g.severity()), "improvement",
                    "Improve " + g.metric().getValue(), describe(g), actionsFor(g.metric())));
        }
        if (!gaps.outperforming().isEmpty()) {
            String metrics = gaps.outperforming().stream().map(g -> g.metric().getValue()).collect(Collectors.joining(", "));
            out.add(new ComparisonRecommendation("strengths", STRENGTH_PRIORITY, "strength", "Leverage Your Strengths",
                    "You're outperforming benchmarks in: " + metrics,
                    List.of("Document and replicate successful strategies",
                            "Share best practices across your organization",
                            "Consider these as competitive advantages in marketing")));
        }
        out.sort(Comparator.comparingInt(ComparisonRecommendation::priority).reversed());
        return out;
    }

    static int priorityFor(GapSeverity severity) {
        if (severity == GapSeverity.HIGH) {
            return 10;
        }
        return severity == GapSeverity.MEDIUM ? 7 : 5;
    }

    private static String describe(MetricGap g) {
        double pct = Math.abs(g.gapPercentage() == null ? 0 : g.gapPercentage());
        return switch (g.metric()) {
            case PRODUCTIVITY -> String.format("Your productivity score (%s) is %s%% below the %s benchmark.",
                    fmt(g.current()), fmt(pct), fmt(g.target()));
            case RETENTION -> String.format("Your retention rate (%s%%) is %s%% below the %s%% benchmark.",
                    fmt(g.current()), fmt(pct), fmt(g.target()));
            case ADOPTION -> String.format("Your adoption rate (%s%%) is %s%% below the %s%% benchmark.",
                    fmt(g.current()), fmt(pct), fmt(g.target()));
            case CHURN -> String.format("Your churn rate (%s%%) is %s%% away from the %s%% benchmark.",
                    fmt(g.current()), fmt(pct), fmt(g.target()));
        };
    }

    private static List<String> actionsFor(MetricType metric) {
        return switch (metric) {
            case PRODUCTIVITY -> List.of("Increase user engagement through targeted campaigns",
                    "Optimize onboarding flow to reduce friction",
                    "Implement retention strategies for at-risk users");
            case RETENTION -> List.of("Analyze drop-off points in user journey",
                    "Implement re-engagement campaigns for inactive users",
                    "Add value-driving features to increase stickiness");
            case ADOPTION -> List.of("Simplify onboarding process",
                    "Add progressive feature discovery",
                    "Provide incentives for completing adoption stages");
            case CHURN -> List.of("Identify and address common churn triggers",
                    "Implement early warning system for at-risk users",
                    "Improve product value proposition");
        };
    }

    private static String fmt(Double v) {
        if (v == null) {
            return "n/a";
        }
        return v == Math.rint(v) ? String.valueOf(v.longValue()) : String.valueOf(Numbers.round2(v));
    }
}
