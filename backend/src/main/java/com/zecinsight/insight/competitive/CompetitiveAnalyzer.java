package com.zecinsight.insight.competitive;

import com.zecinsight.comparison.GapSeverity;
import com.zecinsight.comparison.MarketPosition;
import com.zecinsight.comparison.MetricGap;
import com.zecinsight.comparison.ProjectComparison;
import com.zecinsight.domain.Benchmark;
import com.zecinsight.domain.MetricType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed rule tables over a project comparison and its category's latest benchmarks.
 */
public final class CompetitiveAnalyzer {

    static final int MAX_SUCCESS_FACTORS = 8;
    static final double QUICK_WIN_MAX_GAP = 15;

    private static final Map<MetricType, List<String>> KEY_DRIVERS = Map.of(
            MetricType.PRODUCTIVITY, List.of("Consistent user engagement", "High retention rates",
                    "Effective onboarding processes", "Regular feature usage"),
            MetricType.RETENTION, List.of("Value-driven feature set", "Regular engagement campaigns",
                    "Strong community building", "Responsive user support"),
            MetricType.ADOPTION, List.of("Streamlined onboarding", "Clear value proposition",
                    "Progressive feature discovery", "Incentivized early adoption"),
            MetricType.CHURN, List.of("Proactive user engagement", "Early warning systems",
                    "Continuous value delivery", "Strong retention programs"));

    private static final Map<String, List<String>> EMERGING_PATTERNS = Map.of(
            "defi", List.of("Increased focus on user experience and simplicity",
                    "Integration of social features for community building",
                    "Emphasis on security and transparency"),
            "gamefi", List.of("Shift towards sustainable tokenomics",
                    "Focus on gameplay quality over pure earning",
                    "Integration of social and competitive elements"),
            "social_fi", List.of("Privacy-first approaches gaining traction",
                    "Monetization models evolving beyond ads",
                    "Community governance becoming standard"),
            "nft", List.of("Utility-focused NFTs over pure collectibles",
                    "Integration with real-world assets",
                    "Focus on creator empowerment"));

    private static final List<String> DEFAULT_EMERGING = List.of("Market-specific patterns still emerging",
            "Monitor competitor innovations closely", "Focus on user feedback and iteration");

    private static final Map<String, MarketTrends.CategoryInsights> CATEGORY_INSIGHTS = Map.of(
            "defi", new MarketTrends.CategoryInsights(
                    List.of("TVL growth", "Transaction volume", "User retention"),
                    List.of("Security audits", "Liquidity depth", "User experience"),
                    List.of("Complex UX", "High gas fees", "Security vulnerabilities")),
            "gamefi", new MarketTrends.CategoryInsights(
                    List.of("Daily active users", "Session length", "Token economy health"),
                    List.of("Engaging gameplay", "Balanced economy", "Community engagement"),
                    List.of("Unsustainable tokenomics", "Pay-to-win mechanics", "Poor gameplay")),
            "social_fi", new MarketTrends.CategoryInsights(
                    List.of("User engagement", "Content creation rate", "Network effects"),
                    List.of("Privacy features", "Content quality", "Community moderation"),
                    List.of("Spam and bots", "Privacy concerns", "Monetization challenges")));

    private static final MarketTrends.CategoryInsights DEFAULT_CATEGORY_INSIGHTS = new MarketTrends.CategoryInsights(
            List.of("User growth", "Engagement", "Retention"),
            List.of("Product quality", "User experience", "Community"),
            List.of("Poor execution", "Lack of differentiation", "Weak value proposition"));

    private CompetitiveAnalyzer() {
    }

    public static SuccessfulPatterns analyzeSuccessfulPatterns(String category, List<Benchmark> benchmarks) {
        if (benchmarks.isEmpty()) {
            return SuccessfulPatterns.unavailable(category);
        }
        Map<String, MetricPattern> patterns = new LinkedHashMap<>();
        for (MetricType metric : MetricType.values()) {
            find(benchmarks, metric).ifPresent(b -> patterns.put(metric.getValue(), pattern(metric, b)));
        }
        Set<String> factors = new LinkedHashSet<>();
        patterns.values().forEach(p -> factors.addAll(p.keyDrivers()));
        List<String> top = factors.stream().limit(MAX_SUCCESS_FACTORS).toList();
        return new SuccessfulPatterns(true, category, null, patterns, top, benchmarks.get(0).getSampleSize());
    }

    public static MarketTrends identifyCompetitiveTrends(String category, List<Benchmark> benchmarks) {
        if (benchmarks.isEmpty()) {
            return MarketTrends.unavailable(category);
        }
        return new MarketTrends(true, category, null,
                assessMaturity(benchmarks),
                assessIntensity(benchmarks.get(0).getSampleSize()),
                EMERGING_PATTERNS.getOrDefault(key(category), DEFAULT_EMERGING),
                CATEGORY_INSIGHTS.getOrDefault(key(category), DEFAULT_CATEGORY_INSIGHTS));
    }

    static MarketTrends.Maturity assessMaturity(List<Benchmark> benchmarks) {
        Optional<Benchmark> productivity = find(benchmarks, MetricType.PRODUCTIVITY);
        if (productivity.isEmpty()) {
            return new MarketTrends.Maturity("unknown", null, null, List.of());
        }
        Benchmark b = productivity.get();
        double spread = b.getP90() - b.getP25();
        double median = b.getP50();
        if (spread < 20 && median > 70) {
            return new MarketTrends.Maturity("mature", spread, median, List.of(
                    "Market shows high consolidation with established leaders",
                    "High barriers to entry for new projects",
                    "Focus on differentiation and niche positioning"));
        }
        if (spread < 30 && median > 50) {
            return new MarketTrends.Maturity("growing", spread, median, List.of(
                    "Market is consolidating with clear leaders emerging",
                    "Opportunities exist for well-executed projects",
                    "Focus on execution excellence and user experience"));
        }
        return new MarketTrends.Maturity("emerging", spread, median, List.of(
                "Market is still developing with high variance",
                "Significant opportunities for innovation",
                "Focus on finding product-market fit"));
    }

    static MarketTrends.Intensity assessIntensity(int sampleSize) {
        if (sampleSize > 100) {
            return new MarketTrends.Intensity("high", sampleSize, List.of(
                    "Highly competitive market with many players",
                    "Differentiation is critical for success",
                    "Focus on unique value propositions"));
        }
        if (sampleSize > 50) {
            return new MarketTrends.Intensity("moderate", sampleSize, List.of(
                    "Growing competitive landscape",
                    "Opportunities for market share capture",
                    "Focus on execution and user acquisition"));
        }
        return new MarketTrends.Intensity("low", sampleSize, List.of(
                "Less crowded market with room for growth",
                "First-mover advantages available",
                "Focus on rapid iteration and learning"));
    }

    /**
     * One strategic recommendation per underperforming metric that has a pattern, plus a positioning entry
     * unless the project already leads. Sorted by priority, highest first.
     */
    public static List<StrategicRecommendation> generateStrategicRecommendations(ProjectComparison comparison,
                                                                                 SuccessfulPatterns patterns,
                                                                                 MarketTrends trends) {
        List<StrategicRecommendation> recs = new ArrayList<>();
        if (!comparison.hasBenchmarks()) {
            return recs;
        }
        for (MetricGap gap : comparison.performanceGaps().underperforming()) {
            MetricPattern pattern = patterns.available() ? patterns.pattern(gap.metric()) : null;
            if (pattern == null) {
                continue;
            }
            boolean high = gap.severity() == GapSeverity.HIGH;
            recs.add(new StrategicRecommendation(
                    gap.metric().getValue(),
                    priorityFor(gap.severity()),
                    "strategic",
                    "Strategic " + gap.metric().getValue() + " improvement",
                    "Currently at " + gap.current() + ", " + Math.abs(gap.gapPercentage()) + "% below target",
                    "Aim for " + pattern.competitiveThreshold() + " to be competitive",
                    strategyFor(gap.metric(), pattern),
                    high ? "1-2 months" : "2-4 months",
                    high ? "High" : "Medium"));
        }
        if (comparison.overallPosition().position() != MarketPosition.TOP_PERFORMER) {
            List<String> strategy = new ArrayList<>(List.of(
                    "Conduct comprehensive competitive analysis",
                    "Identify unique value propositions",
                    "Focus on underperforming metrics first"));
            if (trends.available()) {
                strategy.add("Align with " + trends.category() + " market trends");
                strategy.addAll(trends.emergingPatterns().stream().limit(2).toList());
            }
            recs.add(new StrategicRecommendation("market_positioning", 8, "strategic",
                    "Improve overall market position",
                    "Currently " + comparison.overallPosition().position().getValue(),
                    "Move towards top_performer status",
                    strategy, "3-6 months", "High"));
        }
        recs.sort(Comparator.comparingInt(StrategicRecommendation::priority).reversed());
        return recs;
    }

    public static MarketPositioning analyzeMarketPositioning(ProjectComparison comparison) {
        int gaps = comparison.hasBenchmarks() ? comparison.performanceGaps().underperforming().size() : 0;
        int strengths = comparison.hasBenchmarks() ? comparison.performanceGaps().outperforming().size() : 0;
        int score = switch (position(comparison)) {
            case TOP_PERFORMER -> 90;
            case ABOVE_AVERAGE -> 70;
            case AVERAGE -> 50;
            case BELOW_AVERAGE -> 30;
            case UNKNOWN -> 0;
        };
        score = clamp(score - gaps * 5 + strengths * 5);
        return new MarketPositioning(comparison.overallPosition(), gaps, strengths, score, List.of(
                "Focus on closing critical performance gaps",
                "Leverage existing strengths in marketing",
                "Monitor competitor movements closely"));
    }

    /** Low-severity underperforming metrics less than 15% off target. */
    public static List<QuickWin> identifyQuickWins(ProjectComparison comparison) {
        if (!comparison.hasBenchmarks()) {
            return List.of();
        }
        return comparison.performanceGaps().underperforming().stream()
                .filter(g -> g.severity() == GapSeverity.LOW
                        && g.gapPercentage() != null && Math.abs(g.gapPercentage()) < QUICK_WIN_MAX_GAP)
                .map(g -> new QuickWin(g.metric(), g.current(), g.target(),
                        g.gap() == null ? 0 : Math.abs(g.gap()), "Low", "Medium", List.of(
                        "Small improvements in " + g.metric().getValue() + " can close the gap",
                        "Focus on incremental optimizations",
                        "Monitor progress weekly")))
                .toList();
    }

    /**
     * Position base (40/30/20/10) plus 15 per outperforming metric, minus 10 per underperforming one,
     * plus 5 per metric at target; clamped to 0..100.
     */
    public static CompetitiveAdvantage calculateCompetitiveAdvantage(ProjectComparison comparison) {
        int score = switch (position(comparison)) {
            case TOP_PERFORMER -> 40;
            case ABOVE_AVERAGE -> 30;
            case AVERAGE -> 20;
            case BELOW_AVERAGE -> 10;
            case UNKNOWN -> 0;
        };
        if (comparison.hasBenchmarks()) {
            score += comparison.performanceGaps().outperforming().size() * 15;
            score -= comparison.performanceGaps().underperforming().size() * 10;
            score += comparison.performanceGaps().atTarget().size() * 5;
        }
        score = clamp(score);
        if (score >= 70) {
            return new CompetitiveAdvantage(score, "Strong", "Strong competitive position with clear advantages");
        }
        if (score >= 40) {
            return new CompetitiveAdvantage(score, "Moderate", "Moderate competitive position with room for improvement");
        }
        return new CompetitiveAdvantage(score, "Weak", "Weak competitive position requiring significant improvement");
    }

    static int priorityFor(GapSeverity severity) {
        return switch (severity) {
            case HIGH -> 10;
            case MEDIUM -> 7;
            case LOW -> 5;
        };
    }

    private static List<String> strategyFor(MetricType metric, MetricPattern pattern) {
        String drivers = String.join(", ", pattern.keyDrivers());
        return switch (metric) {
            case PRODUCTIVITY -> List.of("Focus on " + drivers,
                    "Implement data-driven optimization cycles",
                    "Benchmark against top performers regularly",
                    "Invest in user engagement initiatives");
            case RETENTION -> List.of("Prioritize " + drivers,
                    "Implement early warning systems for churn",
                    "Create re-engagement campaigns",
                    "Build strong community connections");
            case ADOPTION -> List.of("Optimize " + drivers,
                    "Reduce friction in onboarding",
                    "Provide clear value demonstrations",
                    "Implement progressive feature rollout");
            case CHURN -> List.of("Address " + drivers,
                    "Identify and fix churn triggers",
                    "Improve product value delivery",
                    "Enhance user support systems");
        };
    }

    private static MetricPattern pattern(MetricType metric, Benchmark b) {
        long p90 = Math.round(b.getP90());
        long p50 = Math.round(b.getP50());
        long p75 = Math.round(b.getP75());
        List<String> insights = switch (metric) {
            case PRODUCTIVITY -> List.of(
                    "Top 10% of " + b.getCategory() + " projects achieve productivity scores above " + p90,
                    "Median performers maintain scores around " + p50,
                    "To be competitive, aim for scores above " + p75);
            case RETENTION -> List.of(
                    "Top performers maintain " + p90 + "%+ retention rates",
                    "Industry median is around " + p50 + "%",
                    "Competitive projects achieve " + p75 + "%+ retention");
            case ADOPTION -> List.of(
                    "Leading projects achieve " + p90 + "%+ adoption rates",
                    "Average adoption rates hover around " + p50 + "%",
                    "Strong performers maintain " + p75 + "%+ adoption");
            case CHURN -> List.of(
                    "Top performers keep churn below " + p90 + "%",
                    "Industry median churn is around " + p50 + "%",
                    "Competitive projects maintain churn under " + p75 + "%");
        };
        return new MetricPattern(metric, b.getP90(), b.getP50(), b.getP75(), insights, KEY_DRIVERS.get(metric));
    }

    private static Optional<Benchmark> find(List<Benchmark> benchmarks, MetricType metric) {
        return benchmarks.stream().filter(b -> metric.getValue().equals(b.getBenchmarkType())).findFirst();
    }

    private static MarketPosition position(ProjectComparison comparison) {
        return comparison.overallPosition() == null ? MarketPosition.UNKNOWN : comparison.overallPosition().position();
    }

    private static String key(String category) {
        return category == null ? "" : category.toLowerCase();
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }
}
