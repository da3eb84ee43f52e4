package com.zecinsight.insight;

import com.zecinsight.comparison.GapSeverity;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.Recommendation;
import com.zecinsight.domain.RecommendationType;
import com.zecinsight.domain.RiskLevel;
import com.zecinsight.domain.WalletHealthStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule tables turning productivity scores into ranked recommendations. Nothing here touches storage; the
 * returned recommendations are unsaved.
 */
public final class RecommendationEngine {

    static final int DECLINING_THRESHOLD = 50;
    static final int HIGH_SEVERITY_BELOW = 35;
    static final int SCORE_TARGET = 70;
    static final int MAX_WALLET_RECOMMENDATIONS = 10;

    static final Comparator<Recommendation> BY_PRIORITY =
            Comparator.comparingInt(Recommendation::getPriority).reversed();

    private RecommendationEngine() {
    }

    /** Component scores below 50, in component order. Churn is inverted upstream so low is still bad. */
    public static List<DecliningMetric> identifyDecliningMetrics(ProductivityScore s) {
        List<DecliningMetric> declining = new ArrayList<>();
        addIfDeclining(declining, "retention", s.getRetentionScore());
        addIfDeclining(declining, "adoption", s.getAdoptionScore());
        addIfDeclining(declining, "activity", s.getActivityScore());
        addIfDeclining(declining, "diversity", s.getDiversityScore());
        addIfDeclining(declining, "churn", s.getChurnScore());
        return declining;
    }

    public static List<Recommendation> walletRecommendations(ProductivityScore s, List<DecliningMetric> declining) {
        List<Recommendation> recs = new ArrayList<>();
        for (DecliningMetric m : declining) {
            recs.add(forMetric(m));
        }
        if (s.getTotalScore() < DECLINING_THRESHOLD) {
            recs.add(build(RecommendationType.MARKETING, "Comprehensive engagement campaign",
                    "Overall productivity score is " + s.getTotalScore() + "/100. Launch multi-channel engagement initiative.",
                    8, "High", "4-6 weeks",
                    List.of("Audit current user experience",
                            "Identify key friction points",
                            "Launch targeted marketing campaign",
                            "Improve product value proposition",
                            "Enhance customer support"),
                    indicators("total_score_increase", true, "total_score_target", SCORE_TARGET),
                    "Productivity score " + s.getTotalScore(), "Productivity score " + SCORE_TARGET + "+"));
        }
        Instant now = Instant.now();
        for (Recommendation r : recs) {
            r.setWalletId(s.getWalletId());
            r.setProjectId(s.getProjectId());
            r.setCreatedAt(now);
        }
        recs.sort(BY_PRIORITY);
        return recs.size() > MAX_WALLET_RECOMMENDATIONS ? new ArrayList<>(recs.subList(0, MAX_WALLET_RECOMMENDATIONS)) : recs;
    }

    public static ProjectHealth analyzeProjectHealth(List<ProductivityScore> scores) {
        int total = scores.size();
        int healthy = 0;
        int atRisk = 0;
        int churn = 0;
        int low = 0;
        int medium = 0;
        int high = 0;
        long sum = 0;
        for (ProductivityScore s : scores) {
            if (s.getStatus() == WalletHealthStatus.HEALTHY) healthy++;
            else if (s.getStatus() == WalletHealthStatus.AT_RISK) atRisk++;
            else if (s.getStatus() == WalletHealthStatus.CHURN) churn++;
            if (s.getRiskLevel() == RiskLevel.LOW) low++;
            else if (s.getRiskLevel() == RiskLevel.MEDIUM) medium++;
            else if (s.getRiskLevel() == RiskLevel.HIGH) high++;
            sum += s.getTotalScore();
        }
        double average = total == 0 ? Double.NaN : Math.round((double) sum / total);
        return new ProjectHealth(total,
                new ProjectHealth.HealthDistribution(healthy, atRisk, churn),
                new ProjectHealth.RiskDistribution(low, medium, high),
                pct(healthy, total), pct(atRisk, total), pct(churn, total), average);
    }

    /** Project-level rules over the health tallies. Callers skip empty projects. */
    public static List<Recommendation> projectRecommendations(String projectId, ProjectHealth h) {
        List<Recommendation> recs = new ArrayList<>();
        if (h.churnPercentage() > 30) {
            recs.add(build(RecommendationType.RETENTION, "Address high churn rate",
                    fmt(h.churnPercentage()) + "% of wallets are churning. Implement retention strategies.",
                    10, "Critical", "2-4 weeks",
                    List.of("Analyze common churn patterns",
                            "Improve product value delivery",
                            "Launch win-back campaign",
                            "Enhance onboarding process",
                            "Implement early warning system"),
                    indicators("health_percentage_target", 50),
                    fmt(h.churnPercentage()) + "% churn", "Churn below 30%"));
        }
        if (h.atRiskPercentage() > 40) {
            recs.add(build(RecommendationType.ENGAGEMENT, "Re-engage at-risk wallets",
                    fmt(h.atRiskPercentage()) + "% of wallets are at risk. Proactive engagement needed.",
                    9, "High", "2-3 weeks",
                    List.of("Segment at-risk wallets by behavior",
                            "Create targeted re-engagement campaigns",
                            "Offer personalized incentives",
                            "Improve feature discoverability"),
                    indicators("health_percentage_target", 50),
                    fmt(h.atRiskPercentage()) + "% at risk", "At-risk share below 40%"));
        }
        if (h.averageScore() < 50) {
            recs.add(build(RecommendationType.FEATURE_ENHANCEMENT, "Improve overall product experience",
                    "Average productivity score is " + fmt(h.averageScore()) + "/100. Comprehensive improvements needed.",
                    8, "High", "6-8 weeks",
                    List.of("Conduct user research and feedback sessions",
                            "Identify and fix major pain points",
                            "Enhance core features",
                            "Improve user interface and experience",
                            "Add requested features"),
                    indicators("total_score_target", 60),
                    "Average score " + fmt(h.averageScore()), "Average score 60+"));
        }
        if (h.healthPercentage() < 40) {
            recs.add(build(RecommendationType.MARKETING, "Boost user acquisition and activation",
                    "Only " + fmt(h.healthPercentage()) + "% of wallets are healthy. Focus on quality growth.",
                    7, "Medium", "4-6 weeks",
                    List.of("Optimize user acquisition channels",
                            "Improve activation rate",
                            "Enhance onboarding experience",
                            "Build community engagement",
                            "Implement referral program"),
                    indicators("health_percentage_target", 40),
                    fmt(h.healthPercentage()) + "% healthy", "40%+ healthy"));
        }
        int highRisk = h.riskDistribution().high();
        if (highRisk > 0) {
            recs.add(build(RecommendationType.RETENTION, "Address " + highRisk + " high-risk wallets",
                    highRisk + " wallets are at high risk of churning",
                    9, "High", "1-2 weeks",
                    List.of("Identify common patterns among high-risk wallets",
                            "Launch targeted re-engagement campaign",
                            "Provide personalized support and incentives",
                            "Monitor progress weekly"),
                    indicators("health_percentage_target", 50),
                    highRisk + " high-risk wallets", "No high-risk wallets"));
        }
        Instant now = Instant.now();
        for (Recommendation r : recs) {
            r.setProjectId(projectId);
            r.setCreatedAt(now);
        }
        recs.sort(BY_PRIORITY);
        return recs;
    }

    private static Recommendation forMetric(DecliningMetric m) {
        boolean high = m.severity() == GapSeverity.HIGH;
        String impact = high ? "High" : "Medium";
        String current = m.name() + " score " + m.score();
        String target = m.name() + " score " + SCORE_TARGET + "+";
        return switch (m.name()) {
            case "retention" -> build(RecommendationType.RETENTION, "Improve wallet retention",
                    "Retention score is " + m.score() + "/100. Implement strategies to keep this wallet engaged.",
                    high ? 9 : 7, impact, "2-4 weeks",
                    List.of("Send personalized re-engagement email",
                            "Offer exclusive features or benefits",
                            "Provide usage tips and best practices",
                            "Schedule follow-up check-ins"),
                    indicators("activity_increase", true, "transaction_frequency", "weekly",
                            "retention_score_target", SCORE_TARGET),
                    current, target);
            case "adoption" -> build(RecommendationType.ONBOARDING, "Optimize onboarding experience",
                    "Adoption score is " + m.score() + "/100. Help this wallet progress through adoption stages.",
                    high ? 8 : 6, impact, "1-3 weeks",
                    List.of("Send guided tutorial or walkthrough",
                            "Highlight key features not yet used",
                            "Provide incentives for feature exploration",
                            "Simplify complex workflows"),
                    indicators("adoption_score_increase", true, "transaction_count_increase", true,
                            "adoption_score_target", SCORE_TARGET),
                    current, target);
            case "activity" -> build(RecommendationType.ENGAGEMENT, "Increase wallet activity",
                    "Activity score is " + m.score() + "/100. Encourage more frequent interactions.",
                    high ? 8 : 6, impact, "1-2 weeks",
                    List.of("Send activity-based notifications",
                            "Offer time-limited promotions",
                            "Gamify user interactions",
                            "Provide activity streaks or rewards"),
                    indicators("activity_increase", true, "transaction_count_increase", true,
                            "activity_score_target", SCORE_TARGET),
                    current, target);
            case "diversity" -> build(RecommendationType.ENGAGEMENT, "Improve transaction frequency",
                    "Diversity score is " + m.score() + "/100. Encourage more regular usage.",
                    high ? 7 : 5, "Medium", "2-4 weeks",
                    List.of("Set up automated reminders",
                            "Create recurring use cases",
                            "Offer subscription or membership benefits",
                            "Build habit-forming features"),
                    indicators("transaction_frequency", "weekly", "transaction_count_increase", true,
                            "diversity_score_target", SCORE_TARGET),
                    current, target);
            case "churn" -> build(RecommendationType.RETENTION, "Prevent wallet churn",
                    "Churn risk score is " + m.score() + "/100. Immediate action needed to prevent disengagement.",
                    10, "Critical", "1 week",
                    List.of("Reach out with personalized support",
                            "Identify and address pain points",
                            "Offer special retention incentives",
                            "Conduct user feedback survey",
                            "Provide VIP support access"),
                    indicators("activity_resumed", 7, "activity_increase", true,
                            "churn_score_target", SCORE_TARGET),
                    current, target);
            default -> throw new IllegalArgumentException("Unknown metric: " + m.name());
        };
    }

    private static Recommendation build(RecommendationType type, String title, String description, int priority,
                                        String impact, String timeline, List<String> actions,
                                        Map<String, Object> indicators, String currentState, String targetState) {
        Recommendation r = new Recommendation();
        r.setType(type);
        r.setTitle(title);
        r.setDescription(description);
        r.setPriority(priority);
        r.setExpectedImpact(impact);
        r.setTimeline(timeline);
        r.setEffortLevel(type.getEffortLevel());
        r.setActions(new ArrayList<>(actions));
        r.setCompletionIndicators(indicators);
        r.setCurrentState(currentState);
        r.setTargetState(targetState);
        return r;
    }

    private static void addIfDeclining(List<DecliningMetric> out, String name, int score) {
        if (score < DECLINING_THRESHOLD) {
            out.add(new DecliningMetric(name, score, score < HIGH_SEVERITY_BELOW ? GapSeverity.HIGH : GapSeverity.MEDIUM));
        }
    }

    private static Map<String, Object> indicators(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    private static double pct(int part, int total) {
        return total == 0 ? 0 : Math.round(part * 100.0 / total);
    }

    private static String fmt(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
