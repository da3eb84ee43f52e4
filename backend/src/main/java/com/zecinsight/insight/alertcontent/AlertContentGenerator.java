package com.zecinsight.insight.alertcontent;

import com.zecinsight.alert.Alert;
import com.zecinsight.alert.AlertSeverity;
import com.zecinsight.alert.AlertType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a threshold alert into an actionable package. Deterministic lookup tables; the trend only raises
 * urgency and priority, it never decides whether an alert exists.
 */
public final class AlertContentGenerator {

    static final Set<AlertType> CRITICAL_TYPES =
            EnumSet.of(AlertType.RETENTION_CRITICAL, AlertType.CHURN_CRITICAL, AlertType.COMBINED_RISK);

    /** Alert data keys that carry the share of affected wallets, checked in order. */
    static final List<String> AFFECTED_KEYS = List.of(
            "combined_percentage", "churn_rate", "high_risk_percentage", "drop_off_percentage", "drop_percentage");

    private AlertContentGenerator() {
    }

    public static EnrichedAlert generateAlertContent(Alert alert, AlertContext context) {
        AlertContext ctx = context == null ? AlertContext.none() : context;
        return EnrichedAlert.of(alert,
                generateSuggestions(alert),
                generateActionItems(alert),
                calculateUrgency(alert, ctx.trend()),
                calculatePriorityScore(alert, ctx),
                estimateImpact(alert.type()),
                suggestTimeline(alert.severity()));
    }

    /** Enriches every alert with the same context, highest priority score first. */
    public static List<EnrichedAlert> generateAlertPackages(List<Alert> alerts, AlertContext context) {
        List<EnrichedAlert> out = new ArrayList<>(alerts.size());
        for (Alert a : alerts) {
            out.add(generateAlertContent(a, context));
        }
        out.sort(Comparator.comparingInt(EnrichedAlert::priorityScore).reversed());
        return out;
    }

    public static Urgency calculateUrgency(Alert alert, Trend trend) {
        int score = switch (alert.severity()) {
            case CRITICAL -> 90;
            case WARNING -> 60;
            case INFO -> 30;
        };
        if (CRITICAL_TYPES.contains(alert.type())) {
            score = Math.min(100, score + 10);
        }
        if (trend == Trend.WORSENING) {
            score = Math.min(100, score + 10);
        }
        String level;
        String responseTime;
        if (score >= 80) {
            level = "critical";
            responseTime = "Immediate (24-48 hours)";
        } else if (score >= 60) {
            level = "high";
            responseTime = "2-5 days";
        } else if (score >= 40) {
            level = "medium";
            responseTime = "1 week";
        } else {
            level = "low";
            responseTime = "1-2 weeks";
        }
        return new Urgency(level, score, responseTime,
                "Based on " + alert.severity().getValue() + " severity and " + alert.type().getValue() + " type");
    }

    /**
     * 0..100: severity (up to 40) plus type impact (up to 30) plus affected share (up to 20) plus trend
     * (up to 10).
     */
    public static int calculatePriorityScore(Alert alert, AlertContext context) {
        int score = switch (alert.severity()) {
            case CRITICAL -> 40;
            case WARNING -> 25;
            case INFO -> 10;
        };
        score += switch (alert.type()) {
            case RETENTION_CRITICAL, CHURN_CRITICAL, COMBINED_RISK -> 30;
            case RETENTION_DROP, HIGH_RISK_WALLETS -> 25;
            case FUNNEL_DROP_OFF -> 20;
            case LOW_CONVERSION, SHIELDED_DROP -> 15;
            default -> 10;
        };
        Double affected = context.affectedPercentage() != null
                ? context.affectedPercentage() : affectedFromData(alert.data());
        if (affected == null) {
            score += 10;
        } else if (affected >= 50) {
            score += 20;
        } else if (affected >= 30) {
            score += 15;
        } else if (affected >= 10) {
            score += 10;
        } else {
            score += 5;
        }
        if (context.trend() == Trend.WORSENING) {
            score += 10;
        } else if (context.trend() == Trend.STABLE) {
            score += 5;
        } else {
            score += 3;
        }
        return Math.min(100, score);
    }

    public static ImpactEstimate estimateImpact(AlertType type) {
        return switch (type) {
            case RETENTION_CRITICAL, CHURN_CRITICAL, COMBINED_RISK -> new ImpactEstimate(
                    "High - Significant user loss expected",
                    "High - Direct revenue impact from churned users",
                    "High - Negative word-of-mouth affects acquisition",
                    "High");
            case RETENTION_DROP, RETENTION_WARNING, HIGH_RISK_WALLETS -> new ImpactEstimate(
                    "Medium - Moderate user loss risk",
                    "Medium - Potential revenue decline",
                    "Medium - May slow growth trajectory",
                    "Medium");
            case FUNNEL_DROP_OFF -> new ImpactEstimate(
                    "Medium - Reduced user activation",
                    "Medium - Lower conversion to paying users",
                    "High - Directly limits growth potential",
                    "Medium-High");
            case LOW_CONVERSION -> new ImpactEstimate(
                    "Low-Medium - Affects new user experience",
                    "Medium - Reduces monetization potential",
                    "Medium - Limits effective growth",
                    "Medium");
            case SHIELDED_SPIKE, SHIELDED_VOLUME_CHANGE -> new ImpactEstimate(
                    "Low - May indicate increased engagement",
                    "Low - Minimal direct impact",
                    "Low-Medium - Could indicate new use case",
                    "Low");
            case SHIELDED_DROP -> new ImpactEstimate(
                    "Low-Medium - Affects privacy-focused users",
                    "Low - Limited user segment",
                    "Low - Niche feature impact",
                    "Low-Medium");
        };
    }

    public static ResolutionTimeline suggestTimeline(AlertSeverity severity) {
        return switch (severity) {
            case CRITICAL -> new ResolutionTimeline("24-48 hours", "1-2 days", "1-2 weeks", "1 week", "2-4 weeks");
            case WARNING -> new ResolutionTimeline("1-3 days", "2-5 days", "1-3 weeks", "1-2 weeks", "4-6 weeks");
            case INFO -> new ResolutionTimeline("3-5 days", "1 week", "2-4 weeks", "2-3 weeks", "6-8 weeks");
        };
    }

    /** Critical alerts always open with two P0 emergency items. */
    public static List<ActionItem> generateActionItems(Alert alert) {
        List<ActionItem> items = new ArrayList<>();
        boolean critical = alert.severity() == AlertSeverity.CRITICAL;
        if (critical) {
            items.add(new ActionItem("Convene emergency response team", "Product Lead", "Immediate (within 24 hours)", "P0"));
            items.add(new ActionItem("Analyze root cause and create action plan", "Analytics Team", "24-48 hours", "P0"));
        }
        switch (alert.type()) {
            case RETENTION_DROP, RETENTION_CRITICAL, RETENTION_WARNING -> {
                items.add(new ActionItem("Launch re-engagement email campaign", "Marketing Team", "2-3 days", critical ? "P0" : "P1"));
                items.add(new ActionItem("Conduct user interviews with churned users", "Product Team", "1 week", "P1"));
                items.add(new ActionItem("Implement retention improvements", "Engineering Team", "2-3 weeks", "P1"));
            }
            case CHURN_CRITICAL, HIGH_RISK_WALLETS, COMBINED_RISK -> {
                items.add(new ActionItem("Identify and segment at-risk users", "Analytics Team", "1-2 days", "P0"));
                items.add(new ActionItem("Create personalized retention offers", "Product Team", "3-5 days", "P1"));
                items.add(new ActionItem("Launch targeted retention campaign", "Marketing Team", "1 week", "P1"));
            }
            case FUNNEL_DROP_OFF, LOW_CONVERSION -> {
                items.add(new ActionItem("Conduct funnel analysis and identify friction points", "Product Analytics", "2-3 days", "P1"));
                items.add(new ActionItem("Run A/B tests on funnel improvements", "Product Team", "1-2 weeks", "P1"));
                items.add(new ActionItem("Implement winning variations", "Engineering Team", "2-3 weeks", "P2"));
            }
            case SHIELDED_SPIKE, SHIELDED_DROP, SHIELDED_VOLUME_CHANGE -> {
                items.add(new ActionItem("Investigate cause of activity change", "Analytics Team", "1-2 days", "P1"));
                items.add(new ActionItem("Monitor for continued trends", "Operations Team", "Ongoing", "P2"));
            }
        }
        items.add(new ActionItem("Review alert resolution and document learnings", "Product Lead", "1 week after resolution", "P2"));
        return items;
    }

    public static List<Suggestion> generateSuggestions(Alert alert) {
        boolean critical = alert.severity() == AlertSeverity.CRITICAL;
        List<Suggestion> s = new ArrayList<>();
        switch (alert.type().getCategory()) {
            case RETENTION -> {
                if (critical) {
                    s.add(new Suggestion("immediate_action", "Launch emergency re-engagement campaign for at-risk users",
                            "Critical retention levels require immediate intervention to prevent further losses",
                            "Stabilize retention within 1-2 weeks"));
                    s.add(new Suggestion("investigation", "Conduct urgent user interviews to identify pain points",
                            "Understanding why users are leaving is crucial for effective intervention",
                            "Identify top 3 churn drivers within 3-5 days"));
                }
                s.add(new Suggestion("engagement", "Implement personalized email campaigns targeting inactive users",
                        "Personalized outreach has shown 3-5x higher re-engagement rates",
                        "10-15% improvement in retention over 4 weeks"));
                s.add(new Suggestion("product", "Add value-driving features or improve existing feature discoverability",
                        "Users stay when they consistently derive value from the product",
                        "Increase feature adoption by 20-30%"));
                s.add(new Suggestion("community", "Build community engagement through forums, events, or social channels",
                        "Strong community connections significantly improve retention",
                        "Create network effects that boost retention by 15-25%"));
            }
            case CHURN -> {
                s.add(new Suggestion("prevention", "Implement early warning system to identify at-risk users before they churn",
                        "Proactive intervention is 5x more effective than reactive win-back",
                        "Reduce churn rate by 20-30%"));
                s.add(new Suggestion("retention", "Create VIP support program for high-value or at-risk users",
                        "Personalized support significantly reduces churn among engaged users",
                        "Improve retention of high-value users by 40%"));
                s.add(new Suggestion("product", "Analyze common patterns among churned users and fix identified issues",
                        "Addressing root causes prevents future churn",
                        "Eliminate top churn drivers within 2-3 weeks"));
                s.add(new Suggestion("incentives", "Offer retention incentives or loyalty rewards to at-risk users",
                        "Strategic incentives can tip the balance for users considering leaving",
                        "Retain 30-40% of at-risk users"));
                if (critical) {
                    s.add(new Suggestion("emergency", "Conduct emergency product review and implement quick wins",
                            "Critical churn levels indicate fundamental product or market fit issues",
                            "Stabilize churn within 2-3 weeks"));
                }
            }
            case FUNNEL -> {
                if (alert.type() == AlertType.FUNNEL_DROP_OFF) {
                    Object stage = alert.data() == null ? null : alert.data().get("to_stage");
                    String name = stage == null ? "unknown" : stage.toString();
                    s.add(new Suggestion("optimization", "Optimize the " + name + " stage to reduce friction and improve conversion",
                            "High drop-off at " + name + " indicates a significant barrier to progression",
                            "Reduce drop-off by 20-30%"));
                    s.add(new Suggestion("analysis", "Conduct user testing specifically for the " + name + " stage",
                            "Direct user feedback reveals hidden friction points",
                            "Identify and fix top 3 friction points"));
                    s.add(new Suggestion("incentives", "Add progressive incentives to encourage " + name + " completion",
                            "Strategic incentives can overcome hesitation at critical stages",
                            "Increase stage completion by 15-25%"));
                }
                s.add(new Suggestion("onboarding", "Simplify onboarding flow and reduce steps to value",
                        "Every additional step in onboarding reduces conversion by 10-20%",
                        "Improve overall funnel conversion by 25-35%"));
                s.add(new Suggestion("education", "Add contextual help and tooltips at key decision points",
                        "Users need guidance at critical moments to progress confidently",
                        "Reduce confusion-related drop-offs by 30%"));
            }
            case SHIELDED -> {
                if (alert.type() == AlertType.SHIELDED_SPIKE) {
                    s.add(new Suggestion("monitoring", "Monitor for unusual patterns that might indicate coordinated activity",
                            "Sudden spikes can indicate both positive adoption or potential issues",
                            "Understand spike cause within 24-48 hours"));
                    s.add(new Suggestion("opportunity", "Investigate if spike represents new user segment or use case",
                            "Activity spikes often reveal new growth opportunities",
                            "Identify and capitalize on new use cases"));
                } else if (alert.type() == AlertType.SHIELDED_DROP) {
                    s.add(new Suggestion("investigation", "Investigate technical issues or UX problems with shielded features",
                            "Sudden drops often indicate technical or usability problems",
                            "Identify and resolve issues within 1 week"));
                    s.add(new Suggestion("engagement", "Re-engage privacy-focused users with targeted communications",
                            "Privacy-focused users are often high-value and worth retaining",
                            "Restore 50-70% of previous activity levels"));
                }
                s.add(new Suggestion("education", "Educate users on privacy features and benefits",
                        "Many users don't fully understand or utilize privacy features",
                        "Increase shielded transaction adoption by 20-30%"));
            }
        }
        return s;
    }

    static Double affectedFromData(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        for (String key : AFFECTED_KEYS) {
            if (data.get(key) instanceof Number n) {
                return n.doubleValue();
            }
        }
        return null;
    }
}
