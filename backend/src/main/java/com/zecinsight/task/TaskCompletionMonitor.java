package com.zecinsight.task;

import com.zecinsight.common.Numbers;
import com.zecinsight.domain.EffectivenessLevel;
import com.zecinsight.domain.MetricSnapshot;
import com.zecinsight.domain.RecommendationType;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pure completion and effectiveness rules for recommendation tasks.
 *
 * <p>Supported indicators: {@code activity_increase}, {@code transaction_count_increase},
 * {@code adoption_score_increase}, {@code total_score_increase}, {@code transaction_frequency}
 * ({@code daily} or {@code weekly}), {@code activity_resumed} (true for 7 days, or a day count),
 * the {@code *_score_target} thresholds and {@code health_percentage_target}. Unknown indicators count as
 * not met.
 */
public final class TaskCompletionMonitor {

    public static final double COMPLETION_THRESHOLD = 80;
    static final double HIGH_EFFECTIVENESS = 20;
    static final double MEDIUM_EFFECTIVENESS = 10;
    /** Window the activity fields of a snapshot cover. */
    static final int ACTIVITY_WINDOW_DAYS = 30;
    static final int DEFAULT_RESUMED_DAYS = 7;
    static final double DAILY_TX_RATE = 1.0;
    static final double WEEKLY_TX_RATE = 0.14;

    private TaskCompletionMonitor() {
    }

    public static CompletionStatus checkCompletionIndicators(Map<String, Object> indicators,
                                                             MetricSnapshot baseline,
                                                             MetricSnapshot current,
                                                             LocalDate today) {
        if (indicators == null || indicators.isEmpty()) {
            return CompletionStatus.none();
        }
        MetricSnapshot base = baseline == null ? new MetricSnapshot() : baseline;
        List<IndicatorCheck> met = new ArrayList<>();
        List<IndicatorCheck> pending = new ArrayList<>();
        for (Map.Entry<String, Object> e : indicators.entrySet()) {
            IndicatorCheck check = evaluate(e.getKey(), e.getValue(), base, current, today);
            (check.met() ? met : pending).add(check);
        }
        int total = met.size() + pending.size();
        double pct = Math.round(met.size() * 100.0 / total);
        return new CompletionStatus(pct >= COMPLETION_THRESHOLD, met.size(), total, pct, met, pending);
    }

    public static Effectiveness calculateEffectiveness(MetricSnapshot baseline, MetricSnapshot current,
                                                       RecommendationType type) {
        String metric = targetMetric(type);
        Integer before = baseline == null ? null : metricValue(baseline, metric);
        Integer after = current == null ? null : metricValue(current, metric);
        double score = 0;
        List<Improvement> improvements = new ArrayList<>();
        if (before != null && after != null) {
            int delta = after - before;
            score = Math.max(0, delta);
            improvements.add(new Improvement(metric, before, after, delta));
        }
        score = Numbers.round2(Math.min(score, 100));
        EffectivenessLevel level = levelFor(score);
        String summary = String.format(Locale.ROOT, "Task effectiveness: %s (%d points improvement)",
                level.getValue(), Math.round(score));
        return new Effectiveness(score, level, improvements, summary);
    }

    static EffectivenessLevel levelFor(double score) {
        if (score >= HIGH_EFFECTIVENESS) return EffectivenessLevel.HIGH;
        if (score >= MEDIUM_EFFECTIVENESS) return EffectivenessLevel.MEDIUM;
        return EffectivenessLevel.LOW;
    }

    static String targetMetric(RecommendationType type) {
        return switch (type) {
            case RETENTION -> "retention_score";
            case ONBOARDING -> "adoption_score";
            case ENGAGEMENT -> "activity_score";
            case MARKETING, FEATURE_ENHANCEMENT -> "productivity_score";
        };
    }

    private static IndicatorCheck evaluate(String key, Object value, MetricSnapshot base, MetricSnapshot cur,
                                           LocalDate today) {
        if (key.endsWith("_score_target")) {
            String metric = key.equals("total_score_target") ? "productivity_score"
                    : key.substring(0, key.length() - "_target".length());
            Integer actual = metricValue(cur, metric);
            Double target = asDouble(value);
            boolean ok = actual != null && target != null && actual >= target;
            return new IndicatorCheck(key, value, ok, ok
                    ? String.format(Locale.ROOT, "%s reached %d (target: %s)", metric, actual, value)
                    : String.format(Locale.ROOT, "%s at %s (target: %s)", metric, actual, value));
        }
        switch (key) {
            case "activity_increase":
                return increase(key, value, "active_days", orZero(base.getActiveDays()), orZero(cur.getActiveDays()));
            case "transaction_count_increase":
                return increase(key, value, "total_transactions",
                        orZero(base.getTotalTransactions()), orZero(cur.getTotalTransactions()));
            case "adoption_score_increase":
                return increase(key, value, "adoption_score", orZero(base.getAdoptionScore()), orZero(cur.getAdoptionScore()));
            case "total_score_increase":
                return increase(key, value, "productivity_score",
                        orZero(base.getProductivityScore()), orZero(cur.getProductivityScore()));
            case "transaction_frequency": {
                double perDay = orZero(cur.getTotalTransactions()) / (double) ACTIVITY_WINDOW_DAYS;
                String required = String.valueOf(value);
                boolean ok = ("daily".equals(required) && perDay >= DAILY_TX_RATE)
                        || ("weekly".equals(required) && perDay >= WEEKLY_TX_RATE);
                return new IndicatorCheck(key, value, ok,
                        String.format(Locale.ROOT, "%.2f transactions per day (required: %s)", perDay, required));
            }
            case "activity_resumed": {
                int window = value instanceof Number n ? n.intValue() : DEFAULT_RESUMED_DAYS;
                boolean enabled = !Boolean.FALSE.equals(value);
                LocalDate last = cur.getLastActivityDate();
                if (last == null) {
                    return new IndicatorCheck(key, value, false, "No recorded activity");
                }
                long since = ChronoUnit.DAYS.between(last, today);
                boolean ok = enabled && since <= window;
                return new IndicatorCheck(key, value, ok,
                        String.format(Locale.ROOT, "Last active %d days ago (window: %d)", since, window));
            }
            case "health_percentage_target": {
                Double target = asDouble(value);
                Double actual = cur.getHealthPercentage();
                boolean ok = actual != null && target != null && actual >= target;
                return new IndicatorCheck(key, value, ok,
                        String.format(Locale.ROOT, "Health percentage %s%% (target: %s%%)", actual, value));
            }
            default:
                return new IndicatorCheck(key, value, false, "Unsupported indicator");
        }
    }

    private static IndicatorCheck increase(String key, Object value, String metric, int before, int after) {
        boolean ok = Boolean.TRUE.equals(value) && after > before;
        return new IndicatorCheck(key, value, ok,
                String.format(Locale.ROOT, "%s went from %d to %d", metric, before, after));
    }

    static Integer metricValue(MetricSnapshot s, String metric) {
        return switch (metric) {
            case "productivity_score" -> s.getProductivityScore();
            case "retention_score" -> s.getRetentionScore();
            case "adoption_score" -> s.getAdoptionScore();
            case "activity_score" -> s.getActivityScore();
            case "diversity_score" -> s.getDiversityScore();
            case "churn_score" -> s.getChurnScore();
            default -> null;
        };
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String str) {
            try {
                return Double.parseDouble(str);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static int orZero(Integer v) {
        return v == null ? 0 : v;
    }
}
