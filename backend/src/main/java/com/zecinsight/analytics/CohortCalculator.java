package com.zecinsight.analytics;

import com.zecinsight.common.Numbers;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.scoring.AdoptionStage;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Cohort and funnel math over project samples. Stateless.
 */
public final class CohortCalculator {

    public static final int MAX_COHORTS = 8;

    private CohortCalculator() {
    }

    /**
     * Weekly cohorts, newest first, at most {@link #MAX_COHORTS}.
     */
    public static List<RetentionCohort> weeklyCohorts(List<WalletMetricSample> samples, LocalDate today) {
        Map<String, Set<LocalDate>> activeDaysByWallet = new HashMap<>();
        for (WalletMetricSample s : samples) {
            if (s.isActive() || s.getTransactionCount() > 0) {
                activeDaysByWallet.computeIfAbsent(s.getWalletId(), k -> new HashSet<>()).add(s.getDate());
            }
        }
        TreeMap<LocalDate, List<String>> cohorts = new TreeMap<>(Comparator.reverseOrder());
        activeDaysByWallet.forEach((walletId, days) -> {
            LocalDate first = days.stream().min(LocalDate::compareTo).orElseThrow();
            cohorts.computeIfAbsent(weekStart(first), k -> new ArrayList<>()).add(walletId);
        });

        List<RetentionCohort> out = new ArrayList<>();
        for (Map.Entry<LocalDate, List<String>> e : cohorts.entrySet()) {
            if (out.size() == MAX_COHORTS) {
                break;
            }
            LocalDate start = e.getKey();
            List<String> wallets = e.getValue();
            Double[] weeks = new Double[4];
            for (int n = 1; n <= 4; n++) {
                LocalDate from = start.plusWeeks(n);
                LocalDate to = from.plusDays(7);
                if (to.isAfter(today.plusDays(1))) {
                    weeks[n - 1] = null;
                    continue;
                }
                long retained = wallets.stream()
                        .filter(w -> activeDaysByWallet.get(w).stream()
                                .anyMatch(d -> !d.isBefore(from) && d.isBefore(to)))
                        .count();
                weeks[n - 1] = Numbers.round2(Numbers.percentage(retained, wallets.size()));
            }
            out.add(new RetentionCohort(start, wallets.size(), weeks[0], weeks[1], weeks[2], weeks[3]));
        }
        return out;
    }

    /**
     * Mean of all elapsed week 1..4 retention values across cohorts; 0 when none have elapsed.
     */
    public static double overallRetention(List<RetentionCohort> cohorts) {
        List<Double> values = new ArrayList<>();
        for (RetentionCohort c : cohorts) {
            for (int n = 1; n <= 4; n++) {
                if (c.week(n) != null) {
                    values.add(c.week(n));
                }
            }
        }
        return Numbers.round2(values.stream().mapToDouble(Double::doubleValue).average().orElse(0));
    }

    /**
     * Funnel over every wallet id given; wallets without samples only reach CREATED.
     */
    public static AdoptionFunnel adoptionFunnel(List<String> walletIds, List<WalletMetricSample> samples) {
        Map<String, List<WalletMetricSample>> byWallet = samples.stream()
                .collect(Collectors.groupingBy(WalletMetricSample::getWalletId));
        Map<AdoptionStage, Integer> reached = new HashMap<>();
        for (String walletId : walletIds) {
            for (AdoptionStage stage : AdoptionStage.reachedStages(byWallet.getOrDefault(walletId, List.of()))) {
                reached.merge(stage, 1, Integer::sum);
            }
        }
        int total = walletIds.size();
        List<FunnelStage> stages = new ArrayList<>();
        Integer previous = null;
        double sum = 0;
        for (AdoptionStage stage : AdoptionStage.values()) {
            int count = reached.getOrDefault(stage, 0);
            double pct = Numbers.round2(Numbers.percentage(count, total));
            Double dropOff = previous == null ? null
                    : Numbers.round2(previous == 0 ? 0 : (previous - count) * 100.0 / previous);
            stages.add(new FunnelStage(stage, count, pct, dropOff));
            sum += pct;
            previous = count;
        }
        return new AdoptionFunnel(total, stages, Numbers.round2(sum / AdoptionStage.values().length));
    }

    static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
