package com.zecinsight.shielded;

import com.zecinsight.analytics.ProjectMetricsService;
import com.zecinsight.common.Numbers;
import com.zecinsight.common.ValidationException;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.Wallet;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.domain.WalletMetricSampleRepository;
import com.zecinsight.domain.WalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares wallets that mostly shield their transactions with those that stay transparent. Only active
 * wallets with at least one transaction in the window are classified.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShieldedComparisonService {

    static final int DEFAULT_DAYS = 30;
    static final int MAX_DAYS = 365;

    private final ProjectMetricsService metricsService;
    private final WalletRepository walletRepository;
    private final WalletMetricSampleRepository sampleRepository;

    public ShieldedComparison compare(String projectId, Integer days) {
        int window = days == null ? DEFAULT_DAYS : days;
        if (window < 1 || window > MAX_DAYS) {
            throw new ValidationException("days must be between 1 and " + MAX_DAYS);
        }
        metricsService.getProject(projectId);
        LocalDate end = LocalDate.now(ZoneOffset.UTC);
        LocalDate start = end.minusDays(window);

        List<WalletUsage> usage = collectUsage(projectId, start);
        Map<PrivacyUsageClass, List<WalletUsage>> classes = ShieldedAnalyzer.classify(usage);
        Map<PrivacyUsageClass, ClassMetrics> metrics = new EnumMap<>(PrivacyUsageClass.class);
        classes.forEach((c, group) -> metrics.put(c, ShieldedAnalyzer.metrics(group, usage.size())));

        long totalTx = usage.stream().mapToLong(WalletUsage::totalTransactions).sum();
        long shieldedTx = usage.stream().mapToLong(WalletUsage::shieldedTransactions).sum();
        int privacyUsers = (int) usage.stream()
                .filter(w -> PrivacyUsageClass.of(w.shieldedPercentage()).usesPrivacy())
                .count();
        double adoption = Numbers.round2(Numbers.percentage(privacyUsers, usage.size()));
        ShieldedAnalyzer.Insights insights = ShieldedAnalyzer.insights(metrics, adoption);

        Map<String, ClassMetrics> byClass = new LinkedHashMap<>();
        metrics.forEach((c, m) -> byClass.put(c.getValue(), m));
        log.debug("Shielded comparison for project {} classified {} wallet(s)", projectId, usage.size());
        return new ShieldedComparison(projectId, start, end, window, usage.size(),
                Numbers.round2(Numbers.percentage(shieldedTx, totalTx)), adoption, byClass,
                ShieldedAnalyzer.correlations(usage), insights.keyFindings(), insights.recommendations(),
                Instant.now());
    }

    private List<WalletUsage> collectUsage(String projectId, LocalDate from) {
        List<Wallet> wallets = walletRepository.findByProjectId(projectId).stream().filter(Wallet::isActive).toList();
        Map<String, ProductivityScore> latest = metricsService.getLatestScores(projectId).stream()
                .collect(Collectors.toMap(ProductivityScore::getWalletId, Function.identity(), (a, b) -> a));
        Map<String, List<WalletMetricSample>> samples = sampleRepository
                .findByProjectIdAndDateGreaterThanEqual(projectId, from).stream()
                .collect(Collectors.groupingBy(WalletMetricSample::getWalletId));

        List<WalletUsage> out = new ArrayList<>();
        for (Wallet w : wallets) {
            List<WalletMetricSample> rows = samples.getOrDefault(w.getId(), List.of());
            long tx = rows.stream().mapToLong(WalletMetricSample::getTransactionCount).sum();
            if (tx == 0) {
                continue;
            }
            long shielded = rows.stream().mapToLong(WalletMetricSample::getShieldedTxCount).sum();
            long volume = rows.stream().mapToLong(WalletMetricSample::getVolumeZatoshi).sum();
            int activeDays = (int) rows.stream()
                    .filter(r -> r.isActive() || r.getTransactionCount() > 0)
                    .map(WalletMetricSample::getDate)
                    .distinct()
                    .count();
            ProductivityScore score = latest.get(w.getId());
            out.add(new WalletUsage(w.getId(), tx, Math.min(shielded, tx), volume, activeDays,
                    score == null ? null : score.getTotalScore()));
        }
        return out;
    }
}
