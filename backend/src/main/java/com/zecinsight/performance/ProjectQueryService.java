package com.zecinsight.performance;

import com.zecinsight.common.Numbers;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.ProductivityScoreRepository;
import com.zecinsight.domain.Wallet;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.domain.WalletMetricSampleRepository;
import com.zecinsight.domain.WalletRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Frequently used project reads, memoized in the {@link QueryCache}.
 */
@Service
@RequiredArgsConstructor
public class ProjectQueryService {

    static final int WINDOW_DAYS = 30;

    private final WalletRepository walletRepository;
    private final WalletMetricSampleRepository sampleRepository;
    private final ProductivityScoreRepository scoreRepository;
    private final QueryCache queryCache;

    public AggregatedMetrics getAggregatedMetrics(String projectId) {
        return queryCache.cachedQuery(aggregatedKey(projectId), () -> computeAggregatedMetrics(projectId));
    }

    public List<WalletSummary> findWallets(String projectId, WalletQueryFilter filter) {
        WalletQueryFilter f = filter == null ? WalletQueryFilter.none() : filter;
        return queryCache.cachedQuery(walletsKey(projectId, f), () -> computeWallets(projectId, f));
    }

    /** Evicts every cached read for the project. */
    public void evictProject(String projectId) {
        queryCache.invalidate(aggregatedKey(projectId));
        queryCache.invalidatePrefix("wallets:" + projectId + ":");
    }

    static String aggregatedKey(String projectId) {
        return "aggregated:" + projectId;
    }

    static String walletsKey(String projectId, WalletQueryFilter filter) {
        return "wallets:" + projectId + ":" + filter;
    }

    private AggregatedMetrics computeAggregatedMetrics(String projectId) {
        List<Wallet> wallets = walletRepository.findByProjectId(projectId);
        List<WalletMetricSample> samples = sampleRepository.findByProjectIdAndDateGreaterThanEqual(
                projectId, LocalDate.now(ZoneOffset.UTC).minusDays(WINDOW_DAYS));
        long activeWallets = samples.stream()
                .filter(s -> s.isActive() || s.getTransactionCount() > 0)
                .map(WalletMetricSample::getWalletId)
                .distinct()
                .count();
        long totalTx = samples.stream().mapToLong(WalletMetricSample::getTransactionCount).sum();
        long totalVolume = samples.stream().mapToLong(WalletMetricSample::getVolumeZatoshi).sum();

        List<Integer> scores = scoreRepository.findLatestByWalletIds(wallets.stream().map(Wallet::getId).toList())
                .stream()
                .map(ProductivityScore::getTotalScore)
                .sorted()
                .toList();
        Double avg = scores.isEmpty() ? null
                : Numbers.round2(scores.stream().mapToInt(Integer::intValue).average().orElse(0));
        Double median = scores.isEmpty() ? null : Numbers.round2(median(scores));
        return new AggregatedMetrics(wallets.size(), (int) activeWallets, totalTx, totalVolume, avg, median);
    }

    private List<WalletSummary> computeWallets(String projectId, WalletQueryFilter filter) {
        List<Wallet> wallets = walletRepository.findByProjectId(projectId).stream()
                .filter(w -> filter.walletType() == null || filter.walletType() == w.getType())
                .filter(w -> filter.privacyMode() == null || filter.privacyMode() == w.getPrivacyMode())
                .toList();
        Map<String, ProductivityScore> latest = scoreRepository
                .findLatestByWalletIds(wallets.stream().map(Wallet::getId).toList())
                .stream()
                .collect(Collectors.toMap(ProductivityScore::getWalletId, Function.identity(), (a, b) -> a));
        Map<String, Integer> activeDays = new HashMap<>();
        sampleRepository.findByProjectIdAndDateGreaterThanEqual(projectId,
                        LocalDate.now(ZoneOffset.UTC).minusDays(WINDOW_DAYS))
                .stream()
                .filter(s -> s.isActive() || s.getTransactionCount() > 0)
                .forEach(s -> activeDays.merge(s.getWalletId(), 1, Integer::sum));

        return wallets.stream()
                .map(w -> new WalletSummary(w.getId(), w.getAddress(), w.getType(), w.getPrivacyMode(),
                        latest.containsKey(w.getId()) ? latest.get(w.getId()).getTotalScore() : null,
                        activeDays.getOrDefault(w.getId(), 0)))
                .filter(s -> filter.minScore() == null || (s.totalScore() != null && s.totalScore() >= filter.minScore()))
                .sorted(Comparator.comparing(WalletSummary::totalScore, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(filter.effectiveLimit())
                .toList();
    }

    private static double median(List<Integer> sorted) {
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }
}
