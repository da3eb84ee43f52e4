package com.zecinsight.task;

import com.zecinsight.analytics.ProjectMetricsService;
import com.zecinsight.common.Numbers;
import com.zecinsight.domain.MetricSnapshot;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.WalletHealthStatus;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.domain.WalletMetricSampleRepository;
import com.zecinsight.scoring.ProductivityScoringService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;

/**
 * Captures the metrics a task is judged on: wallet scores and 30-day activity for wallet tasks, average score
 * and health share for project tasks. Wallet scores are recomputed so the snapshot reflects current samples.
 */
@Service
@RequiredArgsConstructor
public class MetricSnapshotService {

    private final ProductivityScoringService scoringService;
    private final ProjectMetricsService projectMetricsService;
    private final WalletMetricSampleRepository sampleRepository;

    public MetricSnapshot capture(String walletId, String projectId) {
        MetricSnapshot s = new MetricSnapshot();
        if (walletId != null) {
            ProductivityScore score = scoringService.calculate(walletId);
            s.setProductivityScore(score.getTotalScore());
            s.setRetentionScore(score.getRetentionScore());
            s.setAdoptionScore(score.getAdoptionScore());
            s.setActivityScore(score.getActivityScore());
            s.setDiversityScore(score.getDiversityScore());
            s.setChurnScore(score.getChurnScore());

            LocalDate since = LocalDate.now(ZoneOffset.UTC).minusDays(TaskCompletionMonitor.ACTIVITY_WINDOW_DAYS);
            List<WalletMetricSample> recent = sampleRepository
                    .findByWalletIdAndDateGreaterThanEqualOrderByDateAsc(walletId, since);
            List<WalletMetricSample> activeDays = recent.stream()
                    .filter(r -> r.isActive() || r.getTransactionCount() > 0)
                    .toList();
            s.setActiveDays(activeDays.size());
            s.setTotalTransactions(recent.stream().mapToInt(WalletMetricSample::getTransactionCount).sum());
            s.setLastActivityDate(activeDays.stream()
                    .map(WalletMetricSample::getDate)
                    .max(Comparator.naturalOrder())
                    .orElse(null));
        } else if (projectId != null) {
            List<ProductivityScore> scores = projectMetricsService.getLatestScores(projectId);
            if (!scores.isEmpty()) {
                s.setProductivityScore((int) Math.round(scores.stream()
                        .mapToInt(ProductivityScore::getTotalScore).average().orElse(0)));
            }
            long healthy = scores.stream().filter(p -> p.getStatus() == WalletHealthStatus.HEALTHY).count();
            s.setHealthPercentage(Numbers.round2(Numbers.percentage(healthy, scores.size())));
        }
        s.setCapturedAt(Instant.now());
        return s;
    }
}
