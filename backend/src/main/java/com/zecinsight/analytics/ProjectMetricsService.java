package com.zecinsight.analytics;

import com.zecinsight.common.NotFoundException;
import com.zecinsight.common.Numbers;
import com.zecinsight.config.CaffeineConfig;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.ProductivityScoreRepository;
import com.zecinsight.domain.Project;
import com.zecinsight.domain.ProjectRepository;
import com.zecinsight.domain.RiskLevel;
import com.zecinsight.domain.Wallet;
import com.zecinsight.domain.WalletHealthStatus;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.domain.WalletMetricSampleRepository;
import com.zecinsight.domain.WalletRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives project-level inputs for the comparison, alert and dashboard engines from stored samples and
 * latest productivity scores.
 */
@Service
@RequiredArgsConstructor
public class ProjectMetricsService {

    /** Sample history considered for cohorts and the funnel. */
    static final int ANALYSIS_WINDOW_DAYS = 180;

    private final ProjectRepository projectRepository;
    private final WalletRepository walletRepository;
    private final WalletMetricSampleRepository sampleRepository;
    private final ProductivityScoreRepository scoreRepository;

    public Project getProject(String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("Project not found: " + projectId));
    }

    @Cacheable(cacheNames = CaffeineConfig.PROJECT_METRICS_CACHE, key = "#projectId")
    public ProjectMetrics getProjectMetrics(String projectId) {
        Project project = getProject(projectId);
        List<ProductivityScore> scores = getLatestScores(projectId);
        double productivity = Numbers.round2(scores.stream().mapToInt(ProductivityScore::getTotalScore).average().orElse(0));
        double retention = CohortCalculator.overallRetention(getRetentionCohorts(projectId));
        double adoption = getAdoptionFunnel(projectId).overallAdoptionRate();
        double churn = getChurnSnapshot(projectId).churnRate();
        return new ProjectMetrics(projectId, project.getName(), project.getCategory(),
                productivity, retention, adoption, churn, Instant.now());
    }

    public List<ProductivityScore> getLatestScores(String projectId) {
        List<String> walletIds = walletRepository.findByProjectId(projectId).stream().map(Wallet::getId).toList();
        return scoreRepository.findLatestByWalletIds(walletIds);
    }

    public List<RetentionCohort> getRetentionCohorts(String projectId) {
        LocalDate today = today();
        return CohortCalculator.weeklyCohorts(windowSamples(projectId, today), today);
    }

    public AdoptionFunnel getAdoptionFunnel(String projectId) {
        List<String> walletIds = walletRepository.findByProjectId(projectId).stream().map(Wallet::getId).toList();
        return CohortCalculator.adoptionFunnel(walletIds, windowSamples(projectId, today()));
    }

    public ChurnSnapshot getChurnSnapshot(String projectId) {
        int total = walletRepository.findByProjectId(projectId).size();
        List<ProductivityScore> scores = getLatestScores(projectId);
        int churned = (int) scores.stream().filter(s -> s.getStatus() == WalletHealthStatus.CHURN).count();
        int atRisk = (int) scores.stream().filter(s -> s.getStatus() == WalletHealthStatus.AT_RISK).count();
        int highRisk = (int) scores.stream().filter(s -> s.getRiskLevel() == RiskLevel.HIGH).count();
        return new ChurnSnapshot(total, churned, atRisk, highRisk,
                Numbers.round2(Numbers.percentage(churned, total)),
                Numbers.round2(Numbers.percentage(atRisk, total)),
                Numbers.round2(Numbers.percentage(highRisk, total)));
    }

    /**
     * Per-day shielded totals for the last {@code days} days, oldest first. Days without samples are omitted.
     */
    public List<ShieldedDailyActivity> getShieldedActivity(String projectId, int days) {
        List<WalletMetricSample> samples = sampleRepository.findByProjectIdAndDateGreaterThanEqual(
                projectId, today().minusDays(days));
        Map<LocalDate, long[]> byDay = new TreeMap<>();
        for (WalletMetricSample s : samples) {
            long[] acc = byDay.computeIfAbsent(s.getDate(), k -> new long[2]);
            acc[0] += s.getShieldedTxCount();
            acc[1] += s.getShieldedVolumeZatoshi();
        }
        return byDay.entrySet().stream()
                .map(e -> new ShieldedDailyActivity(e.getKey(), (int) e.getValue()[0], e.getValue()[1]))
                .toList();
    }

    private List<WalletMetricSample> windowSamples(String projectId, LocalDate today) {
        return sampleRepository.findByProjectIdAndDateGreaterThanEqual(projectId, today.minusDays(ANALYSIS_WINDOW_DAYS));
    }

    private static LocalDate today() {
        return LocalDate.now(ZoneOffset.UTC);
    }
}
