package com.zecinsight.dashboard;

import com.zecinsight.alert.AlertReport;
import com.zecinsight.alert.AlertService;
import com.zecinsight.analytics.AdoptionFunnel;
import com.zecinsight.analytics.ProjectMetricsService;
import com.zecinsight.analytics.RetentionCohort;
import com.zecinsight.common.Numbers;
import com.zecinsight.common.ValidationException;
import com.zecinsight.config.AsyncConfig;
import com.zecinsight.domain.Project;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.ProductivityScoreRepository;
import com.zecinsight.domain.Recommendation;
import com.zecinsight.domain.WalletHealthStatus;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.domain.WalletMetricSampleRepository;
import com.zecinsight.insight.ProjectHealth;
import com.zecinsight.insight.RecommendationEngine;
import com.zecinsight.performance.AggregatedMetrics;
import com.zecinsight.performance.ProjectQueryService;
import com.zecinsight.performance.QueryCache;
import com.zecinsight.performance.config.PerformanceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Assembles the per-project dashboard from the analytics, alert and insight engines. Every view is memoized
 * in the {@link QueryCache} under the dashboard TTL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DashboardService {

    static final int TOP_RECOMMENDATIONS = 5;
    static final int LOWEST_WALLETS = 10;
    static final int MAX_TIME_SERIES_DAYS = 365;

    private static final List<String> VIEW_PREFIXES = List.of("dashboard:", "health:", "timeseries:");

    private final ProjectMetricsService metricsService;
    private final ProjectQueryService projectQueryService;
    private final AlertService alertService;
    private final WalletMetricSampleRepository sampleRepository;
    private final ProductivityScoreRepository scoreRepository;
    private final QueryCache queryCache;
    private final PerformanceProperties properties;
    @Qualifier(AsyncConfig.BATCH_EXECUTOR)
    private final Executor batchExecutor;

    public ProjectDashboard getProjectDashboard(String projectId) {
        Project project = metricsService.getProject(projectId);
        return queryCache.cachedQuery("dashboard:" + projectId, () -> assemble(project), properties.getDashboardTtl());
    }

    private ProjectDashboard assemble(Project project) {
        String projectId = project.getId();
        CompletableFuture<AggregatedMetrics> overview =
                CompletableFuture.supplyAsync(() -> projectQueryService.getAggregatedMetrics(projectId), batchExecutor);
        CompletableFuture<List<ProductivityScore>> scores =
                CompletableFuture.supplyAsync(() -> metricsService.getLatestScores(projectId), batchExecutor);
        CompletableFuture<List<RetentionCohort>> cohorts =
                CompletableFuture.supplyAsync(() -> metricsService.getRetentionCohorts(projectId), batchExecutor);
        CompletableFuture<AdoptionFunnel> funnel =
                CompletableFuture.supplyAsync(() -> metricsService.getAdoptionFunnel(projectId), batchExecutor);
        CompletableFuture<AlertReport> alerts = CompletableFuture
                .supplyAsync(() -> alertService.evaluateProjectAlerts(projectId), batchExecutor)
                .exceptionally(e -> {
                    log.warn("Dashboard for project {} built without alerts: {}", projectId, rootMessage(e));
                    return null;
                });

        try {
            List<ProductivityScore> latest = scores.join();
            ProjectDashboard dashboard = new ProjectDashboard(projectId, project.getName(),
                    toOverview(overview.join()),
                    summarize(latest),
                    cohorts.join(),
                    funnel.join(),
                    alerts.join(),
                    insights(projectId, latest),
                    Instant.now());
            log.debug("Assembled dashboard for project {}", projectId);
            return dashboard;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    static ProjectOverview toOverview(AggregatedMetrics m) {
        BigDecimal volumeZec = BigDecimal.valueOf(m.totalVolumeZatoshi()).movePointLeft(8);
        double avg = m.avgProductivity() == null ? 0 : m.avgProductivity();
        return new ProjectOverview(m.totalWallets(), m.activeWallets(), m.totalTransactions(), volumeZec, avg);
    }

    static ProductivitySummary summarize(List<ProductivityScore> scores) {
        int atRisk = (int) scores.stream().filter(s -> s.getStatus() == WalletHealthStatus.AT_RISK).count();
        int churn = (int) scores.stream().filter(s -> s.getStatus() == WalletHealthStatus.CHURN).count();
        return new ProductivitySummary(
                average(scores, ProductivityScore::getTotalScore),
                average(scores, ProductivityScore::getRetentionScore),
                average(scores, ProductivityScore::getAdoptionScore),
                average(scores, ProductivityScore::getActivityScore),
                average(scores, ProductivityScore::getDiversityScore),
                atRisk, churn);
    }

    private static DashboardInsights insights(String projectId, List<ProductivityScore> scores) {
        if (scores.isEmpty()) {
            return DashboardInsights.empty();
        }
        ProjectHealth health = RecommendationEngine.analyzeProjectHealth(scores);
        List<Recommendation> top = RecommendationEngine.projectRecommendations(projectId, health).stream()
                .limit(TOP_RECOMMENDATIONS)
                .toList();
        return new DashboardInsights(health, top);
    }

    public WalletHealthDashboard getWalletHealthDashboard(String projectId) {
        metricsService.getProject(projectId);
        return queryCache.cachedQuery("health:" + projectId, () -> {
            List<ProductivityScore> scores = metricsService.getLatestScores(projectId);
            Map<String, WalletHealthDashboard.Bucket> byStatus = buckets(scores, s -> s.getStatus().getValue());
            Map<String, WalletHealthDashboard.Bucket> byRisk = buckets(scores, s -> s.getRiskLevel().getValue());
            List<WalletHealthDashboard.WalletScoreRow> lowest = scores.stream()
                    .sorted(Comparator.comparingInt(ProductivityScore::getTotalScore)
                            .thenComparing(ProductivityScore::getWalletId))
                    .limit(LOWEST_WALLETS)
                    .map(s -> new WalletHealthDashboard.WalletScoreRow(s.getWalletId(), s.getTotalScore(),
                            s.getStatus(), s.getRiskLevel()))
                    .toList();
            return new WalletHealthDashboard(projectId, scores.size(), byStatus, byRisk, lowest, Instant.now());
        }, properties.getDashboardTtl());
    }

    /**
     * Daily series for the last {@code days} days, oldest first. Days with no data are omitted.
     *
     * @throws ValidationException for an unknown metric or days outside 1..365
     */
    public List<TimeSeriesPoint> getTimeSeriesData(String projectId, String metric, int days) {
        TimeSeriesMetric m = TimeSeriesMetric.fromValue(metric);
        if (days < 1 || days > MAX_TIME_SERIES_DAYS) {
            throw new ValidationException("days must be between 1 and " + MAX_TIME_SERIES_DAYS);
        }
        metricsService.getProject(projectId);
        String key = "timeseries:" + projectId + ":" + m.getValue() + ":" + days;
        return queryCache.cachedQuery(key, () -> computeSeries(projectId, m, days), properties.getDashboardTtl());
    }

    private List<TimeSeriesPoint> computeSeries(String projectId, TimeSeriesMetric metric, int days) {
        LocalDate from = LocalDate.now(ZoneOffset.UTC).minusDays(days);
        return switch (metric) {
            case ACTIVE_WALLETS -> {
                Map<LocalDate, Set<String>> active = new TreeMap<>();
                for (WalletMetricSample s : sampleRepository.findByProjectIdAndDateGreaterThanEqual(projectId, from)) {
                    if (s.isActive() || s.getTransactionCount() > 0) {
                        active.computeIfAbsent(s.getDate(), d -> new HashSet<>()).add(s.getWalletId());
                    }
                }
                yield active.entrySet().stream()
                        .map(e -> new TimeSeriesPoint(e.getKey(), e.getValue().size()))
                        .toList();
            }
            case TRANSACTIONS -> sampleRepository.findByProjectIdAndDateGreaterThanEqual(projectId, from).stream()
                    .collect(Collectors.groupingBy(WalletMetricSample::getDate, TreeMap::new,
                            Collectors.summingLong(WalletMetricSample::getTransactionCount)))
                    .entrySet().stream()
                    .map(e -> new TimeSeriesPoint(e.getKey(), e.getValue()))
                    .toList();
            case PRODUCTIVITY -> scoreRepository.findByProjectIdAndCalculatedAtGreaterThanEqual(projectId,
                            from.atStartOfDay().toInstant(ZoneOffset.UTC)).stream()
                    .collect(Collectors.groupingBy(s -> LocalDate.ofInstant(s.getCalculatedAt(), ZoneOffset.UTC),
                            TreeMap::new, Collectors.averagingInt(ProductivityScore::getTotalScore)))
                    .entrySet().stream()
                    .map(e -> new TimeSeriesPoint(e.getKey(), Numbers.round2(e.getValue())))
                    .toList();
        };
    }

    public AnalyticsReport exportAnalyticsReport(String projectId, String format) {
        ExportFormat f = ExportFormat.fromValue(format);
        ProjectDashboard dashboard = getProjectDashboard(projectId);
        Object data = f == ExportFormat.CSV ? ReportExporter.toCsv(dashboard) : dashboard;
        return new AnalyticsReport(f, data, Instant.now());
    }

    /**
     * Drops the cached dashboard views of one project, or of every project when {@code projectId} is null.
     * Also drops that project's memoized aggregate reads.
     */
    public void clearDashboardCache(String projectId) {
        if (projectId == null) {
            VIEW_PREFIXES.forEach(queryCache::invalidatePrefix);
            log.info("Cleared dashboard cache for all projects");
            return;
        }
        queryCache.invalidate("dashboard:" + projectId);
        queryCache.invalidate("health:" + projectId);
        queryCache.invalidatePrefix("timeseries:" + projectId + ":");
        projectQueryService.evictProject(projectId);
        log.info("Cleared dashboard cache for project {}", projectId);
    }

    public DashboardCacheStats getCacheStats() {
        return new DashboardCacheStats(queryCache.stats(), properties.getDashboardTtl().toSeconds());
    }

    private static double average(List<ProductivityScore> scores, ToIntFunction<ProductivityScore> f) {
        return Numbers.round2(scores.stream().mapToInt(f).average().orElse(0));
    }

    private static Map<String, WalletHealthDashboard.Bucket> buckets(List<ProductivityScore> scores,
                                                                     Function<ProductivityScore, String> key) {
        Map<String, List<ProductivityScore>> grouped = scores.stream()
                .filter(s -> s.getStatus() != null && s.getRiskLevel() != null)
                .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.toList()));
        Map<String, WalletHealthDashboard.Bucket> out = new LinkedHashMap<>();
        grouped.forEach((k, list) -> out.put(k,
                new WalletHealthDashboard.Bucket(list.size(), average(list, ProductivityScore::getTotalScore))));
        return out;
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return t.getMessage();
    }
}
