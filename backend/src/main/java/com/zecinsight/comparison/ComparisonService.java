package com.zecinsight.comparison;

import com.zecinsight.analytics.ProjectMetrics;
import com.zecinsight.analytics.ProjectMetricsService;
import com.zecinsight.benchmark.BenchmarkService;
import com.zecinsight.benchmark.GapStatus;
import com.zecinsight.benchmark.PercentileRange;
import com.zecinsight.benchmark.TargetPercentile;
import com.zecinsight.common.Numbers;
import com.zecinsight.common.ValidationException;
import com.zecinsight.domain.Benchmark;
import com.zecinsight.domain.MetricType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads project metrics and category benchmarks and runs them through {@link GapAnalyzer}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComparisonService {

    /** Gap percentage points within which a metric counts as stable. */
    static final double STABLE_BAND = 1.0;
    /** Position score (1..5 scale) delta within which the trend counts as stable. */
    static final double POSITION_STABLE_BAND = 0.25;

    private final ProjectMetricsService projectMetricsService;
    private final BenchmarkService benchmarkService;
    private final GapAnalyzer gapAnalyzer;

    public ProjectComparison compareProjectToBenchmarks(String projectId, TargetPercentile target) {
        TargetPercentile t = target == null ? TargetPercentile.P50 : target;
        ProjectMetrics metrics = projectMetricsService.getProjectMetrics(projectId);
        Map<String, Benchmark> benchmarks = benchmarkService.getBenchmarksByCategory(metrics.category()).stream()
                .collect(Collectors.toMap(Benchmark::getBenchmarkType, Function.identity(), (a, b) -> a));
        if (benchmarks.isEmpty()) {
            log.warn("No benchmarks for category {} (project {})", metrics.category(), projectId);
            return new ProjectComparison(projectId, metrics.projectName(), metrics.category(),
                    ProjectComparison.STATUS_NO_BENCHMARKS,
                    "No benchmarks available for category: " + metrics.category(),
                    t, null, null, null, null, metrics, Instant.now());
        }
        return buildComparison(metrics, benchmarks, t);
    }

    public MultiProjectComparison compareMultipleProjects(List<String> projectIds, TargetPercentile target) {
        if (projectIds == null || projectIds.isEmpty()) {
            throw new ValidationException("project_ids must not be empty");
        }
        TargetPercentile t = target == null ? TargetPercentile.P50 : target;
        List<ProjectComparison> comparisons = projectIds.stream()
                .map(id -> compareProjectToBenchmarks(id, t))
                .toList();

        List<MultiProjectComparison.ProjectEntry> projects = comparisons.stream()
                .map(c -> new MultiProjectComparison.ProjectEntry(c.projectId(), c.projectName(), c.category(),
                        c.overallPosition() == null ? OverallPosition.unknown() : c.overallPosition()))
                .toList();
        Map<String, List<MultiProjectComparison.Cell>> matrix = new LinkedHashMap<>();
        Map<String, String> leaders = new LinkedHashMap<>();
        for (MetricType metric : MetricType.values()) {
            List<MultiProjectComparison.Cell> cells = comparisons.stream().map(c -> cellFor(c, metric)).toList();
            matrix.put(metric.getValue(), cells);
            Comparator<MultiProjectComparison.Cell> byValue = Comparator.comparingDouble(MultiProjectComparison.Cell::value);
            Optional<MultiProjectComparison.Cell> leader = metric.isLowerIsBetter()
                    ? cells.stream().min(byValue)
                    : cells.stream().max(byValue);
            leaders.put(metric.getValue(), leader.map(MultiProjectComparison.Cell::projectId).orElse(null));
        }
        return new MultiProjectComparison(projects, matrix, leaders, t, Instant.now());
    }

    /**
     * Compares today's position with the one obtained from benchmarks in force {@code daysBack} days ago,
     * holding the project's current metrics fixed.
     */
    public PositionChange trackMarketPositionChanges(String projectId, int daysBack) {
        if (daysBack <= 0) {
            throw new ValidationException("days_back must be positive");
        }
        ProjectMetrics metrics = projectMetricsService.getProjectMetrics(projectId);
        LocalDate asOf = LocalDate.now(ZoneOffset.UTC).minusDays(daysBack);
        Map<String, Benchmark> current = new LinkedHashMap<>();
        Map<String, Benchmark> previous = new LinkedHashMap<>();
        for (MetricType metric : MetricType.values()) {
            benchmarkService.getLatestBenchmark(metric.getValue(), metrics.category())
                    .ifPresent(b -> current.put(metric.getValue(), b));
            benchmarkService.getBenchmarkAsOf(metric.getValue(), metrics.category(), asOf)
                    .ifPresent(b -> previous.put(metric.getValue(), b));
        }
        List<MetricComparison> now = gapAnalyzer.compare(metrics, current, TargetPercentile.P50);
        List<MetricComparison> then = gapAnalyzer.compare(metrics, previous, TargetPercentile.P50);
        OverallPosition currentPosition = gapAnalyzer.calculateOverallPosition(now);
        OverallPosition previousPosition = gapAnalyzer.calculateOverallPosition(then);

        Map<String, PositionChange.MetricChange> changes = new LinkedHashMap<>();
        for (int i = 0; i < now.size(); i++) {
            MetricComparison a = now.get(i);
            MetricComparison b = then.get(i);
            if (a.gapPercentage() == null || b.gapPercentage() == null) {
                changes.put(a.metric().getValue(), new PositionChange.MetricChange(null, "unknown"));
                continue;
            }
            double change = Numbers.round2(a.gapPercentage() - b.gapPercentage());
            double effective = a.metric().isLowerIsBetter() ? -change : change;
            changes.put(a.metric().getValue(), new PositionChange.MetricChange(change, direction(effective, STABLE_BAND)));
        }
        String trend = previousPosition.metricsCompared() == 0 || currentPosition.metricsCompared() == 0
                ? "unknown"
                : direction(currentPosition.score() - previousPosition.score(), POSITION_STABLE_BAND);
        return new PositionChange(projectId, currentPosition, previousPosition, trend, changes, daysBack);
    }

    private ProjectComparison buildComparison(ProjectMetrics metrics, Map<String, Benchmark> benchmarks,
                                              TargetPercentile target) {
        List<MetricComparison> comparisons = gapAnalyzer.compare(metrics, benchmarks, target);
        PerformanceGaps gaps = gapAnalyzer.identifyPerformanceGaps(comparisons);
        return new ProjectComparison(metrics.projectId(), metrics.projectName(), metrics.category(),
                ProjectComparison.STATUS_COMPARED, null, target, comparisons, gaps,
                gapAnalyzer.generateComparisonRecommendations(gaps),
                gapAnalyzer.calculateOverallPosition(comparisons), metrics, Instant.now());
    }

    private static MultiProjectComparison.Cell cellFor(ProjectComparison c, MetricType metric) {
        if (c.comparisons() == null) {
            return new MultiProjectComparison.Cell(c.projectId(), c.projectMetrics().value(metric), null,
                    GapStatus.NO_BENCHMARK, PercentileRange.UNKNOWN);
        }
        MetricComparison m = c.comparisons().stream().filter(x -> x.metric() == metric).findFirst().orElseThrow();
        return new MultiProjectComparison.Cell(c.projectId(), m.currentValue(), m.gap(), m.status(), m.percentileRange());
    }

    private static String direction(double delta, double band) {
        if (Math.abs(delta) < band) {
            return "stable";
        }
        return delta > 0 ? "improving" : "declining";
    }
}
