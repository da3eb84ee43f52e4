package com.zecinsight.benchmark;

import com.zecinsight.analytics.ProjectMetrics;
import com.zecinsight.analytics.ProjectMetricsService;
import com.zecinsight.common.ValidationException;
import com.zecinsight.config.CaffeineConfig;
import com.zecinsight.domain.Benchmark;
import com.zecinsight.domain.BenchmarkRepository;
import com.zecinsight.domain.MetricType;
import com.zecinsight.domain.Project;
import com.zecinsight.domain.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stores and reads the benchmark time series. Writes for an existing (type, category, date) replace that
 * day's snapshot; earlier dates are never touched. Every write path evicts the benchmark cache itself,
 * since internal calls bypass the proxy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BenchmarkService {

    static final int DEFAULT_HISTORY_LIMIT = 30;
    static final int DEFAULT_RETENTION_DAYS = 365;

    private final BenchmarkRepository benchmarkRepository;
    private final ProjectRepository projectRepository;
    private final ProjectMetricsService projectMetricsService;

    @CacheEvict(cacheNames = CaffeineConfig.BENCHMARK_CACHE, allEntries = true)
    public Benchmark storeBenchmark(String type, String category, Percentiles percentiles, int sampleSize, LocalDate asOfDate) {
        if (type == null || type.isBlank() || category == null || category.isBlank()) {
            throw new ValidationException("benchmark_type and category are required");
        }
        if (percentiles == null) {
            throw new ValidationException("percentiles are required");
        }
        if (!(percentiles.p25() <= percentiles.p50() && percentiles.p50() <= percentiles.p75()
                && percentiles.p75() <= percentiles.p90())) {
            throw new ValidationException("Percentiles must be non-decreasing (p25 <= p50 <= p75 <= p90)");
        }
        if (sampleSize < 0) {
            throw new ValidationException("sample_size must not be negative");
        }
        LocalDate date = asOfDate == null ? LocalDate.now(ZoneOffset.UTC) : asOfDate;
        Benchmark b = benchmarkRepository.findByBenchmarkTypeAndCategoryAndAsOfDate(type, category, date)
                .orElseGet(Benchmark::new);
        b.setBenchmarkType(type);
        b.setCategory(category);
        b.setAsOfDate(date);
        b.setP25(percentiles.p25());
        b.setP50(percentiles.p50());
        b.setP75(percentiles.p75());
        b.setP90(percentiles.p90());
        b.setSampleSize(sampleSize);
        b.setCreatedAt(Instant.now());
        Benchmark saved = benchmarkRepository.save(b);
        log.info("Stored benchmark {}/{} as of {} (n={})", type, category, date, sampleSize);
        return saved;
    }

    /**
     * Computes percentiles over {@code values} and stores them for today. Empty input stores nothing.
     */
    @CacheEvict(cacheNames = CaffeineConfig.BENCHMARK_CACHE, allEntries = true)
    public Optional<Benchmark> calculateAndStoreBenchmark(String type, String category, List<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            log.warn("No values provided for {}/{} benchmark", type, category);
            return Optional.empty();
        }
        Percentiles percentiles = BenchmarkCalculator.calculatePercentiles(values);
        return Optional.of(storeBenchmark(type, category, percentiles, values.size(), LocalDate.now(ZoneOffset.UTC)));
    }

    @Cacheable(cacheNames = CaffeineConfig.BENCHMARK_CACHE, key = "'latest:' + #type + ':' + #category", unless = "#result == null")
    public Optional<Benchmark> getLatestBenchmark(String type, String category) {
        return benchmarkRepository.findFirstByBenchmarkTypeAndCategoryOrderByAsOfDateDesc(type, category);
    }

    /** Latest snapshot as of a past date, used for position tracking. */
    public Optional<Benchmark> getBenchmarkAsOf(String type, String category, LocalDate asOf) {
        return benchmarkRepository.findFirstByBenchmarkTypeAndCategoryAndAsOfDateLessThanEqualOrderByAsOfDateDesc(
                type, category, asOf);
    }

    /**
     * Latest benchmark per type for the category.
     */
    @Cacheable(cacheNames = CaffeineConfig.BENCHMARK_CACHE, key = "'category:' + #category")
    public List<Benchmark> getBenchmarksByCategory(String category) {
        Map<String, Benchmark> latestByType = new LinkedHashMap<>();
        for (Benchmark b : benchmarkRepository.findByCategoryOrderByAsOfDateDesc(category)) {
            latestByType.putIfAbsent(b.getBenchmarkType(), b);
        }
        return new ArrayList<>(latestByType.values());
    }

    public List<Benchmark> getBenchmarkHistory(String type, String category, Integer limit) {
        int n = limit == null || limit <= 0 ? DEFAULT_HISTORY_LIMIT : limit;
        return benchmarkRepository.findByBenchmarkTypeAndCategoryOrderByAsOfDateDesc(type, category, PageRequest.of(0, n));
    }

    public List<String> getBenchmarkCategories() {
        return benchmarkRepository.findDistinctCategories().stream().sorted().toList();
    }

    public List<BenchmarkStatistics> getBenchmarkStatistics() {
        Map<String, List<Benchmark>> grouped = benchmarkRepository.findAll().stream()
                .collect(Collectors.groupingBy(b -> b.getBenchmarkType() + "\u0000" + b.getCategory()));
        return grouped.values().stream()
                .map(list -> new BenchmarkStatistics(
                        list.get(0).getBenchmarkType(),
                        list.get(0).getCategory(),
                        list.size(),
                        list.stream().map(Benchmark::getAsOfDate).min(LocalDate::compareTo).orElse(null),
                        list.stream().map(Benchmark::getAsOfDate).max(LocalDate::compareTo).orElse(null),
                        list.stream().mapToInt(Benchmark::getSampleSize).average().orElse(0)))
                .sorted(Comparator.comparing(BenchmarkStatistics::benchmarkType)
                        .thenComparing(BenchmarkStatistics::category))
                .toList();
    }

    @CacheEvict(cacheNames = CaffeineConfig.BENCHMARK_CACHE, allEntries = true)
    public long cleanupOldBenchmarks(int daysToKeep) {
        LocalDate cutoff = LocalDate.now(ZoneOffset.UTC).minusDays(daysToKeep);
        long deleted = benchmarkRepository.deleteByAsOfDateBefore(cutoff);
        log.info("Deleted {} benchmark record(s) older than {}", deleted, cutoff);
        return deleted;
    }

    @CacheEvict(cacheNames = CaffeineConfig.BENCHMARK_CACHE, allEntries = true)
    @Scheduled(cron = "${zecinsight.benchmarks.cleanup-cron:0 30 3 * * *}")
    public void scheduledCleanup() {
        cleanupOldBenchmarks(DEFAULT_RETENTION_DAYS);
    }

    /**
     * Recomputes every comparison metric's percentiles over all projects of the category and stores them
     * for today. Metrics with no projects are skipped.
     */
    @CacheEvict(cacheNames = CaffeineConfig.BENCHMARK_CACHE, allEntries = true)
    public List<Benchmark> recalculateCategoryBenchmarks(String category) {
        List<Project> projects = projectRepository.findByCategory(category);
        List<ProjectMetrics> metrics = new ArrayList<>();
        for (Project p : projects) {
            metrics.add(projectMetricsService.getProjectMetrics(p.getId()));
        }
        List<Benchmark> stored = new ArrayList<>();
        for (MetricType metric : MetricType.values()) {
            List<Double> values = metrics.stream().map(m -> m.value(metric)).toList();
            calculateAndStoreBenchmark(metric.getValue(), category, values).ifPresent(stored::add);
        }
        log.info("Recalculated {} benchmark(s) for category {} over {} project(s)", stored.size(), category, projects.size());
        return stored;
    }
}
