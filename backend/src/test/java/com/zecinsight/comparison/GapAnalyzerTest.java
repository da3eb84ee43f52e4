package com.zecinsight.comparison;

import com.zecinsight.analytics.ProjectMetrics;
import com.zecinsight.benchmark.GapStatus;
import com.zecinsight.benchmark.PercentileRange;
import com.zecinsight.benchmark.TargetPercentile;
import com.zecinsight.comparison.config.ComparisonProperties;
import com.zecinsight.domain.Benchmark;
import com.zecinsight.domain.MetricType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GapAnalyzerTest {

    private final GapAnalyzer analyzer = new GapAnalyzer(new ComparisonProperties());

    private static Benchmark benchmark(String type, double p25, double p50, double p75, double p90) {
        Benchmark b = new Benchmark();
        b.setBenchmarkType(type);
        b.setCategory("defi");
        b.setP25(p25);
        b.setP50(p50);
        b.setP75(p75);
        b.setP90(p90);
        b.setSampleSize(20);
        return b;
    }

    private static ProjectMetrics metrics(double productivity, double retention, double adoption, double churn) {
        return new ProjectMetrics("p1", "Shielded Swap", "defi", productivity, retention, adoption, churn, Instant.now());
    }

    @Test
    @DisplayName("severity is medium above 20% and high above 30%")
    void severityFor_thresholds() {
        assertThat(analyzer.severityFor(-21.43)).isEqualTo(GapSeverity.MEDIUM);
        assertThat(analyzer.severityFor(-56.92)).isEqualTo(GapSeverity.HIGH);
        assertThat(analyzer.severityFor(-20.0)).isEqualTo(GapSeverity.LOW);
        assertThat(analyzer.severityFor(-30.0)).isEqualTo(GapSeverity.MEDIUM);
    }

    @Test
    @DisplayName("metrics without a benchmark are reported as no_benchmark with unknown range")
    void compare_missingBenchmark_noBenchmark() {
        List<MetricComparison> result = analyzer.compare(metrics(55, 40, 30, 10),
                Map.of("productivity", benchmark("productivity", 40, 70, 80, 90)), TargetPercentile.P50);

        assertThat(result).hasSize(4);
        assertThat(result.get(0).metric()).isEqualTo(MetricType.PRODUCTIVITY);
        assertThat(result.get(0).gapPercentage()).isEqualTo(-21.43);
        assertThat(result.get(0).percentileRange()).isEqualTo(PercentileRange.P25_50);
        assertThat(result.get(1).status()).isEqualTo(GapStatus.NO_BENCHMARK);
        assertThat(result.get(1).percentileRange()).isEqualTo(PercentileRange.UNKNOWN);
        assertThat(result.get(1).benchmarkData()).isNull();
    }

    @Test
    @DisplayName("gaps inside the 10% band count as at target, beyond it as under or over")
    void identifyPerformanceGaps_buckets() {
        List<MetricComparison> comparisons = analyzer.compare(metrics(55, 28, 66, 10), Map.of(
                "productivity", benchmark("productivity", 40, 70, 80, 90),
                "retention", benchmark("retention", 20, 65, 70, 80),
                "adoption", benchmark("adoption", 30, 60, 70, 80),
                "churn", benchmark("churn", 5, 10, 20, 30)), TargetPercentile.P50);

        PerformanceGaps gaps = analyzer.identifyPerformanceGaps(comparisons);

        assertThat(gaps.underperforming()).extracting(MetricGap::metric)
                .containsExactly(MetricType.PRODUCTIVITY, MetricType.RETENTION);
        assertThat(gaps.underperforming().get(0).severity()).isEqualTo(GapSeverity.MEDIUM);
        assertThat(gaps.underperforming().get(1).gapPercentage()).isEqualTo(-56.92);
        assertThat(gaps.underperforming().get(1).severity()).isEqualTo(GapSeverity.HIGH);
        assertThat(gaps.outperforming()).isEmpty();
        assertThat(gaps.atTarget()).extracting(MetricGap::metric)
                .containsExactly(MetricType.ADOPTION, MetricType.CHURN);
    }

    @Test
    @DisplayName("overall position averages range scores of benchmarked metrics only")
    void calculateOverallPosition_averagesScores() {
        List<MetricComparison> comparisons = analyzer.compare(metrics(95, 85, 10, 50), Map.of(
                "productivity", benchmark("productivity", 40, 70, 80, 90),
                "retention", benchmark("retention", 20, 65, 70, 80)), TargetPercentile.P50);

        OverallPosition position = analyzer.calculateOverallPosition(comparisons);

        assertThat(position.score()).isEqualTo(5.0);
        assertThat(position.metricsCompared()).isEqualTo(2);
        assertThat(position.position()).isEqualTo(MarketPosition.TOP_PERFORMER);
    }

    @Test
    @DisplayName("no benchmarks at all yields unknown position")
    void calculateOverallPosition_noBenchmarks_unknown() {
        OverallPosition position = analyzer.calculateOverallPosition(
                analyzer.compare(metrics(1, 2, 3, 4), Map.of(), TargetPercentile.P50));
        assertThat(position).isEqualTo(OverallPosition.unknown());
    }

    @Test
    @DisplayName("position thresholds at 4.5, 3.5 and 2.5")
    void positionFor_thresholds() {
        assertThat(analyzer.positionFor(4.5)).isEqualTo(MarketPosition.TOP_PERFORMER);
        assertThat(analyzer.positionFor(3.5)).isEqualTo(MarketPosition.ABOVE_AVERAGE);
        assertThat(analyzer.positionFor(2.5)).isEqualTo(MarketPosition.AVERAGE);
        assertThat(analyzer.positionFor(2.49)).isEqualTo(MarketPosition.BELOW_AVERAGE);
    }

    @Test
    @DisplayName("recommendations are sorted by priority with a single strengths entry")
    void generateComparisonRecommendations_sortedByPriority() {
        PerformanceGaps gaps = new PerformanceGaps(
                List.of(new MetricGap(MetricType.ADOPTION, 40, 50.0, -10.0, -20.0, GapSeverity.LOW),
                        new MetricGap(MetricType.RETENTION, 28, 65.0, -37.0, -56.92, GapSeverity.HIGH)),
                List.of(new MetricGap(MetricType.PRODUCTIVITY, 90, 70.0, 20.0, 28.57, null)),
                List.of());

        List<ComparisonRecommendation> recs = analyzer.generateComparisonRecommendations(gaps);

        assertThat(recs).extracting(ComparisonRecommendation::priority).containsExactly(10, 5, 3);
        assertThat(recs.get(0).metric()).isEqualTo("retention");
        assertThat(recs.get(0).description()).contains("56.92% below");
        assertThat(recs.get(2).type()).isEqualTo("strength");
        assertThat(recs.get(2).description()).endsWith("productivity");
    }
}
