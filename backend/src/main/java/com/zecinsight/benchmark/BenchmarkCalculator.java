package com.zecinsight.benchmark;

import com.zecinsight.common.Numbers;
import com.zecinsight.domain.Benchmark;

import java.util.Collection;

/**
 * Percentile math. Stateless.
 */
public final class BenchmarkCalculator {

    private BenchmarkCalculator() {
    }

    /**
     * Linear-interpolation percentiles over a sorted copy: index = p/100 * (n-1). Empty input gives zeros.
     */
    public static Percentiles calculatePercentiles(Collection<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            return Percentiles.ZERO;
        }
        double[] sorted = values.stream().mapToDouble(Number::doubleValue).sorted().toArray();
        return new Percentiles(
                percentile(sorted, 25),
                percentile(sorted, 50),
                percentile(sorted, 75),
                percentile(sorted, 90));
    }

    static double percentile(double[] sorted, int p) {
        double index = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        // stays inside [sorted[lower], sorted[upper]] under rounding
        return Math.min(sorted[upper], sorted[lower] + (sorted[upper] - sorted[lower]) * weight);
    }

    public static PercentileRange getPercentileRange(double value, Benchmark benchmark) {
        if (benchmark == null) {
            return PercentileRange.UNKNOWN;
        }
        if (value < benchmark.getP25()) {
            return PercentileRange.BELOW_25;
        }
        if (value < benchmark.getP50()) {
            return PercentileRange.P25_50;
        }
        if (value < benchmark.getP75()) {
            return PercentileRange.P50_75;
        }
        if (value < benchmark.getP90()) {
            return PercentileRange.P75_90;
        }
        return PercentileRange.ABOVE_90;
    }

    /**
     * gap = value - target; percentage = gap / target * 100 rounded to 2 decimals (0 when target is 0).
     */
    public static PerformanceGap calculatePerformanceGap(double value, Benchmark benchmark, TargetPercentile target) {
        if (benchmark == null) {
            return PerformanceGap.noBenchmark(value);
        }
        TargetPercentile t = target == null ? TargetPercentile.P50 : target;
        double targetValue = t.of(benchmark);
        double gap = value - targetValue;
        double percentage = targetValue != 0 ? Numbers.round2(gap / targetValue * 100.0) : 0;
        GapStatus status = gap > 0 ? GapStatus.ABOVE_TARGET : gap < 0 ? GapStatus.BELOW_TARGET : GapStatus.EXACT;
        return new PerformanceGap(gap, percentage, status, targetValue, value);
    }
}
