package com.zecinsight.comparison;

import java.util.List;

public record PerformanceGaps(List<MetricGap> underperforming, List<MetricGap> outperforming, List<MetricGap> atTarget) {

    public static PerformanceGaps empty() {
        return new PerformanceGaps(List.of(), List.of(), List.of());
    }
}
