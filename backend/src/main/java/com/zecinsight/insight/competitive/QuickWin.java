package com.zecinsight.insight.competitive;

import com.zecinsight.domain.MetricType;

import java.util.List;

public record QuickWin(
        MetricType metric,
        double current,
        Double target,
        double gap,
        String effort,
        String impact,
        List<String> actions
) {
}
