package com.zecinsight.task;

import com.zecinsight.domain.EffectivenessLevel;

import java.util.List;

/**
 * Score is the non-negative improvement of the metric the recommendation type targets, capped at 100.
 */
public record Effectiveness(double score, EffectivenessLevel level, List<Improvement> improvements, String summary) {
}
