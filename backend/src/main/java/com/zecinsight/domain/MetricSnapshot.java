package com.zecinsight.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Wallet metrics captured at a point in time; embedded in tasks as the baseline.
 * Null fields were unavailable when captured.
 */
@NoArgsConstructor
@Getter
@Setter
public class MetricSnapshot {

    private Integer productivityScore;
    private Integer retentionScore;
    private Integer adoptionScore;
    private Integer activityScore;
    private Integer diversityScore;
    private Integer churnScore;
    private Integer activeDays;
    private Integer totalTransactions;
    private LocalDate lastActivityDate;
    private Double healthPercentage;
    private Instant capturedAt;
}
