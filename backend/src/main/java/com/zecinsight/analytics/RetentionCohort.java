package com.zecinsight.analytics;

import java.time.LocalDate;

/**
 * Weekly cohort keyed by the Monday of the wallets' first active week. Week N retention is the share (0..100)
 * of cohort wallets active during week N after the cohort week; null while that week has not fully elapsed.
 */
public record RetentionCohort(
        LocalDate cohortWeek,
        int cohortSize,
        Double week1,
        Double week2,
        Double week3,
        Double week4
) {

    public Double week(int n) {
        return switch (n) {
            case 1 -> week1;
            case 2 -> week2;
            case 3 -> week3;
            case 4 -> week4;
            default -> throw new IllegalArgumentException("week must be 1..4");
        };
    }
}
