package com.zecinsight.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;

/**
 * Stores one benchmark snapshot. as_of_date defaults to today.
 */
public record StoreBenchmarkRequest(
        @NotBlank(message = "benchmark_type is required")
        String benchmarkType,

        @NotBlank(message = "category is required")
        String category,

        @NotNull Double p25,
        @NotNull Double p50,
        @NotNull Double p75,
        @NotNull Double p90,

        @PositiveOrZero(message = "sample_size must not be negative")
        int sampleSize,

        LocalDate asOfDate
) {
}
