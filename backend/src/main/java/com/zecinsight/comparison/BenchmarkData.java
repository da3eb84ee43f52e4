package com.zecinsight.comparison;

import com.zecinsight.domain.Benchmark;

import java.time.LocalDate;

public record BenchmarkData(double p25, double p50, double p75, double p90, int sampleSize, LocalDate asOfDate) {

    static BenchmarkData of(Benchmark b) {
        return new BenchmarkData(b.getP25(), b.getP50(), b.getP75(), b.getP90(), b.getSampleSize(), b.getAsOfDate());
    }
}
