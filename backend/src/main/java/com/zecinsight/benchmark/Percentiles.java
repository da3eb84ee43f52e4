package com.zecinsight.benchmark;

/**
 * p25/p50/p75/p90 of a sample. Always non-decreasing.
 */
public record Percentiles(double p25, double p50, double p75, double p90) {

    public static final Percentiles ZERO = new Percentiles(0, 0, 0, 0);
}
