package com.zecinsight.shielded;

/**
 * Pearson coefficient rounded to 3 decimals. strength is insufficient_data below 3 samples.
 */
public record Correlation(double coefficient, String strength, int sampleSize) {
}
