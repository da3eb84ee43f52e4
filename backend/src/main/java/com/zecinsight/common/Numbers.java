package com.zecinsight.common;

/**
 * Rounding and ratio helpers shared by the scoring engines.
 */
public final class Numbers {

    private Numbers() {
    }

    /** Half-up rounding to two decimals (matches Math.round(x * 100) / 100). */
    public static double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return Math.round(value * 100.0) / 100.0;
    }

    /** part / total * 100, or 0 when total is 0. */
    public static double percentage(double part, double total) {
        return total == 0 ? 0 : part / total * 100.0;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
