package com.zecinsight.benchmark;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.zecinsight.common.ValidationException;
import com.zecinsight.domain.Benchmark;

import java.util.function.ToDoubleFunction;

/**
 * Percentile a project is measured against. Replaces free-form "p50"-style keys.
 */
public enum TargetPercentile {
    P25("p25", Benchmark::getP25),
    P50("p50", Benchmark::getP50),
    P75("p75", Benchmark::getP75),
    P90("p90", Benchmark::getP90);

    private final String value;
    private final ToDoubleFunction<Benchmark> accessor;

    TargetPercentile(String value, ToDoubleFunction<Benchmark> accessor) {
        this.value = value;
        this.accessor = accessor;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double of(Benchmark benchmark) {
        return accessor.applyAsDouble(benchmark);
    }

    /**
     * Parses p25/p50/p75/p90; null or blank means p50.
     *
     * @throws ValidationException for any other key
     */
    @JsonCreator
    public static TargetPercentile fromValue(String value) {
        if (value == null || value.isBlank()) {
            return P50;
        }
        for (TargetPercentile t : values()) {
            if (t.value.equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        throw new ValidationException("Invalid target percentile: " + value + ". Must be one of: p25, p50, p75, p90");
    }
}
