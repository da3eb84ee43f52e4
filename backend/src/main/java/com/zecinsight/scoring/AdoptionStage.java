package com.zecinsight.scoring;

import com.fasterxml.jackson.annotation.JsonValue;
import com.zecinsight.domain.WalletMetricSample;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Adoption funnel stages in funnel order, with the points each contributes to the adoption score.
 */
public enum AdoptionStage {
    CREATED("created", 10),
    FIRST_TX("first_tx", 20),
    FEATURE_USAGE("feature_usage", 30),
    RECURRING("recurring", 25),
    HIGH_VALUE("high_value", 15);

    static final long HIGH_VALUE_MIN_VOLUME_ZATOSHI = 1_000_000L;

    private final String value;
    private final int points;

    AdoptionStage(String value, int points) {
        this.value = value;
        this.points = points;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getPoints() {
        return points;
    }

    /**
     * Stages reached given the wallet's full sample history. CREATED is always reached.
     */
    public static Set<AdoptionStage> reachedStages(List<WalletMetricSample> samples) {
        Set<AdoptionStage> reached = EnumSet.of(CREATED);
        if (samples == null || samples.isEmpty()) {
            return reached;
        }
        long txCount = 0;
        long volume = 0;
        boolean shielded = false;
        boolean transparent = false;
        int activeDays = 0;
        LocalDate first = null;
        LocalDate last = null;
        for (WalletMetricSample s : samples) {
            txCount += s.getTransactionCount();
            volume += s.getVolumeZatoshi();
            shielded |= s.getShieldedTxCount() > 0;
            transparent |= s.getTransparentTxCount() > 0;
            if (isActiveDay(s)) {
                activeDays++;
                if (first == null || s.getDate().isBefore(first)) {
                    first = s.getDate();
                }
                if (last == null || s.getDate().isAfter(last)) {
                    last = s.getDate();
                }
            }
        }
        long spanDays = first == null ? 0 : ChronoUnit.DAYS.between(first, last);

        if (txCount >= 1) {
            reached.add(FIRST_TX);
        }
        if (txCount >= 3 && shielded && transparent) {
            reached.add(FEATURE_USAGE);
        }
        if (txCount >= 5 && activeDays >= 3 && spanDays >= 7) {
            reached.add(RECURRING);
        }
        if (txCount >= 10 && activeDays >= 7 && spanDays >= 30 && volume >= HIGH_VALUE_MIN_VOLUME_ZATOSHI) {
            reached.add(HIGH_VALUE);
        }
        return reached;
    }

    static boolean isActiveDay(WalletMetricSample s) {
        return s.isActive() || s.getTransactionCount() > 0;
    }
}
