package com.zecinsight.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Alert thresholds grouped by category. Percentages are 0..100, multipliers are ratios against the
 * rolling daily average, volume is zatoshi. Field defaults are the platform defaults.
 */
@NoArgsConstructor
@Getter
@Setter
public class AlertThresholds {

    private Retention retention = new Retention();
    private Churn churn = new Churn();
    private Funnel funnel = new Funnel();
    private Shielded shielded = new Shielded();

    /** Deep copy, so per-project overrides never mutate shared defaults. */
    public AlertThresholds copy() {
        AlertThresholds c = new AlertThresholds();
        c.retention.setDropPercentage(retention.getDropPercentage());
        c.retention.setCriticalLevel(retention.getCriticalLevel());
        c.retention.setWarningLevel(retention.getWarningLevel());
        c.churn.setCriticalRate(churn.getCriticalRate());
        c.churn.setHighRiskPercentage(churn.getHighRiskPercentage());
        c.funnel.setStageDropThreshold(funnel.getStageDropThreshold());
        c.funnel.setCriticalStageDrop(funnel.getCriticalStageDrop());
        c.funnel.setCriticalConversion(funnel.getCriticalConversion());
        c.shielded.setSpikeMultiplier(shielded.getSpikeMultiplier());
        c.shielded.setDropMultiplier(shielded.getDropMultiplier());
        c.shielded.setVolumeThreshold(shielded.getVolumeThreshold());
        return c;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retention {
        private double dropPercentage = 15;
        private double criticalLevel = 40;
        private double warningLevel = 55;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Churn {
        private double criticalRate = 40;
        private double highRiskPercentage = 30;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Funnel {
        private double stageDropThreshold = 40;
        private double criticalStageDrop = 70;
        private double criticalConversion = 30;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Shielded {
        private double spikeMultiplier = 2.5;
        private double dropMultiplier = 0.4;
        private long volumeThreshold = 1_000_000L;
    }
}
