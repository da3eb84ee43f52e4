package com.zecinsight.comparison.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Gap severity and market position thresholds. Gap values are absolute gap percentages.
 */
@ConfigurationProperties(prefix = "zecinsight.comparison")
@Getter
@Setter
public class ComparisonProperties {

    /** Gaps within this band (either side) count as at target. */
    private double atTargetBand = 10;

    /** |gap%| above this is high severity. */
    private double highSeverityGap = 30;

    /** |gap%| above this (and not high) is medium severity. */
    private double mediumSeverityGap = 20;

    private double topPerformerScore = 4.5;
    private double aboveAverageScore = 3.5;
    private double averageScore = 2.5;
}
