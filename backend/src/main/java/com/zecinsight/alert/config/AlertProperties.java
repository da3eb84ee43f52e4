package com.zecinsight.alert.config;

import com.zecinsight.domain.AlertThresholds;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Platform default alert thresholds, overridable per project through stored configuration.
 */
@ConfigurationProperties(prefix = "zecinsight.alerts")
@Getter
@Setter
public class AlertProperties {

    private AlertThresholds.Retention retention = new AlertThresholds.Retention();
    private AlertThresholds.Churn churn = new AlertThresholds.Churn();
    private AlertThresholds.Funnel funnel = new AlertThresholds.Funnel();
    private AlertThresholds.Shielded shielded = new AlertThresholds.Shielded();

    /** Days of daily shielded activity the shielded rules average over. */
    private int shieldedWindowDays = 30;

    /** Fresh copy of the defaults; callers may mutate it. */
    public AlertThresholds toThresholds() {
        AlertThresholds t = new AlertThresholds();
        t.setRetention(retention);
        t.setChurn(churn);
        t.setFunnel(funnel);
        t.setShielded(shielded);
        return t.copy();
    }
}
