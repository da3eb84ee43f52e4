package com.zecinsight.task.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "zecinsight.tasks")
@Getter
@Setter
public class TaskMonitoringProperties {

    /** Enables the periodic sweep over pending tasks. */
    private boolean monitoringEnabled = true;

    /** Delay between sweeps. Read by the scheduled job through its placeholder. */
    private long monitoringIntervalMs = 86_400_000L;
}
