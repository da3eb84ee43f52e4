package com.zecinsight.task.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TaskMonitoringProperties.class)
public class TaskConfig {
}
